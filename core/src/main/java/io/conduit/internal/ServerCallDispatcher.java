/*
 * Copyright 2021 The gRPC Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.conduit.internal;

import io.conduit.Decompressor;
import io.conduit.HandlerRegistry;
import io.conduit.Metadata;
import io.conduit.ServerMethodDefinition;
import io.conduit.Status;
import io.perfmark.PerfMark;
import io.perfmark.Tag;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;
import static io.conduit.internal.GrpcUtil.CONTENT_TYPE_KEY;
import static io.conduit.internal.GrpcUtil.MESSAGE_ACCEPT_ENCODING_KEY;
import static io.conduit.internal.GrpcUtil.MESSAGE_ENCODING_KEY;
import static io.conduit.internal.GrpcUtil.PATH_KEY;
import static io.conduit.internal.GrpcUtil.TIMEOUT_KEY;

/**
 * Dispatches new server streams to the handler registered for their full method name.
 * 将服务端新建的流分发给按完整方法名注册的处理器
 */
@ThreadSafe
public final class ServerCallDispatcher {

    private static final Logger log = Logger.getLogger(ServerCallDispatcher.class.getName());

    private static final ServerStreamListener NOOP_LISTENER = new NoopListener();

    private final HandlerRegistry registry;
    private final HandlerRegistry fallbackRegistry;
    private final Executor executor;
    @Nullable
    private final ScheduledExecutorService deadlineExecutor;
    private final CompressionNegotiator compressionNegotiator;
    private final int maxInboundMessageSize;

    /**
     * @param registry              the primary method registry
     * @param fallbackRegistry      consulted when the primary registry has no such method
     * @param executor              runs the handlers and their listeners
     * @param deadlineExecutor      schedules the cancellation of calls carrying {@code grpc-timeout},
     *                              {@code null} to ignore client deadlines
     * @param compressionNegotiator chooses response compression and validates request encodings
     * @param maxInboundMessageSize the maximum request message size
     */
    public ServerCallDispatcher(HandlerRegistry registry,
                                HandlerRegistry fallbackRegistry,
                                Executor executor,
                                @Nullable ScheduledExecutorService deadlineExecutor,
                                CompressionNegotiator compressionNegotiator,
                                int maxInboundMessageSize) {
        this.registry = checkNotNull(registry, "registry");
        this.fallbackRegistry = checkNotNull(fallbackRegistry, "fallbackRegistry");
        this.executor = checkNotNull(executor, "executor");
        this.deadlineExecutor = deadlineExecutor;
        this.compressionNegotiator = checkNotNull(compressionNegotiator, "compressionNegotiator");
        this.maxInboundMessageSize = maxInboundMessageSize;
    }

    /**
     * 流创建事件，根据 :path 查找方法并开始调用
     *
     * @param stream  the new stream
     * @param headers the request headers, including {@code :path}
     */
    public void streamCreated(ServerStream stream, Metadata headers) {
        String path = headers.get(PATH_KEY);
        String methodName = path != null && path.startsWith("/") ? path.substring(1) : path;
        Tag tag = PerfMark.createTag(methodName, System.identityHashCode(stream));
        PerfMark.startTask("ServerCallDispatcher.streamCreated", tag);
        try {
            streamCreatedInternal(stream, methodName, headers);
        } finally {
            PerfMark.stopTask("ServerCallDispatcher.streamCreated", tag);
        }
    }

    private void streamCreatedInternal(ServerStream stream, @Nullable String methodName, Metadata headers) {
        String contentType = headers.get(CONTENT_TYPE_KEY);
        if (contentType != null && !GrpcUtil.isGrpcContentType(contentType)) {
            closeWithStatus(stream, Status.INTERNAL.withDescription("Unsupported content-type: " + contentType));
            return;
        }

        // 如果 header 中包含消息编码的 key，则根据 encode 类型查找相应的解压器
        String encoding = headers.get(MESSAGE_ENCODING_KEY);
        Status encodingStatus = compressionNegotiator
                .negotiate(CompressionNegotiator.parseAcceptEncoding(headers.get(MESSAGE_ACCEPT_ENCODING_KEY)))
                .checkIncoming(encoding);
        if (!encodingStatus.isOk()) {
            closeWithStatus(stream, encodingStatus);
            return;
        }
        Decompressor decompressor = null;
        if (encoding != null && !GrpcUtil.IDENTITY_ENCODING.equals(encoding)) {
            decompressor = compressionNegotiator.getDecompressorRegistry().lookupDecompressor(encoding);
        }

        // 根据方法名称获取方法定义，如果没有则从回退的方法注册器中查找
        ServerMethodDefinition<?, ?> method = null;
        if (methodName != null) {
            method = registry.lookupMethod(methodName, stream.getAuthority());
            if (method == null) {
                method = fallbackRegistry.lookupMethod(methodName, stream.getAuthority());
            }
        }
        if (method == null) {
            closeWithStatus(stream, Status.UNIMPLEMENTED.withDescription("Method not found: " + methodName));
            return;
        }
        startCall(stream, method, headers, decompressor);
    }

    private <ReqT, RespT> void startCall(final ServerStream stream,
                                         ServerMethodDefinition<ReqT, RespT> methodDef,
                                         Metadata headers,
                                         @Nullable Decompressor decompressor) {
        ServerCallImpl<ReqT, RespT> call = new ServerCallImpl<>(stream, methodDef.getMethodDescriptor(), headers,
                executor, compressionNegotiator, decompressor, maxInboundMessageSize);

        ServerStreamListener listener = call.newServerStreamListener();
        String timeout = headers.get(TIMEOUT_KEY);
        if (timeout != null && deadlineExecutor != null) {
            listener = withDeadline(stream, listener, timeout);
        }
        // Callbacks are queued behind startCall() in the call's serializing executor.
        stream.setListener(listener);
        call.startCall(methodDef.getServerCallHandler(), headers);
    }

    /**
     * 根据 grpc-timeout 调度超时取消，调用结束时取消调度
     */
    private ServerStreamListener withDeadline(final ServerStream stream,
                                              final ServerStreamListener delegate,
                                              String timeout) {
        long timeoutNanos;
        try {
            timeoutNanos = GrpcUtil.TimeoutMarshaller.parseAsciiString(timeout);
        } catch (IllegalArgumentException e) {
            log.log(Level.FINE, "Ignoring malformed grpc-timeout " + timeout, e);
            return delegate;
        }
        final ScheduledFuture<?> deadlineFuture = deadlineExecutor.schedule(new Runnable() {
            @Override
            public void run() {
                stream.cancel(Status.DEADLINE_EXCEEDED.withDescription("server deadline exceeded"));
            }
        }, timeoutNanos, TimeUnit.NANOSECONDS);

        return new ServerStreamListener() {
            @Override
            public void dataRead(byte[] data) {
                delegate.dataRead(data);
            }

            @Override
            public void halfClosed() {
                delegate.halfClosed();
            }

            @Override
            public void closed(Status status) {
                deadlineFuture.cancel(false);
                delegate.closed(status);
            }
        };
    }

    private static void closeWithStatus(ServerStream stream, Status status) {
        log.log(Level.FINE, "Rejecting stream: {0}", status);
        stream.setListener(NOOP_LISTENER);
        stream.close(GrpcUtil.statusToTrailers(status, new Metadata()));
    }

    private static final class NoopListener implements ServerStreamListener {
        @Override
        public void dataRead(byte[] data) {
        }

        @Override
        public void halfClosed() {
        }

        @Override
        public void closed(Status status) {
        }
    }
}
