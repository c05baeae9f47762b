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

import com.google.common.base.MoreObjects;
import io.conduit.CallOptions;
import io.conduit.ClientCall;
import io.conduit.Codec;
import io.conduit.Compressor;
import io.conduit.Deadline;
import io.conduit.Decompressor;
import io.conduit.Metadata;
import io.conduit.MethodDescriptor;
import io.conduit.Status;
import io.conduit.StatusException;
import io.perfmark.PerfMark;
import io.perfmark.Tag;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import java.io.InputStream;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static io.conduit.internal.GrpcUtil.AUTHORITY_KEY;
import static io.conduit.internal.GrpcUtil.CONTENT_TYPE_KEY;
import static io.conduit.internal.GrpcUtil.MESSAGE_ACCEPT_ENCODING_KEY;
import static io.conduit.internal.GrpcUtil.MESSAGE_ENCODING_KEY;
import static io.conduit.internal.GrpcUtil.PATH_KEY;
import static io.conduit.internal.GrpcUtil.TIMEOUT_KEY;
import static java.lang.Math.max;

/**
 * ClientCall 的实现，负责一次调用的状态机：发送 header、分帧发送请求、解帧接收响应，并保证只关闭一次
 * Implementation of {@link ClientCall}.
 *
 * <p>Listener callbacks run in a serialized executor, in the order headers, messages, close.
 * Cancellation, deadline expiry and local failures all race to set the terminal status; the first
 * one wins and every later message is dropped.
 * 监听器的回调按照 header、消息、关闭的顺序串行执行，取消、超时和本地错误竞争设置终止状态，第一个生效，之后的消息都会被丢弃
 */
public final class ClientCallImpl<ReqT, RespT> extends ClientCall<ReqT, RespT> {

    private static final Logger log = Logger.getLogger(ClientCallImpl.class.getName());

    /**
     * Provides transports for the call, picking the connection when more than one is available.
     * 为调用提供 Transport，有多个连接时负责选择
     */
    public interface ClientTransportProvider {
        /**
         * Returns a transport for a new call.
         * 返回用于新调用的 Transport
         *
         * @param headers the prepared request headers, including {@code :path} and {@code :authority}
         * @throws StatusException when no transport can carry the call, e.g. no route or no healthy
         *                         endpoint
         */
        ClientTransport get(MethodDescriptor<?, ?> method, CallOptions callOptions, Metadata headers)
                throws StatusException;
    }

    private final MethodDescriptor<ReqT, RespT> method;
    private final Tag tag;
    private final Executor callExecutor;
    private final SerializingExecutor deframerExecutor = new SerializingExecutor(directExecutor());
    // 是否是 unary 的请求
    private final boolean unaryRequest;
    private final CallOptions callOptions;
    private final String authority;
    private final ClientTransportProvider clientTransportProvider;
    private final ScheduledExecutorService deadlineCancellationExecutor;
    private final CompressionNegotiator compressionNegotiator;
    private final int defaultMaxInboundMessageSize;

    private final Object lock = new Object();

    private volatile ClientStream stream;
    private volatile ClientTransport transport;
    private volatile boolean cancelCalled;
    private volatile boolean cancelListenersShouldBeRemoved;
    private boolean halfCloseCalled;
    private Listener<RespT> observer;
    private MessageFramer framer;
    private MessageDeframer deframer;
    private volatile ScheduledFuture<?> deadlineCancellationFuture;

    @GuardedBy("lock")
    private Status exceptionStatus;

    // 以下字段只在 callExecutor 中访问
    private boolean observerClosed;
    private int messagesReceived;

    // 只在 deframerExecutor 中访问
    private PendingClose pendingClose;

    /**
     * 构建 ClientCall 实例
     *
     * @param method                       调用的方法
     * @param executor                     执行回调的线程池，CallOptions 中的线程池优先
     * @param callOptions                  调用的选项
     * @param authority                    默认的 authority
     * @param clientTransportProvider      Transport 提供器
     * @param deadlineCancellationExecutor 用于调度超时的执行器
     * @param compressionNegotiator        压缩协商
     * @param defaultMaxInboundMessageSize 默认的最大接收消息大小
     */
    public ClientCallImpl(MethodDescriptor<ReqT, RespT> method,
                          Executor executor,
                          CallOptions callOptions,
                          String authority,
                          ClientTransportProvider clientTransportProvider,
                          ScheduledExecutorService deadlineCancellationExecutor,
                          CompressionNegotiator compressionNegotiator,
                          int defaultMaxInboundMessageSize) {
        this.method = checkNotNull(method, "method");
        // 用于性能追踪的工具
        this.tag = PerfMark.createTag(method.getFullMethodName(), System.identityHashCode(this));
        Executor effectiveExecutor = callOptions.getExecutor() != null ? callOptions.getExecutor() : executor;
        this.callExecutor = new SerializingExecutor(checkNotNull(effectiveExecutor, "executor"));
        this.callOptions = checkNotNull(callOptions, "callOptions");
        this.authority = callOptions.getAuthority() != null ? callOptions.getAuthority() : authority;
        this.clientTransportProvider = checkNotNull(clientTransportProvider, "clientTransportProvider");
        this.deadlineCancellationExecutor = deadlineCancellationExecutor;
        this.compressionNegotiator = checkNotNull(compressionNegotiator, "compressionNegotiator");
        this.defaultMaxInboundMessageSize = defaultMaxInboundMessageSize;
        this.unaryRequest = method.getType() == MethodDescriptor.MethodType.UNARY
                || method.getType() == MethodDescriptor.MethodType.SERVER_STREAMING;
        PerfMark.event("ClientCall.<init>", tag);
    }

    /**
     * 添加调用需要的 header，会移除调用方设置的同名 header
     */
    static void prepareHeaders(Metadata headers,
                               MethodDescriptor<?, ?> method,
                               String authority,
                               CompressionNegotiator compressionNegotiator) {
        headers.discardAll(PATH_KEY);
        headers.put(PATH_KEY, GrpcUtil.pathOf(method));

        headers.discardAll(AUTHORITY_KEY);
        if (authority != null) {
            headers.put(AUTHORITY_KEY, authority);
        }

        headers.discardAll(CONTENT_TYPE_KEY);
        headers.put(CONTENT_TYPE_KEY, GrpcUtil.contentType(method.getRequestMarshaller().contentSubtype()));

        headers.discardAll(MESSAGE_ENCODING_KEY);
        headers.discardAll(TIMEOUT_KEY);

        headers.discardAll(MESSAGE_ACCEPT_ENCODING_KEY);
        String advertisedEncodings = compressionNegotiator.getAcceptEncoding();
        if (!advertisedEncodings.isEmpty()) {
            headers.put(MESSAGE_ACCEPT_ENCODING_KEY, advertisedEncodings);
        }
    }

    /**
     * 开始调用
     *
     * @param observer 响应监听器
     * @param headers  请求的 header
     */
    @Override
    public void start(Listener<RespT> observer, Metadata headers) {
        PerfMark.startTask("ClientCall.start", tag);
        try {
            startInternal(observer, headers);
        } finally {
            PerfMark.stopTask("ClientCall.start", tag);
        }
    }

    private void startInternal(final Listener<RespT> observer, Metadata headers) {
        checkState(stream == null, "Already started");
        checkNotNull(observer, "observer");
        checkNotNull(headers, "headers");
        this.observer = observer;

        // 启动前已经取消，则不创建流，直接通知监听器
        if (cancelCalled) {
            stream = NoopClientStream.INSTANCE;
            executeCloseObserver(currentExceptionStatus(), new Metadata());
            return;
        }

        prepareHeaders(headers, method, authority, compressionNegotiator);

        int maxInbound = callOptions.getMaxInboundMessageSize() != null
                ? callOptions.getMaxInboundMessageSize()
                : defaultMaxInboundMessageSize;
        deframer = new MessageDeframer(new DeframerListener(), maxInbound);
        framer = new MessageFramer(new MessageFramer.Sink() {
            @Override
            public void deliverFrame(byte[] frame) {
                stream.writeData(frame);
            }
        });
        if (callOptions.getMaxOutboundMessageSize() != null) {
            framer.setMaxOutboundMessageSize(callOptions.getMaxOutboundMessageSize());
        }

        Deadline deadline = callOptions.getDeadline();
        boolean deadlineExceeded = deadline != null && deadline.isExpired();
        ClientStream newStream;
        if (deadlineExceeded) {
            // 初始化超时失败的流
            newStream = new FailingClientStream(Status.DEADLINE_EXCEEDED.withDescription(
                    "ClientCall started after deadline exceeded: " + deadline));
        } else {
            if (deadline != null) {
                long remaining = max(0, deadline.timeRemaining(TimeUnit.NANOSECONDS));
                headers.put(TIMEOUT_KEY, GrpcUtil.TimeoutMarshaller.toAsciiString(remaining));
            }
            newStream = newStreamOnPickedTransport(headers);
        }
        stream = newStream;

        // 调用 start 方法，修改流的状态
        newStream.start(new ClientStreamListenerImpl());

        if (deadline != null
                && deadlineCancellationExecutor != null
                // 如果截止时间已经到期，由失败的流处理
                && !(newStream instanceof FailingClientStream)) {
            deadlineCancellationFuture = deadline.runOnExpiration(
                    new DeadlineTimer(deadline), deadlineCancellationExecutor);
        }

        if (cancelListenersShouldBeRemoved) {
            // Race detected! ClientStreamListener.closed may have been called before
            // deadlineCancellationFuture was set, thereby preventing the future from being
            // cancelled. Go ahead and cancel again, just to be sure it was cancelled.
            cancelDeadlineFuture();
        }
    }

    /**
     * 选择 Transport，协商压缩方式，并创建流
     */
    private ClientStream newStreamOnPickedTransport(Metadata headers) {
        ClientTransport picked;
        try {
            picked = clientTransportProvider.get(method, callOptions, headers);
        } catch (StatusException e) {
            log.log(Level.FINE, "No transport for {0}: {1}", new Object[]{method.getFullMethodName(), e.getStatus()});
            return new FailingClientStream(e.getStatus());
        }

        Compressor compressor;
        String compressorName = callOptions.getCompressor();
        if (compressorName != null) {
            compressor = compressionNegotiator.getCompressorRegistry().lookupCompressor(compressorName);
            // 如果设置了压缩器名称，但是没有相应的压缩器，则返回错误
            if (compressor == null) {
                return new FailingClientStream(Status.INTERNAL.withDescription(
                        String.format("Unable to find compressor by name %s", compressorName)));
            }
        } else {
            compressor = compressionNegotiator.negotiate(picked.getAdvertisedEncodings().get()).getOutgoing();
        }
        if (compressor != Codec.Identity.NONE
                && !GrpcUtil.IDENTITY_ENCODING.equals(compressor.getMessageEncoding())) {
            headers.put(MESSAGE_ENCODING_KEY, compressor.getMessageEncoding());
        }
        framer.setCompressor(compressor);
        framer.setMessageCompression(method.isSafeToCompress());

        transport = picked;
        return picked.newStream(method, headers, callOptions);
    }

    private void cancelDeadlineFuture() {
        cancelListenersShouldBeRemoved = true;
        ScheduledFuture<?> f = deadlineCancellationFuture;
        if (f != null) {
            f.cancel(false);
        }
    }

    private class DeadlineTimer implements Runnable {
        private final Deadline deadline;

        DeadlineTimer(Deadline deadline) {
            this.deadline = deadline;
        }

        @Override
        public void run() {
            long overdue = -deadline.timeRemaining(TimeUnit.NANOSECONDS);
            failCall(Status.DEADLINE_EXCEEDED.withDescription(
                    String.format("deadline exceeded after %dns overdue: %s", max(0, overdue), deadline)));
        }
    }

    @Override
    public void request(final int numMessages) {
        PerfMark.startTask("ClientCall.request", tag);
        try {
            checkState(stream != null, "Not started");
            checkArgument(numMessages >= 0, "Number requested must be non-negative");
            if (numMessages == 0 || deframer == null) {
                return;
            }
            deframerExecutor.execute(new Runnable() {
                @Override
                public void run() {
                    deframer.request(numMessages);
                }
            });
        } finally {
            PerfMark.stopTask("ClientCall.request", tag);
        }
    }

    @Override
    public void cancel(@Nullable String message, @Nullable Throwable cause) {
        PerfMark.startTask("ClientCall.cancel", tag);
        try {
            cancelInternal(message, cause);
        } finally {
            PerfMark.stopTask("ClientCall.cancel", tag);
        }
    }

    private void cancelInternal(@Nullable String message, @Nullable Throwable cause) {
        if (message == null && cause == null) {
            cause = new CancellationException("Cancelled without a message or cause");
            log.log(Level.WARNING, "Cancelling without a message or cause is suboptimal", cause);
        }
        if (cancelCalled) {
            return;
        }
        cancelCalled = true;
        Status status = Status.CANCELLED;
        if (message != null) {
            status = status.withDescription(message);
        } else {
            status = status.withDescription("Call cancelled without message");
        }
        if (cause != null) {
            status = status.withCause(cause);
        }
        // Cancel is called in exception handling cases, so it may be the case that the
        // stream was never successfully created or start has never been called.
        if (stream == null) {
            trySetExceptionStatus(status);
            return;
        }
        failCall(status);
    }

    /**
     * Terminates the call locally with the given status, if no terminal status was set before. The
     * stream is cancelled and the listener closed, messages still queued are dropped.
     * 使用指定的状态终止调用，如果之前没有设置过终止状态；取消流并关闭监听器，队列中的消息会被丢弃
     */
    private void failCall(Status status) {
        if (!trySetExceptionStatus(status)) {
            return;
        }
        try {
            ClientStream current = stream;
            if (current != null) {
                current.cancel(status);
            }
        } finally {
            cancelDeadlineFuture();
        }
        executeCloseObserver(status, new Metadata());
    }

    private boolean trySetExceptionStatus(Status status) {
        synchronized (lock) {
            if (exceptionStatus != null) {
                return false;
            }
            exceptionStatus = status;
            return true;
        }
    }

    @Nullable
    private Status currentExceptionStatus() {
        synchronized (lock) {
            return exceptionStatus;
        }
    }

    private boolean isTerminated() {
        return cancelCalled || currentExceptionStatus() != null;
    }

    /**
     * 关闭请求的消息发送，返回的响应不受影响，当客户端不会发送更多消息时调用
     */
    @Override
    public void halfClose() {
        PerfMark.startTask("ClientCall.halfClose", tag);
        try {
            halfCloseInternal();
        } finally {
            PerfMark.stopTask("ClientCall.halfClose", tag);
        }
    }

    private void halfCloseInternal() {
        checkState(stream != null, "Not started");
        checkState(!cancelCalled, "call was cancelled");
        checkState(!halfCloseCalled, "call already half-closed");
        halfCloseCalled = true;
        if (framer != null) {
            framer.close();
        }
        stream.halfClose();
    }

    /**
     * 执行发送消息
     *
     * @param message 发给服务端的消息
     */
    @Override
    public void sendMessage(ReqT message) {
        PerfMark.startTask("ClientCall.sendMessage", tag);
        try {
            sendMessageInternal(message);
        } finally {
            PerfMark.stopTask("ClientCall.sendMessage", tag);
        }
    }

    private void sendMessageInternal(ReqT message) {
        checkState(stream != null, "Not started");
        checkState(!cancelCalled, "call was cancelled");
        checkState(!halfCloseCalled, "call was half-closed");
        if (currentExceptionStatus() != null || framer == null) {
            // 调用已经失败，丢弃消息
            return;
        }
        try {
            framer.writePayload(method.streamRequest(message));
        } catch (RuntimeException e) {
            Status status = Status.fromThrowable(e);
            if (status.getCode() == Status.Code.UNKNOWN) {
                status = Status.CANCELLED.withCause(e).withDescription("Failed to stream message");
            }
            failCall(status);
            return;
        } catch (Error e) {
            failCall(Status.CANCELLED.withDescription("Client sendMessage() failed with Error"));
            throw e;
        }
        // For unary requests, we don't flush since we know that halfClose should be coming soon.
        // 对于 unary 请求，不用 flush，因为接下来就是 halfClose
        if (!unaryRequest) {
            framer.flush();
        }
    }

    @Override
    public void setMessageCompression(boolean enabled) {
        checkState(stream != null, "Not started");
        if (framer != null) {
            framer.setMessageCompression(enabled && method.isSafeToCompress());
        }
    }

    @Override
    public boolean isReady() {
        return stream != null && !isTerminated() && !halfCloseCalled;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("method", method).toString();
    }

    private void executeCloseObserver(final Status status, final Metadata trailers) {
        callExecutor.execute(new Runnable() {
            @Override
            public void run() {
                closeObserver(status, trailers);
            }
        });
    }

    /**
     * 关闭监听器，只会执行一次，只在 callExecutor 中调用
     */
    private void closeObserver(Status status, Metadata trailers) {
        if (observerClosed) {
            return;
        }
        observerClosed = true;
        cancelDeadlineFuture();
        if (status.isOk() && method.getType().serverSendsOneMessage() && messagesReceived == 0) {
            status = Status.INTERNAL.withDescription("No value received for unary call");
        }
        if (!status.isOk()) {
            log.log(Level.FINE, "Call {0} closed with {1}", new Object[]{method.getFullMethodName(), status});
        }
        observer.onClose(status, trailers);
    }

    /**
     * 在 close 之前等待缓冲的消息传递完成
     */
    private static final class PendingClose {
        final Status status;
        final Metadata trailers;

        PendingClose(Status status, Metadata trailers) {
            this.status = status;
            this.trailers = trailers;
        }
    }

    /**
     * 解帧器的监听器，在 deframerExecutor 中执行
     */
    private final class DeframerListener implements MessageDeframer.Listener {

        @Override
        public void messageRead(final InputStream message) {
            PerfMark.startTask("ClientStreamListener.messageRead", tag);
            try {
                callExecutor.execute(new MessageRead(message));
            } finally {
                PerfMark.stopTask("ClientStreamListener.messageRead", tag);
            }
        }

        @Override
        public void deframerClosed(boolean hasPartialMessage) {
            PendingClose close = pendingClose;
            pendingClose = null;
            if (close == null) {
                return;
            }
            if (hasPartialMessage) {
                executeCloseObserver(Status.INTERNAL.withDescription("Encountered end-of-stream mid-frame"),
                        new Metadata());
                return;
            }
            executeCloseObserver(close.status, close.trailers);
        }

        @Override
        public void deframeFailed(Throwable cause) {
            Status status = Status.fromThrowable(cause);
            if (status.getCode() == Status.Code.UNKNOWN) {
                status = Status.INTERNAL.withDescription("Failed to read message.").withCause(cause);
            }
            failCall(status);
        }
    }

    /**
     * 在 callExecutor 中解析并传递消息
     */
    private final class MessageRead implements Runnable {
        private final InputStream message;

        MessageRead(InputStream message) {
            this.message = message;
        }

        @Override
        public void run() {
            try {
                if (observerClosed || isTerminated()) {
                    return;
                }
                RespT parsed;
                try {
                    parsed = method.parseResponse(message);
                } catch (Throwable t) {
                    Status status = Status.fromThrowable(t);
                    if (status.getCode() == Status.Code.UNKNOWN) {
                        status = Status.INTERNAL.withDescription("Failed to parse response").withCause(t);
                    }
                    failCall(status);
                    return;
                }
                messagesReceived++;
                if (method.getType().serverSendsOneMessage() && messagesReceived > 1) {
                    failCall(Status.INTERNAL.withDescription("More than one value received for unary call"));
                    return;
                }
                try {
                    observer.onMessage(parsed);
                } catch (Throwable t) {
                    failCall(Status.CANCELLED.withCause(t).withDescription("Failed to read message."));
                }
            } finally {
                GrpcUtil.closeQuietly(message);
            }
        }
    }

    /**
     * 流的监听器，由 Transport 串行调用
     */
    private class ClientStreamListenerImpl implements ClientStreamListener {

        @Override
        public void headersRead(final Metadata headers) {
            PerfMark.startTask("ClientStreamListener.headersRead", tag);
            try {
                ClientTransport current = transport;
                if (current != null) {
                    // 记录对端支持的编码，用于同一连接上之后的调用
                    current.getAdvertisedEncodings().update(headers.get(MESSAGE_ACCEPT_ENCODING_KEY));
                }
                String encoding = headers.get(MESSAGE_ENCODING_KEY);
                if (encoding != null && !GrpcUtil.IDENTITY_ENCODING.equals(encoding)) {
                    final Decompressor decompressor =
                            compressionNegotiator.getDecompressorRegistry().lookupDecompressor(encoding);
                    if (decompressor == null) {
                        failCall(Status.UNIMPLEMENTED.withDescription(
                                String.format("Can't find decompressor for %s", encoding)));
                        return;
                    }
                    deframerExecutor.execute(new Runnable() {
                        @Override
                        public void run() {
                            deframer.setDecompressor(decompressor);
                        }
                    });
                }
                callExecutor.execute(new Runnable() {
                    @Override
                    public void run() {
                        if (observerClosed || isTerminated()) {
                            return;
                        }
                        try {
                            observer.onHeaders(headers);
                        } catch (Throwable t) {
                            failCall(Status.CANCELLED.withCause(t).withDescription("Failed to read headers"));
                        }
                    }
                });
            } finally {
                PerfMark.stopTask("ClientStreamListener.headersRead", tag);
            }
        }

        @Override
        public void dataRead(final byte[] data) {
            deframerExecutor.execute(new Runnable() {
                @Override
                public void run() {
                    deframer.deframe(data);
                }
            });
        }

        @Override
        public void closed(Status status, @Nullable Metadata trailers) {
            PerfMark.startTask("ClientStreamListener.closed", tag);
            try {
                closedInternal(status, trailers);
            } finally {
                PerfMark.stopTask("ClientStreamListener.closed", tag);
            }
        }

        private void closedInternal(Status status, @Nullable Metadata trailers) {
            final Status finalStatus;
            final Metadata finalTrailers;
            if (trailers != null) {
                finalStatus = GrpcUtil.statusFromTrailers(trailers);
                finalTrailers = trailers;
            } else if (status.isOk()) {
                finalStatus = Status.INTERNAL.withDescription("Stream ended without trailers");
                finalTrailers = new Metadata();
            } else {
                finalStatus = status;
                finalTrailers = new Metadata();
            }

            if (finalStatus.isOk() && deframer != null) {
                // 等待缓冲的消息传递完成后再关闭
                deframerExecutor.execute(new Runnable() {
                    @Override
                    public void run() {
                        pendingClose = new PendingClose(finalStatus, finalTrailers);
                        deframer.closeWhenComplete();
                    }
                });
                return;
            }
            if (deframer != null) {
                deframerExecutor.execute(new Runnable() {
                    @Override
                    public void run() {
                        deframer.close();
                    }
                });
            }
            executeCloseObserver(finalStatus, finalTrailers);
        }
    }
}
