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

import com.google.common.annotations.VisibleForTesting;
import io.conduit.Codec;
import io.conduit.Compressor;
import io.conduit.Decompressor;
import io.conduit.Metadata;
import io.conduit.MethodDescriptor;
import io.conduit.ServerCall;
import io.conduit.ServerCallHandler;
import io.conduit.Status;
import io.perfmark.PerfMark;
import io.perfmark.Tag;

import javax.annotation.Nullable;
import java.io.InputStream;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static io.conduit.internal.GrpcUtil.CONTENT_TYPE_KEY;
import static io.conduit.internal.GrpcUtil.MESSAGE_ACCEPT_ENCODING_KEY;
import static io.conduit.internal.GrpcUtil.MESSAGE_ENCODING_KEY;

/**
 * Server side of a call, framing responses onto a {@link ServerStream} and deframing requests
 * from it.
 * 服务端的调用，将响应分帧写入 ServerStream，并从中解帧请求
 */
final class ServerCallImpl<ReqT, RespT> extends ServerCall<ReqT, RespT> {

    private static final Logger log = Logger.getLogger(ServerCallImpl.class.getName());

    @VisibleForTesting
    static final String TOO_MANY_RESPONSES = "Too many responses";
    @VisibleForTesting
    static final String MISSING_RESPONSE = "Completed without a response";
    @VisibleForTesting
    static final String TOO_MANY_REQUESTS = "Too many requests";

    // 服务端流
    private final ServerStream stream;
    // 方法描述
    private final MethodDescriptor<ReqT, RespT> method;
    private final Tag tag;
    // 客户端支持的编码
    private final Set<String> clientAcceptEncodings;
    private final CompressionNegotiator compressionNegotiator;
    // 回调监听器的串行执行器
    private final SerializingExecutor callExecutor;
    private final SerializingExecutor deframerExecutor = new SerializingExecutor(directExecutor());
    private final MessageFramer framer;
    private final MessageDeframer deframer;

    // state
    // 调用取消
    private volatile boolean cancelled;
    // 内部错误关闭了流，之后应用的操作都会被忽略
    private volatile boolean internallyClosed;
    // 发送 header
    private boolean sendHeadersCalled;
    // 已经关闭
    private boolean closeCalled;
    // 指定的压缩器
    private Compressor compressorOverride;
    // 已经发送消息
    private boolean messageSent;

    // 只在 callExecutor 中访问
    private ServerCall.Listener<ReqT> listener;
    private int messagesReceived;

    // 只在 deframerExecutor 中访问
    private boolean halfClosePending;

    ServerCallImpl(ServerStream stream,
                   MethodDescriptor<ReqT, RespT> method,
                   Metadata inboundHeaders,
                   Executor executor,
                   CompressionNegotiator compressionNegotiator,
                   @Nullable Decompressor decompressor,
                   int maxInboundMessageSize) {
        this.stream = checkNotNull(stream, "stream");
        this.method = checkNotNull(method, "method");
        this.tag = PerfMark.createTag(method.getFullMethodName(), System.identityHashCode(this));
        this.clientAcceptEncodings =
                CompressionNegotiator.parseAcceptEncoding(inboundHeaders.get(MESSAGE_ACCEPT_ENCODING_KEY));
        this.compressionNegotiator = checkNotNull(compressionNegotiator, "compressionNegotiator");
        this.callExecutor = new SerializingExecutor(executor);
        this.framer = new MessageFramer(new MessageFramer.Sink() {
            @Override
            public void deliverFrame(byte[] frame) {
                ServerCallImpl.this.stream.writeData(frame);
            }
        });
        this.deframer = new MessageDeframer(new DeframerListener(), maxInboundMessageSize);
        if (decompressor != null) {
            deframer.setDecompressor(decompressor);
        }
    }

    /**
     * 在调用的执行器中启动处理器，之后的监听器回调都在它之后执行
     */
    void startCall(final ServerCallHandler<ReqT, RespT> handler, final Metadata headers) {
        callExecutor.execute(new Runnable() {
            @Override
            public void run() {
                PerfMark.startTask("ServerCall.startCall", tag);
                try {
                    listener = checkNotNull(handler.startCall(ServerCallImpl.this, headers),
                            "startCall() returned a null listener for method %s", method.getFullMethodName());
                } catch (Throwable t) {
                    listener = new ServerCall.Listener<ReqT>() {
                    };
                    internalClose(Status.UNKNOWN.withDescription("Application error processing RPC").withCause(t));
                } finally {
                    PerfMark.stopTask("ServerCall.startCall", tag);
                }
            }
        });
    }

    /**
     * 在请求中将最多给定数量的消息投递给 Listener#onMessage
     */
    @Override
    public void request(final int numMessages) {
        PerfMark.startTask("ServerCall.request", tag);
        try {
            checkArgument(numMessages >= 0, "Number requested must be non-negative");
            if (numMessages == 0) {
                return;
            }
            deframerExecutor.execute(new Runnable() {
                @Override
                public void run() {
                    deframer.request(numMessages);
                }
            });
        } finally {
            PerfMark.stopTask("ServerCall.request", tag);
        }
    }

    /**
     * 发送响应 header
     */
    @Override
    public void sendHeaders(Metadata headers) {
        PerfMark.startTask("ServerCall.sendHeaders", tag);
        try {
            sendHeadersInternal(headers);
        } finally {
            PerfMark.stopTask("ServerCall.sendHeaders", tag);
        }
    }

    private void sendHeadersInternal(Metadata headers) {
        // 检查是否已经发送过 header 或是否已经关闭了调用
        checkState(!sendHeadersCalled, "sendHeaders has already been called");
        checkState(!closeCalled, "call is closed");

        Compressor compressor;
        if (compressorOverride != null) {
            // 客户端不支持指定的压缩方式时不压缩
            compressor = clientAcceptEncodings.contains(compressorOverride.getMessageEncoding())
                    ? compressorOverride
                    : Codec.Identity.NONE;
        } else {
            compressor = compressionNegotiator.negotiate(clientAcceptEncodings).getOutgoing();
        }

        // Always put compressor, even if it's identity.
        headers.discardAll(MESSAGE_ENCODING_KEY);
        headers.put(MESSAGE_ENCODING_KEY, compressor.getMessageEncoding());
        framer.setCompressor(compressor);
        framer.setMessageCompression(method.isSafeToCompress());

        headers.discardAll(MESSAGE_ACCEPT_ENCODING_KEY);
        String advertisedEncodings = compressionNegotiator.getAcceptEncoding();
        if (!advertisedEncodings.isEmpty()) {
            headers.put(MESSAGE_ACCEPT_ENCODING_KEY, advertisedEncodings);
        }
        headers.discardAll(CONTENT_TYPE_KEY);
        headers.put(CONTENT_TYPE_KEY, GrpcUtil.contentType(method.getResponseMarshaller().contentSubtype()));

        sendHeadersCalled = true;
        if (internallyClosed) {
            return;
        }
        stream.writeHeaders(headers);
    }

    /**
     * 发送消息
     */
    @Override
    public void sendMessage(RespT message) {
        PerfMark.startTask("ServerCall.sendMessage", tag);
        try {
            sendMessageInternal(message);
        } finally {
            PerfMark.stopTask("ServerCall.sendMessage", tag);
        }
    }

    private void sendMessageInternal(RespT message) {
        // 检查是否已经发送了 header，和调用是否已经被关闭
        checkState(sendHeadersCalled, "sendHeaders has not been called");
        checkState(!closeCalled, "call is closed");
        if (internallyClosed) {
            return;
        }
        // 如果是 UNARY 或者 CLIENT_STREAMING 类型的方法，且已经发送过消息了，则不允许再发送
        if (method.getType().serverSendsOneMessage() && messageSent) {
            internalClose(Status.INTERNAL.withDescription(TOO_MANY_RESPONSES));
            return;
        }
        messageSent = true;
        try {
            InputStream resp = method.streamResponse(message);
            framer.writePayload(resp);
            framer.flush();
        } catch (RuntimeException e) {
            close(Status.fromThrowable(e), new Metadata());
        } catch (Error e) {
            close(Status.CANCELLED.withDescription("Server sendMessage() failed with Error"), new Metadata());
            throw e;
        }
    }

    /**
     * 设置压缩器，需要在发送 header 之前调用
     */
    @Override
    public void setCompression(String compressorName) {
        checkState(!sendHeadersCalled, "sendHeaders has been called");
        compressorOverride = compressionNegotiator.getCompressorRegistry().lookupCompressor(compressorName);
        checkArgument(compressorOverride != null, "Unable to find compressor by name %s", compressorName);
    }

    /**
     * 处理请求完成事件
     */
    @Override
    public void close(Status status, Metadata trailers) {
        PerfMark.startTask("ServerCall.close", tag);
        try {
            closeInternal(status, trailers);
        } finally {
            PerfMark.stopTask("ServerCall.close", tag);
        }
    }

    private void closeInternal(Status status, Metadata trailers) {
        checkState(!closeCalled, "call already closed");
        closeCalled = true;
        if (internallyClosed) {
            return;
        }
        // 状态是 OK，方法只能返回一个响应，但没有发送响应，则返回错误
        if (status.isOk() && method.getType().serverSendsOneMessage() && !messageSent) {
            internalClose(Status.INTERNAL.withDescription(MISSING_RESPONSE));
            return;
        }
        framer.close();
        stream.close(GrpcUtil.statusToTrailers(status, trailers));
    }

    /**
     * 返回流是否取消了
     */
    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public String getAuthority() {
        return stream.getAuthority();
    }

    @Override
    public MethodDescriptor<ReqT, RespT> getMethodDescriptor() {
        return method;
    }

    /**
     * 使用调用创建流监听器
     */
    ServerStreamListener newServerStreamListener() {
        return new ServerStreamListenerImpl();
    }

    /**
     * Close the {@link ServerStream} because an internal error occurred. Allow the application to
     * run until completion, but silently ignore interactions with the {@link ServerStream} from now
     * on.
     * 因为内部错误关闭流，应用可以继续执行，但是之后对流的操作都会被忽略
     */
    private void internalClose(Status internalError) {
        if (internallyClosed) {
            return;
        }
        internallyClosed = true;
        log.log(Level.WARNING, "Cancelling the stream with status {0}", new Object[]{internalError});
        stream.cancel(internalError);
    }

    /**
     * 解帧器的监听器，在 deframerExecutor 中执行
     */
    private final class DeframerListener implements MessageDeframer.Listener {

        @Override
        public void messageRead(InputStream message) {
            callExecutor.execute(new MessageRead(message));
        }

        @Override
        public void deframerClosed(boolean hasPartialMessage) {
            if (!halfClosePending) {
                return;
            }
            halfClosePending = false;
            if (hasPartialMessage) {
                internalClose(Status.INTERNAL.withDescription("Encountered end-of-stream mid-frame"));
                return;
            }
            callExecutor.execute(new Runnable() {
                @Override
                public void run() {
                    PerfMark.startTask("ServerStreamListener.halfClosed", tag);
                    try {
                        if (cancelled || internallyClosed) {
                            return;
                        }
                        listener.onHalfClose();
                    } catch (Throwable t) {
                        internalClose(Status.UNKNOWN.withDescription("Application error processing RPC").withCause(t));
                    } finally {
                        PerfMark.stopTask("ServerStreamListener.halfClosed", tag);
                    }
                }
            });
        }

        @Override
        public void deframeFailed(Throwable cause) {
            Status status = Status.fromThrowable(cause);
            if (status.getCode() == Status.Code.UNKNOWN) {
                status = Status.INTERNAL.withDescription("Failed to read message.").withCause(cause);
            }
            internalClose(status);
        }
    }

    /**
     * 在 callExecutor 中解析并传递请求
     */
    private final class MessageRead implements Runnable {
        private final InputStream message;

        MessageRead(InputStream message) {
            this.message = message;
        }

        @Override
        public void run() {
            PerfMark.startTask("ServerStreamListener.messagesAvailable", tag);
            try {
                // 如果调用已经取消了，则丢弃消息
                if (cancelled || internallyClosed) {
                    return;
                }
                ReqT request;
                try {
                    request = method.parseRequest(message);
                } catch (Throwable t) {
                    Status status = Status.fromThrowable(t);
                    if (status.getCode() == Status.Code.UNKNOWN) {
                        status = Status.INTERNAL.withDescription("Failed to parse request").withCause(t);
                    }
                    internalClose(status);
                    return;
                }
                messagesReceived++;
                if (method.getType().clientSendsOneMessage() && messagesReceived > 1) {
                    internalClose(Status.INTERNAL.withDescription(TOO_MANY_REQUESTS));
                    return;
                }
                try {
                    listener.onMessage(request);
                } catch (Throwable t) {
                    internalClose(Status.UNKNOWN.withDescription("Application error processing RPC").withCause(t));
                }
            } finally {
                GrpcUtil.closeQuietly(message);
                PerfMark.stopTask("ServerStreamListener.messagesAvailable", tag);
            }
        }
    }

    /**
     * 流的监听器，由 Transport 串行调用
     */
    private final class ServerStreamListenerImpl implements ServerStreamListener {

        @Override
        public void dataRead(final byte[] data) {
            deframerExecutor.execute(new Runnable() {
                @Override
                public void run() {
                    deframer.deframe(data);
                }
            });
        }

        /**
         * 请求半关闭事件，缓冲的消息传递完成后通知监听器
         */
        @Override
        public void halfClosed() {
            deframerExecutor.execute(new Runnable() {
                @Override
                public void run() {
                    halfClosePending = true;
                    deframer.closeWhenComplete();
                }
            });
        }

        @Override
        public void closed(final Status status) {
            PerfMark.startTask("ServerStreamListener.closed", tag);
            try {
                if (!status.isOk()) {
                    // 立即标记，丢弃之后的消息
                    cancelled = true;
                }
                deframerExecutor.execute(new Runnable() {
                    @Override
                    public void run() {
                        halfClosePending = false;
                        deframer.close();
                    }
                });
                callExecutor.execute(new Runnable() {
                    @Override
                    public void run() {
                        // 如果状态是 OK，通知监听器完成，否则通知取消
                        if (status.isOk()) {
                            listener.onComplete();
                        } else {
                            log.log(Level.FINE, "Call {0} cancelled: {1}",
                                    new Object[]{method.getFullMethodName(), status});
                            listener.onCancel();
                        }
                    }
                });
            } finally {
                PerfMark.stopTask("ServerStreamListener.closed", tag);
            }
        }
    }
}
