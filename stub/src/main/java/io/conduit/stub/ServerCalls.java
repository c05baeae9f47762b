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

package io.conduit.stub;

import io.conduit.Metadata;
import io.conduit.MethodDescriptor;
import io.conduit.ServerCall;
import io.conduit.ServerCallHandler;
import io.conduit.Status;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Adapts service implementations written against {@link StreamObserver} to
 * {@link ServerCallHandler}s.
 * 将基于 StreamObserver 的服务实现适配为 ServerCallHandler
 *
 * <p>Methods whose client sends one message are invoked once the client half-closes, with the
 * single request. A call that half-closes without a request, or sends a second one, is closed with
 * {@code INTERNAL} and never reaches the implementation. Methods with a request stream are invoked
 * when the call starts and receive every request through the returned observer.
 */
public final class ServerCalls {

    static final String TOO_MANY_REQUESTS = "Too many requests";
    static final String MISSING_REQUEST = "Half-closed without a request";

    private ServerCalls() {
    }

    public static <ReqT, RespT> ServerCallHandler<ReqT, RespT> asyncUnaryCall(UnaryMethod<ReqT, RespT> method) {
        return MethodHandler.singleRequest(method);
    }

    public static <ReqT, RespT> ServerCallHandler<ReqT, RespT> asyncServerStreamingCall(
            ServerStreamingMethod<ReqT, RespT> method) {
        return MethodHandler.singleRequest(method);
    }

    public static <ReqT, RespT> ServerCallHandler<ReqT, RespT> asyncClientStreamingCall(
            ClientStreamingMethod<ReqT, RespT> method) {
        return MethodHandler.requestStream(method);
    }

    public static <ReqT, RespT> ServerCallHandler<ReqT, RespT> asyncBidiStreamingCall(
            BidiStreamingMethod<ReqT, RespT> method) {
        return MethodHandler.requestStream(method);
    }

    /**
     * Fails the call with {@code UNIMPLEMENTED} naming the method.
     * 为未实现的方法返回 UNIMPLEMENTED
     */
    public static void asyncUnimplementedUnaryCall(MethodDescriptor<?, ?> methodDescriptor,
                                                   StreamObserver<?> responseObserver) {
        checkNotNull(methodDescriptor, "methodDescriptor");
        checkNotNull(responseObserver, "responseObserver");
        responseObserver.onError(Status.UNIMPLEMENTED
                .withDescription(String.format("Method %s is unimplemented", methodDescriptor.getFullMethodName()))
                .asRuntimeException());
    }

    public interface UnaryMethod<ReqT, RespT> extends SingleRequestMethod<ReqT, RespT> {
    }

    public interface ServerStreamingMethod<ReqT, RespT> extends SingleRequestMethod<ReqT, RespT> {
    }

    public interface ClientStreamingMethod<ReqT, RespT> extends RequestStreamMethod<ReqT, RespT> {
    }

    public interface BidiStreamingMethod<ReqT, RespT> extends RequestStreamMethod<ReqT, RespT> {
    }

    /**
     * A method that receives exactly one request.
     */
    public interface SingleRequestMethod<ReqT, RespT> {
        void invoke(ReqT request, StreamObserver<RespT> responseObserver);
    }

    /**
     * A method that receives its requests through the observer it returns.
     */
    public interface RequestStreamMethod<ReqT, RespT> {
        StreamObserver<ReqT> invoke(StreamObserver<RespT> responseObserver);
    }

    /**
     * Exactly one of the two methods is set.
     */
    private static final class MethodHandler<ReqT, RespT> implements ServerCallHandler<ReqT, RespT> {

        @Nullable
        private final SingleRequestMethod<ReqT, RespT> singleRequestMethod;
        @Nullable
        private final RequestStreamMethod<ReqT, RespT> requestStreamMethod;

        private MethodHandler(@Nullable SingleRequestMethod<ReqT, RespT> singleRequestMethod,
                              @Nullable RequestStreamMethod<ReqT, RespT> requestStreamMethod) {
            this.singleRequestMethod = singleRequestMethod;
            this.requestStreamMethod = requestStreamMethod;
        }

        static <ReqT, RespT> MethodHandler<ReqT, RespT> singleRequest(SingleRequestMethod<ReqT, RespT> method) {
            return new MethodHandler<>(checkNotNull(method, "method"), null);
        }

        static <ReqT, RespT> MethodHandler<ReqT, RespT> requestStream(RequestStreamMethod<ReqT, RespT> method) {
            return new MethodHandler<>(null, checkNotNull(method, "method"));
        }

        @Override
        public ServerCall.Listener<ReqT> startCall(ServerCall<ReqT, RespT> call, Metadata headers) {
            ResponseObserver<RespT> responses = new ResponseObserver<>(call);
            if (singleRequestMethod != null) {
                checkArgument(call.getMethodDescriptor().getType().clientSendsOneMessage(),
                        "%s does not take a single request", call.getMethodDescriptor().getFullMethodName());
                // 请求两条消息，第二条到达说明客户端发送了多余的请求
                call.request(2);
                return new CallListener<>(call, responses, singleRequestMethod, null);
            }
            StreamObserver<ReqT> requests = requestStreamMethod.invoke(responses);
            responses.freeze();
            call.request(1);
            return new CallListener<>(call, responses, null, requests);
        }
    }

    /**
     * Delivers the requests of one call to the service implementation.
     * 将一次调用的请求交给服务实现
     */
    private static final class CallListener<ReqT, RespT> extends ServerCall.Listener<ReqT> {

        private final ServerCall<ReqT, RespT> call;
        private final ResponseObserver<RespT> responses;
        @Nullable
        private final SingleRequestMethod<ReqT, RespT> singleRequestMethod;
        @Nullable
        private final StreamObserver<ReqT> requests;

        @Nullable
        private ReqT pendingRequest;
        private boolean rejected;
        private boolean halfClosed;

        CallListener(ServerCall<ReqT, RespT> call,
                     ResponseObserver<RespT> responses,
                     @Nullable SingleRequestMethod<ReqT, RespT> singleRequestMethod,
                     @Nullable StreamObserver<ReqT> requests) {
            this.call = call;
            this.responses = responses;
            this.singleRequestMethod = singleRequestMethod;
            this.requests = requests;
        }

        @Override
        public void onMessage(ReqT request) {
            if (requests != null) {
                requests.onNext(request);
                call.request(1);
                return;
            }
            if (rejected) {
                return;
            }
            if (pendingRequest != null) {
                reject(TOO_MANY_REQUESTS);
                return;
            }
            pendingRequest = request;
        }

        @Override
        public void onHalfClose() {
            halfClosed = true;
            if (requests != null) {
                requests.onCompleted();
                return;
            }
            if (rejected) {
                return;
            }
            if (pendingRequest == null) {
                reject(MISSING_REQUEST);
                return;
            }
            ReqT request = pendingRequest;
            pendingRequest = null;
            singleRequestMethod.invoke(request, responses);
            responses.freeze();
        }

        @Override
        public void onCancel() {
            responses.cancelled();
            if (requests != null && !halfClosed) {
                requests.onError(Status.CANCELLED.withDescription("cancelled before receiving half close")
                                                 .asRuntimeException());
            }
        }

        private void reject(String reason) {
            rejected = true;
            pendingRequest = null;
            call.close(Status.INTERNAL.withDescription(reason), new Metadata());
        }
    }

    /**
     * Sends headers before the first response and closes the call exactly once. After a
     * cancellation, responses are dropped when the service registered a cancel handler and fail
     * otherwise; errors are dropped either way.
     */
    private static final class ResponseObserver<RespT> extends ServerCallStreamObserver<RespT> {

        private final ServerCall<?, RespT> call;
        private volatile boolean cancelled;
        private boolean frozen;
        private boolean headersSent;
        private boolean closed;
        @Nullable
        private Runnable onCancelHandler;

        ResponseObserver(ServerCall<?, RespT> call) {
            this.call = call;
        }

        void freeze() {
            frozen = true;
        }

        void cancelled() {
            cancelled = true;
            if (onCancelHandler != null) {
                onCancelHandler.run();
            }
        }

        @Override
        public void onNext(RespT response) {
            if (dropAfterCancel()) {
                return;
            }
            checkState(!closed, "call already closed");
            if (!headersSent) {
                call.sendHeaders(new Metadata());
                headersSent = true;
            }
            call.sendMessage(response);
        }

        @Override
        public void onError(Throwable t) {
            // 已取消的调用已经关闭
            if (cancelled) {
                return;
            }
            checkState(!closed, "call already closed");
            closed = true;
            Metadata trailers = Status.trailersFromThrowable(t);
            call.close(Status.fromThrowable(t), trailers == null ? new Metadata() : trailers);
        }

        @Override
        public void onCompleted() {
            if (dropAfterCancel()) {
                return;
            }
            checkState(!closed, "call already closed");
            closed = true;
            call.close(Status.OK, new Metadata());
        }

        private boolean dropAfterCancel() {
            if (!cancelled) {
                return false;
            }
            if (onCancelHandler == null) {
                throw Status.CANCELLED.withDescription("call already cancelled").asRuntimeException();
            }
            return true;
        }

        @Override
        public boolean isCancelled() {
            return call.isCancelled();
        }

        @Override
        public void setOnCancelHandler(Runnable onCancelHandler) {
            checkState(!frozen, "the cancel handler may only be set while the method is first invoked");
            this.onCancelHandler = onCancelHandler;
        }

        @Override
        public void setCompression(String compression) {
            call.setCompression(compression);
        }
    }
}
