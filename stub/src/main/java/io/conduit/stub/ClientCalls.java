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

import com.google.common.base.MoreObjects;
import com.google.common.base.Throwables;
import com.google.common.util.concurrent.AbstractFuture;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import io.conduit.CallOptions;
import io.conduit.Channel;
import io.conduit.ClientCall;
import io.conduit.Metadata;
import io.conduit.MethodDescriptor;
import io.conduit.Status;
import io.conduit.StatusException;
import io.conduit.StatusRuntimeException;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Runs the four call shapes on a {@link ClientCall}: with response observers, with a future, or
 * blocking the calling thread.
 * 客户端调用的工具方法，支持观察器、Future 和阻塞三种方式
 *
 * <p>Blocking variants deliver every callback of the call on the thread that waits for it, so
 * they need no executor of their own.
 */
public final class ClientCalls {

    private static final Logger logger = Logger.getLogger(ClientCalls.class.getName());

    private ClientCalls() {
    }

    /**
     * Sends {@code req} on a call that was not started yet and hands the single response, or the
     * failure, to {@code responseObserver}. The call belongs to this method afterwards.
     * 发送一个请求，并将唯一的响应交给观察器，call 必须还没有开始
     */
    public static <ReqT, RespT> void asyncUnaryCall(ClientCall<ReqT, RespT> call,
                                                    ReqT req,
                                                    StreamObserver<RespT> responseObserver) {
        sendSingleRequest(call, req, new ObserverListener<>(call, responseObserver, false));
    }

    /**
     * Like {@link #asyncUnaryCall} but any number of responses reach {@code responseObserver}.
     * 发送一个请求，响应以流的方式交给观察器
     */
    public static <ReqT, RespT> void asyncServerStreamingCall(ClientCall<ReqT, RespT> call,
                                                              ReqT req,
                                                              StreamObserver<RespT> responseObserver) {
        sendSingleRequest(call, req, new ObserverListener<>(call, responseObserver, true));
    }

    /**
     * Starts a client-streaming call. Requests go through the returned observer; the single
     * response reaches {@code responseObserver}.
     * 执行客户端流调用，返回用于发送请求的观察器
     *
     * @return request stream observer, a {@link ClientCallStreamObserver}
     */
    public static <ReqT, RespT> StreamObserver<ReqT> asyncClientStreamingCall(ClientCall<ReqT, RespT> call,
                                                                              StreamObserver<RespT> responseObserver) {
        return startRequestStream(call, new ObserverListener<>(call, responseObserver, false));
    }

    /**
     * Starts a bidirectional-streaming call. The two directions are independent.
     * 执行双向流调用，两个方向互相独立
     *
     * @return request stream observer, a {@link ClientCallStreamObserver}
     */
    public static <ReqT, RespT> StreamObserver<ReqT> asyncBidiStreamingCall(ClientCall<ReqT, RespT> call,
                                                                            StreamObserver<RespT> responseObserver) {
        return startRequestStream(call, new ObserverListener<>(call, responseObserver, true));
    }

    /**
     * Sends {@code req} and waits for the single response.
     * 发送请求并阻塞等待唯一的响应
     *
     * @throws StatusRuntimeException when the call fails
     */
    public static <ReqT, RespT> RespT blockingUnaryCall(Channel channel,
                                                        MethodDescriptor<ReqT, RespT> method,
                                                        CallOptions callOptions,
                                                        ReqT req) {
        CallerThreadExecutor executor = new CallerThreadExecutor();
        ClientCall<ReqT, RespT> call = channel.newCall(method, callOptions.withExecutor(executor));
        ResponseFuture<RespT> response = new ResponseFuture<>(call);
        try {
            sendSingleRequest(call, req, new FutureListener<>(response));
        } catch (RuntimeException e) {
            throw cancelAndRethrow(call, e);
        }
        return await(call, executor, response);
    }

    /**
     * Sends the requests pulled from {@code requests} and waits for the single response. Pulling
     * stops as soon as the call closes, so an endless iterator is fine when the server or a
     * deadline ends the call.
     * 逐条读取迭代器中的请求并发送，阻塞等待唯一的响应；调用关闭后立即停止读取
     *
     * @throws StatusRuntimeException when the call fails
     */
    public static <ReqT, RespT> RespT blockingClientStreamingCall(Channel channel,
                                                                  MethodDescriptor<ReqT, RespT> method,
                                                                  CallOptions callOptions,
                                                                  Iterator<? extends ReqT> requests) {
        checkNotNull(requests, "requests");
        CallerThreadExecutor executor = new CallerThreadExecutor();
        ClientCall<ReqT, RespT> call = channel.newCall(method, callOptions.withExecutor(executor));
        ResponseFuture<RespT> response = new ResponseFuture<>(call);
        try {
            start(call, new FutureListener<>(response));
            executor.runPending();
            boolean cancelled = false;
            while (!cancelled && !response.isDone() && requests.hasNext()) {
                call.sendMessage(requests.next());
                // 处理发送期间到达的回调，调用已经关闭时停止读取
                executor.runPending();
                if (Thread.currentThread().isInterrupted()) {
                    call.cancel("Thread interrupted", null);
                    cancelled = true;
                }
            }
            if (!cancelled && !response.isDone()) {
                call.halfClose();
            }
        } catch (RuntimeException e) {
            throw cancelAndRethrow(call, e);
        }
        return await(call, executor, response);
    }

    /**
     * Sends {@code req} and returns a lazy iterator over the responses. Each response is asked
     * for only when the previous one was taken.
     * 发送请求，返回响应的阻塞迭代器，取走一条响应后才请求下一条
     *
     * <p>Closing the iterator abandons the call.
     */
    public static <ReqT, RespT> ResponseIterator<RespT> blockingServerStreamingCall(Channel channel,
                                                                                    MethodDescriptor<ReqT, RespT> method,
                                                                                    CallOptions callOptions,
                                                                                    ReqT req) {
        CallerThreadExecutor executor = new CallerThreadExecutor();
        ClientCall<ReqT, RespT> call = channel.newCall(method, callOptions.withExecutor(executor));
        BlockingResponses<RespT> responses = new BlockingResponses<>(call, executor);
        sendSingleRequest(call, req, responses.listener);
        return responses;
    }

    /**
     * Sends {@code req} and returns the single response as a future. Cancelling the future
     * cancels the call.
     * 发送请求并返回响应的 Future，取消 Future 会取消调用
     */
    public static <ReqT, RespT> ListenableFuture<RespT> futureUnaryCall(ClientCall<ReqT, RespT> call, ReqT req) {
        ResponseFuture<RespT> response = new ResponseFuture<>(call);
        sendSingleRequest(call, req, new FutureListener<>(response));
        return response;
    }

    /**
     * Runs the call's callbacks on this thread until {@code response} is done. An interrupt
     * cancels the call; the interrupt flag is restored once the call closed.
     * 在当前线程上执行回调直到得到结果，被中断时取消调用，结束后恢复中断标记
     */
    private static <RespT> RespT await(ClientCall<?, RespT> call,
                                       CallerThreadExecutor executor,
                                       ResponseFuture<RespT> response) {
        boolean interrupted = Thread.interrupted();
        if (interrupted) {
            call.cancel("Thread interrupted", null);
        }
        try {
            while (!response.isDone()) {
                try {
                    executor.awaitAndRun();
                } catch (InterruptedException e) {
                    interrupted = true;
                    call.cancel("Thread interrupted", e);
                }
            }
            return Futures.getDone(response);
        } catch (ExecutionException e) {
            throw toStatusRuntimeException(e.getCause());
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Finds the status in the causal chain of {@code t}, keeping its trailers. Anything else is
     * reported as UNKNOWN.
     * 在异常链中查找状态，找不到时返回 UNKNOWN
     */
    private static StatusRuntimeException toStatusRuntimeException(Throwable t) {
        for (Throwable cause : Throwables.getCausalChain(checkNotNull(t, "t"))) {
            if (cause instanceof StatusException) {
                StatusException e = (StatusException) cause;
                return new StatusRuntimeException(e.getStatus(), e.getTrailers());
            }
            if (cause instanceof StatusRuntimeException) {
                StatusRuntimeException e = (StatusRuntimeException) cause;
                return new StatusRuntimeException(e.getStatus(), e.getTrailers());
            }
        }
        return Status.UNKNOWN.withDescription("unexpected exception").withCause(t).asRuntimeException();
    }

    private static RuntimeException cancelAndRethrow(ClientCall<?, ?> call, RuntimeException e) {
        try {
            call.cancel(null, e);
        } catch (RuntimeException cancelFailure) {
            logger.log(Level.SEVERE, "Failed to cancel call after local error", cancelFailure);
        }
        throw e;
    }

    private static <ReqT, RespT> void sendSingleRequest(ClientCall<ReqT, RespT> call,
                                                        ReqT req,
                                                        StartableListener<RespT> responseListener) {
        start(call, responseListener);
        try {
            call.sendMessage(req);
            call.halfClose();
        } catch (RuntimeException e) {
            throw cancelAndRethrow(call, e);
        }
    }

    private static <ReqT, RespT> StreamObserver<ReqT> startRequestStream(ClientCall<ReqT, RespT> call,
                                                                         StartableListener<RespT> responseListener) {
        RequestObserver<ReqT> requests = new RequestObserver<>(call);
        start(call, responseListener);
        return requests;
    }

    private static <RespT> void start(ClientCall<?, RespT> call, StartableListener<RespT> responseListener) {
        call.start(responseListener, new Metadata());
        // 开始之后再请求消息
        responseListener.onStart();
    }

    private abstract static class StartableListener<T> extends ClientCall.Listener<T> {
        abstract void onStart();

        @Override
        public void onHeaders(Metadata headers) {
        }
    }

    /**
     * Request side of an observer based call. After {@code onError} or {@code onCompleted} no
     * more messages may be sent.
     * 请求方向的观察器，结束之后不能再发送消息
     */
    private static final class RequestObserver<T> extends ClientCallStreamObserver<T> {
        private final ClientCall<T, ?> call;
        @Nullable
        private String finishedBy;

        RequestObserver(ClientCall<T, ?> call) {
            this.call = call;
        }

        @Override
        public void onNext(T value) {
            checkState(finishedBy == null, "Request stream already ended by %s", finishedBy);
            call.sendMessage(value);
        }

        @Override
        public void onError(Throwable t) {
            finishedBy = "onError";
            call.cancel("Cancelled by client with StreamObserver.onError()", t);
        }

        @Override
        public void onCompleted() {
            finishedBy = "onCompleted";
            call.halfClose();
        }

        @Override
        public void cancel(@Nullable String message, @Nullable Throwable cause) {
            call.cancel(message, cause);
        }
    }

    /**
     * Hands responses of a call to a {@link StreamObserver}. A streaming response asks for the
     * next message only after the observer took the current one; a single response asks for two
     * up front so the call itself can reject a second one.
     * 将调用的响应交给观察器，流式响应在观察器处理完当前消息后再请求下一条
     */
    private static final class ObserverListener<RespT> extends StartableListener<RespT> {
        private final ClientCall<?, RespT> call;
        private final StreamObserver<RespT> observer;
        private final boolean streamingResponse;

        ObserverListener(ClientCall<?, RespT> call, StreamObserver<RespT> observer, boolean streamingResponse) {
            this.call = call;
            this.observer = checkNotNull(observer, "responseObserver");
            this.streamingResponse = streamingResponse;
        }

        @Override
        void onStart() {
            call.request(streamingResponse ? 1 : 2);
        }

        @Override
        public void onMessage(RespT message) {
            observer.onNext(message);
            if (streamingResponse) {
                call.request(1);
            }
        }

        @Override
        public void onClose(Status status, Metadata trailers) {
            if (status.isOk()) {
                observer.onCompleted();
            } else {
                observer.onError(status.asRuntimeException(trailers));
            }
        }
    }

    /**
     * Completes a {@link ResponseFuture} with the single response of a call.
     * 使用调用的唯一响应完成 Future
     */
    private static final class FutureListener<RespT> extends StartableListener<RespT> {
        private final ResponseFuture<RespT> responseFuture;
        @Nullable
        private RespT value;

        FutureListener(ResponseFuture<RespT> responseFuture) {
            this.responseFuture = responseFuture;
        }

        @Override
        void onStart() {
            responseFuture.call.request(2);
        }

        @Override
        public void onMessage(RespT message) {
            // 第二条响应由 ClientCall 拒绝
            value = message;
        }

        @Override
        public void onClose(Status status, Metadata trailers) {
            if (!status.isOk()) {
                responseFuture.setException(status.asRuntimeException(trailers));
            } else if (value == null) {
                responseFuture.setException(Status.INTERNAL.withDescription("No value received for unary call")
                                                           .asRuntimeException(trailers));
            } else {
                responseFuture.set(value);
            }
        }
    }

    private static final class ResponseFuture<RespT> extends AbstractFuture<RespT> {
        private final ClientCall<?, RespT> call;

        ResponseFuture(ClientCall<?, RespT> call) {
            this.call = call;
        }

        @Override
        protected void interruptTask() {
            call.cancel("Response future was cancelled", null);
        }

        @Override
        protected boolean set(@Nullable RespT resp) {
            return super.set(resp);
        }

        @Override
        protected boolean setException(Throwable throwable) {
            return super.setException(throwable);
        }

        @Override
        protected String pendingToString() {
            return MoreObjects.toStringHelper(this).add("clientCall", call).toString();
        }
    }

    /**
     * Responses of a server-streaming call, buffered until the iterating thread takes them. The
     * call's callbacks run on the iterating thread through {@link CallerThreadExecutor}, so the
     * buffer needs no locking.
     * 服务端流调用的响应缓冲，回调都在迭代线程上执行，不需要加锁
     */
    private static final class BlockingResponses<T> implements ResponseIterator<T> {
        private final ClientCall<?, T> call;
        private final CallerThreadExecutor executor;
        private final ArrayDeque<T> buffered = new ArrayDeque<>();
        private final StartableListener<T> listener = new StartableListener<T>() {
            @Override
            void onStart() {
                call.request(1);
            }

            @Override
            public void onMessage(T message) {
                buffered.add(message);
            }

            @Override
            public void onClose(Status status, Metadata trailers) {
                checkState(closeStatus == null, "call already closed");
                closeStatus = status;
                closeTrailers = trailers;
            }
        };
        @Nullable
        private Status closeStatus;
        private Metadata closeTrailers;
        private boolean abandoned;

        BlockingResponses(ClientCall<?, T> call, CallerThreadExecutor executor) {
            this.call = call;
            this.executor = executor;
        }

        @Override
        public boolean hasNext() {
            if (abandoned) {
                return false;
            }
            awaitResponseOrClose();
            if (!buffered.isEmpty()) {
                return true;
            }
            if (!closeStatus.isOk()) {
                // 每次抛出新的异常，带上当前的调用栈
                throw closeStatus.asRuntimeException(closeTrailers);
            }
            return false;
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            T message = buffered.poll();
            if (closeStatus == null) {
                call.request(1);
            }
            return message;
        }

        @Override
        public void remove() {
            throw new UnsupportedOperationException();
        }

        @Override
        public void close() {
            if (abandoned) {
                return;
            }
            abandoned = true;
            buffered.clear();
            if (closeStatus == null) {
                call.cancel("Response iterator closed", null);
            }
        }

        private void awaitResponseOrClose() {
            boolean interrupted = false;
            try {
                while (buffered.isEmpty() && closeStatus == null) {
                    try {
                        executor.awaitAndRun();
                    } catch (InterruptedException e) {
                        interrupted = true;
                        call.cancel("Thread interrupted", e);
                    }
                }
            } finally {
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
        }
    }

    /**
     * Queues the callbacks of a blocking call until the waiting thread runs them.
     * 缓存阻塞调用的回调，由等待结果的线程执行
     */
    private static final class CallerThreadExecutor implements Executor {
        private final BlockingQueue<Runnable> tasks = new LinkedBlockingQueue<>();

        @Override
        public void execute(Runnable task) {
            tasks.add(task);
        }

        /**
         * Waits for at least one task, then runs everything queued.
         */
        void awaitAndRun() throws InterruptedException {
            runFrom(tasks.take());
        }

        void runPending() {
            runFrom(tasks.poll());
        }

        private void runFrom(@Nullable Runnable first) {
            for (Runnable task = first; task != null; task = tasks.poll()) {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    logger.log(Level.WARNING, "Call callback threw", e);
                }
            }
        }
    }
}
