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

/**
 * Receives notifications from an observable stream of messages.
 * 从可观察的消息流中获取通知
 *
 * <p>Used by client callers and by service implementations for all call shapes, unary
 * included. Outgoing observers are provided by the library; incoming observers are implemented
 * by the application.
 * 客户端调用和服务端实现都使用它收发消息，出站的由库提供，入站的由应用实现
 *
 * <p>Implementations are not required to be thread-safe. The incoming and outgoing directions are
 * independent; if several threads write to one observer, the application must synchronize them.
 */
public interface StreamObserver<V> {

    /**
     * Receives a value from the stream. Never called after {@link #onError(Throwable)} or
     * {@link #onCompleted()}.
     * 从流中接收值，可以多次调用，但在 onError 或 onCompleted 之后不会再调用
     */
    void onNext(V value);

    /**
     * Receives a terminating error from the stream. Called at most once and always last.
     * 接收终止错误，只会调用一次，并且是最后一次调用
     *
     * <p>{@code t} is usually a {@link io.conduit.StatusRuntimeException}; convert it with
     * {@link io.conduit.Status#fromThrowable(Throwable)}.
     */
    void onError(Throwable t);

    /**
     * Receives a notification of successful stream completion. Called at most once and always
     * last.
     * 流成功完成的通知
     */
    void onCompleted();
}
