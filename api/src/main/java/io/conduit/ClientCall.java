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

package io.conduit;

import javax.annotation.Nullable;

/**
 * An instance of a call to a remote method. A call will send zero or more request messages to the
 * server and receive zero or more response messages back.
 * 调用远程方法的实例，一次调用会发送零个或多个请求，接收零个或多个响应
 *
 * <p>Every call is terminated by exactly one {@link Listener#onClose} carrying the final
 * {@link Status}. No callback is delivered after {@code onClose}.
 * 每个调用都只会有一次 onClose，在此之后不会再有回调
 *
 * <p>Methods of this class are not thread-safe, except for {@link #request} and {@link #cancel}.
 * 除 request 和 cancel 外，这个类的方法不是线程安全的
 *
 * @param <ReqT>  type of message sent one or more times to the server.
 * @param <RespT> type of message received one or more times from the server.
 */
public abstract class ClientCall<ReqT, RespT> {

    /**
     * Callbacks for receiving metadata, response messages and completion status from the server.
     * 用于接收服务端的元数据、响应和状态的回调
     *
     * <p>Implementations are free to block for extended periods of time. Implementations are not
     * required to be thread-safe, but they must not be thread-hostile. The caller is free to call
     * an instance from multiple threads, but only one call simultaneously.
     */
    public abstract static class Listener<T> {

        /**
         * The response headers have been received. Headers always precede messages.
         * 接收到响应的 header，header 总是先于消息
         */
        public void onHeaders(Metadata headers) {
        }

        /**
         * A response message has been received. May be called zero or more times depending on
         * whether the call response is empty, a single message or a stream of messages.
         * 接收到响应的消息，根据调用类型可能被调用零次或多次
         */
        public void onMessage(T message) {
        }

        /**
         * The {@link ClientCall} has been closed. Any additional calls to the {@code ClientCall}
         * will not be processed by the server. No further receiving will occur and no further
         * notifications will be made.
         * 调用已经关闭，不会再接收消息或者通知
         *
         * @param status   the result of the remote call.
         * @param trailers metadata provided at call completion.
         */
        public void onClose(Status status, Metadata trailers) {
        }

        /**
         * This indicates that the ClientCall may now be capable of sending additional messages
         * without requiring excessive buffering internally.
         */
        public void onReady() {
        }
    }

    /**
     * Start a call, using {@code responseListener} for processing response messages.
     * 开始一次调用，通过 responseListener 处理返回响应
     *
     * <p>It must be called prior to any other method on this class, except for {@link #cancel} which
     * may be called at any time.
     * 必须先于这个类的其他方法调用，除了 cancel 可以在任何时候调用
     *
     * @param responseListener receives response messages
     * @param headers          which can contain extra call metadata, e.g. authentication credentials.
     * @throws IllegalStateException if a method (including {@code start()}) on this class has been
     *                               called.
     */
    public abstract void start(Listener<RespT> responseListener, Metadata headers);

    /**
     * Requests up to the given number of messages from the call to be delivered to
     * {@link Listener#onMessage(Object)}. No additional messages will be delivered.
     * 请求数量不超过要传递到 Listener#onMessage 调用的给定消息数量
     *
     * <p>If called multiple times, the number of messages able to delivered will be the sum of the
     * calls.
     * 如果多次调用，能够传递的消息数量是调用的总和
     *
     * @param numMessages the requested number of messages to be delivered to the listener. Must be
     *                    non-negative.
     */
    public abstract void request(int numMessages);

    /**
     * Prevent any further processing for this {@code ClientCall}. No further messages may be sent or
     * will be received. The server is informed of cancellations, but may not stop processing the
     * call. Cancelling an already {@code cancel()}ed {@code ClientCall} has no effect.
     * 阻止对此 ClientCall 的进一步操作，调用后不会再发送或者接收消息，对已经取消的调用再次取消无效
     *
     * @param message if not {@code null}, will appear as the description of the CANCELLED status
     * @param cause   if not {@code null}, will appear as the cause of the CANCELLED status
     */
    public abstract void cancel(@Nullable String message, @Nullable Throwable cause);

    /**
     * Close the call for request message sending. Incoming response messages are unaffected. This
     * should be called when no more messages will be sent from the client.
     * 关闭请求的消息发送，返回的响应不受影响
     *
     * @throws IllegalStateException if call is already {@code halfClose()}d or {@link #cancel}ed
     */
    public abstract void halfClose();

    /**
     * Send a request message to the server. May be called zero or more times depending on how many
     * messages the server is willing to accept for the operation.
     * 向 server 端发送请求消息
     *
     * @param message message to be sent to the server.
     * @throws IllegalStateException if call is {@link #halfClose}d or explicitly {@link #cancel}ed
     */
    public abstract void sendMessage(ReqT message);

    /**
     * If {@code true}, indicates that the call is capable of sending additional messages
     * without requiring excessive buffering internally.
     */
    public boolean isReady() {
        return true;
    }

    /**
     * Enables per-message compression, if an encoding type has been negotiated. If no message
     * encoding has been negotiated, this is a no-op.
     * 如果协商了编码方式，开启或关闭单条消息的压缩
     */
    public void setMessageCompression(boolean enabled) {
        // noop
    }
}
