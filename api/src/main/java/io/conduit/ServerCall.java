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
 * Encapsulates a single call received from a remote client. Calls may not simply be unary
 * request-response even though this is the most common pattern. Calls may stream any number of
 * requests and responses.
 * 服务端接收到的一次调用，可以是单次请求响应，也可以是任意数量的流式请求和响应
 *
 * <p>Methods are guaranteed to be non-blocking. Not thread-safe except for {@link #request}, which
 * may be called from any thread.
 *
 * @param <ReqT>  parsed type of request message.
 * @param <RespT> parsed type of response message.
 */
public abstract class ServerCall<ReqT, RespT> {

    /**
     * Callbacks for consuming incoming RPC messages.
     * 消费请求消息的回调
     *
     * <p>Any contexts are guaranteed to arrive before any messages, which are guaranteed before
     * half close, which is guaranteed before completion.
     * 回调按照 消息、半关闭、完成 的顺序执行
     */
    public abstract static class Listener<ReqT> {

        /**
         * A request message has been received. For streaming calls, there may be zero or more
         * request messages.
         * 接收到请求消息
         */
        public void onMessage(ReqT message) {
        }

        /**
         * The client completed all message sending. However, the call may still be cancelled.
         * 客户端完成了所有消息的发送，但是调用依然可能被取消
         */
        public void onHalfClose() {
        }

        /**
         * The call was cancelled and the server is encouraged to abort processing to save resources,
         * since the client will not process any further messages. Cancellations can be caused by
         * timeouts, explicit cancellation by the client, network errors, etc.
         * 调用被取消，服务端应当停止处理以节省资源
         *
         * <p>There will be no further callbacks for the call.
         */
        public void onCancel() {
        }

        /**
         * The call is considered complete and {@link #onCancel} is guaranteed not to be called.
         * However, the client is not guaranteed to have received all messages.
         * 调用完成，不会再调用 onCancel
         */
        public void onComplete() {
        }

        /**
         * This indicates that the call may now be capable of sending additional messages.
         */
        public void onReady() {
        }
    }

    /**
     * Requests up to the given number of messages from the call to be delivered to
     * {@link Listener#onMessage(Object)}.
     * 请求指定数量的消息
     */
    public abstract void request(int numMessages);

    /**
     * Send response header metadata prior to sending a response message. This method may only be
     * called once and cannot be called after calls to {@link #sendMessage} or {@link #close}.
     * 在发送响应消息前发送 header，只能调用一次
     */
    public abstract void sendHeaders(Metadata headers);

    /**
     * Send a response message. Messages are the primary form of communication associated with
     * RPCs. Multiple response messages may exist for streaming calls.
     * 发送响应消息
     */
    public abstract void sendMessage(RespT message);

    /**
     * Close the call with the provided status. No further sending or receiving will occur. If
     * {@link Status#isOk} is {@code false}, then the call is said to have failed.
     * 使用指定的状态关闭调用，之后不会再发送或者接收
     *
     * @throws IllegalStateException if call is already {@code close}d
     */
    public abstract void close(Status status, Metadata trailers);

    /**
     * Returns {@code true} when the call is cancelled and the server is encouraged to abort
     * processing to save resources.
     * 调用是否已经被取消
     */
    public abstract boolean isCancelled();

    /**
     * Sets the compression algorithm for this call. This overrides the algorithm negotiated from
     * the client's accepted encodings.
     * 指定响应的压缩方式，覆盖协商结果
     *
     * @param compressor the name of the compressor to use.
     * @throws IllegalArgumentException if the compressor name can not be found.
     */
    public void setCompression(String compressor) {
        // noop
    }

    /**
     * Gets the authority this call is addressed to.
     * 调用请求的 authority
     */
    @Nullable
    public String getAuthority() {
        return null;
    }

    /**
     * The {@link MethodDescriptor} for the call.
     */
    public abstract MethodDescriptor<ReqT, RespT> getMethodDescriptor();
}
