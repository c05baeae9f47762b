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

import io.conduit.CallOptions;
import io.conduit.Metadata;
import io.conduit.MethodDescriptor;
import io.conduit.Status;

import javax.annotation.CheckReturnValue;
import javax.annotation.concurrent.ThreadSafe;

/**
 * The client-side transport typically encapsulating a single connection to a remote
 * server. However, streams created before the client has discovered any server address may
 * eventually be issued on different connections.  All methods on the transport and its listener
 * are expected to execute quickly.
 * 客户端的 Transport，通常封装了一个到服务端的连接，所有的方法都应当快速执行
 *
 * <p>The transport carries bytes only. Framing, compression and status mapping happen above it.
 * Transport 只传输字节，分帧、压缩和状态转换在上层处理
 */
@ThreadSafe
public interface ClientTransport {

    /**
     * Starts transport. This method may only be called once.
     * 启动 Transport，只能调用一次
     *
     * <p>Implementations must not call {@code listener} from within {@link #start}; implementations
     * are expected to notify listener on a separate thread or when the returned {@link Runnable} is
     * run. This method and the returned {@code Runnable} should not throw any exceptions.
     * 不能在 start 方法内调用 listener，应当在返回的 Runnable 执行时通知
     *
     * @param listener non-{@code null} listener of transport events
     * @return a {@link Runnable} that is executed after-the-fact by the original caller, typically
     *         after locks are released
     */
    @CheckReturnValue
    Runnable start(Listener listener);

    /**
     * Creates a new stream for sending messages to a remote end-point.
     * 创建一个新的流，用于向远程端点发送消息
     *
     * <p>This method returns immediately and does not wait for any validation of the request. If
     * creation fails for any reason, {@link ClientStreamListener#closed} will be called to provide
     * the error information. Any sent messages for this stream will be buffered until creation has
     * completed (either successfully or unsuccessfully).
     * 方法会立即返回，如果创建失败，会通过 ClientStreamListener#closed 通知错误
     *
     * @param method      the descriptor of the remote method to be called for this stream.
     * @param headers     to send at the beginning of the call
     * @param callOptions runtime options of the call
     * @return the newly created stream.
     */
    ClientStream newStream(MethodDescriptor<?, ?> method, Metadata headers, CallOptions callOptions);

    /**
     * Initiates an orderly shutdown of the transport. Existing streams continue, but the transport
     * will not own any new streams. New streams fail with the given reason.
     * 有序关闭 Transport，已经存在的流继续执行，新的流会失败
     */
    void shutdown(Status reason);

    /**
     * Initiates a forceful shutdown in which preexisting and new calls are closed. Existing calls
     * should be closed with the provided {@code reason}.
     * 强制关闭，已经存在的流和新的流都会以指定的原因关闭
     */
    void shutdownNow(Status reason);

    /**
     * The message encodings the peer at the other end of this connection advertised it can
     * decode. Learned from response headers and used by later calls on the same connection.
     * 对端声明的可以解码的编码方式，从响应 header 中获取
     */
    AdvertisedEncodings getAdvertisedEncodings();

    /**
     * Receives notifications for the transport life-cycle events. Implementation does not need to be
     * thread-safe, so notifications must be properly synchronized externally.
     * Transport 生命周期事件的监听器
     */
    interface Listener {
        /**
         * The transport is ready to accept traffic, because the connection is established. This is
         * called at most once.
         * Transport 已经可以接收请求，最多调用一次
         */
        void transportReady();

        /**
         * The transport is shutting down. This transport will stop owning new streams, but existing
         * streams may continue. This is called at most once, and may be called without a prior
         * {@link #transportReady} when the connection could not be established.
         * Transport 正在关闭，不会再创建新的流，在连接建立失败时可能不经过 transportReady 直接调用
         *
         * @param s the reason for the shutdown.
         */
        void transportShutdown(Status s);

        /**
         * The transport completed shutting down. All resources have been released. All streams have
         * either been closed or transferred off this transport.
         * Transport 已经终止，所有的资源都已经释放
         */
        void transportTerminated();
    }
}
