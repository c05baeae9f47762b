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

import io.conduit.Metadata;
import io.conduit.Status;

import javax.annotation.Nullable;

/**
 * An observer of client-side stream events. Calls are serialized by the transport.
 * 客户端流事件的监听器，调用由 Transport 串行执行
 */
public interface ClientStreamListener {

    /**
     * Called upon receiving all header information from the remote end-point. Note that transports
     * may receive headers at most once.
     * 当接收到远程端点的 header 时调用，最多调用一次
     *
     * @param headers the fully buffered received headers.
     */
    void headersRead(Metadata headers);

    /**
     * Called when a chunk of bytes arrives from the remote end-point. Chunk boundaries carry no
     * meaning; a message may span any number of chunks.
     * 接收到远程端点的字节块，块的边界没有意义，一个消息可能跨多个块
     */
    void dataRead(byte[] data);

    /**
     * Called when the stream is fully closed. This is always the last
     * message sent to the listener.
     * 当流完全关闭时调用，这是发送给监听器的最后一个消息
     *
     * @param status   the transport level status. {@code OK} when the stream ended cleanly.
     *                 Transport 层的状态，正常结束时为 OK
     * @param trailers the received trailers, or {@code null} if the stream ended without them
     *                 接收到的 trailers，如果流没有 trailers 就结束则为 null
     */
    void closed(Status status, @Nullable Metadata trailers);
}
