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

import io.conduit.Status;

/**
 * Extension of a byte stream for the client-side of a call. Bytes written are already framed;
 * the stream only moves them.
 * 客户端的流，写入的字节已经是分好帧的，流只负责传输
 */
public interface ClientStream {

    /**
     * Starts stream. This method may only be called once.  It is safe to do latent initialization of
     * the stream up until {@link #start} is called.
     * 开始一个流，这个方法只能被调用一次
     *
     * @param listener non-{@code null} listener of stream events
     */
    void start(ClientStreamListener listener);

    /**
     * Writes a chunk of framed bytes to the remote end-point.
     * 向远程端点写入分帧后的字节
     */
    void writeData(byte[] data);

    /**
     * Closes the local side of this stream and flushes any remaining messages. After this is called,
     * no further messages may be sent on this stream, but additional messages may be received until
     * the remote end-point is closed. This method may only be called once, and only after
     * {@link #start}.
     * 关闭本地端的流，之后不能再发送消息，但是依然可以接收消息直到远程端点关闭
     */
    void halfClose();

    /**
     * Abnormally terminates the stream. After calling this method, no further messages will be
     * sent or received, however it may still be possible to receive buffered messages read prior
     * to cancellation. May only be called after {@link #start}. Multiple cancellations are
     * allowed.
     * 异常终止流，之后不会再发送或接收消息，可以多次调用
     *
     * @param reason must be non-OK
     */
    void cancel(Status reason);
}
