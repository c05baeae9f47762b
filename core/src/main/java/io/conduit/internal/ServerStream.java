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

/**
 * Extension of a byte stream for the server-side of a call.
 * 服务端的流
 */
public interface ServerStream {

    /**
     * Sets the server stream listener. Called before any bytes are delivered.
     * 设置服务端流监听器，在传递任何字节之前调用
     */
    void setListener(ServerStreamListener listener);

    /**
     * Writes custom metadata as headers on the response stream sent to the client. This method may
     * only be called once and cannot be called after calls to {@link #writeData} or {@link #close}.
     * 将 header 写入发送给客户端的响应流，只能调用一次
     *
     * @param headers to send to client.
     */
    void writeHeaders(Metadata headers);

    /**
     * Writes a chunk of framed bytes to the client.
     * 向客户端写入分帧后的字节
     */
    void writeData(byte[] data);

    /**
     * Closes the stream for both reading and writing. The trailers carry the status of the call.
     * 关闭流的读和写，trailers 中包含调用的状态
     *
     * @param trailers an additional block of metadata to pass to the client on stream closure.
     */
    void close(Metadata trailers);

    /**
     * Tears down the stream, typically in the event of a timeout. This method may be called multiple
     * times and from any thread.
     * 终止流，通常是在超时时，可以在任意线程多次调用
     */
    void cancel(Status status);

    /**
     * The authority of the stream, as sent by the client.
     */
    String getAuthority();
}
