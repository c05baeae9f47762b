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
 * An observer of server-side stream events.
 * 服务端流事件的监听器
 */
public interface ServerStreamListener {

    /**
     * Called when a chunk of bytes arrives from the client.
     * 接收到客户端发送的字节块
     */
    void dataRead(byte[] data);

    /**
     * Called when the remote side of the transport gracefully closed, indicating the client had no
     * more data to send. No further data will be received on the stream.
     * 当客户端不再发送数据时调用
     */
    void halfClosed();

    /**
     * Called when the stream is fully closed. A status code of {@link
     * io.conduit.Status.Code#OK} implies normal termination of the stream.
     * Any other value implies abnormal termination.
     * 当流完全关闭时调用，OK 表示正常终止，其他的状态都是异常终止
     *
     * @param status details about the remote closure
     */
    void closed(Status status);
}
