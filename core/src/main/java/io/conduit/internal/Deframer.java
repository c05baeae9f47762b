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

import io.conduit.Decompressor;

/**
 * Interface for deframing messages.
 * 消息解帧器
 */
public interface Deframer {

    /**
     * 设置最大可接收消息大小
     *
     * @param messageSize 消息大小
     */
    void setMaxInboundMessageSize(int messageSize);

    /**
     * Sets the decompressor available to use. The message encoding for the stream comes later in
     * time, and thus will not be available at the time of construction.
     * 设置可用的解压缩器，流的编码会在 header 中出现，所以构造时不可用
     *
     * @param decompressor the decompressing wrapper.
     */
    void setDecompressor(Decompressor decompressor);

    /**
     * Requests up to the given number of messages from the call. No additional messages will be
     * delivered.
     * 请求给定数量的消息，不会传递更多的消息
     *
     * <p>If {@link #close()} has been called, this method will have no effect.
     *
     * @param numMessages the requested number of messages to be delivered to the listener.
     */
    void request(int numMessages);

    /**
     * Adds the given data to this deframer and attempts delivery to the listener.
     * 将给定的数据添加到解帧器中，尝试传递给监听器
     *
     * @param data the raw data read from the remote endpoint. Must be non-null.
     */
    void deframe(byte[] data);

    /**
     * Close when any messages currently queued have been requested and delivered.
     * 当队列中的消息都已经请求并传递后关闭
     */
    void closeWhenComplete();

    /**
     * Closes this deframer and frees any resources. After this method is called, additional calls
     * will have no effect.
     * 关闭这个解帧器，并释放资源，之后的调用不会生效
     */
    void close();
}
