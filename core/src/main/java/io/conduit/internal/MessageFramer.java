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

import com.google.common.io.ByteStreams;
import io.conduit.Codec;
import io.conduit.Compressor;
import io.conduit.Status;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Encodes messages into frames and hands the framed bytes to a {@link Sink}. Frames are buffered
 * until {@link #flush()}.
 * 将消息编码为帧，并交给 Sink，帧在 flush 前会被缓冲
 */
public class MessageFramer implements Framer {

    /**
     * Sink implemented by the transport layer to receive frames and forward them to their
     * destination.
     * 由 Transport 层实现，用于接收帧并转发
     */
    public interface Sink {
        /**
         * Delivers framed bytes to the transport.
         */
        void deliverFrame(byte[] frame);
    }

    private final Sink sink;
    private final List<byte[]> buffered = new ArrayList<>();
    private Compressor compressor = Codec.Identity.NONE;
    private boolean messageCompression = true;
    private int maxOutboundMessageSize = -1;
    private boolean closed;

    /**
     * Creates a {@code MessageFramer}.
     *
     * @param sink the sink used to deliver frames to the transport
     */
    public MessageFramer(Sink sink) {
        this.sink = checkNotNull(sink, "sink");
    }

    @Override
    public MessageFramer setCompressor(Compressor compressor) {
        this.compressor = checkNotNull(compressor, "Can't pass an empty compressor");
        return this;
    }

    @Override
    public MessageFramer setMessageCompression(boolean enable) {
        messageCompression = enable;
        return this;
    }

    @Override
    public void setMaxOutboundMessageSize(int maxSize) {
        checkState(maxOutboundMessageSize == -1, "max size already set");
        maxOutboundMessageSize = maxSize;
    }

    /**
     * Writes out a payload message.
     * 写入消息负载
     *
     * @param message contains the message to be written out. It will be completely consumed.
     */
    @Override
    public void writePayload(InputStream message) {
        verifyNotClosed();
        byte[] bytes;
        try {
            bytes = ByteStreams.toByteArray(message);
        } catch (IOException e) {
            throw Status.INTERNAL
                    .withDescription("Failed to frame message")
                    .withCause(e)
                    .asRuntimeException();
        } finally {
            GrpcUtil.closeQuietly(message);
        }
        // 大小限制作用于未压缩的消息
        if (maxOutboundMessageSize >= 0 && bytes.length > maxOutboundMessageSize) {
            throw Status.RESOURCE_EXHAUSTED
                    .withDescription(String.format("message too large %d > %d", bytes.length,
                            maxOutboundMessageSize))
                    .asRuntimeException();
        }
        Compressor effective = messageCompression ? compressor : Codec.Identity.NONE;
        buffered.add(Frame.encode(bytes, effective).toBytes());
    }

    /**
     * Flushes any buffered data in the framer to the sink.
     * 将缓冲的帧发送给 sink
     */
    @Override
    public void flush() {
        if (buffered.isEmpty()) {
            return;
        }
        if (buffered.size() == 1) {
            sink.deliverFrame(buffered.get(0));
        } else {
            ByteArrayOutputStream joined = new ByteArrayOutputStream();
            for (byte[] frame : buffered) {
                joined.write(frame, 0, frame.length);
            }
            sink.deliverFrame(joined.toByteArray());
        }
        buffered.clear();
    }

    /**
     * Indicates whether or not this framer has been closed via a call to either
     * {@link #close()}.
     */
    @Override
    public boolean isClosed() {
        return closed;
    }

    /**
     * Flushes and closes the framer and releases any buffers. After the framer is closed or
     * disposed, additional calls to this method will have no affect.
     * 发送缓冲的帧并关闭
     */
    @Override
    public void close() {
        if (!isClosed()) {
            closed = true;
            flush();
        }
    }

    private void verifyNotClosed() {
        checkState(!isClosed(), "Framer already closed");
    }
}
