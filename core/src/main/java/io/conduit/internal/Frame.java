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

import com.google.common.base.MoreObjects;
import io.conduit.Codec;
import io.conduit.Compressor;
import io.conduit.Status;

import javax.annotation.concurrent.Immutable;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A length-prefixed message on the wire: a flag byte telling whether the payload is compressed,
 * a 4-byte big-endian payload length, then the payload.
 * 线上传输的带长度前缀的消息：1 字节的压缩标记，4 字节大端序的长度，然后是负载
 */
@Immutable
public final class Frame {

    static final byte UNCOMPRESSED = 0;
    static final byte COMPRESSED = 1;

    private final boolean compressed;
    private final byte[] payload;

    private Frame(boolean compressed, byte[] payload) {
        this.compressed = compressed;
        this.payload = checkNotNull(payload, "payload");
    }

    /**
     * Wraps already encoded payload bytes.
     */
    public static Frame of(boolean compressed, byte[] payload) {
        return new Frame(compressed, payload);
    }

    /**
     * Encode a serialized message. The identity compressor leaves the payload untouched and clears
     * the compressed flag.
     * 编码序列化后的消息，identity 压缩器不修改负载，压缩标记为 0
     */
    public static Frame encode(byte[] message, Compressor compressor) {
        checkNotNull(message, "message");
        if (compressor == Codec.Identity.NONE
                || GrpcUtil.IDENTITY_ENCODING.equals(compressor.getMessageEncoding())) {
            return new Frame(false, message);
        }
        ByteArrayOutputStream compressedBytes = new ByteArrayOutputStream(message.length);
        try {
            OutputStream out = compressor.compress(compressedBytes);
            try {
                out.write(message);
            } finally {
                out.close();
            }
        } catch (IOException e) {
            throw Status.INTERNAL
                    .withDescription("Failed to compress message")
                    .withCause(e)
                    .asRuntimeException();
        }
        return new Frame(true, compressedBytes.toByteArray());
    }

    public boolean isCompressed() {
        return compressed;
    }

    /**
     * The payload as carried on the wire, compressed if {@link #isCompressed()}.
     */
    public byte[] getPayload() {
        return payload;
    }

    /**
     * The wire bytes of this frame, header included.
     * 帧的线上字节，包含帧头
     */
    public byte[] toBytes() {
        ByteBuffer buffer = ByteBuffer.allocate(GrpcUtil.HEADER_LENGTH + payload.length);
        buffer.put(compressed ? COMPRESSED : UNCOMPRESSED);
        buffer.putInt(payload.length);
        buffer.put(payload);
        return buffer.array();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("compressed", compressed)
                .add("length", payload.length)
                .toString();
    }
}
