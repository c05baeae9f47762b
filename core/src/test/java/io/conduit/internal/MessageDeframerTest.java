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
import io.conduit.Status;
import io.conduit.StatusRuntimeException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageDeframerTest {

    private final RecordingListener listener = new RecordingListener();

    @Test
    void emptyMessageIsHeaderOnly() {
        byte[] wire = Frame.encode(new byte[0], Codec.Identity.NONE).toBytes();
        assertArrayEquals(new byte[]{0, 0, 0, 0, 0}, wire);

        MessageDeframer deframer = new MessageDeframer(listener, 100);
        deframer.request(1);
        deframer.deframe(wire);

        assertEquals(1, listener.messages.size());
        assertEquals(0, listener.messages.get(0).length);
    }

    @Test
    void headerIsFlagThenBigEndianLength() {
        byte[] payload = new byte[258];
        byte[] wire = Frame.encode(payload, Codec.Identity.NONE).toBytes();

        assertEquals(5 + 258, wire.length);
        assertEquals(0, wire[0]);
        assertEquals(0, wire[1]);
        assertEquals(0, wire[2]);
        assertEquals(1, wire[3]);
        assertEquals(2, wire[4]);
    }

    @Test
    void deliveryIndependentOfChunkSize() {
        List<byte[]> payloads = Arrays.asList(
                new byte[0],
                "a".getBytes(StandardCharsets.UTF_8),
                patterned(1000),
                "tail".getBytes(StandardCharsets.UTF_8));
        byte[] wire = frameAll(payloads, Codec.Identity.NONE);

        for (int chunkSize = 1; chunkSize <= wire.length; chunkSize = chunkSize < 16 ? chunkSize + 1 : chunkSize * 3) {
            RecordingListener recorder = new RecordingListener();
            MessageDeframer deframer = new MessageDeframer(recorder, 2000);
            deframer.request(payloads.size());
            for (int offset = 0; offset < wire.length; offset += chunkSize) {
                deframer.deframe(Arrays.copyOfRange(wire, offset, Math.min(wire.length, offset + chunkSize)));
            }
            assertNull(recorder.failure, "chunk size " + chunkSize);
            assertEquals(payloads.size(), recorder.messages.size(), "chunk size " + chunkSize);
            for (int i = 0; i < payloads.size(); i++) {
                assertArrayEquals(payloads.get(i), recorder.messages.get(i), "chunk size " + chunkSize);
            }
        }
    }

    @Test
    void deliversOnlyRequestedMessages() {
        byte[] wire = frameAll(Arrays.asList(patterned(3), patterned(4)), Codec.Identity.NONE);
        MessageDeframer deframer = new MessageDeframer(listener, 100);

        deframer.deframe(wire);
        assertTrue(listener.messages.isEmpty());

        deframer.request(1);
        assertEquals(1, listener.messages.size());

        deframer.request(1);
        assertEquals(2, listener.messages.size());
        assertArrayEquals(patterned(4), listener.messages.get(1));
    }

    @Test
    void messageAtMaximumSizeIsAccepted() {
        MessageDeframer deframer = new MessageDeframer(listener, 64);
        deframer.request(1);
        deframer.deframe(Frame.encode(patterned(64), Codec.Identity.NONE).toBytes());

        assertNull(listener.failure);
        assertEquals(1, listener.messages.size());
    }

    @Test
    void messageOverMaximumSizeFailsBeforeBodyArrives() {
        MessageDeframer deframer = new MessageDeframer(listener, 64);
        deframer.request(1);
        byte[] wire = Frame.encode(patterned(65), Codec.Identity.NONE).toBytes();
        // 只发送帧头
        deframer.deframe(Arrays.copyOf(wire, 5));

        assertEquals(Status.Code.RESOURCE_EXHAUSTED, statusOf(listener.failure).getCode());
        assertTrue(deframer.isClosed());
        assertTrue(listener.messages.isEmpty());
    }

    @Test
    void reservedFlagBitsAreRejected() {
        MessageDeframer deframer = new MessageDeframer(listener, 64);
        deframer.request(1);
        deframer.deframe(new byte[]{2, 0, 0, 0, 0});

        assertEquals(Status.Code.INTERNAL, statusOf(listener.failure).getCode());
    }

    @Test
    void compressedFrameWithoutDecompressorFails() {
        MessageDeframer deframer = new MessageDeframer(listener, 1000);
        deframer.request(1);
        deframer.deframe(Frame.encode(patterned(10), new Codec.Gzip()).toBytes());

        assertEquals(Status.Code.INTERNAL, statusOf(listener.failure).getCode());
    }

    @Test
    void gzipFramesRoundTrip() {
        byte[] payload = patterned(500);
        byte[] wire = frameAll(Arrays.asList(payload), new Codec.Gzip());
        assertEquals(Frame.COMPRESSED, wire[0]);

        MessageDeframer deframer = new MessageDeframer(listener, 1000);
        deframer.setDecompressor(new Codec.Gzip());
        deframer.request(1);
        deframer.deframe(wire);

        assertArrayEquals(payload, listener.messages.get(0));
    }

    @Test
    void decompressedSizeIsLimited() {
        // 压缩后很小，解压后超过限制
        byte[] wire = Frame.encode(new byte[10_000], new Codec.Gzip()).toBytes();
        MessageDeframer deframer = new MessageDeframer(listener, 1000);
        deframer.setDecompressor(new Codec.Gzip());
        deframer.request(1);
        deframer.deframe(wire);

        assertEquals(Status.Code.RESOURCE_EXHAUSTED, statusOf(listener.failure).getCode());
    }

    @Test
    void closeWhenCompleteReportsPartialMessage() {
        byte[] wire = Frame.encode(patterned(20), Codec.Identity.NONE).toBytes();
        MessageDeframer deframer = new MessageDeframer(listener, 100);
        deframer.request(1);
        deframer.deframe(Arrays.copyOf(wire, 10));
        deframer.closeWhenComplete();

        assertEquals(Boolean.TRUE, listener.closedWithPartialMessage);
    }

    @Test
    void closeWhenCompleteAfterWholeMessages() {
        MessageDeframer deframer = new MessageDeframer(listener, 100);
        deframer.request(1);
        deframer.deframe(Frame.encode(patterned(20), Codec.Identity.NONE).toBytes());
        deframer.closeWhenComplete();

        assertEquals(Boolean.FALSE, listener.closedWithPartialMessage);
        assertEquals(1, listener.messages.size());
    }

    @Test
    void framerEnforcesOutboundLimit() {
        final List<byte[]> sunk = new ArrayList<>();
        MessageFramer framer = new MessageFramer(new MessageFramer.Sink() {
            @Override
            public void deliverFrame(byte[] frame) {
                sunk.add(frame);
            }
        });
        framer.setMaxOutboundMessageSize(8);
        framer.writePayload(new ByteArrayInputStream(patterned(8)));
        StatusRuntimeException e = null;
        try {
            framer.writePayload(new ByteArrayInputStream(patterned(9)));
        } catch (StatusRuntimeException ex) {
            e = ex;
        }
        assertEquals(Status.Code.RESOURCE_EXHAUSTED, e.getStatus().getCode());
        framer.close();
        assertEquals(1, sunk.size());
        assertTrue(framer.isClosed());
    }

    private static Status statusOf(Throwable t) {
        assertInstanceOf(StatusRuntimeException.class, t);
        return ((StatusRuntimeException) t).getStatus();
    }

    private static byte[] patterned(int length) {
        byte[] bytes = new byte[length];
        for (int i = 0; i < length; i++) {
            bytes[i] = (byte) (i * 31 + 7);
        }
        return bytes;
    }

    private static byte[] frameAll(List<byte[]> payloads, Codec codec) {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        MessageFramer framer = new MessageFramer(new MessageFramer.Sink() {
            @Override
            public void deliverFrame(byte[] frame) {
                out.write(frame, 0, frame.length);
            }
        });
        framer.setCompressor(codec);
        for (byte[] payload : payloads) {
            framer.writePayload(new ByteArrayInputStream(payload));
        }
        framer.close();
        return out.toByteArray();
    }

    private static final class RecordingListener implements MessageDeframer.Listener {
        final List<byte[]> messages = new ArrayList<>();
        Throwable failure;
        Boolean closedWithPartialMessage;

        @Override
        public void messageRead(InputStream message) {
            try {
                messages.add(ByteStreams.toByteArray(message));
            } catch (IOException e) {
                throw new AssertionError(e);
            }
        }

        @Override
        public void deframerClosed(boolean hasPartialMessage) {
            closedWithPartialMessage = hasPartialMessage;
        }

        @Override
        public void deframeFailed(Throwable cause) {
            failure = cause;
        }
    }
}
