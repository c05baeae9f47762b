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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.ByteStreams;
import io.conduit.Codec;
import io.conduit.Decompressor;
import io.conduit.Status;

import javax.annotation.concurrent.NotThreadSafe;
import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayDeque;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Deframer for messages. Bytes arrive in chunks of any size through {@link #deframe}; complete
 * messages are handed to the {@link Listener} as they are requested through {@link #request}.
 * 消息解帧器，字节以任意大小的块通过 deframe 传入，完整的消息在被 request 后交给 Listener
 *
 * <p>The decoder is a two-state machine: read the 5-byte header, then read exactly the number of
 * payload bytes the header declared. It never waits for more bytes than that.
 * 解码是两个状态的状态机：读取 5 字节的帧头，然后读取帧头中声明长度的负载，不会等待更多的字节
 *
 * <p>Calls must be serialized by the owner.
 */
@NotThreadSafe
public class MessageDeframer implements Deframer {

    private static final int RESERVED_MASK = 0xFE;
    private static final int COMPRESSED_FLAG_MASK = 1;

    /**
     * A listener of deframing events. These methods will be invoked from the deframing thread.
     * 解帧事件的监听器
     */
    public interface Listener {

        /**
         * Called to deliver the next complete message.
         * 传递下一个完整的消息
         *
         * @param message the decoded, uncompressed message
         */
        void messageRead(InputStream message);

        /**
         * Called when the deframer closes.
         * 解帧器关闭时调用
         *
         * @param hasPartialMessage whether the deframer contained an incomplete message at closing.
         */
        void deframerClosed(boolean hasPartialMessage);

        /**
         * Called when a {@link #deframe(byte[])} operation failed. The deframer is closed and no
         * further callback follows.
         * 解帧失败时调用，解帧器已经关闭，之后不会有回调
         *
         * @param cause the actual failure
         */
        void deframeFailed(Throwable cause);
    }

    private enum State {
        HEADER, BODY
    }

    private final Listener listener;
    private int maxInboundMessageSize;
    private Decompressor decompressor = Codec.Identity.NONE;
    private State state = State.HEADER;
    private int requiredLength = GrpcUtil.HEADER_LENGTH;
    private boolean compressedFlag;

    // 当前帧已经读取的字节
    private byte[] nextFrame;
    private int nextFrameFilled;

    // 尚未处理的字节块
    private ArrayDeque<byte[]> unprocessed = new ArrayDeque<>();
    private int headOffset;
    private int unprocessedBytes;

    private long pendingDeliveries;
    private boolean inDelivery;
    private boolean closeWhenComplete;

    /**
     * Create a deframer.
     *
     * @param listener       listener for deframer events.
     * @param maxMessageSize the maximum allowed size for received messages.
     */
    public MessageDeframer(Listener listener, int maxMessageSize) {
        this.listener = checkNotNull(listener, "sink");
        this.maxInboundMessageSize = maxMessageSize;
    }

    @Override
    public void setMaxInboundMessageSize(int messageSize) {
        maxInboundMessageSize = messageSize;
    }

    @Override
    public void setDecompressor(Decompressor decompressor) {
        this.decompressor = checkNotNull(decompressor, "Can't pass an empty decompressor");
    }

    @Override
    public void request(int numMessages) {
        checkArgument(numMessages > 0, "numMessages must be > 0");
        if (isClosed()) {
            return;
        }
        pendingDeliveries += numMessages;
        deliverSafely();
    }

    @Override
    public void deframe(byte[] data) {
        checkNotNull(data, "data");
        if (isClosedOrScheduledToClose()) {
            return;
        }
        if (data.length > 0) {
            unprocessed.add(data);
            unprocessedBytes += data.length;
        }
        deliverSafely();
    }

    @Override
    public void closeWhenComplete() {
        if (isClosed()) {
            return;
        } else if (isStalled()) {
            close();
        } else {
            closeWhenComplete = true;
        }
    }

    /**
     * Closes this deframer and frees any resources. After this method is called, additional
     * calls will have no effect.
     */
    @Override
    public void close() {
        if (isClosed()) {
            return;
        }
        boolean hasPartialMessage = hasPartialMessage();
        release();
        listener.deframerClosed(hasPartialMessage);
    }

    /**
     * Indicates whether or not this deframer has been closed.
     */
    public boolean isClosed() {
        return unprocessed == null;
    }

    /**
     * Returns true if this deframer has already been closed or scheduled to close.
     */
    private boolean isClosedOrScheduledToClose() {
        return isClosed() || closeWhenComplete;
    }

    private boolean isStalled() {
        return unprocessedBytes == 0;
    }

    @VisibleForTesting
    boolean hasPartialMessage() {
        return state == State.BODY || nextFrameFilled > 0 || unprocessedBytes > 0;
    }

    private void release() {
        unprocessed = null;
        nextFrame = null;
        nextFrameFilled = 0;
        unprocessedBytes = 0;
    }

    private void deliverSafely() {
        try {
            deliver();
        } catch (Throwable t) {
            release();
            listener.deframeFailed(t);
        }
    }

    /**
     * Reads and delivers as many messages to the listener as possible.
     * 读取并传递尽可能多的消息
     */
    private void deliver() {
        // We can have reentrancy here when using a direct executor, triggered by calls to
        // request more messages. This is safe as we simply loop until pendingDelivers = 0
        if (inDelivery) {
            return;
        }
        inDelivery = true;
        try {
            // Process the uncompressed bytes.
            while (!isClosed() && pendingDeliveries > 0 && readRequiredBytes()) {
                switch (state) {
                    case HEADER:
                        processHeader();
                        break;
                    case BODY:
                        // Read the body and deliver the message.
                        processBody();

                        // Since we've delivered a message, decrement the number of pending
                        // deliveries remaining.
                        pendingDeliveries--;
                        break;
                    default:
                        throw new AssertionError("Invalid state: " + state);
                }
            }

            if (isClosed()) {
                return;
            }

            /*
             * We are stalled when there are no more bytes to process. This allows delivering errors as
             * soon as the buffered input has been consumed, independent of whether the application
             * has requested another message.  At this point in the function, either all frames have been
             * delivered, or unprocessed is empty.  If there is a partial message, it will be inside next
             * frame and not in unprocessed.  If there is extra data but no pending deliveries, it will
             * be in unprocessed.
             */
            if (closeWhenComplete && isStalled()) {
                close();
            }
        } finally {
            inDelivery = false;
        }
    }

    /**
     * Attempts to read the required bytes into nextFrame.
     * 尝试将需要的字节读取到 nextFrame 中
     *
     * @return {@code true} if all of the required bytes have been read.
     */
    private boolean readRequiredBytes() {
        if (nextFrame == null) {
            nextFrame = new byte[requiredLength];
            nextFrameFilled = 0;
        }
        int missingBytes;
        while ((missingBytes = requiredLength - nextFrameFilled) > 0) {
            if (unprocessedBytes == 0) {
                // No more data is available.
                return false;
            }
            byte[] head = unprocessed.peek();
            int toRead = Math.min(missingBytes, head.length - headOffset);
            System.arraycopy(head, headOffset, nextFrame, nextFrameFilled, toRead);
            nextFrameFilled += toRead;
            headOffset += toRead;
            unprocessedBytes -= toRead;
            if (headOffset == head.length) {
                unprocessed.poll();
                headOffset = 0;
            }
        }
        return true;
    }

    /**
     * Processes the message header.
     * 处理帧头
     */
    private void processHeader() {
        int type = nextFrame[0] & 0xFF;
        if ((type & RESERVED_MASK) != 0) {
            throw Status.INTERNAL
                    .withDescription("gRPC frame header malformed: reserved bits not zero")
                    .asRuntimeException();
        }
        compressedFlag = (type & COMPRESSED_FLAG_MASK) != 0;

        // Update the required length to include the length of the frame.
        long length = ((nextFrame[1] & 0xFFL) << 24)
                | ((nextFrame[2] & 0xFFL) << 16)
                | ((nextFrame[3] & 0xFFL) << 8)
                | (nextFrame[4] & 0xFFL);
        // 在分配缓冲之前校验大小
        if (length > maxInboundMessageSize) {
            throw Status.RESOURCE_EXHAUSTED
                    .withDescription(String.format("gRPC message exceeds maximum size %d: %d",
                            maxInboundMessageSize, length))
                    .asRuntimeException();
        }
        requiredLength = (int) length;

        // Continue reading the frame body.
        state = State.BODY;
        nextFrame = null;
        nextFrameFilled = 0;
    }

    /**
     * Processes the body of the message. If the body is compressed, it is decompressed
     * before delivery.
     * 处理消息体，如果是压缩的，则先解压
     */
    private void processBody() {
        byte[] payload = nextFrame;
        nextFrame = null;
        nextFrameFilled = 0;
        InputStream stream = compressedFlag ? getCompressedBody(payload) : new ByteArrayInputStream(payload);

        // Done with this frame, begin processing the next header.
        state = State.HEADER;
        requiredLength = GrpcUtil.HEADER_LENGTH;
        listener.messageRead(stream);
    }

    private InputStream getCompressedBody(byte[] payload) {
        if (decompressor == Codec.Identity.NONE) {
            throw Status.INTERNAL
                    .withDescription("Can't decode compressed gRPC message as compression not configured")
                    .asRuntimeException();
        }
        try {
            // Enforce the maxMessageSize limit on the returned stream.
            InputStream unlimitedStream = decompressor.decompress(new ByteArrayInputStream(payload));
            return new ByteArrayInputStream(ByteStreams.toByteArray(
                    new SizeEnforcingInputStream(unlimitedStream, maxInboundMessageSize)));
        } catch (IOException e) {
            throw Status.INTERNAL
                    .withDescription("Failed to decompress message")
                    .withCause(e)
                    .asRuntimeException();
        }
    }

    /**
     * An {@link InputStream} that enforces the {@link #maxMessageSize} limit for compressed frames.
     * 限制解压后大小的输入流，超出限制时立即失败，不会缓冲超出部分
     */
    @VisibleForTesting
    static final class SizeEnforcingInputStream extends FilterInputStream {

        private final int maxMessageSize;
        private long count;
        private long mark = -1;

        SizeEnforcingInputStream(InputStream in, int maxMessageSize) {
            super(in);
            this.maxMessageSize = maxMessageSize;
        }

        @Override
        public int read() throws IOException {
            int result = in.read();
            if (result != -1) {
                count++;
            }
            verifySize();
            return result;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            int result = in.read(b, off, len);
            if (result != -1) {
                count += result;
            }
            verifySize();
            return result;
        }

        @Override
        public long skip(long n) throws IOException {
            long result = in.skip(n);
            count += result;
            verifySize();
            return result;
        }

        @Override
        public synchronized void mark(int readlimit) {
            in.mark(readlimit);
            mark = count;
        }

        @Override
        public synchronized void reset() throws IOException {
            if (!in.markSupported()) {
                throw new IOException("Mark not supported");
            }
            if (mark == -1) {
                throw new IOException("Mark not set");
            }

            in.reset();
            count = mark;
        }

        private void verifySize() {
            if (count > maxMessageSize) {
                throw Status.RESOURCE_EXHAUSTED
                        .withDescription(String.format(
                                "Decompressed gRPC message exceeds maximum size %d", maxMessageSize))
                        .asRuntimeException();
            }
        }
    }
}
