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
import com.google.common.base.Splitter;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.conduit.Metadata;
import io.conduit.MethodDescriptor;
import io.conduit.Status;

import javax.annotation.Nullable;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Common utilities for the wire protocol: header names, content type, timeout and status encoding.
 * 协议相关的通用工具，包括 header 名称、内容类型、超时和状态的编码
 */
public final class GrpcUtil {

    private static final Logger log = Logger.getLogger(GrpcUtil.class.getName());

    /**
     * The path of the method, {@code /service/method}.
     */
    public static final String PATH_KEY = ":path";

    /**
     * The authority the call is addressed to.
     */
    public static final String AUTHORITY_KEY = ":authority";

    /**
     * Content-Type used for GRPC-over-HTTP/2.
     */
    public static final String CONTENT_TYPE_KEY = "content-type";

    /**
     * The encoding of the messages on this stream.
     * 流中消息的编码方式
     */
    public static final String MESSAGE_ENCODING_KEY = "grpc-encoding";

    /**
     * The accepted message encodings (i.e. compression) that can be used in the stream.
     * 流可以接受的消息编码方式
     */
    public static final String MESSAGE_ACCEPT_ENCODING_KEY = "grpc-accept-encoding";

    /**
     * The timeout header name.
     * 超时 header 的名称
     */
    public static final String TIMEOUT_KEY = "grpc-timeout";

    /**
     * The status code of the call, carried in trailers.
     */
    public static final String STATUS_KEY = "grpc-status";

    /**
     * The percent-encoded status message, carried in trailers.
     */
    public static final String MESSAGE_KEY = "grpc-message";

    /**
     * Opaque status details, base64 encoded, carried in trailers.
     */
    public static final String STATUS_DETAILS_KEY = "grpc-status-details-bin";

    /**
     * The user agent of the client.
     */
    public static final String USER_AGENT_KEY = "user-agent";

    /**
     * Content-Type used for GRPC-over-HTTP/2.
     */
    public static final String CONTENT_TYPE_GRPC = "application/grpc";

    /**
     * The identity encoding, accepted by every peer.
     * 不压缩的编码，所有对端都支持
     */
    public static final String IDENTITY_ENCODING = "identity";

    /**
     * The default maximum uncompressed size (in bytes) for inbound messages. Defaults to 4 MiB.
     * 默认接收的最大消息，4M
     */
    public static final int DEFAULT_MAX_MESSAGE_SIZE = 4 * 1024 * 1024;

    /**
     * The length of the frame header: one flag byte and a 4-byte big-endian length.
     * 帧头的长度，1 字节的标记和 4 字节大端序的长度
     */
    public static final int HEADER_LENGTH = 5;

    public static final Splitter ACCEPT_ENCODING_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private static final String IMPLEMENTATION_VERSION = "0.1.0";

    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private GrpcUtil() {
    }

    /**
     * Returns the content type for the given subtype, {@code application/grpc} when there is none.
     * 根据子类型返回 content-type
     */
    public static String contentType(@Nullable String subtype) {
        if (subtype == null || subtype.isEmpty()) {
            return CONTENT_TYPE_GRPC;
        }
        return CONTENT_TYPE_GRPC + "+" + subtype;
    }

    /**
     * Indicates whether or not the given value is a valid gRPC content-type.
     * 判断是否是有效的 content-type
     */
    public static boolean isGrpcContentType(@Nullable String contentType) {
        if (contentType == null) {
            return false;
        }
        if (CONTENT_TYPE_GRPC.length() > contentType.length()) {
            return false;
        }
        contentType = contentType.toLowerCase();
        if (!contentType.startsWith(CONTENT_TYPE_GRPC)) {
            return false;
        }
        if (contentType.length() == CONTENT_TYPE_GRPC.length()) {
            return true;
        }
        char nextChar = contentType.charAt(CONTENT_TYPE_GRPC.length());
        return nextChar == '+' || nextChar == ';';
    }

    /**
     * The {@code :path} value of a method.
     */
    public static String pathOf(MethodDescriptor<?, ?> method) {
        return "/" + method.getFullMethodName();
    }

    /**
     * Gets the User-Agent string for the in-process transport or a named transport.
     */
    public static String getUserAgent(String transportName, @Nullable String applicationUserAgent) {
        StringBuilder builder = new StringBuilder();
        if (applicationUserAgent != null) {
            builder.append(applicationUserAgent);
            builder.append(' ');
        }
        builder.append("conduit-java-");
        builder.append(transportName);
        builder.append('/');
        builder.append(IMPLEMENTATION_VERSION);
        return builder.toString();
    }

    /**
     * Writes the status into trailers: {@code grpc-status}, the percent-encoded {@code grpc-message}
     * and the base64 {@code grpc-status-details-bin}.
     * 将状态写入 trailers
     */
    public static Metadata statusToTrailers(Status status, Metadata trailers) {
        trailers.discardAll(STATUS_KEY);
        trailers.discardAll(MESSAGE_KEY);
        trailers.discardAll(STATUS_DETAILS_KEY);
        trailers.put(STATUS_KEY, String.valueOf(status.getCode().value()));
        if (status.getDescription() != null) {
            trailers.put(MESSAGE_KEY, encodeStatusMessage(status.getDescription()));
        }
        byte[] details = status.getDetails();
        if (details != null) {
            trailers.putBinary(STATUS_DETAILS_KEY, details);
        }
        return trailers;
    }

    /**
     * Extract the status carried by trailers. Trailers without a parsable {@code grpc-status} map to
     * {@code INTERNAL}, the protocol state being indeterminate.
     * 从 trailers 中解析状态，没有 grpc-status 时返回 INTERNAL
     */
    public static Status statusFromTrailers(Metadata trailers) {
        String code = trailers.get(STATUS_KEY);
        if (code == null) {
            return Status.INTERNAL.withDescription("missing GRPC status in response");
        }
        Status status;
        try {
            status = Status.fromCodeValue(Integer.parseInt(code.trim()));
        } catch (NumberFormatException e) {
            return Status.INTERNAL.withDescription("invalid GRPC status: " + code).withCause(e);
        }
        String message = trailers.get(MESSAGE_KEY);
        if (message != null) {
            status = status.withDescription(decodeStatusMessage(message));
        }
        byte[] details = trailers.getBinary(STATUS_DETAILS_KEY);
        if (details != null) {
            status = status.withDetails(details);
        }
        return status;
    }

    /**
     * Percent-encode a status message: bytes outside the printable ASCII range and {@code %} are
     * written as {@code %XX} of their UTF-8 encoding.
     * 对状态信息进行百分号编码
     */
    @VisibleForTesting
    static String encodeStatusMessage(String message) {
        byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
        StringBuilder sb = new StringBuilder(bytes.length);
        for (byte b : bytes) {
            if (b >= ' ' && b < '~' + 1 && b != '%') {
                sb.append((char) b);
            } else {
                sb.append('%').append(HEX[(b >> 4) & 0xF]).append(HEX[b & 0xF]);
            }
        }
        return sb.toString();
    }

    /**
     * Reverse of {@link #encodeStatusMessage}. Malformed escapes are kept as they are.
     * 解码百分号编码的状态信息，无效的转义保留原样
     */
    @VisibleForTesting
    static String decodeStatusMessage(String value) {
        if (value.indexOf('%') < 0) {
            return value;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(value.length());
        byte[] source = value.getBytes(StandardCharsets.US_ASCII);
        for (int i = 0; i < source.length; i++) {
            if (source[i] == '%' && i + 2 < source.length) {
                int hi = Character.digit(source[i + 1], 16);
                int lo = Character.digit(source[i + 2], 16);
                if (hi >= 0 && lo >= 0) {
                    out.write((hi << 4) | lo);
                    i += 2;
                    continue;
                }
            }
            out.write(source[i]);
        }
        return new String(out.toByteArray(), StandardCharsets.UTF_8);
    }

    /**
     * Get a {@link ThreadFactory} suitable for use in the current environment.
     * 获取线程工厂
     *
     * @param nameFormat to apply to threads created by the factory.
     * @param daemon     {@code true} if the threads the factory creates are daemon threads,
     *                   {@code false} otherwise.
     */
    public static ThreadFactory getThreadFactory(String nameFormat, boolean daemon) {
        return new ThreadFactoryBuilder()
                .setDaemon(daemon)
                .setNameFormat(nameFormat)
                .build();
    }

    /**
     * Closes a Closeable, ignoring IOExceptions. This method exists because Guava's {@code
     * Closeables.closeQuietly()} is beta.
     * 关闭资源，忽略 IOException
     */
    public static void closeQuietly(@Nullable Closeable message) {
        if (message == null) {
            return;
        }
        try {
            message.close();
        } catch (IOException ioException) {
            // do nothing except log
            log.log(Level.WARNING, "exception caught in closeQuietly", ioException);
        }
    }

    /**
     * Marshals a nanoseconds representation of the timeout to and from a string representation,
     * consisting of an ASCII decimal representation of a number with at most 8 digits, followed by a
     * unit:
     * 超时时间和字符串的转换，最多 8 位数字加单位：
     * n = nanoseconds
     * u = microseconds
     * m = milliseconds
     * S = seconds
     * M = minutes
     * H = hours
     *
     * <p>The representation is greedy with respect to precision. That is, 2 seconds will be
     * represented as `2000000u`.</p>
     */
    public static final class TimeoutMarshaller {

        private TimeoutMarshaller() {
        }

        public static String toAsciiString(long timeoutNanos) {
            long cutoff = 100000000;
            TimeUnit unit = TimeUnit.NANOSECONDS;
            if (timeoutNanos < 0) {
                throw new IllegalArgumentException("Timeout too small");
            } else if (timeoutNanos < cutoff) {
                return timeoutNanos + "n";
            } else if (timeoutNanos < cutoff * 1000L) {
                return unit.toMicros(timeoutNanos) + "u";
            } else if (timeoutNanos < cutoff * 1000L * 1000L) {
                return unit.toMillis(timeoutNanos) + "m";
            } else if (timeoutNanos < cutoff * 1000L * 1000L * 1000L) {
                return unit.toSeconds(timeoutNanos) + "S";
            } else if (timeoutNanos < cutoff * 1000L * 1000L * 1000L * 60L) {
                return unit.toMinutes(timeoutNanos) + "M";
            } else {
                return unit.toHours(timeoutNanos) + "H";
            }
        }

        public static long parseAsciiString(String serialized) {
            checkArgument(serialized.length() > 0, "empty timeout");
            checkArgument(serialized.length() <= 9, "bad timeout format");
            long value = Long.parseLong(serialized.substring(0, serialized.length() - 1));
            char unit = serialized.charAt(serialized.length() - 1);
            switch (unit) {
                case 'n':
                    return value;
                case 'u':
                    return TimeUnit.MICROSECONDS.toNanos(value);
                case 'm':
                    return TimeUnit.MILLISECONDS.toNanos(value);
                case 'S':
                    return TimeUnit.SECONDS.toNanos(value);
                case 'M':
                    return TimeUnit.MINUTES.toNanos(value);
                case 'H':
                    return TimeUnit.HOURS.toNanos(value);
                default:
                    throw new IllegalArgumentException(String.format("Invalid timeout unit: %s", unit));
            }
        }
    }
}
