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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.conduit.Codec;
import io.conduit.Compressor;
import io.conduit.CompressorRegistry;
import io.conduit.DecompressorRegistry;
import io.conduit.Status;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.List;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Chooses the compressor for outgoing messages and decides which incoming encodings are accepted.
 * 选择发送消息使用的压缩方式，并判断接收的编码是否支持
 *
 * <p>The outgoing compressor is the first entry of the local preference list that the peer also
 * advertised, identity otherwise. Identity is always accepted in both directions.
 * 发送的压缩方式是本地偏好列表中第一个对端也支持的编码，否则使用 identity，identity 在两个方向都总是支持的
 */
@Immutable
public final class CompressionNegotiator {

    private final List<String> preference;
    private final CompressorRegistry compressorRegistry;
    private final DecompressorRegistry decompressorRegistry;

    /**
     * @param preference           ordered list of encodings this side would like to send
     * @param compressorRegistry   compressors available for sending, every preference must be present
     * @param decompressorRegistry decompressors available for receiving
     */
    public CompressionNegotiator(List<String> preference,
                                 CompressorRegistry compressorRegistry,
                                 DecompressorRegistry decompressorRegistry) {
        this.compressorRegistry = checkNotNull(compressorRegistry, "compressorRegistry");
        this.decompressorRegistry = checkNotNull(decompressorRegistry, "decompressorRegistry");
        for (String encoding : preference) {
            checkArgument(compressorRegistry.lookupCompressor(encoding) != null,
                    "Unable to find compressor by name %s", encoding);
        }
        this.preference = ImmutableList.copyOf(preference);
    }

    /**
     * A negotiator with no preference, which always sends identity.
     */
    public static CompressionNegotiator identityOnly() {
        return new CompressionNegotiator(ImmutableList.<String>of(),
                CompressorRegistry.getDefaultInstance(), DecompressorRegistry.getDefaultInstance());
    }

    /**
     * Negotiate against the encodings advertised by the peer.
     * 根据对端声明的编码进行协商
     */
    public Negotiation negotiate(Set<String> peerAdvertised) {
        Compressor outgoing = Codec.Identity.NONE;
        for (String encoding : preference) {
            if (peerAdvertised.contains(encoding)) {
                outgoing = compressorRegistry.lookupCompressor(encoding);
                break;
            }
        }
        return new Negotiation(outgoing, decompressorRegistry.getKnownMessageEncodings());
    }

    /**
     * The value this side sends as {@code grpc-accept-encoding}.
     */
    public String getAcceptEncoding() {
        return decompressorRegistry.getRawAdvertisedMessageEncodings();
    }

    public CompressorRegistry getCompressorRegistry() {
        return compressorRegistry;
    }

    public DecompressorRegistry getDecompressorRegistry() {
        return decompressorRegistry;
    }

    /**
     * Parse a {@code grpc-accept-encoding} value: comma separated, whitespace trimmed. Identity is
     * always part of the result.
     * 解析 grpc-accept-encoding 的值，结果总是包含 identity
     */
    public static Set<String> parseAcceptEncoding(@Nullable String header) {
        ImmutableSet.Builder<String> builder = ImmutableSet.builder();
        if (header != null) {
            builder.addAll(GrpcUtil.ACCEPT_ENCODING_SPLITTER.split(header));
        }
        builder.add(GrpcUtil.IDENTITY_ENCODING);
        return builder.build();
    }

    /**
     * The result of a negotiation.
     * 协商的结果
     */
    @Immutable
    public static final class Negotiation {

        private final Compressor outgoing;
        private final Set<String> acceptedIncoming;

        Negotiation(Compressor outgoing, Set<String> acceptedIncoming) {
            this.outgoing = checkNotNull(outgoing, "outgoing");
            this.acceptedIncoming = ImmutableSet.<String>builder()
                    .addAll(acceptedIncoming)
                    .add(GrpcUtil.IDENTITY_ENCODING)
                    .build();
        }

        /**
         * The compressor for outgoing messages.
         */
        public Compressor getOutgoing() {
            return outgoing;
        }

        /**
         * The encodings accepted on incoming messages.
         */
        public Set<String> getAcceptedIncoming() {
            return acceptedIncoming;
        }

        /**
         * Checks an incoming encoding, {@code null} meaning identity.
         * 校验接收的编码，不支持时返回 UNIMPLEMENTED
         *
         * @return {@code OK} if accepted, {@code UNIMPLEMENTED} naming the encoding otherwise
         */
        public Status checkIncoming(@Nullable String encoding) {
            if (encoding == null || acceptedIncoming.contains(encoding)) {
                return Status.OK;
            }
            return Status.UNIMPLEMENTED.withDescription(
                    String.format("Can't find decompressor for %s", encoding));
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                    .add("outgoing", outgoing.getMessageEncoding())
                    .add("acceptedIncoming", acceptedIncoming)
                    .toString();
        }
    }
}
