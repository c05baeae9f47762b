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

package io.conduit;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Encloses classes related to the compression and decompression of messages. Each registered
 * decompressor may be advertised to the peer through {@code grpc-accept-encoding}.
 * 解压器注册器，注册的解压器可以通过 grpc-accept-encoding 告知对端
 */
@Immutable
public final class DecompressorRegistry {

    static final Joiner ACCEPT_ENCODING_JOINER = Joiner.on(',');

    /**
     * Returns a registry with gzip, deflate and identity, all advertised.
     */
    public static DecompressorRegistry getDefaultInstance() {
        return DEFAULT_INSTANCE;
    }

    /**
     * Returns a registry with only the identity decompressor.
     * 仅包含 identity 的注册器
     */
    public static DecompressorRegistry emptyInstance() {
        return new DecompressorRegistry();
    }

    private static final DecompressorRegistry DEFAULT_INSTANCE = emptyInstance()
            .with(new Codec.Gzip(), true)
            .with(new Codec.Deflate(), true);

    private final Map<String, DecompressorInfo> decompressors;
    private final String advertisedDecompressors;

    /**
     * Registers a decompressor for both decompression and message encoding negotiation. Returns a
     * new registry.
     * 注册解压器，返回新的注册器
     *
     * @param d             The decompressor to register
     * @param advertised    If true, the message encoding will be listed in the Accept-Encoding
     *                      header.
     */
    public DecompressorRegistry with(Decompressor d, boolean advertised) {
        return new DecompressorRegistry(d, advertised, this);
    }

    private DecompressorRegistry(Decompressor d, boolean advertised, DecompressorRegistry parent) {
        String encoding = checkNotNull(d, "d").getMessageEncoding();
        checkArgument(!encoding.contains(","), "Comma is currently not allowed in message encoding");

        Map<String, DecompressorInfo> newDecompressors = new LinkedHashMap<>(parent.decompressors);
        newDecompressors.put(encoding, new DecompressorInfo(d, advertised));
        decompressors = ImmutableMap.copyOf(newDecompressors);
        advertisedDecompressors = ACCEPT_ENCODING_JOINER.join(getAdvertisedMessageEncodings());
    }

    private DecompressorRegistry() {
        Decompressor identity = Codec.Identity.NONE;
        decompressors = ImmutableMap.of(identity.getMessageEncoding(),
                new DecompressorInfo(identity, false));
        advertisedDecompressors = "";
    }

    /**
     * Provides a list of all message encodings that have decompressors available.
     */
    public Set<String> getKnownMessageEncodings() {
        return decompressors.keySet();
    }

    /**
     * Provides a list of all message encodings that have decompressors available and should be
     * advertised.
     * 返回需要告知对端的编码
     */
    public Set<String> getAdvertisedMessageEncodings() {
        ImmutableSet.Builder<String> advertised = ImmutableSet.builder();
        for (Map.Entry<String, DecompressorInfo> entry : decompressors.entrySet()) {
            if (entry.getValue().advertised) {
                advertised.add(entry.getKey());
            }
        }
        return advertised.build();
    }

    /**
     * The value of the {@code grpc-accept-encoding} header, empty when nothing is advertised.
     */
    public String getRawAdvertisedMessageEncodings() {
        return advertisedDecompressors;
    }

    /**
     * Returns a decompressor for the given message encoding, or {@code null} if none has been
     * registered.
     * 根据编码名称查找解压器
     */
    @Nullable
    public Decompressor lookupDecompressor(String messageEncoding) {
        DecompressorInfo info = decompressors.get(messageEncoding);
        return info != null ? info.decompressor : null;
    }

    /**
     * Information about a decompressor.
     */
    private static final class DecompressorInfo {
        final Decompressor decompressor;
        final boolean advertised;

        DecompressorInfo(Decompressor decompressor, boolean advertised) {
            this.decompressor = checkNotNull(decompressor, "decompressor");
            this.advertised = advertised;
        }
    }
}
