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

import com.google.common.annotations.VisibleForTesting;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Encloses classes related to the compression and decompression of messages.
 * 压缩器注册器，根据编码名称查找压缩器
 */
@ThreadSafe
public final class CompressorRegistry {

    private static final CompressorRegistry DEFAULT_INSTANCE = new CompressorRegistry(
            new Codec.Gzip(),
            new Codec.Deflate(),
            Codec.Identity.NONE);

    /**
     * Returns the default instance used by gRPC when the registry is not specified.
     * Currently the registry just contains support for gzip, deflate and identity.
     */
    public static CompressorRegistry getDefaultInstance() {
        return DEFAULT_INSTANCE;
    }

    /**
     * Returns a new instance with no registered compressors.
     */
    public static CompressorRegistry newEmptyInstance() {
        return new CompressorRegistry();
    }

    private final ConcurrentMap<String, Compressor> compressors;

    @VisibleForTesting
    CompressorRegistry(Compressor... cs) {
        compressors = new ConcurrentHashMap<>();
        for (Compressor c : cs) {
            compressors.put(c.getMessageEncoding(), c);
        }
    }

    /**
     * Returns the compressor registered under the given encoding, or {@code null} if none.
     * 根据编码名称查找压缩器
     */
    @Nullable
    public Compressor lookupCompressor(String compressorName) {
        return compressors.get(compressorName);
    }

    /**
     * Registers a compressor for both decompression and message encoding negotiation.
     * 注册压缩器
     *
     * @param c The compressor to register
     */
    public void register(Compressor c) {
        String encoding = c.getMessageEncoding();
        checkNotNull(encoding, "encoding");
        compressors.put(encoding, c);
    }
}
