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

import com.google.common.collect.ImmutableSet;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Set;

/**
 * The message encodings a peer advertised through {@code grpc-accept-encoding}, kept per
 * connection. Until the peer has spoken only identity is assumed.
 * 对端通过 grpc-accept-encoding 声明的编码方式，每个连接一份，在收到对端响应前只认为支持 identity
 */
@ThreadSafe
public final class AdvertisedEncodings {

    private volatile Set<String> encodings = ImmutableSet.of();

    /**
     * Replaces the known set with the encodings listed in the header value. A {@code null} header
     * leaves the set untouched.
     * 根据 header 的值更新编码集合
     */
    public void update(@Nullable String acceptEncodingHeader) {
        if (acceptEncodingHeader == null) {
            return;
        }
        encodings = CompressionNegotiator.parseAcceptEncoding(acceptEncodingHeader);
    }

    /**
     * Returns the encodings the peer accepts, always including identity.
     */
    public Set<String> get() {
        Set<String> current = encodings;
        if (current.isEmpty()) {
            return ImmutableSet.of(GrpcUtil.IDENTITY_ENCODING);
        }
        return current;
    }

    @Override
    public String toString() {
        return "AdvertisedEncodings" + encodings;
    }
}
