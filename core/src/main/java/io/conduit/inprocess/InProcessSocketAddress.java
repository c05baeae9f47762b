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

package io.conduit.inprocess;

import java.net.SocketAddress;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Custom SocketAddress class for {@link InProcessTransport}.
 * 进程内 Transport 的地址
 */
public final class InProcessSocketAddress extends SocketAddress {
    private static final long serialVersionUID = -2803441206326023474L;

    private final String name;

    /**
     * @param name - The name of the inprocess server or channel this address represents.
     */
    public InProcessSocketAddress(String name) {
        this.name = checkNotNull(name, "name");
    }

    /**
     * Gets the name of the inprocess server or channel this address represents.
     */
    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof InProcessSocketAddress)) {
            return false;
        }
        return name.equals(((InProcessSocketAddress) obj).name);
    }
}
