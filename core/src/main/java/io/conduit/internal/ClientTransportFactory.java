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

import java.io.Closeable;
import java.net.SocketAddress;

/**
 * Pre-configured factory for creating {@link ClientTransport} instances.
 * 预配置的 ClientTransport 工厂
 */
public interface ClientTransportFactory extends Closeable {

    /**
     * Creates an unstarted transport for exclusive use. Ownership of {@code options} is passed to the
     * callee; the caller should not reuse or read from the options after this method is called.
     * 创建一个未启动的 Transport
     *
     * @param serverAddress the address that the transport is connected to
     */
    ClientTransport newClientTransport(SocketAddress serverAddress);

    /**
     * Releases any resources.
     *
     * <p>After this method has been called, it's no longer valid to call
     * {@link #newClientTransport}. No guarantees about thread-safety are made.
     */
    @Override
    void close();
}
