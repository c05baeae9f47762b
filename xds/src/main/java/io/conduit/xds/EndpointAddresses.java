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

package io.conduit.xds;

import com.google.common.net.HostAndPort;
import io.conduit.inprocess.InProcessSocketAddress;

import java.net.InetSocketAddress;
import java.net.SocketAddress;

/**
 * Conversion between endpoint address strings used in discovery resources and
 * {@link SocketAddress}es. {@code inprocess:NAME} names an in-process server, anything else is
 * {@code host:port}.
 * 节点地址字符串与 SocketAddress 之间的转换
 */
public final class EndpointAddresses {

    static final String IN_PROCESS_PREFIX = "inprocess:";

    private EndpointAddresses() {
    }

    /**
     * @throws IllegalArgumentException if the address is malformed
     */
    public static SocketAddress parse(String address) {
        if (address.startsWith(IN_PROCESS_PREFIX)) {
            String name = address.substring(IN_PROCESS_PREFIX.length());
            if (name.isEmpty()) {
                throw new IllegalArgumentException("empty in-process name: " + address);
            }
            return new InProcessSocketAddress(name);
        }
        HostAndPort hostAndPort = HostAndPort.fromString(address);
        if (!hostAndPort.hasPort()) {
            throw new IllegalArgumentException("port required: " + address);
        }
        return InetSocketAddress.createUnresolved(hostAndPort.getHost(), hostAndPort.getPort());
    }

    public static String format(SocketAddress address) {
        if (address instanceof InProcessSocketAddress) {
            return IN_PROCESS_PREFIX + ((InProcessSocketAddress) address).getName();
        }
        if (address instanceof InetSocketAddress) {
            InetSocketAddress inet = (InetSocketAddress) address;
            return HostAndPort.fromParts(inet.getHostString(), inet.getPort()).toString();
        }
        throw new IllegalArgumentException("Unsupported address type: " + address.getClass().getName());
    }
}
