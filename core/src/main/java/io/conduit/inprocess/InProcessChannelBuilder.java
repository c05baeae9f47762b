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

import com.google.common.util.concurrent.MoreExecutors;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.conduit.ManagedChannel;
import io.conduit.internal.AbstractChannelBuilder;
import io.conduit.internal.ClientTransport;
import io.conduit.internal.ClientTransportFactory;
import io.conduit.internal.DirectChannel;

import javax.annotation.Nullable;
import java.net.SocketAddress;
import java.util.concurrent.Executor;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Builder for a channel that issues in-process requests. Clients identify the in-process server by
 * its name.
 * 用于构建进程内请求 Channel 的构建器，通过名称访问 Server
 *
 * <p>The channel is intended to be fully-featured, high performance, and useful in testing.
 */
public final class InProcessChannelBuilder extends AbstractChannelBuilder<InProcessChannelBuilder> {

    private final String name;
    private boolean propagateCauseWithStatus;

    private InProcessChannelBuilder(String name) {
        this.name = checkNotNull(name, "name");
    }

    /**
     * Create a channel builder that will connect to the server with the given name.
     * 使用指定的 Server 名称创建 Channel 构建器
     *
     * @param name the identity of the server to connect to
     */
    public static InProcessChannelBuilder forName(String name) {
        return new InProcessChannelBuilder(name);
    }

    /**
     * Sets whether to include the cause with the status that is propagated forward from the
     * InProcessTransport. This was added to make debugging failing tests easier by showing the
     * cause of the status.
     *
     * <p>By default, this is set to false.
     * A default value of false maintains consistency with other transports which strip causal
     * information from the status to avoid leaking information to untrusted clients, and
     * to avoid sharing language-specific information with the client.
     * 设置是否在传递的状态中包含原因，默认为 false
     */
    @CanIgnoreReturnValue
    public InProcessChannelBuilder propagateCauseWithStatus(boolean enable) {
        this.propagateCauseWithStatus = enable;
        return this;
    }

    /**
     * Creates a transport factory dialing in-process servers by name, for use by channels that
     * manage their own connections.
     * 创建通过名称连接进程内 Server 的 Transport 工厂
     *
     * @param clientExecutor executor for the client side stream callbacks
     */
    public static ClientTransportFactory newTransportFactory(Executor clientExecutor,
                                                             @Nullable String userAgent,
                                                             boolean propagateCauseWithStatus) {
        return new InProcessClientTransportFactory(clientExecutor, userAgent, propagateCauseWithStatus);
    }

    @Override
    public ManagedChannel build() {
        Executor streamExecutor = getExecutor() != null ? getExecutor() : MoreExecutors.directExecutor();
        ClientTransportFactory factory =
                new InProcessClientTransportFactory(streamExecutor, getUserAgent(), propagateCauseWithStatus);
        DirectChannel.Builder builder = DirectChannel.newBuilder(new InProcessSocketAddress(name), factory)
                .compressorRegistry(getCompressorRegistry())
                .decompressorRegistry(getDecompressorRegistry())
                .compressionPreference(getCompressionPreference())
                .maxInboundMessageSize(getMaxInboundMessageSize());
        if (getExecutor() != null) {
            builder.executor(getExecutor());
        }
        if (getScheduledExecutorService() != null) {
            builder.scheduledExecutorService(getScheduledExecutorService());
        }
        if (getAuthorityOverride() != null) {
            builder.overrideAuthority(getAuthorityOverride());
        }
        return builder.build();
    }

    /**
     * Creates InProcess transports.
     * 创建进程内 Transport 的工厂
     */
    static final class InProcessClientTransportFactory implements ClientTransportFactory {
        private final Executor clientExecutor;
        private final String userAgent;
        private final boolean includeCauseWithStatus;

        private boolean closed;

        InProcessClientTransportFactory(Executor clientExecutor,
                                        @Nullable String userAgent,
                                        boolean includeCauseWithStatus) {
            this.clientExecutor = checkNotNull(clientExecutor, "clientExecutor");
            this.userAgent = userAgent;
            this.includeCauseWithStatus = includeCauseWithStatus;
        }

        @Override
        public ClientTransport newClientTransport(SocketAddress addr) {
            checkState(!closed, "The transport factory is closed.");
            checkArgument(addr instanceof InProcessSocketAddress, "Unsupported address type: %s", addr);
            String name = ((InProcessSocketAddress) addr).getName();
            return new InProcessTransport(name, name, userAgent, clientExecutor, includeCauseWithStatus);
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
