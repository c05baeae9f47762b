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
import io.conduit.CallOptions;
import io.conduit.ClientCall;
import io.conduit.ManagedChannel;
import io.conduit.Metadata;
import io.conduit.MethodDescriptor;
import io.conduit.Status;
import io.conduit.StatusException;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A channel with a single connection to a fixed address. A connection that shuts down is replaced
 * by a new one on the next call.
 * 连接固定地址的单连接 Channel，连接关闭后下一次调用会重新建立连接
 */
@ThreadSafe
public final class DirectChannel extends ManagedChannel {

    private static final Logger log = Logger.getLogger(DirectChannel.class.getName());

    static final Status SHUTDOWN_STATUS = Status.UNAVAILABLE.withDescription("Channel shutdown invoked");

    static final Status SHUTDOWN_NOW_STATUS = Status.UNAVAILABLE.withDescription("Channel shutdownNow invoked");

    private final SocketAddress address;
    private final String authority;
    private final ClientTransportFactory transportFactory;
    private final Executor executor;
    private final ScheduledExecutorService scheduledExecutor;
    @Nullable
    private final ExecutorService ownedExecutor;
    @Nullable
    private final ScheduledExecutorService ownedScheduler;
    private final CompressionNegotiator compressionNegotiator;
    private final int maxInboundMessageSize;
    private final CountDownLatch terminatedLatch = new CountDownLatch(1);

    private final ClientCallImpl.ClientTransportProvider transportProvider =
            new ClientCallImpl.ClientTransportProvider() {
                @Override
                public ClientTransport get(MethodDescriptor<?, ?> method, CallOptions callOptions, Metadata headers)
                        throws StatusException {
                    return obtainActiveTransport();
                }
            };

    @GuardedBy("this")
    private ClientTransport activeTransport;
    @GuardedBy("this")
    private final Set<ClientTransport> transports = new HashSet<>();
    @GuardedBy("this")
    private boolean shutdown;
    @GuardedBy("this")
    private boolean terminated;

    private DirectChannel(Builder builder, SocketAddress address, ClientTransportFactory transportFactory) {
        this.address = checkNotNull(address, "address");
        this.transportFactory = checkNotNull(transportFactory, "transportFactory");
        this.authority = builder.getAuthorityOverride() != null ? builder.getAuthorityOverride() : address.toString();
        this.ownedExecutor = builder.newOwnedExecutorIfAbsent("conduit-direct");
        this.executor = ownedExecutor != null ? ownedExecutor : builder.getExecutor();
        this.ownedScheduler = builder.newOwnedSchedulerIfAbsent("conduit-direct");
        this.scheduledExecutor = ownedScheduler != null ? ownedScheduler : builder.getScheduledExecutorService();
        this.compressionNegotiator = builder.buildCompressionNegotiator();
        this.maxInboundMessageSize = builder.getMaxInboundMessageSize();
    }

    /**
     * Creates a builder for a channel to the given address.
     */
    public static Builder newBuilder(SocketAddress address, ClientTransportFactory transportFactory) {
        return new Builder(address, transportFactory);
    }

    @Override
    public <ReqT, RespT> ClientCall<ReqT, RespT> newCall(MethodDescriptor<ReqT, RespT> method,
                                                         CallOptions callOptions) {
        return new ClientCallImpl<>(method, executor, callOptions, authority, transportProvider,
                scheduledExecutor, compressionNegotiator, maxInboundMessageSize);
    }

    @Override
    public String authority() {
        return authority;
    }

    /**
     * 返回当前的连接，没有时创建新连接
     */
    private ClientTransport obtainActiveTransport() throws StatusException {
        ClientTransport transport;
        Runnable start;
        synchronized (this) {
            if (shutdown) {
                throw SHUTDOWN_STATUS.asException();
            }
            if (activeTransport != null) {
                return activeTransport;
            }
            transport = transportFactory.newClientTransport(address);
            activeTransport = transport;
            transports.add(transport);
            start = transport.start(new TransportListener(transport));
        }
        log.log(Level.FINE, "Created transport {0} for {1}", new Object[]{transport, address});
        start.run();
        return transport;
    }

    @Override
    public ManagedChannel shutdown() {
        List<ClientTransport> toShutdown;
        synchronized (this) {
            if (shutdown) {
                return this;
            }
            shutdown = true;
            activeTransport = null;
            toShutdown = new ArrayList<>(transports);
            maybeTerminate();
        }
        for (ClientTransport transport : toShutdown) {
            transport.shutdown(SHUTDOWN_STATUS);
        }
        return this;
    }

    @Override
    public ManagedChannel shutdownNow() {
        shutdown();
        List<ClientTransport> toShutdown;
        synchronized (this) {
            toShutdown = new ArrayList<>(transports);
        }
        for (ClientTransport transport : toShutdown) {
            transport.shutdownNow(SHUTDOWN_NOW_STATUS);
        }
        return this;
    }

    @Override
    public synchronized boolean isShutdown() {
        return shutdown;
    }

    @Override
    public synchronized boolean isTerminated() {
        return terminated;
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return terminatedLatch.await(timeout, unit);
    }

    @GuardedBy("this")
    private void maybeTerminate() {
        if (terminated || !shutdown || !transports.isEmpty()) {
            return;
        }
        terminated = true;
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
        if (ownedScheduler != null) {
            ownedScheduler.shutdown();
        }
        transportFactory.close();
        terminatedLatch.countDown();
        log.log(Level.FINE, "Channel to {0} terminated", address);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("address", address).toString();
    }

    /**
     * 连接的事件监听器
     */
    private final class TransportListener implements ClientTransport.Listener {
        private final ClientTransport transport;

        TransportListener(ClientTransport transport) {
            this.transport = transport;
        }

        @Override
        public void transportReady() {
            log.log(Level.FINE, "Transport {0} ready", transport);
        }

        @Override
        public void transportShutdown(Status s) {
            log.log(Level.FINE, "Transport {0} shutdown: {1}", new Object[]{transport, s});
            synchronized (DirectChannel.this) {
                // 下一次调用时重新建立连接
                if (activeTransport == transport) {
                    activeTransport = null;
                }
            }
        }

        @Override
        public void transportTerminated() {
            synchronized (DirectChannel.this) {
                transports.remove(transport);
                if (activeTransport == transport) {
                    activeTransport = null;
                }
                maybeTerminate();
            }
        }
    }

    /**
     * Builder for {@link DirectChannel}.
     */
    public static final class Builder extends AbstractChannelBuilder<Builder> {
        private final SocketAddress address;
        private final ClientTransportFactory transportFactory;

        private Builder(SocketAddress address, ClientTransportFactory transportFactory) {
            this.address = checkNotNull(address, "address");
            this.transportFactory = checkNotNull(transportFactory, "transportFactory");
        }

        @Override
        public DirectChannel build() {
            return new DirectChannel(this, address, transportFactory);
        }
    }
}
