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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import io.conduit.Status;
import io.conduit.StatusException;
import io.conduit.SynchronizationContext;
import io.conduit.SynchronizationContext.ScheduledHandle;
import io.conduit.internal.BackoffPolicy;
import io.conduit.internal.ClientTransport;
import io.conduit.internal.ClientTransportFactory;
import io.conduit.internal.ExponentialBackoffPolicy;

import javax.annotation.Nullable;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * The connections of one cluster. Endpoints reported connectable by discovery are connected; a
 * connection that becomes ready joins the pool, one that fails leaves it and is retried after an
 * exponential backoff. Draining, unhealthy and removed endpoints leave the pool and their connection
 * shuts down gracefully so in-flight calls finish.
 * 一个集群的连接，可连接的端点会建立连接，连接就绪后加入连接池，失败后移出连接池并按指数退避重连；
 * DRAINING、UNHEALTHY 以及被移除的端点会移出连接池，并优雅关闭连接
 *
 * <p>Lifecycle changes run in the {@link SynchronizationContext}; {@link #pick} reads an immutable
 * picker and may be called from any thread.
 */
public final class ClusterChannel {

    private static final Logger logger = Logger.getLogger(ClusterChannel.class.getName());

    static final Status REMOVED_STATUS = Status.UNAVAILABLE.withDescription("Endpoint removed from cluster");

    static final Status DRAINING_STATUS = Status.UNAVAILABLE.withDescription("Endpoint draining");

    static final Status SHUTDOWN_STATUS = Status.UNAVAILABLE.withDescription("Cluster shutdown");

    private final String name;
    private final ClientTransportFactory transportFactory;
    private final SynchronizationContext syncContext;
    private final ScheduledExecutorService scheduledExecutor;
    private final BackoffPolicy.Provider backoffPolicyProvider;
    @Nullable
    private final Runnable onTerminated;

    // 以下字段只在 syncContext 中访问
    private Map<SocketAddress, EndpointState> endpoints = new LinkedHashMap<>();
    private final Set<ClientTransport> transports = new HashSet<>();
    private String lbPolicy = ClusterResource.ROUND_ROBIN;
    private boolean shutdown;

    private volatile EndpointPicker picker;
    private volatile ImmutableMap<SocketAddress, HealthState> endpointHealth = ImmutableMap.of();
    private volatile boolean terminated;

    ClusterChannel(String name,
                   ClientTransportFactory transportFactory,
                   SynchronizationContext syncContext,
                   ScheduledExecutorService scheduledExecutor,
                   BackoffPolicy.Provider backoffPolicyProvider,
                   @Nullable Runnable onTerminated) {
        this.name = checkNotNull(name, "name");
        this.transportFactory = checkNotNull(transportFactory, "transportFactory");
        this.syncContext = checkNotNull(syncContext, "syncContext");
        this.scheduledExecutor = checkNotNull(scheduledExecutor, "scheduledExecutor");
        this.backoffPolicyProvider = checkNotNull(backoffPolicyProvider, "backoffPolicyProvider");
        this.onTerminated = onTerminated;
        this.picker = EndpointPicker.create(name, lbPolicy, new ArrayList<Connection>());
    }

    /**
     * Endpoint reconnect backoff: 1s initial, 120s ceiling unless configured otherwise.
     * 端点重连的退避策略
     */
    public static ExponentialBackoffPolicy.Provider defaultBackoffPolicyProvider() {
        return new ExponentialBackoffPolicy.Provider()
                .setInitialBackoffNanos(TimeUnit.SECONDS.toNanos(1))
                .setMaxBackoffNanos(TimeUnit.SECONDS.toNanos(120));
    }

    public String getName() {
        return name;
    }

    /**
     * Selects a ready connection of this cluster.
     * 选择一个可用的连接
     *
     * @throws StatusException {@code UNAVAILABLE} when the pool is empty
     */
    public Connection pick() throws StatusException {
        return picker.pick();
    }

    /**
     * Applies a new snapshot of the cluster.
     * 应用集群的新快照
     */
    public void update(final ClusterResource cluster) {
        checkNotNull(cluster, "cluster");
        checkState(cluster.getName().equals(name), "cluster name mismatch");
        syncContext.execute(new Runnable() {
            @Override
            public void run() {
                handleUpdate(cluster);
            }
        });
    }

    private void handleUpdate(ClusterResource cluster) {
        if (shutdown) {
            return;
        }
        lbPolicy = cluster.getLbPolicy();
        Map<SocketAddress, Endpoint> incoming = new LinkedHashMap<>();
        for (Endpoint endpoint : cluster.getEndpoints()) {
            incoming.put(endpoint.getAddress(), endpoint);
        }
        // 被移除的端点和 DRAINING 一样处理
        for (EndpointState state : endpoints.values()) {
            if (!incoming.containsKey(state.address)) {
                logger.log(Level.FINE, "[{0}] Endpoint {1} removed", new Object[]{name, state.address});
                state.removed = true;
                state.drain(REMOVED_STATUS);
            }
        }
        Map<SocketAddress, EndpointState> updated = new LinkedHashMap<>();
        for (Endpoint endpoint : incoming.values()) {
            EndpointState state = endpoints.get(endpoint.getAddress());
            if (state == null) {
                state = new EndpointState(endpoint.getAddress());
            }
            updated.put(endpoint.getAddress(), state);
        }
        endpoints = updated;
        for (Endpoint endpoint : incoming.values()) {
            updated.get(endpoint.getAddress()).updateHealth(endpoint.getHealth());
        }
        rebuildPicker();
    }

    private void rebuildPicker() {
        syncContext.throwIfNotInThisSynchronizationContext();
        List<Connection> ready = new ArrayList<>();
        ImmutableMap.Builder<SocketAddress, HealthState> health = ImmutableMap.builder();
        for (EndpointState state : endpoints.values()) {
            health.put(state.address, state.health);
            if (state.readyConnection != null) {
                ready.add(state.readyConnection);
            }
        }
        picker = shutdown
                ? new EndpointPicker.EmptyPicker(SHUTDOWN_STATUS)
                : EndpointPicker.create(name, lbPolicy, ready);
        endpointHealth = health.build();
    }

    /**
     * Stops connecting and drains every endpoint. Calls in flight finish.
     * 停止建立连接并优雅关闭所有端点
     */
    public void shutdown() {
        syncContext.execute(new Runnable() {
            @Override
            public void run() {
                if (shutdown) {
                    return;
                }
                shutdown = true;
                logger.log(Level.FINE, "[{0}] Shutting down", name);
                for (EndpointState state : endpoints.values()) {
                    state.drain(SHUTDOWN_STATUS);
                }
                endpoints = new LinkedHashMap<>();
                rebuildPicker();
                maybeTerminate();
            }
        });
    }

    /**
     * Shuts down and closes every connection, failing the calls in flight with {@code status}.
     */
    public void shutdownNow(final Status status) {
        shutdown();
        syncContext.execute(new Runnable() {
            @Override
            public void run() {
                for (ClientTransport transport : new ArrayList<>(transports)) {
                    transport.shutdownNow(status);
                }
            }
        });
    }

    public boolean isTerminated() {
        return terminated;
    }

    /**
     * Health of each endpoint as last observed by this channel.
     */
    @VisibleForTesting
    ImmutableMap<SocketAddress, HealthState> endpointHealth() {
        return endpointHealth;
    }

    @VisibleForTesting
    List<Connection> readyConnections() {
        return picker.readyConnections();
    }

    private void maybeTerminate() {
        if (terminated || !shutdown || !transports.isEmpty()) {
            return;
        }
        terminated = true;
        logger.log(Level.FINE, "[{0}] Terminated", name);
        if (onTerminated != null) {
            onTerminated.run();
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("name", name)
                .add("lbPolicy", lbPolicy)
                .add("picker", picker)
                .toString();
    }

    /**
     * A ready connection to one endpoint.
     * 一个端点的可用连接
     */
    public static final class Connection {
        private final SocketAddress address;
        private final ClientTransport transport;

        Connection(SocketAddress address, ClientTransport transport) {
            this.address = checkNotNull(address, "address");
            this.transport = checkNotNull(transport, "transport");
        }

        public SocketAddress getAddress() {
            return address;
        }

        public ClientTransport getTransport() {
            return transport;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this).add("address", address).toString();
        }
    }

    /**
     * Connection state of one endpoint, keyed by its address.
     * 单个端点的连接状态
     */
    private final class EndpointState {
        final SocketAddress address;
        HealthState health = HealthState.UNKNOWN;
        boolean connectable;
        boolean removed;

        @Nullable
        ClientTransport activeTransport;
        @Nullable
        Connection readyConnection;
        @Nullable
        BackoffPolicy reconnectPolicy;
        @Nullable
        ScheduledHandle reconnectTask;

        EndpointState(SocketAddress address) {
            this.address = address;
        }

        void updateHealth(HealthState discovered) {
            connectable = discovered.isConnectable();
            if (!connectable) {
                health = discovered;
                drain(discovered == HealthState.DRAINING ? DRAINING_STATUS
                        : Status.UNAVAILABLE.withDescription("Endpoint reported unhealthy"));
                return;
            }
            // 退避中的端点保持自身观察到的 UNHEALTHY
            if (readyConnection == null && reconnectTask == null) {
                health = discovered;
            }
            if (activeTransport == null && reconnectTask == null) {
                startNewTransport();
            }
        }

        void startNewTransport() {
            syncContext.throwIfNotInThisSynchronizationContext();
            checkState(reconnectTask == null, "Should have no reconnectTask scheduled");
            ClientTransport transport = transportFactory.newClientTransport(address);
            activeTransport = transport;
            transports.add(transport);
            logger.log(Level.FINE, "[{0}] Connecting to {1}", new Object[]{name, address});
            syncContext.executeLater(transport.start(new TransportListener(this, transport)));
        }

        void scheduleBackoff(Status status) {
            syncContext.throwIfNotInThisSynchronizationContext();
            if (reconnectPolicy == null) {
                reconnectPolicy = backoffPolicyProvider.get();
            }
            long delayNanos = reconnectPolicy.nextBackoffNanos();
            logger.log(Level.FINE, "[{0}] Endpoint {1} failed ({2}), reconnecting in {3} ns",
                    new Object[]{name, address, status, delayNanos});
            checkState(reconnectTask == null, "previous reconnectTask is not done");
            reconnectTask = syncContext.schedule(new Runnable() {
                @Override
                public void run() {
                    reconnectTask = null;
                    if (!shutdown && !removed && connectable && activeTransport == null) {
                        startNewTransport();
                    }
                }
            }, delayNanos, TimeUnit.NANOSECONDS, scheduledExecutor);
        }

        /**
         * 移出连接池，取消重连，优雅关闭连接
         */
        void drain(Status reason) {
            if (reconnectTask != null) {
                reconnectTask.cancel();
                reconnectTask = null;
            }
            reconnectPolicy = null;
            readyConnection = null;
            ClientTransport transport = activeTransport;
            activeTransport = null;
            if (transport != null) {
                transport.shutdown(reason);
            }
        }

        void handleTransportReady(ClientTransport transport) {
            if (transport != activeTransport) {
                return;
            }
            logger.log(Level.FINE, "[{0}] Endpoint {1} ready", new Object[]{name, address});
            health = HealthState.HEALTHY;
            reconnectPolicy = null;
            readyConnection = new Connection(address, transport);
            rebuildPicker();
        }

        void handleTransportShutdown(ClientTransport transport, Status status) {
            if (transport != activeTransport) {
                return;
            }
            activeTransport = null;
            readyConnection = null;
            if (shutdown || removed || !connectable) {
                rebuildPicker();
                return;
            }
            health = HealthState.UNHEALTHY;
            rebuildPicker();
            scheduleBackoff(status);
        }

        void handleTransportTerminated(ClientTransport transport) {
            transports.remove(transport);
            if (transport == activeTransport) {
                activeTransport = null;
            }
            maybeTerminate();
        }
    }

    /**
     * 连接事件监听器，事件都转到 syncContext 中处理
     */
    private final class TransportListener implements ClientTransport.Listener {
        private final EndpointState endpoint;
        private final ClientTransport transport;

        TransportListener(EndpointState endpoint, ClientTransport transport) {
            this.endpoint = endpoint;
            this.transport = transport;
        }

        @Override
        public void transportReady() {
            syncContext.execute(new Runnable() {
                @Override
                public void run() {
                    endpoint.handleTransportReady(transport);
                }
            });
        }

        @Override
        public void transportShutdown(final Status s) {
            syncContext.execute(new Runnable() {
                @Override
                public void run() {
                    endpoint.handleTransportShutdown(transport, s);
                }
            });
        }

        @Override
        public void transportTerminated() {
            syncContext.execute(new Runnable() {
                @Override
                public void run() {
                    endpoint.handleTransportTerminated(transport);
                }
            });
        }
    }
}
