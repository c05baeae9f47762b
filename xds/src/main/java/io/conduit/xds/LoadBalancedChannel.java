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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.conduit.CallOptions;
import io.conduit.ClientCall;
import io.conduit.ManagedChannel;
import io.conduit.Metadata;
import io.conduit.MethodDescriptor;
import io.conduit.Status;
import io.conduit.StatusException;
import io.conduit.SynchronizationContext;
import io.conduit.internal.BackoffPolicy;
import io.conduit.internal.ClientCallImpl;
import io.conduit.internal.ClientTransport;
import io.conduit.internal.ClientTransportFactory;
import io.conduit.internal.CompressionNegotiator;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
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
 * A channel that routes every call to a cluster and picks a connection of that cluster. Clusters
 * and routes come from an {@link EndpointDiscovery} source; each snapshot is validated and
 * acknowledged before it takes effect.
 * 将每个调用路由到集群并从集群中选择连接的 Channel，集群和路由来自服务发现，
 * 每个快照校验通过并确认后才生效
 */
@ThreadSafe
public final class LoadBalancedChannel extends ManagedChannel {

    private static final Logger logger = Logger.getLogger(LoadBalancedChannel.class.getName());

    static final Status SHUTDOWN_NOW_STATUS = Status.UNAVAILABLE.withDescription("Channel shutdownNow invoked");

    private final String authority;
    private final ClientTransportFactory transportFactory;
    private final Executor executor;
    private final ScheduledExecutorService scheduledExecutor;
    @Nullable
    private final ExecutorService ownedExecutor;
    @Nullable
    private final ScheduledExecutorService ownedScheduler;
    @Nullable
    private final ManagedChannel ownedControlPlane;
    private final CompressionNegotiator compressionNegotiator;
    private final int maxInboundMessageSize;
    private final BackoffPolicy.Provider endpointBackoffPolicyProvider;
    @Nullable
    private final String routeConfigName;
    private final EndpointDiscovery discovery;
    private final Router router = new Router();
    private final CountDownLatch terminatedLatch = new CountDownLatch(1);

    @VisibleForTesting
    final SynchronizationContext syncContext = new SynchronizationContext(
            new Thread.UncaughtExceptionHandler() {
                @Override
                public void uncaughtException(Thread t, Throwable e) {
                    logger.log(Level.SEVERE, "Uncaught exception in the SynchronizationContext", e);
                }
            });

    private volatile ImmutableMap<String, ClusterChannel> clusters = ImmutableMap.of();

    // 以下字段只在 syncContext 中访问
    private final Set<ClusterChannel> liveClusters = new HashSet<>();
    private boolean clustersReceived;

    private volatile boolean shutdown;
    private volatile boolean terminated;

    private final ClientCallImpl.ClientTransportProvider transportProvider =
            new ClientCallImpl.ClientTransportProvider() {
                @Override
                public ClientTransport get(MethodDescriptor<?, ?> method, CallOptions callOptions, Metadata headers)
                        throws StatusException {
                    String callAuthority = callOptions.getAuthority() != null ? callOptions.getAuthority() : authority;
                    return pickTransport(callAuthority, method.getFullMethodName(), headers);
                }
            };

    LoadBalancedChannel(LoadBalancedChannelBuilder builder,
                        String authority,
                        Executor executor,
                        @Nullable ExecutorService ownedExecutor,
                        ScheduledExecutorService scheduledExecutor,
                        @Nullable ScheduledExecutorService ownedScheduler,
                        CompressionNegotiator compressionNegotiator,
                        int maxInboundMessageSize) {
        this.authority = checkNotNull(authority, "authority");
        this.transportFactory = checkNotNull(builder.transportFactory, "transportFactory");
        this.executor = checkNotNull(executor, "executor");
        this.ownedExecutor = ownedExecutor;
        this.scheduledExecutor = checkNotNull(scheduledExecutor, "scheduledExecutor");
        this.ownedScheduler = ownedScheduler;
        this.compressionNegotiator = compressionNegotiator;
        this.maxInboundMessageSize = maxInboundMessageSize;
        this.endpointBackoffPolicyProvider = builder.endpointBackoffPolicyProvider;
        this.routeConfigName = builder.routeConfigName;
        this.ownedControlPlane = builder.ownedControlPlane;
        if (builder.controlPlane != null) {
            this.discovery = new AdsDiscoveryClient(builder.controlPlane, builder.node, syncContext,
                    scheduledExecutor, builder.discoveryBackoffPolicyProvider);
        } else {
            this.discovery = new StaticDiscovery(builder.staticClusters, builder.staticRouteConfigurations);
        }
    }

    /**
     * Starts the subscriptions. Clusters are subscribed before routes.
     * 开始订阅，先订阅集群，再订阅路由
     */
    LoadBalancedChannel start() {
        discovery.subscribe(ResourceType.CLUSTER, ImmutableList.<String>of(), new ClusterWatcher());
        List<String> routeNames = routeConfigName == null
                ? ImmutableList.<String>of() : ImmutableList.of(routeConfigName);
        discovery.subscribe(ResourceType.ROUTE_CONFIGURATION, routeNames, new RouteWatcher());
        return this;
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
     * 路由到集群，再从集群中选择连接
     */
    private ClientTransport pickTransport(String callAuthority, String fullMethodName, Metadata headers)
            throws StatusException {
        if (shutdown) {
            throw Status.UNAVAILABLE.withDescription("Channel shutdown invoked").asException();
        }
        String clusterName = router.resolve(callAuthority, fullMethodName, headers);
        ClusterChannel cluster = clusters.get(clusterName);
        if (cluster == null) {
            throw Status.UNAVAILABLE.withDescription("cluster " + clusterName + " not found").asException();
        }
        return cluster.pick().getTransport();
    }

    @VisibleForTesting
    Router getRouter() {
        return router;
    }

    @VisibleForTesting
    @Nullable
    ClusterChannel getCluster(String name) {
        return clusters.get(name);
    }

    private void handleClusterUpdate(String version, String nonce, List<ClusterResource> resources) {
        syncContext.throwIfNotInThisSynchronizationContext();
        if (shutdown) {
            return;
        }
        String error = validateClusters(resources);
        if (error != null) {
            logger.log(Level.WARNING, "Rejecting clusters version {0}: {1}", new Object[]{version, error});
            discovery.ack(ResourceType.CLUSTER, version, nonce, false, error);
            return;
        }
        Map<String, ClusterChannel> updated = new LinkedHashMap<>();
        for (ClusterResource resource : resources) {
            ClusterChannel cluster = clusters.get(resource.getName());
            if (cluster == null) {
                cluster = newClusterChannel(resource.getName());
            }
            cluster.update(resource);
            updated.put(resource.getName(), cluster);
        }
        for (ClusterChannel cluster : clusters.values()) {
            if (!updated.containsKey(cluster.getName())) {
                logger.log(Level.FINE, "Cluster {0} removed", cluster.getName());
                cluster.shutdown();
            }
        }
        clusters = ImmutableMap.copyOf(updated);
        clustersReceived = true;
        logger.log(Level.FINE, "Accepted clusters version {0}: {1}", new Object[]{version, updated.keySet()});
        discovery.ack(ResourceType.CLUSTER, version, nonce, true, null);
    }

    private ClusterChannel newClusterChannel(String name) {
        final ClusterChannel[] holder = new ClusterChannel[1];
        ClusterChannel cluster = new ClusterChannel(name, transportFactory, syncContext, scheduledExecutor,
                endpointBackoffPolicyProvider, new Runnable() {
                    @Override
                    public void run() {
                        liveClusters.remove(holder[0]);
                        maybeTerminate();
                    }
                });
        holder[0] = cluster;
        liveClusters.add(cluster);
        return cluster;
    }

    /**
     * @return the reason the snapshot is invalid, or {@code null}
     */
    @Nullable
    static String validateClusters(List<ClusterResource> resources) {
        Set<String> names = new HashSet<>();
        for (ClusterResource resource : resources) {
            if (resource.getName().isEmpty()) {
                return "cluster with empty name";
            }
            if (!names.add(resource.getName())) {
                return "duplicate cluster " + resource.getName();
            }
            if (!EndpointPicker.isSupported(resource.getLbPolicy())) {
                return "cluster " + resource.getName() + " has unsupported lb policy " + resource.getLbPolicy();
            }
        }
        return null;
    }

    private void handleRouteUpdate(String version, String nonce, List<RouteConfiguration> configurations) {
        syncContext.throwIfNotInThisSynchronizationContext();
        if (shutdown) {
            return;
        }
        String error = null;
        List<Route> routes = new ArrayList<>();
        if (!clustersReceived) {
            error = "routes received before any cluster";
        } else {
            boolean found = routeConfigName == null;
            for (RouteConfiguration configuration : configurations) {
                if (routeConfigName == null || routeConfigName.equals(configuration.getName())) {
                    found = true;
                    routes.addAll(configuration.getRoutes());
                }
            }
            if (!found) {
                error = "route configuration " + routeConfigName + " not found";
            }
            for (Route route : routes) {
                if (error == null && !clusters.containsKey(route.getClusterName())) {
                    error = "route references unknown cluster " + route.getClusterName();
                }
            }
        }
        if (error != null) {
            logger.log(Level.WARNING, "Rejecting routes version {0}: {1}", new Object[]{version, error});
            discovery.ack(ResourceType.ROUTE_CONFIGURATION, version, nonce, false, error);
            return;
        }
        router.update(new RouteTable(routes));
        discovery.ack(ResourceType.ROUTE_CONFIGURATION, version, nonce, true, null);
    }

    @Override
    public ManagedChannel shutdown() {
        synchronized (this) {
            if (shutdown) {
                return this;
            }
            shutdown = true;
        }
        logger.log(Level.FINE, "Shutting down channel for {0}", authority);
        discovery.shutdown();
        syncContext.execute(new Runnable() {
            @Override
            public void run() {
                for (ClusterChannel cluster : clusters.values()) {
                    cluster.shutdown();
                }
                clusters = ImmutableMap.of();
                maybeTerminate();
            }
        });
        return this;
    }

    @Override
    public ManagedChannel shutdownNow() {
        shutdown();
        syncContext.execute(new Runnable() {
            @Override
            public void run() {
                for (ClusterChannel cluster : new ArrayList<>(liveClusters)) {
                    cluster.shutdownNow(SHUTDOWN_NOW_STATUS);
                }
            }
        });
        return this;
    }

    @Override
    public boolean isShutdown() {
        return shutdown;
    }

    @Override
    public boolean isTerminated() {
        return terminated;
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return terminatedLatch.await(timeout, unit);
    }

    private void maybeTerminate() {
        syncContext.throwIfNotInThisSynchronizationContext();
        if (terminated || !shutdown || !liveClusters.isEmpty()) {
            return;
        }
        terminated = true;
        if (ownedControlPlane != null) {
            ownedControlPlane.shutdown();
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
        if (ownedScheduler != null) {
            ownedScheduler.shutdown();
        }
        transportFactory.close();
        terminatedLatch.countDown();
        logger.log(Level.FINE, "Channel for {0} terminated", authority);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("authority", authority)
                .add("discovery", discovery)
                .toString();
    }

    private final class ClusterWatcher implements EndpointDiscovery.ResourceWatcher<ClusterResource> {
        @Override
        public void onUpdate(final String version, final String nonce, final List<ClusterResource> resources) {
            syncContext.execute(new Runnable() {
                @Override
                public void run() {
                    handleClusterUpdate(version, nonce, resources);
                }
            });
        }

        @Override
        public void onError(Status error) {
            logger.log(Level.FINE, "Cluster discovery error: {0}", error);
        }
    }

    private final class RouteWatcher implements EndpointDiscovery.ResourceWatcher<RouteConfiguration> {
        @Override
        public void onUpdate(final String version, final String nonce, final List<RouteConfiguration> resources) {
            syncContext.execute(new Runnable() {
                @Override
                public void run() {
                    handleRouteUpdate(version, nonce, resources);
                }
            });
        }

        @Override
        public void onError(Status error) {
            logger.log(Level.FINE, "Route discovery error: {0}", error);
        }
    }
}
