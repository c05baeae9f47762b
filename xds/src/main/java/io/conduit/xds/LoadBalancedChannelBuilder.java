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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.conduit.Channel;
import io.conduit.ManagedChannel;
import io.conduit.internal.AbstractChannelBuilder;
import io.conduit.internal.BackoffPolicy;
import io.conduit.internal.ClientTransportFactory;
import io.conduit.internal.DirectChannel;

import javax.annotation.Nullable;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Builder for {@link LoadBalancedChannel}. Exactly one discovery source must be configured: static
 * resources, an aggregated discovery server, or a bootstrap naming one of them.
 * LoadBalancedChannel 的构建器，必须且只能配置一个发现来源
 */
public final class LoadBalancedChannelBuilder extends AbstractChannelBuilder<LoadBalancedChannelBuilder> {

    final String target;
    final ClientTransportFactory transportFactory;

    @Nullable
    List<ClusterResource> staticClusters;
    @Nullable
    List<RouteConfiguration> staticRouteConfigurations;

    @Nullable
    Channel controlPlane;
    @Nullable
    String controlPlaneTarget;
    @Nullable
    ManagedChannel ownedControlPlane;
    Node node = Node.of("");

    @Nullable
    String routeConfigName;

    BackoffPolicy.Provider endpointBackoffPolicyProvider = ClusterChannel.defaultBackoffPolicyProvider();
    BackoffPolicy.Provider discoveryBackoffPolicyProvider = AdsDiscoveryClient.defaultBackoffPolicyProvider();

    private LoadBalancedChannelBuilder(String target, ClientTransportFactory transportFactory) {
        this.target = checkNotNull(target, "target");
        this.transportFactory = checkNotNull(transportFactory, "transportFactory");
    }

    /**
     * Creates a builder for a channel whose calls are routed with {@code target} as their default
     * authority, connecting to endpoints through {@code transportFactory}.
     * 创建构建器，target 作为调用默认的 authority 参与路由
     */
    public static LoadBalancedChannelBuilder forTarget(String target, ClientTransportFactory transportFactory) {
        return new LoadBalancedChannelBuilder(target, transportFactory);
    }

    /**
     * Uses a fixed set of clusters and route configurations.
     * 使用静态的集群和路由配置
     */
    @CanIgnoreReturnValue
    public LoadBalancedChannelBuilder staticResources(List<ClusterResource> clusters,
                                                      List<RouteConfiguration> routeConfigurations) {
        checkState(!hasAdsServer(), "ADS server already configured");
        this.staticClusters = ImmutableList.copyOf(clusters);
        this.staticRouteConfigurations = ImmutableList.copyOf(routeConfigurations);
        return this;
    }

    /**
     * Discovers resources from the aggregated discovery service reachable through
     * {@code controlPlane}. The channel does not take ownership of {@code controlPlane}.
     * 通过 controlPlane 从 ADS 服务获取资源，不负责关闭 controlPlane
     */
    @CanIgnoreReturnValue
    public LoadBalancedChannelBuilder adsServer(Channel controlPlane, Node node) {
        checkState(staticClusters == null, "static resources already configured");
        checkState(!hasAdsServer(), "ADS server already configured");
        this.controlPlane = checkNotNull(controlPlane, "controlPlane");
        this.node = checkNotNull(node, "node");
        return this;
    }

    /**
     * Applies a bootstrap configuration. An ADS server target is dialed with this builder's
     * transport factory through a channel owned by the built channel.
     * 应用启动配置
     */
    @CanIgnoreReturnValue
    public LoadBalancedChannelBuilder bootstrap(BootstrapInfo info) {
        checkNotNull(info, "info");
        if (info.getAdsServerTarget() != null) {
            checkState(staticClusters == null, "static resources already configured");
            checkState(!hasAdsServer(), "ADS server already configured");
            this.controlPlaneTarget = info.getAdsServerTarget();
            this.node = info.getNode();
        } else {
            staticResources(info.getStaticClusters(), info.getStaticRouteConfigurations());
        }
        if (info.getRouteConfigName() != null) {
            routeConfigName(info.getRouteConfigName());
        }
        return this;
    }

    /**
     * Subscribes to this route configuration only. By default all route configurations are used,
     * their routes concatenated in the order received.
     */
    @CanIgnoreReturnValue
    public LoadBalancedChannelBuilder routeConfigName(String routeConfigName) {
        this.routeConfigName = checkNotNull(routeConfigName, "routeConfigName");
        return this;
    }

    @CanIgnoreReturnValue
    public LoadBalancedChannelBuilder endpointBackoff(BackoffPolicy.Provider provider) {
        this.endpointBackoffPolicyProvider = checkNotNull(provider, "provider");
        return this;
    }

    /**
     * Caps the endpoint reconnect backoff. Defaults to 120 seconds.
     * 设置端点重连退避的上限
     */
    @CanIgnoreReturnValue
    public LoadBalancedChannelBuilder maxEndpointBackoff(long duration, TimeUnit unit) {
        checkArgument(duration > 0, "duration must be positive");
        this.endpointBackoffPolicyProvider =
                ClusterChannel.defaultBackoffPolicyProvider().setMaxBackoffNanos(unit.toNanos(duration));
        return this;
    }

    @CanIgnoreReturnValue
    public LoadBalancedChannelBuilder discoveryBackoff(BackoffPolicy.Provider provider) {
        this.discoveryBackoffPolicyProvider = checkNotNull(provider, "provider");
        return this;
    }

    private boolean hasAdsServer() {
        return controlPlane != null || controlPlaneTarget != null;
    }

    @Override
    public LoadBalancedChannel build() {
        checkState(staticClusters != null || hasAdsServer(), "no discovery source configured");
        ExecutorService ownedExecutor = newOwnedExecutorIfAbsent("conduit-lb");
        Executor executor = ownedExecutor != null ? ownedExecutor : getExecutor();
        ScheduledExecutorService ownedScheduler = newOwnedSchedulerIfAbsent("conduit-lb");
        ScheduledExecutorService scheduler = ownedScheduler != null ? ownedScheduler : getScheduledExecutorService();
        if (controlPlaneTarget != null) {
            ownedControlPlane = DirectChannel.newBuilder(EndpointAddresses.parse(controlPlaneTarget), transportFactory)
                    .executor(executor)
                    .scheduledExecutorService(scheduler)
                    .build();
            controlPlane = ownedControlPlane;
        }
        String authority = getAuthorityOverride() != null ? getAuthorityOverride() : target;
        LoadBalancedChannel channel = new LoadBalancedChannel(this, authority, executor, ownedExecutor,
                scheduler, ownedScheduler, buildCompressionNegotiator(), getMaxInboundMessageSize());
        return channel.start();
    }
}
