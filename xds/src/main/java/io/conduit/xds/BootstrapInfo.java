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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Parsed bootstrap configuration: the node identity and exactly one discovery source, either the
 * address of an aggregated discovery server or a set of static resources.
 * 解析后的启动配置，包含节点信息以及唯一的发现来源：ADS 服务地址或静态资源
 */
@Immutable
public final class BootstrapInfo {

    private final Node node;
    @Nullable
    private final String adsServerTarget;
    @Nullable
    private final String routeConfigName;
    private final ImmutableList<ClusterResource> staticClusters;
    private final ImmutableList<RouteConfiguration> staticRouteConfigurations;

    BootstrapInfo(Node node,
                  @Nullable String adsServerTarget,
                  @Nullable String routeConfigName,
                  List<ClusterResource> staticClusters,
                  List<RouteConfiguration> staticRouteConfigurations) {
        this.node = checkNotNull(node, "node");
        this.adsServerTarget = adsServerTarget;
        this.routeConfigName = routeConfigName;
        this.staticClusters = ImmutableList.copyOf(staticClusters);
        this.staticRouteConfigurations = ImmutableList.copyOf(staticRouteConfigurations);
        checkArgument(adsServerTarget == null || (staticClusters.isEmpty() && staticRouteConfigurations.isEmpty()),
                "ADS server and static resources are mutually exclusive");
    }

    public Node getNode() {
        return node;
    }

    /**
     * Address of the aggregated discovery server, or {@code null} when resources are static.
     */
    @Nullable
    public String getAdsServerTarget() {
        return adsServerTarget;
    }

    @Nullable
    public String getRouteConfigName() {
        return routeConfigName;
    }

    public ImmutableList<ClusterResource> getStaticClusters() {
        return staticClusters;
    }

    public ImmutableList<RouteConfiguration> getStaticRouteConfigurations() {
        return staticRouteConfigurations;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("node", node)
                .add("adsServerTarget", adsServerTarget)
                .add("routeConfigName", routeConfigName)
                .add("staticClusters", staticClusters.size())
                .add("staticRouteConfigurations", staticRouteConfigurations.size())
                .toString();
    }
}
