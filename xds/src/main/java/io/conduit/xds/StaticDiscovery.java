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
import com.google.common.collect.ImmutableSet;

import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Discovery over a fixed set of resources. Each subscription receives exactly one snapshot,
 * synchronously, with version {@value #VERSION}.
 * 静态资源发现，每个订阅同步收到一次快照
 */
public final class StaticDiscovery implements EndpointDiscovery {

    private static final Logger logger = Logger.getLogger(StaticDiscovery.class.getName());

    static final String VERSION = "static";

    private final ImmutableList<ClusterResource> clusters;
    private final ImmutableList<RouteConfiguration> routeConfigurations;

    @GuardedBy("this")
    private boolean shutdown;

    public StaticDiscovery(List<ClusterResource> clusters, List<RouteConfiguration> routeConfigurations) {
        this.clusters = ImmutableList.copyOf(clusters);
        this.routeConfigurations = ImmutableList.copyOf(routeConfigurations);
    }

    @Override
    public <T> void subscribe(ResourceType<T> type, Collection<String> names, ResourceWatcher<T> watcher) {
        checkNotNull(watcher, "watcher");
        synchronized (this) {
            checkState(!shutdown, "discovery shut down");
        }
        List<T> snapshot = filter(type, resourcesOf(type), names);
        logger.log(Level.FINE, "Delivering {0} static {1} resources", new Object[]{snapshot.size(), type});
        watcher.onUpdate(VERSION, "", snapshot);
    }

    @SuppressWarnings("unchecked")
    private <T> List<T> resourcesOf(ResourceType<T> type) {
        if (type == ResourceType.CLUSTER) {
            return (List<T>) clusters;
        }
        if (type == ResourceType.ROUTE_CONFIGURATION) {
            return (List<T>) routeConfigurations;
        }
        throw new IllegalArgumentException("Unsupported resource type " + type);
    }

    private static <T> List<T> filter(ResourceType<T> type, List<T> resources, Collection<String> names) {
        if (names.isEmpty()) {
            return resources;
        }
        ImmutableSet<String> wanted = ImmutableSet.copyOf(names);
        List<T> filtered = new ArrayList<>();
        for (T resource : resources) {
            if (wanted.contains(type.nameOf(resource))) {
                filtered.add(resource);
            }
        }
        return filtered;
    }

    @Override
    public void ack(ResourceType<?> type, String version, String nonce, boolean accepted, @Nullable String detail) {
        if (!accepted) {
            logger.log(Level.WARNING, "Static {0} resources rejected: {1}", new Object[]{type, detail});
        }
    }

    @Override
    public synchronized void shutdown() {
        shutdown = true;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("clusters", clusters.size())
                .add("routeConfigurations", routeConfigurations.size())
                .toString();
    }
}
