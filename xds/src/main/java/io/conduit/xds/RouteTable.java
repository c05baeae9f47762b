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
import io.conduit.Metadata;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.util.List;

/**
 * An immutable snapshot of routes. The first matching route wins.
 * 不可变的路由表，第一个匹配的路由生效
 */
@Immutable
public final class RouteTable {

    public static final RouteTable EMPTY = new RouteTable(ImmutableList.<Route>of());

    private final ImmutableList<Route> routes;

    public RouteTable(List<Route> routes) {
        this.routes = ImmutableList.copyOf(routes);
    }

    public ImmutableList<Route> getRoutes() {
        return routes;
    }

    /**
     * Returns the cluster of the first route matching the call, or {@code null} if none does.
     * 返回第一个匹配路由的集群名称，没有匹配时返回 null
     *
     * @param path the call path, {@code /service/method}
     */
    @Nullable
    public String resolve(String authority, String path, Metadata headers) {
        for (Route route : routes) {
            if (route.getMatch().matches(authority, path, headers)) {
                return route.getClusterName();
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("routes", routes).toString();
    }
}
