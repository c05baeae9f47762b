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
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A named, ordered list of routes as delivered by discovery.
 * 路由配置资源，包含有序的路由列表
 */
public final class RouteConfiguration {

    private final String name;
    private final ImmutableList<Route> routes;

    public RouteConfiguration(String name, List<Route> routes) {
        this.name = checkNotNull(name, "name");
        this.routes = ImmutableList.copyOf(routes);
    }

    public String getName() {
        return name;
    }

    public ImmutableList<Route> getRoutes() {
        return routes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RouteConfiguration)) {
            return false;
        }
        RouteConfiguration that = (RouteConfiguration) o;
        return name.equals(that.name) && routes.equals(that.routes);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(name, routes);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("name", name)
                          .add("routes", routes)
                          .toString();
    }
}
