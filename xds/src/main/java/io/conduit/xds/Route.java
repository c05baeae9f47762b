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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Sends calls meeting {@link RouteMatch} to a cluster.
 * 将满足条件的调用路由到指定集群
 */
public final class Route {

    private final RouteMatch match;
    private final String clusterName;

    public Route(RouteMatch match, String clusterName) {
        this.match = checkNotNull(match, "match");
        this.clusterName = checkNotNull(clusterName, "clusterName");
    }

    public RouteMatch getMatch() {
        return match;
    }

    public String getClusterName() {
        return clusterName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Route)) {
            return false;
        }
        Route that = (Route) o;
        return match.equals(that.match) && clusterName.equals(that.clusterName);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(match, clusterName);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("match", match)
                          .add("cluster", clusterName)
                          .toString();
    }
}
