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
 * A named group of endpoints with the policy used to pick among them.
 * 集群资源，包含名称、负载均衡策略和节点列表
 */
public final class ClusterResource {

    public static final String ROUND_ROBIN = "round_robin";
    public static final String PICK_FIRST = "pick_first";

    private final String name;
    private final String lbPolicy;
    private final ImmutableList<Endpoint> endpoints;

    public ClusterResource(String name, String lbPolicy, List<Endpoint> endpoints) {
        this.name = checkNotNull(name, "name");
        this.lbPolicy = checkNotNull(lbPolicy, "lbPolicy");
        this.endpoints = ImmutableList.copyOf(endpoints);
    }

    public static ClusterResource roundRobin(String name, List<Endpoint> endpoints) {
        return new ClusterResource(name, ROUND_ROBIN, endpoints);
    }

    public String getName() {
        return name;
    }

    public String getLbPolicy() {
        return lbPolicy;
    }

    public ImmutableList<Endpoint> getEndpoints() {
        return endpoints;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ClusterResource)) {
            return false;
        }
        ClusterResource that = (ClusterResource) o;
        return name.equals(that.name) && lbPolicy.equals(that.lbPolicy) && endpoints.equals(that.endpoints);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(name, lbPolicy, endpoints);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("name", name)
                          .add("lbPolicy", lbPolicy)
                          .add("endpoints", endpoints)
                          .toString();
    }
}
