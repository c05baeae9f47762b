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
 * Identifies the client to the control plane.
 * 向控制面标识客户端的节点信息
 */
public final class Node {

    private final String id;
    private final String cluster;
    private final String userAgentName;
    private final String userAgentVersion;

    public Node(String id, String cluster, String userAgentName, String userAgentVersion) {
        this.id = checkNotNull(id, "id");
        this.cluster = checkNotNull(cluster, "cluster");
        this.userAgentName = checkNotNull(userAgentName, "userAgentName");
        this.userAgentVersion = checkNotNull(userAgentVersion, "userAgentVersion");
    }

    /**
     * A node carrying only an id, with this library as user agent.
     */
    public static Node of(String id) {
        return new Node(id, "", "conduit-java", "0.1.0");
    }

    public String getId() {
        return id;
    }

    public String getCluster() {
        return cluster;
    }

    public String getUserAgentName() {
        return userAgentName;
    }

    public String getUserAgentVersion() {
        return userAgentVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Node)) {
            return false;
        }
        Node that = (Node) o;
        return id.equals(that.id) && cluster.equals(that.cluster)
                && userAgentName.equals(that.userAgentName) && userAgentVersion.equals(that.userAgentVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id, cluster, userAgentName, userAgentVersion);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("id", id)
                          .add("cluster", cluster)
                          .add("userAgentName", userAgentName)
                          .add("userAgentVersion", userAgentVersion)
                          .toString();
    }
}
