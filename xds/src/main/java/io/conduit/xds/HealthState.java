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

/**
 * Health of an endpoint as reported by discovery or observed by the cluster channel.
 * 节点的健康状态
 */
public enum HealthState {
    /**
     * Not yet known; the endpoint is connected to like a healthy one.
     * 未知，按照健康节点处理
     */
    UNKNOWN,
    HEALTHY,
    /**
     * Not connected to. Set by discovery, or after a failed connection attempt until the next
     * retry succeeds.
     * 不健康，不会被选中
     */
    UNHEALTHY,
    /**
     * Leaving the cluster; in-flight calls finish but no new call is picked.
     * 正在下线，进行中的调用会完成，但不再接收新调用
     */
    DRAINING;

    /**
     * Whether the cluster channel should hold a connection to an endpoint in this state.
     */
    boolean isConnectable() {
        return this == UNKNOWN || this == HEALTHY;
    }
}
