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

import io.conduit.Status;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.List;

/**
 * Source of cluster and route resources. Every update is a full snapshot of the subscribed type.
 * 集群和路由资源的来源，每次更新都是该类型的完整快照
 *
 * <p>The receiver of an update reports whether it accepted the snapshot through {@link #ack}; a
 * rejected snapshot leaves the previously accepted one in effect.
 */
public interface EndpointDiscovery {

    /**
     * Subscribes to resources of {@code type}. An empty {@code names} collection subscribes to all
     * resources of the type.
     * 订阅指定类型的资源，名称为空时订阅该类型的所有资源
     */
    <T> void subscribe(ResourceType<T> type, Collection<String> names, ResourceWatcher<T> watcher);

    /**
     * Reports the outcome of validating the snapshot delivered with {@code version} and
     * {@code nonce}. The nonce identifies the answered response even when later responses of the
     * same type were received in the meantime.
     * 反馈指定版本快照的校验结果，nonce 标识所应答的响应
     *
     * @param detail the reason of a rejection, ignored when {@code accepted}
     */
    void ack(ResourceType<?> type, String version, String nonce, boolean accepted, @Nullable String detail);

    /**
     * Stops discovery. No watcher is notified afterwards.
     */
    void shutdown();

    /**
     * Receives resource snapshots. Callbacks of one discovery source are never concurrent.
     * 资源快照的监听器，同一个来源的回调不会并发执行
     */
    interface ResourceWatcher<T> {

        /**
         * A full snapshot. {@code nonce} must be handed back to {@link #ack} with the outcome.
         */
        void onUpdate(String version, String nonce, List<T> resources);

        /**
         * A snapshot could not be decoded, or the source is unreachable. The last accepted snapshot
         * stays in effect.
         */
        void onError(Status error);
    }
}
