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
import io.conduit.Status;
import io.conduit.StatusException;

import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Immutable choice over the ready connections of a cluster. A new picker is built on every pool
 * change and swapped in atomically.
 * 集群可用连接的选择器，不可变，连接池变化时整体替换
 */
abstract class EndpointPicker {

    private static final Random random = new Random();

    /**
     * Selects a ready connection.
     *
     * @throws StatusException {@code UNAVAILABLE} when no connection is ready
     */
    abstract ClusterChannel.Connection pick() throws StatusException;

    abstract List<ClusterChannel.Connection> readyConnections();

    /**
     * Builds the picker for {@code lbPolicy} over {@code ready}, in pool order.
     * 根据负载均衡策略构建选择器
     */
    static EndpointPicker create(String cluster, String lbPolicy, List<ClusterChannel.Connection> ready) {
        if (ready.isEmpty()) {
            return new EmptyPicker(Status.UNAVAILABLE.withDescription("no healthy endpoint in cluster " + cluster));
        }
        if (ClusterResource.PICK_FIRST.equals(lbPolicy)) {
            return new PickFirstPicker(ready);
        }
        if (ClusterResource.ROUND_ROBIN.equals(lbPolicy)) {
            return new RoundRobinPicker(ready, random.nextInt(ready.size()));
        }
        throw new IllegalArgumentException("Unsupported lb policy " + lbPolicy);
    }

    static boolean isSupported(String lbPolicy) {
        return ClusterResource.ROUND_ROBIN.equals(lbPolicy) || ClusterResource.PICK_FIRST.equals(lbPolicy);
    }

    static final class EmptyPicker extends EndpointPicker {
        private final Status status;

        EmptyPicker(Status status) {
            this.status = checkNotNull(status, "status");
        }

        @Override
        ClusterChannel.Connection pick() throws StatusException {
            throw status.asException();
        }

        @Override
        List<ClusterChannel.Connection> readyConnections() {
            return ImmutableList.of();
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(EmptyPicker.class).add("status", status).toString();
        }
    }

    /**
     * 轮询选择下一个连接
     */
    static final class RoundRobinPicker extends EndpointPicker {

        private static final AtomicIntegerFieldUpdater<RoundRobinPicker> indexUpdater =
                AtomicIntegerFieldUpdater.newUpdater(RoundRobinPicker.class, "index");

        private final ImmutableList<ClusterChannel.Connection> list; // non-empty
        @SuppressWarnings("unused")
        private volatile int index;

        RoundRobinPicker(List<ClusterChannel.Connection> list, int startIndex) {
            checkArgument(!list.isEmpty(), "empty list");
            this.list = ImmutableList.copyOf(list);
            this.index = startIndex - 1;
        }

        @Override
        ClusterChannel.Connection pick() {
            int size = list.size();
            int i = indexUpdater.incrementAndGet(this);
            if (i >= size) {
                int oldi = i;
                i %= size;
                indexUpdater.compareAndSet(this, oldi, i);
            }
            return list.get(i);
        }

        @Override
        List<ClusterChannel.Connection> readyConnections() {
            return list;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(RoundRobinPicker.class).add("list", list).toString();
        }
    }

    /**
     * 总是选择第一个可用连接
     */
    static final class PickFirstPicker extends EndpointPicker {
        private final ImmutableList<ClusterChannel.Connection> list;

        PickFirstPicker(List<ClusterChannel.Connection> list) {
            checkArgument(!list.isEmpty(), "empty list");
            this.list = ImmutableList.copyOf(list);
        }

        @Override
        ClusterChannel.Connection pick() {
            return list.get(0);
        }

        @Override
        List<ClusterChannel.Connection> readyConnections() {
            return list;
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(PickFirstPicker.class).add("first", list.get(0)).toString();
        }
    }
}
