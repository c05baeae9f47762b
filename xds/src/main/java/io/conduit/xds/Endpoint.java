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

import java.net.SocketAddress;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A backend address with its health state. Immutable; a state change is a new instance.
 * 后端节点地址及其健康状态，不可变
 */
public final class Endpoint {

    private final SocketAddress address;
    private final HealthState health;

    public Endpoint(SocketAddress address, HealthState health) {
        this.address = checkNotNull(address, "address");
        this.health = checkNotNull(health, "health");
    }

    public static Endpoint healthy(SocketAddress address) {
        return new Endpoint(address, HealthState.HEALTHY);
    }

    public SocketAddress getAddress() {
        return address;
    }

    public HealthState getHealth() {
        return health;
    }

    public Endpoint withHealth(HealthState health) {
        return new Endpoint(address, health);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Endpoint)) {
            return false;
        }
        Endpoint that = (Endpoint) o;
        return address.equals(that.address) && health == that.health;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(address, health);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("address", address)
                          .add("health", health)
                          .toString();
    }
}
