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

import com.google.common.collect.ImmutableList;
import io.conduit.Status;
import io.conduit.StatusException;
import io.conduit.inprocess.InProcessChannelBuilder;
import io.conduit.inprocess.InProcessSocketAddress;
import io.conduit.internal.ClientTransportFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.ArrayList;
import java.util.List;

import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EndpointPickerTest {

    private final ClientTransportFactory transportFactory =
            InProcessChannelBuilder.newTransportFactory(directExecutor(), null, false);

    @AfterEach
    void tearDown() {
        transportFactory.close();
    }

    @Test
    void roundRobinRotatesFromStartIndex() throws StatusException {
        List<ClusterChannel.Connection> ready = connections("a", "b", "c");
        EndpointPicker picker = new EndpointPicker.RoundRobinPicker(ready, 1);

        List<ClusterChannel.Connection> picked = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            picked.add(picker.pick());
        }

        assertEquals(ImmutableList.of(ready.get(1), ready.get(2), ready.get(0),
                ready.get(1), ready.get(2), ready.get(0)), picked);
    }

    @Test
    void roundRobinSpreadsEvenly() throws StatusException {
        List<ClusterChannel.Connection> ready = connections("a", "b");
        EndpointPicker picker = EndpointPicker.create("orders", ClusterResource.ROUND_ROBIN, ready);

        int first = 0;
        for (int i = 0; i < 100; i++) {
            if (picker.pick() == ready.get(0)) {
                first++;
            }
        }
        assertEquals(50, first);
    }

    @Test
    void pickFirstAlwaysReturnsFirst() throws StatusException {
        List<ClusterChannel.Connection> ready = connections("a", "b");
        EndpointPicker picker = EndpointPicker.create("orders", ClusterResource.PICK_FIRST, ready);

        assertSame(ready.get(0), picker.pick());
        assertSame(ready.get(0), picker.pick());
        assertEquals(ready, picker.readyConnections());
    }

    @Test
    void emptyPoolFailsUnavailable() {
        final EndpointPicker picker = EndpointPicker.create("orders", ClusterResource.ROUND_ROBIN,
                ImmutableList.<ClusterChannel.Connection>of());

        StatusException e = assertThrows(StatusException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                picker.pick();
            }
        });
        assertEquals(Status.Code.UNAVAILABLE, e.getStatus().getCode());
        assertEquals("no healthy endpoint in cluster orders", e.getStatus().getDescription());
        assertTrue(picker.readyConnections().isEmpty());
    }

    @Test
    void unknownPolicyIsRejected() {
        assertTrue(EndpointPicker.isSupported(ClusterResource.ROUND_ROBIN));
        assertTrue(EndpointPicker.isSupported(ClusterResource.PICK_FIRST));
        assertFalse(EndpointPicker.isSupported("ring_hash"));
        assertThrows(IllegalArgumentException.class, new Executable() {
            @Override
            public void execute() {
                EndpointPicker.create("orders", "ring_hash", connections("a"));
            }
        });
    }

    private List<ClusterChannel.Connection> connections(String... names) {
        List<ClusterChannel.Connection> list = new ArrayList<>();
        for (String name : names) {
            InProcessSocketAddress address = new InProcessSocketAddress(name);
            list.add(new ClusterChannel.Connection(address, transportFactory.newClientTransport(address)));
        }
        return list;
    }
}
