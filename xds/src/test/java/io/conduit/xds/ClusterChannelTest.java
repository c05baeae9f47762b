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
import io.conduit.SynchronizationContext;
import io.conduit.inprocess.InProcessChannelBuilder;
import io.conduit.inprocess.InProcessServer;
import io.conduit.inprocess.InProcessServerBuilder;
import io.conduit.inprocess.InProcessSocketAddress;
import io.conduit.internal.ClientTransportFactory;
import io.conduit.internal.ExponentialBackoffPolicy;
import io.conduit.testing.FakeClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.io.IOException;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Drives a cluster over in-process endpoints; an endpoint whose server is not running fails to
 * connect.
 */
class ClusterChannelTest {

    private final FakeClock fakeClock = new FakeClock();
    private final List<Throwable> uncaught = new ArrayList<>();
    private final SynchronizationContext syncContext = new SynchronizationContext(
            new Thread.UncaughtExceptionHandler() {
                @Override
                public void uncaughtException(Thread t, Throwable e) {
                    uncaught.add(e);
                }
            });
    private final ClientTransportFactory transportFactory =
            InProcessChannelBuilder.newTransportFactory(directExecutor(), null, false);
    private final AtomicInteger terminations = new AtomicInteger();
    private final List<InProcessServer> servers = new ArrayList<>();

    private final String name1 = InProcessServerBuilder.generateName();
    private final String name2 = InProcessServerBuilder.generateName();
    private final SocketAddress endpoint1 = new InProcessSocketAddress(name1);
    private final SocketAddress endpoint2 = new InProcessSocketAddress(name2);

    private ClusterChannel cluster;

    @BeforeEach
    void setUp() throws IOException {
        startServer(name1);
        cluster = new ClusterChannel("orders", transportFactory, syncContext,
                fakeClock.getScheduledExecutorService(),
                new ExponentialBackoffPolicy.Provider().setJitter(0).setMultiplier(2),
                new Runnable() {
                    @Override
                    public void run() {
                        terminations.incrementAndGet();
                    }
                });
    }

    @AfterEach
    void tearDown() {
        cluster.shutdownNow(Status.UNAVAILABLE);
        for (InProcessServer server : servers) {
            server.shutdownNow();
        }
        transportFactory.close();
        assertTrue(uncaught.isEmpty(), uncaught.toString());
    }

    @Test
    void failedEndpointIsExcludedAndReconnectedAfterBackoff() throws Exception {
        cluster.update(ClusterResource.roundRobin("orders",
                ImmutableList.of(Endpoint.healthy(endpoint1), Endpoint.healthy(endpoint2))));

        assertEquals(HealthState.HEALTHY, cluster.endpointHealth().get(endpoint1));
        assertEquals(HealthState.UNHEALTHY, cluster.endpointHealth().get(endpoint2));
        for (int i = 0; i < 4; i++) {
            assertEquals(endpoint1, cluster.pick().getAddress());
        }
        assertEquals(1, fakeClock.numPendingTasks());

        // 第一次重连仍然失败，退避时间翻倍
        fakeClock.forwardTime(1, TimeUnit.SECONDS);
        assertEquals(HealthState.UNHEALTHY, cluster.endpointHealth().get(endpoint2));
        fakeClock.forwardTime(1999, TimeUnit.MILLISECONDS);
        assertEquals(1, fakeClock.numPendingTasks());

        startServer(name2);
        fakeClock.forwardTime(1, TimeUnit.MILLISECONDS);

        assertEquals(HealthState.HEALTHY, cluster.endpointHealth().get(endpoint2));
        assertEquals(0, fakeClock.numPendingTasks());
        Set<SocketAddress> picked = new HashSet<>();
        for (int i = 0; i < 4; i++) {
            picked.add(cluster.pick().getAddress());
        }
        assertEquals(2, picked.size());
    }

    @Test
    void serverShutdownTakesEndpointOutOfPool() throws Exception {
        cluster.update(ClusterResource.roundRobin("orders", ImmutableList.of(Endpoint.healthy(endpoint1))));
        assertEquals(1, cluster.readyConnections().size());

        servers.get(0).shutdown();

        assertEquals(HealthState.UNHEALTHY, cluster.endpointHealth().get(endpoint1));
        assertUnavailable();
        assertEquals(1, fakeClock.numPendingTasks());
    }

    @Test
    void drainingAndRemovedEndpointsLeavePool() throws Exception {
        startServer(name2);
        cluster.update(ClusterResource.roundRobin("orders",
                ImmutableList.of(Endpoint.healthy(endpoint1), Endpoint.healthy(endpoint2))));
        assertEquals(2, cluster.readyConnections().size());

        cluster.update(ClusterResource.roundRobin("orders", ImmutableList.of(
                new Endpoint(endpoint1, HealthState.DRAINING), Endpoint.healthy(endpoint2))));
        assertEquals(1, cluster.readyConnections().size());
        assertEquals(endpoint2, cluster.pick().getAddress());
        assertEquals(HealthState.DRAINING, cluster.endpointHealth().get(endpoint1));

        cluster.update(ClusterResource.roundRobin("orders", ImmutableList.of(Endpoint.healthy(endpoint1))));
        assertEquals(1, cluster.readyConnections().size());
        assertEquals(endpoint1, cluster.pick().getAddress());
        assertFalse(cluster.endpointHealth().containsKey(endpoint2));
        assertEquals(0, fakeClock.numPendingTasks());
    }

    @Test
    void unhealthyFromDiscoveryIsNotConnected() throws Exception {
        cluster.update(ClusterResource.roundRobin("orders",
                ImmutableList.of(new Endpoint(endpoint1, HealthState.UNHEALTHY))));

        assertUnavailable();
        assertEquals(0, fakeClock.numPendingTasks());

        cluster.update(ClusterResource.roundRobin("orders", ImmutableList.of(Endpoint.healthy(endpoint1))));
        assertEquals(endpoint1, cluster.pick().getAddress());
    }

    @Test
    void endpointBackFromUnhealthyReportsDiscoveredHealthWhileConnecting() throws Exception {
        cluster.update(ClusterResource.roundRobin("orders",
                ImmutableList.of(new Endpoint(endpoint1, HealthState.UNHEALTHY))));
        assertEquals(HealthState.UNHEALTHY, cluster.endpointHealth().get(endpoint1));

        // 在连接建立之前检查健康状态
        final List<HealthState> whileConnecting = new ArrayList<>();
        final List<Integer> readyWhileConnecting = new ArrayList<>();
        syncContext.execute(new Runnable() {
            @Override
            public void run() {
                cluster.update(ClusterResource.roundRobin("orders", ImmutableList.of(Endpoint.healthy(endpoint1))));
                syncContext.executeLater(new Runnable() {
                    @Override
                    public void run() {
                        whileConnecting.add(cluster.endpointHealth().get(endpoint1));
                        readyWhileConnecting.add(cluster.readyConnections().size());
                    }
                });
            }
        });

        assertEquals(HealthState.HEALTHY, whileConnecting.get(0));
        assertEquals(0, (int) readyWhileConnecting.get(0));
        assertEquals(endpoint1, cluster.pick().getAddress());
    }

    @Test
    void endpointInBackoffStaysUnhealthyWhenDiscoveryRepeatsHealthy() {
        cluster.update(ClusterResource.roundRobin("orders", ImmutableList.of(Endpoint.healthy(endpoint2))));
        assertEquals(HealthState.UNHEALTHY, cluster.endpointHealth().get(endpoint2));
        assertEquals(1, fakeClock.numPendingTasks());

        cluster.update(ClusterResource.roundRobin("orders", ImmutableList.of(Endpoint.healthy(endpoint2))));

        assertEquals(HealthState.UNHEALTHY, cluster.endpointHealth().get(endpoint2));
        assertEquals(1, fakeClock.numPendingTasks());
    }

    @Test
    void removingFailedEndpointCancelsReconnect() {
        cluster.update(ClusterResource.roundRobin("orders", ImmutableList.of(Endpoint.healthy(endpoint2))));
        assertEquals(1, fakeClock.numPendingTasks());

        cluster.update(ClusterResource.roundRobin("orders", ImmutableList.<Endpoint>of()));

        assertEquals(0, fakeClock.numPendingTasks());
        assertTrue(cluster.endpointHealth().isEmpty());
    }

    @Test
    void shutdownEmptiesPoolAndTerminates() {
        cluster.update(ClusterResource.roundRobin("orders", ImmutableList.of(Endpoint.healthy(endpoint1))));

        cluster.shutdown();

        StatusException e = assertUnavailable();
        assertEquals(ClusterChannel.SHUTDOWN_STATUS.getDescription(), e.getStatus().getDescription());
        assertTrue(cluster.isTerminated());
        assertEquals(1, terminations.get());

        cluster.update(ClusterResource.roundRobin("orders", ImmutableList.of(Endpoint.healthy(endpoint1))));
        assertTrue(cluster.readyConnections().isEmpty());
    }

    @Test
    void nameMismatchIsRejected() {
        assertThrows(IllegalStateException.class, new Executable() {
            @Override
            public void execute() {
                cluster.update(ClusterResource.roundRobin("users", ImmutableList.<Endpoint>of()));
            }
        });
    }

    private StatusException assertUnavailable() {
        StatusException e = assertThrows(StatusException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                cluster.pick();
            }
        });
        assertEquals(Status.Code.UNAVAILABLE, e.getStatus().getCode());
        return e;
    }

    private void startServer(String name) throws IOException {
        servers.add(InProcessServerBuilder.forName(name).directExecutor().build().start());
    }
}
