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
import io.conduit.CallOptions;
import io.conduit.ManagedChannel;
import io.conduit.MethodDescriptor;
import io.conduit.ServerServiceDefinition;
import io.conduit.Status;
import io.conduit.StatusRuntimeException;
import io.conduit.inprocess.InProcessChannelBuilder;
import io.conduit.inprocess.InProcessServer;
import io.conduit.inprocess.InProcessServerBuilder;
import io.conduit.inprocess.InProcessSocketAddress;
import io.conduit.stub.ClientCalls;
import io.conduit.stub.ServerCalls;
import io.conduit.stub.StreamObserver;
import io.conduit.testing.FakeClock;
import io.conduit.testing.StringMarshaller;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.io.IOException;

import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * A load balanced channel fed by an aggregated discovery server.
 */
class LoadBalancedChannelAdsTest {

    private static final MethodDescriptor<String, String> PING = MethodDescriptor.<String, String>newBuilder()
            .setType(MethodDescriptor.MethodType.UNARY)
            .setFullMethodName(MethodDescriptor.generateFullMethodName("pkg.Orders", "Ping"))
            .setRequestMarshaller(StringMarshaller.INSTANCE)
            .setResponseMarshaller(StringMarshaller.INSTANCE)
            .build();

    private final FakeClock fakeClock = new FakeClock();
    private final String backendName = InProcessServerBuilder.generateName();

    private FakeAdsServer adsServer;
    private InProcessServer backend;
    private ManagedChannel controlPlane;
    private LoadBalancedChannel channel;

    @BeforeEach
    void setUp() throws IOException {
        adsServer = new FakeAdsServer().start();
        backend = InProcessServerBuilder.forName(backendName)
                .directExecutor()
                .addService(ServerServiceDefinition.builder("pkg.Orders")
                        .addMethod(PING, ServerCalls.asyncUnaryCall(new ServerCalls.UnaryMethod<String, String>() {
                            @Override
                            public void invoke(String request, StreamObserver<String> responseObserver) {
                                responseObserver.onNext("pong " + request);
                                responseObserver.onCompleted();
                            }
                        }))
                        .build())
                .build()
                .start();
        controlPlane = InProcessChannelBuilder.forName(adsServer.name).directExecutor().build();
        channel = LoadBalancedChannelBuilder
                .forTarget("shop.example.com", InProcessChannelBuilder.newTransportFactory(directExecutor(), null, false))
                .adsServer(controlPlane, Node.of("shop-client"))
                .directExecutor()
                .scheduledExecutorService(fakeClock.getScheduledExecutorService())
                .build();
    }

    @AfterEach
    void tearDown() {
        channel.shutdownNow();
        controlPlane.shutdownNow();
        backend.shutdownNow();
        adsServer.shutdownNow();
    }

    @Test
    void subscribesClustersBeforeRoutes() {
        assertEquals(2, adsServer.requests.size());
        assertEquals(ResourceType.CLUSTER.typeUrl(), adsServer.requests.get(0).getTypeUrl());
        assertEquals(ResourceType.ROUTE_CONFIGURATION.typeUrl(), adsServer.requests.get(1).getTypeUrl());
        assertEquals("shop-client", adsServer.requests.get(0).getNode().getId());
    }

    @Test
    void callsFailUntilRoutesArrive() {
        assertCallFails("no route for shop.example.com/pkg.Orders/Ping");

        pushClusters("1", "n-1", "orders");
        assertCallFails("no route for shop.example.com/pkg.Orders/Ping");

        pushRoutes("1", "n-2", "orders");
        assertEquals("pong a", ping("a"));
    }

    @Test
    void rejectedRoutesLeavePreviousTableInEffect() {
        pushClusters("1", "n-1", "orders");
        pushRoutes("1", "n-2", "orders");
        DiscoveryRequest routeAck = adsServer.lastRequest();
        assertEquals("1", routeAck.getVersionInfo());
        assertFalse(routeAck.isNack());

        pushRoutes("2", "n-3", "payments");

        DiscoveryRequest nack = adsServer.lastRequest();
        assertEquals(ResourceType.ROUTE_CONFIGURATION.typeUrl(), nack.getTypeUrl());
        assertTrue(nack.isNack());
        assertEquals("1", nack.getVersionInfo());
        assertEquals("n-3", nack.getResponseNonce());
        assertEquals("route references unknown cluster payments", nack.getErrorDetail().getDescription());
        assertEquals("orders", channel.getRouter().current().getRoutes().get(0).getClusterName());
        assertEquals("pong b", ping("b"));
    }

    @Test
    void rejectedClustersLeavePreviousClustersInEffect() {
        pushClusters("1", "n-1", "orders");
        pushRoutes("1", "n-2", "orders");

        adsServer.push(ResourceType.CLUSTER, "2", "n-3", ImmutableList.of(
                new ClusterResource("orders", "least_request", ImmutableList.<Endpoint>of())));

        DiscoveryRequest nack = adsServer.lastRequest();
        assertTrue(nack.isNack());
        assertEquals("1", nack.getVersionInfo());
        assertEquals("pong c", ping("c"));
    }

    @Test
    void removedClusterFailsCallsRoutedToIt() {
        pushClusters("1", "n-1", "orders");
        pushRoutes("1", "n-2", "orders");
        ClusterChannel orders = channel.getCluster("orders");

        pushClusters("2", "n-3", "inventory");

        assertNull(channel.getCluster("orders"));
        assertTrue(orders.isTerminated());
        assertCallFails("cluster orders not found");
    }

    @Test
    void controlPlaneOutageKeepsLastSnapshot() {
        pushClusters("1", "n-1", "orders");
        pushRoutes("1", "n-2", "orders");

        adsServer.currentStream().onError(Status.UNAVAILABLE.asRuntimeException());

        assertEquals(2, adsServer.streams.size());
        assertEquals("pong d", ping("d"));
        DiscoveryRequest resumed = adsServer.lastRequest();
        assertEquals("1", resumed.getVersionInfo());
        assertEquals("", resumed.getResponseNonce());
    }

    private void pushClusters(String version, String nonce, String name) {
        adsServer.push(ResourceType.CLUSTER, version, nonce, ImmutableList.of(ClusterResource.roundRobin(name,
                ImmutableList.of(Endpoint.healthy(new InProcessSocketAddress(backendName))))));
    }

    private void pushRoutes(String version, String nonce, String cluster) {
        adsServer.push(ResourceType.ROUTE_CONFIGURATION, version, nonce, ImmutableList.of(
                new RouteConfiguration("main", ImmutableList.of(new Route(RouteMatch.any(), cluster)))));
    }

    private String ping(String message) {
        return ClientCalls.blockingUnaryCall(channel, PING, CallOptions.DEFAULT, message);
    }

    private void assertCallFails(String description) {
        StatusRuntimeException e = assertThrows(StatusRuntimeException.class, new Executable() {
            @Override
            public void execute() {
                ping("x");
            }
        });
        assertEquals(Status.Code.UNAVAILABLE, e.getStatus().getCode());
        assertEquals(description, e.getStatus().getDescription());
    }
}
