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

import com.google.common.io.Files;
import io.conduit.inprocess.InProcessChannelBuilder;
import io.conduit.inprocess.InProcessSocketAddress;
import io.conduit.testing.FakeClock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BootstrapperTest {

    private static final String STATIC_BOOTSTRAP = "{\n"
            + "  \"node\": {\"id\": \"client-1\", \"cluster\": \"edge\"},\n"
            + "  \"route_config_name\": \"main\",\n"
            + "  \"static_resources\": {\n"
            + "    \"clusters\": [{\"name\": \"orders\", \"lb_policy\": \"pick_first\",\n"
            + "                   \"endpoints\": [{\"address\": \"inprocess:orders-1\"}]}],\n"
            + "    \"route_configs\": [{\"name\": \"main\", \"routes\": [{\"cluster\": \"orders\"}]}]\n"
            + "  }\n"
            + "}";

    @TempDir
    File tempDir;

    @Test
    void parsesStaticResources() throws Exception {
        BootstrapInfo info = Bootstrapper.parse(STATIC_BOOTSTRAP);

        assertEquals("client-1", info.getNode().getId());
        assertEquals("edge", info.getNode().getCluster());
        assertNull(info.getAdsServerTarget());
        assertEquals("main", info.getRouteConfigName());
        assertEquals(1, info.getStaticClusters().size());
        ClusterResource orders = info.getStaticClusters().get(0);
        assertEquals(ClusterResource.PICK_FIRST, orders.getLbPolicy());
        assertEquals(new InProcessSocketAddress("orders-1"), orders.getEndpoints().get(0).getAddress());
        assertEquals("orders", info.getStaticRouteConfigurations().get(0).getRoutes().get(0).getClusterName());
    }

    @Test
    void parsesAdsServer() throws Exception {
        BootstrapInfo info = Bootstrapper.parse(
                "{\"node\": {\"id\": \"client-2\"}, \"ads_server\": {\"target\": \"cp.example.com:18000\"}}");

        assertEquals("cp.example.com:18000", info.getAdsServerTarget());
        assertEquals("", info.getNode().getCluster());
        assertNull(info.getRouteConfigName());
        assertTrue(info.getStaticClusters().isEmpty());
    }

    @Test
    void rejectsInvalidDocuments() {
        assertInvalid("not json", "Failed to parse bootstrap JSON");
        assertInvalid("[]", "Bootstrap is not a JSON object");
        assertInvalid("{\"ads_server\": {\"target\": \"cp:1\"}}", "Invalid bootstrap: 'node' required");
        assertInvalid("{\"node\": {}, \"ads_server\": {\"target\": \"cp:1\"}}", null);
        assertInvalid("{\"node\": {\"id\": \"a\"}}",
                "Invalid bootstrap: one of 'ads_server' or 'static_resources' required");
        assertInvalid("{\"node\": {\"id\": \"a\"}, \"ads_server\": {\"target\": \"cp:1\"},"
                        + " \"static_resources\": {}}",
                "Invalid bootstrap: 'ads_server' and 'static_resources' are mutually exclusive");
        assertInvalid("{\"node\": {\"id\": \"a\"}, \"static_resources\": {\"clusters\": [{\"lb_policy\": \"x\"}]}}",
                null);
    }

    @Test
    void environmentVariableWinsOverSystemProperty() throws Exception {
        File fromEnv = write("env.json", STATIC_BOOTSTRAP);
        File fromProperty = write("property.json",
                "{\"node\": {\"id\": \"other\"}, \"ads_server\": {\"target\": \"cp:1\"}}");

        assertEquals("client-1",
                Bootstrapper.fromEnvironment(fromEnv.getPath(), fromProperty.getPath()).getNode().getId());
        assertEquals("other", Bootstrapper.fromEnvironment(null, fromProperty.getPath()).getNode().getId());
    }

    @Test
    void missingLocationOrFileFails() {
        XdsInitializationException e = assertThrows(XdsInitializationException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                Bootstrapper.fromEnvironment(null, null);
            }
        });
        assertTrue(e.getMessage().contains(Bootstrapper.BOOTSTRAP_PATH_ENV_VAR));

        final String missing = new File(tempDir, "missing.json").getPath();
        e = assertThrows(XdsInitializationException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                Bootstrapper.fromFile(missing);
            }
        });
        assertTrue(e.getCause() instanceof IOException);
    }

    @Test
    void bootstrapWithAdsServerDialsControlPlane() throws Exception {
        FakeAdsServer adsServer = new FakeAdsServer().start();
        FakeClock fakeClock = new FakeClock();
        BootstrapInfo info = Bootstrapper.parse("{\"node\": {\"id\": \"client-3\"},"
                + " \"ads_server\": {\"target\": \"inprocess:" + adsServer.name + "\"},"
                + " \"route_config_name\": \"main\"}");
        LoadBalancedChannel channel = LoadBalancedChannelBuilder
                .forTarget("shop.example.com", InProcessChannelBuilder.newTransportFactory(directExecutor(), null, false))
                .bootstrap(info)
                .directExecutor()
                .scheduledExecutorService(fakeClock.getScheduledExecutorService())
                .build();
        try {
            assertEquals(2, adsServer.requests.size());
            assertEquals("client-3", adsServer.requests.get(0).getNode().getId());
            DiscoveryRequest routeRequest = adsServer.requests.get(1);
            assertEquals(ResourceType.ROUTE_CONFIGURATION.typeUrl(), routeRequest.getTypeUrl());
            assertEquals("main", routeRequest.getResourceNames().get(0));
        } finally {
            channel.shutdownNow();
            adsServer.shutdownNow();
        }
        assertTrue(channel.isTerminated());
    }

    private static void assertInvalid(final String json, String message) {
        XdsInitializationException e = assertThrows(XdsInitializationException.class, new Executable() {
            @Override
            public void execute() throws Throwable {
                Bootstrapper.parse(json);
            }
        }, json);
        if (message != null) {
            assertEquals(message, e.getMessage());
        }
    }

    private File write(String name, String content) throws IOException {
        File file = new File(tempDir, name);
        Files.asCharSink(file, StandardCharsets.UTF_8).write(content);
        return file;
    }
}
