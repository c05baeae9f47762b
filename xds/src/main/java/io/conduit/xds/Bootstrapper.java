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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.Files;

import javax.annotation.Nullable;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads the bootstrap configuration.
 * 读取启动配置
 *
 * <p>The configuration is a JSON object:
 * <pre>
 * {
 *   "node": {"id": "client-1", "cluster": "edge"},
 *   "ads_server": {"target": "cp.example.com:18000"},
 *   "route_config_name": "default",
 *   "static_resources": {"clusters": [...], "route_configs": [...]}
 * }
 * </pre>
 * Exactly one of {@code ads_server} and {@code static_resources} must be present. Static resources
 * use the same JSON shape as discovery resources.
 */
public final class Bootstrapper {

    private static final Logger logger = Logger.getLogger(Bootstrapper.class.getName());

    static final String BOOTSTRAP_PATH_ENV_VAR = "CONDUIT_XDS_BOOTSTRAP";

    static final String BOOTSTRAP_PATH_SYS_PROPERTY = "io.conduit.xds.bootstrap";

    private Bootstrapper() {
    }

    /**
     * Reads the file named by the {@value #BOOTSTRAP_PATH_ENV_VAR} environment variable, or when it
     * is unset, by the {@value #BOOTSTRAP_PATH_SYS_PROPERTY} system property.
     * 从环境变量或系统属性指定的文件中读取配置
     */
    public static BootstrapInfo fromEnvironment() throws XdsInitializationException {
        return fromEnvironment(System.getenv(BOOTSTRAP_PATH_ENV_VAR), System.getProperty(BOOTSTRAP_PATH_SYS_PROPERTY));
    }

    @VisibleForTesting
    static BootstrapInfo fromEnvironment(@Nullable String envPath, @Nullable String propertyPath)
            throws XdsInitializationException {
        String path = envPath != null ? envPath : propertyPath;
        if (path == null) {
            throw new XdsInitializationException("Environment variable " + BOOTSTRAP_PATH_ENV_VAR
                    + " or system property " + BOOTSTRAP_PATH_SYS_PROPERTY + " not defined");
        }
        return fromFile(path);
    }

    public static BootstrapInfo fromFile(String path) throws XdsInitializationException {
        logger.log(Level.FINE, "Reading bootstrap file from {0}", path);
        String content;
        try {
            content = Files.asCharSource(new File(path), StandardCharsets.UTF_8).read();
        } catch (IOException e) {
            throw new XdsInitializationException("Fail to read bootstrap file " + path, e);
        }
        return parse(content);
    }

    public static BootstrapInfo parse(String json) throws XdsInitializationException {
        Object raw;
        try {
            raw = JsonParser.parse(json);
        } catch (IOException | IllegalStateException e) {
            throw new XdsInitializationException("Failed to parse bootstrap JSON", e);
        }
        if (!(raw instanceof Map)) {
            throw new XdsInitializationException("Bootstrap is not a JSON object");
        }
        @SuppressWarnings("unchecked")
        Map<String, ?> rawBootstrap = (Map<String, ?>) raw;
        try {
            return parseBootstrap(rawBootstrap);
        } catch (ResourceInvalidException | ClassCastException | IllegalArgumentException e) {
            throw new XdsInitializationException("Invalid bootstrap: " + e.getMessage(), e);
        }
    }

    private static BootstrapInfo parseBootstrap(Map<String, ?> rawBootstrap)
            throws ResourceInvalidException, XdsInitializationException {
        Map<String, ?> rawNode = JsonUtil.getObject(rawBootstrap, "node");
        if (rawNode == null) {
            throw new XdsInitializationException("Invalid bootstrap: 'node' required");
        }
        Node base = Node.of(JsonUtil.getRequiredString(rawNode, "id"));
        String nodeCluster = JsonUtil.getString(rawNode, "cluster");
        Node node = new Node(base.getId(), nodeCluster == null ? "" : nodeCluster,
                base.getUserAgentName(), base.getUserAgentVersion());

        String adsTarget = null;
        Map<String, ?> rawAds = JsonUtil.getObject(rawBootstrap, "ads_server");
        if (rawAds != null) {
            adsTarget = JsonUtil.getRequiredString(rawAds, "target");
        }

        List<ClusterResource> clusters = new ArrayList<>();
        List<RouteConfiguration> routeConfigs = new ArrayList<>();
        Map<String, ?> rawStatic = JsonUtil.getObject(rawBootstrap, "static_resources");
        if (rawStatic != null) {
            List<Map<String, ?>> rawClusters = JsonUtil.getListOfObjects(rawStatic, "clusters");
            if (rawClusters != null) {
                for (Map<String, ?> rawCluster : rawClusters) {
                    clusters.add(ResourceType.CLUSTER.fromJson(rawCluster));
                }
            }
            List<Map<String, ?>> rawRouteConfigs = JsonUtil.getListOfObjects(rawStatic, "route_configs");
            if (rawRouteConfigs != null) {
                for (Map<String, ?> rawRouteConfig : rawRouteConfigs) {
                    routeConfigs.add(ResourceType.ROUTE_CONFIGURATION.fromJson(rawRouteConfig));
                }
            }
        }
        if (adsTarget == null && rawStatic == null) {
            throw new XdsInitializationException("Invalid bootstrap: one of 'ads_server' or 'static_resources' required");
        }
        if (adsTarget != null && rawStatic != null) {
            throw new XdsInitializationException(
                    "Invalid bootstrap: 'ads_server' and 'static_resources' are mutually exclusive");
        }
        return new BootstrapInfo(node, adsTarget, JsonUtil.getString(rawBootstrap, "route_config_name"),
                clusters, routeConfigs);
    }
}
