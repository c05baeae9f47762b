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

import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A kind of discovery resource: its type URL and the codec between the resource and the opaque
 * bytes carried in discovery responses. Resources are encoded as JSON.
 * 发现资源的类型，包含类型 URL 以及资源与字节之间的编解码，资源使用 JSON 编码
 */
public abstract class ResourceType<T> {

    public static final ResourceType<ClusterResource> CLUSTER = new ClusterType();

    public static final ResourceType<RouteConfiguration> ROUTE_CONFIGURATION = new RouteConfigurationType();

    private final String typeUrl;

    ResourceType(String typeUrl) {
        this.typeUrl = typeUrl;
    }

    public final String typeUrl() {
        return typeUrl;
    }

    /**
     * The name identifying the resource within its type.
     */
    public abstract String nameOf(T resource);

    /**
     * Decodes one resource.
     * 解析单个资源
     *
     * @throws ResourceInvalidException if the bytes are not a valid resource of this type
     */
    public final T decode(byte[] value) throws ResourceInvalidException {
        Object json;
        try {
            json = JsonParser.parse(new String(value, StandardCharsets.UTF_8));
        } catch (IOException | IllegalStateException e) {
            throw new ResourceInvalidException("malformed JSON: " + e.getMessage(), e);
        }
        if (!(json instanceof Map)) {
            throw new ResourceInvalidException("resource is not a JSON object");
        }
        @SuppressWarnings("unchecked")
        Map<String, ?> obj = (Map<String, ?>) json;
        try {
            return fromJson(obj);
        } catch (ClassCastException | IllegalArgumentException e) {
            throw new ResourceInvalidException(e.getMessage(), e);
        }
    }

    /**
     * Encodes one resource.
     * 编码单个资源
     */
    public final byte[] encode(T resource) {
        StringWriter out = new StringWriter();
        try {
            JsonWriter writer = new JsonWriter(out);
            toJson(writer, resource);
            writer.close();
        } catch (IOException e) {
            // StringWriter does not throw
            throw new AssertionError(e);
        }
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    abstract T fromJson(Map<String, ?> obj) throws ResourceInvalidException;

    abstract void toJson(JsonWriter writer, T resource) throws IOException;

    @Override
    public String toString() {
        return typeUrl;
    }

    private static final class ClusterType extends ResourceType<ClusterResource> {

        ClusterType() {
            super("type.googleapis.com/envoy.config.cluster.v3.Cluster");
        }

        @Override
        public String nameOf(ClusterResource resource) {
            return resource.getName();
        }

        @Override
        ClusterResource fromJson(Map<String, ?> obj) throws ResourceInvalidException {
            String name = JsonUtil.getRequiredString(obj, "name");
            String lbPolicy = JsonUtil.getString(obj, "lb_policy");
            List<Endpoint> endpoints = new ArrayList<>();
            List<Map<String, ?>> rawEndpoints = JsonUtil.getListOfObjects(obj, "endpoints");
            if (rawEndpoints != null) {
                for (Map<String, ?> rawEndpoint : rawEndpoints) {
                    String address = JsonUtil.getRequiredString(rawEndpoint, "address");
                    String health = JsonUtil.getString(rawEndpoint, "health");
                    HealthState state;
                    try {
                        state = health == null ? HealthState.UNKNOWN
                                : HealthState.valueOf(health.toUpperCase(Locale.US));
                    } catch (IllegalArgumentException e) {
                        throw new ResourceInvalidException("unknown health state " + health + " in cluster " + name);
                    }
                    endpoints.add(new Endpoint(EndpointAddresses.parse(address), state));
                }
            }
            return new ClusterResource(name, lbPolicy == null ? ClusterResource.ROUND_ROBIN : lbPolicy, endpoints);
        }

        @Override
        void toJson(JsonWriter writer, ClusterResource resource) throws IOException {
            writer.beginObject();
            writer.name("name").value(resource.getName());
            writer.name("lb_policy").value(resource.getLbPolicy());
            writer.name("endpoints").beginArray();
            for (Endpoint endpoint : resource.getEndpoints()) {
                writer.beginObject();
                writer.name("address").value(EndpointAddresses.format(endpoint.getAddress()));
                writer.name("health").value(endpoint.getHealth().name());
                writer.endObject();
            }
            writer.endArray();
            writer.endObject();
        }
    }

    private static final class RouteConfigurationType extends ResourceType<RouteConfiguration> {

        RouteConfigurationType() {
            super("type.googleapis.com/envoy.config.route.v3.RouteConfiguration");
        }

        @Override
        public String nameOf(RouteConfiguration resource) {
            return resource.getName();
        }

        @Override
        RouteConfiguration fromJson(Map<String, ?> obj) throws ResourceInvalidException {
            String name = JsonUtil.getRequiredString(obj, "name");
            List<Route> routes = new ArrayList<>();
            List<Map<String, ?>> rawRoutes = JsonUtil.getListOfObjects(obj, "routes");
            if (rawRoutes != null) {
                for (Map<String, ?> rawRoute : rawRoutes) {
                    String cluster = JsonUtil.getRequiredString(rawRoute, "cluster");
                    Map<String, ?> rawMatch = JsonUtil.getObject(rawRoute, "match");
                    RouteMatch match = rawMatch == null ? RouteMatch.any() : parseMatch(rawMatch);
                    routes.add(new Route(match, cluster));
                }
            }
            return new RouteConfiguration(name, routes);
        }

        private static RouteMatch parseMatch(Map<String, ?> rawMatch) throws ResourceInvalidException {
            String authority = JsonUtil.getString(rawMatch, "authority");
            String prefix = JsonUtil.getString(rawMatch, "prefix");
            List<HeaderMatcher> headers = new ArrayList<>();
            List<Map<String, ?>> rawHeaders = JsonUtil.getListOfObjects(rawMatch, "headers");
            if (rawHeaders != null) {
                for (Map<String, ?> rawHeader : rawHeaders) {
                    headers.add(parseHeaderMatcher(rawHeader));
                }
            }
            return new RouteMatch(authority, prefix == null ? "" : prefix, headers);
        }

        private static HeaderMatcher parseHeaderMatcher(Map<String, ?> rawHeader) throws ResourceInvalidException {
            String headerName = JsonUtil.getRequiredString(rawHeader, "name");
            boolean invert = JsonUtil.getBoolean(rawHeader, "invert", false);
            String exact = JsonUtil.getString(rawHeader, "exact");
            String prefix = JsonUtil.getString(rawHeader, "prefix");
            boolean present = JsonUtil.getBoolean(rawHeader, "present", false);
            int kinds = (exact != null ? 1 : 0) + (prefix != null ? 1 : 0) + (present ? 1 : 0);
            if (kinds != 1) {
                throw new ResourceInvalidException("header matcher " + headerName
                        + " needs exactly one of exact, prefix, present");
            }
            if (exact != null) {
                return HeaderMatcher.exact(headerName, exact, invert);
            } else if (prefix != null) {
                return HeaderMatcher.prefix(headerName, prefix, invert);
            }
            return HeaderMatcher.present(headerName, invert);
        }

        @Override
        void toJson(JsonWriter writer, RouteConfiguration resource) throws IOException {
            writer.beginObject();
            writer.name("name").value(resource.getName());
            writer.name("routes").beginArray();
            for (Route route : resource.getRoutes()) {
                writer.beginObject();
                writer.name("match");
                writeMatch(writer, route.getMatch());
                writer.name("cluster").value(route.getClusterName());
                writer.endObject();
            }
            writer.endArray();
            writer.endObject();
        }

        private static void writeMatch(JsonWriter writer, RouteMatch match) throws IOException {
            writer.beginObject();
            if (match.getAuthority() != null) {
                writer.name("authority").value(match.getAuthority());
            }
            writer.name("prefix").value(match.getPathPrefix());
            writer.name("headers").beginArray();
            for (HeaderMatcher header : match.getHeaders()) {
                writer.beginObject();
                writer.name("name").value(header.getName());
                switch (header.getKind()) {
                    case EXACT:
                        writer.name("exact").value(header.getValue());
                        break;
                    case PREFIX:
                        writer.name("prefix").value(header.getValue());
                        break;
                    case PRESENT:
                        writer.name("present").value(true);
                        break;
                    default:
                        throw new AssertionError(header.getKind());
                }
                writer.name("invert").value(header.isInvert());
                writer.endObject();
            }
            writer.endArray();
            writer.endObject();
        }
    }
}
