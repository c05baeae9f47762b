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

import com.google.common.io.BaseEncoding;
import com.google.common.io.ByteStreams;
import com.google.gson.stream.JsonWriter;
import io.conduit.MethodDescriptor;
import io.conduit.Status;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding of the discovery envelopes. Resource payloads are carried as base64 strings.
 * 发现协议消息的 JSON 编解码，资源内容使用 base64 编码
 */
public abstract class JsonDiscoveryMarshaller<T> implements MethodDescriptor.Marshaller<T> {

    public static final JsonDiscoveryMarshaller<DiscoveryRequest> REQUEST = new RequestMarshaller();

    public static final JsonDiscoveryMarshaller<DiscoveryResponse> RESPONSE = new ResponseMarshaller();

    private static final BaseEncoding BASE64 = BaseEncoding.base64();

    JsonDiscoveryMarshaller() {
    }

    @Override
    public String contentSubtype() {
        return "json";
    }

    @Override
    public final InputStream stream(T value) {
        StringWriter out = new StringWriter();
        try {
            JsonWriter writer = new JsonWriter(out);
            write(writer, value);
            writer.close();
        } catch (IOException e) {
            throw new AssertionError(e);
        }
        return new ByteArrayInputStream(out.toString().getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public final T parse(InputStream stream) {
        try {
            String raw = new String(ByteStreams.toByteArray(stream), StandardCharsets.UTF_8);
            Object json = JsonParser.parse(raw);
            if (!(json instanceof Map)) {
                throw new IllegalArgumentException("discovery message is not a JSON object");
            }
            @SuppressWarnings("unchecked")
            Map<String, ?> obj = (Map<String, ?>) json;
            return read(obj);
        } catch (IOException | RuntimeException e) {
            throw Status.INTERNAL.withDescription("Invalid discovery message")
                                 .withCause(e)
                                 .asRuntimeException();
        }
    }

    abstract void write(JsonWriter writer, T value) throws IOException;

    abstract T read(Map<String, ?> obj);

    private static String stringOrEmpty(Map<String, ?> obj, String key) {
        String value = JsonUtil.getString(obj, key);
        return value == null ? "" : value;
    }

    private static final class RequestMarshaller extends JsonDiscoveryMarshaller<DiscoveryRequest> {

        @Override
        void write(JsonWriter writer, DiscoveryRequest request) throws IOException {
            writer.beginObject();
            writer.name("type_url").value(request.getTypeUrl());
            Node node = request.getNode();
            if (node != null) {
                writer.name("node").beginObject();
                writer.name("id").value(node.getId());
                writer.name("cluster").value(node.getCluster());
                writer.name("user_agent_name").value(node.getUserAgentName());
                writer.name("user_agent_version").value(node.getUserAgentVersion());
                writer.endObject();
            }
            writer.name("resource_names").beginArray();
            for (String name : request.getResourceNames()) {
                writer.value(name);
            }
            writer.endArray();
            writer.name("version_info").value(request.getVersionInfo());
            writer.name("response_nonce").value(request.getResponseNonce());
            Status errorDetail = request.getErrorDetail();
            if (errorDetail != null) {
                writer.name("error_detail").beginObject();
                writer.name("code").value(errorDetail.getCode().value());
                if (errorDetail.getDescription() != null) {
                    writer.name("message").value(errorDetail.getDescription());
                }
                writer.endObject();
            }
            writer.endObject();
        }

        @Override
        DiscoveryRequest read(Map<String, ?> obj) {
            Node node = null;
            Map<String, ?> rawNode = JsonUtil.getObject(obj, "node");
            if (rawNode != null) {
                node = new Node(stringOrEmpty(rawNode, "id"), stringOrEmpty(rawNode, "cluster"),
                        stringOrEmpty(rawNode, "user_agent_name"), stringOrEmpty(rawNode, "user_agent_version"));
            }
            List<?> rawNames = JsonUtil.getList(obj, "resource_names");
            List<String> names = rawNames == null
                    ? Collections.<String>emptyList() : JsonUtil.checkStringList(rawNames);
            Status errorDetail = null;
            Map<String, ?> rawError = JsonUtil.getObject(obj, "error_detail");
            if (rawError != null) {
                Double code = JsonUtil.getNumber(rawError, "code");
                errorDetail = Status.fromCodeValue(code == null ? Status.Code.UNKNOWN.value() : code.intValue())
                                    .withDescription(JsonUtil.getString(rawError, "message"));
            }
            return new DiscoveryRequest(JsonUtil.getRequiredString(obj, "type_url"), node, names,
                    stringOrEmpty(obj, "version_info"), stringOrEmpty(obj, "response_nonce"), errorDetail);
        }
    }

    private static final class ResponseMarshaller extends JsonDiscoveryMarshaller<DiscoveryResponse> {

        @Override
        void write(JsonWriter writer, DiscoveryResponse response) throws IOException {
            writer.beginObject();
            writer.name("type_url").value(response.getTypeUrl());
            writer.name("version_info").value(response.getVersionInfo());
            writer.name("nonce").value(response.getNonce());
            writer.name("resources").beginArray();
            for (DiscoveryResponse.Resource resource : response.getResources()) {
                writer.beginObject();
                writer.name("type_url").value(resource.getTypeUrl());
                writer.name("value").value(BASE64.encode(resource.getValue()));
                writer.endObject();
            }
            writer.endArray();
            writer.endObject();
        }

        @Override
        DiscoveryResponse read(Map<String, ?> obj) {
            List<DiscoveryResponse.Resource> resources = new ArrayList<>();
            List<Map<String, ?>> rawResources = JsonUtil.getListOfObjects(obj, "resources");
            if (rawResources != null) {
                for (Map<String, ?> rawResource : rawResources) {
                    resources.add(new DiscoveryResponse.Resource(JsonUtil.getRequiredString(rawResource, "type_url"),
                            BASE64.decode(JsonUtil.getRequiredString(rawResource, "value"))));
                }
            }
            return new DiscoveryResponse(JsonUtil.getRequiredString(obj, "type_url"),
                    stringOrEmpty(obj, "version_info"), stringOrEmpty(obj, "nonce"), resources);
        }
    }
}
