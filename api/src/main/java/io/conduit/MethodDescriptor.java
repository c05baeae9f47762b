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

package io.conduit;

import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

import javax.annotation.CheckReturnValue;
import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.io.InputStream;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Description of a remote method used by {@link Channel} to initiate a call. The descriptor is the
 * capability record the call state machine is parameterized by: call cardinality plus the codec
 * pair for requests and responses.
 * 远程方法的描述，包含调用类型和请求、响应的编解码器，Channel 根据这个描述发起调用
 *
 * @param <ReqT>  type of serializable request message
 * @param <RespT> type of serializable response message
 */
@Immutable
public final class MethodDescriptor<ReqT, RespT> {

    private final MethodType type;
    private final String fullMethodName;
    @Nullable
    private final String serviceName;
    private final Marshaller<ReqT> requestMarshaller;
    private final Marshaller<RespT> responseMarshaller;
    private final boolean safeToCompress;

    /**
     * The call type of a method.
     * 方法的调用类型
     */
    public enum MethodType {
        /**
         * One request message followed by one response message.
         * 一个请求，一个响应
         */
        UNARY,

        /**
         * Zero or more request messages with one response message.
         * 客户端流，零个或多个请求，一个响应
         */
        CLIENT_STREAMING,

        /**
         * One request message followed by zero or more response messages.
         * 服务端流，一个请求，零个或多个响应
         */
        SERVER_STREAMING,

        /**
         * Including client and server streaming.
         * 双向流
         */
        BIDI_STREAMING;

        /**
         * Returns {@code true} for {@code UNARY} and {@code SERVER_STREAMING}, which do not permit
         * the client to stream.
         * 客户端是否只发送一个消息
         */
        public final boolean clientSendsOneMessage() {
            return this == UNARY || this == SERVER_STREAMING;
        }

        /**
         * Returns {@code true} for {@code UNARY} and {@code CLIENT_STREAMING}, which do not permit
         * the server to stream.
         * 服务端是否只返回一个消息
         */
        public final boolean serverSendsOneMessage() {
            return this == UNARY || this == CLIENT_STREAMING;
        }
    }

    /**
     * A typed abstraction over message serialization and deserialization, a.k.a. the codec
     * boundary. Implementations are pluggable per message type.
     * 消息序列化与反序列化的抽象，可以针对每种消息类型替换
     */
    public interface Marshaller<T> {
        /**
         * Given a message, produce an {@link InputStream} for it so that it can be written to the
         * wire.
         * 将消息转为流，以便写入
         *
         * @param value to serialize.
         * @return serialized value as stream of bytes.
         */
        InputStream stream(T value);

        /**
         * Given an {@link InputStream} parse it into an instance of the declared type so that it
         * can be passed to application code.
         * 将流解析为消息
         *
         * @param stream of bytes for serialized value
         * @return parsed value
         */
        T parse(InputStream stream);

        /**
         * The content subtype announced on the wire, appended to {@code application/grpc+}, or
         * {@code null} for the default.
         * 内容子类型，如 proto、json
         */
        @Nullable
        default String contentSubtype() {
            return null;
        }
    }

    private MethodDescriptor(MethodType type,
                             String fullMethodName,
                             Marshaller<ReqT> requestMarshaller,
                             Marshaller<RespT> responseMarshaller,
                             boolean safeToCompress) {
        this.type = checkNotNull(type, "type");
        this.fullMethodName = checkNotNull(fullMethodName, "fullMethodName");
        this.serviceName = extractFullServiceName(fullMethodName);
        this.requestMarshaller = checkNotNull(requestMarshaller, "requestMarshaller");
        this.responseMarshaller = checkNotNull(responseMarshaller, "responseMarshaller");
        this.safeToCompress = safeToCompress;
    }

    /**
     * The call type of the method.
     */
    public MethodType getType() {
        return type;
    }

    /**
     * The fully qualified name of the method.
     * 方法的全限定名，如 package.Service/Method
     */
    public String getFullMethodName() {
        return fullMethodName;
    }

    /**
     * A convenience method for {@code extractFullServiceName(getFullMethodName())}.
     */
    @Nullable
    public String getServiceName() {
        return serviceName;
    }

    public Marshaller<ReqT> getRequestMarshaller() {
        return requestMarshaller;
    }

    public Marshaller<RespT> getResponseMarshaller() {
        return responseMarshaller;
    }

    /**
     * Parse a response payload from the given {@link InputStream}.
     */
    public RespT parseResponse(InputStream input) {
        return responseMarshaller.parse(input);
    }

    /**
     * Convert a request message to an {@link InputStream}.
     */
    public InputStream streamRequest(ReqT requestMessage) {
        return requestMarshaller.stream(requestMessage);
    }

    /**
     * Parse an incoming request message.
     */
    public ReqT parseRequest(InputStream input) {
        return requestMarshaller.parse(input);
    }

    /**
     * Serialize an outgoing response message.
     */
    public InputStream streamResponse(RespT response) {
        return responseMarshaller.stream(response);
    }

    /**
     * Returns whether messages of this method may be compressed. This is the declared compression
     * capability of the codec pair.
     * 消息是否允许被压缩
     */
    public boolean isSafeToCompress() {
        return safeToCompress;
    }

    /**
     * Generate the fully qualified method name. This matches the name
     * 生成方法的全限定名
     *
     * @param fullServiceName the fully qualified service name that is prefixed with the package name
     * @param methodName      the short method name
     */
    public static String generateFullMethodName(String fullServiceName, String methodName) {
        return checkNotNull(fullServiceName, "fullServiceName")
                + "/"
                + checkNotNull(methodName, "methodName");
    }

    /**
     * Extract the fully qualified service name out of a fully qualified method name. May return
     * {@code null} if the input is malformed, but you cannot rely on it for the validity of the
     * input.
     * 从方法全限定名中提取服务名
     */
    @Nullable
    public static String extractFullServiceName(String fullMethodName) {
        int index = checkNotNull(fullMethodName, "fullMethodName").lastIndexOf('/');
        if (index == -1) {
            return null;
        }
        return fullMethodName.substring(0, index);
    }

    /**
     * Creates a new builder for a {@link MethodDescriptor}.
     */
    @CheckReturnValue
    public static <ReqT, RespT> Builder<ReqT, RespT> newBuilder() {
        return new Builder<>();
    }

    /**
     * Creates a new builder for a {@link MethodDescriptor}.
     */
    @CheckReturnValue
    public static <ReqT, RespT> Builder<ReqT, RespT> newBuilder(
            Marshaller<ReqT> requestMarshaller, Marshaller<RespT> responseMarshaller) {
        return new Builder<ReqT, RespT>()
                .setRequestMarshaller(requestMarshaller)
                .setResponseMarshaller(responseMarshaller);
    }

    /**
     * Turns this descriptor into a builder.
     */
    @CheckReturnValue
    public Builder<ReqT, RespT> toBuilder() {
        return toBuilder(requestMarshaller, responseMarshaller);
    }

    /**
     * Turns this descriptor into a builder, replacing the request and response marshallers.
     */
    @CheckReturnValue
    public <NewReqT, NewRespT> Builder<NewReqT, NewRespT> toBuilder(
            Marshaller<NewReqT> requestMarshaller, Marshaller<NewRespT> responseMarshaller) {
        return MethodDescriptor.<NewReqT, NewRespT>newBuilder()
                .setRequestMarshaller(requestMarshaller)
                .setResponseMarshaller(responseMarshaller)
                .setType(type)
                .setFullMethodName(fullMethodName)
                .setSafeToCompress(safeToCompress);
    }

    /**
     * A builder for a {@link MethodDescriptor}.
     */
    public static final class Builder<ReqT, RespT> {

        private Marshaller<ReqT> requestMarshaller;
        private Marshaller<RespT> responseMarshaller;
        private MethodType type;
        private String fullMethodName;
        private boolean safeToCompress = true;

        private Builder() {
        }

        @CanIgnoreReturnValue
        public Builder<ReqT, RespT> setRequestMarshaller(Marshaller<ReqT> requestMarshaller) {
            this.requestMarshaller = requestMarshaller;
            return this;
        }

        @CanIgnoreReturnValue
        public Builder<ReqT, RespT> setResponseMarshaller(Marshaller<RespT> responseMarshaller) {
            this.responseMarshaller = responseMarshaller;
            return this;
        }

        @CanIgnoreReturnValue
        public Builder<ReqT, RespT> setType(MethodType type) {
            this.type = type;
            return this;
        }

        @CanIgnoreReturnValue
        public Builder<ReqT, RespT> setFullMethodName(String fullMethodName) {
            checkArgument(fullMethodName.indexOf('/') > 0, "Malformed method name %s", fullMethodName);
            this.fullMethodName = fullMethodName;
            return this;
        }

        @CanIgnoreReturnValue
        public Builder<ReqT, RespT> setSafeToCompress(boolean safeToCompress) {
            this.safeToCompress = safeToCompress;
            return this;
        }

        @CheckReturnValue
        public MethodDescriptor<ReqT, RespT> build() {
            return new MethodDescriptor<>(type, fullMethodName, requestMarshaller,
                    responseMarshaller, safeToCompress);
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("fullMethodName", fullMethodName)
                .add("type", type)
                .add("safeToCompress", safeToCompress)
                .add("requestMarshaller", requestMarshaller)
                .add("responseMarshaller", responseMarshaller)
                .toString();
    }
}
