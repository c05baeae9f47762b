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

import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * Definition of a service to be exposed via a server: the service name and the methods bound to
 * their handlers, keyed by full method name.
 * 服务定义，包含服务名和以方法全名为 key 的方法定义
 */
public final class ServerServiceDefinition {

    /**
     * Convenience that constructs a {@link ServerServiceDefinition} builder.
     */
    public static Builder builder(String serviceName) {
        return new Builder(serviceName);
    }

    private final String serviceName;

    private final Map<String, ServerMethodDefinition<?, ?>> methods;

    private ServerServiceDefinition(String serviceName,
                                    Map<String, ServerMethodDefinition<?, ?>> methods) {
        this.serviceName = checkNotNull(serviceName, "serviceName");
        this.methods = ImmutableMap.copyOf(methods);
    }

    public String getServiceName() {
        return serviceName;
    }

    public Collection<ServerMethodDefinition<?, ?>> getMethods() {
        return methods.values();
    }

    /**
     * Look up a method by its fully qualified name.
     * 根据方法全名查找方法定义
     *
     * @param methodName the fully qualified name without leading slash. E.g., "com.foo.Foo/Bar"
     */
    @Nullable
    public ServerMethodDefinition<?, ?> getMethod(String methodName) {
        return methods.get(methodName);
    }

    /**
     * Builder for constructing Service instances.
     */
    public static final class Builder {

        private final String serviceName;
        private final Map<String, ServerMethodDefinition<?, ?>> methods = new LinkedHashMap<>();

        private Builder(String serviceName) {
            this.serviceName = checkNotNull(serviceName, "serviceName");
        }

        /**
         * Add a method to be supported by the service.
         *
         * @param method  the {@link MethodDescriptor} of this method.
         * @param handler handler for incoming calls
         */
        @CanIgnoreReturnValue
        public <ReqT, RespT> Builder addMethod(MethodDescriptor<ReqT, RespT> method,
                                               ServerCallHandler<ReqT, RespT> handler) {
            return addMethod(ServerMethodDefinition.create(
                    checkNotNull(method, "method must not be null"),
                    checkNotNull(handler, "handler must not be null")));
        }

        /**
         * Add a method to be supported by the service.
         */
        @CanIgnoreReturnValue
        public <ReqT, RespT> Builder addMethod(ServerMethodDefinition<ReqT, RespT> def) {
            MethodDescriptor<ReqT, RespT> method = def.getMethodDescriptor();
            checkArgument(serviceName.equals(method.getServiceName()),
                    "Method name should be prefixed with service name and separated with '/'. "
                            + "Expected service name: '%s'. Actual fully qualifed method name: '%s'.",
                    serviceName, method.getFullMethodName());
            String name = method.getFullMethodName();
            checkState(!methods.containsKey(name), "Method by same name already registered: %s", name);
            methods.put(name, def);
            return this;
        }

        /**
         * Construct new ServerServiceDefinition.
         */
        public ServerServiceDefinition build() {
            return new ServerServiceDefinition(serviceName, methods);
        }
    }
}
