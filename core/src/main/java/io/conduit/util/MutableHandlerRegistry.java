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

package io.conduit.util;

import io.conduit.HandlerRegistry;
import io.conduit.MethodDescriptor;
import io.conduit.ServerMethodDefinition;
import io.conduit.ServerServiceDefinition;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * A {@link HandlerRegistry} that services can be added to and removed from while serving.
 * 可以在运行中添加和移除服务的处理器注册器
 *
 * <p>Uses {@link ConcurrentHashMap} to avoid service registration excessively
 * blocking method lookup.
 */
@ThreadSafe
public final class MutableHandlerRegistry extends HandlerRegistry {

    private final ConcurrentMap<String, ServerServiceDefinition> services = new ConcurrentHashMap<>();

    /**
     * Registers a service.
     * 注册服务
     *
     * @return the previously registered service with the same service name if exists,
     * otherwise {@code null}.
     */
    @Nullable
    public ServerServiceDefinition addService(ServerServiceDefinition service) {
        return services.put(service.getServiceName(), service);
    }

    /**
     * Removes a registered service
     * 移除注册的服务
     *
     * @return true if the service was found to be removed.
     */
    public boolean removeService(ServerServiceDefinition service) {
        return services.remove(service.getServiceName(), service);
    }

    /**
     * Note: This does not necessarily return a consistent view of the map.
     */
    @Override
    public List<ServerServiceDefinition> getServices() {
        return Collections.unmodifiableList(new ArrayList<>(services.values()));
    }

    /**
     * Note: This does not honor the authority provided.
     * 根据方法全名查找方法
     */
    @Override
    @Nullable
    public ServerMethodDefinition<?, ?> lookupMethod(String methodName, @Nullable String authority) {
        String serviceName = MethodDescriptor.extractFullServiceName(methodName);
        if (serviceName == null) {
            return null;
        }
        ServerServiceDefinition service = services.get(serviceName);
        if (service == null) {
            return null;
        }
        return service.getMethod(methodName);
    }
}
