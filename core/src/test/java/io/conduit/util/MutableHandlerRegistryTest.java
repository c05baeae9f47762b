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

import io.conduit.Metadata;
import io.conduit.MethodDescriptor;
import io.conduit.ServerCall;
import io.conduit.ServerCallHandler;
import io.conduit.ServerMethodDefinition;
import io.conduit.ServerServiceDefinition;
import io.conduit.testing.StringMarshaller;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MutableHandlerRegistryTest {

    private static final ServerCallHandler<String, String> NOOP_HANDLER = new ServerCallHandler<String, String>() {
        @Override
        public ServerCall.Listener<String> startCall(ServerCall<String, String> call, Metadata headers) {
            return new ServerCall.Listener<String>() {
            };
        }
    };

    private final MutableHandlerRegistry registry = new MutableHandlerRegistry();

    private static MethodDescriptor<String, String> unary(String service, String method) {
        return MethodDescriptor.<String, String>newBuilder()
                .setType(MethodDescriptor.MethodType.UNARY)
                .setFullMethodName(MethodDescriptor.generateFullMethodName(service, method))
                .setRequestMarshaller(StringMarshaller.INSTANCE)
                .setResponseMarshaller(StringMarshaller.INSTANCE)
                .build();
    }

    private static ServerServiceDefinition service(String name, String... methods) {
        ServerServiceDefinition.Builder builder = ServerServiceDefinition.builder(name);
        for (String method : methods) {
            builder.addMethod(unary(name, method), NOOP_HANDLER);
        }
        return builder.build();
    }

    @Test
    void lookupFindsRegisteredMethod() {
        ServerServiceDefinition orders = service("shop.Orders", "Get", "List");
        assertNull(registry.addService(orders));

        ServerMethodDefinition<?, ?> found = registry.lookupMethod("shop.Orders/List");
        assertEquals("shop.Orders/List", found.getMethodDescriptor().getFullMethodName());
        assertNull(registry.lookupMethod("shop.Orders/Delete"));
        assertNull(registry.lookupMethod("shop.Users/Get"));
        assertNull(registry.lookupMethod("malformed"));
    }

    @Test
    void addingSameServiceNameReplacesPrevious() {
        ServerServiceDefinition first = service("shop.Orders", "Get");
        ServerServiceDefinition second = service("shop.Orders", "List");
        registry.addService(first);

        assertSame(first, registry.addService(second));
        assertNull(registry.lookupMethod("shop.Orders/Get"));
        assertEquals(1, registry.getServices().size());
    }

    @Test
    void removeOnlyMatchesRegisteredInstance() {
        ServerServiceDefinition registered = service("shop.Orders", "Get");
        registry.addService(registered);

        assertFalse(registry.removeService(service("shop.Orders", "Get")));
        assertTrue(registry.removeService(registered));
        assertNull(registry.lookupMethod("shop.Orders/Get"));
        assertTrue(registry.getServices().isEmpty());
    }
}
