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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Definition of a method exposed by a {@link ServerServiceDefinition}: the method descriptor
 * paired with the handler that serves it.
 * 服务方法的定义，由方法描述和处理器组成
 */
public final class ServerMethodDefinition<ReqT, RespT> {

    private final MethodDescriptor<ReqT, RespT> method;

    private final ServerCallHandler<ReqT, RespT> handler;

    private ServerMethodDefinition(MethodDescriptor<ReqT, RespT> method,
                                   ServerCallHandler<ReqT, RespT> handler) {
        this.method = checkNotNull(method, "method");
        this.handler = checkNotNull(handler, "handler");
    }

    /**
     * Create a new instance.
     *
     * @param method  the {@link MethodDescriptor} for this method.
     * @param handler a handler for receiving incoming calls for this method.
     */
    public static <ReqT, RespT> ServerMethodDefinition<ReqT, RespT> create(MethodDescriptor<ReqT, RespT> method,
                                                                           ServerCallHandler<ReqT, RespT> handler) {
        return new ServerMethodDefinition<>(method, handler);
    }

    public MethodDescriptor<ReqT, RespT> getMethodDescriptor() {
        return method;
    }

    public ServerCallHandler<ReqT, RespT> getServerCallHandler() {
        return handler;
    }
}
