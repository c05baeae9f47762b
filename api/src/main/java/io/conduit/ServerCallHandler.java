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

import javax.annotation.concurrent.ThreadSafe;

/**
 * Interface to initiate processing of incoming remote calls. Advanced applications and generated
 * code will implement this interface to allows {@link ServerCall}s to be processed.
 * 处理请求的接口
 */
@ThreadSafe
public interface ServerCallHandler<RequestT, ResponseT> {
    /**
     * Starts asynchronous processing of an incoming call.
     * 开始异步处理请求
     *
     * @param call    object for responding to the remote client.
     * @param headers request headers received from the client
     * @return listener for processing incoming request messages for {@code call}
     */
    ServerCall.Listener<RequestT> startCall(ServerCall<RequestT, ResponseT> call, Metadata headers);
}
