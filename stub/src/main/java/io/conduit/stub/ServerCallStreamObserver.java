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

package io.conduit.stub;

/**
 * The response side of a server call, handed to service implementations by {@link ServerCalls}.
 * 服务端调用的响应观察器
 */
public abstract class ServerCallStreamObserver<RespT> implements StreamObserver<RespT> {

    /**
     * Whether the client cancelled the call or its deadline expired.
     * 调用是否已经被客户端取消或者超时
     */
    public abstract boolean isCancelled();

    /**
     * Sets a callback invoked when the call is cancelled. Setting a handler also means
     * {@code onNext} and {@code onCompleted} after cancellation become no-ops instead of throwing.
     * May only be set during the initial invocation of the service method.
     * 设置取消回调，只能在服务方法初次调用时设置
     */
    public abstract void setOnCancelHandler(Runnable onCancelHandler);

    /**
     * Sets the compression algorithm for the responses, when the client accepts it.
     * 设置响应的压缩方式
     */
    public abstract void setCompression(String compression);
}
