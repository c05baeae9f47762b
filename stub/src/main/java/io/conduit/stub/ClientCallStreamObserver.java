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

import javax.annotation.Nullable;

/**
 * The request side of an observer based call, handed out by {@link ClientCalls}. Besides sending
 * messages it can cancel the call.
 * 客户端调用的请求观察器，除发送消息外还可以取消调用
 */
public abstract class ClientCallStreamObserver<ReqT> implements StreamObserver<ReqT> {

    /**
     * Prevents any further processing of the call. The response observer receives
     * {@code onError} with {@code CANCELLED}. At least one of the arguments should be non-null.
     * 取消调用，响应观察器会收到 CANCELLED 错误
     */
    public abstract void cancel(@Nullable String message, @Nullable Throwable cause);
}
