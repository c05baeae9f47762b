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

import java.util.Iterator;

/**
 * A blocking, lazy and non-restartable iterator over the responses of a server-streaming call.
 * Once the stream ended {@link #hasNext()} keeps returning {@code false}; a failed call throws
 * {@link io.conduit.StatusRuntimeException} from {@link #hasNext()} and {@link #next()}.
 * 服务端流调用响应的阻塞迭代器，只能遍历一次；调用失败时 hasNext 和 next 会抛出 StatusRuntimeException
 *
 * <p>Closing the iterator before the stream ended cancels the call.
 * 在流结束之前关闭迭代器会取消调用
 */
public interface ResponseIterator<T> extends Iterator<T>, AutoCloseable {

    /**
     * Cancels the call if it is still running. Idempotent.
     * 如果调用还在进行则取消
     */
    @Override
    void close();
}
