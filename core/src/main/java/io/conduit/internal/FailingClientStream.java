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

package io.conduit.internal;

import com.google.common.annotations.VisibleForTesting;
import io.conduit.Status;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * An implementation of {@link ClientStream} that fails (by calling {@link
 * ClientStreamListener#closed}) when started, and silently does nothing for the other operations.
 * ClientStream 的实现，在启动时通过 ClientStreamListener#closed 返回失败，不做其他操作
 */
public final class FailingClientStream extends NoopClientStream {

    private boolean started;
    private final Status error;

    /**
     * Creates a {@code FailingClientStream} that would fail with the given error.
     * 根据所给的错误创建 FailingClientStream
     */
    public FailingClientStream(Status error) {
        checkArgument(!error.isOk(), "error must not be OK");
        this.error = error;
    }

    @Override
    public void start(ClientStreamListener listener) {
        checkState(!started, "already started");
        started = true;
        listener.closed(error, null);
    }

    @VisibleForTesting
    Status getError() {
        return error;
    }
}
