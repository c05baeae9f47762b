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

import io.conduit.Status;

/**
 * An implementation of {@link ClientStream} that silently does nothing for the operations.
 * 什么都不做的 ClientStream
 */
public class NoopClientStream implements ClientStream {

    public static final NoopClientStream INSTANCE = new NoopClientStream();

    @Override
    public void start(ClientStreamListener listener) {
    }

    @Override
    public void writeData(byte[] data) {
    }

    @Override
    public void halfClose() {
    }

    @Override
    public void cancel(Status reason) {
    }
}
