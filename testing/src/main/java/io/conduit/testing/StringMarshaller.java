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

package io.conduit.testing;

import com.google.common.io.ByteStreams;
import io.conduit.MethodDescriptor;
import io.conduit.Status;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Marshalls UTF-8 encoded strings.
 * UTF-8 字符串的序列化器
 */
public final class StringMarshaller implements MethodDescriptor.Marshaller<String> {

    public static final StringMarshaller INSTANCE = new StringMarshaller();

    @Override
    public InputStream stream(String value) {
        return new ByteArrayInputStream(value.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String parse(InputStream stream) {
        try {
            return new String(ByteStreams.toByteArray(stream), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw Status.INTERNAL.withDescription("Failed to read string").withCause(ex).asRuntimeException();
        }
    }
}
