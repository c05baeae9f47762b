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

package io.conduit.xds;

/**
 * A discovery resource that failed to decode or validate.
 * 资源解析或校验失败
 */
public final class ResourceInvalidException extends Exception {

    private static final long serialVersionUID = 0L;

    public ResourceInvalidException(String message) {
        super(message);
    }

    public ResourceInvalidException(String message, Throwable cause) {
        super(message, cause);
    }
}
