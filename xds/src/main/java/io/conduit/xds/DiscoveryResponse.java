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

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.util.Arrays;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A full snapshot of one resource type pushed by the control plane.
 * 控制面推送的某个资源类型的完整快照
 */
public final class DiscoveryResponse {

    private final String typeUrl;
    private final String versionInfo;
    private final String nonce;
    private final ImmutableList<Resource> resources;

    public DiscoveryResponse(String typeUrl, String versionInfo, String nonce, List<Resource> resources) {
        this.typeUrl = checkNotNull(typeUrl, "typeUrl");
        this.versionInfo = checkNotNull(versionInfo, "versionInfo");
        this.nonce = checkNotNull(nonce, "nonce");
        this.resources = ImmutableList.copyOf(resources);
    }

    public String getTypeUrl() {
        return typeUrl;
    }

    public String getVersionInfo() {
        return versionInfo;
    }

    public String getNonce() {
        return nonce;
    }

    public ImmutableList<Resource> getResources() {
        return resources;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("typeUrl", typeUrl)
                          .add("versionInfo", versionInfo)
                          .add("nonce", nonce)
                          .add("resources", resources.size())
                          .toString();
    }

    /**
     * One encoded resource with its type.
     * 编码后的单个资源
     */
    public static final class Resource {
        private final String typeUrl;
        private final byte[] value;

        public Resource(String typeUrl, byte[] value) {
            this.typeUrl = checkNotNull(typeUrl, "typeUrl");
            this.value = checkNotNull(value, "value").clone();
        }

        /**
         * Encodes a resource of the given type.
         */
        public static <T> Resource of(ResourceType<T> type, T resource) {
            return new Resource(type.typeUrl(), type.encode(resource));
        }

        public String getTypeUrl() {
            return typeUrl;
        }

        public byte[] getValue() {
            return value.clone();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Resource)) {
                return false;
            }
            Resource that = (Resource) o;
            return typeUrl.equals(that.typeUrl) && Arrays.equals(value, that.value);
        }

        @Override
        public int hashCode() {
            return 31 * typeUrl.hashCode() + Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return MoreObjects.toStringHelper(this)
                              .add("typeUrl", typeUrl)
                              .add("bytes", value.length)
                              .toString();
        }
    }
}
