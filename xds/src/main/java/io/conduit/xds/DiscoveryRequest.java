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
import io.conduit.Status;

import javax.annotation.Nullable;
import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A subscription, acknowledgement or rejection sent to the control plane. The version is the last
 * accepted one for the type; a rejection carries an error detail and the nonce of the rejected
 * response.
 * 发送给控制面的请求，用于订阅、确认或拒绝；版本始终是该类型最后一次接受的版本
 */
public final class DiscoveryRequest {

    private final String typeUrl;
    @Nullable
    private final Node node;
    private final ImmutableList<String> resourceNames;
    private final String versionInfo;
    private final String responseNonce;
    @Nullable
    private final Status errorDetail;

    public DiscoveryRequest(String typeUrl,
                            @Nullable Node node,
                            List<String> resourceNames,
                            String versionInfo,
                            String responseNonce,
                            @Nullable Status errorDetail) {
        this.typeUrl = checkNotNull(typeUrl, "typeUrl");
        this.node = node;
        this.resourceNames = ImmutableList.copyOf(resourceNames);
        this.versionInfo = checkNotNull(versionInfo, "versionInfo");
        this.responseNonce = checkNotNull(responseNonce, "responseNonce");
        this.errorDetail = errorDetail;
    }

    public String getTypeUrl() {
        return typeUrl;
    }

    @Nullable
    public Node getNode() {
        return node;
    }

    /**
     * Subscribed names; empty means every resource of the type.
     * 订阅的资源名称，为空表示订阅该类型的所有资源
     */
    public ImmutableList<String> getResourceNames() {
        return resourceNames;
    }

    public String getVersionInfo() {
        return versionInfo;
    }

    public String getResponseNonce() {
        return responseNonce;
    }

    /**
     * Why the response named by the nonce was rejected, {@code null} for an acknowledgement.
     */
    @Nullable
    public Status getErrorDetail() {
        return errorDetail;
    }

    public boolean isNack() {
        return errorDetail != null;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .omitNullValues()
                          .add("typeUrl", typeUrl)
                          .add("resourceNames", resourceNames)
                          .add("versionInfo", versionInfo)
                          .add("responseNonce", responseNonce)
                          .add("errorDetail", errorDetail)
                          .toString();
    }
}
