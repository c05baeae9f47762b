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
import com.google.common.base.Objects;
import com.google.common.collect.ImmutableList;
import io.conduit.Metadata;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Locale;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Criteria a call must meet for a route to apply: authority, path prefix and headers.
 * 路由的匹配条件，包括 authority、路径前缀和请求头
 *
 * <p>The authority pattern is an exact host name, {@code *} for any, or {@code *.suffix} for any
 * name ending in {@code .suffix}. A {@code null} pattern matches any authority.
 */
public final class RouteMatch {

    private static final RouteMatch ANY = new RouteMatch(null, "", ImmutableList.<HeaderMatcher>of());

    @Nullable
    private final String authority;
    private final String pathPrefix;
    private final ImmutableList<HeaderMatcher> headers;

    public RouteMatch(@Nullable String authority, String pathPrefix, List<HeaderMatcher> headers) {
        this.authority = authority;
        this.pathPrefix = checkNotNull(pathPrefix, "pathPrefix");
        this.headers = ImmutableList.copyOf(headers);
    }

    /**
     * Matches every call.
     */
    public static RouteMatch any() {
        return ANY;
    }

    @Nullable
    public String getAuthority() {
        return authority;
    }

    public String getPathPrefix() {
        return pathPrefix;
    }

    public ImmutableList<HeaderMatcher> getHeaders() {
        return headers;
    }

    /**
     * @param path the call path, {@code /service/method}
     */
    boolean matches(String callAuthority, String path, Metadata callHeaders) {
        if (!authorityMatches(callAuthority)) {
            return false;
        }
        if (!path.startsWith(pathPrefix)) {
            return false;
        }
        for (HeaderMatcher matcher : headers) {
            if (!matcher.matches(callHeaders)) {
                return false;
            }
        }
        return true;
    }

    private boolean authorityMatches(String callAuthority) {
        if (authority == null || authority.equals("*")) {
            return true;
        }
        String host = callAuthority.toLowerCase(Locale.US);
        String pattern = authority.toLowerCase(Locale.US);
        if (pattern.startsWith("*.")) {
            // 通配符不匹配后缀本身
            return host.endsWith(pattern.substring(1)) && host.length() > pattern.length() - 1;
        }
        return host.equals(pattern);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RouteMatch)) {
            return false;
        }
        RouteMatch that = (RouteMatch) o;
        return Objects.equal(authority, that.authority) && pathPrefix.equals(that.pathPrefix)
                && headers.equals(that.headers);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(authority, pathPrefix, headers);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .omitNullValues()
                          .add("authority", authority)
                          .add("pathPrefix", pathPrefix)
                          .add("headers", headers)
                          .toString();
    }
}
