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

import com.google.common.base.Joiner;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import io.conduit.Metadata;

import javax.annotation.Nullable;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A predicate over one request header. Multiple values of the header are joined with
 * {@code ","} before matching.
 * 请求头的匹配条件，多个值使用逗号连接后匹配
 */
public final class HeaderMatcher {

    /**
     * 匹配方式
     */
    public enum Kind {
        EXACT,
        PREFIX,
        PRESENT
    }

    private final String name;
    private final Kind kind;
    @Nullable
    private final String value;
    private final boolean invert;

    private HeaderMatcher(String name, Kind kind, @Nullable String value, boolean invert) {
        this.name = checkNotNull(name, "name");
        this.kind = checkNotNull(kind, "kind");
        checkArgument(kind == Kind.PRESENT || value != null, "value required for %s matcher", kind);
        this.value = value;
        this.invert = invert;
    }

    public static HeaderMatcher exact(String name, String value, boolean invert) {
        return new HeaderMatcher(name, Kind.EXACT, value, invert);
    }

    public static HeaderMatcher prefix(String name, String prefix, boolean invert) {
        return new HeaderMatcher(name, Kind.PREFIX, prefix, invert);
    }

    public static HeaderMatcher present(String name, boolean invert) {
        return new HeaderMatcher(name, Kind.PRESENT, null, invert);
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    @Nullable
    public String getValue() {
        return value;
    }

    public boolean isInvert() {
        return invert;
    }

    boolean matches(Metadata headers) {
        List<String> values = headers.getAll(name);
        boolean matched;
        if (values.isEmpty()) {
            matched = false;
        } else {
            String joined = Joiner.on(',').join(values);
            switch (kind) {
                case EXACT:
                    matched = joined.equals(value);
                    break;
                case PREFIX:
                    matched = joined.startsWith(value);
                    break;
                case PRESENT:
                    matched = true;
                    break;
                default:
                    throw new AssertionError(kind);
            }
        }
        return matched != invert;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof HeaderMatcher)) {
            return false;
        }
        HeaderMatcher that = (HeaderMatcher) o;
        return name.equals(that.name) && kind == that.kind && Objects.equal(value, that.value)
                && invert == that.invert;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(name, kind, value, invert);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                          .add("name", name)
                          .add("kind", kind)
                          .add("value", value)
                          .add("invert", invert)
                          .toString();
    }
}
