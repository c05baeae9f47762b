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

package io.conduit;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.io.BaseEncoding;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Provides access to read and write metadata values to be exchanged during a call. Used for the
 * initial headers and the trailing metadata of a stream.
 * 调用过程中交换的元数据，用于流的初始 header 和结尾的 trailers
 *
 * <p>Keys are case insensitive and stored lower-case. Keys ending with {@link #BINARY_HEADER_SUFFIX}
 * carry binary values, which are stored base64 encoded.
 * key 不区分大小写，以 -bin 结尾的 key 存储二进制的值，使用 base64 编码
 *
 * <p>This class is not thread safe, implementations should ensure that header reads and writes do
 * not occur in multiple threads concurrently.
 */
@NotThreadSafe
public final class Metadata {

    /**
     * All binary headers should have this suffix in their names. Vice versa.
     * 所有二进制的 header 都应当以此结尾
     */
    public static final String BINARY_HEADER_SUFFIX = "-bin";

    private static final BaseEncoding BASE64 = BaseEncoding.base64().omitPadding();

    private final ListMultimap<String, String> values = LinkedListMultimap.create();

    public Metadata() {
    }

    /**
     * Returns true if a value is defined for the given key.
     */
    public boolean containsKey(String key) {
        return values.containsKey(normalize(key));
    }

    /**
     * Returns the last metadata entry added with the name 'name' parsed as T.
     * 返回最后一个添加的值
     *
     * @return the parsed metadata entry or null if there are none.
     */
    @Nullable
    public String get(String key) {
        List<String> all = values.get(normalize(key));
        return all.isEmpty() ? null : all.get(all.size() - 1);
    }

    /**
     * Returns all the metadata entries named 'name', in the order they were received.
     */
    public List<String> getAll(String key) {
        return ImmutableList.copyOf(values.get(normalize(key)));
    }

    /**
     * Returns the last binary entry for the key, decoded from base64.
     * 返回二进制的值
     */
    @Nullable
    public byte[] getBinary(String key) {
        String name = normalize(key);
        checkArgument(name.endsWith(BINARY_HEADER_SUFFIX), "Binary key must end with %s: %s",
                BINARY_HEADER_SUFFIX, name);
        String value = get(name);
        if (value == null) {
            return null;
        }
        try {
            return BASE64.decode(value.replace("=", ""));
        } catch (IllegalArgumentException e) {
            // 值无法解码时视为不存在
            return null;
        }
    }

    /**
     * Returns set of all keys in store.
     */
    public Set<String> keys() {
        return ImmutableSet.copyOf(values.keySet());
    }

    /**
     * Adds the {@code key, value} pair. If {@code key} already has values, {@code value} is added to
     * the end. Duplicate values for the same key are permitted.
     * 添加键值对，已有的值保留
     */
    public void put(String key, String value) {
        String name = normalize(key);
        checkArgument(!name.endsWith(BINARY_HEADER_SUFFIX), "Use putBinary for binary key %s", name);
        values.put(name, checkNotNull(value, "value"));
    }

    /**
     * Adds a binary value, stored base64 encoded.
     */
    public void putBinary(String key, byte[] value) {
        String name = normalize(key);
        checkArgument(name.endsWith(BINARY_HEADER_SUFFIX), "Binary key must end with %s: %s",
                BINARY_HEADER_SUFFIX, name);
        values.put(name, BASE64.encode(checkNotNull(value, "value")));
    }

    /**
     * Removes all values for the given key without returning them.
     * 移除 key 对应的所有值
     */
    public void discardAll(String key) {
        values.removeAll(normalize(key));
    }

    /**
     * Perform a simple merge of two sets of metadata.
     * 合并两个元数据
     */
    public void merge(Metadata other) {
        values.putAll(other.values);
    }

    /**
     * Returns the number of values stored.
     */
    public int size() {
        return values.size();
    }

    @Override
    public String toString() {
        return "Metadata(" + values + ")";
    }

    private static String normalize(String key) {
        checkNotNull(key, "key");
        checkArgument(!key.isEmpty(), "empty key");
        return key.toLowerCase(Locale.ROOT);
    }
}
