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

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * Helper utility to work with JSON values in Java types.
 * 读取 JSON 值的工具方法
 */
final class JsonUtil {

    private JsonUtil() {
    }

    /**
     * Gets a list from an object for the given key. If the key is not present, this returns null.
     * If the value is not a List, throws an exception.
     */
    @Nullable
    static List<?> getList(Map<String, ?> obj, String key) {
        if (!obj.containsKey(key)) {
            return null;
        }
        Object value = obj.get(key);
        if (!(value instanceof List)) {
            throw new ClassCastException(
                    String.format("value '%s' for key '%s' in '%s' is not List", value, key, obj));
        }
        return (List<?>) value;
    }

    /**
     * Gets a list of objects from an object for the given key.
     */
    @Nullable
    static List<Map<String, ?>> getListOfObjects(Map<String, ?> obj, String key) {
        List<?> list = getList(obj, key);
        if (list == null) {
            return null;
        }
        return checkObjectList(list);
    }

    /**
     * Gets an object from an object for the given key. If the key is not present, this returns null.
     * If the value is not a Map, throws an exception.
     */
    @SuppressWarnings("unchecked")
    @Nullable
    static Map<String, ?> getObject(Map<String, ?> obj, String key) {
        if (!obj.containsKey(key)) {
            return null;
        }
        Object value = obj.get(key);
        if (!(value instanceof Map)) {
            throw new ClassCastException(
                    String.format("value '%s' for key '%s' in '%s' is not object", value, key, obj));
        }
        return (Map<String, ?>) value;
    }

    /**
     * Gets a string from an object for the given key. If the key is not present, this returns null.
     * If the value is not a String, throws an exception.
     */
    @Nullable
    static String getString(Map<String, ?> obj, String key) {
        if (!obj.containsKey(key)) {
            return null;
        }
        Object value = obj.get(key);
        if (!(value instanceof String)) {
            throw new ClassCastException(
                    String.format("value '%s' for key '%s' in '%s' is not String", value, key, obj));
        }
        return (String) value;
    }

    /**
     * Gets a required string, throwing if it is absent.
     */
    static String getRequiredString(Map<String, ?> obj, String key) {
        String value = getString(obj, key);
        if (value == null) {
            throw new IllegalArgumentException(String.format("missing '%s' in '%s'", key, obj));
        }
        return value;
    }

    /**
     * Gets a number from an object for the given key. If the key is not present, this returns null.
     * If the value is not a Double, throws an exception.
     */
    @Nullable
    static Double getNumber(Map<String, ?> obj, String key) {
        if (!obj.containsKey(key)) {
            return null;
        }
        Object value = obj.get(key);
        if (!(value instanceof Double)) {
            throw new ClassCastException(
                    String.format("value '%s' for key '%s' in '%s' is not number", value, key, obj));
        }
        return (Double) value;
    }

    /**
     * Gets a boolean from an object for the given key, {@code defaultValue} if absent.
     */
    static boolean getBoolean(Map<String, ?> obj, String key, boolean defaultValue) {
        if (!obj.containsKey(key)) {
            return defaultValue;
        }
        Object value = obj.get(key);
        if (!(value instanceof Boolean)) {
            throw new ClassCastException(
                    String.format("value '%s' for key '%s' in '%s' is not boolean", value, key, obj));
        }
        return (Boolean) value;
    }

    /**
     * Casts a list of unchecked JSON values to a list of checked objects in Java type.
     * If the given list contains a value that is not a Map, throws an exception.
     */
    @SuppressWarnings("unchecked")
    static List<Map<String, ?>> checkObjectList(List<?> rawList) {
        for (int i = 0; i < rawList.size(); i++) {
            if (!(rawList.get(i) instanceof Map)) {
                throw new ClassCastException(
                        String.format("value %s for idx %d in %s is not object", rawList.get(i), i, rawList));
            }
        }
        return (List<Map<String, ?>>) rawList;
    }

    /**
     * Casts a list of unchecked JSON values to a list of String. If the given list
     * contains a value that is not a String, throws an exception.
     */
    @SuppressWarnings("unchecked")
    static List<String> checkStringList(List<?> rawList) {
        for (int i = 0; i < rawList.size(); i++) {
            if (!(rawList.get(i) instanceof String)) {
                throw new ClassCastException(
                        String.format("value '%s' for idx %d in '%s' is not string", rawList.get(i), i, rawList));
            }
        }
        return (List<String>) rawList;
    }
}
