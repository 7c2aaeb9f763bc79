/*
 * Copyright 2025 Netflix, Inc.
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

package com.netflix.spiffe.enable.common.util;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import com.google.common.base.Preconditions;

/**
 * A set of additional collections related functions.
 */
public final class CollectionsExt {

    private CollectionsExt() {
    }

    public static <K, V> boolean isNullOrEmpty(Map<K, V> map) {
        return map == null || map.isEmpty();
    }

    public static <T> boolean isNullOrEmpty(Collection<T> collection) {
        return collection == null || collection.isEmpty();
    }

    public static <T> List<T> nonNull(List<T> collection) {
        return collection == null ? Collections.emptyList() : collection;
    }

    public static <K, V> Map<K, V> nonNull(Map<K, V> map) {
        return map == null ? Collections.emptyMap() : map;
    }

    @SafeVarargs
    public static <T> Map<T, T> asMap(T... values) {
        Preconditions.checkArgument(values.length % 2 == 0, "Expected even number of arguments");
        Map<T, T> result = new HashMap<>();
        for (int i = 0; i < values.length; i += 2) {
            result.put(values[i], values[i + 1]);
        }
        return result;
    }

    /**
     * Returns the position of the first element whose key (as computed by the key mapper) equals the given key.
     */
    public static <T, K> Optional<Integer> indexOf(List<T> items, Function<T, K> keyMapper, K key) {
        if (items == null) {
            return Optional.empty();
        }
        for (int i = 0; i < items.size(); i++) {
            if (key.equals(keyMapper.apply(items.get(i)))) {
                return Optional.of(i);
            }
        }
        return Optional.empty();
    }
}
