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


package com.netflix.spiffe.enable.common.json;

import java.io.IOException;
import java.io.UncheckedIOException;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * Jackon's {@link ObjectMapper} is thread safe, and uses cache for optimal performance. It makes sense
 * to reuse the same instance within single JVM. This class provides shared, pre-configured instances of
 * {@link ObjectMapper} with different configuration options.
 */
public class ObjectMappers {

    private static final ObjectMapper JACKSON_DEFAULT = new ObjectMapper();
    private static final ObjectMapper COMPACT = createCompactMapper();
    private static final ObjectMapper CANONICAL = createCanonicalMapper();

    public static ObjectMapper jacksonDefaultMapper() {
        return JACKSON_DEFAULT;
    }

    /**
     * Mapper for external wire formats: unknown properties are ignored, and null values are not written.
     */
    public static ObjectMapper compactMapper() {
        return COMPACT;
    }

    /**
     * Mapper writing object properties and map entries sorted by name, so equal values always serialize to the same
     * text.
     */
    public static ObjectMapper canonicalMapper() {
        return CANONICAL;
    }

    public static String writeValueAsString(ObjectMapper objectMapper, Object object) {
        try {
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static <T> T readValue(ObjectMapper objectMapper, String json, Class<T> clazz) {
        try {
            return objectMapper.readValue(json, clazz);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static ObjectMapper createCompactMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        mapper.disable(SerializationFeature.INDENT_OUTPUT);
        return mapper;
    }

    private static ObjectMapper createCanonicalMapper() {
        return JsonMapper.builder()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.INDENT_OUTPUT)
                .build();
    }
}
