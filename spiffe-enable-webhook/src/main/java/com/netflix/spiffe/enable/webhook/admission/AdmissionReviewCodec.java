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


package com.netflix.spiffe.enable.webhook.admission;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import javax.inject.Singleton;

import com.fasterxml.jackson.databind.JsonNode;
import com.netflix.spiffe.enable.common.json.ObjectMappers;
import com.netflix.spiffe.enable.webhook.SpiffeEnableException;

/**
 * JSON encoding of {@link AdmissionReview} messages and of the JSON patches they carry.
 */
@Singleton
public class AdmissionReviewCodec {

    public AdmissionReview decode(String body) {
        if (body == null || body.isEmpty()) {
            throw SpiffeEnableException.malformedRequest("empty admission review");
        }
        try {
            return ObjectMappers.readValue(ObjectMappers.compactMapper(), body, AdmissionReview.class);
        } catch (UncheckedIOException e) {
            throw SpiffeEnableException.malformedRequest("failed to decode admission review", e.getCause());
        }
    }

    public String encode(AdmissionReview review) {
        try {
            return ObjectMappers.writeValueAsString(ObjectMappers.compactMapper(), review);
        } catch (UncheckedIOException e) {
            throw SpiffeEnableException.marshalFailure(e.getCause());
        }
    }

    public String encodePatch(JsonNode patch) {
        return Base64.getEncoder().encodeToString(patch.toString().getBytes(StandardCharsets.UTF_8));
    }
}
