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

import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.netflix.spiffe.enable.webhook.SpiffeEnableException;

/**
 * Outcome of a pod mutation.
 */
public final class MutationResult {

    public enum Outcome {
        /**
         * Injection not enabled for the pod, admitted unchanged.
         */
        Allowed,

        /**
         * Admitted with a JSON patch (possibly empty, if the pod has all resources already).
         */
        Patched,

        /**
         * Rejected because of invalid annotation values.
         */
        Denied,

        Errored
    }

    private final Outcome outcome;
    private final String message;
    private final JsonNode patch;
    private final SpiffeEnableException error;

    private MutationResult(Outcome outcome, String message, JsonNode patch, SpiffeEnableException error) {
        this.outcome = outcome;
        this.message = message;
        this.patch = patch;
        this.error = error;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public String getMessage() {
        return message;
    }

    public Optional<JsonNode> getPatch() {
        return Optional.ofNullable(patch);
    }

    public Optional<SpiffeEnableException> getError() {
        return Optional.ofNullable(error);
    }

    public static MutationResult allowed(String message) {
        return new MutationResult(Outcome.Allowed, message, null, null);
    }

    public static MutationResult patched(JsonNode patch) {
        return new MutationResult(Outcome.Patched, null, patch, null);
    }

    public static MutationResult denied(SpiffeEnableException error) {
        return new MutationResult(Outcome.Denied, error.getMessage(), null, error);
    }

    public static MutationResult errored(SpiffeEnableException error) {
        return new MutationResult(Outcome.Errored, error.getMessage(), null, error);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MutationResult that = (MutationResult) o;
        return outcome == that.outcome &&
                Objects.equals(message, that.message) &&
                Objects.equals(patch, that.patch) &&
                Objects.equals(error, that.error);
    }

    @Override
    public int hashCode() {
        return Objects.hash(outcome, message, patch, error);
    }

    @Override
    public String toString() {
        return "MutationResult{" +
                "outcome=" + outcome +
                ", message='" + message + '\'' +
                ", patch=" + patch +
                '}';
    }
}
