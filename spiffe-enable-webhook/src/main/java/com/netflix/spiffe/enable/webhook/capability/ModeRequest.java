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


package com.netflix.spiffe.enable.webhook.capability;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.netflix.spiffe.enable.webhook.SpiffeEnableException;
import com.netflix.spiffe.enable.webhook.pod.InjectionAnnotations;

import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ANNOTATION_MODE;

/**
 * Capabilities requested by the mode annotation, in declaration order with duplicates removed, together with the
 * tokens that do not name any capability.
 */
public final class ModeRequest {

    private final String modeValue;
    private final List<Capability> capabilities;
    private final List<String> invalidTokens;

    private ModeRequest(String modeValue, List<Capability> capabilities, List<String> invalidTokens) {
        this.modeValue = modeValue;
        this.capabilities = capabilities;
        this.invalidTokens = invalidTokens;
    }

    public List<Capability> getCapabilities() {
        return capabilities;
    }

    public List<String> getInvalidTokens() {
        return invalidTokens;
    }

    public boolean isValid() {
        return invalidTokens.isEmpty();
    }

    /**
     * Returns an exception describing the invalid tokens, or {@link Optional#empty()} if all tokens are valid.
     */
    public Optional<SpiffeEnableException> validate() {
        if (isValid()) {
            return Optional.empty();
        }
        return Optional.of(SpiffeEnableException.invalidMode(ANNOTATION_MODE, modeValue, invalidTokens, Capability.getModeTokens()));
    }

    public static ModeRequest parse(InjectionAnnotations annotations) {
        Set<Capability> capabilities = new LinkedHashSet<>();
        Set<String> invalidTokens = new LinkedHashSet<>();
        for (String token : annotations.getModeTokens()) {
            Optional<Capability> capability = Capability.fromModeToken(token);
            if (capability.isPresent()) {
                capabilities.add(capability.get());
            } else {
                invalidTokens.add(token);
            }
        }
        return new ModeRequest(
                annotations.getModeValue(),
                Collections.unmodifiableList(new ArrayList<>(capabilities)),
                Collections.unmodifiableList(new ArrayList<>(invalidTokens))
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ModeRequest that = (ModeRequest) o;
        return Objects.equals(modeValue, that.modeValue) &&
                Objects.equals(capabilities, that.capabilities) &&
                Objects.equals(invalidTokens, that.invalidTokens);
    }

    @Override
    public int hashCode() {
        return Objects.hash(modeValue, capabilities, invalidTokens);
    }

    @Override
    public String toString() {
        return "ModeRequest{" +
                "modeValue='" + modeValue + '\'' +
                ", capabilities=" + capabilities +
                ", invalidTokens=" + invalidTokens +
                '}';
    }
}
