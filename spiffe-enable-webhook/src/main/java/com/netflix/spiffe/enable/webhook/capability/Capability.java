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

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Capabilities that can be requested with the mode annotation.
 */
public enum Capability {

    /**
     * spiffe-helper sidecar writing X.509 and JWT SVIDs to a shared directory.
     */
    Helper("helper"),

    /**
     * Envoy sidecar with traffic redirection, configured over ADS by the agent.
     */
    Proxy("proxy");

    private final String modeToken;

    Capability(String modeToken) {
        this.modeToken = modeToken;
    }

    public String getModeToken() {
        return modeToken;
    }

    public static Optional<Capability> fromModeToken(String token) {
        for (Capability capability : values()) {
            if (capability.modeToken.equals(token)) {
                return Optional.of(capability);
            }
        }
        return Optional.empty();
    }

    public static List<String> getModeTokens() {
        return Arrays.stream(values()).map(Capability::getModeToken).collect(Collectors.toList());
    }
}
