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

import java.util.Collection;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.spectator.api.Id;
import com.netflix.spectator.api.Registry;
import com.netflix.spiffe.enable.webhook.SpiffeEnableException;
import com.netflix.spiffe.enable.webhook.capability.Capability;

@Singleton
public class MutationMetrics {

    private static final String METRICS_ROOT = "spiffeEnable.mutation.";
    private static final String RESULT_TAG = "result";
    private static final String ERROR_TAG = "error";
    private static final String CAPABILITY_TAG = "capability";

    private final Registry registry;
    private final Id resultId;
    private final Id capabilityId;

    @Inject
    public MutationMetrics(Registry registry) {
        this.registry = registry;

        this.resultId = registry.createId(METRICS_ROOT + "result");
        this.capabilityId = registry.createId(METRICS_ROOT + "capability");
    }

    public void incrementAllowed() {
        registry.counter(resultId.withTag(RESULT_TAG, "allowed")).increment();
    }

    public void incrementPatched(Collection<Capability> capabilities) {
        registry.counter(resultId.withTag(RESULT_TAG, "patched")).increment();
        for (Capability capability : capabilities) {
            registry.counter(capabilityId.withTag(CAPABILITY_TAG, capability.getModeToken())).increment();
        }
    }

    public void incrementDenied(SpiffeEnableException.ErrorCode errorCode) {
        registry.counter(resultId
                .withTag(RESULT_TAG, "denied")
                .withTag(ERROR_TAG, errorCode.name())
        ).increment();
    }

    public void incrementErrored(SpiffeEnableException.ErrorCode errorCode) {
        registry.counter(resultId
                .withTag(RESULT_TAG, "errored")
                .withTag(ERROR_TAG, errorCode.name())
        ).increment();
    }
}
