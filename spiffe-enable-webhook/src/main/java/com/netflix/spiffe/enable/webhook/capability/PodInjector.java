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

import com.netflix.spiffe.enable.webhook.pod.PodMutationContext;
import io.kubernetes.client.openapi.models.V1Pod;

/**
 * Adds a set of resources to a pod. Implementations must go through {@link com.netflix.spiffe.enable.webhook.pod.PodResources},
 * so that injecting into a pod that already has the resources leaves it unchanged.
 */
public interface PodInjector {

    /**
     * @throws com.netflix.spiffe.enable.webhook.SpiffeEnableException if a configuration file cannot be rendered
     */
    void inject(V1Pod pod, PodMutationContext context);
}
