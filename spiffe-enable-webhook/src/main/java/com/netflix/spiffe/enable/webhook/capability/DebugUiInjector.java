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

import javax.inject.Inject;
import javax.inject.Singleton;

import com.netflix.spiffe.enable.webhook.WebhookConfiguration;
import com.netflix.spiffe.enable.webhook.pod.PodMutationContext;
import com.netflix.spiffe.enable.webhook.pod.PodResources;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1ContainerPort;
import io.kubernetes.client.openapi.models.V1Pod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.netflix.spiffe.enable.webhook.pod.PodConstants.DEBUG_UI_CONTAINER;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.DEBUG_UI_PORT;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.IMAGE_PULL_POLICY_ALWAYS;

/**
 * Adds the debug UI container, which shows the SVIDs the workload receives from the Workload API.
 */
@Singleton
public class DebugUiInjector implements PodInjector {

    private static final Logger logger = LoggerFactory.getLogger(DebugUiInjector.class);

    private final WebhookConfiguration configuration;

    @Inject
    public DebugUiInjector(WebhookConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public void inject(V1Pod pod, PodMutationContext context) {
        V1Container container = new V1Container()
                .name(DEBUG_UI_CONTAINER)
                .image(configuration.getDebugUiImage())
                .imagePullPolicy(IMAGE_PULL_POLICY_ALWAYS)
                .addPortsItem(new V1ContainerPort().containerPort(DEBUG_UI_PORT));
        if (PodResources.ensureContainer(pod, WorkloadApiInjector.withWorkloadApiAccess(container))) {
            logger.info("{} Added debug UI container: {}", context, DEBUG_UI_CONTAINER);
        }
    }
}
