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

import com.netflix.spiffe.enable.common.util.CollectionsExt;
import com.netflix.spiffe.enable.webhook.WebhookConfiguration;
import com.netflix.spiffe.enable.webhook.pod.PodMutationContext;
import com.netflix.spiffe.enable.webhook.pod.PodResources;
import io.kubernetes.client.openapi.models.V1CSIVolumeSource;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1Volume;
import io.kubernetes.client.openapi.models.V1VolumeMount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.netflix.spiffe.enable.webhook.pod.PodConstants.WORKLOAD_API_MOUNT_PATH;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.WORKLOAD_API_SOCKET;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.WORKLOAD_API_SOCKET_ENV_NAME;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.WORKLOAD_API_VOLUME;

/**
 * Gives every workload container access to the SPIFFE Workload API: a CSI volume exposing the agent socket, mounted
 * read-only in each container, and the <tt>SPIFFE_ENDPOINT_SOCKET</tt> variable pointing at it. Applied to every
 * pod that has injection enabled, regardless of the requested mode.
 */
@Singleton
public class WorkloadApiInjector implements PodInjector {

    private static final Logger logger = LoggerFactory.getLogger(WorkloadApiInjector.class);

    private final WebhookConfiguration configuration;

    @Inject
    public WorkloadApiInjector(WebhookConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public void inject(V1Pod pod, PodMutationContext context) {
        V1Volume volume = new V1Volume()
                .name(WORKLOAD_API_VOLUME)
                .csi(new V1CSIVolumeSource()
                        .driver(configuration.getCsiDriverName())
                        .readOnly(true)
                );
        if (PodResources.ensureVolume(pod, volume)) {
            logger.info("{} Added Workload API CSI volume: {}", context, WORKLOAD_API_VOLUME);
        }
        for (V1Container container : CollectionsExt.nonNull(pod.getSpec().getContainers())) {
            if (ensureWorkloadApiAccess(container)) {
                logger.info("{} Added Workload API socket to container: {}", context, container.getName());
            }
        }
    }

    /**
     * Ensures the container mounts the Workload API volume and has the socket environment variable set.
     *
     * @return true if the container was changed
     */
    public static boolean ensureWorkloadApiAccess(V1Container container) {
        boolean mountChanged = PodResources.ensureVolumeMount(container, newWorkloadApiVolumeMount());
        boolean envChanged = PodResources.ensureEnvVar(container, newWorkloadApiSocketEnvVar());
        return mountChanged || envChanged;
    }

    /**
     * Returns a container with the Workload API access added, for containers created by the injectors.
     */
    static V1Container withWorkloadApiAccess(V1Container container) {
        ensureWorkloadApiAccess(container);
        return container;
    }

    public static V1VolumeMount newWorkloadApiVolumeMount() {
        return new V1VolumeMount()
                .name(WORKLOAD_API_VOLUME)
                .mountPath(WORKLOAD_API_MOUNT_PATH)
                .readOnly(true);
    }

    public static V1EnvVar newWorkloadApiSocketEnvVar() {
        return new V1EnvVar()
                .name(WORKLOAD_API_SOCKET_ENV_NAME)
                .value(WORKLOAD_API_SOCKET);
    }
}
