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

import java.util.Collections;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.annotations.VisibleForTesting;
import com.netflix.spiffe.enable.webhook.WebhookConfiguration;
import com.netflix.spiffe.enable.webhook.pod.PodMutationContext;
import com.netflix.spiffe.enable.webhook.pod.PodResources;
import com.netflix.spiffe.enable.webhook.render.SpiffeHelperConfig;
import com.netflix.spiffe.enable.webhook.render.SpiffeHelperConfigRenderer;
import io.kubernetes.client.custom.IntOrString;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1EmptyDirVolumeSource;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1HTTPGetAction;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1Probe;
import io.kubernetes.client.openapi.models.V1Volume;
import io.kubernetes.client.openapi.models.V1VolumeMount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.netflix.spiffe.enable.webhook.pod.PodConstants.CERTS_DIRECTORY;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.CERTS_VOLUME;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.HELPER_CONFIG_ENV_NAME;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.HELPER_CONFIG_FILE_PATH;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.HELPER_CONFIG_MOUNT_PATH;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.HELPER_CONFIG_VOLUME;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.HELPER_HEALTH_CHECK_LIVENESS_PATH;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.HELPER_HEALTH_CHECK_PORT;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.HELPER_HEALTH_CHECK_READINESS_PATH;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.HELPER_INIT_CONTAINER;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.HELPER_SIDECAR_CONTAINER;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.IMAGE_PULL_POLICY_IF_NOT_PRESENT;

/**
 * Injects the spiffe-helper sidecar. An init container writes the rendered helper configuration into the
 * <tt>spiffe-helper-config</tt> volume before any other init container runs, and the sidecar keeps the workload
 * SVIDs and trust bundles up to date in the shared <tt>spiffe-enable-certs</tt> volume.
 */
@Singleton
public class SpiffeHelperInjector implements CapabilityInjector {

    private static final Logger logger = LoggerFactory.getLogger(SpiffeHelperInjector.class);

    private final WebhookConfiguration configuration;
    private final SpiffeHelperConfigRenderer renderer;

    @Inject
    public SpiffeHelperInjector(WebhookConfiguration configuration, SpiffeHelperConfigRenderer renderer) {
        this.configuration = configuration;
        this.renderer = renderer;
    }

    @Override
    public Capability getCapability() {
        return Capability.Helper;
    }

    @Override
    public void inject(V1Pod pod, PodMutationContext context) {
        SpiffeHelperConfig helperConfig = SpiffeHelperConfig.newBuilder()
                .withIncludeIntermediateBundle(context.getAnnotations().isIncludeIntermediateBundle())
                .build();
        String renderedConfig = renderer.render(helperConfig);

        if (PodResources.ensureVolume(pod, newEmptyDirVolume(HELPER_CONFIG_VOLUME))) {
            logger.info("{} Added spiffe-helper config volume: {}", context, HELPER_CONFIG_VOLUME);
        }
        if (PodResources.ensureVolume(pod, newEmptyDirVolume(CERTS_VOLUME))) {
            logger.info("{} Added certificates volume: {}", context, CERTS_VOLUME);
        }
        if (PodResources.ensureInitContainer(pod, newInitContainer(renderedConfig), Collections.emptySet())) {
            logger.info("{} Added spiffe-helper config init container: {}", context, HELPER_INIT_CONTAINER);
        }
        if (PodResources.ensureContainer(pod, newSidecarContainer())) {
            logger.info("{} Added spiffe-helper sidecar container: {}", context, HELPER_SIDECAR_CONTAINER);
        }
    }

    @VisibleForTesting
    V1Container newInitContainer(String renderedConfig) {
        return new V1Container()
                .name(HELPER_INIT_CONTAINER)
                .image(configuration.getInitHelperImage())
                .imagePullPolicy(IMAGE_PULL_POLICY_IF_NOT_PRESENT)
                .command(InitContainerCommands.SHELL)
                .addArgsItem(InitContainerCommands.writeEnvToFile(HELPER_CONFIG_ENV_NAME, HELPER_CONFIG_MOUNT_PATH, HELPER_CONFIG_FILE_PATH)
                        + " && " + InitContainerCommands.printFile("SPIFFE Helper Config", HELPER_CONFIG_FILE_PATH))
                .addEnvItem(new V1EnvVar().name(HELPER_CONFIG_ENV_NAME).value(renderedConfig))
                .addVolumeMountsItem(new V1VolumeMount().name(HELPER_CONFIG_VOLUME).mountPath(HELPER_CONFIG_MOUNT_PATH))
                .addVolumeMountsItem(new V1VolumeMount().name(CERTS_VOLUME).mountPath(CERTS_DIRECTORY));
    }

    @VisibleForTesting
    V1Container newSidecarContainer() {
        V1Container sidecar = new V1Container()
                .name(HELPER_SIDECAR_CONTAINER)
                .image(configuration.getSpiffeHelperImage())
                .imagePullPolicy(IMAGE_PULL_POLICY_IF_NOT_PRESENT)
                .addArgsItem("-config")
                .addArgsItem(HELPER_CONFIG_FILE_PATH)
                .startupProbe(newProbe(HELPER_HEALTH_CHECK_READINESS_PATH, 5, 5, 10, 2))
                .livenessProbe(newProbe(HELPER_HEALTH_CHECK_LIVENESS_PATH, 60, 15, 3, 5))
                .readinessProbe(newProbe(HELPER_HEALTH_CHECK_READINESS_PATH, 15, 10, 3, 5))
                .addVolumeMountsItem(new V1VolumeMount().name(HELPER_CONFIG_VOLUME).mountPath(HELPER_CONFIG_MOUNT_PATH).readOnly(true))
                .addVolumeMountsItem(new V1VolumeMount().name(CERTS_VOLUME).mountPath(CERTS_DIRECTORY));
        return WorkloadApiInjector.withWorkloadApiAccess(sidecar);
    }

    private static V1Probe newProbe(String path, int initialDelaySeconds, int periodSeconds, int failureThreshold, int timeoutSeconds) {
        return new V1Probe()
                .httpGet(new V1HTTPGetAction()
                        .path(path)
                        .port(new IntOrString(HELPER_HEALTH_CHECK_PORT))
                )
                .initialDelaySeconds(initialDelaySeconds)
                .periodSeconds(periodSeconds)
                .failureThreshold(failureThreshold)
                .successThreshold(1)
                .timeoutSeconds(timeoutSeconds);
    }

    static V1Volume newEmptyDirVolume(String name) {
        return new V1Volume().name(name).emptyDir(new V1EmptyDirVolumeSource());
    }
}
