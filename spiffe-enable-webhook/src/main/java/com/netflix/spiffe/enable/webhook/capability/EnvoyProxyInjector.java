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
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.google.common.annotations.VisibleForTesting;
import com.netflix.spiffe.enable.webhook.WebhookConfiguration;
import com.netflix.spiffe.enable.webhook.pod.PodMutationContext;
import com.netflix.spiffe.enable.webhook.pod.PodResources;
import com.netflix.spiffe.enable.webhook.render.EnvoyBootstrapConfig;
import com.netflix.spiffe.enable.webhook.render.EnvoyBootstrapRenderer;
import com.netflix.spiffe.enable.webhook.render.NftablesParams;
import com.netflix.spiffe.enable.webhook.render.NftablesScriptRenderer;
import io.kubernetes.client.openapi.models.V1Capabilities;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1ContainerPort;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1SecurityContext;
import io.kubernetes.client.openapi.models.V1VolumeMount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ENVOY_CONFIG_ENV_NAME;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ENVOY_CONFIG_FILE_PATH;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ENVOY_CONFIG_MOUNT_PATH;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ENVOY_CONFIG_VOLUME;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ENVOY_INIT_CONTAINER;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ENVOY_PORT;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ENVOY_SIDECAR_CONTAINER;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ENVOY_UID;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.HELPER_INIT_CONTAINER;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.IMAGE_PULL_POLICY_IF_NOT_PRESENT;

/**
 * Injects the Envoy sidecar. The init container writes the Envoy bootstrap into the <tt>envoy-config</tt> volume
 * and installs the nftables rules redirecting the pod traffic through Envoy, which requires root with
 * <tt>NET_ADMIN</tt> and <tt>NET_RAW</tt>. The sidecar itself runs unprivileged as uid/gid 1337.
 */
@Singleton
public class EnvoyProxyInjector implements CapabilityInjector {

    private static final Logger logger = LoggerFactory.getLogger(EnvoyProxyInjector.class);

    /**
     * The spiffe-helper config init container stays first.
     */
    private static final Set<String> PRECEDING_INIT_CONTAINERS = Collections.singleton(HELPER_INIT_CONTAINER);

    private final WebhookConfiguration configuration;
    private final EnvoyBootstrapRenderer bootstrapRenderer;
    private final NftablesScriptRenderer nftablesRenderer;

    @Inject
    public EnvoyProxyInjector(WebhookConfiguration configuration,
                              EnvoyBootstrapRenderer bootstrapRenderer,
                              NftablesScriptRenderer nftablesRenderer) {
        this.configuration = configuration;
        this.bootstrapRenderer = bootstrapRenderer;
        this.nftablesRenderer = nftablesRenderer;
    }

    @Override
    public Capability getCapability() {
        return Capability.Proxy;
    }

    @Override
    public void inject(V1Pod pod, PodMutationContext context) {
        String bootstrap = bootstrapRenderer.render(newBootstrapConfig());
        String nftablesScript = nftablesRenderer.render(NftablesParams.DEFAULT);

        if (PodResources.ensureVolume(pod, SpiffeHelperInjector.newEmptyDirVolume(ENVOY_CONFIG_VOLUME))) {
            logger.info("{} Added Envoy config volume: {}", context, ENVOY_CONFIG_VOLUME);
        }
        if (PodResources.ensureInitContainer(pod, newInitContainer(bootstrap, nftablesScript), PRECEDING_INIT_CONTAINERS)) {
            logger.info("{} Added Envoy config init container: {}", context, ENVOY_INIT_CONTAINER);
        }
        if (PodResources.ensureContainer(pod, newSidecarContainer())) {
            logger.info("{} Added Envoy sidecar container: {}", context, ENVOY_SIDECAR_CONTAINER);
        }
    }

    @VisibleForTesting
    EnvoyBootstrapConfig newBootstrapConfig() {
        return EnvoyBootstrapConfig.newBuilder()
                .withNodeId(configuration.getEnvoyNodeId())
                .withClusterName(configuration.getEnvoyClusterName())
                .withAgentXdsService(configuration.getAgentXdsService())
                .withAgentXdsPort(configuration.getAgentXdsPort())
                .build();
    }

    @VisibleForTesting
    V1Container newInitContainer(String bootstrap, String nftablesScript) {
        String command = "set -e\n"
                + InitContainerCommands.writeEnvToFile(ENVOY_CONFIG_ENV_NAME, ENVOY_CONFIG_MOUNT_PATH, ENVOY_CONFIG_FILE_PATH) + "\n"
                + nftablesScript;
        return new V1Container()
                .name(ENVOY_INIT_CONTAINER)
                .image(configuration.getInitHelperImage())
                .imagePullPolicy(IMAGE_PULL_POLICY_IF_NOT_PRESENT)
                .command(InitContainerCommands.SHELL)
                .addArgsItem(command)
                .addEnvItem(new V1EnvVar().name(ENVOY_CONFIG_ENV_NAME).value(bootstrap))
                .addVolumeMountsItem(new V1VolumeMount().name(ENVOY_CONFIG_VOLUME).mountPath(ENVOY_CONFIG_MOUNT_PATH))
                .securityContext(new V1SecurityContext()
                        .capabilities(new V1Capabilities().addAddItem("NET_ADMIN").addAddItem("NET_RAW"))
                        .runAsUser(0L)
                        .runAsNonRoot(false)
                );
    }

    @VisibleForTesting
    V1Container newSidecarContainer() {
        V1Container sidecar = new V1Container()
                .name(ENVOY_SIDECAR_CONTAINER)
                .image(configuration.getEnvoyImage())
                .imagePullPolicy(IMAGE_PULL_POLICY_IF_NOT_PRESENT)
                .addCommandItem("envoy")
                .addArgsItem("-c")
                .addArgsItem(ENVOY_CONFIG_FILE_PATH)
                .addVolumeMountsItem(new V1VolumeMount().name(ENVOY_CONFIG_VOLUME).mountPath(ENVOY_CONFIG_MOUNT_PATH))
                .securityContext(new V1SecurityContext()
                        .allowPrivilegeEscalation(false)
                        .runAsUser(ENVOY_UID)
                        .runAsGroup(ENVOY_UID)
                        .runAsNonRoot(true)
                        .privileged(false)
                        .capabilities(new V1Capabilities().addDropItem("all"))
                )
                .addPortsItem(new V1ContainerPort().containerPort(ENVOY_PORT));
        return WorkloadApiInjector.withWorkloadApiAccess(sidecar);
    }
}
