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

package com.netflix.spiffe.enable.webhook;

import com.netflix.archaius.api.annotations.Configuration;
import com.netflix.archaius.api.annotations.DefaultValue;

@Configuration(prefix = "spiffeEnable.webhook")
public interface WebhookConfiguration {

    /**
     * @return the CSI driver serving the SPIFFE Workload API socket on each node.
     */
    @DefaultValue("csi.spiffe.io")
    String getCsiDriverName();

    @DefaultValue("ghcr.io/spiffe/spiffe-helper:0.10.0")
    String getSpiffeHelperImage();

    /**
     * @return image of the init containers writing rendered configuration files (requires a shell and nft).
     */
    @DefaultValue("010438484483.dkr.ecr.eu-west-1.amazonaws.com/cofide/spiffe-enable-init:v0.1.0-alpha")
    String getInitHelperImage();

    @DefaultValue("docker.io/istio/proxyv2:1.26.4")
    String getEnvoyImage();

    @DefaultValue("010438484483.dkr.ecr.eu-west-1.amazonaws.com/cofide/spiffe-enable-ui:v0.1.0-alpha")
    String getDebugUiImage();

    /**
     * @return in-cluster address of the agent aggregated discovery service the Envoy sidecar connects to.
     */
    @DefaultValue("cofide-agent.cofide.svc.cluster.local")
    String getAgentXdsService();

    @DefaultValue("18001")
    int getAgentXdsPort();

    @DefaultValue("node")
    String getEnvoyNodeId();

    @DefaultValue("cluster")
    String getEnvoyClusterName();
}
