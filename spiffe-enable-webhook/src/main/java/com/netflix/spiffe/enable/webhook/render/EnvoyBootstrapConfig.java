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


package com.netflix.spiffe.enable.webhook.render;

import java.util.Objects;

import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ENVOY_ADMIN_PORT;

/**
 * Parameters of the Envoy bootstrap document: the node identity, the local admin listener and the agent aggregated
 * discovery service (ADS) endpoint.
 */
public final class EnvoyBootstrapConfig {

    public static final String DEFAULT_NODE_ID = "node";
    public static final String DEFAULT_CLUSTER_NAME = "cluster";
    public static final String DEFAULT_ADMIN_ADDRESS = "127.0.0.1";

    private final String nodeId;
    private final String clusterName;
    private final String adminAddress;
    private final int adminPort;
    private final String agentXdsService;
    private final int agentXdsPort;

    private EnvoyBootstrapConfig(String nodeId,
                                 String clusterName,
                                 String adminAddress,
                                 int adminPort,
                                 String agentXdsService,
                                 int agentXdsPort) {
        this.nodeId = nodeId;
        this.clusterName = clusterName;
        this.adminAddress = adminAddress;
        this.adminPort = adminPort;
        this.agentXdsService = agentXdsService;
        this.agentXdsPort = agentXdsPort;
    }

    public String getNodeId() {
        return nodeId;
    }

    public String getClusterName() {
        return clusterName;
    }

    public String getAdminAddress() {
        return adminAddress;
    }

    public int getAdminPort() {
        return adminPort;
    }

    public String getAgentXdsService() {
        return agentXdsService;
    }

    public int getAgentXdsPort() {
        return agentXdsPort;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        EnvoyBootstrapConfig that = (EnvoyBootstrapConfig) o;
        return adminPort == that.adminPort &&
                agentXdsPort == that.agentXdsPort &&
                Objects.equals(nodeId, that.nodeId) &&
                Objects.equals(clusterName, that.clusterName) &&
                Objects.equals(adminAddress, that.adminAddress) &&
                Objects.equals(agentXdsService, that.agentXdsService);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeId, clusterName, adminAddress, adminPort, agentXdsService, agentXdsPort);
    }

    @Override
    public String toString() {
        return "EnvoyBootstrapConfig{" +
                "nodeId='" + nodeId + '\'' +
                ", clusterName='" + clusterName + '\'' +
                ", adminAddress='" + adminAddress + '\'' +
                ", adminPort=" + adminPort +
                ", agentXdsService='" + agentXdsService + '\'' +
                ", agentXdsPort=" + agentXdsPort +
                '}';
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String nodeId = DEFAULT_NODE_ID;
        private String clusterName = DEFAULT_CLUSTER_NAME;
        private String adminAddress = DEFAULT_ADMIN_ADDRESS;
        private int adminPort = ENVOY_ADMIN_PORT;
        private String agentXdsService;
        private int agentXdsPort;

        private Builder() {
        }

        public Builder withNodeId(String nodeId) {
            this.nodeId = nodeId;
            return this;
        }

        public Builder withClusterName(String clusterName) {
            this.clusterName = clusterName;
            return this;
        }

        public Builder withAdminAddress(String adminAddress) {
            this.adminAddress = adminAddress;
            return this;
        }

        public Builder withAdminPort(int adminPort) {
            this.adminPort = adminPort;
            return this;
        }

        public Builder withAgentXdsService(String agentXdsService) {
            this.agentXdsService = agentXdsService;
            return this;
        }

        public Builder withAgentXdsPort(int agentXdsPort) {
            this.agentXdsPort = agentXdsPort;
            return this;
        }

        public EnvoyBootstrapConfig build() {
            return new EnvoyBootstrapConfig(nodeId, clusterName, adminAddress, adminPort, agentXdsService, agentXdsPort);
        }
    }
}
