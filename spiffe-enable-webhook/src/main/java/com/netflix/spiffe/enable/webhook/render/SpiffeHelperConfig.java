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

import static com.netflix.spiffe.enable.webhook.pod.PodConstants.CERTS_DIRECTORY;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.HELPER_HEALTH_CHECK_LIVENESS_PATH;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.HELPER_HEALTH_CHECK_PORT;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.HELPER_HEALTH_CHECK_READINESS_PATH;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.WORKLOAD_API_SOCKET_PATH;

/**
 * Parameters of the spiffe-helper configuration file.
 */
public final class SpiffeHelperConfig {

    public static final String DEFAULT_JWT_AUDIENCE = "aud";

    private final String agentAddress;
    private final String certDir;
    private final boolean includeIntermediateBundle;
    private final String jwtAudience;
    private final int healthCheckPort;
    private final String readinessPath;
    private final String livenessPath;

    private SpiffeHelperConfig(String agentAddress,
                               String certDir,
                               boolean includeIntermediateBundle,
                               String jwtAudience,
                               int healthCheckPort,
                               String readinessPath,
                               String livenessPath) {
        this.agentAddress = agentAddress;
        this.certDir = certDir;
        this.includeIntermediateBundle = includeIntermediateBundle;
        this.jwtAudience = jwtAudience;
        this.healthCheckPort = healthCheckPort;
        this.readinessPath = readinessPath;
        this.livenessPath = livenessPath;
    }

    public String getAgentAddress() {
        return agentAddress;
    }

    public String getCertDir() {
        return certDir;
    }

    public boolean isIncludeIntermediateBundle() {
        return includeIntermediateBundle;
    }

    public String getJwtAudience() {
        return jwtAudience;
    }

    public int getHealthCheckPort() {
        return healthCheckPort;
    }

    public String getReadinessPath() {
        return readinessPath;
    }

    public String getLivenessPath() {
        return livenessPath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SpiffeHelperConfig that = (SpiffeHelperConfig) o;
        return includeIntermediateBundle == that.includeIntermediateBundle &&
                healthCheckPort == that.healthCheckPort &&
                Objects.equals(agentAddress, that.agentAddress) &&
                Objects.equals(certDir, that.certDir) &&
                Objects.equals(jwtAudience, that.jwtAudience) &&
                Objects.equals(readinessPath, that.readinessPath) &&
                Objects.equals(livenessPath, that.livenessPath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(agentAddress, certDir, includeIntermediateBundle, jwtAudience, healthCheckPort, readinessPath, livenessPath);
    }

    @Override
    public String toString() {
        return "SpiffeHelperConfig{" +
                "agentAddress='" + agentAddress + '\'' +
                ", certDir='" + certDir + '\'' +
                ", includeIntermediateBundle=" + includeIntermediateBundle +
                ", jwtAudience='" + jwtAudience + '\'' +
                ", healthCheckPort=" + healthCheckPort +
                ", readinessPath='" + readinessPath + '\'' +
                ", livenessPath='" + livenessPath + '\'' +
                '}';
    }

    public Builder toBuilder() {
        return newBuilder()
                .withAgentAddress(agentAddress)
                .withCertDir(certDir)
                .withIncludeIntermediateBundle(includeIntermediateBundle)
                .withJwtAudience(jwtAudience)
                .withHealthCheckPort(healthCheckPort)
                .withReadinessPath(readinessPath)
                .withLivenessPath(livenessPath);
    }

    /**
     * Builder preset with the workload API socket, the shared certificate directory and the helper health endpoints.
     */
    public static Builder newBuilder() {
        return new Builder();
    }

    public static final class Builder {
        private String agentAddress = WORKLOAD_API_SOCKET_PATH;
        private String certDir = CERTS_DIRECTORY;
        private boolean includeIntermediateBundle;
        private String jwtAudience = DEFAULT_JWT_AUDIENCE;
        private int healthCheckPort = HELPER_HEALTH_CHECK_PORT;
        private String readinessPath = HELPER_HEALTH_CHECK_READINESS_PATH;
        private String livenessPath = HELPER_HEALTH_CHECK_LIVENESS_PATH;

        private Builder() {
        }

        public Builder withAgentAddress(String agentAddress) {
            this.agentAddress = agentAddress;
            return this;
        }

        public Builder withCertDir(String certDir) {
            this.certDir = certDir;
            return this;
        }

        public Builder withIncludeIntermediateBundle(boolean includeIntermediateBundle) {
            this.includeIntermediateBundle = includeIntermediateBundle;
            return this;
        }

        public Builder withJwtAudience(String jwtAudience) {
            this.jwtAudience = jwtAudience;
            return this;
        }

        public Builder withHealthCheckPort(int healthCheckPort) {
            this.healthCheckPort = healthCheckPort;
            return this;
        }

        public Builder withReadinessPath(String readinessPath) {
            this.readinessPath = readinessPath;
            return this;
        }

        public Builder withLivenessPath(String livenessPath) {
            this.livenessPath = livenessPath;
            return this;
        }

        public SpiffeHelperConfig build() {
            return new SpiffeHelperConfig(agentAddress, certDir, includeIntermediateBundle, jwtAudience, healthCheckPort, readinessPath, livenessPath);
        }
    }
}
