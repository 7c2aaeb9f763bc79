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

package com.netflix.spiffe.enable.webhook.pod;

public final class PodConstants {
    private PodConstants() {
    }

    // Annotations
    public static final String ANNOTATION_ENABLED = "spiffe.cofide.io/enabled";
    public static final String ANNOTATION_MODE = "spiffe.cofide.io/mode";
    public static final String ANNOTATION_DEBUG = "spiffe.cofide.io/debug";
    public static final String ANNOTATION_HELPER_INCLUDE_INTERMEDIATE_BUNDLE = "spiffe.cofide.io/spiffe-helper-include-intermediate-bundle";

    public static final String ANNOTATION_TRUE = "true";

    public static final String IMAGE_PULL_POLICY_IF_NOT_PRESENT = "IfNotPresent";
    public static final String IMAGE_PULL_POLICY_ALWAYS = "Always";

    // SPIFFE Workload API
    public static final String WORKLOAD_API_VOLUME = "spiffe-workload-api";
    public static final String WORKLOAD_API_MOUNT_PATH = "/spiffe-workload-api";
    public static final String WORKLOAD_API_SOCKET_ENV_NAME = "SPIFFE_ENDPOINT_SOCKET";
    public static final String WORKLOAD_API_SOCKET_PATH = WORKLOAD_API_MOUNT_PATH + "/spire-agent.sock";
    public static final String WORKLOAD_API_SOCKET = "unix://" + WORKLOAD_API_SOCKET_PATH;

    // Certificates written by spiffe-helper
    public static final String CERTS_VOLUME = "spiffe-enable-certs";
    public static final String CERTS_DIRECTORY = "/spiffe-enable";

    // spiffe-helper
    public static final String HELPER_CONFIG_VOLUME = "spiffe-helper-config";
    public static final String HELPER_CONFIG_MOUNT_PATH = "/etc/spiffe-helper";
    public static final String HELPER_CONFIG_FILE_NAME = "config.conf";
    public static final String HELPER_CONFIG_FILE_PATH = HELPER_CONFIG_MOUNT_PATH + "/" + HELPER_CONFIG_FILE_NAME;
    public static final String HELPER_CONFIG_ENV_NAME = "SPIFFE_HELPER_CONFIG";
    public static final String HELPER_INIT_CONTAINER = "inject-spiffe-helper-config";
    public static final String HELPER_SIDECAR_CONTAINER = "spiffe-helper";
    public static final int HELPER_HEALTH_CHECK_PORT = 8081;
    public static final String HELPER_HEALTH_CHECK_READINESS_PATH = "/ready";
    public static final String HELPER_HEALTH_CHECK_LIVENESS_PATH = "/live";

    // Envoy proxy
    public static final String ENVOY_CONFIG_VOLUME = "envoy-config";
    public static final String ENVOY_CONFIG_MOUNT_PATH = "/etc/envoy";
    public static final String ENVOY_CONFIG_FILE_NAME = "envoy.yaml";
    public static final String ENVOY_CONFIG_FILE_PATH = ENVOY_CONFIG_MOUNT_PATH + "/" + ENVOY_CONFIG_FILE_NAME;
    public static final String ENVOY_CONFIG_ENV_NAME = "ENVOY_CONFIG_CONTENT";
    public static final String ENVOY_INIT_CONTAINER = "inject-envoy-config";
    public static final String ENVOY_SIDECAR_CONTAINER = "envoy-sidecar";
    public static final int ENVOY_PORT = 10000;
    public static final int ENVOY_ADMIN_PORT = 9901;
    public static final int ENVOY_DNS_PROXY_PORT = 15053;
    public static final long ENVOY_UID = 1337;

    // Debug UI
    public static final String DEBUG_UI_CONTAINER = "spiffe-enable-ui";
    public static final int DEBUG_UI_PORT = 8000;
}
