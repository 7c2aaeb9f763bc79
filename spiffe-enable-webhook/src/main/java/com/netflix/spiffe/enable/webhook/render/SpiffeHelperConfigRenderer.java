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

import javax.inject.Singleton;

import com.netflix.spiffe.enable.common.util.StringExt;
import com.netflix.spiffe.enable.webhook.SpiffeEnableException;

import static com.netflix.spiffe.enable.common.util.StringExt.doubleQuotes;

/**
 * Renders the spiffe-helper configuration file (HCL). The file has a fixed set of lines in a fixed order, and all
 * string values are written as escaped, double quoted literals, so identical parameters always produce identical
 * text.
 */
@Singleton
public class SpiffeHelperConfigRenderer {

    private static final String WHAT = "spiffe-helper config";

    public String render(SpiffeHelperConfig config) {
        checkValue("agent address", config.getAgentAddress());
        checkValue("certificate directory", config.getCertDir());
        checkValue("JWT audience", config.getJwtAudience());
        checkValue("readiness path", config.getReadinessPath());
        checkValue("liveness path", config.getLivenessPath());
        if (config.getHealthCheckPort() < 1 || config.getHealthCheckPort() > 65535) {
            throw SpiffeEnableException.renderFailure(WHAT, "health check port out of range: " + config.getHealthCheckPort());
        }

        StringBuilder sb = new StringBuilder();
        line(sb, "agent_address = " + doubleQuotes(config.getAgentAddress()));
        line(sb, "include_federated_domains = true");
        if (config.isIncludeIntermediateBundle()) {
            line(sb, "add_intermediates_to_bundle = true");
        }
        line(sb, "cmd = \"\"");
        line(sb, "cmd_args = \"\"");
        line(sb, "cert_dir = " + doubleQuotes(config.getCertDir()));
        line(sb, "renew_signal = \"\"");
        line(sb, "svid_file_name = \"tls.crt\"");
        line(sb, "svid_key_file_name = \"tls.key\"");
        line(sb, "svid_bundle_file_name = \"ca.pem\"");
        line(sb, "jwt_bundle_file_name = \"cert.jwt\"");
        line(sb, "jwt_svids = [{jwt_audience=" + doubleQuotes(config.getJwtAudience()) + ", jwt_svid_file_name=\"jwt_svid.token\"}]");
        line(sb, "daemon_mode = true");
        line(sb, "health_checks.listener_enabled = true");
        line(sb, "health_checks.bind_port = " + config.getHealthCheckPort());
        line(sb, "health_checks.readiness_path = " + doubleQuotes(config.getReadinessPath()));
        line(sb, "health_checks.liveness_path = " + doubleQuotes(config.getLivenessPath()));
        return sb.toString();
    }

    private static void checkValue(String name, String value) {
        if (StringExt.isEmpty(value)) {
            throw SpiffeEnableException.renderFailure(WHAT, name + " not set");
        }
        if (StringExt.containsControlCharacter(value)) {
            throw SpiffeEnableException.renderFailure(WHAT, name + " contains control characters");
        }
    }

    private static void line(StringBuilder sb, String line) {
        sb.append(line).append('\n');
    }
}
