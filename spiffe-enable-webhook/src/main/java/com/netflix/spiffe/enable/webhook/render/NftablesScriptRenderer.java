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

import com.netflix.spiffe.enable.webhook.SpiffeEnableException;

/**
 * Renders the shell script run by the Envoy init container. The script installs an <tt>inet envoy_proxy</tt>
 * nftables table that sends DNS traffic to the Envoy DNS proxy, and loopback TCP traffic to the Envoy listener.
 * Traffic of the Envoy process itself (matched by its uid) is left untouched.
 */
@Singleton
public class NftablesScriptRenderer {

    static final String RULES_FILE = "/tmp/envoy_proxy.nft";

    private static final String SCRIPT_TEMPLATE = ""
            + "if ! command -v nft > /dev/null 2>&1; then\n"
            + "    echo \"nftables (nft) is not installed\"\n"
            + "    exit 1\n"
            + "fi\n"
            + "cat <<'EOF' > " + RULES_FILE + "\n"
            + "table inet envoy_proxy {\n"
            + "    chain envoy_output {\n"
            + "        type nat hook output priority dstnat; policy accept;\n"
            + "        meta skuid == %1$d return\n"
            + "        udp dport 53 counter redirect to :%3$d comment \"DNS UDP to Envoy\"\n"
            + "        tcp dport 53 counter redirect to :%3$d comment \"DNS TCP to Envoy\"\n"
            + "        tcp dport %2$d return\n"
            + "        tcp dport %4$d return\n"
            + "        ip daddr 127.0.0.1/8 tcp dport 1-65535 counter redirect to :%2$d comment \"Loopback IPv4 to Envoy\"\n"
            + "        ip6 daddr ::1/128 tcp dport 1-65535 counter redirect to :%2$d comment \"Loopback IPv6 to Envoy\"\n"
            + "    }\n"
            + "}\n"
            + "EOF\n"
            + "nft -f " + RULES_FILE + "\n"
            + "echo \"nftables redirection rules applied\"\n"
            + "nft list table inet envoy_proxy\n";

    public String render(NftablesParams params) {
        checkPort("proxy port", params.getProxyPort());
        checkPort("DNS proxy port", params.getDnsProxyPort());
        checkPort("admin port", params.getAdminPort());
        if (params.getProxyUid() < 0) {
            throw SpiffeEnableException.renderFailure("nftables script", "negative proxy uid: " + params.getProxyUid());
        }
        return String.format(SCRIPT_TEMPLATE, params.getProxyUid(), params.getProxyPort(), params.getDnsProxyPort(), params.getAdminPort());
    }

    private static void checkPort(String name, int port) {
        if (port < 1 || port > 65535) {
            throw SpiffeEnableException.renderFailure("nftables script", name + " out of range: " + port);
        }
    }
}
