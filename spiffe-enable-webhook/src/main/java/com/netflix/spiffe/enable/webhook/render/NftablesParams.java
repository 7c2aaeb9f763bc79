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
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ENVOY_DNS_PROXY_PORT;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ENVOY_PORT;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ENVOY_UID;

/**
 * Parameters of the traffic redirection rules installed for the Envoy sidecar.
 */
public final class NftablesParams {

    public static final NftablesParams DEFAULT = new NftablesParams(ENVOY_UID, ENVOY_PORT, ENVOY_DNS_PROXY_PORT, ENVOY_ADMIN_PORT);

    private final long proxyUid;
    private final int proxyPort;
    private final int dnsProxyPort;
    private final int adminPort;

    public NftablesParams(long proxyUid, int proxyPort, int dnsProxyPort, int adminPort) {
        this.proxyUid = proxyUid;
        this.proxyPort = proxyPort;
        this.dnsProxyPort = dnsProxyPort;
        this.adminPort = adminPort;
    }

    public long getProxyUid() {
        return proxyUid;
    }

    public int getProxyPort() {
        return proxyPort;
    }

    public int getDnsProxyPort() {
        return dnsProxyPort;
    }

    public int getAdminPort() {
        return adminPort;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NftablesParams that = (NftablesParams) o;
        return proxyUid == that.proxyUid && proxyPort == that.proxyPort && dnsProxyPort == that.dnsProxyPort && adminPort == that.adminPort;
    }

    @Override
    public int hashCode() {
        return Objects.hash(proxyUid, proxyPort, dnsProxyPort, adminPort);
    }

    @Override
    public String toString() {
        return "NftablesParams{" +
                "proxyUid=" + proxyUid +
                ", proxyPort=" + proxyPort +
                ", dnsProxyPort=" + dnsProxyPort +
                ", adminPort=" + adminPort +
                '}';
    }
}
