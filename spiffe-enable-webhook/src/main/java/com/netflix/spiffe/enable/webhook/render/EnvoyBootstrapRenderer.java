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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import javax.inject.Singleton;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.collect.ImmutableMap;
import com.netflix.spiffe.enable.common.json.ObjectMappers;
import com.netflix.spiffe.enable.common.util.StringExt;
import com.netflix.spiffe.enable.webhook.SpiffeEnableException;

/**
 * Renders the Envoy bootstrap document. Envoy discovers its listeners and clusters from the agent over ADS, so the
 * bootstrap only carries the node identity, the admin listener and the static <tt>xds_cluster</tt> pointing at the
 * agent. The document is written as compact JSON (a valid YAML document) with object keys sorted.
 */
@Singleton
public class EnvoyBootstrapRenderer {

    private static final String WHAT = "Envoy bootstrap";

    static final String XDS_CLUSTER_NAME = "xds_cluster";

    private static final String HTTP_PROTOCOL_OPTIONS = "envoy.extensions.upstreams.http.v3.HttpProtocolOptions";

    public String render(EnvoyBootstrapConfig config) {
        checkValue("node id", config.getNodeId());
        checkValue("cluster name", config.getClusterName());
        checkValue("admin address", config.getAdminAddress());
        checkValue("agent xDS service", config.getAgentXdsService());
        checkPort("admin port", config.getAdminPort());
        checkPort("agent xDS port", config.getAgentXdsPort());

        try {
            return ObjectMappers.canonicalMapper().writeValueAsString(buildDocument(config));
        } catch (JsonProcessingException e) {
            throw SpiffeEnableException.renderFailure(WHAT, e);
        }
    }

    private static Map<String, Object> buildDocument(EnvoyBootstrapConfig config) {
        return ImmutableMap.of(
                "node", ImmutableMap.of(
                        "id", config.getNodeId(),
                        "cluster", config.getClusterName()
                ),
                "admin", ImmutableMap.of(
                        "address", socketAddress(config.getAdminAddress(), config.getAdminPort())
                ),
                "dynamic_resources", ImmutableMap.of(
                        "ads_config", ImmutableMap.of(
                                "api_type", "GRPC",
                                "transport_api_version", "V3",
                                "grpc_services", list(ImmutableMap.of(
                                        "envoy_grpc", ImmutableMap.of("cluster_name", XDS_CLUSTER_NAME)
                                )),
                                "set_node_on_first_message_only", true
                        ),
                        "cds_config", adsConfigSource(),
                        "lds_config", adsConfigSource()
                ),
                "static_resources", ImmutableMap.of(
                        "clusters", list(xdsCluster(config))
                )
        );
    }

    private static Map<String, Object> xdsCluster(EnvoyBootstrapConfig config) {
        return ImmutableMap.of(
                "name", XDS_CLUSTER_NAME,
                "type", "LOGICAL_DNS",
                "connect_timeout", "5s",
                "typed_extension_protocol_options", ImmutableMap.of(
                        HTTP_PROTOCOL_OPTIONS, ImmutableMap.of(
                                "@type", "type.googleapis.com/" + HTTP_PROTOCOL_OPTIONS,
                                "explicit_http_config", ImmutableMap.of(
                                        "http2_protocol_options", Collections.emptyMap()
                                )
                        )
                ),
                "load_assignment", ImmutableMap.of(
                        "cluster_name", XDS_CLUSTER_NAME,
                        "endpoints", list(ImmutableMap.of(
                                "lb_endpoints", list(ImmutableMap.of(
                                        "endpoint", ImmutableMap.of(
                                                "address", socketAddress(config.getAgentXdsService(), config.getAgentXdsPort())
                                        )
                                ))
                        ))
                )
        );
    }

    private static Map<String, Object> adsConfigSource() {
        return ImmutableMap.of(
                "resource_api_version", "V3",
                "ads", Collections.emptyMap()
        );
    }

    private static Map<String, Object> socketAddress(String address, int port) {
        return ImmutableMap.of(
                "socket_address", ImmutableMap.of(
                        "address", address,
                        "port_value", port
                )
        );
    }

    private static List<Object> list(Object element) {
        return Collections.singletonList(element);
    }

    private static void checkValue(String name, String value) {
        if (StringExt.isEmpty(value)) {
            throw SpiffeEnableException.renderFailure(WHAT, name + " not set");
        }
        if (StringExt.containsControlCharacter(value)) {
            throw SpiffeEnableException.renderFailure(WHAT, name + " contains control characters");
        }
    }

    private static void checkPort(String name, int port) {
        if (port < 1 || port > 65535) {
            throw SpiffeEnableException.renderFailure(WHAT, name + " out of range: " + port);
        }
    }
}
