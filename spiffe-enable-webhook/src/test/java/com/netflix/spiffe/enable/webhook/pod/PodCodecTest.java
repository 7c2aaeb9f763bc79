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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.netflix.spiffe.enable.webhook.SpiffeEnableException;
import io.kubernetes.client.openapi.models.V1Pod;
import org.junit.Test;

import static com.netflix.spiffe.enable.webhook.SpiffeEnableException.ErrorCode.MalformedRequest;
import static com.netflix.spiffe.enable.webhook.pod.PodGenerator.parse;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class PodCodecTest {

    private static final String POD_JSON = "{\"apiVersion\":\"v1\",\"kind\":\"Pod\","
            + "\"metadata\":{\"name\":\"web\",\"namespace\":\"apps\",\"annotations\":{\"spiffe.cofide.io/enabled\":\"true\"}},"
            + "\"spec\":{\"containers\":[{\"name\":\"app\",\"image\":\"nginx\",\"ports\":[{\"containerPort\":8080}]}]}}";

    private final PodCodec codec = new PodCodec();

    @Test
    public void testDecode() {
        V1Pod pod = codec.decode(parse(POD_JSON));

        assertThat(pod.getMetadata().getName()).isEqualTo("web");
        assertThat(pod.getMetadata().getAnnotations()).containsEntry("spiffe.cofide.io/enabled", "true");
        assertThat(pod.getSpec().getContainers()).hasSize(1);
        assertThat(pod.getSpec().getContainers().get(0).getPorts().get(0).getContainerPort()).isEqualTo(8080);
    }

    @Test
    public void testDecodedPodSerializesToSameTree() {
        JsonNode original = parse(POD_JSON);
        assertThat(codec.toTree(codec.decode(original))).isEqualTo(original);
    }

    @Test
    public void testDecodeRejectsMissingObject() {
        assertMalformed(null);
        assertMalformed(parse("[1, 2]"));
        assertMalformed(parse("\"pod\""));
    }

    @Test
    public void testDecodeRejectsPodWithoutSpec() {
        assertMalformed(parse("{\"apiVersion\":\"v1\",\"kind\":\"Pod\",\"metadata\":{\"name\":\"web\"}}"));
    }

    @Test
    public void testDecodeRejectsInvalidFieldTypes() {
        assertMalformed(parse("{\"spec\":{\"containers\":\"not a list\"}}"));
    }

    @Test
    public void testDecodeRejectsInvalidQuantity() {
        assertMalformed(parse("{\"spec\":{\"containers\":[{\"name\":\"app\",\"resources\":{\"limits\":{\"cpu\":\"lots\"}}}]}}"));
    }

    @Test
    public void testDecodeRejectsInvalidTimestamp() {
        assertMalformed(parse("{\"metadata\":{\"name\":\"web\",\"creationTimestamp\":\"yesterday\"},"
                + "\"spec\":{\"containers\":[{\"name\":\"app\"}]}}"));
    }

    @Test
    public void testDecodeRejectsNullListEntries() {
        assertMalformed(parse("{\"spec\":{\"volumes\":[null],\"containers\":[{\"name\":\"app\"}]}}"));
        assertMalformed(parse("{\"spec\":{\"containers\":[null]}}"));
        assertMalformed(parse("{\"spec\":{\"containers\":[{\"name\":\"app\"}],\"initContainers\":[null]}}"));
        assertMalformed(parse("{\"spec\":{\"containers\":[{\"name\":\"app\",\"env\":[null]}]}}"));
        assertMalformed(parse("{\"spec\":{\"initContainers\":[{\"name\":\"init\",\"volumeMounts\":[null]}],"
                + "\"containers\":[{\"name\":\"app\"}]}}"));

        assertThatThrownBy(() -> codec.decode(parse("{\"spec\":{\"containers\":[{\"name\":\"app\",\"env\":[null]}]}}")))
                .hasMessage("spec.containers[app].env contains a null entry");
    }

    @Test
    public void testDiff() {
        JsonNode original = parse(POD_JSON);
        ObjectNode mutated = original.deepCopy();
        ((ArrayNode) mutated.get("spec").get("containers")).addObject().put("name", "sidecar");
        ((ObjectNode) mutated.get("metadata")).put("name", "web-2");

        JsonNode patch = codec.diff(original, mutated);

        assertThat(patch.isArray()).isTrue();
        assertThat(patch.size()).isEqualTo(2);
        for (JsonNode operation : patch) {
            assertThat(operation.get("op").asText()).isIn("add", "replace");
        }
        assertThat(codec.diff(original, original.deepCopy()).size()).isZero();
    }

    private void assertMalformed(JsonNode object) {
        assertThatThrownBy(() -> codec.decode(object))
                .isInstanceOf(SpiffeEnableException.class)
                .matches(e -> SpiffeEnableException.hasErrorCode(e, MalformedRequest));
    }
}
