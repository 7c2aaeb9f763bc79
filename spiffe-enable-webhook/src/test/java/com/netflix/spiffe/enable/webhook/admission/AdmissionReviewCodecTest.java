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


package com.netflix.spiffe.enable.webhook.admission;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import com.fasterxml.jackson.databind.JsonNode;
import com.netflix.spiffe.enable.webhook.SpiffeEnableException;
import com.netflix.spiffe.enable.webhook.SpiffeEnableException.ErrorCode;
import com.netflix.spiffe.enable.webhook.pod.PodGenerator;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class AdmissionReviewCodecTest {

    private static final String REVIEW = "{"
            + "\"apiVersion\": \"admission.k8s.io/v1\","
            + "\"kind\": \"AdmissionReview\","
            + "\"request\": {"
            + "  \"uid\": \"705ab4f5-6393-11e8-b7cc-42010a800002\","
            + "  \"kind\": {\"group\": \"\", \"version\": \"v1\", \"kind\": \"Pod\"},"
            + "  \"namespace\": \"payments\","
            + "  \"operation\": \"CREATE\","
            + "  \"userInfo\": {\"username\": \"system:serviceaccount:kube-system:replicaset-controller\"},"
            + "  \"object\": {\"metadata\": {\"generateName\": \"web-\"}, \"spec\": {\"containers\": [{\"name\": \"app\"}]}},"
            + "  \"dryRun\": false"
            + "}}";

    private final AdmissionReviewCodec codec = new AdmissionReviewCodec();

    @Test
    public void testDecode() {
        AdmissionReview review = codec.decode(REVIEW);

        assertThat(review.getApiVersion()).isEqualTo("admission.k8s.io/v1");
        AdmissionRequest request = review.getRequest();
        assertThat(request.getUid()).isEqualTo("705ab4f5-6393-11e8-b7cc-42010a800002");
        assertThat(request.getNamespace()).isEqualTo("payments");
        assertThat(request.getName()).isNull();
        assertThat(request.getOperation()).isEqualTo("CREATE");
        assertThat(request.getObject().at("/metadata/generateName").asText()).isEqualTo("web-");
    }

    @Test
    public void testEncodeOmitsUnsetFields() {
        String text = codec.encode(AdmissionReview.ofResponse(null, AdmissionResponse.allowed("uid-1", "ok")));

        JsonNode encoded = PodGenerator.parse(text);
        assertThat(encoded.get("apiVersion").asText()).isEqualTo(AdmissionReview.API_VERSION);
        assertThat(encoded.has("request")).isFalse();
        assertThat(encoded.get("response").has("patch")).isFalse();
        assertThat(encoded.get("response").has("patchType")).isFalse();
        assertThat(encoded.at("/response/status/code").asInt()).isEqualTo(200);
    }

    @Test
    public void testEncodePatch() {
        JsonNode patch = PodGenerator.parse("[{\"op\":\"add\",\"path\":\"/spec/volumes\",\"value\":[]}]");

        String encoded = codec.encodePatch(patch);

        assertThat(new String(Base64.getDecoder().decode(encoded), StandardCharsets.UTF_8))
                .isEqualTo("[{\"op\":\"add\",\"path\":\"/spec/volumes\",\"value\":[]}]");
    }

    @Test
    public void testDecodeInvalidReview() {
        for (String body : new String[]{null, "", "{", "[1, 2]"}) {
            assertThatThrownBy(() -> codec.decode(body))
                    .as("body=%s", body)
                    .isInstanceOf(SpiffeEnableException.class)
                    .matches(e -> SpiffeEnableException.hasErrorCode(e, ErrorCode.MalformedRequest));
        }
    }
}
