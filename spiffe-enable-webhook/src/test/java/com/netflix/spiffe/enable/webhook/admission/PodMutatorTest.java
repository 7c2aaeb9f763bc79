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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.flipkart.zjsonpatch.JsonPatch;
import com.google.common.collect.ImmutableSet;
import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;
import com.netflix.spiffe.enable.webhook.SpiffeEnableException;
import com.netflix.spiffe.enable.webhook.SpiffeEnableException.ErrorCode;
import com.netflix.spiffe.enable.webhook.WebhookConfiguration;
import com.netflix.spiffe.enable.webhook.admission.MutationResult.Outcome;
import com.netflix.spiffe.enable.webhook.capability.Capability;
import com.netflix.spiffe.enable.webhook.capability.CapabilityInjector;
import com.netflix.spiffe.enable.webhook.capability.DebugUiInjector;
import com.netflix.spiffe.enable.webhook.capability.EnvoyProxyInjector;
import com.netflix.spiffe.enable.webhook.capability.SpiffeHelperInjector;
import com.netflix.spiffe.enable.webhook.capability.WorkloadApiInjector;
import com.netflix.spiffe.enable.webhook.pod.PodCodec;
import com.netflix.spiffe.enable.webhook.pod.PodGenerator;
import com.netflix.spiffe.enable.webhook.render.EnvoyBootstrapRenderer;
import com.netflix.spiffe.enable.webhook.render.NftablesScriptRenderer;
import com.netflix.spiffe.enable.webhook.render.SpiffeHelperConfigRenderer;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1Pod;
import org.junit.Test;

import static com.netflix.spiffe.enable.webhook.capability.SpiffeHelperInjectorTest.volumeNames;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ANNOTATION_DEBUG;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ANNOTATION_ENABLED;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ANNOTATION_MODE;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.CERTS_VOLUME;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.DEBUG_UI_CONTAINER;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ENVOY_CONFIG_VOLUME;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ENVOY_INIT_CONTAINER;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ENVOY_SIDECAR_CONTAINER;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.HELPER_CONFIG_VOLUME;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.HELPER_INIT_CONTAINER;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.HELPER_SIDECAR_CONTAINER;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.WORKLOAD_API_SOCKET_ENV_NAME;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.WORKLOAD_API_VOLUME;
import static com.netflix.spiffe.enable.webhook.pod.PodGenerator.APP_CONTAINER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class PodMutatorTest {

    private static final List<String> MODES = Arrays.asList(
            null, "", "helper", "proxy", "helper,proxy", "proxy,helper", "helper,helper", " helper , proxy "
    );

    private final WebhookConfiguration configuration = PodGenerator.newConfiguration();

    private final Registry registry = new DefaultRegistry();

    private final SpiffeHelperInjector helperInjector = new SpiffeHelperInjector(configuration, new SpiffeHelperConfigRenderer());

    private final EnvoyProxyInjector proxyInjector = new EnvoyProxyInjector(configuration, new EnvoyBootstrapRenderer(), new NftablesScriptRenderer());

    private final PodMutator mutator = newMutator(ImmutableSet.of(helperInjector, proxyInjector));

    @Test
    public void testPodWithoutEnabledAnnotationIsAllowed() {
        for (V1Pod pod : Arrays.asList(
                PodGenerator.newPod(Collections.emptyMap()),
                PodGenerator.newPod(PodGenerator.annotations(ANNOTATION_ENABLED, "True", ANNOTATION_MODE, "helper")),
                PodGenerator.newPod(PodGenerator.annotations(ANNOTATION_ENABLED, "false", ANNOTATION_MODE, "bogus"))
        )) {
            MutationResult result = mutator.mutate(PodGenerator.newRequest(pod));

            assertThat(result.getOutcome()).isEqualTo(Outcome.Allowed);
            assertThat(result.getMessage()).isEqualTo(PodMutator.NOT_ENABLED_MESSAGE);
            assertThat(result.getPatch()).isEmpty();
        }
        assertThat(resultCount("allowed")).isEqualTo(3);
    }

    @Test
    public void testEnabledPodWithoutModeGetsWorkloadApiOnly() {
        V1Pod pod = PodGenerator.newPod(PodGenerator.annotations(ANNOTATION_ENABLED, "true"), APP_CONTAINER, "worker");
        pod.getSpec().addInitContainersItem(PodGenerator.newContainer("migrate"));

        V1Pod mutated = mutateAndApply(pod);

        assertThat(volumeNames(mutated)).containsExactly(WORKLOAD_API_VOLUME);
        assertThat(mutated.getSpec().getContainers()).hasSize(2);
        for (V1Container container : mutated.getSpec().getContainers()) {
            assertThat(container.getVolumeMounts()).containsExactly(WorkloadApiInjector.newWorkloadApiVolumeMount());
            assertThat(container.getEnv()).containsExactly(WorkloadApiInjector.newWorkloadApiSocketEnvVar());
        }
        assertThat(mutated.getSpec().getInitContainers()).containsExactly(PodGenerator.newContainer("migrate"));
    }

    @Test
    public void testDuplicateModeTokensAreInjectedOnce() {
        V1Pod once = mutateAndApply(PodGenerator.newEnabledPod(ANNOTATION_MODE, "helper"));
        V1Pod twice = mutateAndApply(PodGenerator.newEnabledPod(ANNOTATION_MODE, "helper,helper"));

        twice.getMetadata().getAnnotations().put(ANNOTATION_MODE, "helper");
        assertThat(twice).isEqualTo(once);
    }

    @Test
    public void testInvalidModeIsDenied() {
        V1Pod pod = PodGenerator.newEnabledPod(ANNOTATION_MODE, "helper,bogus");
        JsonNode object = PodGenerator.toJsonNode(pod);
        JsonNode objectCopy = object.deepCopy();

        MutationResult result = mutator.mutate(PodGenerator.newRequest(object));

        assertThat(result.getOutcome()).isEqualTo(Outcome.Denied);
        assertThat(result.getMessage()).contains("bogus").contains("helper, proxy");
        assertThat(result.getPatch()).isEmpty();
        assertThat(result.getError()).hasValueSatisfying(e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.InvalidMode));
        assertThat(object).isEqualTo(objectCopy);
        assertThat(registry.counter(registry.createId("spiffeEnable.mutation.result")
                .withTag("result", "denied")
                .withTag("error", "InvalidMode")
        ).count()).isEqualTo(1);
    }

    @Test
    public void testHelperAndProxy() {
        V1Pod mutated = mutateAndApply(PodGenerator.newEnabledPod(ANNOTATION_MODE, "helper,proxy"));

        assertThat(volumeNames(mutated)).containsExactly(WORKLOAD_API_VOLUME, HELPER_CONFIG_VOLUME, CERTS_VOLUME, ENVOY_CONFIG_VOLUME);
        assertThat(mutated.getSpec().getInitContainers()).extracting("name").containsExactly(HELPER_INIT_CONTAINER, ENVOY_INIT_CONTAINER);
        assertThat(mutated.getSpec().getContainers()).extracting("name").containsExactly(APP_CONTAINER, HELPER_SIDECAR_CONTAINER, ENVOY_SIDECAR_CONTAINER);
        for (V1Container container : mutated.getSpec().getContainers()) {
            assertThat(container.getEnv()).extracting("name").containsOnlyOnce(WORKLOAD_API_SOCKET_ENV_NAME);
        }
        assertThat(registry.counter(registry.createId("spiffeEnable.mutation.capability").withTag("capability", "proxy")).count()).isEqualTo(1);
        assertThat(resultCount("patched")).isEqualTo(1);
    }

    @Test
    public void testProxyBeforeHelperKeepsHelperInitContainerFirst() {
        V1Pod pod = PodGenerator.newEnabledPod(ANNOTATION_MODE, "proxy,helper");
        pod.getSpec().addInitContainersItem(PodGenerator.newContainer("migrate"));

        V1Pod mutated = mutateAndApply(pod);

        assertThat(mutated.getSpec().getInitContainers()).extracting("name").containsExactly(HELPER_INIT_CONTAINER, ENVOY_INIT_CONTAINER, "migrate");
        assertThat(mutated.getSpec().getContainers()).extracting("name").containsExactly(APP_CONTAINER, ENVOY_SIDECAR_CONTAINER, HELPER_SIDECAR_CONTAINER);
    }

    @Test
    public void testMutationIsIdempotent() {
        for (String mode : MODES) {
            for (boolean debug : new boolean[]{false, true}) {
                V1Pod pod = PodGenerator.newEnabledPod(ANNOTATION_DEBUG, Boolean.toString(debug));
                if (mode != null) {
                    pod.getMetadata().getAnnotations().put(ANNOTATION_MODE, mode);
                }
                JsonNode mutated = apply(pod);

                MutationResult second = mutator.mutate(PodGenerator.newRequest(mutated));

                assertThat(second.getOutcome()).as("mode=%s, debug=%s", mode, debug).isEqualTo(Outcome.Patched);
                assertThat(second.getPatch().get().size()).as("mode=%s, debug=%s", mode, debug).isZero();
            }
        }
    }

    @Test
    public void testDebugUi() {
        V1Pod mutated = mutateAndApply(PodGenerator.newEnabledPod(ANNOTATION_DEBUG, "true", ANNOTATION_MODE, "helper"));

        assertThat(mutated.getSpec().getContainers()).extracting("name").containsExactly(APP_CONTAINER, DEBUG_UI_CONTAINER, HELPER_SIDECAR_CONTAINER);
    }

    @Test
    public void testGeneratedPodNameIsAccepted() {
        V1Pod pod = PodGenerator.newEnabledPod(ANNOTATION_MODE, "helper");
        pod.getMetadata().name(null).generateName("web-");
        AdmissionRequest request = new AdmissionRequest("uid-1", null, null, "CREATE", PodGenerator.toJsonNode(pod));

        assertThat(mutator.mutate(request).getOutcome()).isEqualTo(Outcome.Patched);
    }

    @Test
    public void testMalformedPodIsErrored() {
        MutationResult result = mutator.mutate(PodGenerator.newRequest(PodGenerator.parse("{\"metadata\": {\"name\": 5}, \"spec\": []}")));

        assertThat(result.getOutcome()).isEqualTo(Outcome.Errored);
        assertThat(result.getError()).hasValueSatisfying(e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.MalformedRequest));

        MutationResult missing = mutator.mutate(PodGenerator.newRequest((JsonNode) null));
        assertThat(missing.getOutcome()).isEqualTo(Outcome.Errored);
        assertThat(registry.counter(registry.createId("spiffeEnable.mutation.result")
                .withTag("result", "errored")
                .withTag("error", "MalformedRequest")
        ).count()).isEqualTo(2);
    }

    @Test
    public void testInvalidFieldValueIsErroredBeforeGate() {
        JsonNode object = PodGenerator.parse("{\"spec\":{\"containers\":[{\"name\":\"app\",\"resources\":{\"requests\":{\"memory\":\"lots\"}}}]}}");

        MutationResult result = mutator.mutate(PodGenerator.newRequest(object));

        assertThat(result.getOutcome()).isEqualTo(Outcome.Errored);
        assertThat(result.getError()).hasValueSatisfying(e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.MalformedRequest));
    }

    @Test
    public void testRenderFailureIsErrored() {
        CapabilityInjector failingInjector = mock(CapabilityInjector.class);
        when(failingInjector.getCapability()).thenReturn(Capability.Proxy);
        doThrow(SpiffeEnableException.renderFailure("Envoy bootstrap", "agent xDS service not set"))
                .when(failingInjector).inject(any(), any());
        PodMutator failingMutator = newMutator(ImmutableSet.of(helperInjector, failingInjector));

        MutationResult result = failingMutator.mutate(PodGenerator.newRequest(PodGenerator.newEnabledPod(ANNOTATION_MODE, "helper,proxy")));

        assertThat(result.getOutcome()).isEqualTo(Outcome.Errored);
        assertThat(result.getPatch()).isEmpty();
        assertThat(result.getError()).hasValueSatisfying(e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.RenderFailure));
    }

    @Test
    public void testUnexpectedFailureIsErrored() {
        CapabilityInjector failingInjector = mock(CapabilityInjector.class);
        when(failingInjector.getCapability()).thenReturn(Capability.Helper);
        doThrow(new IllegalStateException("boom")).when(failingInjector).inject(any(), any());
        PodMutator failingMutator = newMutator(ImmutableSet.of(failingInjector, proxyInjector));

        MutationResult result = failingMutator.mutate(PodGenerator.newRequest(PodGenerator.newEnabledPod(ANNOTATION_MODE, "helper")));

        assertThat(result.getOutcome()).isEqualTo(Outcome.Errored);
        assertThat(result.getError()).hasValueSatisfying(e -> {
            assertThat(e.getErrorCode()).isEqualTo(ErrorCode.Internal);
            assertThat(e).hasMessageContaining("boom");
        });
        assertThat(registry.counter(registry.createId("spiffeEnable.mutation.result")
                .withTag("result", "errored")
                .withTag("error", "Internal")
        ).count()).isEqualTo(1);
    }

    @Test
    public void testEveryCapabilityNeedsExactlyOneInjector() {
        assertThatThrownBy(() -> newMutator(ImmutableSet.of(helperInjector)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No injector registered for capability Proxy");

        SpiffeHelperInjector otherHelperInjector = new SpiffeHelperInjector(configuration, new SpiffeHelperConfigRenderer());
        assertThatThrownBy(() -> newMutator(ImmutableSet.of(helperInjector, otherHelperInjector, proxyInjector)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Multiple injectors registered for capability Helper");
    }

    private PodMutator newMutator(ImmutableSet<CapabilityInjector> injectors) {
        return new PodMutator(
                new PodCodec(),
                new WorkloadApiInjector(configuration),
                new DebugUiInjector(configuration),
                injectors,
                new MutationMetrics(registry)
        );
    }

    private JsonNode apply(V1Pod pod) {
        JsonNode original = PodGenerator.toJsonNode(pod);
        MutationResult result = mutator.mutate(PodGenerator.newRequest(original));
        assertThat(result.getOutcome()).isEqualTo(Outcome.Patched);
        return JsonPatch.apply(result.getPatch().get(), original);
    }

    private V1Pod mutateAndApply(V1Pod pod) {
        return PodGenerator.decode(apply(pod));
    }

    private long resultCount(String result) {
        return registry.counter(registry.createId("spiffeEnable.mutation.result").withTag("result", result)).count();
    }
}
