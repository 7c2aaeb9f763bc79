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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1EmptyDirVolumeSource;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1Volume;
import io.kubernetes.client.openapi.models.V1VolumeMount;
import org.junit.Test;

import static com.netflix.spiffe.enable.webhook.pod.PodGenerator.newContainer;
import static org.assertj.core.api.Assertions.assertThat;

public class PodResourcesTest {

    private final V1Pod pod = PodGenerator.newPod(Collections.emptyMap(), "app", "worker");

    @Test
    public void testEnsureVolume() {
        assertThat(PodResources.hasVolume(pod, "data")).isFalse();

        assertThat(PodResources.ensureVolume(pod, emptyDir("data"))).isTrue();
        assertThat(PodResources.hasVolume(pod, "data")).isTrue();

        assertThat(PodResources.ensureVolume(pod, emptyDir("data"))).isFalse();
        assertThat(pod.getSpec().getVolumes()).hasSize(1);
    }

    @Test
    public void testEnsureContainerAppends() {
        assertThat(PodResources.ensureContainer(pod, newContainer("sidecar"))).isTrue();
        assertThat(PodResources.ensureContainer(pod, newContainer("sidecar"))).isFalse();
        assertThat(PodResources.ensureContainer(pod, newContainer("app"))).isFalse();

        assertThat(names(pod.getSpec().getContainers())).containsExactly("app", "worker", "sidecar");
        assertThat(PodResources.hasContainer(pod.getSpec().getContainers(), "sidecar")).isTrue();
    }

    @Test
    public void testEnsureInitContainerInsertsFirst() {
        pod.getSpec().setInitContainers(Arrays.asList(newContainer("migrate"), newContainer("warmup")));

        assertThat(PodResources.ensureInitContainer(pod, newContainer("first"), Collections.emptySet())).isTrue();
        assertThat(names(pod.getSpec().getInitContainers())).containsExactly("first", "migrate", "warmup");

        assertThat(PodResources.ensureInitContainer(pod, newContainer("first"), Collections.emptySet())).isFalse();
        assertThat(pod.getSpec().getInitContainers()).hasSize(3);
    }

    @Test
    public void testEnsureInitContainerAfterPrecedingNames() {
        pod.getSpec().setInitContainers(Arrays.asList(newContainer("first"), newContainer("migrate")));

        assertThat(PodResources.ensureInitContainer(pod, newContainer("second"), Collections.singleton("first"))).isTrue();
        assertThat(names(pod.getSpec().getInitContainers())).containsExactly("first", "second", "migrate");
    }

    @Test
    public void testEnsureInitContainerWithoutInitContainers() {
        assertThat(PodResources.ensureInitContainer(pod, newContainer("first"), Collections.singleton("other"))).isTrue();
        assertThat(names(pod.getSpec().getInitContainers())).containsExactly("first");
    }

    @Test
    public void testEnsureEnvVarKeepsExistingValue() {
        V1Container container = newContainer("app").addEnvItem(new V1EnvVar().name("SOCKET").value("custom"));

        assertThat(PodResources.ensureEnvVar(container, new V1EnvVar().name("SOCKET").value("default"))).isFalse();
        assertThat(container.getEnv()).hasSize(1);
        assertThat(container.getEnv().get(0).getValue()).isEqualTo("custom");

        assertThat(PodResources.ensureEnvVar(container, new V1EnvVar().name("OTHER").value("x"))).isTrue();
        assertThat(PodResources.hasEnvVar(container, "OTHER")).isTrue();
    }

    @Test
    public void testFindVolumeMount() {
        V1Container container = newContainer("app")
                .addVolumeMountsItem(new V1VolumeMount().name("logs").mountPath("/logs"))
                .addVolumeMountsItem(new V1VolumeMount().name("data").mountPath("/data").readOnly(true));

        assertThat(PodResources.findVolumeMount(container, "data", "/data", true)).contains(new VolumeMountMatch(1, true, true));
        assertThat(PodResources.findVolumeMount(container, "data", "/data", false)).contains(new VolumeMountMatch(1, true, false));
        assertThat(PodResources.findVolumeMount(container, "data", "/other", true)).contains(new VolumeMountMatch(1, false, true));
        assertThat(PodResources.findVolumeMount(container, "missing", "/data", true)).isEmpty();

        Optional<VolumeMountMatch> logs = PodResources.findVolumeMount(container, "logs", "/logs", false);
        assertThat(logs).isPresent();
        assertThat(logs.get().isPathMatches()).isTrue();
        assertThat(logs.get().isReadOnlyMatches()).isTrue();
        assertThat(logs.get().isExactMatch()).isTrue();
    }

    @Test
    public void testEnsureVolumeMountAppends() {
        V1Container container = newContainer("app");
        V1VolumeMount mount = new V1VolumeMount().name("data").mountPath("/data").readOnly(true);

        assertThat(PodResources.ensureVolumeMount(container, mount)).isTrue();
        assertThat(PodResources.ensureVolumeMount(container, new V1VolumeMount().name("data").mountPath("/data").readOnly(true))).isFalse();
        assertThat(container.getVolumeMounts()).hasSize(1);
    }

    @Test
    public void testEnsureVolumeMountCorrectsReadOnlyFlag() {
        V1Container container = newContainer("app")
                .addVolumeMountsItem(new V1VolumeMount().name("data").mountPath("/data").readOnly(false));

        assertThat(PodResources.ensureVolumeMount(container, new V1VolumeMount().name("data").mountPath("/data").readOnly(true))).isTrue();
        assertThat(container.getVolumeMounts()).hasSize(1);
        assertThat(container.getVolumeMounts().get(0).getReadOnly()).isTrue();
    }

    @Test
    public void testEnsureVolumeMountCorrectsPath() {
        V1Container container = newContainer("app")
                .addVolumeMountsItem(new V1VolumeMount().name("data").mountPath("/somewhere"));

        assertThat(PodResources.ensureVolumeMount(container, new V1VolumeMount().name("data").mountPath("/data").readOnly(true))).isTrue();
        assertThat(container.getVolumeMounts()).hasSize(1);
        assertThat(container.getVolumeMounts().get(0).getMountPath()).isEqualTo("/data");
        assertThat(container.getVolumeMounts().get(0).getReadOnly()).isTrue();
    }

    @Test
    public void testUnsetReadOnlyMatchesFalse() {
        V1Container container = newContainer("app")
                .addVolumeMountsItem(new V1VolumeMount().name("data").mountPath("/data"));

        assertThat(PodResources.ensureVolumeMount(container, new V1VolumeMount().name("data").mountPath("/data").readOnly(false))).isFalse();
        assertThat(container.getVolumeMounts().get(0).getReadOnly()).isNull();
    }

    @Test
    public void testEnsureNamedDoesNotModifyInput() {
        List<String> items = Collections.unmodifiableList(Arrays.asList("a", "b"));

        Optional<List<String>> updated = PodResources.ensureNamed(items, s -> s, "c", 1);
        assertThat(updated).contains(Arrays.asList("a", "c", "b"));
        assertThat(items).containsExactly("a", "b");

        assertThat(PodResources.ensureNamed(items, s -> s, "b", PodResources.APPEND)).isEmpty();
        assertThat(PodResources.ensureNamed(null, s -> s, "a", PodResources.APPEND)).contains(Collections.singletonList("a"));
    }

    private static V1Volume emptyDir(String name) {
        return new V1Volume().name(name).emptyDir(new V1EmptyDirVolumeSource());
    }

    private static List<String> names(List<V1Container> containers) {
        return containers.stream().map(V1Container::getName).collect(Collectors.toList());
    }
}
