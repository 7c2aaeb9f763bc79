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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import com.google.common.annotations.VisibleForTesting;
import com.netflix.spiffe.enable.common.util.CollectionsExt;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1EnvVar;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodSpec;
import io.kubernetes.client.openapi.models.V1Volume;
import io.kubernetes.client.openapi.models.V1VolumeMount;

/**
 * Presence checks and idempotent, name keyed upserts over the ordered pod collections (volumes, containers, init
 * containers, container environment and volume mounts). Injectors must add pod resources through these operations
 * only, so a pod that was already mutated stays unchanged when admitted again.
 */
public final class PodResources {

    @VisibleForTesting
    static final int APPEND = -1;

    private PodResources() {
    }

    public static boolean hasVolume(V1Pod pod, String name) {
        return pod.getSpec() != null && CollectionsExt.indexOf(pod.getSpec().getVolumes(), V1Volume::getName, name).isPresent();
    }

    public static boolean hasContainer(List<V1Container> containers, String name) {
        return CollectionsExt.indexOf(containers, V1Container::getName, name).isPresent();
    }

    public static boolean hasEnvVar(V1Container container, String name) {
        return CollectionsExt.indexOf(container.getEnv(), V1EnvVar::getName, name).isPresent();
    }

    /**
     * Finds a volume mount by its name, and reports whether its path and read-only flag match the requested ones.
     */
    public static Optional<VolumeMountMatch> findVolumeMount(V1Container container, String name, String mountPath, boolean readOnly) {
        return CollectionsExt.indexOf(container.getVolumeMounts(), V1VolumeMount::getName, name).map(index -> {
            V1VolumeMount existing = container.getVolumeMounts().get(index);
            return new VolumeMountMatch(
                    index,
                    mountPath.equals(existing.getMountPath()),
                    isReadOnly(existing) == readOnly
            );
        });
    }

    /**
     * Appends the volume, unless a volume with the same name exists.
     *
     * @return true if the pod was changed
     */
    public static boolean ensureVolume(V1Pod pod, V1Volume volume) {
        V1PodSpec spec = pod.getSpec();
        return ensureNamed(spec.getVolumes(), V1Volume::getName, volume, APPEND)
                .map(updated -> {
                    spec.setVolumes(updated);
                    return true;
                })
                .orElse(false);
    }

    /**
     * Appends the container to the pod containers, unless a container with the same name exists.
     *
     * @return true if the pod was changed
     */
    public static boolean ensureContainer(V1Pod pod, V1Container container) {
        V1PodSpec spec = pod.getSpec();
        return ensureNamed(spec.getContainers(), V1Container::getName, container, APPEND)
                .map(updated -> {
                    spec.setContainers(updated);
                    return true;
                })
                .orElse(false);
    }

    /**
     * Inserts the init container ahead of the workload init containers, unless an init container with the same name
     * exists. The insert position is right after the leading init containers whose names are listed in
     * <tt>precedingNames</tt>; with no preceding names the container becomes the first one.
     *
     * @return true if the pod was changed
     */
    public static boolean ensureInitContainer(V1Pod pod, V1Container initContainer, Collection<String> precedingNames) {
        V1PodSpec spec = pod.getSpec();
        List<V1Container> initContainers = CollectionsExt.nonNull(spec.getInitContainers());
        int position = 0;
        while (position < initContainers.size() && precedingNames.contains(initContainers.get(position).getName())) {
            position++;
        }
        return ensureNamed(spec.getInitContainers(), V1Container::getName, initContainer, position)
                .map(updated -> {
                    spec.setInitContainers(updated);
                    return true;
                })
                .orElse(false);
    }

    /**
     * Appends the environment variable, unless a variable with the same name exists. An existing variable keeps its
     * value.
     *
     * @return true if the container was changed
     */
    public static boolean ensureEnvVar(V1Container container, V1EnvVar envVar) {
        return ensureNamed(container.getEnv(), V1EnvVar::getName, envVar, APPEND)
                .map(updated -> {
                    container.setEnv(updated);
                    return true;
                })
                .orElse(false);
    }

    /**
     * Appends the volume mount if the container has no mount with the same name. If a mount with this name exists
     * but differs in its path or read-only flag, it is corrected in place, so the container never ends up with two
     * mounts of the same name.
     *
     * @return true if the container was changed
     */
    public static boolean ensureVolumeMount(V1Container container, V1VolumeMount volumeMount) {
        boolean readOnly = isReadOnly(volumeMount);
        Optional<VolumeMountMatch> match = findVolumeMount(container, volumeMount.getName(), volumeMount.getMountPath(), readOnly);
        if (!match.isPresent()) {
            return ensureNamed(container.getVolumeMounts(), V1VolumeMount::getName, volumeMount, APPEND)
                    .map(updated -> {
                        container.setVolumeMounts(updated);
                        return true;
                    })
                    .orElse(false);
        }
        if (match.get().isExactMatch()) {
            return false;
        }
        V1VolumeMount existing = container.getVolumeMounts().get(match.get().getIndex());
        existing.setMountPath(volumeMount.getMountPath());
        existing.setReadOnly(volumeMount.getReadOnly());
        return true;
    }

    /**
     * Returns a copy of the list with the item added at the given position (or appended for {@link #APPEND}), or
     * {@link Optional#empty()} if the list has an item with the same name already.
     */
    @VisibleForTesting
    static <T> Optional<List<T>> ensureNamed(List<T> items, Function<T, String> nameOf, T item, int position) {
        String name = nameOf.apply(item);
        if (CollectionsExt.indexOf(items, nameOf, name).isPresent()) {
            return Optional.empty();
        }
        List<T> updated = new ArrayList<>(CollectionsExt.nonNull(items));
        if (position == APPEND || position >= updated.size()) {
            updated.add(item);
        } else {
            updated.add(position, item);
        }
        return Optional.of(updated);
    }

    private static boolean isReadOnly(V1VolumeMount volumeMount) {
        return Boolean.TRUE.equals(volumeMount.getReadOnly());
    }
}
