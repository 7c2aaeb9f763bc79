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

import java.util.EnumSet;
import java.util.List;
import javax.inject.Singleton;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.flipkart.zjsonpatch.DiffFlags;
import com.flipkart.zjsonpatch.JsonDiff;
import com.google.gson.JsonParseException;
import com.netflix.spiffe.enable.common.json.ObjectMappers;
import com.netflix.spiffe.enable.common.util.CollectionsExt;
import com.netflix.spiffe.enable.webhook.SpiffeEnableException;
import io.kubernetes.client.openapi.JSON;
import io.kubernetes.client.openapi.models.V1Container;
import io.kubernetes.client.openapi.models.V1Pod;
import io.kubernetes.client.openapi.models.V1PodSpec;

/**
 * Converts pods between the admission request payload, the Kubernetes client model and JSON trees, and computes
 * the JSON patch between two pod trees. Pods are serialized with the Kubernetes client serializer, which omits
 * unset fields, so a decoded pod serializes back to the same tree.
 */
@Singleton
public class PodCodec {

    private static final EnumSet<DiffFlags> PATCH_FLAGS = EnumSet.of(DiffFlags.OMIT_MOVE_OPERATION, DiffFlags.OMIT_COPY_OPERATION);

    private final JSON kubeJson = new JSON();

    /**
     * Decodes the admission request object into a pod.
     *
     * @throws SpiffeEnableException with {@link SpiffeEnableException.ErrorCode#MalformedRequest} if the object is
     *                               missing, is not a JSON object, cannot be decoded, has no pod spec, or has null
     *                               entries in its volume, container, environment or volume mount lists
     */
    public V1Pod decode(JsonNode object) {
        if (object == null || !object.isObject()) {
            throw SpiffeEnableException.malformedRequest("admission request object is not a pod");
        }
        V1Pod pod;
        try {
            pod = kubeJson.deserialize(object.toString(), V1Pod.class);
        } catch (JsonParseException e) {
            throw SpiffeEnableException.malformedRequest("failed to decode pod", e);
        } catch (RuntimeException e) {
            // Type adapters of the Kubernetes model (quantities, timestamps) fail with their own exceptions.
            throw SpiffeEnableException.malformedRequest("invalid pod field value", e);
        }
        if (pod == null || pod.getSpec() == null) {
            throw SpiffeEnableException.malformedRequest("pod has no spec");
        }
        checkNoNullEntries(pod.getSpec());
        return pod;
    }

    private static void checkNoNullEntries(V1PodSpec spec) {
        checkNoNullEntries("spec.volumes", spec.getVolumes());
        checkContainers("spec.containers", spec.getContainers());
        checkContainers("spec.initContainers", spec.getInitContainers());
    }

    private static void checkContainers(String path, List<V1Container> containers) {
        checkNoNullEntries(path, containers);
        for (V1Container container : CollectionsExt.nonNull(containers)) {
            String containerPath = path + "[" + container.getName() + "]";
            checkNoNullEntries(containerPath + ".env", container.getEnv());
            checkNoNullEntries(containerPath + ".volumeMounts", container.getVolumeMounts());
        }
    }

    private static void checkNoNullEntries(String path, List<?> items) {
        if (items != null && items.contains(null)) {
            throw SpiffeEnableException.malformedRequest(path + " contains a null entry");
        }
    }

    public String serialize(V1Pod pod) {
        return kubeJson.serialize(pod);
    }

    /**
     * @throws SpiffeEnableException with {@link SpiffeEnableException.ErrorCode#MarshalFailure} if the pod cannot be
     *                               serialized
     */
    public JsonNode toTree(V1Pod pod) {
        try {
            return ObjectMappers.jacksonDefaultMapper().readTree(serialize(pod));
        } catch (JsonProcessingException | RuntimeException e) {
            throw SpiffeEnableException.marshalFailure(e);
        }
    }

    /**
     * Returns a JSON patch (RFC 6902) transforming the source tree into the target one, built from
     * <tt>add</tt>, <tt>remove</tt> and <tt>replace</tt> operations only.
     */
    public JsonNode diff(JsonNode source, JsonNode target) {
        return JsonDiff.asJson(source, target, PATCH_FLAGS);
    }
}
