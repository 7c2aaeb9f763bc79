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

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import com.netflix.spiffe.enable.common.util.StringExt;
import com.netflix.spiffe.enable.webhook.SpiffeEnableException;
import com.netflix.spiffe.enable.webhook.capability.Capability;
import com.netflix.spiffe.enable.webhook.capability.CapabilityInjector;
import com.netflix.spiffe.enable.webhook.capability.DebugUiInjector;
import com.netflix.spiffe.enable.webhook.capability.ModeRequest;
import com.netflix.spiffe.enable.webhook.capability.WorkloadApiInjector;
import com.netflix.spiffe.enable.webhook.pod.InjectionAnnotations;
import com.netflix.spiffe.enable.webhook.pod.PodCodec;
import com.netflix.spiffe.enable.webhook.pod.PodMutationContext;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import io.kubernetes.client.openapi.models.V1Pod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mutates pods admitted with SPIFFE injection enabled.
 * <p>
 * A pod without <tt>spiffe.cofide.io/enabled: "true"</tt> is allowed unchanged. For enabled pods, the Workload API
 * socket is added to every container, the debug UI is added if requested, and then the capabilities named in the
 * mode annotation are injected in declaration order. A mode annotation with any unknown token rejects the pod.
 * The outcome is a JSON patch against the canonical form of the received pod. The received pod is never modified,
 * and a request either yields a complete patch or no patch at all.
 */
@Singleton
public class PodMutator {

    private static final Logger logger = LoggerFactory.getLogger(PodMutator.class);

    public static final String NOT_ENABLED_MESSAGE = "Injection criteria not met";

    private final PodCodec podCodec;
    private final WorkloadApiInjector workloadApiInjector;
    private final DebugUiInjector debugUiInjector;
    private final Map<Capability, CapabilityInjector> capabilityInjectors;
    private final MutationMetrics metrics;

    @Inject
    public PodMutator(PodCodec podCodec,
                      WorkloadApiInjector workloadApiInjector,
                      DebugUiInjector debugUiInjector,
                      Set<CapabilityInjector> capabilityInjectors,
                      MutationMetrics metrics) {
        logger.info("Registered capability injectors: {}", capabilityInjectors.stream().map(CapabilityInjector::getCapability).collect(Collectors.toList()));

        Map<Capability, CapabilityInjector> injectorMap = new EnumMap<>(Capability.class);
        for (CapabilityInjector injector : capabilityInjectors) {
            CapabilityInjector previous = injectorMap.put(injector.getCapability(), injector);
            Preconditions.checkArgument(previous == null, "Multiple injectors registered for capability %s", injector.getCapability());
        }
        for (Capability capability : Capability.values()) {
            Preconditions.checkArgument(injectorMap.containsKey(capability), "No injector registered for capability %s", capability);
        }

        this.podCodec = podCodec;
        this.workloadApiInjector = workloadApiInjector;
        this.debugUiInjector = debugUiInjector;
        this.capabilityInjectors = injectorMap;
        this.metrics = metrics;
    }

    public MutationResult mutate(AdmissionRequest request) {
        V1Pod pod;
        try {
            pod = podCodec.decode(request.getObject());
        } catch (SpiffeEnableException e) {
            logger.warn("[request={}] Rejecting admission request: {}", request.getUid(), e.getMessage());
            metrics.incrementErrored(e.getErrorCode());
            return MutationResult.errored(e);
        }

        InjectionAnnotations annotations = InjectionAnnotations.from(pod);
        PodMutationContext context = new PodMutationContext(request.getUid(), resolveNamespace(request, pod), resolveName(request, pod), annotations);
        if (!annotations.isEnabled()) {
            logger.debug("{} Injection not enabled, admitting pod unchanged", context);
            metrics.incrementAllowed();
            return MutationResult.allowed(NOT_ENABLED_MESSAGE);
        }

        try {
            return mutateEnabledPod(pod, context);
        } catch (SpiffeEnableException e) {
            if (SpiffeEnableException.isExpected(e)) {
                logger.warn("{} Pod mutation rejected: {}", context, e.getMessage());
            } else {
                logger.error("{} Pod mutation failed", context, e);
            }
            metrics.incrementErrored(e.getErrorCode());
            return MutationResult.errored(e);
        } catch (RuntimeException e) {
            logger.error("{} Unexpected pod mutation error", context, e);
            SpiffeEnableException error = SpiffeEnableException.internal(e);
            metrics.incrementErrored(error.getErrorCode());
            return MutationResult.errored(error);
        }
    }

    private MutationResult mutateEnabledPod(V1Pod pod, PodMutationContext context) {
        InjectionAnnotations annotations = context.getAnnotations();
        JsonNode original = podCodec.toTree(pod);

        workloadApiInjector.inject(pod, context);
        if (annotations.isDebugEnabled()) {
            debugUiInjector.inject(pod, context);
        }

        ModeRequest modeRequest = ModeRequest.parse(annotations);
        Optional<SpiffeEnableException> modeError = modeRequest.validate();
        if (modeError.isPresent()) {
            logger.warn("{} Pod rejected: {}", context, modeError.get().getMessage());
            metrics.incrementDenied(modeError.get().getErrorCode());
            return MutationResult.denied(modeError.get());
        }

        for (Capability capability : modeRequest.getCapabilities()) {
            capabilityInjectors.get(capability).inject(pod, context);
        }

        JsonNode patch = podCodec.diff(original, podCodec.toTree(pod));
        logger.info("{} Pod mutated: capabilities={}, patchOperations={}", context, modeRequest.getCapabilities(), patch.size());
        metrics.incrementPatched(modeRequest.getCapabilities());
        return MutationResult.patched(patch);
    }

    private static String resolveNamespace(AdmissionRequest request, V1Pod pod) {
        if (StringExt.isNotEmpty(request.getNamespace())) {
            return request.getNamespace();
        }
        V1ObjectMeta metadata = pod.getMetadata();
        return metadata == null ? null : metadata.getNamespace();
    }

    /**
     * Pods created by controllers have no name yet at admission time, only a name prefix.
     */
    private static String resolveName(AdmissionRequest request, V1Pod pod) {
        if (StringExt.isNotEmpty(request.getName())) {
            return request.getName();
        }
        V1ObjectMeta metadata = pod.getMetadata();
        if (metadata == null) {
            return null;
        }
        return StringExt.getNonEmptyOrDefault(metadata.getName(), metadata.getGenerateName());
    }
}
