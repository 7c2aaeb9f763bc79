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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.netflix.spiffe.enable.common.util.CollectionsExt;
import com.netflix.spiffe.enable.common.util.StringExt;
import io.kubernetes.client.openapi.models.V1Pod;

import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ANNOTATION_DEBUG;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ANNOTATION_ENABLED;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ANNOTATION_HELPER_INCLUDE_INTERMEDIATE_BUNDLE;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ANNOTATION_MODE;
import static com.netflix.spiffe.enable.webhook.pod.PodConstants.ANNOTATION_TRUE;

/**
 * Injection settings read from pod annotations. Flags are only set when the annotation value is exactly "true";
 * any other value (including "True" or "yes") leaves the flag unset.
 */
public final class InjectionAnnotations {

    private static final InjectionAnnotations DISABLED = new InjectionAnnotations(false, null, Collections.emptyList(), false, false);

    private final boolean enabled;
    private final String modeValue;
    private final List<String> modeTokens;
    private final boolean debugEnabled;
    private final boolean includeIntermediateBundle;

    private InjectionAnnotations(boolean enabled,
                                 String modeValue,
                                 List<String> modeTokens,
                                 boolean debugEnabled,
                                 boolean includeIntermediateBundle) {
        this.enabled = enabled;
        this.modeValue = modeValue;
        this.modeTokens = modeTokens;
        this.debugEnabled = debugEnabled;
        this.includeIntermediateBundle = includeIntermediateBundle;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * @return raw value of the mode annotation, or null if the annotation is not set
     */
    public String getModeValue() {
        return modeValue;
    }

    /**
     * @return trimmed, non-empty mode tokens in declaration order (duplicates retained)
     */
    public List<String> getModeTokens() {
        return modeTokens;
    }

    public boolean isDebugEnabled() {
        return debugEnabled;
    }

    public boolean isIncludeIntermediateBundle() {
        return includeIntermediateBundle;
    }

    public static InjectionAnnotations from(V1Pod pod) {
        if (pod.getMetadata() == null) {
            return DISABLED;
        }
        return from(pod.getMetadata().getAnnotations());
    }

    public static InjectionAnnotations from(Map<String, String> annotations) {
        if (CollectionsExt.isNullOrEmpty(annotations)) {
            return DISABLED;
        }
        String modeValue = annotations.get(ANNOTATION_MODE);
        return new InjectionAnnotations(
                isTrue(annotations, ANNOTATION_ENABLED),
                modeValue,
                Collections.unmodifiableList(StringExt.splitByComma(modeValue)),
                isTrue(annotations, ANNOTATION_DEBUG),
                isTrue(annotations, ANNOTATION_HELPER_INCLUDE_INTERMEDIATE_BUNDLE)
        );
    }

    private static boolean isTrue(Map<String, String> annotations, String key) {
        return ANNOTATION_TRUE.equals(annotations.get(key));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        InjectionAnnotations that = (InjectionAnnotations) o;
        return enabled == that.enabled &&
                debugEnabled == that.debugEnabled &&
                includeIntermediateBundle == that.includeIntermediateBundle &&
                Objects.equals(modeValue, that.modeValue) &&
                Objects.equals(modeTokens, that.modeTokens);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, modeValue, modeTokens, debugEnabled, includeIntermediateBundle);
    }

    @Override
    public String toString() {
        return "InjectionAnnotations{" +
                "enabled=" + enabled +
                ", modeValue='" + modeValue + '\'' +
                ", modeTokens=" + modeTokens +
                ", debugEnabled=" + debugEnabled +
                ", includeIntermediateBundle=" + includeIntermediateBundle +
                '}';
    }
}
