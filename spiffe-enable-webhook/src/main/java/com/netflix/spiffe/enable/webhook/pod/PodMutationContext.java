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

import java.util.Objects;

/**
 * Request scoped data shared by the pod injectors.
 */
public final class PodMutationContext {

    private final String requestUid;
    private final String namespace;
    private final String podName;
    private final InjectionAnnotations annotations;

    public PodMutationContext(String requestUid, String namespace, String podName, InjectionAnnotations annotations) {
        this.requestUid = requestUid;
        this.namespace = namespace;
        this.podName = podName;
        this.annotations = annotations;
    }

    public String getRequestUid() {
        return requestUid;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getPodName() {
        return podName;
    }

    public InjectionAnnotations getAnnotations() {
        return annotations;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        PodMutationContext that = (PodMutationContext) o;
        return Objects.equals(requestUid, that.requestUid) &&
                Objects.equals(namespace, that.namespace) &&
                Objects.equals(podName, that.podName) &&
                Objects.equals(annotations, that.annotations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(requestUid, namespace, podName, annotations);
    }

    /**
     * Short form used as a log message prefix.
     */
    @Override
    public String toString() {
        return "[request=" + requestUid + ", pod=" + namespace + '/' + podName + ']';
    }
}
