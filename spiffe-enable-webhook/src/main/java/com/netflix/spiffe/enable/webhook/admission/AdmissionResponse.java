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

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AdmissionResponse {

    public static final String PATCH_TYPE_JSON_PATCH = "JSONPatch";

    @JsonProperty
    private final String uid;

    @JsonProperty
    private final boolean allowed;

    /**
     * Base64 encoded JSON patch.
     */
    @JsonProperty
    private final String patch;

    @JsonProperty
    private final String patchType;

    @JsonProperty
    private final AdmissionStatus status;

    @JsonCreator
    public AdmissionResponse(@JsonProperty("uid") String uid,
                             @JsonProperty("allowed") boolean allowed,
                             @JsonProperty("patch") String patch,
                             @JsonProperty("patchType") String patchType,
                             @JsonProperty("status") AdmissionStatus status) {
        this.uid = uid;
        this.allowed = allowed;
        this.patch = patch;
        this.patchType = patchType;
        this.status = status;
    }

    public String getUid() {
        return uid;
    }

    public boolean isAllowed() {
        return allowed;
    }

    public String getPatch() {
        return patch;
    }

    public String getPatchType() {
        return patchType;
    }

    public AdmissionStatus getStatus() {
        return status;
    }

    public static AdmissionResponse allowed(String uid, String message) {
        return new AdmissionResponse(uid, true, null, null, new AdmissionStatus(200, message, null));
    }

    public static AdmissionResponse patched(String uid, String base64Patch) {
        return new AdmissionResponse(uid, true, base64Patch, PATCH_TYPE_JSON_PATCH, null);
    }

    public static AdmissionResponse rejected(String uid, int code, String message, String reason) {
        return new AdmissionResponse(uid, false, null, null, new AdmissionStatus(code, message, reason));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AdmissionResponse that = (AdmissionResponse) o;
        return allowed == that.allowed &&
                Objects.equals(uid, that.uid) &&
                Objects.equals(patch, that.patch) &&
                Objects.equals(patchType, that.patchType) &&
                Objects.equals(status, that.status);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uid, allowed, patch, patchType, status);
    }

    @Override
    public String toString() {
        return "AdmissionResponse{" +
                "uid='" + uid + '\'' +
                ", allowed=" + allowed +
                ", patchType='" + patchType + '\'' +
                ", status=" + status +
                '}';
    }
}
