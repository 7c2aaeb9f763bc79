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

/**
 * <tt>admission.k8s.io/v1</tt> AdmissionReview envelope. The API server sends it with the request set, and expects
 * it back with the response set.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AdmissionReview {

    public static final String API_VERSION = "admission.k8s.io/v1";
    public static final String KIND = "AdmissionReview";

    @JsonProperty
    private final String apiVersion;

    @JsonProperty
    private final String kind;

    @JsonProperty
    private final AdmissionRequest request;

    @JsonProperty
    private final AdmissionResponse response;

    @JsonCreator
    public AdmissionReview(@JsonProperty("apiVersion") String apiVersion,
                           @JsonProperty("kind") String kind,
                           @JsonProperty("request") AdmissionRequest request,
                           @JsonProperty("response") AdmissionResponse response) {
        this.apiVersion = apiVersion;
        this.kind = kind;
        this.request = request;
        this.response = response;
    }

    public String getApiVersion() {
        return apiVersion;
    }

    public String getKind() {
        return kind;
    }

    public AdmissionRequest getRequest() {
        return request;
    }

    public AdmissionResponse getResponse() {
        return response;
    }

    public static AdmissionReview ofRequest(AdmissionRequest request) {
        return new AdmissionReview(API_VERSION, KIND, request, null);
    }

    /**
     * Builds the review returned to the API server, echoing the API version of the received review.
     */
    public static AdmissionReview ofResponse(String apiVersion, AdmissionResponse response) {
        return new AdmissionReview(apiVersion == null ? API_VERSION : apiVersion, KIND, null, response);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AdmissionReview that = (AdmissionReview) o;
        return Objects.equals(apiVersion, that.apiVersion) &&
                Objects.equals(kind, that.kind) &&
                Objects.equals(request, that.request) &&
                Objects.equals(response, that.response);
    }

    @Override
    public int hashCode() {
        return Objects.hash(apiVersion, kind, request, response);
    }

    @Override
    public String toString() {
        return "AdmissionReview{" +
                "apiVersion='" + apiVersion + '\'' +
                ", kind='" + kind + '\'' +
                ", request=" + request +
                ", response=" + response +
                '}';
    }
}
