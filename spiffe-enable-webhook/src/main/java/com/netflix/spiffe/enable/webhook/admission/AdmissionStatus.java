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
 * Result details of an admission call (a subset of the Kubernetes <tt>Status</tt> object).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AdmissionStatus {

    @JsonProperty
    private final Integer code;

    @JsonProperty
    private final String message;

    @JsonProperty
    private final String reason;

    @JsonCreator
    public AdmissionStatus(@JsonProperty("code") Integer code,
                           @JsonProperty("message") String message,
                           @JsonProperty("reason") String reason) {
        this.code = code;
        this.message = message;
        this.reason = reason;
    }

    public Integer getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AdmissionStatus that = (AdmissionStatus) o;
        return Objects.equals(code, that.code) && Objects.equals(message, that.message) && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message, reason);
    }

    @Override
    public String toString() {
        return "AdmissionStatus{" +
                "code=" + code +
                ", message='" + message + '\'' +
                ", reason='" + reason + '\'' +
                '}';
    }
}
