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
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The part of an admission request used by the webhook. The admitted object is kept as a raw JSON tree, and decoded
 * only after the request passes the basic checks.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AdmissionRequest {

    @JsonProperty
    private final String uid;

    @JsonProperty
    private final String namespace;

    @JsonProperty
    private final String name;

    @JsonProperty
    private final String operation;

    @JsonProperty
    private final JsonNode object;

    @JsonCreator
    public AdmissionRequest(@JsonProperty("uid") String uid,
                            @JsonProperty("namespace") String namespace,
                            @JsonProperty("name") String name,
                            @JsonProperty("operation") String operation,
                            @JsonProperty("object") JsonNode object) {
        this.uid = uid;
        this.namespace = namespace;
        this.name = name;
        this.operation = operation;
        this.object = object;
    }

    public String getUid() {
        return uid;
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * @return the object name, which is empty for pods created with <tt>generateName</tt>
     */
    public String getName() {
        return name;
    }

    public String getOperation() {
        return operation;
    }

    public JsonNode getObject() {
        return object;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AdmissionRequest that = (AdmissionRequest) o;
        return Objects.equals(uid, that.uid) &&
                Objects.equals(namespace, that.namespace) &&
                Objects.equals(name, that.name) &&
                Objects.equals(operation, that.operation) &&
                Objects.equals(object, that.object);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uid, namespace, name, operation, object);
    }

    @Override
    public String toString() {
        return "AdmissionRequest{" +
                "uid='" + uid + '\'' +
                ", namespace='" + namespace + '\'' +
                ", name='" + name + '\'' +
                ", operation='" + operation + '\'' +
                '}';
    }
}
