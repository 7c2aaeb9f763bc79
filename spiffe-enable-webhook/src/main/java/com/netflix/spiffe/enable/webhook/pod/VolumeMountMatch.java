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
 * Position and state of a container volume mount found by name.
 */
public final class VolumeMountMatch {

    private final int index;
    private final boolean pathMatches;
    private final boolean readOnlyMatches;

    public VolumeMountMatch(int index, boolean pathMatches, boolean readOnlyMatches) {
        this.index = index;
        this.pathMatches = pathMatches;
        this.readOnlyMatches = readOnlyMatches;
    }

    public int getIndex() {
        return index;
    }

    public boolean isPathMatches() {
        return pathMatches;
    }

    public boolean isReadOnlyMatches() {
        return readOnlyMatches;
    }

    public boolean isExactMatch() {
        return pathMatches && readOnlyMatches;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        VolumeMountMatch that = (VolumeMountMatch) o;
        return index == that.index && pathMatches == that.pathMatches && readOnlyMatches == that.readOnlyMatches;
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, pathMatches, readOnlyMatches);
    }

    @Override
    public String toString() {
        return "VolumeMountMatch{" +
                "index=" + index +
                ", pathMatches=" + pathMatches +
                ", readOnlyMatches=" + readOnlyMatches +
                '}';
    }
}
