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


package com.netflix.spiffe.enable.webhook.capability;

import java.util.Arrays;
import java.util.List;

import static java.lang.String.format;

/**
 * Shell commands of the init containers writing rendered configuration files.
 */
final class InitContainerCommands {

    static final List<String> SHELL = Arrays.asList("/bin/sh", "-c");

    private static final String BANNER_END = "===========================";

    private InitContainerCommands() {
    }

    /**
     * Command writing the value of an environment variable verbatim into a file, creating the parent directory first.
     * The value is expanded inside double quotes and printed with a <tt>%s</tt> format, so neither the shell nor
     * printf interpret its content.
     */
    static String writeEnvToFile(String envName, String directory, String filePath) {
        return format("mkdir -p %s && printf '%%s' \"${%s}\" > %s", directory, envName, filePath);
    }

    /**
     * Command printing a written file between banner lines, so the container log shows what was written.
     */
    static String printFile(String title, String filePath) {
        return format("printf '\\n=== %s ===\\n' && cat %s && printf '\\n%s\\n'", title, filePath, BANNER_END);
    }
}
