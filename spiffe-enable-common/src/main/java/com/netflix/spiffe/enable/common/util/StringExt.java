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

package com.netflix.spiffe.enable.common.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A set of string manipulation related functions.
 */
public final class StringExt {

    public final static Pattern COMMA_SPLIT_RE = Pattern.compile("\\s*,\\s*");

    private StringExt() {
    }

    /**
     * Return true if the string value is not null, and it is not an empty string.
     */
    public static boolean isNotEmpty(String s) {
        return s != null && !s.isEmpty();
    }

    /**
     * Return true if the string value is null or an empty string.
     */
    public static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }

    /**
     * Returns the value if not empty, or the default value otherwise.
     */
    public static String getNonEmptyOrDefault(String value, String defaultValue) {
        return isNotEmpty(value) ? value : defaultValue;
    }

    /**
     * Returns a list of comma separated values from the parameter, in their original order. The white space
     * characters around each value are removed, and empty values (for example from "a,,b" or "a,") are dropped.
     */
    public static List<String> splitByComma(String value) {
        if (!isNotEmpty(value)) {
            return Collections.emptyList();
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        for (String part : COMMA_SPLIT_RE.split(trimmed)) {
            if (!part.isEmpty()) {
                result.add(part);
            }
        }
        return result;
    }

    /**
     * Concatenate strings from the given string collection, separating the items with the given delimiter.
     */
    public static String concatenate(Collection<String> stringCollection, String delimiter) {
        if (stringCollection == null) {
            return null;
        }
        Iterator<String> it = stringCollection.iterator();
        if (!it.hasNext()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(it.next());
        while (it.hasNext()) {
            sb.append(delimiter);
            sb.append(it.next());
        }
        return sb.toString();
    }

    /**
     * Returns true if the text contains any ISO control character (new lines and tabs included).
     */
    public static boolean containsControlCharacter(String text) {
        if (text == null) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (Character.isISOControl(text.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Wrap text in double quotes, escaping backslash and double quote characters inside it.
     */
    public static String doubleQuotes(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2).append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.append('"').toString();
    }
}
