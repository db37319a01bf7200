/*
 * Licensed to Crate.io GmbH ("Crate") under one or more contributor
 * license agreements.  See the NOTICE file distributed with this work for
 * additional information regarding copyright ownership.  Crate licenses
 * this file to you under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.  You may
 * obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.  See the
 * License for the specific language governing permissions and limitations
 * under the License.
 *
 * However, if you have executed another commercial license agreement
 * with Crate these terms will supersede the license and you may use the
 * software solely pursuant to the terms of the relevant commercial agreement.
 */

package io.docq.metadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parser for partition key paths like {@code /a/b} or {@code /"a/b"/c}.
 */
public final class PartitionKeyPaths {

    private PartitionKeyPaths() {
    }

    /**
     * Splits a path into its segments. Segments may be wrapped in single or double quotes to contain
     * slashes, a backslash escapes the next character inside a quoted segment.
     *
     * @throws IllegalArgumentException if the path is malformed
     */
    public static List<String> parse(String path) {
        if (path.isEmpty() || path.charAt(0) != '/') {
            throw new IllegalArgumentException(
                String.format(Locale.ENGLISH, "Path '%s' must start with '/'", path));
        }
        List<String> segments = new ArrayList<>();
        int pos = 1;
        int length = path.length();
        while (pos < length) {
            char c = path.charAt(pos);
            if (c == '"' || c == '\'') {
                StringBuilder segment = new StringBuilder();
                int end = pos + 1;
                boolean closed = false;
                while (end < length) {
                    char current = path.charAt(end);
                    if (current == '\\' && end + 1 < length) {
                        segment.append(path.charAt(end + 1));
                        end += 2;
                        continue;
                    }
                    if (current == c) {
                        closed = true;
                        break;
                    }
                    segment.append(current);
                    end++;
                }
                if (closed == false) {
                    throw new IllegalArgumentException(
                        String.format(Locale.ENGLISH, "Path '%s' has an unterminated quoted segment", path));
                }
                segments.add(segment.toString());
                pos = end + 1;
                if (pos < length && path.charAt(pos) != '/') {
                    throw new IllegalArgumentException(
                        String.format(Locale.ENGLISH, "Path '%s' has trailing characters after a quoted segment", path));
                }
                pos++;
            } else {
                int end = path.indexOf('/', pos);
                if (end == -1) {
                    end = length;
                }
                String segment = path.substring(pos, end).trim();
                if (segment.isEmpty()) {
                    throw new IllegalArgumentException(
                        String.format(Locale.ENGLISH, "Path '%s' contains an empty segment", path));
                }
                segments.add(segment);
                pos = end + 1;
            }
        }
        if (segments.isEmpty()) {
            throw new IllegalArgumentException(
                String.format(Locale.ENGLISH, "Path '%s' has no segments", path));
        }
        return segments;
    }
}
