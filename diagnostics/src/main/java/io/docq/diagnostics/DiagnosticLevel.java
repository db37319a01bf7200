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

package io.docq.diagnostics;

import java.util.Locale;

import org.jetbrains.annotations.Nullable;

/**
 * Verbosity tiers of the diagnostics, ordered from least to most verbose.
 */
public enum DiagnosticLevel {

    /**
     * Aggregate statistics only. Free-form annotations on nodes are suppressed.
     */
    INFO("info"),

    /**
     * Adds the diagnostic node tree and the client configuration to the exported diagnostics.
     */
    DEBUG("debug"),

    /**
     * Additionally captures headers, request and response bodies and URLs of network calls.
     * These may contain sensitive data.
     */
    DEBUG_UNSAFE("debug-unsafe");

    private final String label;

    DiagnosticLevel(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * @return true if something requested at {@code requested} is recorded by a node configured with
     *         {@code configured}, which is the case if the configured level is at least as verbose.
     */
    public static boolean allowTracing(DiagnosticLevel requested, DiagnosticLevel configured) {
        return configured.compareTo(requested) >= 0;
    }

    /**
     * Parses a level label like {@code debug-unsafe}. Underscores and case are ignored.
     *
     * @return the level or null if the value doesn't name a level
     */
    @Nullable
    public static DiagnosticLevel fromString(@Nullable String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ENGLISH).replace('_', '-');
        for (DiagnosticLevel level : values()) {
            if (level.label.equals(normalized)) {
                return level;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return label;
    }
}
