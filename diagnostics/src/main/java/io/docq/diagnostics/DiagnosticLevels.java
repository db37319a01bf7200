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

import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import com.google.common.annotations.VisibleForTesting;

/**
 * Resolves the diagnostic level a client runs with.
 *
 * A level configured on the client wins over the environment variable {@value #ENV_VARIABLE}
 * which in turn wins over the system property {@value #SYSTEM_PROPERTY}. Without any of them
 * {@link DiagnosticLevel#INFO} is used.
 */
public final class DiagnosticLevels {

    private static final Logger LOGGER = LogManager.getLogger(DiagnosticLevels.class);

    public static final String ENV_VARIABLE = "DOCQ_DIAGNOSTICS_LEVEL";
    public static final String SYSTEM_PROPERTY = "docq.diagnostics.level";
    public static final DiagnosticLevel DEFAULT = DiagnosticLevel.INFO;

    private DiagnosticLevels() {
    }

    public static DiagnosticLevel determine(@Nullable DiagnosticLevel clientLevel) {
        return determine(clientLevel, System.getenv(), System.getProperty(SYSTEM_PROPERTY));
    }

    @VisibleForTesting
    static DiagnosticLevel determine(@Nullable DiagnosticLevel clientLevel,
                                     Map<String, String> environment,
                                     @Nullable String systemProperty) {
        if (clientLevel != null) {
            return clientLevel;
        }
        DiagnosticLevel fromEnv = parse(ENV_VARIABLE, environment.get(ENV_VARIABLE));
        if (fromEnv != null) {
            return fromEnv;
        }
        DiagnosticLevel fromProperty = parse(SYSTEM_PROPERTY, systemProperty);
        if (fromProperty != null) {
            return fromProperty;
        }
        return DEFAULT;
    }

    @Nullable
    private static DiagnosticLevel parse(String source, @Nullable String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        DiagnosticLevel level = DiagnosticLevel.fromString(value);
        if (level == null) {
            LOGGER.warn("Ignoring invalid diagnostic level '{}' configured via {}", value, source);
        }
        return level;
    }
}
