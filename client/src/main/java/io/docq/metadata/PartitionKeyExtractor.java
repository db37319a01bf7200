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
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Extracts the partition key of a document according to a {@link PartitionKeyDefinition}.
 *
 * An extracted key holds one component per path. A component is either a string, number or boolean,
 * {@link PartitionKeyLiteral#NULL} for a present but null value or {@link PartitionKeyLiteral#NONE} for
 * an absent value.
 */
public final class PartitionKeyExtractor {

    private static final Logger LOGGER = LogManager.getLogger(PartitionKeyExtractor.class);

    private PartitionKeyExtractor() {
    }

    /**
     * @return the key components, an empty list for a system managed key, or null if the definition is
     *         malformed or a path resolves to a value of an unsupported type. Null is logged, not thrown,
     *         so callers can tell an absent key from a broken definition and apply their own fallback.
     */
    @Nullable
    public static List<Object> extractPartitionKeys(Map<String, ?> document, @Nullable PartitionKeyDefinition definition) {
        if (definition == null || definition.paths() == null || definition.paths().isEmpty()) {
            LOGGER.error("Unexpected partition key definition found: {}", definition);
            return null;
        }
        if (definition.systemKey()) {
            return List.of();
        }
        List<String> paths = definition.paths();
        List<Object> partitionKeys = new ArrayList<>(paths.size());
        for (String path : paths) {
            List<String> segments;
            try {
                segments = PartitionKeyPaths.parse(path);
            } catch (IllegalArgumentException e) {
                LOGGER.error("Unexpected partition key definition found, invalid path '{}': {}", path, e.getMessage());
                return null;
            }
            Object component = extractPartitionKey(segments, document);
            if (component == null) {
                LOGGER.warn("Unsupported partition key value found at path '{}'", path);
                return null;
            }
            partitionKeys.add(component);
        }
        return Collections.unmodifiableList(partitionKeys);
    }

    /**
     * Key of a document that was given without any partition key value.
     */
    public static List<Object> undefinedPartitionKey(PartitionKeyDefinition definition) {
        if (definition.systemKey() || definition.paths() == null) {
            return List.of();
        }
        List<Object> partitionKeys = new ArrayList<>(definition.paths().size());
        for (int i = 0; i < definition.paths().size(); i++) {
            partitionKeys.add(PartitionKeyLiteral.NONE);
        }
        return Collections.unmodifiableList(partitionKeys);
    }

    @Nullable
    private static Object extractPartitionKey(List<String> segments, Object document) {
        Object current = document;
        for (String segment : segments) {
            if (current instanceof Map<?, ?> map && map.containsKey(segment)) {
                current = map.get(segment);
            } else {
                return PartitionKeyLiteral.NONE;
            }
        }
        if (current == null || current == PartitionKeyLiteral.NULL) {
            return PartitionKeyLiteral.NULL;
        }
        if (current instanceof String || current instanceof Number || current instanceof Boolean) {
            return current;
        }
        if (current == PartitionKeyLiteral.NONE) {
            return PartitionKeyLiteral.NONE;
        }
        if (current instanceof Map<?, ?> map && map.isEmpty()) {
            return PartitionKeyLiteral.NONE;
        }
        return null;
    }
}
