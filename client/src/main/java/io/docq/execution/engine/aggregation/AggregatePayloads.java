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

package io.docq.execution.engine.aggregation;

import java.util.Collections;
import java.util.Map;

import org.jetbrains.annotations.Nullable;

/**
 * Partial aggregates arrive wrapped as {@code {"item": value}}, or {@code {"item2": value}} for
 * aggregates that may evaluate to null.
 */
public final class AggregatePayloads {

    /**
     * Group identity of rows that don't carry group by items.
     */
    public static final String EMPTY_GROUP = "__empty__";

    static final String ITEM = "item";
    static final String ITEM2 = "item2";

    /**
     * Stands in for a payload value that is absent, so aggregators always receive a wrapped value.
     */
    public static final Map<String, Object> NULL_PAYLOAD = Collections.singletonMap(ITEM2, null);

    private AggregatePayloads() {
    }

    @Nullable
    public static Object extract(@Nullable Object payload) {
        if (payload instanceof Map<?, ?> map) {
            if (map.isEmpty()) {
                return null;
            }
            Object item2 = map.get(ITEM2);
            return item2 != null ? item2 : map.get(ITEM);
        }
        return payload;
    }
}
