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

import java.util.Map;

import org.jetbrains.annotations.Nullable;

/**
 * Base for MIN and MAX. A partial result is either the raw value or
 * {@code {"min"|"max": value, "count": c}}; a count of 0 means the partition had no value.
 */
abstract sealed class ExtremeValueAggregator implements Aggregator permits MinAggregator, MaxAggregator {

    private final String key;
    private boolean hasValue = false;
    @Nullable
    private Object value;

    ExtremeValueAggregator(String key) {
        this.key = key;
    }

    /**
     * @param comparison result of comparing a candidate against the current value
     */
    protected abstract boolean replaces(int comparison);

    @Override
    public void aggregate(@Nullable Object partialResult) {
        if (partialResult == null) {
            return;
        }
        Object candidate = partialResult;
        if (partialResult instanceof Map<?, ?> partial) {
            if (partial.containsKey(key) == false) {
                throw new IllegalArgumentException("Expected a {" + key + ", count} partial result, got: " + partial);
            }
            Object count = partial.get("count");
            if (count instanceof Number number && number.longValue() == 0) {
                return;
            }
            candidate = partial.get(key);
        }
        if (hasValue == false || replaces(ItemComparator.INSTANCE.compare(candidate, value))) {
            value = candidate;
            hasValue = true;
        }
    }

    @Override
    @Nullable
    public Object getResult() {
        return value;
    }
}
