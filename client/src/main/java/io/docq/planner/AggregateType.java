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

package io.docq.planner;

import java.util.Locale;

import org.jetbrains.annotations.Nullable;

public enum AggregateType {
    AVERAGE("Average"),
    COUNT("Count"),
    MAX("Max"),
    MIN("Min"),
    SUM("Sum");

    private final String planName;

    AggregateType(String planName) {
        this.planName = planName;
    }

    /**
     * @return the name used for this aggregate in query plans
     */
    public String planName() {
        return planName;
    }

    /**
     * @return the aggregate type for a name used in query plans, e.g. {@code Sum}, or null if unknown
     */
    @Nullable
    public static AggregateType fromPlanName(@Nullable String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toLowerCase(Locale.ENGLISH);
        for (AggregateType type : values()) {
            if (type.planName.toLowerCase(Locale.ENGLISH).equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
