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

import java.util.Comparator;

import org.jetbrains.annotations.Nullable;

/**
 * Orders values of mixed types: null &lt; boolean &lt; number &lt; string.
 * Values within a type compare naturally. Objects and arrays can't be ordered.
 */
public final class ItemComparator implements Comparator<Object> {

    public static final ItemComparator INSTANCE = new ItemComparator();

    private ItemComparator() {
    }

    @Override
    public int compare(@Nullable Object o1, @Nullable Object o2) {
        int rank1 = typeRank(o1);
        int rank2 = typeRank(o2);
        if (rank1 != rank2) {
            return Integer.compare(rank1, rank2);
        }
        return switch (rank1) {
            case 0 -> 0;
            case 1 -> Boolean.compare((Boolean) o1, (Boolean) o2);
            case 2 -> compareNumbers((Number) o1, (Number) o2);
            default -> ((String) o1).compareTo((String) o2);
        };
    }

    private static int typeRank(@Nullable Object value) {
        if (value == null) {
            return 0;
        }
        if (value instanceof Boolean) {
            return 1;
        }
        if (value instanceof Number) {
            return 2;
        }
        if (value instanceof String) {
            return 3;
        }
        throw new IllegalArgumentException(
            "Cannot order value of type " + value.getClass().getSimpleName() + ": " + value);
    }

    static int compareNumbers(Number n1, Number n2) {
        if (isIntegral(n1) && isIntegral(n2)) {
            return Long.compare(n1.longValue(), n2.longValue());
        }
        return Double.compare(n1.doubleValue(), n2.doubleValue());
    }

    static boolean isIntegral(Number number) {
        return number instanceof Long
               || number instanceof Integer
               || number instanceof Short
               || number instanceof Byte;
    }

    /**
     * Adds two numbers as {@code long} if both are integral, as {@code double} otherwise.
     * A {@code long} sum that overflows continues as {@code double}.
     */
    static Number add(Number n1, Number n2) {
        if (isIntegral(n1) && isIntegral(n2)) {
            try {
                return Math.addExact(n1.longValue(), n2.longValue());
            } catch (ArithmeticException e) {
                return (double) n1.longValue() + (double) n2.longValue();
            }
        }
        return n1.doubleValue() + n2.doubleValue();
    }
}
