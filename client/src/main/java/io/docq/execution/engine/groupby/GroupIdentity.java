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

package io.docq.execution.engine.groupby;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.jetbrains.annotations.Nullable;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import io.docq.execution.engine.aggregation.AggregatePayloads;

/**
 * Computes the identity of a group from the group by items of a row.
 *
 * Values are fed into the hash in a canonical form: map entries are sorted by key and numbers hash by
 * their decimal value regardless of their Java type, so the same group fetched from different
 * partitions always gets the same identity.
 * Distinct groups colliding on the SHA-256 hash would be merged; this isn't detected.
 */
public final class GroupIdentity {

    private static final byte NULL = 0;
    private static final byte BOOLEAN = 1;
    private static final byte NUMBER = 2;
    private static final byte STRING = 3;
    private static final byte ARRAY = 4;
    private static final byte OBJECT = 5;

    private GroupIdentity() {
    }

    public static String of(@Nullable Object groupByItems) {
        if (groupByItems == null) {
            return AggregatePayloads.EMPTY_GROUP;
        }
        Hasher hasher = Hashing.sha256().newHasher();
        put(hasher, groupByItems);
        return hasher.hash().toString();
    }

    private static void put(Hasher hasher, @Nullable Object value) {
        if (value == null) {
            hasher.putByte(NULL);
        } else if (value instanceof Boolean bool) {
            hasher.putByte(BOOLEAN).putBoolean(bool);
        } else if (value instanceof Number number) {
            putString(hasher.putByte(NUMBER), canonicalNumber(number));
        } else if (value instanceof CharSequence str) {
            putString(hasher.putByte(STRING), str.toString());
        } else if (value instanceof Collection<?> collection) {
            hasher.putByte(ARRAY).putInt(collection.size());
            for (Object element : collection) {
                put(hasher, element);
            }
        } else if (value instanceof Object[] array) {
            put(hasher, List.of(array));
        } else if (value instanceof Map<?, ?> map) {
            TreeMap<String, Object> sorted = new TreeMap<>();
            for (var entry : map.entrySet()) {
                sorted.put(String.valueOf(entry.getKey()), entry.getValue());
            }
            hasher.putByte(OBJECT).putInt(sorted.size());
            for (var entry : sorted.entrySet()) {
                putString(hasher, entry.getKey());
                put(hasher, entry.getValue());
            }
        } else {
            throw new IllegalArgumentException(
                "Unsupported group by value of type " + value.getClass().getName() + ": " + value);
        }
    }

    private static void putString(Hasher hasher, String str) {
        hasher.putInt(str.length()).putString(str, StandardCharsets.UTF_8);
    }

    /**
     * Decimal form without trailing zeros, so {@code 5}, {@code 5L}, {@code 5.0} and {@code new BigDecimal("5.00")}
     * are the same group. Floats are taken by their shortest decimal representation, {@code 0.1f} equals {@code 0.1}.
     */
    static String canonicalNumber(Number number) {
        BigDecimal decimal;
        if (number instanceof BigDecimal bigDecimal) {
            decimal = bigDecimal;
        } else if (number instanceof BigInteger bigInteger) {
            decimal = new BigDecimal(bigInteger);
        } else if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
            decimal = BigDecimal.valueOf(number.longValue());
        } else if (number instanceof Float floatValue) {
            if (Float.isFinite(floatValue) == false) {
                return Float.toString(floatValue);
            }
            decimal = new BigDecimal(Float.toString(floatValue));
        } else {
            double doubleValue = number.doubleValue();
            if (Double.isFinite(doubleValue) == false) {
                return Double.toString(doubleValue);
            }
            decimal = BigDecimal.valueOf(doubleValue);
        }
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.stripTrailingZeros().toPlainString();
    }
}
