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

package io.docq.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.jetbrains.annotations.Nullable;

import io.docq.transport.HttpHeaders;

/**
 * Response headers accumulated over one or more pulls of an execution context.
 *
 * Not thread-safe, a pull chain only mutates headers from one logical flow at a time.
 */
public final class QueryHeaders {

    private final LinkedHashMap<String, String> headers;

    private QueryHeaders(Map<String, String> headers) {
        this.headers = new LinkedHashMap<>(headers);
    }

    /**
     * Headers of a pull that didn't consume any request units yet.
     */
    public static QueryHeaders initial() {
        return new QueryHeaders(Map.of(HttpHeaders.REQUEST_CHARGE, "0"));
    }

    public static QueryHeaders of(Map<String, String> headers) {
        QueryHeaders result = initial();
        result.headers.putAll(headers);
        return result;
    }

    /**
     * Merges {@code other} into these headers. Request charges add up, query metrics are concatenated,
     * any other header is overwritten by the value of {@code other}.
     */
    public QueryHeaders merge(@Nullable QueryHeaders other) {
        if (other == null) {
            return this;
        }
        for (Map.Entry<String, String> entry : other.headers.entrySet()) {
            String name = entry.getKey();
            String value = entry.getValue();
            switch (name) {
                case HttpHeaders.REQUEST_CHARGE ->
                    headers.put(name, formatCharge(requestCharge() + other.requestCharge()));
                case HttpHeaders.QUERY_METRICS -> headers.merge(name, value, (a, b) -> a + ";" + b);
                default -> headers.put(name, value);
            }
        }
        return this;
    }

    public double requestCharge() {
        String value = headers.get(HttpHeaders.REQUEST_CHARGE);
        if (value == null) {
            return 0.0d;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return 0.0d;
        }
    }

    @Nullable
    public String continuation() {
        return headers.get(HttpHeaders.CONTINUATION);
    }

    @Nullable
    public String get(String name) {
        return headers.get(name);
    }

    public QueryHeaders put(String name, String value) {
        headers.put(name, value);
        return this;
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(headers);
    }

    private static String formatCharge(double charge) {
        if (charge == Math.rint(charge)) {
            return Long.toString((long) charge);
        }
        return Double.toString(charge);
    }

    @Override
    public String toString() {
        return "QueryHeaders" + headers;
    }
}
