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

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import io.docq.execution.engine.aggregation.AggregatePayloads;

public class GroupIdentityTest {

    @Test
    public void test_identity_ignores_map_key_order() {
        Map<String, Object> ab = new LinkedHashMap<>();
        ab.put("a", 1);
        ab.put("b", List.of("x", true));
        Map<String, Object> ba = new LinkedHashMap<>();
        ba.put("b", List.of("x", true));
        ba.put("a", 1);

        assertThat(GroupIdentity.of(List.of(ab))).isEqualTo(GroupIdentity.of(List.of(ba)));
    }

    @Test
    public void test_integral_numbers_hash_alike() {
        assertThat(GroupIdentity.of(List.of(1))).isEqualTo(GroupIdentity.of(List.of(1L)));
        assertThat(GroupIdentity.of(List.of(1))).isEqualTo(GroupIdentity.of(List.of(1.0)));
        assertThat(GroupIdentity.of(List.of(1))).isNotEqualTo(GroupIdentity.of(List.of(1.5)));
    }

    @Test
    public void test_map_with_null_value_is_hashed_by_sorted_keys() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("name", "x");
        first.put("deleted", null);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("deleted", null);
        second.put("name", "x");

        assertThat(GroupIdentity.of(List.of(first))).isEqualTo(GroupIdentity.of(List.of(second)));
        assertThat(GroupIdentity.of(List.of(first))).isNotEqualTo(GroupIdentity.of(List.of(Map.of("name", "x"))));
    }

    @Test
    public void test_decimal_numbers_hash_by_value() {
        assertThat(GroupIdentity.of(List.of(new BigDecimal("5.0")))).isEqualTo(GroupIdentity.of(List.of(5L)));
        assertThat(GroupIdentity.of(List.of(new BigDecimal("2.50")))).isEqualTo(GroupIdentity.of(List.of(2.5)));
        assertThat(GroupIdentity.of(List.of(BigInteger.valueOf(42)))).isEqualTo(GroupIdentity.of(List.of(42)));
        assertThat(GroupIdentity.of(List.of(0.1f))).isEqualTo(GroupIdentity.of(List.of(0.1)));
        assertThat(GroupIdentity.of(List.of(0.0))).isEqualTo(GroupIdentity.of(List.of(new BigDecimal("0.000"))));
    }

    @Test
    public void test_canonical_number_form() {
        assertThat(GroupIdentity.canonicalNumber(1e20)).isEqualTo("100000000000000000000");
        assertThat(GroupIdentity.canonicalNumber(new BigDecimal("1E+2"))).isEqualTo("100");
        assertThat(GroupIdentity.canonicalNumber(Double.NaN)).isEqualTo("NaN");
        assertThat(GroupIdentity.canonicalNumber(-3)).isEqualTo("-3");
    }

    @Test
    public void test_values_of_different_types_differ() {
        assertThat(GroupIdentity.of(List.of("1"))).isNotEqualTo(GroupIdentity.of(List.of(1)));
        assertThat(GroupIdentity.of(List.of("true"))).isNotEqualTo(GroupIdentity.of(List.of(true)));
        assertThat(GroupIdentity.of(List.of(List.of()))).isNotEqualTo(GroupIdentity.of(List.of(Map.of())));
        assertThat(GroupIdentity.of(List.of("a", "b"))).isNotEqualTo(GroupIdentity.of(List.of("ab")));
    }

    @Test
    public void test_missing_group_by_items_map_to_empty_group() {
        assertThat(GroupIdentity.of(null)).isEqualTo(AggregatePayloads.EMPTY_GROUP);
        assertThat(GroupIdentity.of(List.of())).isNotEqualTo(AggregatePayloads.EMPTY_GROUP);
    }
}
