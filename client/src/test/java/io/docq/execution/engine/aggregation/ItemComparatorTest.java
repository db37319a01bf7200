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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.Test;

public class ItemComparatorTest {

    @Test
    public void test_types_are_ordered_null_boolean_number_string() {
        List<Object> values = new ArrayList<>(Arrays.asList("x", 2.5, null, true, 1, false, "a", 3L));
        values.sort(ItemComparator.INSTANCE);
        assertThat(values).containsExactly(null, false, true, 1, 2.5, 3L, "a", "x");
    }

    @Test
    public void test_numbers_compare_across_types() {
        assertThat(ItemComparator.INSTANCE.compare(2, 2L)).isZero();
        assertThat(ItemComparator.INSTANCE.compare(2, 2.0)).isZero();
        assertThat(ItemComparator.INSTANCE.compare(Long.MAX_VALUE, Long.MAX_VALUE - 1)).isPositive();
    }

    @Test
    public void test_objects_cannot_be_ordered() {
        assertThatThrownBy(() -> ItemComparator.INSTANCE.compare(Map.of(), 1))
            .isExactlyInstanceOf(IllegalArgumentException.class);
    }
}
