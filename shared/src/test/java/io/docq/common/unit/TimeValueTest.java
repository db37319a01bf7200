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

package io.docq.common.unit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Test;

public class TimeValueTest {

    @Test
    public void test_seconds_are_converted_to_millis() {
        assertThat(TimeValue.timeValueSeconds(30).millis()).isEqualTo(30_000L);
        assertThat(TimeValue.timeValueSeconds(1)).isEqualTo(TimeValue.timeValueMillis(1000));
    }

    @Test
    public void test_plus_and_ordering() {
        TimeValue total = TimeValue.timeValueMillis(250).plus(TimeValue.timeValueMillis(750));
        assertThat(total).isEqualTo(TimeValue.timeValueSeconds(1));
        assertThat(TimeValue.ZERO).isLessThan(total);
    }

    @Test
    public void test_negative_duration_is_rejected() {
        assertThatThrownBy(() -> TimeValue.timeValueMillis(-1))
            .isExactlyInstanceOf(IllegalArgumentException.class);
    }
}
