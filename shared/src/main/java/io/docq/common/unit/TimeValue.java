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

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * An immutable duration with millisecond precision.
 */
public final class TimeValue implements Comparable<TimeValue> {

    public static final TimeValue ZERO = new TimeValue(0);

    private final long millis;

    private TimeValue(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("duration must be >= 0, got: " + millis);
        }
        this.millis = millis;
    }

    public static TimeValue timeValueMillis(long millis) {
        if (millis == 0) {
            return ZERO;
        }
        return new TimeValue(millis);
    }

    public static TimeValue timeValueSeconds(long seconds) {
        return timeValueMillis(TimeUnit.SECONDS.toMillis(seconds));
    }

    public long millis() {
        return millis;
    }

    public TimeValue plus(TimeValue other) {
        return timeValueMillis(millis + other.millis);
    }

    @Override
    public int compareTo(TimeValue o) {
        return Long.compare(millis, o.millis);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return millis == ((TimeValue) o).millis;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(millis);
    }

    @Override
    public String toString() {
        if (millis >= 1000 && millis % 1000 == 0) {
            return String.format(Locale.ENGLISH, "%ds", millis / 1000);
        }
        return String.format(Locale.ENGLISH, "%dms", millis);
    }
}
