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

package io.docq.retry;

import java.util.Iterator;
import java.util.NoSuchElementException;

import io.docq.common.unit.TimeValue;

/**
 * Delays doubling from {@code initialDelayInMs} with every attempt, each capped at {@code maxDelayInMs}.
 * Iterating yields the delays of the first {@code maxIterations} attempts.
 */
public class LimitedExponentialBackoff implements Iterable<TimeValue> {

    private final long initialDelayInMs;
    private final int maxIterations;
    private final long maxDelayInMs;

    public LimitedExponentialBackoff(long initialDelayInMs, int maxIterations, long maxDelayInMs) {
        if (initialDelayInMs < 0 || maxIterations <= 0 || maxDelayInMs < initialDelayInMs) {
            throw new IllegalArgumentException(
                "Invalid backoff: initialDelayInMs=" + initialDelayInMs
                + ", maxIterations=" + maxIterations
                + ", maxDelayInMs=" + maxDelayInMs);
        }
        this.initialDelayInMs = initialDelayInMs;
        this.maxIterations = maxIterations;
        this.maxDelayInMs = maxDelayInMs;
    }

    /**
     * @param attempt 0 based number of the retry
     * @return {@code min(maxDelayInMs, initialDelayInMs * 2^attempt)}
     */
    public TimeValue delay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, got: " + attempt);
        }
        if (initialDelayInMs == 0) {
            return TimeValue.ZERO;
        }
        // shifting any further would overflow
        if (attempt >= Long.numberOfLeadingZeros(initialDelayInMs) - 1) {
            return TimeValue.timeValueMillis(maxDelayInMs);
        }
        return TimeValue.timeValueMillis(Math.min(maxDelayInMs, initialDelayInMs << attempt));
    }

    @Override
    public Iterator<TimeValue> iterator() {
        return new Iterator<>() {

            private int attempt = 0;

            @Override
            public boolean hasNext() {
                return attempt < maxIterations;
            }

            @Override
            public TimeValue next() {
                if (hasNext() == false) {
                    throw new NoSuchElementException("Backoff is limited to " + maxIterations + " attempts");
                }
                return delay(attempt++);
            }
        };
    }
}
