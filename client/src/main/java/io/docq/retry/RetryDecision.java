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

import java.util.Objects;

import org.jetbrains.annotations.Nullable;

import io.docq.common.unit.TimeValue;

/**
 * Outcome of {@link RetryPolicy#shouldRetry}: don't retry, retry against the same endpoint, or retry
 * against another endpoint.
 */
public final class RetryDecision {

    public enum Outcome {
        DO_NOT_RETRY,
        RETRY,
        RETRY_ON_ENDPOINT
    }

    public static final RetryDecision DO_NOT_RETRY = new RetryDecision(Outcome.DO_NOT_RETRY, null, TimeValue.ZERO);

    private final Outcome outcome;
    @Nullable
    private final String endpoint;
    private final TimeValue retryAfter;

    private RetryDecision(Outcome outcome, @Nullable String endpoint, TimeValue retryAfter) {
        this.outcome = outcome;
        this.endpoint = endpoint;
        this.retryAfter = retryAfter;
    }

    public static RetryDecision retry(TimeValue retryAfter) {
        return new RetryDecision(Outcome.RETRY, null, retryAfter);
    }

    public static RetryDecision retryOn(String endpoint, TimeValue retryAfter) {
        return new RetryDecision(Outcome.RETRY_ON_ENDPOINT, Objects.requireNonNull(endpoint, "endpoint"), retryAfter);
    }

    public Outcome outcome() {
        return outcome;
    }

    public boolean shouldRetry() {
        return outcome != Outcome.DO_NOT_RETRY;
    }

    /**
     * @return the endpoint to retry on, only set for {@link Outcome#RETRY_ON_ENDPOINT}
     */
    @Nullable
    public String endpoint() {
        return endpoint;
    }

    /**
     * @return how long the caller should wait before issuing the retry
     */
    public TimeValue retryAfter() {
        return retryAfter;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        RetryDecision that = (RetryDecision) o;
        return outcome == that.outcome
               && Objects.equals(endpoint, that.endpoint)
               && retryAfter.equals(that.retryAfter);
    }

    @Override
    public int hashCode() {
        return Objects.hash(outcome, endpoint, retryAfter);
    }

    @Override
    public String toString() {
        return "RetryDecision{" +
               "outcome=" + outcome +
               ", endpoint=" + endpoint +
               ", retryAfter=" + retryAfter +
               '}';
    }
}
