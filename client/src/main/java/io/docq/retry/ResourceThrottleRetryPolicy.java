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

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import io.docq.common.unit.TimeValue;
import io.docq.diagnostics.DiagnosticNodeInternal;
import io.docq.exceptions.ErrorResponseException;

/**
 * Retries throttled requests (429).
 *
 * The delay is the configured fixed interval if there is one, else the delay the service asked for
 * with the retry-after header, else an exponential backoff. Retrying stops after
 * {@link RetryOptions#maxRetryAttemptCount()} attempts or once the next delay would push the total
 * waiting time over {@link RetryOptions#maxWaitTimeInSeconds()}.
 */
public class ResourceThrottleRetryPolicy implements RetryPolicy {

    private static final Logger LOGGER = LogManager.getLogger(ResourceThrottleRetryPolicy.class);

    static final int BACKOFF_FIRST_DELAY_IN_MS = 100;
    static final int BACKOFF_MAX_DELAY_IN_MS = 5_000;

    private final int maxTries;
    private final long fixedRetryIntervalInMs;
    private final long timeoutInMs;
    private final LimitedExponentialBackoff backoff;

    private int currentRetryAttemptCount = 0;
    private long cumulativeWaitTimeInMs = 0;
    private TimeValue retryAfter = TimeValue.ZERO;

    public ResourceThrottleRetryPolicy(RetryOptions retryOptions) {
        this.maxTries = retryOptions.maxRetryAttemptCount();
        this.fixedRetryIntervalInMs = retryOptions.fixedRetryIntervalInMs();
        this.timeoutInMs = retryOptions.maxWaitTimeInSeconds() * 1000L;
        this.backoff = new LimitedExponentialBackoff(
            BACKOFF_FIRST_DELAY_IN_MS,
            Math.max(1, maxTries),
            BACKOFF_MAX_DELAY_IN_MS
        );
    }

    @Override
    public TimeValue retryAfter() {
        return retryAfter;
    }

    public int currentRetryAttemptCount() {
        return currentRetryAttemptCount;
    }

    public long cumulativeWaitTimeInMs() {
        return cumulativeWaitTimeInMs;
    }

    @Override
    public CompletableFuture<RetryDecision> shouldRetry(ErrorResponseException error,
                                                        DiagnosticNodeInternal diagnosticNode,
                                                        @Nullable RetryContext retryContext,
                                                        @Nullable String locationEndpoint) {
        if (currentRetryAttemptCount >= maxTries) {
            return CompletableFuture.completedFuture(RetryDecision.DO_NOT_RETRY);
        }
        long delayInMs = nextDelayInMs(error);
        if (cumulativeWaitTimeInMs + delayInMs > timeoutInMs) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Not retrying throttled request, waited={}ms, nextDelay={}ms, maxWait={}ms",
                    cumulativeWaitTimeInMs, delayInMs, timeoutInMs);
            }
            return CompletableFuture.completedFuture(RetryDecision.DO_NOT_RETRY);
        }
        currentRetryAttemptCount++;
        cumulativeWaitTimeInMs += delayInMs;
        retryAfter = TimeValue.timeValueMillis(delayInMs);
        if (retryContext != null) {
            retryContext.retryCount(currentRetryAttemptCount);
        }
        diagnosticNode.addData(Map.of(RetryPolicies.SUCCESSFUL_RETRY_POLICY, "resourceThrottle"));
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Retrying throttled request, attempt={}, delay={}, activityId={}",
                currentRetryAttemptCount, retryAfter, error.activityId());
        }
        return CompletableFuture.completedFuture(RetryDecision.retry(retryAfter));
    }

    private long nextDelayInMs(ErrorResponseException error) {
        if (fixedRetryIntervalInMs > 0) {
            return fixedRetryIntervalInMs;
        }
        long retryAfterInMs = error.retryAfterInMs();
        if (retryAfterInMs > 0) {
            return retryAfterInMs;
        }
        return backoff.delay(currentRetryAttemptCount).millis();
    }
}
