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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import io.docq.common.unit.TimeValue;
import io.docq.diagnostics.DiagnosticNodeInternal;
import io.docq.exceptions.ErrorResponseException;
import io.docq.transport.HttpHeaders;
import io.docq.transport.StatusCodes;

public class ResourceThrottleRetryPolicyTest {

    private static ErrorResponseException throttled(long retryAfterInMs) {
        return new ErrorResponseException(
            StatusCodes.TOO_MANY_REQUESTS,
            3200,
            Map.of(HttpHeaders.RETRY_AFTER_IN_MS, Long.toString(retryAfterInMs)),
            null
        );
    }

    @Test
    public void test_retries_with_delay_requested_by_service() {
        ResourceThrottleRetryPolicy policy = new ResourceThrottleRetryPolicy(RetryOptions.DEFAULT);
        DiagnosticNodeInternal node = RetryPolicyTestSupport.requestNode();
        RetryContext retryContext = new RetryContext();

        RetryDecision decision = policy.shouldRetry(throttled(250), node, retryContext, null).join();

        assertThat(decision.outcome()).isEqualTo(RetryDecision.Outcome.RETRY);
        assertThat(decision.retryAfter()).isEqualTo(TimeValue.timeValueMillis(250));
        assertThat(policy.retryAfter()).isEqualTo(TimeValue.timeValueMillis(250));
        assertThat(retryContext.retryCount()).isEqualTo(1);
        assertThat(node.data()).containsEntry(RetryPolicies.SUCCESSFUL_RETRY_POLICY, "resourceThrottle");
    }

    @Test
    public void test_fixed_interval_overrides_service_delay() {
        ResourceThrottleRetryPolicy policy = new ResourceThrottleRetryPolicy(new RetryOptions(9, 50, 30));

        RetryDecision decision = policy.shouldRetry(throttled(250), RetryPolicyTestSupport.requestNode(), null, null).join();

        assertThat(decision.retryAfter()).isEqualTo(TimeValue.timeValueMillis(50));
    }

    @Test
    public void test_backoff_is_used_without_service_delay() {
        ResourceThrottleRetryPolicy policy = new ResourceThrottleRetryPolicy(RetryOptions.DEFAULT);

        RetryDecision decision = policy.shouldRetry(
            new ErrorResponseException(StatusCodes.TOO_MANY_REQUESTS, 0, Map.of(), null),
            RetryPolicyTestSupport.requestNode(),
            null,
            null
        ).join();

        assertThat(decision.retryAfter())
            .isEqualTo(TimeValue.timeValueMillis(ResourceThrottleRetryPolicy.BACKOFF_FIRST_DELAY_IN_MS));
    }

    @Test
    public void test_backoff_grows_with_every_attempt() {
        ResourceThrottleRetryPolicy policy = new ResourceThrottleRetryPolicy(RetryOptions.DEFAULT);
        ErrorResponseException throttled = new ErrorResponseException(StatusCodes.TOO_MANY_REQUESTS, 0, Map.of(), null);
        DiagnosticNodeInternal node = RetryPolicyTestSupport.requestNode();

        List<Long> delays = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            delays.add(policy.shouldRetry(throttled, node, null, null).join().retryAfter().millis());
        }

        assertThat(delays).containsExactly(100L, 200L, 400L, 800L);
        assertThat(policy.cumulativeWaitTimeInMs()).isEqualTo(1500L);
    }

    @Test
    public void test_stops_after_max_attempts() {
        ResourceThrottleRetryPolicy policy = new ResourceThrottleRetryPolicy(new RetryOptions(3, 0, 30));
        DiagnosticNodeInternal node = RetryPolicyTestSupport.requestNode();

        for (int i = 0; i < 3; i++) {
            assertThat(policy.shouldRetry(throttled(10), node, null, null).join().shouldRetry()).isTrue();
        }
        assertThat(policy.shouldRetry(throttled(10), node, null, null).join()).isEqualTo(RetryDecision.DO_NOT_RETRY);
        assertThat(policy.currentRetryAttemptCount()).isEqualTo(3);
        assertThat(policy.cumulativeWaitTimeInMs()).isEqualTo(30L);
    }

    @Test
    public void test_stops_once_max_wait_time_would_be_exceeded() {
        ResourceThrottleRetryPolicy policy = new ResourceThrottleRetryPolicy(new RetryOptions(9, 0, 1));
        DiagnosticNodeInternal node = RetryPolicyTestSupport.requestNode();

        assertThat(policy.shouldRetry(throttled(600), node, null, null).join().shouldRetry()).isTrue();
        assertThat(policy.shouldRetry(throttled(600), node, null, null).join().shouldRetry()).isFalse();
        assertThat(policy.shouldRetry(throttled(400), node, null, null).join().shouldRetry()).isTrue();
        assertThat(policy.cumulativeWaitTimeInMs()).isEqualTo(1_000L);
    }
}
