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

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.junit.Before;
import org.junit.Test;

import io.docq.exceptions.ErrorResponseException;
import io.docq.exceptions.RUCapPerOperationExceededException;
import io.docq.transport.HttpHeaders;
import io.docq.transport.OperationType;
import io.docq.transport.ResourceType;
import io.docq.transport.StatusCodes;
import io.docq.transport.SubStatusCodes;

public class RetryPoliciesTest {

    private RetryPolicies retryPolicies;

    @Before
    public void setUpPolicies() {
        retryPolicies = new RetryPolicies(
            RetryPolicyTestSupport.endpointManager(),
            ResourceType.ITEM,
            OperationType.QUERY,
            RetryOptions.DEFAULT,
            node -> CompletableFuture.completedFuture(null)
        );
    }

    private static ErrorResponseException error(int statusCode, int subStatusCode) {
        return new ErrorResponseException(statusCode, subStatusCode, Map.of(), null);
    }

    @Test
    public void test_errors_are_routed_by_status_and_sub_status() {
        assertThat(retryPolicies.policyFor(error(StatusCodes.TOO_MANY_REQUESTS, SubStatusCodes.UNKNOWN)))
            .isInstanceOf(ResourceThrottleRetryPolicy.class);
        assertThat(retryPolicies.policyFor(error(StatusCodes.FORBIDDEN, SubStatusCodes.WRITE_FORBIDDEN)))
            .isInstanceOf(EndpointDiscoveryRetryPolicy.class);
        assertThat(retryPolicies.policyFor(error(StatusCodes.NOT_FOUND, SubStatusCodes.READ_SESSION_NOT_AVAILABLE)))
            .isInstanceOf(SessionRetryPolicy.class);
        assertThat(retryPolicies.policyFor(error(StatusCodes.GONE, SubStatusCodes.PARTITION_KEY_RANGE_GONE)))
            .isInstanceOf(PartitionKeyRangeGoneRetryPolicy.class);
        assertThat(retryPolicies.policyFor(error(StatusCodes.GONE, SubStatusCodes.COMPLETING_SPLIT)))
            .isInstanceOf(PartitionKeyRangeGoneRetryPolicy.class);
        assertThat(retryPolicies.policyFor(error(StatusCodes.GONE, SubStatusCodes.COMPLETING_PARTITION_MIGRATION)))
            .isInstanceOf(PartitionKeyRangeGoneRetryPolicy.class);
        assertThat(retryPolicies.policyFor(error(StatusCodes.REQUEST_TIMEOUT, SubStatusCodes.UNKNOWN)))
            .isInstanceOf(TimeoutFailoverRetryPolicy.class);
        assertThat(retryPolicies.policyFor(error(StatusCodes.SERVICE_UNAVAILABLE, SubStatusCodes.UNKNOWN)))
            .isInstanceOf(TimeoutFailoverRetryPolicy.class);
    }

    @Test
    public void test_non_retryable_errors_have_no_policy() {
        assertThat(retryPolicies.policyFor(error(StatusCodes.BAD_REQUEST, SubStatusCodes.UNKNOWN))).isNull();
        assertThat(retryPolicies.policyFor(error(StatusCodes.FORBIDDEN, SubStatusCodes.DATABASE_ACCOUNT_NOT_FOUND))).isNull();
        assertThat(retryPolicies.policyFor(error(StatusCodes.NOT_FOUND, SubStatusCodes.UNKNOWN))).isNull();
        assertThat(retryPolicies.policyFor(error(StatusCodes.GONE, SubStatusCodes.UNKNOWN))).isNull();
        assertThat(retryPolicies.policyFor(error(StatusCodes.CONFLICT, SubStatusCodes.UNKNOWN))).isNull();
    }

    @Test
    public void test_transport_failures_are_routed_by_error_code() {
        assertThat(retryPolicies.policyFor(ErrorResponseException.transportFailure("ETIMEDOUT", "timed out")))
            .isInstanceOf(TimeoutFailoverRetryPolicy.class);
        assertThat(retryPolicies.policyFor(ErrorResponseException.transportFailure("ECONNREFUSED", "refused")))
            .isInstanceOf(DefaultRetryPolicy.class);
    }

    @Test
    public void test_exceeded_request_unit_cap_is_never_retried() {
        RUCapPerOperationExceededException error = new RUCapPerOperationExceededException(12.0, 10.0, null);

        assertThat(retryPolicies.policyFor(error)).isNull();
        assertThat(retryPolicies.shouldRetry(error, RetryPolicyTestSupport.requestNode(), new RetryContext(), null).join())
            .isEqualTo(RetryDecision.DO_NOT_RETRY);
    }

    @Test
    public void test_attempt_counts_are_kept_across_errors() {
        ErrorResponseException throttled = new ErrorResponseException(
            StatusCodes.TOO_MANY_REQUESTS,
            SubStatusCodes.UNKNOWN,
            Map.of(HttpHeaders.RETRY_AFTER_IN_MS, "1"),
            null
        );
        RetryContext retryContext = new RetryContext();
        for (int i = 0; i < RetryOptions.DEFAULT.maxRetryAttemptCount(); i++) {
            assertThat(retryPolicies.shouldRetry(throttled, RetryPolicyTestSupport.requestNode(), retryContext, null).join()
                .shouldRetry()).isTrue();
        }
        assertThat(retryPolicies.shouldRetry(throttled, RetryPolicyTestSupport.requestNode(), retryContext, null).join())
            .isEqualTo(RetryDecision.DO_NOT_RETRY);
    }
}
