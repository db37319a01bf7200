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

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import org.jetbrains.annotations.Nullable;

import io.docq.diagnostics.DiagnosticNodeInternal;
import io.docq.exceptions.ErrorResponseException;
import io.docq.exceptions.RUCapPerOperationExceededException;
import io.docq.transport.OperationType;
import io.docq.transport.ResourceType;
import io.docq.transport.StatusCodes;
import io.docq.transport.SubStatusCodes;

/**
 * The retry policies of a single request. Each error is routed to the policy responsible for it;
 * the policies keep their attempt counts for the lifetime of this instance.
 *
 * An exceeded request unit cap is never retried.
 */
public class RetryPolicies {

    /**
     * Data key of the diagnostic node of a request, naming the policy that decided to retry it.
     */
    public static final String SUCCESSFUL_RETRY_POLICY = "successfulRetryPolicy";

    static final Set<String> TIMEOUT_ERROR_CODES = Set.of("ETIMEDOUT", "ESOCKETTIMEDOUT");

    private final ResourceThrottleRetryPolicy resourceThrottleRetryPolicy;
    private final EndpointDiscoveryRetryPolicy endpointDiscoveryRetryPolicy;
    private final SessionRetryPolicy sessionRetryPolicy;
    private final PartitionKeyRangeGoneRetryPolicy partitionKeyRangeGoneRetryPolicy;
    private final TimeoutFailoverRetryPolicy timeoutFailoverRetryPolicy;
    private final DefaultRetryPolicy defaultRetryPolicy;

    public RetryPolicies(EndpointManager endpointManager,
                         ResourceType resourceType,
                         OperationType operationType,
                         RetryOptions retryOptions,
                         Function<DiagnosticNodeInternal, CompletableFuture<Void>> routingMapRefresher) {
        this.resourceThrottleRetryPolicy = new ResourceThrottleRetryPolicy(retryOptions);
        this.endpointDiscoveryRetryPolicy = new EndpointDiscoveryRetryPolicy(endpointManager, resourceType, operationType);
        this.sessionRetryPolicy = new SessionRetryPolicy(endpointManager, resourceType, operationType);
        this.partitionKeyRangeGoneRetryPolicy = new PartitionKeyRangeGoneRetryPolicy(routingMapRefresher);
        this.timeoutFailoverRetryPolicy = new TimeoutFailoverRetryPolicy(endpointManager, resourceType, operationType);
        this.defaultRetryPolicy = new DefaultRetryPolicy(operationType);
    }

    /**
     * @return the policy responsible for {@code error}, null if the error isn't retryable
     */
    @Nullable
    public RetryPolicy policyFor(ErrorResponseException error) {
        if (error instanceof RUCapPerOperationExceededException) {
            return null;
        }
        int subStatusCode = error.subStatusCode();
        return switch (error.statusCode()) {
            case StatusCodes.TOO_MANY_REQUESTS -> resourceThrottleRetryPolicy;
            case StatusCodes.FORBIDDEN -> subStatusCode == SubStatusCodes.WRITE_FORBIDDEN
                ? endpointDiscoveryRetryPolicy
                : null;
            case StatusCodes.NOT_FOUND -> subStatusCode == SubStatusCodes.READ_SESSION_NOT_AVAILABLE
                ? sessionRetryPolicy
                : null;
            case StatusCodes.GONE -> isPartitionKeyRangeGone(subStatusCode)
                ? partitionKeyRangeGoneRetryPolicy
                : null;
            case StatusCodes.REQUEST_TIMEOUT, StatusCodes.SERVICE_UNAVAILABLE -> timeoutFailoverRetryPolicy;
            case StatusCodes.TRANSPORT_FAILURE -> isTimeout(error.transportErrorCode())
                ? timeoutFailoverRetryPolicy
                : defaultRetryPolicy;
            default -> null;
        };
    }

    public CompletableFuture<RetryDecision> shouldRetry(ErrorResponseException error,
                                                        DiagnosticNodeInternal diagnosticNode,
                                                        @Nullable RetryContext retryContext,
                                                        @Nullable String locationEndpoint) {
        RetryPolicy policy = policyFor(error);
        if (policy == null) {
            return CompletableFuture.completedFuture(RetryDecision.DO_NOT_RETRY);
        }
        return policy.shouldRetry(error, diagnosticNode, retryContext, locationEndpoint);
    }

    private static boolean isTimeout(@Nullable String transportErrorCode) {
        return transportErrorCode != null && TIMEOUT_ERROR_CODES.contains(transportErrorCode);
    }

    private static boolean isPartitionKeyRangeGone(int subStatusCode) {
        return subStatusCode == SubStatusCodes.PARTITION_KEY_RANGE_GONE
               || subStatusCode == SubStatusCodes.COMPLETING_SPLIT
               || subStatusCode == SubStatusCodes.COMPLETING_PARTITION_MIGRATION;
    }
}
