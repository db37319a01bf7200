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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import io.docq.common.unit.TimeValue;
import io.docq.concurrent.CompletableFutures;
import io.docq.diagnostics.DiagnosticNodeInternal;
import io.docq.exceptions.ErrorResponseException;
import io.docq.transport.OperationType;
import io.docq.transport.ResourceType;

/**
 * Fails requests over to the next region after a timeout or an unavailable service (408, 503).
 *
 * Only reads are failed over, or writes if the account accepts writes in multiple regions; a write
 * that timed out may have been applied. Each region is tried at most once per request.
 */
public class TimeoutFailoverRetryPolicy implements RetryPolicy {

    private static final Logger LOGGER = LogManager.getLogger(TimeoutFailoverRetryPolicy.class);

    static final int MAX_RETRY_ATTEMPT_COUNT = 120;

    private final EndpointManager endpointManager;
    private final ResourceType resourceType;
    private final OperationType operationType;
    private int failoverRetryCount = 0;

    public TimeoutFailoverRetryPolicy(EndpointManager endpointManager,
                                      ResourceType resourceType,
                                      OperationType operationType) {
        this.endpointManager = endpointManager;
        this.resourceType = resourceType;
        this.operationType = operationType;
    }

    @Override
    public TimeValue retryAfter() {
        return TimeValue.ZERO;
    }

    @Override
    public CompletableFuture<RetryDecision> shouldRetry(ErrorResponseException error,
                                                        DiagnosticNodeInternal diagnosticNode,
                                                        @Nullable RetryContext retryContext,
                                                        @Nullable String locationEndpoint) {
        if (retryContext == null
            || locationEndpoint == null
            || endpointManager.enableEndpointDiscovery() == false
            || failoverRetryCount >= MAX_RETRY_ATTEMPT_COUNT) {
            return CompletableFuture.completedFuture(RetryDecision.DO_NOT_RETRY);
        }
        boolean readOnly = operationType.isReadOnly();
        if (readOnly == false && endpointManager.canUseMultipleWriteLocations(resourceType, operationType) == false) {
            return CompletableFuture.completedFuture(RetryDecision.DO_NOT_RETRY);
        }
        retryContext.addTriedEndpoint(locationEndpoint);
        String nextEndpoint = nextEndpoint(
            readOnly ? endpointManager.readEndpoints() : endpointManager.writeEndpoints(),
            retryContext.triedEndpoints()
        );
        if (nextEndpoint == null) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("No endpoint left to fail over to, tried={}", retryContext.triedEndpoints());
            }
            return CompletableFuture.completedFuture(RetryDecision.DO_NOT_RETRY);
        }
        failoverRetryCount++;
        int attempt = failoverRetryCount;
        return CompletableFutures.composeSafely(() -> readOnly
                ? endpointManager.markCurrentLocationUnavailableForRead(diagnosticNode, locationEndpoint)
                : endpointManager.markCurrentLocationUnavailableForWrite(diagnosticNode, locationEndpoint))
            .thenApply(ignored -> {
                retryContext.retryCount(attempt);
                retryContext.retryRequestOnPreferredLocations(false);
                diagnosticNode.recordEndpointResolution(nextEndpoint);
                diagnosticNode.addData(Map.of(RetryPolicies.SUCCESSFUL_RETRY_POLICY, "timeoutFailover"));
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Failing over from endpoint={} to endpoint={}, statusCode={}, attempt={}",
                        locationEndpoint, nextEndpoint, error.statusCode(), attempt);
                }
                return RetryDecision.retryOn(nextEndpoint, TimeValue.ZERO);
            });
    }

    @Nullable
    private static String nextEndpoint(List<String> endpoints, List<String> triedEndpoints) {
        for (String endpoint : endpoints) {
            if (triedEndpoints.contains(endpoint) == false) {
                return endpoint;
            }
        }
        return null;
    }
}
