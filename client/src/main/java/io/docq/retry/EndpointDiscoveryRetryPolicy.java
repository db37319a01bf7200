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
import io.docq.concurrent.CompletableFutures;
import io.docq.diagnostics.DiagnosticNodeInternal;
import io.docq.exceptions.ErrorResponseException;
import io.docq.transport.OperationType;
import io.docq.transport.ResourceType;

/**
 * Handles writes rejected by a region that no longer accepts them (403 / write forbidden).
 * The region is marked unavailable and the request is retried on the endpoint resolved afterwards.
 */
public class EndpointDiscoveryRetryPolicy implements RetryPolicy {

    private static final Logger LOGGER = LogManager.getLogger(EndpointDiscoveryRetryPolicy.class);

    static final int MAX_TRIES = 120;
    static final TimeValue RETRY_AFTER = TimeValue.timeValueMillis(1000);

    private final EndpointManager endpointManager;
    private final ResourceType resourceType;
    private final OperationType operationType;
    private int currentRetryAttemptCount = 0;

    public EndpointDiscoveryRetryPolicy(EndpointManager endpointManager,
                                        ResourceType resourceType,
                                        OperationType operationType) {
        this.endpointManager = endpointManager;
        this.resourceType = resourceType;
        this.operationType = operationType;
    }

    @Override
    public TimeValue retryAfter() {
        return RETRY_AFTER;
    }

    @Override
    public CompletableFuture<RetryDecision> shouldRetry(ErrorResponseException error,
                                                        DiagnosticNodeInternal diagnosticNode,
                                                        @Nullable RetryContext retryContext,
                                                        @Nullable String locationEndpoint) {
        if (locationEndpoint == null
            || endpointManager.enableEndpointDiscovery() == false
            || currentRetryAttemptCount >= MAX_TRIES) {
            return CompletableFuture.completedFuture(RetryDecision.DO_NOT_RETRY);
        }
        currentRetryAttemptCount++;
        int attempt = currentRetryAttemptCount;
        return CompletableFutures.composeSafely(() -> markUnavailable(diagnosticNode, locationEndpoint))
            .thenCompose(ignored -> endpointManager.resolveServiceEndpoint(diagnosticNode, resourceType, operationType))
            .thenApply(endpoint -> {
                if (retryContext != null) {
                    retryContext.retryCount(attempt);
                    retryContext.clearSessionTokenNotAvailable(false);
                    retryContext.retryRequestOnPreferredLocations(false);
                    retryContext.addTriedEndpoint(locationEndpoint);
                }
                diagnosticNode.recordEndpointResolution(endpoint);
                diagnosticNode.addData(Map.of(RetryPolicies.SUCCESSFUL_RETRY_POLICY, "endpointDiscovery"));
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Write forbidden on endpoint={}, retrying on endpoint={}, attempt={}",
                        locationEndpoint, endpoint, attempt);
                }
                if (endpoint.equals(locationEndpoint)) {
                    return RetryDecision.retry(RETRY_AFTER);
                }
                return RetryDecision.retryOn(endpoint, RETRY_AFTER);
            });
    }

    private CompletableFuture<Void> markUnavailable(DiagnosticNodeInternal diagnosticNode, String locationEndpoint) {
        if (operationType.isReadOnly()) {
            return endpointManager.markCurrentLocationUnavailableForRead(diagnosticNode, locationEndpoint);
        }
        return endpointManager.markCurrentLocationUnavailableForWrite(diagnosticNode, locationEndpoint);
    }
}
