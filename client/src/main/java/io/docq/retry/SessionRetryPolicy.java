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
import io.docq.diagnostics.DiagnosticNodeInternal;
import io.docq.exceptions.ErrorResponseException;
import io.docq.transport.OperationType;
import io.docq.transport.ResourceType;

/**
 * Handles reads of a session the contacted region hasn't caught up with yet (404 / read session not available).
 *
 * With multiple write locations the request moves through the preferred regions, the session token is
 * dropped once every region was tried. Otherwise it is retried at most twice, without session token.
 */
public class SessionRetryPolicy implements RetryPolicy {

    private static final Logger LOGGER = LogManager.getLogger(SessionRetryPolicy.class);

    private final EndpointManager endpointManager;
    private final ResourceType resourceType;
    private final OperationType operationType;
    private int currentRetryAttemptCount = 0;

    public SessionRetryPolicy(EndpointManager endpointManager, ResourceType resourceType, OperationType operationType) {
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
        if (retryContext == null || endpointManager.enableEndpointDiscovery() == false) {
            return CompletableFuture.completedFuture(RetryDecision.DO_NOT_RETRY);
        }
        if (endpointManager.canUseMultipleWriteLocations(resourceType, operationType)) {
            List<String> endpoints = operationType.isReadOnly()
                ? endpointManager.readEndpoints()
                : endpointManager.writeEndpoints();
            if (currentRetryAttemptCount > endpoints.size()) {
                return CompletableFuture.completedFuture(RetryDecision.DO_NOT_RETRY);
            }
            currentRetryAttemptCount++;
            retryContext.incrementRetryCount();
            retryContext.retryRequestOnPreferredLocations(currentRetryAttemptCount > 1);
            retryContext.clearSessionTokenNotAvailable(currentRetryAttemptCount == endpoints.size());
        } else {
            if (currentRetryAttemptCount > 1) {
                return CompletableFuture.completedFuture(RetryDecision.DO_NOT_RETRY);
            }
            currentRetryAttemptCount++;
            retryContext.incrementRetryCount();
            retryContext.retryRequestOnPreferredLocations(false);
            retryContext.clearSessionTokenNotAvailable(true);
        }
        diagnosticNode.addData(Map.of(RetryPolicies.SUCCESSFUL_RETRY_POLICY, "session"));
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Retrying read of unavailable session, attempt={}, retryContext={}",
                currentRetryAttemptCount, retryContext);
        }
        return CompletableFuture.completedFuture(RetryDecision.retry(TimeValue.ZERO));
    }
}
