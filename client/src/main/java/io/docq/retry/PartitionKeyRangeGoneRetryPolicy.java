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
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import io.docq.common.exceptions.Exceptions;
import io.docq.common.unit.TimeValue;
import io.docq.diagnostics.DiagnosticNodeInternal;
import io.docq.diagnostics.MetadataDiagnostics;
import io.docq.diagnostics.MetadataLookupType;
import io.docq.exceptions.ErrorResponseException;

/**
 * Handles requests routed with a stale partition key range (410 after a split or migration).
 * The routing map is refreshed and the request retried once.
 */
public class PartitionKeyRangeGoneRetryPolicy implements RetryPolicy {

    private static final Logger LOGGER = LogManager.getLogger(PartitionKeyRangeGoneRetryPolicy.class);

    static final int MAX_RETRIES = 1;

    private final Function<DiagnosticNodeInternal, CompletableFuture<Void>> routingMapRefresher;
    private int retries = 0;

    /**
     * @param routingMapRefresher reloads the partition key ranges, recording its network calls into the given node
     */
    public PartitionKeyRangeGoneRetryPolicy(Function<DiagnosticNodeInternal, CompletableFuture<Void>> routingMapRefresher) {
        this.routingMapRefresher = routingMapRefresher;
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
        if (retries >= MAX_RETRIES) {
            return CompletableFuture.completedFuture(RetryDecision.DO_NOT_RETRY);
        }
        retries++;
        return MetadataDiagnostics.withMetadataDiagnostics(
                routingMapRefresher,
                diagnosticNode,
                MetadataLookupType.PARTITION_KEY_RANGE_LOOKUP)
            .handle((ignored, err) -> {
                if (err != null) {
                    LOGGER.warn("Couldn't refresh partition key ranges, not retrying request: {}",
                        Exceptions.messageOf(Exceptions.unwrap(err)));
                    return RetryDecision.DO_NOT_RETRY;
                }
                if (retryContext != null) {
                    retryContext.incrementRetryCount();
                }
                diagnosticNode.addData(Map.of(RetryPolicies.SUCCESSFUL_RETRY_POLICY, "partitionKeyRangeGone"));
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Partition key range gone, subStatusCode={}, retrying after routing map refresh",
                        error.subStatusCode());
                }
                return RetryDecision.retry(TimeValue.ZERO);
            });
    }
}
