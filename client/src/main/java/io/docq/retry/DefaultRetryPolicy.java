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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import io.docq.common.unit.TimeValue;
import io.docq.diagnostics.DiagnosticNodeInternal;
import io.docq.exceptions.ErrorResponseException;
import io.docq.transport.OperationType;

/**
 * Retries reads that failed with a transient connection error on the same endpoint.
 * Timeouts are failed over to another region instead, see {@link TimeoutFailoverRetryPolicy}.
 */
public class DefaultRetryPolicy implements RetryPolicy {

    private static final Logger LOGGER = LogManager.getLogger(DefaultRetryPolicy.class);

    static final int MAX_TRIES = 10;
    static final TimeValue RETRY_AFTER = TimeValue.timeValueMillis(1000);

    static final Set<String> CONNECTION_ERROR_CODES = Set.of(
        "ECONNRESET",
        "ECONNREFUSED",
        "ENOTFOUND",
        "EPIPE",
        "EHOSTUNREACH",
        "ENETUNREACH",
        "ENETDOWN",
        "EAI_AGAIN",
        "ECONNABORTED"
    );

    private final OperationType operationType;
    private int currentRetryAttemptCount = 0;

    public DefaultRetryPolicy(OperationType operationType) {
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
        if (currentRetryAttemptCount < MAX_TRIES && needsRetry(error)) {
            currentRetryAttemptCount++;
            if (retryContext != null) {
                retryContext.retryCount(currentRetryAttemptCount);
            }
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Retrying request after connection error={}, attempt={}",
                    error.transportErrorCode(), currentRetryAttemptCount);
            }
            return CompletableFuture.completedFuture(RetryDecision.retry(RETRY_AFTER));
        }
        return CompletableFuture.completedFuture(RetryDecision.DO_NOT_RETRY);
    }

    private boolean needsRetry(ErrorResponseException error) {
        String code = error.transportErrorCode();
        return operationType.isReadOnly() && code != null && CONNECTION_ERROR_CODES.contains(code);
    }
}
