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

import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.Nullable;

import io.docq.common.unit.TimeValue;
import io.docq.diagnostics.DiagnosticNodeInternal;
import io.docq.exceptions.ErrorResponseException;

/**
 * Decides whether a failed request is retried.
 *
 * Implementations keep per request state (e.g. the number of attempts so far), so a new instance is
 * used for every request. The caller must wait for the decision before issuing the retry.
 */
public interface RetryPolicy {

    /**
     * @return the delay the caller should wait before the next retry
     */
    TimeValue retryAfter();

    /**
     * @param error            the error the request failed with
     * @param diagnosticNode   node of the failed request, a policy deciding to retry annotates it
     * @param retryContext     per request retry state, updated by the policy
     * @param locationEndpoint the endpoint the failed request was sent to
     */
    CompletableFuture<RetryDecision> shouldRetry(ErrorResponseException error,
                                                 DiagnosticNodeInternal diagnosticNode,
                                                 @Nullable RetryContext retryContext,
                                                 @Nullable String locationEndpoint);
}
