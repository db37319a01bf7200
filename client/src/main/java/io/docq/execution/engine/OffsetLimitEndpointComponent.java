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

package io.docq.execution.engine;

import java.util.concurrent.CompletableFuture;

import io.docq.data.ExecutionContext;
import io.docq.data.ExecutionContexts;
import io.docq.data.QueryHeaders;
import io.docq.data.QueryOperationOptions;
import io.docq.data.RUConsumedManager;
import io.docq.data.Response;
import io.docq.diagnostics.DiagnosticNodeInternal;

/**
 * Skips the first {@code offset} items of the inner context and returns at most {@code limit} items after that.
 * Pulls that don't produce an item count neither against the offset nor against the limit.
 */
public class OffsetLimitEndpointComponent<T> implements ExecutionContext<T> {

    private final ExecutionContext<T> executionContext;
    private int offset;
    private int limit;

    public OffsetLimitEndpointComponent(ExecutionContext<T> executionContext, int offset, int limit) {
        if (offset < 0 || limit < 0) {
            throw new IllegalArgumentException("offset and limit must be >= 0, got: " + offset + ", " + limit);
        }
        this.executionContext = executionContext;
        this.offset = offset;
        this.limit = limit;
    }

    @Override
    public CompletableFuture<Response<T>> nextItem(DiagnosticNodeInternal diagnosticNode,
                                                   QueryOperationOptions operationOptions,
                                                   RUConsumedManager ruConsumedManager) {
        QueryHeaders aggregateHeaders = QueryHeaders.initial();
        if (offset > 0) {
            return ExecutionContexts.drain(executionContext, diagnosticNode, operationOptions, ruConsumedManager, response -> {
                    aggregateHeaders.merge(response.headers());
                    if (response.result() != null) {
                        offset--;
                    }
                    return offset > 0;
                })
                .thenCompose(ignored -> take(diagnosticNode, operationOptions, ruConsumedManager, aggregateHeaders));
        }
        return take(diagnosticNode, operationOptions, ruConsumedManager, aggregateHeaders);
    }

    private CompletableFuture<Response<T>> take(DiagnosticNodeInternal diagnosticNode,
                                                QueryOperationOptions operationOptions,
                                                RUConsumedManager ruConsumedManager,
                                                QueryHeaders aggregateHeaders) {
        if (hasMoreResults() == false) {
            return CompletableFuture.completedFuture(new Response<>(null, aggregateHeaders));
        }
        return executionContext.nextItem(diagnosticNode, operationOptions, ruConsumedManager).thenApply(response -> {
            aggregateHeaders.merge(response.headers());
            if (response.result() != null) {
                limit--;
            }
            return new Response<>(response.result(), aggregateHeaders);
        });
    }

    @Override
    public boolean hasMoreResults() {
        return limit > 0 && executionContext.hasMoreResults();
    }
}
