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

package io.docq.data;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

import io.docq.common.exceptions.Exceptions;
import io.docq.diagnostics.DiagnosticNodeInternal;

public final class ExecutionContexts {

    private ExecutionContexts() {
    }

    /**
     * Pulls from {@code source} until it is exhausted or {@code onResponse} returns false.
     *
     * Pulls that complete synchronously are consumed in a loop, the method only recurses on pulls that
     * are still in flight. This keeps the stack flat for sources serving many items from memory.
     *
     * @return a future completed once pulling stopped, or completed exceptionally with the first error
     *         raised by a pull or by {@code onResponse}
     */
    public static <T> CompletableFuture<Void> drain(ExecutionContext<T> source,
                                                    DiagnosticNodeInternal diagnosticNode,
                                                    QueryOperationOptions operationOptions,
                                                    RUConsumedManager ruConsumedManager,
                                                    Predicate<? super Response<T>> onResponse) {
        try {
            while (source.hasMoreResults()) {
                CompletableFuture<Response<T>> next = source.nextItem(diagnosticNode, operationOptions, ruConsumedManager);
                if (next.isDone() == false) {
                    return next.thenCompose(response -> {
                        if (onResponse.test(response)) {
                            return drain(source, diagnosticNode, operationOptions, ruConsumedManager, onResponse);
                        }
                        return CompletableFuture.completedFuture(null);
                    });
                }
                if (onResponse.test(next.join()) == false) {
                    return CompletableFuture.completedFuture(null);
                }
            }
            return CompletableFuture.completedFuture(null);
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(Exceptions.unwrap(t));
        }
    }

    static <T> CompletableFuture<Response<List<T>>> fetchMore(ExecutionContext<T> source,
                                                             DiagnosticNodeInternal diagnosticNode,
                                                             QueryOperationOptions operationOptions,
                                                             RUConsumedManager ruConsumedManager) {
        int maxItemCount = operationOptions.maxItemCount();
        List<T> items = new ArrayList<>(Math.min(maxItemCount, QueryOperationOptions.DEFAULT_MAX_ITEM_COUNT));
        QueryHeaders headers = QueryHeaders.initial();
        return drain(source, diagnosticNode, operationOptions, ruConsumedManager, response -> {
            headers.merge(response.headers());
            if (response.result() != null) {
                items.add(response.result());
            }
            return items.size() < maxItemCount;
        }).thenApply(ignored -> new Response<>(items, headers));
    }
}
