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

import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import io.docq.diagnostics.DiagnosticNodeInternal;

/**
 * Serves already materialized items, one per pull.
 */
public class InMemoryExecutionContext<T> implements ExecutionContext<T> {

    private final Iterator<? extends T> items;

    public static <T> InMemoryExecutionContext<T> of(List<? extends T> items) {
        return new InMemoryExecutionContext<>(items.iterator());
    }

    public InMemoryExecutionContext(Iterator<? extends T> items) {
        this.items = items;
    }

    @Override
    public CompletableFuture<Response<T>> nextItem(DiagnosticNodeInternal diagnosticNode,
                                                   QueryOperationOptions operationOptions,
                                                   RUConsumedManager ruConsumedManager) {
        if (items.hasNext()) {
            return CompletableFuture.completedFuture(new Response<>(items.next(), QueryHeaders.initial()));
        }
        return CompletableFuture.completedFuture(Response.empty());
    }

    @Override
    public boolean hasMoreResults() {
        return items.hasNext();
    }
}
