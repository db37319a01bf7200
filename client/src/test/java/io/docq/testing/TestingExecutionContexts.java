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

package io.docq.testing;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import io.docq.data.ExecutionContext;
import io.docq.data.FetchFunction;
import io.docq.data.PagedExecutionContext;
import io.docq.data.QueryHeaders;
import io.docq.data.QueryOperationOptions;
import io.docq.data.RUConsumedManager;
import io.docq.data.Response;
import io.docq.diagnostics.DiagnosticNodeInternal;
import io.docq.transport.HttpHeaders;

public final class TestingExecutionContexts {

    private TestingExecutionContexts() {
    }

    /**
     * A paginated context serving {@code pages}, each page charging {@code requestChargePerPage}.
     */
    public static <T> PagedExecutionContext<T> paged(double requestChargePerPage, List<List<T>> pages) {
        FetchFunction<T> fetchFunction = (diagnosticNode, continuationToken) -> {
            int pageIdx = continuationToken == null ? 0 : Integer.parseInt(continuationToken);
            QueryHeaders headers = QueryHeaders.of(Map.of(HttpHeaders.REQUEST_CHARGE, Double.toString(requestChargePerPage)));
            if (pageIdx + 1 < pages.size()) {
                headers.put(HttpHeaders.CONTINUATION, Integer.toString(pageIdx + 1));
            }
            return CompletableFuture.completedFuture(new Response<>(pages.get(pageIdx), headers));
        };
        return new PagedExecutionContext<>(fetchFunction);
    }

    /**
     * Pulls until the context is exhausted and returns all produced items.
     */
    public static <T> List<T> drainAll(ExecutionContext<T> context, DiagnosticNodeInternal node) {
        List<T> items = new ArrayList<>();
        RUConsumedManager ruConsumedManager = new RUConsumedManager();
        while (context.hasMoreResults()) {
            Response<T> response = context.nextItem(node, QueryOperationOptions.DEFAULT, ruConsumedManager).join();
            if (response.hasResult()) {
                items.add(response.result());
            }
        }
        return items;
    }
}
