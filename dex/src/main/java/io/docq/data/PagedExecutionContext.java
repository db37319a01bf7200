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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import io.docq.concurrent.CompletableFutures;
import io.docq.diagnostics.ChildNode;
import io.docq.diagnostics.DiagnosticLevel;
import io.docq.diagnostics.DiagnosticNodeType;
import io.docq.diagnostics.DiagnosticNodeInternal;
import io.docq.exceptions.RUCapPerOperationExceededException;

/**
 * Execution context over a paginated service query. Pages are fetched on demand, following the
 * continuation header, and served one item per pull.
 *
 * The headers of a fetched page are returned with the first item of that page, pulls served from
 * the buffered page return initial headers.
 *
 * Every fetch is recorded under a {@link DiagnosticNodeType#DEFAULT_QUERY_NODE} child node and charged
 * against the request unit cap of the operation, if one is configured.
 */
public class PagedExecutionContext<T> implements ExecutionContext<T> {

    private static final Logger LOGGER = LogManager.getLogger(PagedExecutionContext.class);

    private final FetchFunction<T> fetchFunction;

    private List<T> buffer = List.of();
    private int idx = 0;
    @Nullable
    private String continuationToken;
    private boolean started = false;

    public PagedExecutionContext(FetchFunction<T> fetchFunction) {
        this.fetchFunction = fetchFunction;
    }

    @Override
    public CompletableFuture<Response<T>> nextItem(DiagnosticNodeInternal diagnosticNode,
                                                   QueryOperationOptions operationOptions,
                                                   RUConsumedManager ruConsumedManager) {
        if (idx < buffer.size()) {
            return CompletableFuture.completedFuture(new Response<>(buffer.get(idx++), QueryHeaders.initial()));
        }
        if (hasMoreResults() == false) {
            return CompletableFuture.completedFuture(Response.empty());
        }
        return fetchPage(diagnosticNode, operationOptions, ruConsumedManager).thenApply(headers -> {
            if (idx < buffer.size()) {
                return new Response<>(buffer.get(idx++), headers);
            }
            return new Response<>(null, headers);
        });
    }

    private CompletableFuture<QueryHeaders> fetchPage(DiagnosticNodeInternal diagnosticNode,
                                                      QueryOperationOptions operationOptions,
                                                      RUConsumedManager ruConsumedManager) {
        if (operationOptions.hasRuCap() && ruConsumedManager.getRUConsumed() > operationOptions.ruCapPerOperation()) {
            return CompletableFuture.failedFuture(new RUCapPerOperationExceededException(
                ruConsumedManager.getRUConsumed(),
                operationOptions.ruCapPerOperation(),
                List.of()
            ));
        }
        ChildNode child = diagnosticNode.initializeChildNode(DiagnosticNodeType.DEFAULT_QUERY_NODE, DiagnosticLevel.DEBUG);
        return CompletableFutures.composeSafely(() -> fetchFunction.fetch(child.node(), continuationToken))
            .thenApply(page -> onPage(child.node(), page, operationOptions, ruConsumedManager))
            .whenComplete((headers, err) -> child.finish());
    }

    private QueryHeaders onPage(DiagnosticNodeInternal node,
                                Response<List<T>> page,
                                QueryOperationOptions operationOptions,
                                RUConsumedManager ruConsumedManager) {
        List<T> items = page.result() == null ? List.of() : page.result();
        node.recordQueryResult(items, DiagnosticLevel.DEBUG);
        started = true;
        continuationToken = page.headers().continuation();
        buffer = items;
        idx = 0;

        double consumed = ruConsumedManager.addToRUConsumed(page.headers().requestCharge());
        if (operationOptions.hasRuCap() && consumed > operationOptions.ruCapPerOperation()) {
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Request unit cap exceeded, consumed={} cap={}", consumed, operationOptions.ruCapPerOperation());
            }
            // the fetched items are handed out with the error
            idx = buffer.size();
            throw new RUCapPerOperationExceededException(
                consumed,
                operationOptions.ruCapPerOperation(),
                new ArrayList<>(items)
            );
        }
        return page.headers();
    }

    @Override
    public boolean hasMoreResults() {
        return started == false || continuationToken != null || idx < buffer.size();
    }
}
