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

import java.util.List;
import java.util.concurrent.CompletableFuture;

import io.docq.diagnostics.DiagnosticNodeInternal;

/**
 * Pull based producer of query results. Stages of a query pipeline implement this interface and
 * usually wrap one or more inner execution contexts.
 *
 * A consumer pulls like this:
 *
 * <pre>
 *     while (context.hasMoreResults()) {
 *         Response&lt;T&gt; response = context.nextItem(node, options, ruConsumed).get();
 *         if (response.result() != null) {
 *             // do something with the item
 *         }
 *     }
 * </pre>
 *
 * A pull may complete without an item (e.g. an empty page was fetched), so only
 * {@link #hasMoreResults()} tells if the context is exhausted.
 *
 * Thread-safety notes:
 *
 * Concurrent pulls on the same execution context are not supported. The next pull may only be issued
 * once the previous one completed.
 */
public interface ExecutionContext<T> {

    /**
     * Produces the next item.
     *
     * @param diagnosticNode    node that network calls issued by this pull are recorded into
     * @param operationOptions  options of the running operation
     * @param ruConsumedManager request units consumed so far by the running operation
     * @return a future completed with the item, if any, and the headers of all network calls made for it.
     *         Errors are reported by completing the future exceptionally.
     */
    CompletableFuture<Response<T>> nextItem(DiagnosticNodeInternal diagnosticNode,
                                            QueryOperationOptions operationOptions,
                                            RUConsumedManager ruConsumedManager);

    /**
     * @return false once no further pull can produce an item
     */
    boolean hasMoreResults();

    default CompletableFuture<Response<T>> nextItem(DiagnosticNodeInternal diagnosticNode) {
        return nextItem(diagnosticNode, QueryOperationOptions.DEFAULT, new RUConsumedManager());
    }

    /**
     * Pulls items until {@link QueryOperationOptions#maxItemCount()} items were collected or the context is
     * exhausted. The headers of all pulls are merged into the headers of the returned page.
     */
    default CompletableFuture<Response<List<T>>> fetchMore(DiagnosticNodeInternal diagnosticNode,
                                                           QueryOperationOptions operationOptions,
                                                           RUConsumedManager ruConsumedManager) {
        return ExecutionContexts.fetchMore(this, diagnosticNode, operationOptions, ruConsumedManager);
    }
}
