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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import io.docq.common.TimeSource;
import io.docq.data.CompositeExecutionContext;
import io.docq.data.ExecutionContext;
import io.docq.data.QueryOperationOptions;
import io.docq.data.RUConsumedManager;
import io.docq.data.Response;
import io.docq.diagnostics.ClientConfigDiagnostic;
import io.docq.diagnostics.DiagnosticLevel;
import io.docq.diagnostics.DiagnosticNodeInternal;
import io.docq.diagnostics.DiagnosticNodeType;
import io.docq.execution.engine.groupby.GroupByEndpointComponent;
import io.docq.planner.QueryInfo;

/**
 * Runs a query over the execution contexts of the partitions it targets.
 *
 * Stages are stacked in this order, each one only if the query needs it:
 * <pre>
 *     partitions -> group by -> offset/limit
 * </pre>
 *
 * Every {@link #fetchNextPage()} is a separate operation: it gets its own
 * {@link DiagnosticNodeType#CLIENT_REQUEST_NODE} root and its own request unit budget.
 */
public class QueryPipeline {

    private static final Logger LOGGER = LogManager.getLogger(QueryPipeline.class);

    private final ExecutionContext<Map<String, Object>> endpoint;
    private final QueryOperationOptions operationOptions;
    private final DiagnosticLevel diagnosticLevel;
    private final TimeSource timeSource;
    @Nullable
    private final ClientConfigDiagnostic clientConfig;

    public QueryPipeline(List<? extends ExecutionContext<Map<String, Object>>> partitionSources,
                         QueryInfo queryInfo,
                         QueryOperationOptions operationOptions,
                         DiagnosticLevel diagnosticLevel) {
        this(partitionSources, queryInfo, operationOptions, diagnosticLevel, TimeSource.SYSTEM, null);
    }

    public QueryPipeline(List<? extends ExecutionContext<Map<String, Object>>> partitionSources,
                         QueryInfo queryInfo,
                         QueryOperationOptions operationOptions,
                         DiagnosticLevel diagnosticLevel,
                         TimeSource timeSource,
                         @Nullable ClientConfigDiagnostic clientConfig) {
        ExecutionContext<Map<String, Object>> context = new CompositeExecutionContext<>(partitionSources);
        if (queryInfo.hasGroupBy()) {
            context = new GroupByEndpointComponent(context, queryInfo);
        }
        if (queryInfo.hasOffsetOrLimit()) {
            context = new OffsetLimitEndpointComponent<>(
                context,
                queryInfo.offset() == null ? 0 : queryInfo.offset(),
                queryInfo.limit() == null ? Integer.MAX_VALUE : queryInfo.limit()
            );
        }
        this.endpoint = context;
        this.operationOptions = operationOptions;
        this.diagnosticLevel = diagnosticLevel;
        this.timeSource = timeSource;
        this.clientConfig = clientConfig;
    }

    public boolean hasMoreResults() {
        return endpoint.hasMoreResults();
    }

    /**
     * Fetches up to {@link QueryOperationOptions#maxItemCount()} results.
     * Errors, including an exceeded request unit cap, complete the future exceptionally.
     */
    public CompletableFuture<FeedPage<Map<String, Object>>> fetchNextPage() {
        DiagnosticNodeInternal rootNode = new DiagnosticNodeInternal(
            diagnosticLevel,
            DiagnosticNodeType.CLIENT_REQUEST_NODE,
            timeSource
        );
        return endpoint.fetchMore(rootNode, operationOptions, new RUConsumedManager())
            .whenComplete((page, err) -> rootNode.updateTimestamp())
            .thenApply(page -> toFeedPage(rootNode, page));
    }

    private FeedPage<Map<String, Object>> toFeedPage(DiagnosticNodeInternal rootNode,
                                                    Response<List<Map<String, Object>>> page) {
        List<Map<String, Object>> resources = page.result() == null ? List.of() : page.result();
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Fetched page with {} results, requestCharge={}", resources.size(), page.headers().requestCharge());
        }
        return new FeedPage<>(resources, page.headers(), rootNode.toDiagnostic(clientConfig), endpoint.hasMoreResults());
    }
}
