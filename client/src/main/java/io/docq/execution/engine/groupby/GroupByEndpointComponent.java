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

package io.docq.execution.engine.groupby;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import io.docq.common.exceptions.Exceptions;
import io.docq.data.ExecutionContext;
import io.docq.data.ExecutionContexts;
import io.docq.data.QueryHeaders;
import io.docq.data.QueryOperationOptions;
import io.docq.data.RUConsumedManager;
import io.docq.data.Response;
import io.docq.diagnostics.DiagnosticNodeInternal;
import io.docq.exceptions.RUCapPerOperationExceededException;
import io.docq.execution.engine.aggregation.AggregatePayloads;
import io.docq.execution.engine.aggregation.Aggregator;
import io.docq.execution.engine.aggregation.Aggregators;
import io.docq.planner.AggregateType;
import io.docq.planner.QueryInfo;

/**
 * Execution context that merges the per partition results of a GROUP BY query.
 *
 * Rows of the inner context look like:
 *
 * <pre>
 *     {
 *         "groupByItems": [{"item": "A"}],
 *         "payload": {"k": "A", "total": {"item": 3}}
 *     }
 * </pre>
 *
 * The first pull drains the inner context, feeding every payload field into the aggregator of its group.
 * Once the inner context is exhausted each group is materialized into a single row and the rows are
 * returned one per pull, in no particular order.
 */
public class GroupByEndpointComponent implements ExecutionContext<Map<String, Object>> {

    private static final Logger LOGGER = LogManager.getLogger(GroupByEndpointComponent.class);

    static final String GROUP_BY_ITEMS = "groupByItems";
    static final String PAYLOAD = "payload";

    private final ExecutionContext<Map<String, Object>> executionContext;
    private final QueryInfo queryInfo;
    private final Map<String, Map<String, Aggregator>> groupings = new LinkedHashMap<>();
    private final Deque<Map<String, Object>> aggregateResults = new ArrayDeque<>();
    private boolean completed = false;

    public GroupByEndpointComponent(ExecutionContext<Map<String, Object>> executionContext, QueryInfo queryInfo) {
        this.executionContext = executionContext;
        this.queryInfo = queryInfo;
    }

    @Override
    public CompletableFuture<Response<Map<String, Object>>> nextItem(DiagnosticNodeInternal diagnosticNode,
                                                                     QueryOperationOptions operationOptions,
                                                                     RUConsumedManager ruConsumedManager) {
        if (aggregateResults.isEmpty() == false) {
            return CompletableFuture.completedFuture(new Response<>(aggregateResults.pop(), QueryHeaders.initial()));
        }
        if (completed) {
            return CompletableFuture.completedFuture(Response.empty());
        }
        QueryHeaders aggregateHeaders = QueryHeaders.initial();
        return ExecutionContexts.drain(executionContext, diagnosticNode, operationOptions, ruConsumedManager, response -> {
                aggregateHeaders.merge(response.headers());
                if (response.result() != null) {
                    accumulate(response.result());
                }
                return true;
            })
            .whenComplete((ignored, err) -> {
                if (err != null
                    && Exceptions.unwrap(err) instanceof RUCapPerOperationExceededException ruCapExceeded) {
                    // partial groups must not reach the caller
                    ruCapExceeded.discardFetchedResults();
                }
            })
            .thenApply(ignored -> {
                materialize();
                completed = true;
                return new Response<>(aggregateResults.poll(), aggregateHeaders);
            });
    }

    @Override
    public boolean hasMoreResults() {
        return executionContext.hasMoreResults() || aggregateResults.isEmpty() == false;
    }

    @SuppressWarnings("unchecked")
    private void accumulate(Map<String, Object> row) {
        String group = GroupIdentity.of(row.get(GROUP_BY_ITEMS));
        Object payloadValue = row.get(PAYLOAD);
        Map<String, Object> payload = payloadValue instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
        Map<String, Aggregator> aggregators = groupings.computeIfAbsent(group, ignored -> new LinkedHashMap<>());
        for (Map.Entry<String, Object> field : payload.entrySet()) {
            String alias = field.getKey();
            AggregateType aggregateType = queryInfo.aggregateType(alias);
            Aggregator aggregator = aggregators.computeIfAbsent(alias, ignored -> Aggregators.create(aggregateType));
            aggregator.aggregate(partialResult(aggregateType, field.getValue()));
        }
    }

    @Nullable
    private static Object partialResult(@Nullable AggregateType aggregateType, @Nullable Object value) {
        if (aggregateType == null) {
            return value;
        }
        return AggregatePayloads.extract(value == null ? AggregatePayloads.NULL_PAYLOAD : value);
    }

    private void materialize() {
        for (Map<String, Aggregator> aggregators : groupings.values()) {
            Map<String, Object> groupResult = new LinkedHashMap<>();
            for (Map.Entry<String, Aggregator> entry : aggregators.entrySet()) {
                groupResult.put(entry.getKey(), entry.getValue().getResult());
            }
            aggregateResults.push(groupResult);
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Group by source exhausted, materialized {} groups", groupings.size());
        }
        groupings.clear();
    }
}
