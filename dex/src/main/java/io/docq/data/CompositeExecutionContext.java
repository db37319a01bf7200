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
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import io.docq.concurrent.CompletableFutures;
import io.docq.diagnostics.ChildNode;
import io.docq.diagnostics.DiagnosticLevel;
import io.docq.diagnostics.DiagnosticNodeInternal;
import io.docq.diagnostics.DiagnosticNodeType;

/**
 * Execution context backed by one execution context per partition.
 * <p>
 * It consumes each source to its end before pulling from the next one, so items of different
 * partitions are not interleaved. Which partitions take part is decided by the caller.
 * <p>
 * The pulls of each source are recorded under one {@link DiagnosticNodeType#PARALLEL_QUERY_NODE}
 * child node per source.
 */
public class CompositeExecutionContext<T> implements ExecutionContext<T> {

    private final List<? extends ExecutionContext<T>> sources;
    private final ChildNode[] sourceNodes;
    private final DiagnosticNodeInternal[] sourceNodeParents;
    private int idx = 0;

    public CompositeExecutionContext(List<? extends ExecutionContext<T>> sources) {
        assert sources.isEmpty() == false : "Must have at least 1 source";
        this.sources = List.copyOf(sources);
        this.sourceNodes = new ChildNode[sources.size()];
        this.sourceNodeParents = new DiagnosticNodeInternal[sources.size()];
    }

    @Override
    public CompletableFuture<Response<T>> nextItem(DiagnosticNodeInternal diagnosticNode,
                                                   QueryOperationOptions operationOptions,
                                                   RUConsumedManager ruConsumedManager) {
        skipExhausted();
        if (idx >= sources.size()) {
            return CompletableFuture.completedFuture(Response.empty());
        }
        int sourceIdx = idx;
        ExecutionContext<T> source = sources.get(sourceIdx);
        ChildNode node = sourceNode(sourceIdx, diagnosticNode);
        return CompletableFutures.composeSafely(() -> source.nextItem(node.node(), operationOptions, ruConsumedManager))
            .whenComplete((response, err) -> {
                if (err != null || source.hasMoreResults() == false) {
                    node.finish();
                }
            });
    }

    private ChildNode sourceNode(int sourceIdx, DiagnosticNodeInternal diagnosticNode) {
        ChildNode node = sourceNodes[sourceIdx];
        // pulls issued for another operation, e.g. the next page, get their own node
        if (node == null || sourceNodeParents[sourceIdx] != diagnosticNode) {
            if (node != null) {
                node.finish();
            }
            node = diagnosticNode.initializeChildNode(
                DiagnosticNodeType.PARALLEL_QUERY_NODE,
                DiagnosticLevel.DEBUG,
                Map.of("sourceIndex", sourceIdx)
            );
            sourceNodes[sourceIdx] = node;
            sourceNodeParents[sourceIdx] = diagnosticNode;
        }
        return node;
    }

    private void skipExhausted() {
        while (idx < sources.size() && sources.get(idx).hasMoreResults() == false) {
            idx++;
        }
    }

    @Override
    public boolean hasMoreResults() {
        for (int i = idx; i < sources.size(); i++) {
            if (sources.get(i).hasMoreResults()) {
                return true;
            }
        }
        return false;
    }
}
