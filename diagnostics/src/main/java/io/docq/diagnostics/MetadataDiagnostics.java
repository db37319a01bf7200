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

package io.docq.diagnostics;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import io.docq.concurrent.CompletableFutures;

public final class MetadataDiagnostics {

    private MetadataDiagnostics() {
    }

    /**
     * Runs an internal lookup, like resolving partition key ranges, under its own metadata request node.
     *
     * The lookup records into a fresh {@link DiagnosticContext}. Once it completes, successfully or not,
     * the node is finalized and merged under {@code parent} so that its network calls are counted as
     * metadata lookups of {@code type}.
     */
    public static <T> CompletableFuture<T> withMetadataDiagnostics(Function<DiagnosticNodeInternal, CompletableFuture<T>> lookup,
                                                                   DiagnosticNodeInternal parent,
                                                                   MetadataLookupType type) {
        DiagnosticNodeInternal node = new DiagnosticNodeInternal(
            parent.diagnosticLevel(),
            DiagnosticNodeType.METADATA_REQUEST_NODE,
            null,
            Map.of(),
            parent.timeSource(),
            new DiagnosticContext(parent.timeSource())
        );
        return CompletableFutures.composeSafely(() -> lookup.apply(node))
            .whenComplete((result, err) -> {
                node.updateTimestamp();
                parent.addChildNode(node, DiagnosticLevel.DEBUG, type);
            });
    }
}
