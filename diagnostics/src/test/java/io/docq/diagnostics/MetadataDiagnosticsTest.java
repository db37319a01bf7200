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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.junit.Test;

public class MetadataDiagnosticsTest {

    @Test
    public void test_lookup_calls_are_merged_as_metadata_lookups() {
        DiagnosticNodeInternal parent = new DiagnosticNodeInternal(DiagnosticLevel.DEBUG, DiagnosticNodeType.CLIENT_REQUEST_NODE);

        String result = MetadataDiagnostics.withMetadataDiagnostics(node -> {
            node.diagnosticContext().recordNetworkCall(TestingRequests.record("plan", 20, 400));
            return CompletableFuture.completedFuture("plan");
        }, parent, MetadataLookupType.QUERY_PLAN_LOOKUP).join();

        assertThat(result).isEqualTo("plan");
        assertThat(parent.diagnosticContext().gatewayCallCount()).isEqualTo(0);
        assertThat(parent.diagnosticContext().metadataLookupCount()).isEqualTo(1);
        assertThat(parent.children())
            .extracting(DiagnosticNodeInternal::nodeType)
            .containsExactly(DiagnosticNodeType.METADATA_REQUEST_NODE);
    }

    @Test
    public void test_failed_lookup_is_still_merged() {
        DiagnosticNodeInternal parent = new DiagnosticNodeInternal(DiagnosticLevel.INFO, DiagnosticNodeType.CLIENT_REQUEST_NODE);

        CompletableFuture<Object> lookup = MetadataDiagnostics.withMetadataDiagnostics(node -> {
            node.diagnosticContext().recordFailedAttempt(TestingRequests.record("ranges", 5, 0), 0);
            return CompletableFuture.failedFuture(new IllegalStateException("routing map unavailable"));
        }, parent, MetadataLookupType.PARTITION_KEY_RANGE_LOOKUP);

        assertThatThrownBy(lookup::join)
            .isExactlyInstanceOf(CompletionException.class)
            .hasCauseExactlyInstanceOf(IllegalStateException.class);
        assertThat(parent.diagnosticContext().failedAttemptCount()).isEqualTo(1);
        assertThat(parent.children()).isEmpty();
    }
}
