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

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.Test;

import io.docq.common.TimeSource;
import io.docq.transport.RequestContext;

public class DiagnosticNodeInternalTest {

    private final AtomicLong now = new AtomicLong(1_000L);
    private final TimeSource timeSource = now::get;

    private DiagnosticNodeInternal root(DiagnosticLevel level) {
        return new DiagnosticNodeInternal(level, DiagnosticNodeType.CLIENT_REQUEST_NODE, timeSource);
    }

    @Test
    public void test_child_is_not_created_if_level_is_not_traced() {
        DiagnosticNodeInternal root = root(DiagnosticLevel.INFO);
        ChildNode child = root.initializeChildNode(DiagnosticNodeType.DEFAULT_QUERY_NODE, DiagnosticLevel.DEBUG);

        assertThat(child.isPassthrough()).isTrue();
        assertThat(child.node()).isSameAs(root);
        assertThat(root.children()).isEmpty();
    }

    @Test
    public void test_child_shares_context_with_parent() {
        DiagnosticNodeInternal root = root(DiagnosticLevel.DEBUG);
        ChildNode child = root.initializeChildNode(
            DiagnosticNodeType.PARALLEL_QUERY_NODE,
            DiagnosticLevel.DEBUG,
            Map.of("sourceIndex", 2)
        );

        assertThat(child.created()).isTrue();
        assertThat(child.node().parent()).isSameAs(root);
        assertThat(child.node().diagnosticContext()).isSameAs(root.diagnosticContext());
        assertThat(child.node().data()).containsEntry("sourceIndex", 2);
        assertThat(root.children()).containsExactly(child.node());

        now.addAndGet(40);
        child.finish();
        assertThat(child.node().durationInMs()).isEqualTo(40L);
        assertThat(root.durationInMs()).isEqualTo(0L);
    }

    @Test
    public void test_add_data_is_ignored_at_info() {
        DiagnosticNodeInternal root = root(DiagnosticLevel.INFO);
        root.addData(Map.of("key", "value"), "message");
        root.addLog("another message");

        assertThat(root.data()).isEmpty();
    }

    @Test
    public void test_add_data_merges_and_appends_log() {
        DiagnosticNodeInternal root = root(DiagnosticLevel.DEBUG);
        root.addData(Map.of("a", 1, "b", 1));
        root.addData(Map.of("b", 2), "first");
        root.addLog("second");

        assertThat(root.data())
            .containsEntry("a", 1)
            .containsEntry("b", 2)
            .containsEntry("log", List.of("first", "second"));
    }

    @Test
    public void test_successful_call_is_counted_at_info_without_annotating_node() {
        DiagnosticNodeInternal root = root(DiagnosticLevel.INFO);
        RequestContext request = TestingRequests.queryRequest("SELECT * FROM c");
        root.recordSuccessfulNetworkCall(900L, request, TestingRequests.response(200, "act-1", "[]"), 0, request.url());

        assertThat(root.diagnosticContext().gatewayCallCount()).isEqualTo(1);
        assertThat(root.data()).isEmpty();

        GatewayRequestRecord recorded = root.diagnosticContext().getClientSideStats(now.get()).gatewayStatistics().get(0);
        assertThat(recorded.activityId()).isEqualTo("act-1");
        assertThat(recorded.durationInMs()).isEqualTo(100L);
        assertThat(recorded.requestPayloadLengthInBytes()).isEqualTo("SELECT * FROM c".length());
        assertThat(recorded.responsePayloadLengthInBytes()).isEqualTo(2);
        assertThat(recorded.partitionKeyRangeId()).isEqualTo("0");
    }

    @Test
    @SuppressWarnings("unchecked")
    public void test_headers_and_bodies_are_only_captured_at_debug_unsafe() {
        RequestContext request = TestingRequests.queryRequest("SELECT * FROM c");

        DiagnosticNodeInternal debug = root(DiagnosticLevel.DEBUG);
        debug.recordSuccessfulNetworkCall(1_000L, request, TestingRequests.response(200, "act-1", "[1]"), 0, request.url());
        Map<String, Object> requestData = (Map<String, Object>) debug.data().get("requestData");
        assertThat(requestData)
            .containsKeys("operationType", "resourceType", "requestPayloadLengthInBytes")
            .doesNotContainKeys("headers", "requestBody", "responseBody", "url");

        DiagnosticNodeInternal unsafe = root(DiagnosticLevel.DEBUG_UNSAFE);
        unsafe.recordSuccessfulNetworkCall(1_000L, request, TestingRequests.response(200, "act-1", "[1]"), 0, request.url());
        requestData = (Map<String, Object>) unsafe.data().get("requestData");
        assertThat(requestData)
            .containsEntry("requestBody", "SELECT * FROM c")
            .containsEntry("responseBody", "[1]")
            .containsEntry("url", "https://account-westeurope.example.com/dbs/db/colls/items/docs")
            .containsEntry("headers", Map.of("authorization", "secret-token"));
    }

    @Test
    public void test_failed_call_is_counted_at_every_level() {
        for (DiagnosticLevel level : DiagnosticLevel.values()) {
            DiagnosticNodeInternal root = root(level);
            root.recordFailedNetworkCall(1_000L, TestingRequests.queryRequest("q"), 0, 429, 3200, Map.of());
            root.recordFailedNetworkCall(1_000L, TestingRequests.queryRequest("q"), 1, 429, 3200, null);

            DiagnosticContext context = root.diagnosticContext();
            assertThat(context.failedAttemptCount()).as(level.label()).isEqualTo(2);
            assertThat(context.getClientSideStats(now.get()).failedAttempts())
                .extracting(FailedRequestAttempt::attemptNumber)
                .containsExactly(0, 1);
            assertThat(root.data().containsKey("failedAttempt")).isEqualTo(level != DiagnosticLevel.INFO);
        }
    }

    @Test
    public void test_endpoint_resolution_is_recorded_in_context() {
        DiagnosticNodeInternal root = root(DiagnosticLevel.DEBUG);
        root.recordEndpointResolution("https://east.example.com/");
        root.recordEndpointResolution("https://west.example.com/");
        root.recordEndpointResolution("https://east.example.com/");

        assertThat(root.data()).containsEntry("selectedLocation", "https://east.example.com/");
        assertThat(root.diagnosticContext().locationEndpointsContacted())
            .containsExactly("https://east.example.com/", "https://west.example.com/");
    }

    @Test
    public void test_query_records_read_accumulates() {
        DiagnosticNodeInternal root = root(DiagnosticLevel.DEBUG);
        root.recordQueryResult(List.of(1, 2, 3), DiagnosticLevel.DEBUG);
        root.recordQueryResult(List.of(4), DiagnosticLevel.DEBUG);
        root.recordQueryResult("not a collection", DiagnosticLevel.DEBUG);
        root.recordQueryResult(List.of(5), DiagnosticLevel.DEBUG_UNSAFE);

        assertThat(root.data()).containsEntry("queryRecordsRead", 4L);
    }

    @Test
    public void test_hidden_child_still_contributes_statistics() {
        DiagnosticNodeInternal root = root(DiagnosticLevel.INFO);
        DiagnosticNodeInternal metadataNode = new DiagnosticNodeInternal(
            DiagnosticLevel.INFO,
            DiagnosticNodeType.METADATA_REQUEST_NODE,
            null,
            Map.of(),
            timeSource,
            new DiagnosticContext(timeSource)
        );
        metadataNode.diagnosticContext().recordNetworkCall(TestingRequests.record("meta-1", 10, 200));

        root.addChildNode(metadataNode, DiagnosticLevel.DEBUG, MetadataLookupType.PARTITION_KEY_RANGE_LOOKUP);

        assertThat(root.children()).isEmpty();
        assertThat(metadataNode.parent()).isNull();
        assertThat(root.diagnosticContext().metadataLookupCount()).isEqualTo(1);
        assertThat(root.diagnosticContext().gatewayCallCount()).isEqualTo(0);
    }

    @Test
    public void test_diagnostic_tree_is_only_exported_at_debug() {
        ClientConfigDiagnostic config = new ClientConfigDiagnostic(
            "https://account.example.com/",
            null,
            "Session",
            false,
            false,
            true,
            DiagnosticLevel.DEBUG,
            "0.1.0"
        );

        DiagnosticNodeInternal infoRoot = root(DiagnosticLevel.INFO);
        infoRoot.initializeChildNode(DiagnosticNodeType.DEFAULT_QUERY_NODE, DiagnosticLevel.INFO);
        ClientDiagnostics info = infoRoot.toDiagnostic(config);
        assertThat(info.diagnosticNode()).isNull();
        assertThat(info.clientConfig()).isNull();
        assertThat(info.clientSideRequestStatistics()).isNotNull();

        DiagnosticNodeInternal debugRoot = root(DiagnosticLevel.DEBUG);
        ChildNode child = debugRoot.initializeChildNode(DiagnosticNodeType.DEFAULT_QUERY_NODE, DiagnosticLevel.DEBUG);
        ClientDiagnostics debug = child.node().toDiagnostic(config);
        assertThat(debug.clientConfig()).isEqualTo(config);
        assertThat(debug.diagnosticNode()).isNotNull();
        assertThat(debug.diagnosticNode().id()).isEqualTo(debugRoot.id());
        assertThat(debug.diagnosticNode().children())
            .extracting(DiagnosticNode::nodeType)
            .containsExactly(DiagnosticNodeType.DEFAULT_QUERY_NODE);
    }

    @Test
    public void test_exported_node_is_an_immutable_snapshot() {
        DiagnosticNodeInternal root = root(DiagnosticLevel.DEBUG);
        root.addData(Map.of("stage", "first"));
        DiagnosticNode snapshot = root.toDiagnosticNode();

        root.addData(Map.of("stage", "second"));
        root.initializeChildNode(DiagnosticNodeType.DEFAULT_QUERY_NODE, DiagnosticLevel.DEBUG);

        assertThat(snapshot.data()).containsEntry("stage", "first");
        assertThat(snapshot.children()).isEmpty();
        assertThatThrownBy(() -> snapshot.data().put("stage", "third"))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
