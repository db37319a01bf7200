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

package io.docq.retry;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;

import io.docq.diagnostics.DiagnosticNodeInternal;
import io.docq.diagnostics.DiagnosticNodeType;
import io.docq.diagnostics.GatewayRequestRecord;
import io.docq.diagnostics.MetadataLookup;
import io.docq.diagnostics.MetadataLookupType;
import io.docq.exceptions.ErrorResponseException;
import io.docq.transport.OperationType;
import io.docq.transport.ResourceType;
import io.docq.transport.StatusCodes;
import io.docq.transport.SubStatusCodes;

public class PartitionKeyRangeGoneRetryPolicyTest {

    private static final ErrorResponseException GONE = new ErrorResponseException(
        StatusCodes.GONE,
        SubStatusCodes.COMPLETING_SPLIT,
        Map.of(),
        null
    );

    @Test
    public void test_routing_map_is_refreshed_before_single_retry() {
        AtomicInteger refreshes = new AtomicInteger();
        PartitionKeyRangeGoneRetryPolicy policy = new PartitionKeyRangeGoneRetryPolicy(refreshNode -> {
            refreshes.incrementAndGet();
            refreshNode.diagnosticContext().recordNetworkCall(new GatewayRequestRecord(
                "pkranges",
                0L,
                3L,
                200,
                0,
                0,
                512,
                OperationType.READ,
                ResourceType.PARTITION_KEY_RANGE,
                null
            ));
            return CompletableFuture.completedFuture(null);
        });
        DiagnosticNodeInternal node = RetryPolicyTestSupport.requestNode();
        RetryContext retryContext = new RetryContext();

        RetryDecision decision = policy.shouldRetry(GONE, node, retryContext, null).join();

        assertThat(decision.outcome()).isEqualTo(RetryDecision.Outcome.RETRY);
        assertThat(refreshes.get()).isEqualTo(1);
        assertThat(retryContext.retryCount()).isEqualTo(1);
        assertThat(node.diagnosticContext().getClientSideStats(0L).metadataLookups())
            .extracting(MetadataLookup::metadataType)
            .containsExactly(MetadataLookupType.PARTITION_KEY_RANGE_LOOKUP);
        assertThat(node.children())
            .extracting(DiagnosticNodeInternal::nodeType)
            .containsExactly(DiagnosticNodeType.METADATA_REQUEST_NODE);

        assertThat(policy.shouldRetry(GONE, node, retryContext, null).join()).isEqualTo(RetryDecision.DO_NOT_RETRY);
        assertThat(refreshes.get()).isEqualTo(1);
    }

    @Test
    public void test_failed_refresh_is_not_retried() {
        PartitionKeyRangeGoneRetryPolicy policy = new PartitionKeyRangeGoneRetryPolicy(
            refreshNode -> CompletableFuture.failedFuture(new IllegalStateException("service unavailable"))
        );

        RetryDecision decision = policy.shouldRetry(GONE, RetryPolicyTestSupport.requestNode(), new RetryContext(), null).join();

        assertThat(decision).isEqualTo(RetryDecision.DO_NOT_RETRY);
    }
}
