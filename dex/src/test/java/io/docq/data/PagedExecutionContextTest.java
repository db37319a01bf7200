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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletionException;

import org.junit.Test;

import io.docq.diagnostics.DiagnosticLevel;
import io.docq.diagnostics.DiagnosticNodeInternal;
import io.docq.diagnostics.DiagnosticNodeType;
import io.docq.exceptions.RUCapPerOperationExceededException;

public class PagedExecutionContextTest {

    private final DiagnosticNodeInternal node = new DiagnosticNodeInternal(
        DiagnosticLevel.DEBUG,
        DiagnosticNodeType.CLIENT_REQUEST_NODE
    );

    @Test
    public void test_items_of_all_pages_are_served_in_order() {
        TestingFetchFunction<String> fetchFunction = new TestingFetchFunction<>(
            2.0,
            List.of(List.of("a", "b"), List.of(), List.of("c"))
        );
        PagedExecutionContext<String> context = new PagedExecutionContext<>(fetchFunction);

        List<String> items = new ArrayList<>();
        List<Double> charges = new ArrayList<>();
        assertThat(context.hasMoreResults()).isTrue();
        while (context.hasMoreResults()) {
            Response<String> response = context.nextItem(node).join();
            charges.add(response.headers().requestCharge());
            if (response.hasResult()) {
                items.add(response.result());
            }
        }

        assertThat(items).containsExactly("a", "b", "c");
        // page headers come with the first pull of each page, the empty page yields no item
        assertThat(charges).containsExactly(2.0, 0.0, 2.0, 2.0);
        assertThat(fetchFunction.receivedContinuations).containsExactly(null, "1", "2");
    }

    @Test
    public void test_each_fetch_is_recorded_under_a_query_node() {
        PagedExecutionContext<Integer> context = new PagedExecutionContext<>(
            new TestingFetchFunction<>(1.0, List.of(List.of(1, 2, 3), List.of(4)))
        );
        ExecutionContexts.fetchMore(context, node, QueryOperationOptions.DEFAULT, new RUConsumedManager()).join();

        List<DiagnosticNodeInternal> children = node.children();
        assertThat(children)
            .extracting(DiagnosticNodeInternal::nodeType)
            .containsExactly(DiagnosticNodeType.DEFAULT_QUERY_NODE, DiagnosticNodeType.DEFAULT_QUERY_NODE);
        assertThat(children.get(0).data()).containsEntry("queryRecordsRead", 3L);
        assertThat(children.get(1).data()).containsEntry("queryRecordsRead", 1L);
    }

    @Test
    public void test_exceeding_ru_cap_fails_with_items_of_the_page() {
        PagedExecutionContext<String> context = new PagedExecutionContext<>(
            new TestingFetchFunction<>(5.0, List.of(List.of("a"), List.of("b", "c"), List.of("d")))
        );
        QueryOperationOptions options = QueryOperationOptions.DEFAULT.withRuCap(7);
        RUConsumedManager ruConsumed = new RUConsumedManager();

        assertThat(context.nextItem(node, options, ruConsumed).join().result()).isEqualTo("a");

        assertThatThrownBy(() -> context.nextItem(node, options, ruConsumed).join())
            .isExactlyInstanceOf(CompletionException.class)
            .cause()
            .isExactlyInstanceOf(RUCapPerOperationExceededException.class)
            .satisfies(e -> {
                RUCapPerOperationExceededException ruCapExceeded = (RUCapPerOperationExceededException) e;
                assertThat(ruCapExceeded.ruConsumed()).isEqualTo(10.0);
                assertThat(ruCapExceeded.ruCap()).isEqualTo(7.0);
                assertThat(ruCapExceeded.fetchedResults()).isEqualTo(Arrays.asList("b", "c"));
            });

        // the budget is checked before the next fetch as well
        assertThatThrownBy(() -> context.nextItem(node, options, ruConsumed).join())
            .cause()
            .isExactlyInstanceOf(RUCapPerOperationExceededException.class)
            .satisfies(e -> assertThat(((RUCapPerOperationExceededException) e).fetchedResults()).isEmpty());
    }

    @Test
    public void test_failed_fetch_is_propagated() {
        PagedExecutionContext<String> context = new PagedExecutionContext<>((diagnosticNode, continuation) -> {
            throw new IllegalStateException("connection closed");
        });

        assertThatThrownBy(() -> context.nextItem(node).join())
            .cause()
            .isExactlyInstanceOf(IllegalStateException.class)
            .hasMessage("connection closed");
    }
}
