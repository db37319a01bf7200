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

/**
 * Per operation options consumed by the execution contexts.
 *
 * @param ruCapPerOperation max request units a single operation may consume, 0 or less disables the cap
 * @param maxItemCount      number of items {@link ExecutionContext#fetchMore} collects into one page
 */
public record QueryOperationOptions(double ruCapPerOperation, int maxItemCount) {

    public static final int DEFAULT_MAX_ITEM_COUNT = 100;
    public static final QueryOperationOptions DEFAULT = new QueryOperationOptions(0, DEFAULT_MAX_ITEM_COUNT);

    public QueryOperationOptions {
        if (maxItemCount <= 0) {
            throw new IllegalArgumentException("maxItemCount must be > 0, got: " + maxItemCount);
        }
    }

    public boolean hasRuCap() {
        return ruCapPerOperation > 0;
    }

    public QueryOperationOptions withRuCap(double ruCap) {
        return new QueryOperationOptions(ruCap, maxItemCount);
    }

    public QueryOperationOptions withMaxItemCount(int count) {
        return new QueryOperationOptions(ruCapPerOperation, count);
    }
}
