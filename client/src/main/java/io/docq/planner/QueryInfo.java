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

package io.docq.planner;

import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.Nullable;

/**
 * The parts of a query plan the client side pipeline is built from.
 *
 * @param groupByExpressions          group by expressions, empty if the query doesn't group
 * @param groupByAliasToAggregateType aggregate type of each projected alias; aliases without an entry
 *                                    (e.g. the grouping keys) aren't aggregated
 * @param offset                      number of results to skip, null if the query has no OFFSET
 * @param limit                       max number of results, null if the query has no LIMIT
 */
public record QueryInfo(List<String> groupByExpressions,
                        Map<String, AggregateType> groupByAliasToAggregateType,
                        @Nullable Integer offset,
                        @Nullable Integer limit) {

    public QueryInfo {
        groupByExpressions = List.copyOf(groupByExpressions);
        groupByAliasToAggregateType = Map.copyOf(groupByAliasToAggregateType);
        if (offset != null && offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0, got: " + offset);
        }
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0, got: " + limit);
        }
    }

    public static QueryInfo groupBy(List<String> groupByExpressions, Map<String, AggregateType> aliasToAggregateType) {
        return new QueryInfo(groupByExpressions, aliasToAggregateType, null, null);
    }

    public boolean hasGroupBy() {
        return groupByExpressions.isEmpty() == false;
    }

    public boolean hasOffsetOrLimit() {
        return offset != null || limit != null;
    }

    @Nullable
    public AggregateType aggregateType(String alias) {
        return groupByAliasToAggregateType.get(alias);
    }
}
