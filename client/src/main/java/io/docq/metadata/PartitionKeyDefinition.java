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

package io.docq.metadata;

import java.util.List;

import org.jetbrains.annotations.Nullable;

/**
 * Partition key schema of a container.
 *
 * @param paths     one path for a regular key, several for a hierarchical key
 * @param systemKey true if the key is managed by the service and not part of the documents
 */
public record PartitionKeyDefinition(@Nullable List<String> paths,
                                     @Nullable PartitionKeyKind kind,
                                     @Nullable Integer version,
                                     boolean systemKey) {

    public static final String DEFAULT_PARTITION_KEY_PATH = "/_partitionKey";

    public static PartitionKeyDefinition of(String... paths) {
        return new PartitionKeyDefinition(
            List.of(paths),
            paths.length > 1 ? PartitionKeyKind.MULTI_HASH : PartitionKeyKind.HASH,
            2,
            false
        );
    }

    public static PartitionKeyDefinition systemManaged() {
        return new PartitionKeyDefinition(List.of(DEFAULT_PARTITION_KEY_PATH), PartitionKeyKind.HASH, 2, true);
    }

    public boolean isHierarchical() {
        return paths != null && paths.size() > 1;
    }
}
