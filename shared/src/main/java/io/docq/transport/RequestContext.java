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

package io.docq.transport;

import java.util.Map;

import org.jetbrains.annotations.Nullable;

/**
 * The parts of an outgoing request the engine needs for diagnostics and retry decisions.
 *
 * @param endpoint            the regional endpoint the request is sent to
 * @param path                the resource path, appended to the endpoint to build the URL
 * @param partitionKeyRangeId the targeted physical partition, if the request is scoped to one
 */
public record RequestContext(OperationType operationType,
                             ResourceType resourceType,
                             Map<String, String> headers,
                             @Nullable String body,
                             String endpoint,
                             String path,
                             @Nullable String partitionKeyRangeId) {

    public RequestContext {
        headers = Map.copyOf(headers);
    }

    public int payloadLengthInBytes() {
        return body == null ? 0 : body.length();
    }

    public String url() {
        if (endpoint.endsWith("/") && path.startsWith("/")) {
            return endpoint + path.substring(1);
        }
        if (endpoint.endsWith("/") || path.startsWith("/")) {
            return endpoint + path;
        }
        return endpoint + "/" + path;
    }
}
