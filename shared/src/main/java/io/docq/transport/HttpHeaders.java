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

/**
 * Names of the service headers the query engine reads or writes.
 */
public final class HttpHeaders {

    public static final String ACTIVITY_ID = "x-ms-activity-id";
    public static final String REQUEST_CHARGE = "x-ms-request-charge";
    public static final String CONTINUATION = "x-ms-continuation";
    public static final String QUERY_METRICS = "x-ms-documentdb-query-metrics";
    public static final String RETRY_AFTER_IN_MS = "x-ms-retry-after-ms";
    public static final String SUB_STATUS = "x-ms-substatus";
    public static final String SESSION_TOKEN = "x-ms-session-token";
    public static final String PARTITION_KEY_RANGE_ID = "x-ms-documentdb-partitionkeyrangeid";

    private HttpHeaders() {
    }
}
