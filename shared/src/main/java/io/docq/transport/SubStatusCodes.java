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

public final class SubStatusCodes {

    public static final int UNKNOWN = 0;

    // 403
    public static final int WRITE_FORBIDDEN = 3;
    public static final int DATABASE_ACCOUNT_NOT_FOUND = 1008;

    // 404
    public static final int READ_SESSION_NOT_AVAILABLE = 1002;

    // 410
    public static final int PARTITION_KEY_RANGE_GONE = 1002;
    public static final int COMPLETING_SPLIT = 1007;
    public static final int COMPLETING_PARTITION_MIGRATION = 1008;

    private SubStatusCodes() {
    }
}
