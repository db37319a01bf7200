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

/**
 * Throttling retry settings.
 *
 * @param maxRetryAttemptCount   max number of retries of a throttled request
 * @param fixedRetryIntervalInMs fixed delay between retries, 0 to use the delay suggested by the service
 * @param maxWaitTimeInSeconds   max total time spent waiting on retries of one request
 */
public record RetryOptions(int maxRetryAttemptCount, long fixedRetryIntervalInMs, int maxWaitTimeInSeconds) {

    public static final RetryOptions DEFAULT = new RetryOptions(9, 0, 30);

    public RetryOptions {
        if (maxRetryAttemptCount < 0) {
            throw new IllegalArgumentException("maxRetryAttemptCount must be >= 0, got: " + maxRetryAttemptCount);
        }
        if (fixedRetryIntervalInMs < 0) {
            throw new IllegalArgumentException("fixedRetryIntervalInMs must be >= 0, got: " + fixedRetryIntervalInMs);
        }
        if (maxWaitTimeInSeconds < 0) {
            throw new IllegalArgumentException("maxWaitTimeInSeconds must be >= 0, got: " + maxWaitTimeInSeconds);
        }
    }
}
