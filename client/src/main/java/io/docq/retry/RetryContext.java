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

import java.util.ArrayList;
import java.util.List;

/**
 * Per request state that retry policies share with the request handler.
 * The handler reads it when issuing the retry, e.g. to drop the session token.
 */
public class RetryContext {

    private int retryCount = 0;
    private boolean retryRequestOnPreferredLocations = false;
    private boolean clearSessionTokenNotAvailable = false;
    private final List<String> triedEndpoints = new ArrayList<>();

    public int retryCount() {
        return retryCount;
    }

    public void retryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public void incrementRetryCount() {
        retryCount++;
    }

    public boolean retryRequestOnPreferredLocations() {
        return retryRequestOnPreferredLocations;
    }

    public void retryRequestOnPreferredLocations(boolean retryRequestOnPreferredLocations) {
        this.retryRequestOnPreferredLocations = retryRequestOnPreferredLocations;
    }

    public boolean clearSessionTokenNotAvailable() {
        return clearSessionTokenNotAvailable;
    }

    public void clearSessionTokenNotAvailable(boolean clearSessionTokenNotAvailable) {
        this.clearSessionTokenNotAvailable = clearSessionTokenNotAvailable;
    }

    public List<String> triedEndpoints() {
        return List.copyOf(triedEndpoints);
    }

    public void addTriedEndpoint(String endpoint) {
        if (triedEndpoints.contains(endpoint) == false) {
            triedEndpoints.add(endpoint);
        }
    }

    @Override
    public String toString() {
        return "RetryContext{" +
               "retryCount=" + retryCount +
               ", retryRequestOnPreferredLocations=" + retryRequestOnPreferredLocations +
               ", clearSessionTokenNotAvailable=" + clearSessionTokenNotAvailable +
               ", triedEndpoints=" + triedEndpoints +
               '}';
    }
}
