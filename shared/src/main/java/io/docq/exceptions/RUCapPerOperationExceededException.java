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

package io.docq.exceptions;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.jetbrains.annotations.Nullable;

import io.docq.transport.StatusCodes;
import io.docq.transport.SubStatusCodes;

/**
 * Raised once the request units consumed by a single query operation exceed the cap the caller configured.
 * The results fetched before the cap was hit are attached so the caller may still make use of them.
 */
public class RUCapPerOperationExceededException extends ErrorResponseException {

    public static final String ERROR_CODE = "OPERATION_RU_LIMIT_EXCEEDED";

    private final double ruConsumed;
    private final double ruCap;
    @Nullable
    private List<?> fetchedResults;

    public RUCapPerOperationExceededException(double ruConsumed, double ruCap, @Nullable List<?> fetchedResults) {
        super(
            StatusCodes.TOO_MANY_REQUESTS,
            SubStatusCodes.UNKNOWN,
            Map.of(),
            null,
            null,
            String.format(Locale.ENGLISH,
                "%s: request units consumed by the operation (%.2f) exceed the configured cap of %.2f",
                ERROR_CODE, ruConsumed, ruCap)
        );
        this.ruConsumed = ruConsumed;
        this.ruCap = ruCap;
        this.fetchedResults = fetchedResults;
    }

    public String code() {
        return ERROR_CODE;
    }

    public double ruConsumed() {
        return ruConsumed;
    }

    public double ruCap() {
        return ruCap;
    }

    @Nullable
    public List<?> fetchedResults() {
        return fetchedResults;
    }

    /**
     * Drops the attached partial results, used by stages that keep their own partial state.
     */
    public void discardFetchedResults() {
        fetchedResults = null;
    }
}
