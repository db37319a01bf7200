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

import java.util.Locale;
import java.util.Map;

import org.jetbrains.annotations.Nullable;

import io.docq.transport.HttpHeaders;
import io.docq.transport.StatusCodes;
import io.docq.transport.SubStatusCodes;

/**
 * A failed network call, either a non-success response of the service or a transport failure
 * (status code {@link StatusCodes#TRANSPORT_FAILURE}, see {@link #transportErrorCode()}).
 */
public class ErrorResponseException extends RuntimeException {

    private final int statusCode;
    private final int subStatusCode;
    private final Map<String, String> headers;
    @Nullable
    private final String body;
    @Nullable
    private final String transportErrorCode;

    public ErrorResponseException(int statusCode, int subStatusCode, Map<String, String> headers, @Nullable String body) {
        this(statusCode, subStatusCode, headers, body, null, null);
    }

    protected ErrorResponseException(int statusCode,
                                     int subStatusCode,
                                     Map<String, String> headers,
                                     @Nullable String body,
                                     @Nullable String transportErrorCode,
                                     @Nullable String message) {
        super(message == null ? genMessage(statusCode, subStatusCode, transportErrorCode) : message);
        this.statusCode = statusCode;
        this.subStatusCode = subStatusCode;
        this.headers = Map.copyOf(headers);
        this.body = body;
        this.transportErrorCode = transportErrorCode;
    }

    /**
     * A failure raised by the transport before any response was received.
     *
     * @param transportErrorCode low level error code like {@code ECONNRESET}
     */
    public static ErrorResponseException transportFailure(String transportErrorCode, String message) {
        return new ErrorResponseException(
            StatusCodes.TRANSPORT_FAILURE,
            SubStatusCodes.UNKNOWN,
            Map.of(),
            null,
            transportErrorCode,
            message
        );
    }

    private static String genMessage(int statusCode, int subStatusCode, @Nullable String transportErrorCode) {
        if (transportErrorCode != null) {
            return String.format(Locale.ENGLISH, "Transport failure: %s", transportErrorCode);
        }
        return String.format(Locale.ENGLISH, "Request failed with status %d and sub-status %d", statusCode, subStatusCode);
    }

    public int statusCode() {
        return statusCode;
    }

    public int subStatusCode() {
        return subStatusCode;
    }

    public Map<String, String> headers() {
        return headers;
    }

    @Nullable
    public String body() {
        return body;
    }

    @Nullable
    public String transportErrorCode() {
        return transportErrorCode;
    }

    @Nullable
    public String activityId() {
        return headers.get(HttpHeaders.ACTIVITY_ID);
    }

    /**
     * @return the delay the service asked for before the request may be retried, 0 if none was given
     */
    public long retryAfterInMs() {
        String value = headers.get(HttpHeaders.RETRY_AFTER_IN_MS);
        if (value == null) {
            return 0L;
        }
        try {
            return Math.max(0L, Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            return 0L;
        }
    }
}
