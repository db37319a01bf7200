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

package io.docq.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;

import io.docq.common.TimeSource;

/**
 * Aggregate statistics of one top level operation, shared by all diagnostic nodes of its tree.
 *
 * Several network calls of the same operation may complete concurrently, so all recorded data is
 * append only and safe to be written from multiple threads.
 */
public class DiagnosticContext {

    private final long requestStartTimeUTCInMs;
    private final Queue<Recorded<FailedRequestAttempt>> failedAttempts = new ConcurrentLinkedQueue<>();
    private final Queue<Recorded<MetadataLookup>> metadataLookups = new ConcurrentLinkedQueue<>();
    private final Queue<GatewayRequestRecord> gatewayStatistics = new ConcurrentLinkedQueue<>();
    private final Set<String> locationEndpointsContacted = new LinkedHashSet<>();
    // every context merged into this one, directly or through a merged child
    private final Set<DiagnosticContext> mergedContexts = Collections.newSetFromMap(new IdentityHashMap<>());

    /**
     * A merged entry together with the context that originally recorded it.
     */
    private record Recorded<T>(DiagnosticContext source, T value) {
    }

    public DiagnosticContext() {
        this(TimeSource.SYSTEM);
    }

    public DiagnosticContext(TimeSource timeSource) {
        this(timeSource.currentTimeMillis());
    }

    public DiagnosticContext(long requestStartTimeUTCInMs) {
        this.requestStartTimeUTCInMs = requestStartTimeUTCInMs;
    }

    public long requestStartTimeUTCInMs() {
        return requestStartTimeUTCInMs;
    }

    public void recordNetworkCall(GatewayRequestRecord request) {
        gatewayStatistics.add(request);
    }

    public void recordFailedAttempt(GatewayRequestRecord request, int retryAttemptNumber) {
        failedAttempts.add(new Recorded<>(this, FailedRequestAttempt.of(request, retryAttemptNumber)));
    }

    public void recordEndpointResolution(String location) {
        synchronized (locationEndpointsContacted) {
            locationEndpointsContacted.add(location);
        }
    }

    /**
     * Merges the statistics of {@code child} into this context. The network calls of the child are
     * recorded as metadata lookups of the given type, its metadata lookups, failed attempts and
     * contacted endpoints are taken over as they are.
     *
     * Merged contexts are tracked transitively: merging a context into itself, merging the same child
     * a second time, or merging a child whose own merged contexts were already merged here never
     * counts an entry twice.
     */
    public void mergeDiagnostics(DiagnosticContext child, MetadataLookupType metadataType) {
        if (child == this) {
            return;
        }
        List<DiagnosticContext> childSources = child.mergedContexts();
        Set<DiagnosticContext> newSources = Collections.newSetFromMap(new IdentityHashMap<>());
        synchronized (mergedContexts) {
            if (mergedContexts.contains(child)) {
                return;
            }
            newSources.add(child);
            for (DiagnosticContext source : childSources) {
                if (source != this && mergedContexts.contains(source) == false) {
                    newSources.add(source);
                }
            }
            mergedContexts.addAll(newSources);
        }
        for (String endpoint : child.locationEndpointsContacted()) {
            recordEndpointResolution(endpoint);
        }
        for (GatewayRequestRecord request : child.gatewayStatistics) {
            metadataLookups.add(new Recorded<>(child, MetadataLookup.of(request, metadataType)));
        }
        for (Recorded<MetadataLookup> lookup : child.metadataLookups) {
            if (newSources.contains(lookup.source())) {
                metadataLookups.add(lookup);
            }
        }
        for (Recorded<FailedRequestAttempt> attempt : child.failedAttempts) {
            if (newSources.contains(attempt.source())) {
                failedAttempts.add(attempt);
            }
        }
    }

    private List<DiagnosticContext> mergedContexts() {
        synchronized (mergedContexts) {
            return List.copyOf(mergedContexts);
        }
    }

    public ClientSideRequestStatistics getClientSideStats(long endTimeUTCInMs) {
        List<GatewayRequestRecord> gateway = new ArrayList<>(gatewayStatistics);
        List<MetadataLookup> lookups = values(metadataLookups);
        List<FailedRequestAttempt> failed = values(failedAttempts);

        long totalRequestPayload = 0;
        long totalResponsePayload = 0;
        for (GatewayRequestRecord request : gateway) {
            totalRequestPayload += request.requestPayloadLengthInBytes();
            totalResponsePayload += request.responsePayloadLengthInBytes();
        }
        for (MetadataLookup lookup : lookups) {
            totalRequestPayload += lookup.requestPayloadLengthInBytes();
            totalResponsePayload += lookup.responsePayloadLengthInBytes();
        }
        for (FailedRequestAttempt attempt : failed) {
            totalRequestPayload += attempt.requestPayloadLengthInBytes();
            totalResponsePayload += attempt.responsePayloadLengthInBytes();
        }
        return new ClientSideRequestStatistics(
            requestStartTimeUTCInMs,
            endTimeUTCInMs - requestStartTimeUTCInMs,
            locationEndpointsContacted(),
            failed,
            lookups,
            gateway,
            totalRequestPayload,
            totalResponsePayload
        );
    }

    private static <T> List<T> values(Queue<Recorded<T>> recorded) {
        List<T> values = new ArrayList<>(recorded.size());
        for (Recorded<T> entry : recorded) {
            values.add(entry.value());
        }
        return values;
    }

    /**
     * @return number of successful network calls, both user facing and metadata lookups
     */
    public int recordedCallCount() {
        return gatewayStatistics.size() + metadataLookups.size();
    }

    public int gatewayCallCount() {
        return gatewayStatistics.size();
    }

    public int metadataLookupCount() {
        return metadataLookups.size();
    }

    public int failedAttemptCount() {
        return failedAttempts.size();
    }

    public List<String> locationEndpointsContacted() {
        synchronized (locationEndpointsContacted) {
            return List.copyOf(locationEndpointsContacted);
        }
    }
}
