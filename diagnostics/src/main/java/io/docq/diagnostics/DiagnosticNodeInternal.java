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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import io.docq.common.TimeSource;
import io.docq.transport.HttpHeaders;
import io.docq.transport.RequestContext;
import io.docq.transport.TransportResponse;

/**
 * Mutable record of the telemetry of one logical operation. Children represent nested sub-operations,
 * all nodes of a tree share one {@link DiagnosticContext}.
 *
 * {@link #toDiagnosticNode()} and {@link #toDiagnostic(ClientConfigDiagnostic)} convert it into the
 * public, immutable representation.
 */
public class DiagnosticNodeInternal {

    private static final Logger LOGGER = LogManager.getLogger(DiagnosticNodeInternal.class);

    static final String LOG = "log";
    static final String QUERY_RECORDS_READ = "queryRecordsRead";
    static final String SELECTED_LOCATION = "selectedLocation";
    static final String FAILED_ATTEMPT = "failedAttempt";
    static final String REQUEST_DATA = "requestData";

    private final String id;
    private final DiagnosticNodeType nodeType;
    private final long startTimeUTCInMs;
    private final DiagnosticLevel diagnosticLevel;
    private final DiagnosticContext diagnosticCtx;
    private final TimeSource timeSource;
    private final List<DiagnosticNodeInternal> children = new ArrayList<>();

    private Map<String, Object> data;
    private long durationInMs = 0;
    @Nullable
    private DiagnosticNodeInternal parent;

    public DiagnosticNodeInternal(DiagnosticLevel diagnosticLevel, DiagnosticNodeType nodeType) {
        this(diagnosticLevel, nodeType, TimeSource.SYSTEM);
    }

    public DiagnosticNodeInternal(DiagnosticLevel diagnosticLevel, DiagnosticNodeType nodeType, TimeSource timeSource) {
        this(diagnosticLevel, nodeType, null, Map.of(), timeSource, new DiagnosticContext(timeSource));
    }

    public DiagnosticNodeInternal(DiagnosticLevel diagnosticLevel,
                                  DiagnosticNodeType nodeType,
                                  @Nullable DiagnosticNodeInternal parent,
                                  Map<String, ?> data,
                                  TimeSource timeSource,
                                  DiagnosticContext diagnosticCtx) {
        this.id = UUID.randomUUID().toString();
        this.diagnosticLevel = diagnosticLevel;
        this.nodeType = nodeType;
        this.parent = parent;
        this.data = new LinkedHashMap<>(data);
        this.timeSource = timeSource;
        this.startTimeUTCInMs = timeSource.currentTimeMillis();
        this.diagnosticCtx = diagnosticCtx;
    }

    public String id() {
        return id;
    }

    public DiagnosticNodeType nodeType() {
        return nodeType;
    }

    public DiagnosticLevel diagnosticLevel() {
        return diagnosticLevel;
    }

    public DiagnosticContext diagnosticContext() {
        return diagnosticCtx;
    }

    public TimeSource timeSource() {
        return timeSource;
    }

    public long startTimeUTCInMs() {
        return startTimeUTCInMs;
    }

    /**
     * Only meaningful once {@link #updateTimestamp()} finalized the node.
     */
    public synchronized long durationInMs() {
        return durationInMs;
    }

    @Nullable
    public synchronized DiagnosticNodeInternal parent() {
        return parent;
    }

    public synchronized List<DiagnosticNodeInternal> children() {
        return List.copyOf(children);
    }

    public synchronized Map<String, Object> data() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public void updateTimestamp() {
        updateTimestamp(timeSource.currentTimeMillis());
    }

    public synchronized void updateTimestamp(long endTimeUTCInMs) {
        durationInMs = endTimeUTCInMs - startTimeUTCInMs;
    }

    public void addLog(String msg) {
        addData(Map.of(), msg);
    }

    public void addData(Map<String, ?> newData) {
        addData(newData, null, diagnosticLevel);
    }

    public void addData(Map<String, ?> newData, @Nullable String msg) {
        addData(newData, msg, diagnosticLevel);
    }

    /**
     * Shallow-merges {@code newData} into the data of this node and appends {@code msg} to its log.
     * Nothing is recorded at the {@link DiagnosticLevel#INFO} tier.
     */
    public void addData(Map<String, ?> newData, @Nullable String msg, DiagnosticLevel level) {
        if (level == DiagnosticLevel.INFO) {
            return;
        }
        synchronized (this) {
            LinkedHashMap<String, Object> merged = new LinkedHashMap<>(data);
            merged.putAll(newData);
            if (msg != null) {
                List<Object> log = new ArrayList<>();
                if (merged.get(LOG) instanceof Collection<?> previous) {
                    log.addAll(previous);
                }
                log.add(msg);
                merged.put(LOG, log);
            }
            data = merged;
        }
    }

    /**
     * Records a successful network call into the shared context and annotates this node with its payload
     * sizes and timing. Headers, bodies and the URL are only captured at {@link DiagnosticLevel#DEBUG_UNSAFE}.
     */
    public void recordSuccessfulNetworkCall(long startTimeUTCInMs,
                                            RequestContext requestContext,
                                            TransportResponse response,
                                            int subStatusCode,
                                            @Nullable String url) {
        GatewayRequestRecord request;
        try {
            Map<String, String> responseHeaders = response.headers();
            request = new GatewayRequestRecord(
                responseHeaders == null ? null : responseHeaders.get(HttpHeaders.ACTIVITY_ID),
                startTimeUTCInMs,
                timeSource.currentTimeMillis() - startTimeUTCInMs,
                response.status(),
                subStatusCode,
                requestContext.payloadLengthInBytes(),
                response.payloadLengthInBytes(),
                requestContext.operationType(),
                requestContext.resourceType(),
                requestContext.partitionKeyRangeId()
            );
        } catch (RuntimeException e) {
            LOGGER.debug("Couldn't record successful network call", e);
            return;
        }
        diagnosticCtx.recordNetworkCall(request);
        try {
            Map<String, Object> requestData = requestData(requestContext, request.requestPayloadLengthInBytes());
            if (DiagnosticLevel.allowTracing(DiagnosticLevel.DEBUG_UNSAFE, diagnosticLevel)) {
                requestData.put("headers", requestContext.headers());
                requestData.put("requestBody", requestContext.body());
                requestData.put("responseBody", response.bodyAsText());
                requestData.put("url", url);
            }
            LinkedHashMap<String, Object> newData = new LinkedHashMap<>();
            newData.put("requestPayloadLengthInBytes", request.requestPayloadLengthInBytes());
            newData.put("responsePayloadLengthInBytes", request.responsePayloadLengthInBytes());
            newData.put("startTimeUTCInMs", request.startTimeUTCInMs());
            newData.put("durationInMs", request.durationInMs());
            newData.put(REQUEST_DATA, requestData);
            addData(newData);
        } catch (RuntimeException e) {
            LOGGER.debug("Couldn't annotate diagnostic node with successful network call", e);
        }
    }

    /**
     * Records a failed attempt, tagged with the retry attempt number, into the shared context.
     * The attempt is always counted, the annotation of this node depends on the diagnostic level.
     */
    public void recordFailedNetworkCall(long startTimeUTCInMs,
                                        RequestContext requestContext,
                                        int retryAttemptNumber,
                                        int statusCode,
                                        int subStatusCode,
                                        @Nullable Map<String, String> responseHeaders) {
        int requestPayloadLength = requestContext.payloadLengthInBytes();
        GatewayRequestRecord request = new GatewayRequestRecord(
            responseHeaders == null ? null : responseHeaders.get(HttpHeaders.ACTIVITY_ID),
            startTimeUTCInMs,
            timeSource.currentTimeMillis() - startTimeUTCInMs,
            statusCode,
            subStatusCode,
            requestPayloadLength,
            0,
            requestContext.operationType(),
            requestContext.resourceType(),
            requestContext.partitionKeyRangeId()
        );
        diagnosticCtx.recordFailedAttempt(request, retryAttemptNumber);
        try {
            Map<String, Object> requestData = requestData(requestContext, requestPayloadLength);
            if (DiagnosticLevel.allowTracing(DiagnosticLevel.DEBUG_UNSAFE, diagnosticLevel)) {
                requestData.put("headers", requestContext.headers());
                requestData.put("requestBody", requestContext.body());
                requestData.put("url", requestContext.url());
            }
            LinkedHashMap<String, Object> newData = new LinkedHashMap<>();
            newData.put(FAILED_ATTEMPT, true);
            newData.put(REQUEST_DATA, requestData);
            addData(newData);
        } catch (RuntimeException e) {
            LOGGER.debug("Couldn't annotate diagnostic node with failed network call", e);
        }
    }

    private static Map<String, Object> requestData(RequestContext requestContext, int requestPayloadLength) {
        LinkedHashMap<String, Object> requestData = new LinkedHashMap<>();
        requestData.put("operationType", requestContext.operationType());
        requestData.put("resourceType", requestContext.resourceType());
        requestData.put("requestPayloadLengthInBytes", requestPayloadLength);
        return requestData;
    }

    public void recordEndpointResolution(String location) {
        addData(Map.of(SELECTED_LOCATION, location));
        diagnosticCtx.recordEndpointResolution(location);
    }

    /**
     * Increments the number of records read by this node if {@code resources} is a collection.
     */
    public void recordQueryResult(@Nullable Object resources, DiagnosticLevel level) {
        if (DiagnosticLevel.allowTracing(level, diagnosticLevel) && resources instanceof Collection<?> collection) {
            synchronized (this) {
                long previousCount = data.get(QUERY_RECORDS_READ) instanceof Number number ? number.longValue() : 0L;
                data.put(QUERY_RECORDS_READ, previousCount + collection.size());
            }
        }
    }

    /**
     * Creates a child sharing the diagnostic context of this node.
     * If {@code level} isn't traced by this node, no child is created and this node is returned as passthrough.
     */
    public ChildNode initializeChildNode(DiagnosticNodeType type, DiagnosticLevel level) {
        return initializeChildNode(type, level, Map.of());
    }

    public ChildNode initializeChildNode(DiagnosticNodeType type, DiagnosticLevel level, Map<String, ?> childData) {
        if (DiagnosticLevel.allowTracing(level, diagnosticLevel) == false) {
            return new ChildNode(this, false);
        }
        DiagnosticNodeInternal child = new DiagnosticNodeInternal(
            diagnosticLevel,
            type,
            this,
            childData,
            timeSource,
            diagnosticCtx
        );
        synchronized (this) {
            children.add(child);
        }
        return new ChildNode(child, true);
    }

    /**
     * Merges the context of {@code child} into the context of this node, treating the network calls of
     * the child as metadata lookups of type {@code metadataType}. The statistics are always merged, the
     * child only becomes part of the tree if {@code level} is traced.
     */
    public DiagnosticNodeInternal addChildNode(DiagnosticNodeInternal child,
                                               DiagnosticLevel level,
                                               MetadataLookupType metadataType) {
        diagnosticCtx.mergeDiagnostics(child.diagnosticCtx, metadataType);
        if (DiagnosticLevel.allowTracing(level, diagnosticLevel)) {
            synchronized (child) {
                child.parent = this;
            }
            synchronized (this) {
                children.add(child);
            }
        }
        return child;
    }

    public DiagnosticNodeInternal rootNode() {
        DiagnosticNodeInternal node = this;
        DiagnosticNodeInternal nodeParent = node.parent();
        while (nodeParent != null) {
            node = nodeParent;
            nodeParent = node.parent();
        }
        return node;
    }

    public DiagnosticNode toDiagnosticNode() {
        List<DiagnosticNodeInternal> currentChildren;
        Map<String, Object> currentData;
        long currentDuration;
        synchronized (this) {
            currentChildren = List.copyOf(children);
            currentData = DiagnosticData.deepCopy(data);
            currentDuration = durationInMs;
        }
        List<DiagnosticNode> childSnapshots = new ArrayList<>(currentChildren.size());
        for (DiagnosticNodeInternal child : currentChildren) {
            childSnapshots.add(child.toDiagnosticNode());
        }
        return new DiagnosticNode(
            id,
            nodeType,
            Collections.unmodifiableList(childSnapshots),
            currentData,
            startTimeUTCInMs,
            currentDuration
        );
    }

    /**
     * Exports the diagnostics of the whole operation this node belongs to. The node tree and the client
     * configuration are only included at {@link DiagnosticLevel#DEBUG} or above.
     */
    public ClientDiagnostics toDiagnostic(@Nullable ClientConfigDiagnostic clientConfig) {
        boolean detailed = DiagnosticLevel.allowTracing(DiagnosticLevel.DEBUG, diagnosticLevel);
        DiagnosticNode diagnosticNode = detailed ? rootNode().toDiagnosticNode() : null;
        return new ClientDiagnostics(
            diagnosticCtx.getClientSideStats(timeSource.currentTimeMillis()),
            diagnosticNode,
            detailed ? clientConfig : null
        );
    }

    @Override
    public String toString() {
        return "DiagnosticNodeInternal{" +
               "id=" + id +
               ", nodeType=" + nodeType +
               ", diagnosticLevel=" + diagnosticLevel +
               '}';
    }
}
