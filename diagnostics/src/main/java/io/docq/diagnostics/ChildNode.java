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

/**
 * Result of {@link DiagnosticNodeInternal#initializeChildNode(DiagnosticNodeType, DiagnosticLevel)}.
 *
 * Either a freshly created child linked into the tree, or, if the requested level isn't traced,
 * the parent itself so callers keep writing to it. {@link #node()} is valid in both cases.
 */
public record ChildNode(DiagnosticNodeInternal node, boolean created) {

    public boolean isPassthrough() {
        return created == false;
    }

    /**
     * Finalizes the duration of a created child. A passthrough leaves the parent's duration untouched.
     */
    public void finish() {
        if (created) {
            node.updateTimestamp();
        }
    }
}
