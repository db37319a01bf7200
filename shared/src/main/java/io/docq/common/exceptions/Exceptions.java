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

package io.docq.common.exceptions;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.google.common.base.MoreObjects;

public final class Exceptions {

    private Exceptions() {
    }

    /**
     * Strips the wrappers added by future composition so that callers can classify the actual error.
     */
    public static Throwable unwrap(@NotNull Throwable t) {
        int counter = 0;
        Throwable result = t;
        while (result instanceof CompletionException || result instanceof ExecutionException) {
            Throwable cause = result.getCause();
            if (cause == null || cause == result) {
                return result;
            }
            if (counter > 10) {
                return result;
            }
            counter++;
            result = cause;
        }
        return result;
    }

    public static String messageOf(@Nullable Throwable t) {
        if (t == null) {
            return "Unknown";
        }
        Throwable unwrappedT = unwrap(t);
        return MoreObjects.firstNonNull(unwrappedT.getMessage(), unwrappedT.toString());
    }

    public static RuntimeException toRuntimeException(Throwable t) {
        Throwable unwrapped = unwrap(t);
        if (unwrapped instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        return new RuntimeException(unwrapped);
    }

    /**
     * Throws the given throwable without wrapping checked exceptions.
     */
    @SuppressWarnings("unchecked")
    public static <T extends Throwable> void rethrowUnchecked(Throwable t) throws T {
        throw (T) t;
    }
}
