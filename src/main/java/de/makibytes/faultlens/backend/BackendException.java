/*
 * Copyright (c) 2026 MakiBytes.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */
package de.makibytes.faultlens.backend;

public class BackendException extends Exception {

    public enum Kind {
        TIMEOUT,
        TRANSPORT,
        EMPTY_RESPONSE
    }

    private final Kind kind;
    private final boolean retryable;

    public BackendException(Kind kind, String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.retryable = retryable && kind == Kind.TRANSPORT;
    }

    public static BackendException timeout(String message, Throwable cause) {
        return new BackendException(Kind.TIMEOUT, message, false, cause);
    }

    public static BackendException transport(String message, boolean retryable, Throwable cause) {
        return new BackendException(Kind.TRANSPORT, message, retryable, cause);
    }

    public static BackendException emptyResponse(String message) {
        return new BackendException(Kind.EMPTY_RESPONSE, message, false, null);
    }

    public Kind getKind() {
        return kind;
    }

    /** Only transport failures are ever retried. */
    public boolean isRetryable() {
        return retryable;
    }
}
