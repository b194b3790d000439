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
package de.makibytes.faultlens.model;

/**
 * Outcome of one backend call. Failures are data here, never exceptions.
 */
public record BackendResult(String backendId,
                            BackendStatus status,
                            String text,
                            String error,
                            long elapsedMs,
                            int attempts) {

    public static BackendResult success(String backendId, String text, long elapsedMs, int attempts) {
        return new BackendResult(backendId, BackendStatus.SUCCESS, text, null, elapsedMs, attempts);
    }

    public static BackendResult error(String backendId, String error, long elapsedMs, int attempts) {
        return new BackendResult(backendId, BackendStatus.ERROR, null, error, elapsedMs, attempts);
    }

    public static BackendResult timeout(String backendId, long elapsedMs, int attempts) {
        return new BackendResult(backendId, BackendStatus.TIMEOUT, null,
                "no response within " + elapsedMs + " ms", elapsedMs, attempts);
    }

    public boolean succeeded() {
        return status == BackendStatus.SUCCESS;
    }

    public int wordCount() {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
