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

import java.time.Duration;

/**
 * Timing and retry policy of one backend, shared by analysis cycles and direct queries.
 * The retry budget is clamped to a single extra attempt.
 */
public record BackendSettings(Duration timeout,
                              int maxRetries,
                              Duration retryBackoff,
                              Duration displayDuration,
                              boolean premium) {

    public static final int MAX_RETRIES = 1;

    public BackendSettings {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("backend timeout must be positive");
        }
        maxRetries = Math.min(MAX_RETRIES, Math.max(0, maxRetries));
        retryBackoff = retryBackoff == null || retryBackoff.isNegative() ? Duration.ZERO : retryBackoff;
        displayDuration = displayDuration == null || displayDuration.isNegative() ? Duration.ZERO : displayDuration;
    }
}
