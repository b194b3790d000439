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
package de.makibytes.faultlens.config;

import java.time.Duration;

/**
 * Immutable snapshot of the values that can be changed while the service runs.
 * A new snapshot replaces the previous one as a whole, so readers never see a half-applied update.
 */
public record RuntimeSettings(int decimationSize,
                              int windowSize,
                              int minContext,
                              int requiredConsecutive,
                              Duration minInterval,
                              int topK,
                              double fingerprintJaccardThreshold,
                              Duration fingerprintCooldown) {

    public RuntimeSettings {
        requirePositive("decimationSize", decimationSize);
        requirePositive("windowSize", windowSize);
        requirePositive("requiredConsecutive", requiredConsecutive);
        requirePositive("topK", topK);
        if (minContext < 0) {
            throw new IllegalArgumentException("minContext must not be negative");
        }
        if (minInterval == null || minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must not be negative");
        }
        if (fingerprintCooldown == null || fingerprintCooldown.isNegative()) {
            throw new IllegalArgumentException("fingerprintCooldown must not be negative");
        }
        if (Double.isNaN(fingerprintJaccardThreshold)
                || fingerprintJaccardThreshold < 0.0
                || fingerprintJaccardThreshold > 1.0) {
            throw new IllegalArgumentException("fingerprintJaccardThreshold must be within [0, 1]");
        }
    }

    public static RuntimeSettings fromProperties(FaultLensProperties properties) {
        FaultLensProperties.Gate gate = properties.getGate();
        return new RuntimeSettings(
                properties.getIngest().getDecimationSize(),
                gate.getWindowSize(),
                gate.getMinContext(),
                gate.getRequiredConsecutive(),
                Duration.ofSeconds(gate.getMinIntervalSeconds()),
                gate.getTopK(),
                gate.getFingerprintJaccardThreshold(),
                Duration.ofSeconds(gate.getFingerprintCooldownSeconds()));
    }

    /**
     * Number of rows the window must hold before a trigger is allowed, never more than the window itself.
     */
    public int effectiveMinContext() {
        int required = minContext > 0 ? minContext : Math.max(5, windowSize / 2);
        return Math.min(required, windowSize);
    }

    public RuntimeSettings apply(RuntimeSettingsUpdate update) {
        if (update == null) {
            return this;
        }
        return new RuntimeSettings(
                update.decimationSize() != null ? update.decimationSize() : decimationSize,
                update.windowSize() != null ? update.windowSize() : windowSize,
                minContext,
                update.requiredConsecutive() != null ? update.requiredConsecutive() : requiredConsecutive,
                update.minIntervalSeconds() != null ? seconds("minIntervalSeconds", update.minIntervalSeconds()) : minInterval,
                topK,
                update.fingerprintJaccardThreshold() != null ? update.fingerprintJaccardThreshold() : fingerprintJaccardThreshold,
                update.fingerprintCooldownSeconds() != null
                        ? seconds("fingerprintCooldownSeconds", update.fingerprintCooldownSeconds())
                        : fingerprintCooldown);
    }

    private static Duration seconds(String name, long value) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return Duration.ofSeconds(value);
    }

    private static void requirePositive(String name, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be at least 1");
        }
    }
}
