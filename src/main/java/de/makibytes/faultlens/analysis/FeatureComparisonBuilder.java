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
package de.makibytes.faultlens.analysis;

import java.util.List;
import java.util.Locale;

import de.makibytes.faultlens.detector.BaselineStatistics;
import de.makibytes.faultlens.model.AggregatedRow;

/**
 * Renders the top contributing features of the latest row against normal operation.
 */
public final class FeatureComparisonBuilder {

    private FeatureComparisonBuilder() {
    }

    public static String build(List<String> topFeatures, AggregatedRow latest, BaselineStatistics baseline) {
        StringBuilder text = new StringBuilder();
        text.append("Top ").append(topFeatures.size()).append(" Contributing Features (Fault vs Normal):\n");
        if (latest == null) {
            return text.append("(no data)\n").toString();
        }
        int rank = 1;
        for (String feature : topFeatures) {
            double fault = latest.value(feature);
            BaselineStatistics.FeatureStats stats = baseline == null ? null : baseline.get(feature);
            text.append(rank++).append(". ").append(feature).append(": ");
            if (stats == null) {
                text.append(String.format(Locale.ROOT, "Fault=%.3f | Normal=NA (baseline not loaded)\n", fault));
                continue;
            }
            double delta = fault - stats.mean();
            String percent = stats.mean() != 0.0
                    ? String.format(Locale.ROOT, "%.1f%%", 100.0 * delta / Math.abs(stats.mean()))
                    : "n/a";
            text.append(String.format(Locale.ROOT, "Fault=%.3f | Normal=%.3f | Δ=%.3f (%s) | z=%.2f\n",
                    fault, stats.mean(), delta, percent, stats.zScore(fault)));
        }
        return text.toString();
    }
}
