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
package de.makibytes.faultlens.gate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import de.makibytes.faultlens.model.AggregatedRow;

public final class FeatureRanker {

    private FeatureRanker() {
    }

    /**
     * Ranks features by |latest - window mean|, largest first. Ties keep schema order.
     */
    public static List<String> topFeatures(List<AggregatedRow> window, List<String> schema, int k) {
        if (window == null || window.isEmpty() || k <= 0) {
            return List.of();
        }
        AggregatedRow latest = window.get(window.size() - 1);
        List<FeatureDeviation> deviations = new ArrayList<>(schema.size());
        for (String feature : schema) {
            double sum = 0.0;
            int count = 0;
            for (AggregatedRow row : window) {
                double value = row.value(feature);
                if (!Double.isNaN(value)) {
                    sum += value;
                    count++;
                }
            }
            double latestValue = latest.value(feature);
            if (count == 0 || Double.isNaN(latestValue)) {
                continue;
            }
            deviations.add(new FeatureDeviation(feature, Math.abs(latestValue - sum / count)));
        }
        // List.sort is stable, so equal deviations stay in schema order
        deviations.sort(Comparator.comparingDouble(FeatureDeviation::deviation).reversed());
        return deviations.stream()
                .limit(k)
                .map(FeatureDeviation::feature)
                .toList();
    }

    /**
     * Jaccard similarity |A n B| / |A u B|; two empty sets are identical.
     */
    public static double jaccard(Collection<String> first, Collection<String> second) {
        Set<String> a = new HashSet<>(first);
        Set<String> b = new HashSet<>(second);
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        a.retainAll(b);
        return (double) a.size() / union.size();
    }

    private record FeatureDeviation(String feature, double deviation) {
    }
}
