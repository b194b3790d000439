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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merged outcome of one analysis cycle, keyed by backend id in dispatch order.
 */
public record AnalysisBundle(long id,
                             Instant timestamp,
                             long triggerSequenceIndex,
                             List<String> topFeatures,
                             String featureComparison,
                             Map<String, BackendResult> results) {

    public AnalysisBundle {
        topFeatures = topFeatures == null ? List.of() : List.copyOf(topFeatures);
        results = results == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public boolean partialFailure() {
        return results.values().stream().anyMatch(result -> !result.succeeded());
    }

    public long successCount() {
        return results.values().stream().filter(BackendResult::succeeded).count();
    }

    public Map<String, Integer> wordCounts() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        results.forEach((backendId, result) -> counts.put(backendId, result.wordCount()));
        return counts;
    }
}
