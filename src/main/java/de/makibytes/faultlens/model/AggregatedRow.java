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
import java.util.Map;

/**
 * One averaged sensor row together with the detector verdict for it. Immutable.
 */
public class AggregatedRow {

    private final long sequenceIndex;
    private final Instant timestamp;
    private final Map<String, Double> features;
    private final double anomalyScore;
    private final boolean anomaly;
    private final double threshold;

    public AggregatedRow(long sequenceIndex,
                         Instant timestamp,
                         Map<String, Double> features,
                         double anomalyScore,
                         boolean anomaly,
                         double threshold) {
        this.sequenceIndex = sequenceIndex;
        this.timestamp = timestamp;
        this.features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
        this.anomalyScore = anomalyScore;
        this.anomaly = anomaly;
        this.threshold = threshold;
    }

    public AggregatedRow(long sequenceIndex, Instant timestamp, Map<String, Double> features, DetectorVerdict verdict) {
        this(sequenceIndex, timestamp, features, verdict.score(), verdict.anomaly(), verdict.threshold());
    }

    public long getSequenceIndex() {
        return sequenceIndex;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Map<String, Double> getFeatures() {
        return features;
    }

    public double getAnomalyScore() {
        return anomalyScore;
    }

    public boolean isAnomaly() {
        return anomaly;
    }

    public double getThreshold() {
        return threshold;
    }

    public double value(String feature) {
        Double value = features.get(feature);
        return value == null ? Double.NaN : value;
    }
}
