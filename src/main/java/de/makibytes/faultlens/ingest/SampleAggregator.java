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
package de.makibytes.faultlens.ingest;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collapses every {@code size} consecutive raw rows into one row holding the per-feature mean.
 * Not thread-safe; callers serialize access.
 */
public class SampleAggregator {

    private final List<String> features;
    private final Deque<double[]> buffer = new ArrayDeque<>();
    private int size;

    public SampleAggregator(List<String> features, int size) {
        if (features == null || features.isEmpty()) {
            throw new IllegalArgumentException("feature schema must not be empty");
        }
        if (size < 1) {
            throw new IllegalArgumentException("aggregation size must be at least 1");
        }
        this.features = List.copyOf(features);
        this.size = size;
    }

    /**
     * Adds one raw row. Keys outside the schema are ignored; a schema feature that is absent or
     * not numeric makes the whole row count as missing that feature.
     */
    public AggregationResult submit(Map<String, ?> raw) {
        List<String> missing = new ArrayList<>();
        double[] values = new double[features.size()];
        for (int i = 0; i < features.size(); i++) {
            String feature = features.get(i);
            Double value = raw == null ? null : toDouble(raw.get(feature));
            if (value == null) {
                missing.add(feature);
            } else {
                values[i] = value;
            }
        }
        if (!missing.isEmpty()) {
            return AggregationResult.missing(missing, buffer.size(), size);
        }
        buffer.addLast(values);
        if (buffer.size() < size) {
            return AggregationResult.accumulating(buffer.size(), size);
        }
        double[] sums = new double[features.size()];
        for (double[] row : buffer) {
            for (int i = 0; i < sums.length; i++) {
                sums[i] += row[i];
            }
        }
        int count = buffer.size();
        buffer.clear();
        Map<String, Double> mean = new LinkedHashMap<>();
        for (int i = 0; i < sums.length; i++) {
            mean.put(features.get(i), sums[i] / count);
        }
        return AggregationResult.emitted(Collections.unmodifiableMap(mean), size);
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    /**
     * Changes the group size, keeping at most the most recent {@code newSize - 1} buffered rows
     * so the next submitted row can never overflow the group.
     */
    public void resize(int newSize) {
        if (newSize < 1) {
            throw new IllegalArgumentException("aggregation size must be at least 1");
        }
        while (buffer.size() > newSize - 1) {
            buffer.removeFirst();
        }
        this.size = newSize;
    }

    public int getSize() {
        return size;
    }

    public int buffered() {
        return buffer.size();
    }

    public List<String> getFeatures() {
        return features;
    }
}
