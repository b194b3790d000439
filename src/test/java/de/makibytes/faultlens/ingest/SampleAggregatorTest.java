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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SampleAggregator")
class SampleAggregatorTest {

    private static final List<String> FEATURES = List.of("Reactor Temperature", "Reactor Pressure");

    private static Map<String, Double> raw(double temperature, double pressure) {
        Map<String, Double> row = new HashMap<>();
        row.put("Reactor Temperature", temperature);
        row.put("Reactor Pressure", pressure);
        return row;
    }

    @Test
    @DisplayName("emits floor(total / N) rows, each the mean of its group")
    void emitsOneMeanPerGroup() {
        SampleAggregator aggregator = new SampleAggregator(FEATURES, 3);
        List<Map<String, Double>> emitted = new ArrayList<>();

        for (int i = 1; i <= 10; i++) {
            AggregationResult result = aggregator.submit(raw(i, 10.0 * i));
            if (result.status() == AggregationResult.Status.EMITTED) {
                emitted.add(result.row());
            }
        }

        assertEquals(3, emitted.size());
        assertEquals(2.0, emitted.get(0).get("Reactor Temperature"), 1e-9);
        assertEquals(50.0, emitted.get(1).get("Reactor Pressure"), 1e-9);
        assertEquals(8.0, emitted.get(2).get("Reactor Temperature"), 1e-9);
        assertEquals(1, aggregator.buffered());
    }

    @Test
    @DisplayName("reports progress while accumulating")
    void reportsProgress() {
        SampleAggregator aggregator = new SampleAggregator(FEATURES, 4);

        AggregationResult first = aggregator.submit(raw(1, 1));
        AggregationResult second = aggregator.submit(raw(1, 1));

        assertEquals(AggregationResult.Status.ACCUMULATING, first.status());
        assertEquals(1, first.have());
        assertEquals(4, first.need());
        assertEquals(2, second.have());
        assertNull(second.row());
    }

    @Test
    @DisplayName("rejects rows with a missing feature without touching the buffer")
    void rejectsMissingFeature() {
        SampleAggregator aggregator = new SampleAggregator(FEATURES, 2);
        aggregator.submit(raw(1, 1));

        AggregationResult result = aggregator.submit(Map.of("Reactor Temperature", 5.0));

        assertEquals(AggregationResult.Status.MISSING_FEATURE, result.status());
        assertEquals(List.of("Reactor Pressure"), result.missing());
        assertEquals(1, aggregator.buffered());
        AggregationResult next = aggregator.submit(raw(3, 3));
        assertEquals(AggregationResult.Status.EMITTED, next.status());
        assertEquals(2.0, next.row().get("Reactor Temperature"), 1e-9);
    }

    @Test
    @DisplayName("ignores keys outside the schema")
    void ignoresExtraKeys() {
        SampleAggregator aggregator = new SampleAggregator(FEATURES, 1);
        Map<String, Double> row = raw(2, 4);
        row.put("Unrelated", 99.0);

        AggregationResult result = aggregator.submit(row);

        assertEquals(AggregationResult.Status.EMITTED, result.status());
        assertEquals(FEATURES, List.copyOf(result.row().keySet()));
    }

    @Test
    @DisplayName("shrinking keeps the most recent N-1 buffered rows")
    void resizeTruncatesBuffer() {
        SampleAggregator aggregator = new SampleAggregator(FEATURES, 5);
        for (int i = 1; i <= 4; i++) {
            aggregator.submit(raw(i, i));
        }

        aggregator.resize(3);

        assertEquals(2, aggregator.buffered());
        AggregationResult result = aggregator.submit(raw(6, 6));
        assertEquals(AggregationResult.Status.EMITTED, result.status());
        // rows 3, 4 and 6 remain
        assertEquals(13.0 / 3.0, result.row().get("Reactor Temperature"), 1e-9);
    }

    @Test
    @DisplayName("rejects invalid sizes and schemas")
    void rejectsInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new SampleAggregator(FEATURES, 0));
        assertThrows(IllegalArgumentException.class, () -> new SampleAggregator(List.of(), 1));
        SampleAggregator aggregator = new SampleAggregator(FEATURES, 2);
        assertThrows(IllegalArgumentException.class, () -> aggregator.resize(0));
    }
}
