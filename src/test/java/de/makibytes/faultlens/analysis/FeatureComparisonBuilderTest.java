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
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import de.makibytes.faultlens.detector.BaselineStatistics;
import de.makibytes.faultlens.detector.BaselineStatistics.FeatureStats;
import de.makibytes.faultlens.model.AggregatedRow;
import de.makibytes.faultlens.support.Rows;

@DisplayName("FeatureComparisonBuilder")
class FeatureComparisonBuilderTest {

    private static final List<String> SCHEMA = List.of("Reactor Pressure", "Stripper Level", "Purge Rate");

    @Test
    @DisplayName("renders fault against normal for each top feature")
    void rendersComparison() {
        BaselineStatistics baseline = new BaselineStatistics(Map.of(
                "Reactor Pressure", new FeatureStats(2700.0, 10.0),
                "Stripper Level", new FeatureStats(0.0, 1.0)));
        AggregatedRow latest = Rows.row(5, SCHEMA, true, "Reactor Pressure", 2750.0, "Stripper Level", 2.5);

        String text = FeatureComparisonBuilder.build(List.of("Reactor Pressure", "Stripper Level"), latest, baseline);

        String[] lines = text.split("\n");
        assertEquals("Top 2 Contributing Features (Fault vs Normal):", lines[0]);
        assertEquals("1. Reactor Pressure: Fault=2750.000 | Normal=2700.000 | Δ=50.000 (1.9%) | z=5.00", lines[1]);
        assertEquals("2. Stripper Level: Fault=2.500 | Normal=0.000 | Δ=2.500 (n/a) | z=2.50", lines[2]);
    }

    @Test
    @DisplayName("marks features without baseline statistics")
    void missingBaseline() {
        AggregatedRow latest = Rows.row(5, SCHEMA, true, "Purge Rate", 0.25);

        String text = FeatureComparisonBuilder.build(List.of("Purge Rate"), latest, null);

        assertTrue(text.contains("1. Purge Rate: Fault=0.250 | Normal=NA (baseline not loaded)"));
    }
}
