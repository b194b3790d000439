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
package de.makibytes.faultlens.store;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import de.makibytes.faultlens.config.FaultLensProperties;
import de.makibytes.faultlens.model.AnalysisBundle;
import de.makibytes.faultlens.model.BackendResult;
import de.makibytes.faultlens.model.BackendStatus;

@DisplayName("AnalysisHistory")
class AnalysisHistoryTest {

    @TempDir
    Path tempDir;

    private FaultLensProperties properties(int memoryLimit) {
        FaultLensProperties properties = new FaultLensProperties();
        properties.getHistory().setEnabled(true);
        properties.getHistory().setFile(tempDir.resolve("history.jsonl").toString());
        properties.getHistory().setMarkdownDir(tempDir.resolve("reports").toString());
        properties.getHistory().setMemoryLimit(memoryLimit);
        return properties;
    }

    private static AnalysisBundle bundle(AnalysisHistory history, long trigger) {
        Map<String, BackendResult> results = new LinkedHashMap<>();
        results.put("local", BackendResult.success("local", "Reactor cooling water inlet temperature step", 1200, 1));
        results.put("claude", BackendResult.timeout("claude", 30000, 1));
        return new AnalysisBundle(history.nextId(), Instant.parse("2026-03-01T08:00:00Z").plusSeconds(trigger), trigger,
                List.of("Reactor Temperature", "Reactor Pressure"), "Top 2 Contributing Features (Fault vs Normal):\n", results);
    }

    @Test
    @DisplayName("keeps the newest bundles in memory and finds older ones on disk")
    void memoryLimitAndFileLookup() {
        AnalysisHistory history = new AnalysisHistory(properties(2));
        for (long trigger = 10; trigger <= 30; trigger += 10) {
            history.record(bundle(history, trigger));
        }

        List<AnalysisBundle> recent = history.recent(10);

        assertEquals(List.of(2L, 3L), recent.stream().map(AnalysisBundle::id).toList());
        assertEquals(3L, history.latest().orElseThrow().id());
        AnalysisBundle evicted = history.find(1).orElseThrow();
        assertEquals(10, evicted.triggerSequenceIndex());
        assertEquals(BackendStatus.TIMEOUT, evicted.results().get("claude").status());
        assertFalse(history.find(99).isPresent());
    }

    @Test
    @DisplayName("returns the newest bundles oldest first when the limit cuts the history")
    void recentKeepsChronologicalOrder() {
        AnalysisHistory history = new AnalysisHistory(properties(50));
        for (long trigger = 10; trigger <= 50; trigger += 10) {
            history.record(bundle(history, trigger));
        }

        assertEquals(List.of(3L, 4L, 5L), history.recent(3).stream().map(AnalysisBundle::id).toList());
        assertEquals(List.of(1L, 2L, 3L, 4L, 5L), history.recent(500).stream().map(AnalysisBundle::id).toList());
        assertTrue(history.recent(0).isEmpty());
    }

    @Test
    @DisplayName("continues ids and restores bundles after a restart")
    void reloadContinuesIds() {
        AnalysisHistory first = new AnalysisHistory(properties(50));
        first.record(bundle(first, 10));
        first.record(bundle(first, 20));

        AnalysisHistory reloaded = new AnalysisHistory(properties(50));

        assertEquals(2, reloaded.size());
        AnalysisBundle latest = reloaded.latest().orElseThrow();
        assertEquals(2L, latest.id());
        assertEquals(List.of("local", "claude"), List.copyOf(latest.results().keySet()));
        assertEquals("Reactor cooling water inlet temperature step", latest.results().get("local").text());
        assertEquals(3L, reloaded.nextId());
    }

    @Test
    @DisplayName("skips unreadable lines when loading")
    void skipsCorruptLines() throws IOException {
        AnalysisHistory first = new AnalysisHistory(properties(50));
        first.record(bundle(first, 10));
        Files.writeString(tempDir.resolve("history.jsonl"), "{not json\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

        AnalysisHistory reloaded = new AnalysisHistory(properties(50));

        assertEquals(1, reloaded.size());
        assertEquals(2L, reloaded.nextId());
    }

    @Test
    @DisplayName("appends a readable daily report")
    void writesMarkdownReport() throws IOException {
        AnalysisHistory history = new AnalysisHistory(properties(50));
        history.record(bundle(history, 10));
        history.record(bundle(history, 20));

        List<Path> reports;
        try (Stream<Path> files = Files.list(tempDir.resolve("reports"))) {
            reports = files.toList();
        }

        assertEquals(1, reports.size());
        String name = reports.get(0).getFileName().toString();
        assertTrue(name.startsWith("analysis_") && name.endsWith(".md"), name);
        String report = Files.readString(reports.get(0), StandardCharsets.UTF_8);
        assertTrue(report.startsWith("# Fault Analysis Log "));
        assertTrue(report.contains("## Analysis 1 ("));
        assertTrue(report.contains("## Analysis 2 ("));
        assertTrue(report.contains("Error: no response within 30000 ms"));
        assertTrue(report.contains("*Words:* 6"));
    }

    @Test
    @DisplayName("serves the report of a day that had analyses")
    void dailyReportByDate() {
        AnalysisHistory history = new AnalysisHistory(properties(50));
        AnalysisBundle recorded = bundle(history, 10);
        history.record(recorded);
        LocalDate day = LocalDate.ofInstant(recorded.timestamp(), ZoneId.systemDefault());

        String report = history.dailyReport(day).orElseThrow();

        assertTrue(report.startsWith("# Fault Analysis Log " + day));
        assertTrue(report.contains("## Analysis 1 ("));
        assertFalse(history.dailyReport(day.minusDays(1)).isPresent());
        assertFalse(new AnalysisHistory().dailyReport(day).isPresent());
    }

    @Test
    @DisplayName("stays in memory when persistence is disabled")
    void disabledPersistence() {
        AnalysisHistory history = new AnalysisHistory();
        history.record(bundle(history, 10));

        assertEquals(1, history.recent(5).size());
        assertTrue(history.find(1).isPresent());
        assertFalse(history.find(2).isPresent());
    }
}
