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
package de.makibytes.faultlens.web;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.NoSuchElementException;

import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import de.makibytes.faultlens.analysis.AnalysisOrchestrator;
import de.makibytes.faultlens.ingest.IngestService;
import de.makibytes.faultlens.ingest.TopFeaturePreview;
import de.makibytes.faultlens.model.AnalysisBundle;
import de.makibytes.faultlens.store.AnalysisHistory;

@RestController
public class AnalysisController {

    private static final int MAX_HISTORY_LIMIT = 500;
    private static final MediaType MARKDOWN = new MediaType("text", "markdown", StandardCharsets.UTF_8);

    private final AnalysisOrchestrator orchestrator;
    private final AnalysisHistory history;
    private final IngestService ingestService;

    public AnalysisController(AnalysisOrchestrator orchestrator, AnalysisHistory history, IngestService ingestService) {
        this.orchestrator = orchestrator;
        this.history = history;
        this.ingestService = ingestService;
    }

    @GetMapping("/analysis/latest")
    public AnalysisBundle latest() {
        return orchestrator.latest().orElseThrow(() -> new NoSuchElementException("No analysis has run yet"));
    }

    @GetMapping("/analysis/history")
    public List<AnalysisBundle> history(@RequestParam(name = "limit", defaultValue = "10") int limit) {
        if (limit < 1 || limit > MAX_HISTORY_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_HISTORY_LIMIT);
        }
        return history.recent(limit);
    }

    @GetMapping("/analysis/{id}")
    public AnalysisBundle analysis(@PathVariable("id") long id) {
        return history.find(id).orElseThrow(() -> new NoSuchElementException("Analysis " + id + " not found"));
    }

    @GetMapping("/analysis/download/{date}")
    public ResponseEntity<String> download(@PathVariable("date") String date) {
        LocalDate day;
        try {
            day = LocalDate.parse(date);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("date must be formatted as yyyy-MM-dd");
        }
        String report = history.dailyReport(day)
                .orElseThrow(() -> new NoSuchElementException("No analysis report for " + date));
        return ResponseEntity.ok()
                .contentType(MARKDOWN)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename("analysis_" + day + ".md").build().toString())
                .body(report);
    }

    @GetMapping("/preview/top-features")
    public TopFeaturePreview previewTopFeatures() {
        return ingestService.previewTopFeatures();
    }
}
