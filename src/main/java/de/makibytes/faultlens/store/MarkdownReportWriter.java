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
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.makibytes.faultlens.model.AnalysisBundle;
import de.makibytes.faultlens.model.BackendResult;

/**
 * Human-readable daily log of analyses, one Markdown file per day.
 */
class MarkdownReportWriter {

    private static final Logger logger = LoggerFactory.getLogger(MarkdownReportWriter.class);
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneId.systemDefault());
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private final Path directory;

    MarkdownReportWriter(Path directory) {
        this.directory = directory;
    }

    void append(AnalysisBundle bundle) {
        Path file = fileFor(LocalDate.ofInstant(bundle.timestamp(), ZoneId.systemDefault()));
        try {
            Files.createDirectories(directory);
            boolean newFile = !Files.exists(file);
            StringBuilder text = new StringBuilder();
            if (newFile) {
                text.append("# Fault Analysis Log ").append(DAY.format(bundle.timestamp())).append("\n\n");
            }
            text.append(render(bundle));
            Files.writeString(file, text.toString(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException ex) {
            logger.warn("Failed to write analysis report {}: {}", file, ex.getMessage());
        }
    }

    /**
     * The full report of one day, or empty when nothing was analyzed that day.
     */
    Optional<String> read(LocalDate day) {
        Path file = fileFor(day);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read analysis report " + file, ex);
        }
    }

    Path fileFor(LocalDate day) {
        return directory.resolve("analysis_" + DateTimeFormatter.ISO_LOCAL_DATE.format(day) + ".md");
    }

    static String render(AnalysisBundle bundle) {
        StringBuilder text = new StringBuilder();
        text.append("## Analysis ").append(bundle.id())
                .append(" (").append(TIME.format(bundle.timestamp())).append(")\n\n");
        text.append("**Trigger row:** ").append(bundle.triggerSequenceIndex()).append("\n\n");
        text.append("### Feature Comparison\n\n```\n").append(bundle.featureComparison()).append("```\n\n");
        Map<String, Integer> wordCounts = bundle.wordCounts();
        for (Map.Entry<String, BackendResult> entry : bundle.results().entrySet()) {
            BackendResult result = entry.getValue();
            text.append("### ").append(entry.getKey()).append("\n\n");
            text.append("*Status:* ").append(result.status())
                    .append(" | *Time:* ").append(result.elapsedMs()).append(" ms")
                    .append(" | *Words:* ").append(wordCounts.get(entry.getKey())).append("\n\n");
            text.append(result.succeeded() ? result.text() : "Error: " + result.error()).append("\n\n");
        }
        text.append("---\n\n");
        return text.toString();
    }
}
