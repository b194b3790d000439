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

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import de.makibytes.faultlens.config.FaultLensProperties;
import de.makibytes.faultlens.model.AnalysisBundle;

/**
 * Append-only record of finished analysis bundles: one JSON document per line on disk, the most
 * recent bundles in memory. Ids continue from the largest persisted one after a restart.
 */
@Component
public class AnalysisHistory {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisHistory.class);

    private final Deque<AnalysisBundle> recent = new ConcurrentLinkedDeque<>();
    private final Map<Long, AnalysisBundle> recentById = new ConcurrentHashMap<>();
    private final AtomicLong idSequence = new AtomicLong();
    private final boolean persistenceEnabled;
    private final Path historyFile;
    private final int memoryLimit;
    private final ObjectMapper objectMapper;
    private final MarkdownReportWriter reportWriter;

    public AnalysisHistory() {
        this(defaultProperties());
    }

    @Autowired
    public AnalysisHistory(FaultLensProperties properties) {
        FaultLensProperties.History history = properties.getHistory();
        this.persistenceEnabled = history.isEnabled();
        this.historyFile = Path.of(history.getFile());
        this.memoryLimit = Math.max(1, history.getMemoryLimit());
        this.objectMapper = new ObjectMapper().findAndRegisterModules()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        String markdownDir = history.getMarkdownDir();
        this.reportWriter = markdownDir == null || markdownDir.isBlank() ? null : new MarkdownReportWriter(Path.of(markdownDir));
        if (persistenceEnabled) {
            loadHistory();
        }
    }

    private static FaultLensProperties defaultProperties() {
        FaultLensProperties props = new FaultLensProperties();
        props.getHistory().setEnabled(false);
        return props;
    }

    public long nextId() {
        return idSequence.incrementAndGet();
    }

    public void record(AnalysisBundle bundle) {
        idSequence.accumulateAndGet(bundle.id(), Math::max);
        remember(bundle);
        if (persistenceEnabled) {
            append(bundle);
        }
        if (reportWriter != null) {
            reportWriter.append(bundle);
        }
    }

    public Optional<AnalysisBundle> latest() {
        return Optional.ofNullable(recent.peekLast());
    }

    /**
     * The last {@code limit} bundles, oldest first.
     */
    public List<AnalysisBundle> recent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<AnalysisBundle> result = new ArrayList<>(Math.min(limit, memoryLimit));
        Iterator<AnalysisBundle> iterator = recent.descendingIterator();
        while (iterator.hasNext() && result.size() < limit) {
            result.add(iterator.next());
        }
        Collections.reverse(result);
        return result;
    }

    public Optional<AnalysisBundle> find(long id) {
        AnalysisBundle bundle = recentById.get(id);
        if (bundle != null) {
            return Optional.of(bundle);
        }
        if (!persistenceEnabled || !Files.exists(historyFile)) {
            return Optional.empty();
        }
        try (BufferedReader reader = Files.newBufferedReader(historyFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                AnalysisBundle candidate = parse(line);
                if (candidate != null && candidate.id() == id) {
                    return Optional.of(candidate);
                }
            }
        } catch (IOException ex) {
            logger.warn("Failed to search analysis history: {}", ex.getMessage());
        }
        return Optional.empty();
    }

    /**
     * The Markdown report written for {@code day}. Empty when reports are off or that day has none.
     */
    public Optional<String> dailyReport(LocalDate day) {
        if (reportWriter == null) {
            return Optional.empty();
        }
        return reportWriter.read(day);
    }

    public int size() {
        return recent.size();
    }

    private void remember(AnalysisBundle bundle) {
        recent.addLast(bundle);
        recentById.put(bundle.id(), bundle);
        while (recent.size() > memoryLimit) {
            AnalysisBundle evicted = recent.pollFirst();
            if (evicted != null) {
                recentById.remove(evicted.id());
            }
        }
    }

    private void append(AnalysisBundle bundle) {
        try {
            if (historyFile.getParent() != null) {
                Files.createDirectories(historyFile.getParent());
            }
            String line = objectMapper.writeValueAsString(bundle) + System.lineSeparator();
            Files.writeString(historyFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException ex) {
            logger.warn("Failed to append analysis {} to history: {}", bundle.id(), ex.getMessage());
        }
    }

    private void loadHistory() {
        if (!Files.exists(historyFile)) {
            return;
        }
        int loaded = 0;
        try (BufferedReader reader = Files.newBufferedReader(historyFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                AnalysisBundle bundle = parse(line);
                if (bundle != null) {
                    idSequence.accumulateAndGet(bundle.id(), Math::max);
                    remember(bundle);
                    loaded++;
                }
            }
            logger.info("Loaded {} analyses from {}, next id {}", loaded, historyFile, idSequence.get() + 1);
        } catch (IOException ex) {
            logger.warn("Failed to load analysis history: {}", ex.getMessage());
        }
    }

    private AnalysisBundle parse(String line) {
        if (line.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(line, AnalysisBundle.class);
        } catch (IOException ex) {
            logger.warn("Skipping unreadable history line: {}", ex.getMessage());
            return null;
        }
    }
}
