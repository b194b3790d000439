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

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import de.makibytes.faultlens.backend.AnalysisBackend;
import de.makibytes.faultlens.backend.BackendRegistry;
import de.makibytes.faultlens.model.AnalysisBundle;
import de.makibytes.faultlens.model.BackendResult;
import de.makibytes.faultlens.store.AnalysisHistory;
import de.makibytes.faultlens.stream.StreamBroadcaster;

/**
 * Runs one analysis cycle: every active backend is queried concurrently under its own ceiling,
 * and the bundle is assembled once all of them have settled.
 */
@Service
public class AnalysisOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisOrchestrator.class);

    private final BackendRegistry registry;
    private final BackendInvoker invoker;
    private final AnalysisHistory history;
    private final StreamBroadcaster broadcaster;
    private final ManualAnalysisService manualAnalysis;
    private final Clock clock;
    private final AtomicReference<AnalysisBundle> latest = new AtomicReference<>();
    private final AtomicLong completedCycles = new AtomicLong();
    private final AtomicLong partialFailures = new AtomicLong();

    public AnalysisOrchestrator(BackendRegistry registry,
                                BackendInvoker invoker,
                                AnalysisHistory history,
                                StreamBroadcaster broadcaster,
                                ManualAnalysisService manualAnalysis,
                                Clock clock) {
        this.registry = registry;
        this.invoker = invoker;
        this.history = history;
        this.broadcaster = broadcaster;
        this.manualAnalysis = manualAnalysis;
        this.clock = clock;
        AnalysisBundle persisted = history.latest().orElse(null);
        if (persisted != null) {
            latest.set(persisted);
        }
    }

    public AnalysisBundle dispatch(AnalysisContext context) {
        List<AnalysisBackend> active = registry.activeBackends();
        if (active.isEmpty()) {
            logger.warn("Analysis for row {} runs without any active backend", context.triggerSequenceIndex());
        }
        Map<String, CompletableFuture<BackendResult>> calls = new LinkedHashMap<>();
        for (AnalysisBackend backend : active) {
            calls.put(backend.getId(), invoker.invoke(backend, context.systemInstructions(), context.prompt()));
        }
        CompletableFuture.allOf(calls.values().toArray(new CompletableFuture[0])).join();

        Map<String, BackendResult> results = new LinkedHashMap<>();
        calls.forEach((backendId, call) -> results.put(backendId, call.join()));

        AnalysisBundle bundle = new AnalysisBundle(
                history.nextId(),
                clock.instant(),
                context.triggerSequenceIndex(),
                context.topFeatures(),
                context.featureComparison(),
                results);
        results.forEach((backendId, result) -> {
            if (result.succeeded()) {
                registry.recordUsage(backendId);
                manualAnalysis.showResult(backendId, result);
            }
        });

        history.record(bundle);
        latest.set(bundle);
        broadcaster.publishAnalysis(bundle);
        completedCycles.incrementAndGet();
        if (bundle.partialFailure()) {
            partialFailures.incrementAndGet();
            logger.warn("Analysis {} finished with {}/{} backends successful", bundle.id(), bundle.successCount(), results.size());
        } else {
            logger.info("Analysis {} finished, all {} backends successful", bundle.id(), results.size());
        }
        return bundle;
    }

    public Optional<AnalysisBundle> latest() {
        return Optional.ofNullable(latest.get());
    }

    public long getCompletedCycles() {
        return completedCycles.get();
    }

    public long getPartialFailures() {
        return partialFailures.get();
    }
}
