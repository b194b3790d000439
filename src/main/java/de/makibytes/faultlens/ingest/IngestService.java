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

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import de.makibytes.faultlens.analysis.AnalysisContext;
import de.makibytes.faultlens.analysis.AnalysisContextFactory;
import de.makibytes.faultlens.analysis.AnalysisOrchestrator;
import de.makibytes.faultlens.backend.PremiumSessionExpiredEvent;
import de.makibytes.faultlens.config.FaultLensProperties;
import de.makibytes.faultlens.config.NamedThreadFactory;
import de.makibytes.faultlens.config.RuntimeSettings;
import de.makibytes.faultlens.config.RuntimeSettingsUpdate;
import de.makibytes.faultlens.detector.BaselineFaultDetector;
import de.makibytes.faultlens.detector.FaultDetector;
import de.makibytes.faultlens.gate.AnomalyGate;
import de.makibytes.faultlens.gate.TriggerContext;
import de.makibytes.faultlens.model.AggregatedRow;
import de.makibytes.faultlens.model.DetectorVerdict;
import de.makibytes.faultlens.model.IngestAcknowledgement;
import de.makibytes.faultlens.model.TriggerDecision;
import de.makibytes.faultlens.stream.StreamBroadcaster;
import jakarta.annotation.PreDestroy;

/**
 * The single control path: aggregation, scoring, gating and broadcasting run here, one row at a
 * time, under this service's monitor. Analysis cycles are handed to a one-thread dispatch executor.
 */
@Service
public class IngestService {

    private static final Logger logger = LoggerFactory.getLogger(IngestService.class);

    private final FaultDetector detector;
    private final StreamBroadcaster broadcaster;
    private final AnalysisOrchestrator orchestrator;
    private final AnalysisContextFactory contextFactory;
    private final Clock clock;
    private final ThreadPoolExecutor dispatchExecutor;
    private final SampleAggregator aggregator;
    private final AnomalyGate gate;
    private final AtomicLong rawRows = new AtomicLong();
    private final AtomicLong rejectedRows = new AtomicLong();
    private final AtomicLong triggers = new AtomicLong();
    private final AtomicReference<PremiumSessionExpiredEvent> lastSessionEnd = new AtomicReference<>();

    private volatile RuntimeSettings settings;
    private volatile long sequence;

    public IngestService(FaultLensProperties properties,
                         FaultDetector detector,
                         StreamBroadcaster broadcaster,
                         AnalysisOrchestrator orchestrator,
                         AnalysisContextFactory contextFactory,
                         Clock clock) {
        List<String> features = properties.getFeatures();
        if (features == null || features.isEmpty()) {
            throw new IllegalStateException("faultlens.features must list at least one feature");
        }
        this.detector = detector;
        this.broadcaster = broadcaster;
        this.orchestrator = orchestrator;
        this.contextFactory = contextFactory;
        this.clock = clock;
        this.settings = RuntimeSettings.fromProperties(properties);
        this.dispatchExecutor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(1), new NamedThreadFactory("analysis-dispatch"));
        this.aggregator = new SampleAggregator(features, settings.decimationSize());
        this.gate = new AnomalyGate(features, settings, dispatchExecutor, this::runAnalysis, clock);
        logger.info("Ingest ready: {} features, decimation {}, window {}", features.size(),
                settings.decimationSize(), settings.windowSize());
    }

    public synchronized IngestAcknowledgement ingest(Map<String, ?> raw) {
        rawRows.incrementAndGet();
        AggregationResult aggregation = aggregator.submit(raw);
        switch (aggregation.status()) {
            case MISSING_FEATURE -> {
                rejectedRows.incrementAndGet();
                logger.debug("Rejected row, missing features {}", aggregation.missing());
                return IngestAcknowledgement.rejected(aggregation.missing(), aggregation.have(), aggregation.need());
            }
            case ACCUMULATING -> {
                return IngestAcknowledgement.accumulating(aggregation.have(), aggregation.need());
            }
            default -> {
                // emitted, continue below
            }
        }

        DetectorVerdict verdict = detector.evaluate(aggregation.row());
        AggregatedRow row = new AggregatedRow(++sequence, clock.instant(), aggregation.row(), verdict);
        TriggerDecision decision = gate.evaluate(row);
        broadcaster.publish(row);
        if (decision.eligible()) {
            triggers.incrementAndGet();
        }
        logger.debug("Row {} score {} anomaly {} -> {}", row.getSequenceIndex(), verdict.score(), verdict.anomaly(), decision.reason());
        return IngestAcknowledgement.evaluated(row, aggregation.need(), gate.getConsecutiveAnomalies(), decision);
    }

    private void runAnalysis(TriggerContext trigger) {
        AnalysisContext context = contextFactory.forTrigger(trigger);
        orchestrator.dispatch(context);
    }

    public synchronized RuntimeSettings updateRuntimeSettings(RuntimeSettingsUpdate update) {
        RuntimeSettings updated = settings.apply(update);
        if (updated.decimationSize() != aggregator.getSize()) {
            aggregator.resize(updated.decimationSize());
        }
        gate.applySettings(updated);
        settings = updated;
        logger.info("Runtime settings updated: {}", updated);
        return updated;
    }

    public RuntimeSettings getRuntimeSettings() {
        return settings;
    }

    public synchronized void updateThreshold(double threshold) {
        detector.updateThreshold(threshold);
    }

    /**
     * Loads a new baseline and clears the window, since scores against the old baseline are not comparable.
     */
    public synchronized void reloadBaseline(String location) {
        if (!(detector instanceof BaselineFaultDetector baselineDetector)) {
            throw new IllegalStateException("Detector " + detector.getClass().getSimpleName() + " has no reloadable baseline");
        }
        baselineDetector.reloadBaseline(location);
        gate.reset();
    }

    public TopFeaturePreview previewTopFeatures() {
        List<AggregatedRow> window = gate.windowSnapshot();
        if (window.isEmpty()) {
            return new TopFeaturePreview(-1, List.of(), "");
        }
        AnalysisContext context = contextFactory.forWindow(gate.previewTopFeatures(), window.get(window.size() - 1), clock.instant());
        return new TopFeaturePreview(context.triggerSequenceIndex(), context.topFeatures(), context.featureComparison());
    }

    /**
     * Context for a direct backend query from the current window.
     *
     * @throws IllegalStateException when no row has been aggregated yet
     */
    public AnalysisContext currentContext() {
        List<AggregatedRow> window = gate.windowSnapshot();
        if (window.isEmpty()) {
            throw new IllegalStateException("No aggregated data available yet");
        }
        return contextFactory.forWindow(gate.previewTopFeatures(), window.get(window.size() - 1), clock.instant());
    }

    @EventListener
    public void onPremiumSessionExpired(PremiumSessionExpiredEvent event) {
        lastSessionEnd.set(event);
        if (event.forced()) {
            logger.info("Premium session shut down by operator, disabled {}", event.disabledBackends());
        } else {
            logger.warn("Premium session expired, disabled {}", event.disabledBackends());
        }
    }

    /**
     * Clears the auto-stop flag raised by a premium session expiry.
     */
    public synchronized IngestStatus resetAutoStop() {
        if (lastSessionEnd.getAndSet(null) != null) {
            logger.info("Auto-stop flag reset");
        }
        return status();
    }

    public synchronized IngestStatus status() {
        PremiumSessionExpiredEvent sessionEnd = lastSessionEnd.get();
        boolean autoStopped = sessionEnd != null && !sessionEnd.forced();
        return new IngestStatus(
                rawRows.get(),
                rejectedRows.get(),
                sequence,
                aggregator.buffered(),
                triggers.get(),
                settings,
                gate.snapshot(),
                autoStopped,
                autoStopped ? sessionEnd.endedAt() : null);
    }

    AnomalyGate getGate() {
        return gate;
    }

    @PreDestroy
    public void shutdown() {
        dispatchExecutor.shutdownNow();
    }
}
