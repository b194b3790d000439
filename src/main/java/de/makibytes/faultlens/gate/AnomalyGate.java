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
package de.makibytes.faultlens.gate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.makibytes.faultlens.config.RuntimeSettings;
import de.makibytes.faultlens.model.AggregatedRow;
import de.makibytes.faultlens.model.TriggerDecision;
import de.makibytes.faultlens.model.TriggerReason;

/**
 * Decides, row by row, whether an analysis cycle may start.
 * <p>
 * {@link #evaluate(AggregatedRow)} must be called from a single control path in ingestion order.
 * Only the in-flight flag is touched from another thread: the dispatch worker clears it when the
 * cycle ends, whatever the outcome.
 */
public class AnomalyGate {

    private static final Logger logger = LoggerFactory.getLogger(AnomalyGate.class);

    private final List<String> features;
    private final SlidingWindow window;
    private final Executor dispatchExecutor;
    private final TriggerHandler handler;
    private final Clock clock;
    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    private volatile RuntimeSettings settings;
    private volatile int consecutiveAnomalies;
    private volatile Instant lastTriggerTime;
    private volatile FeatureFingerprint lastFingerprint;
    private volatile List<String> lastTriggeredFeatures = List.of();
    private Instant lastDivergenceTriggerTime;

    public AnomalyGate(List<String> features,
                       RuntimeSettings settings,
                       Executor dispatchExecutor,
                       TriggerHandler handler,
                       Clock clock) {
        this.features = List.copyOf(features);
        this.settings = settings;
        this.window = new SlidingWindow(settings.windowSize());
        this.dispatchExecutor = dispatchExecutor;
        this.handler = handler;
        this.clock = clock;
    }

    public TriggerDecision evaluate(AggregatedRow row) {
        RuntimeSettings current = settings;
        window.push(row);
        consecutiveAnomalies = row.isAnomaly() ? consecutiveAnomalies + 1 : 0;

        if (!row.isAnomaly()) {
            return TriggerDecision.skipped(TriggerReason.NOT_ANOMALOUS, "row is within the normal range");
        }
        if (consecutiveAnomalies < current.requiredConsecutive()) {
            return TriggerDecision.skipped(TriggerReason.NOT_ANOMALOUS,
                    "anomaly " + consecutiveAnomalies + "/" + current.requiredConsecutive());
        }
        int minContext = current.effectiveMinContext();
        if (window.size() < minContext) {
            return TriggerDecision.skipped(TriggerReason.INSUFFICIENT_CONTEXT,
                    "window holds " + window.size() + "/" + minContext + " rows");
        }
        if (inFlight.get()) {
            return TriggerDecision.skipped(TriggerReason.ALREADY_IN_FLIGHT, "analysis already in progress");
        }

        List<String> topFeatures = FeatureRanker.topFeatures(window.snapshot(), features, current.topK());
        FeatureFingerprint fingerprint = FeatureFingerprint.of(topFeatures);
        Instant now = clock.instant();

        TriggerReason reason;
        boolean divergenceDriven = false;
        if (lastTriggerTime == null) {
            reason = TriggerReason.FIRST_DETECTION;
        } else {
            double similarity = fingerprint.similarity(lastFingerprint);
            boolean diverged = similarity < current.fingerprintJaccardThreshold();
            Duration sinceTrigger = Duration.between(lastTriggerTime, now);
            if (sinceTrigger.compareTo(current.minInterval()) >= 0) {
                reason = diverged ? TriggerReason.STATE_CHANGED : TriggerReason.INTERVAL_ELAPSED;
            } else if (diverged && divergenceCooldownElapsed(now, current)) {
                reason = TriggerReason.STATE_CHANGED;
                divergenceDriven = true;
            } else {
                long waitSeconds = current.minInterval().minus(sinceTrigger).toSeconds();
                return TriggerDecision.skipped(TriggerReason.RATE_LIMITED, topFeatures,
                        String.format("similarity %.2f, next trigger in %ds", similarity, waitSeconds));
            }
        }
        return trigger(row, now, reason, divergenceDriven, topFeatures, fingerprint);
    }

    private boolean divergenceCooldownElapsed(Instant now, RuntimeSettings current) {
        return lastDivergenceTriggerTime == null
                || Duration.between(lastDivergenceTriggerTime, now).compareTo(current.fingerprintCooldown()) >= 0;
    }

    private TriggerDecision trigger(AggregatedRow row,
                                    Instant now,
                                    TriggerReason reason,
                                    boolean divergenceDriven,
                                    List<String> topFeatures,
                                    FeatureFingerprint fingerprint) {
        int previousCount = consecutiveAnomalies;
        Instant previousTriggerTime = lastTriggerTime;
        FeatureFingerprint previousFingerprint = lastFingerprint;
        List<String> previousFeatures = lastTriggeredFeatures;
        Instant previousDivergenceTime = lastDivergenceTriggerTime;

        inFlight.set(true);
        lastTriggerTime = now;
        lastFingerprint = fingerprint;
        lastTriggeredFeatures = topFeatures;
        if (divergenceDriven) {
            lastDivergenceTriggerTime = now;
        }
        consecutiveAnomalies = 0;

        TriggerContext context = new TriggerContext(row.getSequenceIndex(), now, reason, topFeatures, window.snapshot());
        try {
            dispatchExecutor.execute(() -> runHandler(context));
        } catch (RejectedExecutionException ex) {
            inFlight.set(false);
            lastTriggerTime = previousTriggerTime;
            lastFingerprint = previousFingerprint;
            lastTriggeredFeatures = previousFeatures;
            lastDivergenceTriggerTime = previousDivergenceTime;
            consecutiveAnomalies = previousCount;
            logger.warn("Analysis hand-off rejected at row {}: {}", row.getSequenceIndex(), ex.getMessage());
            return TriggerDecision.skipped(TriggerReason.RATE_LIMITED, topFeatures, "analysis dispatch unavailable");
        }
        logger.info("Analysis triggered at row {} ({}), top features {}", row.getSequenceIndex(), reason, topFeatures);
        return TriggerDecision.triggered(reason, topFeatures, "analysis dispatched");
    }

    private void runHandler(TriggerContext context) {
        try {
            handler.onTrigger(context);
        } catch (RuntimeException ex) {
            logger.error("Analysis cycle for row {} failed: {}", context.sequenceIndex(), ex.getMessage(), ex);
        } finally {
            inFlight.set(false);
        }
    }

    public List<String> previewTopFeatures() {
        return FeatureRanker.topFeatures(window.snapshot(), features, settings.topK());
    }

    public List<AggregatedRow> windowSnapshot() {
        return window.snapshot();
    }

    public void applySettings(RuntimeSettings newSettings) {
        window.resize(newSettings.windowSize());
        this.settings = newSettings;
    }

    public void reset() {
        window.clear();
        consecutiveAnomalies = 0;
    }

    public boolean isInFlight() {
        return inFlight.get();
    }

    public int getConsecutiveAnomalies() {
        return consecutiveAnomalies;
    }

    public RuntimeSettings getSettings() {
        return settings;
    }

    public GateSnapshot snapshot() {
        return new GateSnapshot(
                window.size(),
                window.capacity(),
                consecutiveAnomalies,
                inFlight.get(),
                lastTriggerTime,
                lastTriggeredFeatures);
    }
}
