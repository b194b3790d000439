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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import de.makibytes.faultlens.config.RuntimeSettings;
import de.makibytes.faultlens.model.AggregatedRow;
import de.makibytes.faultlens.model.TriggerDecision;
import de.makibytes.faultlens.model.TriggerReason;
import de.makibytes.faultlens.support.MutableClock;
import de.makibytes.faultlens.support.Rows;

@DisplayName("AnomalyGate")
class AnomalyGateTest {

    private static final List<String> SCHEMA = List.of("T", "P", "F", "L", "X");

    private MutableClock clock;
    private List<TriggerContext> handled;
    private long sequence;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
        handled = new ArrayList<>();
        sequence = 0;
    }

    private static RuntimeSettings settings(int requiredConsecutive, long minIntervalSeconds) {
        return new RuntimeSettings(1, 20, 5, requiredConsecutive, Duration.ofSeconds(minIntervalSeconds),
                2, 0.6, Duration.ofSeconds(120));
    }

    private AnomalyGate gate(RuntimeSettings settings, Executor executor) {
        return new AnomalyGate(SCHEMA, settings, executor, handled::add, clock);
    }

    private TriggerDecision feed(AnomalyGate gate, boolean anomaly, Object... values) {
        clock.advanceSeconds(1);
        AggregatedRow row = Rows.row(++sequence, SCHEMA, anomaly, values);
        return gate.evaluate(row);
    }

    private void feedNormal(AnomalyGate gate, int count) {
        for (int i = 0; i < count; i++) {
            assertEquals(TriggerReason.NOT_ANOMALOUS, feed(gate, false).reason());
        }
    }

    @Test
    @DisplayName("retriggers inside the interval only when the contributing features diverge")
    void retriggersOnFeatureDivergence() {
        AnomalyGate gate = gate(settings(3, 60), Runnable::run);
        feedNormal(gate, 10);

        List<TriggerDecision> decisions = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            decisions.add(feed(gate, true, "T", 10.0, "P", 10.0));
        }
        TriggerDecision divergent = feed(gate, true, "F", 10.0, "L", 10.0);

        assertEquals(TriggerReason.NOT_ANOMALOUS, decisions.get(0).reason());
        assertEquals(TriggerReason.NOT_ANOMALOUS, decisions.get(1).reason());
        assertTrue(decisions.get(2).eligible());
        assertEquals(TriggerReason.FIRST_DETECTION, decisions.get(2).reason());
        assertEquals(List.of("T", "P"), decisions.get(2).topFeatures());
        assertEquals(1, decisions.stream().filter(TriggerDecision::eligible).count());
        assertEquals(TriggerReason.RATE_LIMITED, decisions.get(9).reason());

        assertTrue(divergent.eligible());
        assertEquals(TriggerReason.STATE_CHANGED, divergent.reason());
        assertEquals(List.of("F", "L"), divergent.topFeatures());
        assertEquals(2, handled.size());
        assertEquals(List.of("F", "L"), gate.snapshot().lastTriggeredFeatures());
    }

    @Test
    @DisplayName("a constant anomaly retriggers only after the minimum interval")
    void constantAnomalyWaitsForInterval() {
        AnomalyGate gate = gate(settings(1, 60), Runnable::run);
        feedNormal(gate, 5);

        assertEquals(TriggerReason.FIRST_DETECTION, feed(gate, true, "T", 10.0).reason());
        for (int i = 0; i < 30; i++) {
            assertEquals(TriggerReason.RATE_LIMITED, feed(gate, true, "T", 10.0).reason());
        }
        clock.advanceSeconds(30);
        TriggerDecision later = feed(gate, true, "T", 10.0);

        assertTrue(later.eligible());
        assertEquals(TriggerReason.INTERVAL_ELAPSED, later.reason());
        assertEquals(2, handled.size());
    }

    @Test
    @DisplayName("a second divergence must wait for the divergence cooldown")
    void divergenceHasItsOwnCooldown() {
        AnomalyGate gate = gate(settings(3, 60), Runnable::run);
        feedNormal(gate, 10);
        for (int i = 0; i < 10; i++) {
            feed(gate, true, "T", 10.0, "P", 10.0);
        }
        assertEquals(TriggerReason.STATE_CHANGED, feed(gate, true, "F", 10.0, "L", 10.0).reason());
        feed(gate, true, "F", 10.0, "L", 10.0);
        feed(gate, true, "F", 10.0, "L", 10.0);

        TriggerDecision back = feed(gate, true, "T", 50.0, "P", 50.0);

        assertFalse(back.eligible());
        assertEquals(TriggerReason.RATE_LIMITED, back.reason());
        assertEquals(List.of("T", "P"), back.topFeatures());
        assertEquals(2, handled.size());
    }

    @Test
    @DisplayName("refuses to trigger without enough context")
    void requiresContext() {
        AnomalyGate gate = gate(settings(1, 0), Runnable::run);

        TriggerDecision decision = feed(gate, true, "T", 10.0);

        assertEquals(TriggerReason.INSUFFICIENT_CONTEXT, decision.reason());
        assertTrue(handled.isEmpty());
    }

    @Test
    @DisplayName("single flight: blocks while in flight, clears even when the cycle throws")
    void inFlightIsClearedAfterFailure() {
        List<Runnable> pending = new ArrayList<>();
        AnomalyGate gate = new AnomalyGate(SCHEMA, settings(1, 0), pending::add, context -> {
            throw new IllegalStateException("backend exploded");
        }, clock);
        feedNormal(gate, 5);

        assertTrue(feed(gate, true, "T", 10.0).eligible());
        assertTrue(gate.isInFlight());
        assertEquals(TriggerReason.ALREADY_IN_FLIGHT, feed(gate, true, "T", 10.0).reason());

        pending.remove(0).run();

        assertFalse(gate.isInFlight());
        TriggerDecision next = feed(gate, true, "T", 10.0);
        assertTrue(next.eligible());
        assertEquals(TriggerReason.INTERVAL_ELAPSED, next.reason());
    }

    @Test
    @DisplayName("a rejected hand-off fails closed and restores the gate state")
    void rejectedHandOffRestoresState() {
        AtomicBoolean reject = new AtomicBoolean(true);
        AnomalyGate gate = gate(settings(1, 60), runnable -> {
            if (reject.get()) {
                throw new RejectedExecutionException("queue full");
            }
            runnable.run();
        });
        feedNormal(gate, 5);

        TriggerDecision refused = feed(gate, true, "T", 10.0);

        assertFalse(refused.eligible());
        assertEquals(TriggerReason.RATE_LIMITED, refused.reason());
        GateSnapshot snapshot = gate.snapshot();
        assertFalse(snapshot.inFlight());
        assertNull(snapshot.lastTriggerTime());
        assertEquals(1, snapshot.consecutiveAnomalies());
        assertTrue(snapshot.lastTriggeredFeatures().isEmpty());

        reject.set(false);
        TriggerDecision accepted = feed(gate, true, "T", 10.0);
        assertEquals(TriggerReason.FIRST_DETECTION, accepted.reason());
        assertEquals(1, handled.size());
    }

    @Test
    @DisplayName("window resize keeps the newest rows and preview does not trigger")
    void resizeAndPreview() {
        AnomalyGate gate = gate(settings(1, 60), Runnable::run);
        feedNormal(gate, 12);
        feed(gate, false, "X", 4.0);

        gate.applySettings(new RuntimeSettings(1, 5, 5, 1, Duration.ofSeconds(60), 2, 0.6, Duration.ofSeconds(120)));

        GateSnapshot snapshot = gate.snapshot();
        assertEquals(5, snapshot.windowSize());
        assertEquals(5, snapshot.windowCapacity());
        assertEquals(13L, gate.windowSnapshot().get(4).getSequenceIndex());
        assertEquals("X", gate.previewTopFeatures().get(0));
        assertTrue(handled.isEmpty());
        assertFalse(gate.isInFlight());
    }
}
