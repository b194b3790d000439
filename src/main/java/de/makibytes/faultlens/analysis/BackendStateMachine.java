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
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.makibytes.faultlens.model.BackendLifecycleState;
import de.makibytes.faultlens.model.BackendResult;

/**
 * Lifecycle of direct queries against one backend:
 * IDLE -> ANALYZING -> DISPLAYING -> IDLE, with DISPLAYING -> FROZEN -> IDLE on operator request.
 * Failed queries go straight back to IDLE.
 */
public class BackendStateMachine {

    private static final Logger logger = LoggerFactory.getLogger(BackendStateMachine.class);

    private final String backendId;
    private final Duration displayDuration;
    private final ScheduledExecutorService timer;
    private final Clock clock;

    private BackendLifecycleState state = BackendLifecycleState.IDLE;
    // bumped on every accepted query so a display timer from an older cycle is ignored
    private long cycle;
    private Instant displayUntil;
    private ScheduledFuture<?> displayTimer;
    private BackendResult lastResult;
    private Instant lastResultAt;

    public BackendStateMachine(String backendId, Duration displayDuration, ScheduledExecutorService timer, Clock clock) {
        this.backendId = backendId;
        this.displayDuration = displayDuration;
        this.timer = timer;
        this.clock = clock;
    }

    public synchronized BackendAcceptance tryAccept() {
        switch (state) {
            case IDLE -> {
                state = BackendLifecycleState.ANALYZING;
                cycle++;
                cancelDisplayTimer();
                return BackendAcceptance.granted();
            }
            case DISPLAYING -> {
                long remaining = Math.max(0, Duration.between(clock.instant(), displayUntil).toMillis());
                return BackendAcceptance.busy(state, remaining);
            }
            default -> {
                return BackendAcceptance.busy(state, null);
            }
        }
    }

    public synchronized void complete(BackendResult result) {
        if (state != BackendLifecycleState.ANALYZING) {
            logger.debug("Ignoring completion for {} in state {}", backendId, state);
            return;
        }
        Instant now = clock.instant();
        lastResult = result;
        lastResultAt = now;
        if (!result.succeeded() || displayDuration.isZero()) {
            state = BackendLifecycleState.IDLE;
            return;
        }
        state = BackendLifecycleState.DISPLAYING;
        displayUntil = now.plus(displayDuration);
        long expectedCycle = cycle;
        displayTimer = timer.schedule(() -> displayElapsed(expectedCycle), displayDuration.toMillis(), TimeUnit.MILLISECONDS);
    }

    synchronized void displayElapsed(long expectedCycle) {
        if (cycle == expectedCycle && state == BackendLifecycleState.DISPLAYING) {
            state = BackendLifecycleState.IDLE;
            displayUntil = null;
            displayTimer = null;
        }
    }

    public synchronized boolean freeze() {
        if (state != BackendLifecycleState.DISPLAYING) {
            return false;
        }
        cancelDisplayTimer();
        state = BackendLifecycleState.FROZEN;
        displayUntil = null;
        return true;
    }

    public synchronized boolean unfreeze() {
        if (state != BackendLifecycleState.FROZEN) {
            return false;
        }
        state = BackendLifecycleState.IDLE;
        return true;
    }

    /**
     * Records a result produced by an analysis cycle without touching the lifecycle.
     */
    public synchronized void showResult(BackendResult result) {
        lastResult = result;
        lastResultAt = clock.instant();
    }

    public synchronized BackendLifecycleState getState() {
        return state;
    }

    public synchronized Snapshot snapshot() {
        Long remaining = state == BackendLifecycleState.DISPLAYING && displayUntil != null
                ? Math.max(0, Duration.between(clock.instant(), displayUntil).toMillis())
                : null;
        return new Snapshot(backendId, state, remaining, lastResult, lastResultAt);
    }

    private void cancelDisplayTimer() {
        if (displayTimer != null) {
            displayTimer.cancel(false);
            displayTimer = null;
        }
    }

    public record Snapshot(String backendId,
                           BackendLifecycleState state,
                           Long displayRemainingMs,
                           BackendResult lastResult,
                           Instant lastResultAt) {
    }
}
