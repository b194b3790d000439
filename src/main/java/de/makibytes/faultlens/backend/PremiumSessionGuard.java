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
package de.makibytes.faultlens.backend;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import de.makibytes.faultlens.config.FaultLensProperties;

/**
 * Bounds how long paid backends stay enabled. Enabling a premium backend opens a session;
 * when it runs out every premium backend is disabled and a {@link PremiumSessionExpiredEvent} is published.
 * With auto-shutdown off a session has no deadline and only ends on {@link #shutdown()}.
 */
@Component
public class PremiumSessionGuard {

    private static final Logger logger = LoggerFactory.getLogger(PremiumSessionGuard.class);

    private final BackendRegistry registry;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;
    private final Duration sessionDuration;

    private boolean autoShutdown;
    private Instant startedAt;
    private Instant expiresAt;

    public PremiumSessionGuard(BackendRegistry registry,
                               ApplicationEventPublisher publisher,
                               FaultLensProperties properties,
                               Clock clock) {
        this.registry = registry;
        this.publisher = publisher;
        this.clock = clock;
        this.sessionDuration = Duration.ofMinutes(Math.max(1, properties.getPremiumSession().getDurationMinutes()));
        this.autoShutdown = properties.getPremiumSession().isAutoShutdown();
        if (!activePremiumIds().isEmpty()) {
            startSession();
        }
    }

    public synchronized boolean toggle(String backendId, boolean enabled) {
        boolean changed = registry.setEnabled(backendId, enabled);
        boolean premium = registry.requireBackend(backendId).getSettings().premium();
        if (premium && enabled && startedAt == null) {
            startSession();
        } else if (premium && !enabled && startedAt != null && activePremiumIds().isEmpty()) {
            logger.info("Premium session closed, no premium backend left enabled");
            startedAt = null;
            expiresAt = null;
        }
        return changed;
    }

    public synchronized SessionStatus extend(long minutes) {
        if (minutes <= 0) {
            throw new IllegalArgumentException("minutes must be positive");
        }
        if (startedAt == null) {
            throw new IllegalStateException("No premium session is active");
        }
        Instant base = expiresAt != null ? expiresAt : clock.instant();
        expiresAt = base.plus(Duration.ofMinutes(minutes));
        logger.info("Premium session extended by {} min, now ends at {}", minutes, expiresAt);
        return status();
    }

    /**
     * Drops the deadline of the running session. Later sessions still get one while auto-shutdown is on.
     */
    public synchronized SessionStatus cancelAutoShutdown() {
        if (startedAt == null) {
            throw new IllegalStateException("No premium session is active");
        }
        expiresAt = null;
        logger.info("Premium session auto-shutdown cancelled, session stays open until shut down");
        return status();
    }

    /**
     * Turns the deadline on or off for the running session and every later one.
     * Turning it back on gives a running session without deadline a full session duration from now.
     */
    public synchronized SessionStatus setAutoShutdown(boolean enabled) {
        autoShutdown = enabled;
        if (startedAt != null) {
            if (!enabled) {
                expiresAt = null;
            } else if (expiresAt == null) {
                expiresAt = clock.instant().plus(sessionDuration);
            }
        }
        logger.info("Premium auto-shutdown {}", enabled ? "enabled" : "disabled");
        return status();
    }

    public synchronized SessionStatus shutdown() {
        endSession(true);
        return status();
    }

    @Scheduled(fixedDelay = 30000, initialDelay = 30000)
    public synchronized void checkExpiry() {
        if (expiresAt != null && !clock.instant().isBefore(expiresAt)) {
            logger.warn("Premium session expired after {} min", Duration.between(startedAt, expiresAt).toMinutes());
            endSession(false);
        }
    }

    public synchronized SessionStatus status() {
        Instant now = clock.instant();
        if (startedAt == null) {
            return new SessionStatus(false, null, null, 0, 0, List.of(), autoShutdown);
        }
        long elapsedSeconds = Math.max(0, Duration.between(startedAt, now).toSeconds());
        long remainingSeconds = expiresAt == null ? 0 : Math.max(0, Duration.between(now, expiresAt).toSeconds());
        return new SessionStatus(true, startedAt, expiresAt, elapsedSeconds, remainingSeconds, activePremiumIds(), autoShutdown);
    }

    private void startSession() {
        startedAt = clock.instant();
        if (autoShutdown) {
            expiresAt = startedAt.plus(sessionDuration);
            logger.info("Premium session started, ends at {}", expiresAt);
        } else {
            expiresAt = null;
            logger.info("Premium session started without auto-shutdown");
        }
    }

    private void endSession(boolean forced) {
        List<String> premiumIds = registry.getBackends().stream()
                .filter(backend -> backend.getSettings().premium())
                .map(AnalysisBackend::getId)
                .toList();
        List<String> disabled = registry.forceDisable(premiumIds);
        startedAt = null;
        expiresAt = null;
        publisher.publishEvent(new PremiumSessionExpiredEvent(clock.instant(), disabled, forced));
    }

    private List<String> activePremiumIds() {
        return registry.activeBackends().stream()
                .filter(backend -> backend.getSettings().premium())
                .map(AnalysisBackend::getId)
                .toList();
    }

    public record SessionStatus(boolean active,
                                Instant startedAt,
                                Instant expiresAt,
                                long elapsedSeconds,
                                long remainingSeconds,
                                List<String> premiumBackends,
                                boolean autoShutdown) {
    }
}
