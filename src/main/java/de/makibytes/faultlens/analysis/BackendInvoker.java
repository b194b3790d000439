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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import de.makibytes.faultlens.backend.AnalysisBackend;
import de.makibytes.faultlens.backend.BackendException;
import de.makibytes.faultlens.backend.BackendSettings;
import de.makibytes.faultlens.config.NamedThreadFactory;
import de.makibytes.faultlens.model.BackendResult;
import jakarta.annotation.PreDestroy;

/**
 * Runs one backend call under its timeout ceiling. The returned future always completes with a
 * {@link BackendResult}, never exceptionally; once the ceiling passes the call is cancelled and a
 * late answer is dropped.
 */
@Component
public class BackendInvoker {

    private static final Logger logger = LoggerFactory.getLogger(BackendInvoker.class);

    private final ExecutorService callExecutor;
    private final ScheduledExecutorService ceilingScheduler;

    public BackendInvoker() {
        this(Executors.newCachedThreadPool(new NamedThreadFactory("backend-call")),
                Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("backend-ceiling")));
    }

    BackendInvoker(ExecutorService callExecutor, ScheduledExecutorService ceilingScheduler) {
        this.callExecutor = callExecutor;
        this.ceilingScheduler = ceilingScheduler;
    }

    public CompletableFuture<BackendResult> invoke(AnalysisBackend backend, String systemInstructions, String prompt) {
        BackendSettings settings = backend.getSettings();
        long startedAt = System.nanoTime();
        AtomicInteger attempts = new AtomicInteger();
        CompletableFuture<BackendResult> outcome = new CompletableFuture<>();

        Future<?> call;
        try {
            call = callExecutor.submit(() -> {
                BackendResult result = callWithRetry(backend, systemInstructions, prompt, startedAt, attempts);
                if (!outcome.complete(result)) {
                    logger.debug("Discarding late {} result from {}", result.status(), backend.getId());
                }
            });
        } catch (RejectedExecutionException ex) {
            outcome.complete(BackendResult.error(backend.getId(), "backend call executor unavailable", 0, 0));
            return outcome;
        }

        ScheduledFuture<?> ceiling;
        try {
            ceiling = ceilingScheduler.schedule(() -> {
                if (outcome.complete(BackendResult.timeout(backend.getId(), elapsedMs(startedAt), attempts.get()))) {
                    call.cancel(true);
                    logger.warn("Backend {} gave no answer within {} ms", backend.getId(), settings.timeout().toMillis());
                }
            }, settings.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException ex) {
            // an unbounded call must not outlive the invoker
            call.cancel(true);
            outcome.complete(BackendResult.error(backend.getId(), "backend timeout scheduler unavailable",
                    elapsedMs(startedAt), attempts.get()));
            return outcome;
        }
        outcome.whenComplete((result, ex) -> ceiling.cancel(false));
        return outcome;
    }

    private BackendResult callWithRetry(AnalysisBackend backend,
                                        String systemInstructions,
                                        String prompt,
                                        long startedAt,
                                        AtomicInteger attempts) {
        BackendSettings settings = backend.getSettings();
        int retries = settings.maxRetries();
        String id = backend.getId();
        for (int attempt = 0; attempt <= retries; attempt++) {
            attempts.incrementAndGet();
            try {
                String text = backend.complete(systemInstructions, prompt);
                if (text == null || text.isBlank()) {
                    return BackendResult.error(id, BackendException.Kind.EMPTY_RESPONSE + ": no text returned",
                            elapsedMs(startedAt), attempts.get());
                }
                return BackendResult.success(id, text, elapsedMs(startedAt), attempts.get());
            } catch (BackendException ex) {
                if (ex.getKind() == BackendException.Kind.TIMEOUT) {
                    return BackendResult.timeout(id, elapsedMs(startedAt), attempts.get());
                }
                if (!ex.isRetryable() || attempt == retries) {
                    logger.warn("Backend {} failed after {} attempt(s): {}", id, attempts.get(), ex.getMessage());
                    return BackendResult.error(id, ex.getKind() + ": " + ex.getMessage(), elapsedMs(startedAt), attempts.get());
                }
                logger.info("Backend {} attempt {} failed ({}), retrying", id, attempt + 1, ex.getMessage());
                if (!sleepBackoff(settings.retryBackoff().toMillis(), attempt)) {
                    return BackendResult.error(id, "interrupted during retry backoff", elapsedMs(startedAt), attempts.get());
                }
            } catch (RuntimeException ex) {
                logger.warn("Backend {} threw unexpectedly: {}", id, ex.getMessage(), ex);
                return BackendResult.error(id, "unexpected failure: " + ex.getMessage(), elapsedMs(startedAt), attempts.get());
            }
        }
        return BackendResult.error(id, "no attempt succeeded", elapsedMs(startedAt), attempts.get());
    }

    private boolean sleepBackoff(long backoffMs, int attempt) {
        long delay = Math.max(0, backoffMs) * (attempt + 1);
        if (delay <= 0) {
            return true;
        }
        try {
            Thread.sleep(delay);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static long elapsedMs(long startedAt) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
    }

    @PreDestroy
    public void shutdown() {
        ceilingScheduler.shutdownNow();
        callExecutor.shutdownNow();
    }
}
