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
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import de.makibytes.faultlens.backend.BackendException;
import de.makibytes.faultlens.model.BackendResult;
import de.makibytes.faultlens.model.BackendStatus;
import de.makibytes.faultlens.support.StubBackend;

@DisplayName("BackendInvoker")
class BackendInvokerTest {

    private final BackendInvoker invoker = new BackendInvoker();

    @AfterEach
    void tearDown() {
        invoker.shutdown();
    }

    private BackendResult run(StubBackend backend) throws Exception {
        return invoker.invoke(backend, "system", "prompt").get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("returns the answer of a healthy backend")
    void success() throws Exception {
        BackendResult result = run(StubBackend.answering("a", "Valve stiction on the reactor feed"));

        assertEquals(BackendStatus.SUCCESS, result.status());
        assertEquals("Valve stiction on the reactor feed", result.text());
        assertEquals(1, result.attempts());
        assertEquals(6, result.wordCount());
    }

    @Test
    @DisplayName("does not retry a non-retryable failure")
    void nonRetryableFailure() throws Exception {
        StubBackend backend = new StubBackend("a", StubBackend.settings(1000, 1, 0, 0), attempt -> {
            throw BackendException.transport("HTTP 401", false, null);
        });

        BackendResult result = run(backend);

        assertEquals(BackendStatus.ERROR, result.status());
        assertEquals(1, backend.getCalls());
        assertTrue(result.error().contains("HTTP 401"));
    }

    @Test
    @DisplayName("retries a transient failure at most once")
    void retryBudgetIsClamped() throws Exception {
        StubBackend backend = new StubBackend("a", StubBackend.settings(2000, 5, 20, 0), attempt -> {
            throw BackendException.transport("HTTP 503", true, null);
        });

        BackendResult result = run(backend);

        assertEquals(BackendStatus.ERROR, result.status());
        assertEquals(2, backend.getCalls());
        assertEquals(2, result.attempts());
    }

    @Test
    @DisplayName("a transient failure followed by an answer is a success")
    void recoversAfterRetry() throws Exception {
        StubBackend backend = new StubBackend("a", StubBackend.settings(2000, 1, 20, 0), attempt -> {
            if (attempt == 1) {
                throw BackendException.transport("connection reset", true, null);
            }
            return "Cooling water failure";
        });

        BackendResult result = run(backend);

        assertEquals(BackendStatus.SUCCESS, result.status());
        assertEquals(2, result.attempts());
    }

    @Test
    @DisplayName("a blank answer is an error and is not retried")
    void blankAnswer() throws Exception {
        StubBackend backend = new StubBackend("a", StubBackend.settings(1000, 1, 0, 0), attempt -> "   ");

        BackendResult result = run(backend);

        assertEquals(BackendStatus.ERROR, result.status());
        assertEquals(1, backend.getCalls());
        assertTrue(result.error().startsWith("EMPTY_RESPONSE"));
    }

    @Test
    @DisplayName("a timeout reported by the backend is not retried")
    void backendTimeout() throws Exception {
        StubBackend backend = new StubBackend("a", StubBackend.settings(1000, 1, 0, 0), attempt -> {
            throw BackendException.timeout("read timed out", null);
        });

        BackendResult result = run(backend);

        assertEquals(BackendStatus.TIMEOUT, result.status());
        assertEquals(1, backend.getCalls());
    }

    @Test
    @DisplayName("an unexpected exception becomes an error result")
    void unexpectedException() throws Exception {
        StubBackend backend = new StubBackend("a", StubBackend.settings(1000, 1, 0, 0), attempt -> {
            throw new IllegalArgumentException("bad payload");
        });

        BackendResult result = run(backend);

        assertEquals(BackendStatus.ERROR, result.status());
        assertTrue(result.error().contains("bad payload"));
    }

    @Test
    @DisplayName("the ceiling completes with TIMEOUT and a late answer is discarded")
    void ceilingWinsOverLateAnswer() throws Exception {
        StubBackend backend = StubBackend.ignoringInterrupts("slow", "too late", 1200,
                StubBackend.settings(200, 0, 0, 0));
        long started = System.nanoTime();

        CompletableFuture<BackendResult> call = invoker.invoke(backend, "system", "prompt");
        BackendResult result = call.get(5, TimeUnit.SECONDS);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertEquals(BackendStatus.TIMEOUT, result.status());
        assertTrue(elapsedMs < 1000, "ceiling should fire long before the backend answers, took " + elapsedMs);

        Thread.sleep(1300);
        assertEquals(BackendStatus.TIMEOUT, call.getNow(null).status());
        assertEquals(1, backend.getCalls());
    }

    @Test
    @DisplayName("completes with an error when the timeout scheduler refuses the ceiling")
    void rejectedCeilingCompletesWithError() throws Exception {
        ExecutorService calls = Executors.newCachedThreadPool();
        ScheduledExecutorService stopped = Executors.newSingleThreadScheduledExecutor();
        stopped.shutdown();
        BackendInvoker stopping = new BackendInvoker(calls, stopped);
        try {
            StubBackend backend = new StubBackend("a", StubBackend.settings(1000, 0, 0, 0), attempt -> {
                StubBackend.sleep(500);
                return "late answer";
            });

            CompletableFuture<BackendResult> future = stopping.invoke(backend, "system", "prompt");

            assertTrue(future.isDone());
            BackendResult result = future.get(1, TimeUnit.SECONDS);
            assertEquals(BackendStatus.ERROR, result.status());
            assertTrue(result.error().contains("scheduler unavailable"));
        } finally {
            calls.shutdownNow();
        }
    }
}
