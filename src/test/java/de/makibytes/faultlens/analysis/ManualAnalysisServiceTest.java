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

import java.time.Instant;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import de.makibytes.faultlens.backend.BackendException;
import de.makibytes.faultlens.backend.BackendRegistry;
import de.makibytes.faultlens.model.BackendLifecycleState;
import de.makibytes.faultlens.model.BackendResult;
import de.makibytes.faultlens.model.BackendStatus;
import de.makibytes.faultlens.support.MutableClock;
import de.makibytes.faultlens.support.StubBackend;

@DisplayName("ManualAnalysisService")
class ManualAnalysisServiceTest {

    private static final AnalysisContext CONTEXT = new AnalysisContext(42, Instant.parse("2026-03-01T08:00:00Z"), null,
            List.of("Reactor Pressure"), "Top 1 Contributing Features (Fault vs Normal):\n", "system", "prompt");

    private final MutableClock clock = MutableClock.startingAt("2026-03-01T08:00:00Z");
    private BackendInvoker invoker;
    private BackendRegistry registry;
    private ManualAnalysisService service;

    @BeforeEach
    void setUp() {
        invoker = new BackendInvoker();
        StubBackend local = new StubBackend("local", StubBackend.settings(1000, 0, 0, 60_000), attempt -> "Pressure sensor drift");
        StubBackend broken = new StubBackend("broken", StubBackend.settings(1000, 0, 0, 60_000), attempt -> {
            throw BackendException.transport("HTTP 500", true, null);
        });
        StubBackend premium = new StubBackend("premium", StubBackend.premiumSettings(1000), attempt -> "Premium answer");
        registry = new BackendRegistry(List.of(local, broken, premium), List.of("local", "broken"));
        service = new ManualAnalysisService(registry, invoker, clock);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
        invoker.shutdown();
    }

    @Test
    @DisplayName("a successful query is displayed and counted")
    void successIsDisplayed() throws Exception {
        ManualAnalysisService.Submission submission = service.submit("local", CONTEXT);

        assertTrue(submission.acceptance().accepted());
        BackendResult result = submission.result().get(5, TimeUnit.SECONDS);

        assertEquals(BackendStatus.SUCCESS, result.status());
        assertEquals(BackendLifecycleState.DISPLAYING, service.status("local").state());
        assertEquals(1, registry.getUsage("local"));

        ManualAnalysisService.Submission refused = service.submit("local", CONTEXT);
        assertFalse(refused.acceptance().accepted());
        assertNull(refused.result());
        assertEquals(60_000L, refused.acceptance().retryAfterMs());
    }

    @Test
    @DisplayName("a failed query frees the backend and is not counted")
    void failureReturnsToIdle() throws Exception {
        BackendResult result = service.submit("broken", CONTEXT).result().get(5, TimeUnit.SECONDS);

        assertEquals(BackendStatus.ERROR, result.status());
        assertEquals(BackendLifecycleState.IDLE, service.status("broken").state());
        assertEquals(0, registry.getUsage("broken"));
    }

    @Test
    @DisplayName("a configured but inactive backend can still be queried directly")
    void inactiveBackendCanBeQueried() throws Exception {
        assertFalse(registry.isActive("premium"));

        BackendResult result = service.submit("premium", CONTEXT).result().get(5, TimeUnit.SECONDS);

        assertEquals("Premium answer", result.text());
        assertEquals(BackendLifecycleState.IDLE, service.status("premium").state());
    }

    @Test
    @DisplayName("freeze and unfreeze follow the lifecycle")
    void freezeLifecycle() throws Exception {
        assertThrows(IllegalStateException.class, () -> service.freeze("local"));

        service.submit("local", CONTEXT).result().get(5, TimeUnit.SECONDS);

        assertEquals(BackendLifecycleState.FROZEN, service.freeze("local").state());
        assertEquals(BackendLifecycleState.IDLE, service.unfreeze("local").state());
        assertThrows(IllegalStateException.class, () -> service.unfreeze("local"));
    }

    @Test
    @DisplayName("a query the invoker cannot time-box frees the backend")
    void rejectedCeilingReturnsToIdle() throws Exception {
        ExecutorService calls = Executors.newCachedThreadPool();
        ScheduledExecutorService stopped = Executors.newSingleThreadScheduledExecutor();
        stopped.shutdown();
        ManualAnalysisService stopping = new ManualAnalysisService(registry, new BackendInvoker(calls, stopped), clock);
        try {
            BackendResult result = stopping.submit("local", CONTEXT).result().get(5, TimeUnit.SECONDS);

            assertEquals(BackendStatus.ERROR, result.status());
            assertEquals(BackendLifecycleState.IDLE, stopping.status("local").state());
            assertTrue(stopping.submit("local", CONTEXT).acceptance().accepted());
        } finally {
            stopping.shutdown();
            calls.shutdownNow();
        }
    }

    @Test
    @DisplayName("unknown backends are rejected")
    void unknownBackend() {
        assertThrows(NoSuchElementException.class, () -> service.submit("nope", CONTEXT));
        assertThrows(NoSuchElementException.class, () -> service.status("nope"));
    }

    @Test
    @DisplayName("statuses are listed by backend id")
    void statusesSorted() {
        List<String> ids = service.statuses().stream().map(snapshot -> snapshot.backendId()).toList();

        assertEquals(List.of("broken", "local", "premium"), ids);
    }
}
