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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import de.makibytes.faultlens.backend.AnalysisBackend;
import de.makibytes.faultlens.backend.BackendRegistry;
import de.makibytes.faultlens.config.NamedThreadFactory;
import de.makibytes.faultlens.model.BackendResult;
import jakarta.annotation.PreDestroy;

/**
 * Direct single-backend queries, each backend guarded by its own {@link BackendStateMachine}.
 * Independent of the analysis cycle's single-flight flag.
 */
@Service
public class ManualAnalysisService {

    private static final Logger logger = LoggerFactory.getLogger(ManualAnalysisService.class);

    private final BackendRegistry registry;
    private final BackendInvoker invoker;
    private final ScheduledExecutorService displayTimer;
    private final Map<String, BackendStateMachine> machines;

    public ManualAnalysisService(BackendRegistry registry, BackendInvoker invoker, Clock clock) {
        this.registry = registry;
        this.invoker = invoker;
        this.displayTimer = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("display-timer"));
        Map<String, BackendStateMachine> temp = new LinkedHashMap<>();
        for (AnalysisBackend backend : registry.getBackends()) {
            temp.put(backend.getId(), new BackendStateMachine(
                    backend.getId(), backend.getSettings().displayDuration(), displayTimer, clock));
        }
        this.machines = Map.copyOf(temp);
    }

    public Submission submit(String backendId, AnalysisContext context) {
        AnalysisBackend backend = registry.requireBackend(backendId);
        BackendStateMachine machine = machines.get(backendId);
        BackendAcceptance acceptance = machine.tryAccept();
        if (!acceptance.accepted()) {
            logger.debug("Direct query for {} refused, backend is {}", backendId, acceptance.state());
            return new Submission(acceptance, null);
        }
        CompletableFuture<BackendResult> result = invoker.invoke(backend, context.systemInstructions(), context.prompt())
                .thenApply(outcome -> {
                    machine.complete(outcome);
                    if (outcome.succeeded()) {
                        registry.recordUsage(backendId);
                    }
                    logger.info("Direct query on {} finished with {} in {} ms", backendId, outcome.status(), outcome.elapsedMs());
                    return outcome;
                });
        return new Submission(acceptance, result);
    }

    public BackendStateMachine.Snapshot freeze(String backendId) {
        BackendStateMachine machine = requireMachine(backendId);
        if (!machine.freeze()) {
            throw new IllegalStateException("Backend " + backendId + " is " + machine.getState() + ", only a displayed result can be frozen");
        }
        return machine.snapshot();
    }

    public BackendStateMachine.Snapshot unfreeze(String backendId) {
        BackendStateMachine machine = requireMachine(backendId);
        if (!machine.unfreeze()) {
            throw new IllegalStateException("Backend " + backendId + " is " + machine.getState() + ", not frozen");
        }
        return machine.snapshot();
    }

    public void showResult(String backendId, BackendResult result) {
        BackendStateMachine machine = machines.get(backendId);
        if (machine != null) {
            machine.showResult(result);
        }
    }

    public BackendStateMachine.Snapshot status(String backendId) {
        return requireMachine(backendId).snapshot();
    }

    public List<BackendStateMachine.Snapshot> statuses() {
        return machines.values().stream()
                .map(BackendStateMachine::snapshot)
                .sorted((a, b) -> a.backendId().compareTo(b.backendId()))
                .toList();
    }

    private BackendStateMachine requireMachine(String backendId) {
        registry.requireBackend(backendId);
        return machines.get(backendId);
    }

    @PreDestroy
    public void shutdown() {
        displayTimer.shutdownNow();
    }

    public record Submission(BackendAcceptance acceptance, CompletableFuture<BackendResult> result) {
    }
}
