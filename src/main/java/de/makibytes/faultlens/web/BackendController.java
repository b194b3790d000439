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
package de.makibytes.faultlens.web;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import de.makibytes.faultlens.analysis.AnalysisContext;
import de.makibytes.faultlens.analysis.BackendAcceptance;
import de.makibytes.faultlens.analysis.BackendStateMachine;
import de.makibytes.faultlens.analysis.ManualAnalysisService;
import de.makibytes.faultlens.backend.BackendRegistry;
import de.makibytes.faultlens.backend.PremiumSessionGuard;
import de.makibytes.faultlens.ingest.IngestService;

@RestController
@RequestMapping("/backends")
public class BackendController {

    private final BackendRegistry registry;
    private final ManualAnalysisService manualAnalysis;
    private final PremiumSessionGuard sessionGuard;
    private final IngestService ingestService;

    public BackendController(BackendRegistry registry,
                             ManualAnalysisService manualAnalysis,
                             PremiumSessionGuard sessionGuard,
                             IngestService ingestService) {
        this.registry = registry;
        this.manualAnalysis = manualAnalysis;
        this.sessionGuard = sessionGuard;
        this.ingestService = ingestService;
    }

    @GetMapping
    public List<BackendRegistry.BackendDescriptor> backends() {
        return registry.describe();
    }

    @PostMapping("/usage/reset")
    public List<BackendRegistry.BackendDescriptor> resetUsage() {
        registry.resetUsage();
        return registry.describe();
    }

    @GetMapping("/status")
    public List<BackendStateMachine.Snapshot> status() {
        return manualAnalysis.statuses();
    }

    @PostMapping("/{id}/analyze")
    public CompletableFuture<ResponseEntity<Object>> analyze(@PathVariable("id") String id) {
        registry.requireBackend(id);
        AnalysisContext context = ingestService.currentContext();
        ManualAnalysisService.Submission submission = manualAnalysis.submit(id, context);
        BackendAcceptance acceptance = submission.acceptance();
        if (!acceptance.accepted()) {
            ResponseEntity.BodyBuilder busy = ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS);
            if (acceptance.retryAfterMs() != null) {
                busy.header("Retry-After", String.valueOf((acceptance.retryAfterMs() + 999) / 1000));
            }
            return CompletableFuture.completedFuture(busy.body((Object) acceptance));
        }
        return submission.result().thenApply(result -> ResponseEntity.ok((Object) result));
    }

    @PostMapping("/{id}/freeze")
    public BackendStateMachine.Snapshot freeze(@PathVariable("id") String id) {
        return manualAnalysis.freeze(id);
    }

    @PostMapping("/{id}/unfreeze")
    public BackendStateMachine.Snapshot unfreeze(@PathVariable("id") String id) {
        return manualAnalysis.unfreeze(id);
    }

    @PostMapping("/{id}/toggle")
    public Map<String, Object> toggle(@PathVariable("id") String id, @RequestParam("enabled") boolean enabled) {
        boolean changed = sessionGuard.toggle(id, enabled);
        return Map.of("id", id, "active", registry.isActive(id), "changed", changed, "activeBackends", registry.activeIds());
    }
}
