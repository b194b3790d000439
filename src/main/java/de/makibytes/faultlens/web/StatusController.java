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

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import de.makibytes.faultlens.analysis.AnalysisOrchestrator;
import de.makibytes.faultlens.backend.BackendRegistry;
import de.makibytes.faultlens.detector.FaultDetector;
import de.makibytes.faultlens.ingest.IngestService;
import de.makibytes.faultlens.ingest.IngestStatus;
import de.makibytes.faultlens.store.AnalysisHistory;
import de.makibytes.faultlens.stream.StreamBroadcaster;

@RestController
public class StatusController {

    private final IngestService ingestService;
    private final AnalysisOrchestrator orchestrator;
    private final BackendRegistry registry;
    private final FaultDetector detector;
    private final StreamBroadcaster broadcaster;
    private final AnalysisHistory history;
    private final AppVersionProvider appVersionProvider;

    public StatusController(IngestService ingestService,
                            AnalysisOrchestrator orchestrator,
                            BackendRegistry registry,
                            FaultDetector detector,
                            StreamBroadcaster broadcaster,
                            AnalysisHistory history,
                            AppVersionProvider appVersionProvider) {
        this.ingestService = ingestService;
        this.orchestrator = orchestrator;
        this.registry = registry;
        this.detector = detector;
        this.broadcaster = broadcaster;
        this.history = history;
        this.appVersionProvider = appVersionProvider;
    }

    @GetMapping("/metrics")
    public Map<String, Object> metrics() {
        IngestStatus status = ingestService.status();
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("version", appVersionProvider.getVersion());
        metrics.put("rawRows", status.rawRows());
        metrics.put("rejectedRows", status.rejectedRows());
        metrics.put("aggregatedRows", status.aggregatedRows());
        metrics.put("pendingRawRows", status.pendingRawRows());
        metrics.put("windowSize", status.gate().windowSize());
        metrics.put("windowCapacity", status.gate().windowCapacity());
        metrics.put("consecutiveAnomalies", status.gate().consecutiveAnomalies());
        metrics.put("analysisInFlight", status.gate().inFlight());
        metrics.put("lastTriggerTime", status.gate().lastTriggerTime());
        metrics.put("lastTriggeredFeatures", status.gate().lastTriggeredFeatures());
        metrics.put("triggers", status.triggers());
        metrics.put("completedAnalyses", orchestrator.getCompletedCycles());
        metrics.put("partialFailures", orchestrator.getPartialFailures());
        metrics.put("historySize", history.size());
        metrics.put("threshold", detector.getThreshold());
        metrics.put("runtimeSettings", status.settings());
        metrics.put("activeBackends", registry.activeIds());
        metrics.put("streamSubscribers", broadcaster.getSubscriberCount());
        metrics.put("droppedSubscribers", broadcaster.getDroppedSubscribers());
        metrics.put("autoStopped", status.autoStopped());
        metrics.put("autoStoppedAt", status.autoStoppedAt());
        return metrics;
    }
}
