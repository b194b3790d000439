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

import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import de.makibytes.faultlens.config.FaultLensProperties;
import de.makibytes.faultlens.config.RuntimeSettings;
import de.makibytes.faultlens.config.RuntimeSettingsUpdate;
import de.makibytes.faultlens.detector.FaultDetector;
import de.makibytes.faultlens.ingest.IngestService;

@RestController
@RequestMapping("/config")
public class RuntimeConfigController {

    private final IngestService ingestService;
    private final FaultDetector detector;
    private final FaultLensProperties properties;

    public RuntimeConfigController(IngestService ingestService, FaultDetector detector, FaultLensProperties properties) {
        this.ingestService = ingestService;
        this.detector = detector;
        this.properties = properties;
    }

    @GetMapping("/runtime")
    public RuntimeSettings runtime() {
        return ingestService.getRuntimeSettings();
    }

    @PostMapping("/runtime")
    public RuntimeSettings updateRuntime(@RequestBody RuntimeSettingsUpdate update) {
        return ingestService.updateRuntimeSettings(update);
    }

    @PostMapping("/threshold")
    public Map<String, Double> updateThreshold(@RequestBody ThresholdRequest request) {
        if (request == null || request.threshold() == null) {
            throw new IllegalArgumentException("threshold is required");
        }
        ingestService.updateThreshold(request.threshold());
        return Map.of("threshold", detector.getThreshold());
    }

    @PostMapping("/baseline/reload")
    public Map<String, Object> reloadBaseline(@RequestBody(required = false) BaselineReloadRequest request) {
        String location = request != null && request.location() != null && !request.location().isBlank()
                ? request.location()
                : properties.getDetector().getBaselineFile();
        ingestService.reloadBaseline(location);
        return Map.of("location", location, "features", detector.getBaseline().asMap().size());
    }

    public record ThresholdRequest(Double threshold) {
    }

    public record BaselineReloadRequest(String location) {
    }
}
