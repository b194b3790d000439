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

import org.springframework.stereotype.Component;

import de.makibytes.faultlens.config.FaultLensProperties;
import de.makibytes.faultlens.detector.FaultDetector;
import de.makibytes.faultlens.gate.TriggerContext;
import de.makibytes.faultlens.model.AggregatedRow;
import de.makibytes.faultlens.model.TriggerReason;

@Component
public class AnalysisContextFactory {

    private final FaultDetector detector;
    private final FaultLensProperties.Prompts prompts;

    public AnalysisContextFactory(FaultDetector detector, FaultLensProperties properties) {
        this.detector = detector;
        this.prompts = properties.getPrompts();
    }

    public AnalysisContext forTrigger(TriggerContext trigger) {
        return create(trigger.sequenceIndex(), trigger.triggeredAt(), trigger.reason(), trigger.topFeatures(), trigger.latest());
    }

    /**
     * Context for a direct query, built from the current window without going through the gate.
     */
    public AnalysisContext forWindow(List<String> topFeatures, AggregatedRow latest, Instant now) {
        long sequenceIndex = latest == null ? -1 : latest.getSequenceIndex();
        return create(sequenceIndex, now, null, topFeatures, latest);
    }

    private AnalysisContext create(long sequenceIndex,
                                   Instant createdAt,
                                   TriggerReason reason,
                                   List<String> topFeatures,
                                   AggregatedRow latest) {
        String comparison = FeatureComparisonBuilder.build(topFeatures, latest, detector.getBaseline());
        String prompt = prompts.getExplain() + "\n\n" + comparison;
        return new AnalysisContext(sequenceIndex, createdAt, reason, topFeatures, comparison, prompts.getSystem(), prompt);
    }
}
