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
package de.makibytes.faultlens.gate;

import java.time.Instant;
import java.util.List;

import de.makibytes.faultlens.model.AggregatedRow;
import de.makibytes.faultlens.model.TriggerReason;

/**
 * Everything captured at the moment the gate fired, handed to the dispatch executor.
 */
public record TriggerContext(long sequenceIndex,
                             Instant triggeredAt,
                             TriggerReason reason,
                             List<String> topFeatures,
                             List<AggregatedRow> window) {

    public TriggerContext {
        topFeatures = List.copyOf(topFeatures);
        window = List.copyOf(window);
    }

    public AggregatedRow latest() {
        return window.isEmpty() ? null : window.get(window.size() - 1);
    }
}
