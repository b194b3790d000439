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
package de.makibytes.faultlens.detector;

import java.util.Map;

import de.makibytes.faultlens.model.DetectorVerdict;

/**
 * Scores one aggregated row. Implementations must be safe to call from the ingest control path
 * while the threshold is updated from a web request.
 */
public interface FaultDetector {

    DetectorVerdict evaluate(Map<String, Double> features);

    double getThreshold();

    void updateThreshold(double threshold);

    BaselineStatistics getBaseline();
}
