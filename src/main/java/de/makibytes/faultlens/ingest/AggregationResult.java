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
package de.makibytes.faultlens.ingest;

import java.util.List;
import java.util.Map;

public record AggregationResult(Status status, int have, int need, Map<String, Double> row, List<String> missing) {

    public enum Status {
        ACCUMULATING,
        EMITTED,
        MISSING_FEATURE
    }

    static AggregationResult accumulating(int have, int need) {
        return new AggregationResult(Status.ACCUMULATING, have, need, null, List.of());
    }

    static AggregationResult emitted(Map<String, Double> row, int need) {
        return new AggregationResult(Status.EMITTED, need, need, row, List.of());
    }

    static AggregationResult missing(List<String> missing, int have, int need) {
        return new AggregationResult(Status.MISSING_FEATURE, have, need, null, List.copyOf(missing));
    }
}
