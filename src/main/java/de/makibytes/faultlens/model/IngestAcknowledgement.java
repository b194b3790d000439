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
package de.makibytes.faultlens.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Immediate answer to one ingested raw row. Never waits for an analysis.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IngestAcknowledgement(Status status,
                                    boolean aggregating,
                                    int have,
                                    int need,
                                    List<String> missing,
                                    Long sequenceIndex,
                                    Double score,
                                    Boolean anomaly,
                                    Double threshold,
                                    Integer consecutiveAnomalies,
                                    TriggerDecision decision) {

    public enum Status {
        ACCUMULATING,
        EVALUATED,
        REJECTED
    }

    public static IngestAcknowledgement rejected(List<String> missing, int have, int need) {
        return new IngestAcknowledgement(Status.REJECTED, need > 1, have, need, List.copyOf(missing),
                null, null, null, null, null, null);
    }

    public static IngestAcknowledgement accumulating(int have, int need) {
        return new IngestAcknowledgement(Status.ACCUMULATING, need > 1, have, need, null,
                null, null, null, null, null, null);
    }

    public static IngestAcknowledgement evaluated(AggregatedRow row, int need, int consecutiveAnomalies, TriggerDecision decision) {
        return new IngestAcknowledgement(Status.EVALUATED, need > 1, need, need, null,
                row.getSequenceIndex(), row.getAnomalyScore(), row.isAnomaly(), row.getThreshold(),
                consecutiveAnomalies, decision);
    }
}
