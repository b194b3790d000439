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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-feature mean and standard deviation of normal operation, read from a
 * {@code feature,mean,std} CSV file with a header line.
 */
public class BaselineStatistics {

    private final Map<String, FeatureStats> stats;

    public BaselineStatistics(Map<String, FeatureStats> stats) {
        this.stats = Collections.unmodifiableMap(new LinkedHashMap<>(stats));
    }

    public static BaselineStatistics read(InputStream input) throws IOException {
        Map<String, FeatureStats> stats = new LinkedHashMap<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            boolean header = true;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank() || line.startsWith("#")) {
                    continue;
                }
                if (header) {
                    header = false;
                    continue;
                }
                int lastComma = line.lastIndexOf(',');
                int middleComma = lastComma > 0 ? line.lastIndexOf(',', lastComma - 1) : -1;
                if (middleComma <= 0) {
                    throw new IOException("Malformed baseline line " + lineNumber + ": " + line);
                }
                String feature = unquote(line.substring(0, middleComma));
                try {
                    double mean = Double.parseDouble(line.substring(middleComma + 1, lastComma).trim());
                    double std = Double.parseDouble(line.substring(lastComma + 1).trim());
                    stats.put(feature, new FeatureStats(mean, std));
                } catch (NumberFormatException ex) {
                    throw new IOException("Malformed number on baseline line " + lineNumber + ": " + line, ex);
                }
            }
        }
        return new BaselineStatistics(stats);
    }

    private static String unquote(String value) {
        String trimmed = value.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }

    public FeatureStats get(String feature) {
        return stats.get(feature);
    }

    public boolean contains(String feature) {
        return stats.containsKey(feature);
    }

    public Map<String, FeatureStats> asMap() {
        return stats;
    }

    public record FeatureStats(double mean, double std) {

        public double zScore(double value) {
            return std > 0.0 ? (value - mean) / std : 0.0;
        }
    }
}
