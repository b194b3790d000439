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

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import de.makibytes.faultlens.config.FaultLensProperties;
import de.makibytes.faultlens.model.DetectorVerdict;

/**
 * Scores a row as the sum of squared z-scores against the normal-operation baseline.
 * The row is anomalous when the score exceeds the threshold.
 */
@Component
public class BaselineFaultDetector implements FaultDetector {

    private static final Logger logger = LoggerFactory.getLogger(BaselineFaultDetector.class);

    private final List<String> features;
    private final ResourceLoader resourceLoader;
    private volatile BaselineStatistics baseline;
    private volatile double threshold;

    @Autowired
    public BaselineFaultDetector(FaultLensProperties properties, ResourceLoader resourceLoader) {
        this.features = List.copyOf(properties.getFeatures());
        this.resourceLoader = resourceLoader;
        this.threshold = properties.getDetector().getThreshold();
        this.baseline = load(properties.getDetector().getBaselineFile());
    }

    public BaselineFaultDetector(List<String> features, BaselineStatistics baseline, double threshold) {
        this.features = List.copyOf(features);
        this.resourceLoader = null;
        this.baseline = baseline;
        this.threshold = threshold;
        requireCoverage(baseline, "in-memory baseline");
    }

    @Override
    public DetectorVerdict evaluate(Map<String, Double> row) {
        BaselineStatistics current = baseline;
        double score = 0.0;
        for (String feature : features) {
            Double value = row.get(feature);
            BaselineStatistics.FeatureStats stats = current.get(feature);
            if (value == null || stats == null) {
                continue;
            }
            double z = stats.zScore(value);
            score += z * z;
        }
        double limit = threshold;
        return new DetectorVerdict(score, score > limit, limit);
    }

    @Override
    public double getThreshold() {
        return threshold;
    }

    @Override
    public void updateThreshold(double threshold) {
        if (Double.isNaN(threshold) || threshold <= 0.0) {
            throw new IllegalArgumentException("threshold must be a positive number");
        }
        logger.info("Detector threshold changed from {} to {}", this.threshold, threshold);
        this.threshold = threshold;
    }

    @Override
    public BaselineStatistics getBaseline() {
        return baseline;
    }

    /**
     * Replaces the baseline; the previous one stays active when the new file cannot be read.
     */
    public void reloadBaseline(String location) {
        if (resourceLoader == null) {
            throw new IllegalStateException("detector was created without a resource loader");
        }
        this.baseline = load(location);
        logger.info("Baseline reloaded from {}", location);
    }

    private BaselineStatistics load(String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalStateException("faultlens.detector.baseline-file is not configured");
        }
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Baseline file not found: " + location);
        }
        try (InputStream input = resource.getInputStream()) {
            BaselineStatistics loaded = BaselineStatistics.read(input);
            requireCoverage(loaded, location);
            return loaded;
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read baseline " + location + ": " + ex.getMessage(), ex);
        }
    }

    private void requireCoverage(BaselineStatistics candidate, String source) {
        List<String> missing = features.stream().filter(feature -> !candidate.contains(feature)).toList();
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Baseline " + source + " has no statistics for " + missing);
        }
    }
}
