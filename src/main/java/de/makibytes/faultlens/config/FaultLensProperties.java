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
package de.makibytes.faultlens.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "faultlens")
public class FaultLensProperties {

    public enum BackendType {
        OPENAI_COMPATIBLE,
        ANTHROPIC
    }

    private List<String> features = new ArrayList<>();
    private Ingest ingest = new Ingest();
    private Gate gate = new Gate();
    private Detector detector = new Detector();
    private BackendDefaults backendDefaults = new BackendDefaults();
    private List<BackendProperties> backends = new ArrayList<>();
    private Stream stream = new Stream();
    private History history = new History();
    private PremiumSession premiumSession = new PremiumSession();
    private Prompts prompts = new Prompts();

    public List<String> getFeatures() {
        return features;
    }

    public void setFeatures(List<String> features) {
        this.features = features;
    }

    public Ingest getIngest() {
        return ingest;
    }

    public void setIngest(Ingest ingest) {
        this.ingest = ingest;
    }

    public Gate getGate() {
        return gate;
    }

    public void setGate(Gate gate) {
        this.gate = gate;
    }

    public Detector getDetector() {
        return detector;
    }

    public void setDetector(Detector detector) {
        this.detector = detector;
    }

    public BackendDefaults getBackendDefaults() {
        return backendDefaults;
    }

    public void setBackendDefaults(BackendDefaults backendDefaults) {
        this.backendDefaults = backendDefaults;
    }

    public List<BackendProperties> getBackends() {
        return backends;
    }

    public void setBackends(List<BackendProperties> backends) {
        this.backends = backends;
    }

    public Stream getStream() {
        return stream;
    }

    public void setStream(Stream stream) {
        this.stream = stream;
    }

    public History getHistory() {
        return history;
    }

    public void setHistory(History history) {
        this.history = history;
    }

    public PremiumSession getPremiumSession() {
        return premiumSession;
    }

    public void setPremiumSession(PremiumSession premiumSession) {
        this.premiumSession = premiumSession;
    }

    public Prompts getPrompts() {
        return prompts;
    }

    public void setPrompts(Prompts prompts) {
        this.prompts = prompts;
    }

    public static class Ingest {
        private int decimationSize = 1;

        public int getDecimationSize() {
            return decimationSize;
        }

        public void setDecimationSize(int decimationSize) {
            this.decimationSize = decimationSize;
        }
    }

    public static class Gate {
        private int windowSize = 20;
        /** Rows required in the window before a trigger; 0 derives max(5, windowSize / 2). */
        private int minContext = 0;
        private int requiredConsecutive = 1;
        private long minIntervalSeconds = 10;
        private int topK = 6;
        private double fingerprintJaccardThreshold = 0.6;
        private long fingerprintCooldownSeconds = 120;

        public int getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = windowSize;
        }

        public int getMinContext() {
            return minContext;
        }

        public void setMinContext(int minContext) {
            this.minContext = minContext;
        }

        public int getRequiredConsecutive() {
            return requiredConsecutive;
        }

        public void setRequiredConsecutive(int requiredConsecutive) {
            this.requiredConsecutive = requiredConsecutive;
        }

        public long getMinIntervalSeconds() {
            return minIntervalSeconds;
        }

        public void setMinIntervalSeconds(long minIntervalSeconds) {
            this.minIntervalSeconds = minIntervalSeconds;
        }

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public double getFingerprintJaccardThreshold() {
            return fingerprintJaccardThreshold;
        }

        public void setFingerprintJaccardThreshold(double fingerprintJaccardThreshold) {
            this.fingerprintJaccardThreshold = fingerprintJaccardThreshold;
        }

        public long getFingerprintCooldownSeconds() {
            return fingerprintCooldownSeconds;
        }

        public void setFingerprintCooldownSeconds(long fingerprintCooldownSeconds) {
            this.fingerprintCooldownSeconds = fingerprintCooldownSeconds;
        }
    }

    public static class Detector {
        private String baselineFile = "classpath:baseline/features_mean_std.csv";
        private double threshold = 55.0;

        public String getBaselineFile() {
            return baselineFile;
        }

        public void setBaselineFile(String baselineFile) {
            this.baselineFile = baselineFile;
        }

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }
    }

    public static class BackendDefaults {
        private long timeoutMs = 45000;
        private long connectTimeoutMs = 5000;
        private int maxRetries = 1;
        private long retryBackoffMs = 2000;
        private long displayDurationMs = 7000;
        private int maxTokens = 2000;
        private double temperature = 0.7;
        private Map<String, String> headers = new HashMap<>();

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }

        public long getDisplayDurationMs() {
            return displayDurationMs;
        }

        public void setDisplayDurationMs(long displayDurationMs) {
            this.displayDurationMs = displayDurationMs;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers;
        }
    }

    public static class BackendProperties {
        private String id;
        private String name;
        private BackendType type = BackendType.OPENAI_COMPATIBLE;
        private String baseUrl;
        private String model;
        private String apiKey;
        private boolean enabled = false;
        private boolean premium = false;
        private long timeoutMs = -1;
        private long connectTimeoutMs = -1;
        private int maxRetries = -1;
        private long retryBackoffMs = -1;
        private long displayDurationMs = -1;
        private int maxTokens = -1;
        private Double temperature;
        private Map<String, String> headers = new HashMap<>();

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public BackendType getType() {
            return type;
        }

        public void setType(BackendType type) {
            this.type = type;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isPremium() {
            return premium;
        }

        public void setPremium(boolean premium) {
            this.premium = premium;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public long getRetryBackoffMs() {
            return retryBackoffMs;
        }

        public void setRetryBackoffMs(long retryBackoffMs) {
            this.retryBackoffMs = retryBackoffMs;
        }

        public long getDisplayDurationMs() {
            return displayDurationMs;
        }

        public void setDisplayDurationMs(long displayDurationMs) {
            this.displayDurationMs = displayDurationMs;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public Double getTemperature() {
            return temperature;
        }

        public void setTemperature(Double temperature) {
            this.temperature = temperature;
        }

        public Map<String, String> getHeaders() {
            return headers;
        }

        public void setHeaders(Map<String, String> headers) {
            this.headers = headers;
        }
    }

    public static class Stream {
        private long heartbeatMs = 15000;
        private int subscriberQueueCapacity = 64;

        public long getHeartbeatMs() {
            return heartbeatMs;
        }

        public void setHeartbeatMs(long heartbeatMs) {
            this.heartbeatMs = heartbeatMs;
        }

        public int getSubscriberQueueCapacity() {
            return subscriberQueueCapacity;
        }

        public void setSubscriberQueueCapacity(int subscriberQueueCapacity) {
            this.subscriberQueueCapacity = subscriberQueueCapacity;
        }
    }

    public static class History {
        private boolean enabled = true;
        private String file = "./faultlens-history.jsonl";
        private String markdownDir = "";
        private int memoryLimit = 200;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getFile() {
            return file;
        }

        public void setFile(String file) {
            this.file = file;
        }

        public String getMarkdownDir() {
            return markdownDir;
        }

        public void setMarkdownDir(String markdownDir) {
            this.markdownDir = markdownDir;
        }

        public int getMemoryLimit() {
            return memoryLimit;
        }

        public void setMemoryLimit(int memoryLimit) {
            this.memoryLimit = memoryLimit;
        }
    }

    public static class PremiumSession {
        private long durationMinutes = 30;
        private boolean autoShutdown = true;

        public long getDurationMinutes() {
            return durationMinutes;
        }

        public void setDurationMinutes(long durationMinutes) {
            this.durationMinutes = durationMinutes;
        }

        public boolean isAutoShutdown() {
            return autoShutdown;
        }

        public void setAutoShutdown(boolean autoShutdown) {
            this.autoShutdown = autoShutdown;
        }
    }

    public static class Prompts {
        private String system = "You are an expert process engineer analyzing faults in a chemical process. "
                + "Identify the most likely root cause from the sensor deviations you are given.";
        private String explain = "An anomaly was detected in the process. Based on the feature comparison below, "
                + "explain the most likely root cause and the physical chain of events behind it.";

        public String getSystem() {
            return system;
        }

        public void setSystem(String system) {
            this.system = system;
        }

        public String getExplain() {
            return explain;
        }

        public void setExplain(String explain) {
            this.explain = explain;
        }
    }
}
