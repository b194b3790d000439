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
package de.makibytes.faultlens.backend;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import de.makibytes.faultlens.config.FaultLensProperties;

/**
 * Configured backends plus the runtime enable/disable overlay.
 * Active set = (enabled in configuration + enabled at runtime) - disabled at runtime.
 */
@Component
public class BackendRegistry {

    private static final Logger logger = LoggerFactory.getLogger(BackendRegistry.class);

    private final List<AnalysisBackend> backends;
    private final Map<String, AnalysisBackend> backendsById;
    private final Set<String> configEnabled;
    private final Set<String> runtimeEnabled = ConcurrentHashMap.newKeySet();
    private final Set<String> runtimeDisabled = ConcurrentHashMap.newKeySet();
    private final Map<String, AtomicLong> usage = new ConcurrentHashMap<>();

    @Autowired
    public BackendRegistry(FaultLensProperties properties) {
        this(createBackends(properties), enabledIds(properties));
    }

    public BackendRegistry(List<AnalysisBackend> backends, Collection<String> configEnabled) {
        Map<String, AnalysisBackend> byId = new LinkedHashMap<>();
        for (AnalysisBackend backend : backends) {
            if (byId.putIfAbsent(backend.getId(), backend) != null) {
                throw new IllegalStateException("Duplicate backend id " + backend.getId());
            }
            usage.put(backend.getId(), new AtomicLong());
        }
        this.backends = List.copyOf(byId.values());
        this.backendsById = Map.copyOf(byId);
        this.configEnabled = Set.copyOf(configEnabled);
        if (activeBackends().isEmpty()) {
            throw new IllegalStateException("No analysis backend is enabled; enable at least one under faultlens.backends");
        }
        logger.info("Analysis backends: {} (active: {})", byId.keySet(), activeIds());
    }

    private static List<AnalysisBackend> createBackends(FaultLensProperties properties) {
        List<AnalysisBackend> created = new ArrayList<>();
        Set<String> usedIds = new HashSet<>();
        FaultLensProperties.BackendDefaults defaults = properties.getBackendDefaults();
        int index = 1;
        for (FaultLensProperties.BackendProperties backend : properties.getBackends()) {
            String id = uniqueId(backendKey(backend, index), usedIds);
            String name = backend.getName() == null || backend.getName().isBlank() ? id : backend.getName();
            long timeoutMs = backend.getTimeoutMs() > 0 ? backend.getTimeoutMs() : defaults.getTimeoutMs();
            long connectTimeoutMs = backend.getConnectTimeoutMs() > 0 ? backend.getConnectTimeoutMs() : defaults.getConnectTimeoutMs();
            int maxRetries = backend.getMaxRetries() >= 0 ? backend.getMaxRetries() : defaults.getMaxRetries();
            long retryBackoffMs = backend.getRetryBackoffMs() >= 0 ? backend.getRetryBackoffMs() : defaults.getRetryBackoffMs();
            long displayMs = backend.getDisplayDurationMs() >= 0 ? backend.getDisplayDurationMs() : defaults.getDisplayDurationMs();
            int maxTokens = backend.getMaxTokens() > 0 ? backend.getMaxTokens() : defaults.getMaxTokens();
            double temperature = backend.getTemperature() != null ? backend.getTemperature() : defaults.getTemperature();
            Map<String, String> headers = new HashMap<>(defaults.getHeaders());
            headers.putAll(backend.getHeaders());
            BackendSettings settings = new BackendSettings(
                    Duration.ofMillis(timeoutMs),
                    maxRetries,
                    Duration.ofMillis(retryBackoffMs),
                    Duration.ofMillis(displayMs),
                    backend.isPremium());
            Duration connectTimeout = Duration.ofMillis(connectTimeoutMs);
            FaultLensProperties.BackendType type = backend.getType() == null
                    ? FaultLensProperties.BackendType.OPENAI_COMPATIBLE
                    : backend.getType();
            switch (type) {
                case ANTHROPIC -> created.add(new AnthropicBackend(id, name,
                        backend.getBaseUrl() == null || backend.getBaseUrl().isBlank() ? "https://api.anthropic.com" : backend.getBaseUrl(),
                        backend.getModel(), backend.getApiKey(), maxTokens, temperature, headers, settings, connectTimeout));
                case OPENAI_COMPATIBLE -> created.add(new OpenAiCompatibleBackend(id, name, backend.getBaseUrl(),
                        backend.getModel(), backend.getApiKey(), maxTokens, temperature, headers, settings, connectTimeout));
            }
            index++;
        }
        return created;
    }

    private static List<String> enabledIds(FaultLensProperties properties) {
        List<String> enabled = new ArrayList<>();
        Set<String> usedIds = new HashSet<>();
        int index = 1;
        for (FaultLensProperties.BackendProperties backend : properties.getBackends()) {
            String id = uniqueId(backendKey(backend, index), usedIds);
            if (backend.isEnabled()) {
                enabled.add(id);
            }
            index++;
        }
        return enabled;
    }

    private static String backendKey(FaultLensProperties.BackendProperties backend, int index) {
        String raw = backend.getId() != null && !backend.getId().isBlank() ? backend.getId() : backend.getName();
        return raw != null && !raw.isBlank()
                ? raw.trim().toLowerCase().replaceAll("[^a-z0-9]+", "-")
                : "backend-" + index;
    }

    private static String uniqueId(String baseKey, Set<String> usedIds) {
        String key = baseKey;
        int suffix = 2;
        while (usedIds.contains(key)) {
            key = baseKey + "-" + suffix++;
        }
        usedIds.add(key);
        return key;
    }

    public List<AnalysisBackend> getBackends() {
        return backends;
    }

    public AnalysisBackend getBackend(String id) {
        return backendsById.get(id);
    }

    public AnalysisBackend requireBackend(String id) {
        AnalysisBackend backend = backendsById.get(id);
        if (backend == null) {
            throw new NoSuchElementException("Unknown backend: " + id);
        }
        return backend;
    }

    public boolean isActive(String id) {
        if (runtimeDisabled.contains(id)) {
            return false;
        }
        return configEnabled.contains(id) || runtimeEnabled.contains(id);
    }

    public List<AnalysisBackend> activeBackends() {
        return backends.stream().filter(backend -> isActive(backend.getId())).toList();
    }

    public List<String> activeIds() {
        return activeBackends().stream().map(AnalysisBackend::getId).toList();
    }

    /**
     * Enables or disables a backend at runtime. Returns whether the active set changed.
     *
     * @throws IllegalStateException if disabling would leave no active backend
     */
    public synchronized boolean setEnabled(String id, boolean enabled) {
        requireBackend(id);
        boolean wasActive = isActive(id);
        if (!enabled && wasActive && activeBackends().size() == 1) {
            throw new IllegalStateException("Cannot disable " + id + ": it is the last active backend");
        }
        applyToggle(id, enabled);
        if (wasActive != enabled) {
            logger.info("Backend {} {}", id, enabled ? "enabled" : "disabled");
        }
        return wasActive != enabled;
    }

    /**
     * Disables the given backends without the last-backend guard; used when a premium session ends.
     */
    public synchronized List<String> forceDisable(Collection<String> ids) {
        List<String> disabled = new ArrayList<>();
        for (String id : ids) {
            if (backendsById.containsKey(id) && isActive(id)) {
                applyToggle(id, false);
                disabled.add(id);
            }
        }
        if (!disabled.isEmpty()) {
            logger.info("Backends {} disabled", disabled);
        }
        return disabled;
    }

    private void applyToggle(String id, boolean enabled) {
        if (enabled) {
            runtimeDisabled.remove(id);
            if (!configEnabled.contains(id)) {
                runtimeEnabled.add(id);
            }
        } else {
            runtimeEnabled.remove(id);
            runtimeDisabled.add(id);
        }
    }

    public void recordUsage(String id) {
        AtomicLong counter = usage.get(id);
        if (counter != null) {
            counter.incrementAndGet();
        }
    }

    public long getUsage(String id) {
        AtomicLong counter = usage.get(id);
        return counter == null ? 0 : counter.get();
    }

    /**
     * Zeroes every usage counter.
     *
     * @return the number of analyses counted before the reset
     */
    public long resetUsage() {
        long total = usage.values().stream().mapToLong(counter -> counter.getAndSet(0)).sum();
        logger.info("Usage counters reset, {} analyses cleared", total);
        return total;
    }

    public List<BackendDescriptor> describe() {
        return backends.stream()
                .map(backend -> new BackendDescriptor(
                        backend.getId(),
                        backend.getDisplayName(),
                        backend.getSettings().premium(),
                        configEnabled.contains(backend.getId()),
                        isActive(backend.getId()),
                        getUsage(backend.getId())))
                .toList();
    }

    public record BackendDescriptor(String id,
                                    String name,
                                    boolean premium,
                                    boolean enabledByConfig,
                                    boolean active,
                                    long successfulCalls) {
    }
}
