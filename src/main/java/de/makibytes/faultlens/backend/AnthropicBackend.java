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
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Anthropic Messages API.
 */
public class AnthropicBackend extends AbstractHttpBackend {

    static final String API_VERSION = "2023-06-01";

    private final String model;
    private final String apiKey;
    private final int maxTokens;
    private final double temperature;

    public AnthropicBackend(String id,
                            String displayName,
                            String baseUrl,
                            String model,
                            String apiKey,
                            int maxTokens,
                            double temperature,
                            Map<String, String> headers,
                            BackendSettings settings,
                            Duration connectTimeout) {
        super(id, displayName, baseUrl, headers, settings, connectTimeout);
        if (model == null || model.isBlank()) {
            throw new IllegalStateException("Backend " + id + " needs a model name");
        }
        this.model = model;
        this.apiKey = apiKey;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
    }

    @Override
    public String complete(String systemInstructions, String prompt) throws BackendException {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", model);
        body.put("max_tokens", maxTokens);
        body.put("temperature", temperature);
        body.put("system", systemInstructions);
        body.putArray("messages").addObject()
                .put("role", "user")
                .put("content", prompt);

        Map<String, String> auth = apiKey == null || apiKey.isBlank()
                ? Map.of("anthropic-version", API_VERSION)
                : Map.of("anthropic-version", API_VERSION, "x-api-key", apiKey);
        JsonNode response = post("/v1/messages", body, auth);
        for (JsonNode block : response.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                return requireText(block.path("text"), getId());
            }
        }
        throw BackendException.emptyResponse(getId() + " returned no text block");
    }
}
