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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Chat completions endpoint as served by OpenAI and by local model servers such as LM Studio.
 */
public class OpenAiCompatibleBackend extends AbstractHttpBackend {

    private final String model;
    private final String apiKey;
    private final int maxTokens;
    private final double temperature;

    public OpenAiCompatibleBackend(String id,
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
        this.model = model;
        this.apiKey = apiKey;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
    }

    @Override
    public String complete(String systemInstructions, String prompt) throws BackendException {
        ObjectNode body = mapper.createObjectNode();
        if (model != null && !model.isBlank()) {
            body.put("model", model);
        }
        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", systemInstructions);
        messages.addObject().put("role", "user").put("content", prompt);
        body.put("temperature", temperature);
        body.put("max_tokens", maxTokens);
        body.put("stream", false);

        Map<String, String> auth = apiKey == null || apiKey.isBlank()
                ? Map.of()
                : Map.of("Authorization", "Bearer " + apiKey);
        JsonNode response = post("/chat/completions", body, auth);
        return requireText(response.path("choices").path(0).path("message").path("content"), getId());
    }
}
