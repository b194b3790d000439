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

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON-over-HTTP plumbing shared by the concrete backends. Each call is a single attempt bounded
 * by the backend timeout.
 */
public abstract class AbstractHttpBackend implements AnalysisBackend {

    protected final ObjectMapper mapper = new ObjectMapper().findAndRegisterModules();

    private final String id;
    private final String displayName;
    private final String baseUrl;
    private final Map<String, String> headers;
    private final BackendSettings settings;
    private final HttpClient httpClient;

    protected AbstractHttpBackend(String id,
                                  String displayName,
                                  String baseUrl,
                                  Map<String, String> headers,
                                  BackendSettings settings,
                                  Duration connectTimeout) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalStateException("Backend " + id + " has no base-url");
        }
        this.id = id;
        this.displayName = displayName;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.headers = Map.copyOf(headers);
        this.settings = settings;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout.isZero() || connectTimeout.isNegative() ? Duration.ofSeconds(5) : connectTimeout)
                .build();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getDisplayName() {
        return displayName;
    }

    @Override
    public BackendSettings getSettings() {
        return settings;
    }

    protected JsonNode post(String path, ObjectNode body, Map<String, String> extraHeaders) throws BackendException {
        String url = baseUrl + path;
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(settings.timeout())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()));
        headers.forEach(builder::header);
        extraHeaders.forEach(builder::header);
        try {
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new HttpStatusException(response.statusCode(), url);
            }
            return mapper.readTree(response.body());
        } catch (HttpTimeoutException ex) {
            throw BackendException.timeout("no response from " + url + " within " + settings.timeout().toMillis() + " ms", ex);
        } catch (HttpStatusException ex) {
            throw BackendException.transport(ex.getMessage(), shouldRetryStatus(ex.getStatusCode()), ex);
        } catch (IOException ex) {
            throw BackendException.transport(describe(ex), true, ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw BackendException.transport("call to " + url + " interrupted", false, ex);
        }
    }

    protected static String requireText(JsonNode node, String backendId) throws BackendException {
        if (node == null || node.isMissingNode() || node.isNull()) {
            throw BackendException.emptyResponse(backendId + " returned no content");
        }
        String text = node.asText("");
        if (text.isBlank()) {
            throw BackendException.emptyResponse(backendId + " returned an empty answer");
        }
        return text.trim();
    }

    private static boolean shouldRetryStatus(int statusCode) {
        return statusCode == 429 || statusCode >= 500;
    }

    private static String describe(IOException ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }

    static class HttpStatusException extends IOException {
        private final int statusCode;

        HttpStatusException(int statusCode, String url) {
            super("HTTP " + statusCode + " from " + url);
            this.statusCode = statusCode;
        }

        public int getStatusCode() {
            return statusCode;
        }
    }
}
