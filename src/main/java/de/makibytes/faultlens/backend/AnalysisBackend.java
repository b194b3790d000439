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

/**
 * One independent root-cause analysis provider.
 * <p>
 * A single call to {@link #complete(String, String)} is one attempt; retries and the overall
 * timeout ceiling are enforced by the caller.
 */
public interface AnalysisBackend {

    String getId();

    String getDisplayName();

    BackendSettings getSettings();

    String complete(String systemInstructions, String prompt) throws BackendException;
}
