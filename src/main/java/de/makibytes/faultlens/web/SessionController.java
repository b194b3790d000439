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
package de.makibytes.faultlens.web;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import de.makibytes.faultlens.backend.PremiumSessionGuard;
import de.makibytes.faultlens.backend.PremiumSessionGuard.SessionStatus;

@RestController
@RequestMapping("/session")
public class SessionController {

    private final PremiumSessionGuard sessionGuard;

    public SessionController(PremiumSessionGuard sessionGuard) {
        this.sessionGuard = sessionGuard;
    }

    @GetMapping("/status")
    public SessionStatus status() {
        return sessionGuard.status();
    }

    @PostMapping("/extend")
    public SessionStatus extend(@RequestParam(name = "minutes", defaultValue = "30") long minutes) {
        return sessionGuard.extend(minutes);
    }

    @PostMapping("/auto-shutdown/cancel")
    public SessionStatus cancelAutoShutdown() {
        return sessionGuard.cancelAutoShutdown();
    }

    @PostMapping("/auto-shutdown")
    public SessionStatus setAutoShutdown(@RequestParam("enabled") boolean enabled) {
        return sessionGuard.setAutoShutdown(enabled);
    }

    @PostMapping("/shutdown")
    public SessionStatus shutdown() {
        return sessionGuard.shutdown();
    }
}
