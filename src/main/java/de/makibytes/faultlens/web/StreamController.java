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

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import de.makibytes.faultlens.config.NamedThreadFactory;
import de.makibytes.faultlens.stream.StreamBroadcaster;
import de.makibytes.faultlens.stream.StreamEvent;
import de.makibytes.faultlens.stream.StreamSubscription;
import jakarta.annotation.PreDestroy;

/**
 * Server-sent events relay: one relay task per connection drains that connection's subscription.
 */
@RestController
public class StreamController {

    private static final Logger logger = LoggerFactory.getLogger(StreamController.class);

    private final StreamBroadcaster broadcaster;
    private final ExecutorService relayExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("sse-relay"));

    public StreamController(StreamBroadcaster broadcaster) {
        this.broadcaster = broadcaster;
    }

    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream() {
        SseEmitter emitter = new SseEmitter(0L);
        StreamSubscription subscription = broadcaster.subscribe();
        emitter.onCompletion(() -> broadcaster.unsubscribe(subscription));
        emitter.onTimeout(() -> broadcaster.unsubscribe(subscription));
        emitter.onError(ex -> broadcaster.unsubscribe(subscription));
        relayExecutor.execute(() -> relay(subscription, emitter));
        return emitter;
    }

    private void relay(StreamSubscription subscription, SseEmitter emitter) {
        try {
            while (!subscription.isClosed()) {
                StreamEvent event = subscription.poll(1, TimeUnit.SECONDS);
                if (event == null) {
                    continue;
                }
                emitter.send(SseEmitter.event()
                        .name(event.eventName())
                        .data(event.payload(), MediaType.APPLICATION_JSON));
            }
        } catch (IOException | IllegalStateException ex) {
            logger.debug("Stream subscriber {} went away: {}", subscription.getId(), ex.getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        } finally {
            broadcaster.unsubscribe(subscription);
            emitter.complete();
        }
    }

    @PreDestroy
    public void shutdown() {
        relayExecutor.shutdownNow();
    }
}
