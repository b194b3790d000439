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
package de.makibytes.faultlens.stream;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import de.makibytes.faultlens.config.FaultLensProperties;
import de.makibytes.faultlens.model.AggregatedRow;
import de.makibytes.faultlens.model.AnalysisBundle;

/**
 * Fans rows and analyses out to passive subscribers. A row is emitted only when its sequence index
 * differs from the last emitted one; a heartbeat goes out after the configured idle time.
 * A subscriber that cannot keep up is dropped instead of slowing the producer down.
 */
@Component
public class StreamBroadcaster {

    private static final Logger logger = LoggerFactory.getLogger(StreamBroadcaster.class);

    private final Map<Long, StreamSubscription> subscribers = new ConcurrentHashMap<>();
    private final AtomicLong subscriptionIds = new AtomicLong();
    private final AtomicLong droppedSubscribers = new AtomicLong();
    private final int queueCapacity;
    private final Duration heartbeatInterval;
    private final Clock clock;

    private long lastEmittedSequence = Long.MIN_VALUE;
    private AggregatedRow latestRow;
    private Instant lastEmissionAt;

    @Autowired
    public StreamBroadcaster(FaultLensProperties properties, Clock clock) {
        this(properties.getStream().getSubscriberQueueCapacity(),
                Duration.ofMillis(properties.getStream().getHeartbeatMs()),
                clock);
    }

    public StreamBroadcaster(int queueCapacity, Duration heartbeatInterval, Clock clock) {
        this.queueCapacity = queueCapacity;
        this.heartbeatInterval = heartbeatInterval;
        this.clock = clock;
        this.lastEmissionAt = clock.instant();
    }

    /**
     * Registers a subscriber; it immediately receives the latest row, if any.
     */
    public synchronized StreamSubscription subscribe() {
        StreamSubscription subscription = new StreamSubscription(subscriptionIds.incrementAndGet(), queueCapacity);
        subscribers.put(subscription.getId(), subscription);
        if (latestRow != null) {
            subscription.offer(new StreamEvent(StreamEvent.Type.ROW, clock.instant(), latestRow));
        }
        logger.debug("Stream subscriber {} connected ({} total)", subscription.getId(), subscribers.size());
        return subscription;
    }

    public void unsubscribe(StreamSubscription subscription) {
        if (subscribers.remove(subscription.getId()) != null) {
            logger.debug("Stream subscriber {} disconnected", subscription.getId());
        }
        subscription.close();
    }

    /**
     * Emits the row unless it carries the same sequence index as the previous emission.
     *
     * @return whether an event was emitted
     */
    public synchronized boolean publish(AggregatedRow row) {
        latestRow = row;
        if (row.getSequenceIndex() == lastEmittedSequence) {
            return false;
        }
        lastEmittedSequence = row.getSequenceIndex();
        emit(new StreamEvent(StreamEvent.Type.ROW, clock.instant(), row));
        return true;
    }

    public synchronized void publishAnalysis(AnalysisBundle bundle) {
        emit(new StreamEvent(StreamEvent.Type.ANALYSIS, clock.instant(), bundle));
    }

    @Scheduled(fixedDelay = 1000, initialDelay = 1000)
    public synchronized void heartbeat() {
        Instant now = clock.instant();
        if (Duration.between(lastEmissionAt, now).compareTo(heartbeatInterval) < 0) {
            return;
        }
        emit(new StreamEvent(StreamEvent.Type.HEARTBEAT, now, now.toString()));
    }

    private void emit(StreamEvent event) {
        lastEmissionAt = event.timestamp();
        Collection<StreamSubscription> current = subscribers.values();
        for (StreamSubscription subscription : current) {
            if (subscription.isClosed()) {
                subscribers.remove(subscription.getId());
            } else if (!subscription.offer(event)) {
                subscribers.remove(subscription.getId());
                subscription.close();
                droppedSubscribers.incrementAndGet();
                logger.info("Dropped stream subscriber {}: queue full", subscription.getId());
            }
        }
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }

    public long getDroppedSubscribers() {
        return droppedSubscribers.get();
    }
}
