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

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * One subscriber's bounded mailbox. Producers never wait on it: a full mailbox is refused.
 */
public class StreamSubscription {

    private final long id;
    private final BlockingQueue<StreamEvent> queue;
    private volatile boolean closed;

    StreamSubscription(long id, int capacity) {
        this.id = id;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
    }

    public long getId() {
        return id;
    }

    boolean offer(StreamEvent event) {
        return !closed && queue.offer(event);
    }

    public StreamEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public StreamEvent poll() {
        return queue.poll();
    }

    public int pending() {
        return queue.size();
    }

    public boolean isClosed() {
        return closed;
    }

    public void close() {
        closed = true;
        queue.clear();
    }
}
