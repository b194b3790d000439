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
package de.makibytes.faultlens.gate;

import java.util.ArrayDeque;
import java.util.List;

import de.makibytes.faultlens.model.AggregatedRow;

/**
 * Bounded FIFO of aggregated rows; the oldest row is evicted on overflow.
 */
public class SlidingWindow {

    private final ArrayDeque<AggregatedRow> rows = new ArrayDeque<>();
    private int capacity;

    public SlidingWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("window capacity must be at least 1");
        }
        this.capacity = capacity;
    }

    public synchronized void push(AggregatedRow row) {
        rows.addLast(row);
        while (rows.size() > capacity) {
            rows.removeFirst();
        }
    }

    public synchronized List<AggregatedRow> snapshot() {
        return List.copyOf(rows);
    }

    public synchronized AggregatedRow latest() {
        return rows.peekLast();
    }

    /** Shrinking keeps the most recent rows. */
    public synchronized void resize(int newCapacity) {
        if (newCapacity < 1) {
            throw new IllegalArgumentException("window capacity must be at least 1");
        }
        this.capacity = newCapacity;
        while (rows.size() > capacity) {
            rows.removeFirst();
        }
    }

    public synchronized void clear() {
        rows.clear();
    }

    public synchronized int size() {
        return rows.size();
    }

    public synchronized int capacity() {
        return capacity;
    }
}
