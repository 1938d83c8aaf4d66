/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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
 */

package dev.mars.alertflow.builder.history;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Bounded undo stack of editor snapshots. The oldest snapshot is discarded once the
 * capacity is reached; a capacity of zero disables undo.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-19
 */
public class EditHistory {

    private static final Logger logger = LoggerFactory.getLogger(EditHistory.class);

    private final int capacity;
    private final Deque<EditSnapshot> snapshots = new ArrayDeque<>();

    public EditHistory(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("History capacity cannot be negative: " + capacity);
        }
        this.capacity = capacity;
    }

    public void push(EditSnapshot snapshot) {
        if (capacity == 0) {
            return;
        }
        if (snapshots.size() == capacity) {
            snapshots.removeLast();
            logger.trace("Edit history full ({}), dropped the oldest snapshot", capacity);
        }
        snapshots.push(snapshot);
    }

    public Optional<EditSnapshot> pop() {
        return Optional.ofNullable(snapshots.poll());
    }

    public void clear() {
        snapshots.clear();
    }

    public int size() {
        return snapshots.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return snapshots.isEmpty();
    }
}
