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

import dev.mars.alertflow.builder.graph.FlowEdge;
import dev.mars.alertflow.workflow.model.Definition;
import dev.mars.alertflow.workflow.model.StepNode;
import dev.mars.alertflow.workflow.model.Task;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Description for EditHistoryTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-19
 */
class EditHistoryTest {

    private static EditSnapshot snapshot(String id) {
        return EditSnapshot.capture(Definition.empty(id), List.of(), List.of(), null);
    }

    @Test
    void testPopReturnsLatestFirst() {
        EditHistory history = new EditHistory(5);
        history.push(snapshot("first"));
        history.push(snapshot("second"));

        assertEquals("second", history.pop().orElseThrow().definition().getId());
        assertEquals("first", history.pop().orElseThrow().definition().getId());
        assertTrue(history.pop().isEmpty());
    }

    @Test
    void testOldestSnapshotIsDroppedWhenFull() {
        EditHistory history = new EditHistory(2);
        history.push(snapshot("a"));
        history.push(snapshot("b"));
        history.push(snapshot("c"));

        assertEquals(2, history.size());
        assertEquals("c", history.pop().orElseThrow().definition().getId());
        assertEquals("b", history.pop().orElseThrow().definition().getId());
        assertTrue(history.isEmpty());
    }

    @Test
    void testZeroCapacityDisablesHistory() {
        EditHistory history = new EditHistory(0);
        history.push(snapshot("a"));

        assertTrue(history.isEmpty());
        assertEquals(0, history.getCapacity());
    }

    @Test
    void testNegativeCapacityRejected() {
        assertThrows(IllegalArgumentException.class, () -> new EditHistory(-1));
    }

    @Test
    void testCaptureIsIndependentOfLiveState() {
        Definition definition = Definition.empty("wf");
        Task task = Task.action("notify", "slack");
        definition.getSequence().add(task);
        List<StepNode> detached = new ArrayList<>();
        detached.add(Task.action("dropped", "console"));

        EditSnapshot snapshot = EditSnapshot.capture(definition, detached,
                List.of(FlowEdge.manual("a", "b")), task.getId());
        task.setName("renamed");
        definition.getSequence().clear();
        detached.clear();

        assertEquals(1, snapshot.definition().getSequence().size());
        assertEquals("notify", snapshot.definition().getSequence().get(0).getName());
        assertEquals(1, snapshot.detached().size());
        assertEquals(1, snapshot.manualEdges().size());
        assertEquals(task.getId(), snapshot.selectedNode());
    }
}
