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

package dev.mars.alertflow.workflow.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
/**
 * Description for DefinitionTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-18
 */

class DefinitionTest {

    private Definition definition;
    private Task step;
    private Condition condition;
    private Task guarded;
    private Loop loop;
    private Task looped;

    @BeforeEach
    void setUp() {
        definition = Definition.empty("wf");
        step = Task.step("query", "prometheus");
        condition = Condition.threshold("high", "{{ steps.query.results }}", "90");
        guarded = Task.action("notify", "slack");
        condition.getTrueBranch().add(guarded);
        looped = Task.action("each", "console");
        loop = Loop.around("{{ items }}", looped);
        definition.getSequence().addAll(List.of(step, condition, loop));
    }

    @Test
    void testAllNodesIsDepthFirst() {
        assertEquals(List.of(step, condition, guarded, loop, looped), definition.allNodes());
    }

    @Test
    void testLocateNestedNode() {
        NodeLocation location = definition.locate(guarded.getId()).orElseThrow();

        assertSame(condition, location.parent());
        assertSame(condition.getTrueBranch(), location.container());
        assertEquals(0, location.index());
        assertFalse(location.isRoot());

        NodeLocation root = definition.locate(loop.getId()).orElseThrow();
        assertTrue(root.isRoot());
        assertEquals(2, root.index());

        assertTrue(definition.findNode("missing").isEmpty());
    }

    @Test
    void testCopyIsDeepAndKeepsIds() {
        guarded.getWith().put("message", "hello");
        Definition copy = definition.copy();

        Condition copiedCondition = (Condition) copy.getSequence().get(1);
        Task copiedTask = (Task) copiedCondition.getTrueBranch().get(0);
        copiedTask.getWith().put("message", "changed");
        copiedCondition.getTrueBranch().clear();

        assertEquals(guarded.getId(), copiedTask.getId());
        assertEquals("hello", guarded.getWith().get("message"));
        assertEquals(1, condition.getTrueBranch().size());
    }

    @Test
    void testDuplicateGetsNewId() {
        Task duplicate = guarded.duplicate();

        assertNotEquals(guarded.getId(), duplicate.getId());
        assertEquals(guarded.getName(), duplicate.getName());
        assertEquals("action-slack", duplicate.getTypeName());
    }

    @Test
    void testDuplicateConditionDropsAlias() {
        condition.setAlias("high_usage");

        Condition duplicate = condition.duplicate();

        assertNull(duplicate.getAlias());
        assertFalse(duplicate.hasAlias());
        assertEquals("high_usage", condition.copy().getAlias());
        assertEquals("{{ steps.query.results }}", duplicate.getValue());
        assertNotEquals(guarded.getId(), duplicate.getTrueBranch().get(0).getId());
    }

    @Test
    void testTriggersReplaceInPlace() {
        definition.putTrigger(TriggerDeclaration.manual());
        definition.putTrigger(TriggerDeclaration.interval("1m"));
        definition.putTrigger(TriggerDeclaration.manual());
        definition.putTrigger(TriggerDeclaration.interval("5m"));

        assertEquals(List.of(TriggerDeclaration.manual(), TriggerDeclaration.interval("5m")),
                List.copyOf(definition.getTriggers()));
        assertTrue(definition.removeTrigger(TriggerType.MANUAL));
        assertFalse(definition.removeTrigger(TriggerType.MANUAL));
    }

    @Test
    void testPropertiesViewCarriesTriggers() {
        definition.setName("Workflow");
        definition.putTrigger(TriggerDeclaration.interval("10m"));
        definition.putTrigger(TriggerDeclaration.incident(List.of("created")));

        Map<String, Object> properties = definition.getProperties();

        assertEquals("Workflow", properties.get("name"));
        assertEquals("10m", properties.get("interval"));
        assertEquals(Map.of("events", List.of("created")), properties.get("incident"));
        assertFalse(properties.containsKey("alert"));

        definition.removeTrigger(TriggerType.INTERVAL);
        assertFalse(definition.getProperties().containsKey("interval"));
    }

    @Test
    void testChildrenOf() {
        assertEquals(List.of(guarded), Definition.childrenOf(condition));
        assertEquals(List.of(looped), Definition.childrenOf(loop));
        assertTrue(Definition.childrenOf(step).isEmpty());
    }

    @Test
    void testNullNameBecomesEmpty() {
        definition.setName(null);
        step.setName(null);

        assertEquals("", definition.getName());
        assertEquals("", step.getName());
    }

    @Test
    void testTriggerDefaults() {
        assertEquals("true", TriggerDeclaration.defaultFor(TriggerType.MANUAL).toPropertyValue());
        assertEquals("", TriggerDeclaration.defaultFor(TriggerType.INTERVAL).getValue());
        assertEquals(Map.of("source", ""), TriggerDeclaration.defaultFor(TriggerType.ALERT).getFilters());
        assertTrue(TriggerDeclaration.defaultFor(TriggerType.INCIDENT).getEvents().isEmpty());
        assertEquals(TriggerType.INTERVAL, TriggerType.fromValue("interval").orElseThrow());
        assertTrue(TriggerType.fromValue("cron").isEmpty());
    }
}
