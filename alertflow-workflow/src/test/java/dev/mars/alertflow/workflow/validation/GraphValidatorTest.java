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

package dev.mars.alertflow.workflow.validation;

import dev.mars.alertflow.config.AlertflowConfiguration;
import dev.mars.alertflow.provider.ProviderCatalog;
import dev.mars.alertflow.workflow.YamlWorkflowParser;
import dev.mars.alertflow.workflow.model.Condition;
import dev.mars.alertflow.workflow.model.Definition;
import dev.mars.alertflow.workflow.model.Loop;
import dev.mars.alertflow.workflow.model.Task;
import dev.mars.alertflow.workflow.model.TriggerDeclaration;
import dev.mars.alertflow.workflow.model.TriggerType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Description for GraphValidatorTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2025-08-21
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class GraphValidatorTest {

    @Mock
    private ProviderCatalog catalog;

    private GraphValidator validator;
    private Definition definition;

    @BeforeEach
    void setUp() {
        when(catalog.checkInstallation(anyString(), any())).thenReturn(Optional.empty());
        validator = new GraphValidator(catalog, AlertflowConfiguration.defaults());

        definition = Definition.empty("wf");
        definition.setName("Workflow");
        definition.putTrigger(TriggerDeclaration.manual());
    }

    private static Condition threshold(Task... actions) {
        Condition condition = Condition.threshold("check", "{{ alert.value }}", "10");
        condition.getTrueBranch().addAll(List.of(actions));
        return condition;
    }

    @Nested
    @DisplayName("Loop rules")
    class LoopRules {

        @Test
        void testLoopWithConditionIsValid() {
            Loop loop = Loop.around("{{ alert.items }}", threshold(Task.action("a", "console")));
            definition.getSequence().add(loop);

            assertTrue(validator.validateNode(loop, definition.getSequence(), definition).isValid());
        }

        @Test
        void testLoopWithSingleTaskIsValid() {
            Loop loop = Loop.around("{{ alert.items }}", Task.action("a", "console"));
            definition.getSequence().add(loop);

            assertTrue(validator.validateNode(loop, definition.getSequence(), definition).isValid());
        }

        @Test
        void testLoopWithTwoTasksFails() {
            Loop loop = Loop.around("{{ alert.items }}", Task.action("a", "console"));
            loop.getSequence().add(Task.action("b", "console"));
            definition.getSequence().add(loop);

            assertEquals(GraphValidator.LOOP_CONDITIONS_ONLY,
                    validator.validateNode(loop, definition.getSequence(), definition).reason().orElseThrow());
        }

        @Test
        void testLoopWithNonConditionChildFails() {
            Loop loop = Loop.around("{{ alert.items }}", threshold(Task.action("a", "console")));
            loop.getSequence().add(Task.action("b", "console"));
            definition.getSequence().add(loop);

            Verdict verdict = validator.validateNode(loop, definition.getSequence(), definition);

            assertFalse(verdict.isValid());
            assertEquals(GraphValidator.LOOP_CONDITIONS_ONLY, verdict.reason().orElseThrow());
        }

        @Test
        void testNestedLoopFails() {
            Loop inner = Loop.around("{{ alert.inner }}", Task.action("a", "console"));
            Loop outer = Loop.around("{{ alert.outer }}", inner);
            definition.getSequence().add(outer);

            assertEquals(GraphValidator.LOOP_CONDITIONS_ONLY,
                    validator.validateNode(outer, definition.getSequence(), definition).reason().orElseThrow());
        }

        @Test
        void testEmptyLoopAndBlankValue() {
            Loop empty = new Loop("loop-1", "{{ alert.items }}");
            Loop blank = Loop.around(" ", Task.action("a", "console"));

            assertEquals(GraphValidator.LOOP_EMPTY,
                    validator.validateNode(empty, List.of(empty), definition).reason().orElseThrow());
            assertEquals(GraphValidator.LOOP_VALUE_EMPTY,
                    validator.validateNode(blank, List.of(blank), definition).reason().orElseThrow());
        }
    }

    @Nested
    @DisplayName("Condition rules")
    class ConditionRules {

        @Test
        void testEmptyBranchFails() {
            Condition condition = threshold();
            definition.getSequence().add(condition);

            Verdict verdict = validator.validateGraph(definition);

            assertEquals(GraphValidator.BRANCH_EMPTY, verdict.reason().orElseThrow());
            assertEquals(condition.getId(), verdict.violation().orElseThrow().key());
        }

        @Test
        void testStepInBranchFails() {
            Condition condition = threshold(Task.step("s", "prometheus"));

            assertEquals(GraphValidator.BRANCH_ACTIONS_ONLY,
                    validator.validateNode(condition, List.of(condition), definition).reason().orElseThrow());
        }

        @Test
        void testFalseBranchIsRejected() {
            Condition condition = threshold(Task.action("a", "console"));
            condition.getFalseBranch().add(Task.action("b", "console"));

            assertEquals(GraphValidator.FALSE_BRANCH_UNSUPPORTED,
                    validator.validateNode(condition, List.of(condition), definition).reason().orElseThrow());
        }

        @Test
        void testFieldRulesComeFirst() {
            Condition unnamed = threshold();
            unnamed.setName("");
            Condition noCompare = Condition.threshold("c", "1", null);
            Condition noAssert = Condition.assertion("c", "");

            assertEquals(GraphValidator.CONDITION_NAME_EMPTY,
                    validator.validateNode(unnamed, List.of(unnamed), definition).reason().orElseThrow());
            assertEquals(GraphValidator.CONDITION_COMPARE_TO_EMPTY,
                    validator.validateNode(noCompare, List.of(noCompare), definition).reason().orElseThrow());
            assertEquals(GraphValidator.CONDITION_ASSERT_EMPTY,
                    validator.validateNode(noAssert, List.of(noAssert), definition).reason().orElseThrow());
        }
    }

    @Nested
    @DisplayName("Task rules")
    class TaskRules {

        @Test
        void testBlankNameFails() {
            Task task = Task.step(" ", "prometheus");
            definition.getSequence().add(task);

            assertEquals(GraphValidator.STEP_NAME_EMPTY,
                    validator.validateNode(task, definition.getSequence(), definition).reason().orElseThrow());
        }

        @Test
        void testProviderCheckUsesCatalog() {
            Task task = Task.action("notify", "slack");
            task.setConfigName(" ops ");
            when(catalog.checkInstallation("slack", "ops")).thenReturn(Optional.of("not installed"));
            definition.getSequence().add(task);

            Verdict verdict = validator.validateNode(task, definition.getSequence(), definition);

            assertEquals("not installed", verdict.reason().orElseThrow());
            assertEquals(ViolationCategory.PROVIDER_NOT_INSTALLED, verdict.violation().orElseThrow().category());
            verify(catalog).checkInstallation(eq("slack"), eq("ops"));
        }

        @Test
        void testStepAfterActionFailsAtRootOnly() {
            Task action = Task.action("a", "console");
            Task step = Task.step("s", "prometheus");
            definition.getSequence().addAll(List.of(action, step));

            Verdict verdict = validator.validateNode(step, definition.getSequence(), definition);

            assertEquals(GraphValidator.STEP_AFTER_ACTION, verdict.reason().orElseThrow());
            assertTrue(validator.validateNode(step, List.of(action, step), definition).isValid());
        }
    }

    @Nested
    @DisplayName("Whole graph")
    class WholeGraph {

        @Test
        void testValidGraph() {
            definition.getSequence().add(Task.step("s", "prometheus"));
            definition.getSequence().add(threshold(Task.action("a", "console")));

            assertSame(Verdict.VALID, validator.validateGraph(definition));
            assertThat(validator.collectViolations(definition)).isEmpty();
        }

        @Test
        void testWorkflowLevelViolations() {
            definition.setName("");
            definition.removeTrigger(TriggerType.MANUAL);

            Map<String, Violation> violations = validator.collectViolations(definition);

            assertThat(violations).containsOnlyKeys(GraphValidator.WORKFLOW_NAME,
                    GraphValidator.TRIGGER_START, GraphValidator.TRIGGER_END);
            assertEquals(ViolationCategory.METADATA, violations.get(GraphValidator.WORKFLOW_NAME).category());
            assertFalse(validator.canDeploy(violations));
        }

        @Test
        void testTriggerPayloadRules() {
            definition.getSequence().add(Task.action("a", "console"));
            definition.putTrigger(TriggerDeclaration.interval(""));
            definition.putTrigger(TriggerDeclaration.alert(Map.of("source", "")));
            definition.putTrigger(TriggerDeclaration.incident(List.of("created", "resolved")));

            Map<String, Violation> violations = validator.collectViolations(definition);

            assertEquals(GraphValidator.INTERVAL_EMPTY, violations.get("interval").reason());
            assertEquals(GraphValidator.ALERT_EMPTY, violations.get("alert").reason());
            assertThat(violations.get("incident").reason()).startsWith("Incident event 'resolved' is not supported");
        }

        @Test
        void testDescriptionLimit() {
            Properties properties = new Properties();
            properties.setProperty(AlertflowConfiguration.DESCRIPTION_MAX_LENGTH, "5");
            GraphValidator strict = new GraphValidator(catalog, new AlertflowConfiguration(properties));
            definition.setDescription("too long");
            definition.getSequence().add(Task.action("a", "console"));

            Map<String, Violation> violations = strict.collectViolations(definition);

            assertEquals("Workflow description cannot exceed 5 characters.",
                    violations.get(GraphValidator.WORKFLOW_DESCRIPTION).reason());
        }

        @Test
        void testNodeViolationsComeBeforeWorkflowViolations() {
            definition.setName("");
            Condition empty = threshold();
            definition.getSequence().add(empty);

            assertThat(validator.collectViolations(definition).keySet())
                    .containsExactly(empty.getId(), GraphValidator.WORKFLOW_NAME);
            assertEquals(GraphValidator.BRANCH_EMPTY, validator.validateGraph(definition).reason().orElseThrow());
        }

        @Test
        void testDetachedNodesAreReported() {
            definition.getSequence().add(Task.action("a", "console"));
            Task detached = Task.action("floating", "console");

            Map<String, Violation> violations = validator.collectViolations(definition, List.of(detached));

            assertEquals(ViolationCategory.STRUCTURE, violations.get(detached.getId()).category());
        }

        @Test
        void testProviderViolationsDoNotBlockDeploy() {
            Task task = Task.action("notify", "slack");
            when(catalog.checkInstallation("slack", null)).thenReturn(Optional.of("No slack provider selected"));
            definition.getSequence().add(task);

            Map<String, Violation> violations = validator.collectViolations(definition);

            assertEquals(1, violations.size());
            assertTrue(validator.canDeploy(violations));
        }
    }

    @Nested
    @DisplayName("Alias rules")
    class AliasRules {

        @Test
        void testDuplicateAliasReportsLaterCondition() {
            Condition first = threshold(Task.action("a1", "console"));
            first.setAlias("x");
            Condition second = threshold(Task.action("b1", "console"));
            second.setName("second");
            second.setAlias("x");
            definition.getSequence().addAll(List.of(first, second));

            Map<String, Violation> violations = validator.collectViolations(definition);

            assertThat(violations).containsOnlyKeys(second.getId());
            assertEquals("Condition alias 'x' is already used by another condition.",
                    violations.get(second.getId()).reason());
            assertEquals(ViolationCategory.STRUCTURE, violations.get(second.getId()).category());
            assertFalse(validator.canDeploy(violations));
        }

        @Test
        void testDistinctAliasesAreValid() {
            Condition first = threshold(Task.action("a1", "console"));
            first.setAlias("x");
            Condition second = threshold(Task.action("b1", "console"));
            second.setAlias("y");
            definition.getSequence().addAll(List.of(first, second));

            assertThat(validator.collectViolations(definition)).isEmpty();
        }

        @Test
        void testDetachedConditionCannotReuseAlias() {
            Condition attached = threshold(Task.action("a1", "console"));
            attached.setAlias("x");
            definition.getSequence().add(attached);
            Condition floating = threshold(Task.action("b1", "console"));
            floating.setAlias("x");

            Map<String, Violation> violations = validator.collectViolations(definition, List.of(floating));

            assertEquals(GraphValidator.DETACHED_NODE, violations.get(floating.getId()).reason());
            assertThat(violations).doesNotContainKey(attached.getId());
        }
    }

    @Nested
    @DisplayName("Variable references")
    class VariableRules {

        private Task step;

        @BeforeEach
        void addStep() {
            step = Task.step("query", "prometheus");
            definition.getSequence().add(step);
            definition.getConsts().put("threshold", "90");
        }

        private String reasonFor(Task action) {
            definition.getSequence().add(action);
            return validator.validateNode(action, definition.getSequence(), definition).reason().orElse(null);
        }

        private Task actionWith(String message) {
            Task action = Task.action("notify", "console");
            action.getWith().put("message", message);
            return action;
        }

        @Test
        void testResolvableReferencesAreValid() {
            Task action = actionWith("{{ steps.query.results }} above {{ consts.threshold }} for {{ alert.name }}");

            assertNull(reasonFor(action));
        }

        @Test
        void testUnknownStepAndConst() {
            assertEquals("Variable: 'steps.missing.results' - a 'missing' step doesn't exist.",
                    reasonFor(actionWith("{{ steps.missing.results }}")));
            definition.getSequence().clear();
            definition.getSequence().add(step);
            assertEquals("Variable: 'consts.limit' - constant 'limit' not found.",
                    reasonFor(actionWith("{{ consts.limit }}")));
        }

        @Test
        void testStepResultsNeedSuffixAndEarlierStep() {
            assertEquals("Variable: 'steps.query' - to access the results of a step, use 'results' as suffix.",
                    reasonFor(actionWith("{{ steps.query }}")));

            Task early = Task.step("early", "prometheus");
            early.getWith().put("query", "{{ steps.query.results }}");
            definition.getSequence().add(0, early);
            Verdict verdict = validator.validateNode(early, definition.getSequence(), definition);
            assertEquals("Variable: 'steps.query.results' - you can't access the results of a step "
                    + "that appears after the current step.", verdict.reason().orElseThrow());
            assertEquals(ViolationCategory.VARIABLE, verdict.violation().orElseThrow().category());
        }

        @Test
        void testSyntaxRules() {
            assertEquals("Empty mustache variable.", reasonFor(actionWith("{{ }}")));
            assertThat(reasonFor(actionWith("{{ steps[0].results }}"))).contains("bracket notation");
            assertThat(reasonFor(actionWith("{{ alert..name }}"))).endsWith("parts cannot be empty.");
            assertThat(reasonFor(actionWith("{{ alert.name. }}"))).endsWith("parts cannot be empty.");
            assertThat(reasonFor(actionWith("{{ whatever }}"))).endsWith("unknown variable.");
        }

        @Test
        void testForeachNeedsEnclosingLoop() {
            Task outside = actionWith("{{ foreach.value }}");
            assertEquals("Variable: 'foreach.value' - 'foreach' can only be used inside a foreach.",
                    reasonFor(outside));

            definition.getSequence().remove(outside);
            Task inside = actionWith("{{ foreach.value }}");
            Loop loop = Loop.around("{{ steps.query.results }}", inside);
            definition.getSequence().add(loop);
            assertTrue(validator.validateNode(inside, loop.getSequence(), definition).isValid());
            assertTrue(validator.validateNode(loop, definition.getSequence(), definition).isValid());

            Task ownLoop = actionWith("{{ . }}");
            ownLoop.setLoopExpression("{{ steps.query.results }}");
            assertNull(reasonFor(ownLoop));
        }

        @Test
        void testConditionAliasAndConditionFields() {
            Condition condition = Condition.threshold("check", "{{ steps.query.results }}", "{{ consts.nope }}");
            condition.setAlias("high");
            condition.getTrueBranch().add(Task.action("a", "console"));
            definition.getSequence().add(condition);

            assertEquals("Variable: 'consts.nope' - constant 'nope' not found.",
                    validator.validateNode(condition, definition.getSequence(), definition).reason().orElseThrow());

            Task guarded = Task.action("guarded", "console");
            guarded.setGuard("{{ high }}");
            assertNull(reasonFor(guarded));
        }
    }

    @Test
    @DisplayName("Foreach action without a condition can be deployed")
    void testForeachActionWithoutConditionCanDeploy() throws Exception {
        String yaml = """
                workflow:
                  id: w2
                  name: Loop over results
                  triggers:
                    - type: manual
                  steps:
                    - name: list
                      provider:
                        type: mock
                  actions:
                    - name: notify-each
                      foreach: "{{ steps.list.results }}"
                      provider:
                        type: mock
                        with:
                          message: "{{ foreach.value }}"
                """;
        Definition parsed = new YamlWorkflowParser().parse(yaml);
        GraphValidator real = new GraphValidator(ProviderCatalog.empty());

        Map<String, Violation> violations = real.collectViolations(parsed);

        assertThat(violations).isEmpty();
        assertTrue(real.canDeploy(violations));
    }

    @Test
    @DisplayName("Minimal parsed workflow can be deployed")
    void testParsedScenarioCanDeploy() throws Exception {
        String yaml = """
                workflow:
                  id: w1
                  steps:
                    - name: s1
                      provider:
                        type: mock
                        config: "{{providers.p1}}"
                  actions:
                    - name: a1
                      provider:
                        type: slack
                  triggers:
                    - type: manual
                """;
        Definition parsed = new YamlWorkflowParser().parse(yaml);
        GraphValidator real = new GraphValidator(ProviderCatalog.empty());

        Map<String, Violation> violations = real.collectViolations(parsed);

        assertThat(violations.values()).extracting(Violation::category)
                .containsOnly(ViolationCategory.PROVIDER_NOT_INSTALLED);
        assertTrue(real.canDeploy(violations));
    }
}
