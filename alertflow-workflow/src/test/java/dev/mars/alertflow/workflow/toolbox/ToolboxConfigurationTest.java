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

package dev.mars.alertflow.workflow.toolbox;

import dev.mars.alertflow.provider.ProviderCatalog;
import dev.mars.alertflow.workflow.model.Condition;
import dev.mars.alertflow.workflow.model.ConditionType;
import dev.mars.alertflow.workflow.model.Loop;
import dev.mars.alertflow.workflow.model.NodeKind;
import dev.mars.alertflow.workflow.model.StepNode;
import dev.mars.alertflow.workflow.model.Task;
import dev.mars.alertflow.workflow.model.TriggerDeclaration;
import dev.mars.alertflow.workflow.model.TriggerType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Description for ToolboxConfigurationTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-19
 */
class ToolboxConfigurationTest {

    private ToolboxConfiguration toolbox;

    @BeforeEach
    void setUp() throws Exception {
        try (InputStream input = getClass().getResourceAsStream("/providers.json")) {
            toolbox = ToolboxConfiguration.fromCatalog(ProviderCatalog.fromJson(input));
        }
    }

    @Test
    @DisplayName("Groups are listed in palette order")
    void listsGroups() {
        assertThat(toolbox.getGroups()).extracting(ToolboxGroup::name)
                .containsExactly("Triggers", "Steps", "Actions", "Misc", "Conditions");
    }

    @Test
    @DisplayName("Steps come from query providers and actions from notify providers")
    void buildsTaskTemplates() {
        assertThat(toolbox.getGroup(ToolboxConfiguration.STEPS_GROUP).orElseThrow().templates())
                .extracting(NodeTemplate::getTypeName)
                .containsExactly("step-prometheus", "step-http");
        assertThat(toolbox.getGroup(ToolboxConfiguration.ACTIONS_GROUP).orElseThrow().templates())
                .extracting(NodeTemplate::getName)
                .containsExactly("ops-slack", "http-action", "console-action");
    }

    @Test
    @DisplayName("Installed providers start with their configuration selected")
    void installedTemplateCarriesConfig() {
        NodeTemplate slack = toolbox.findTemplate("action-slack").orElseThrow();

        Task task = (Task) slack.instantiate();

        assertThat(task.getConfigName()).isEqualTo("ops-slack");
        assertThat(task.isAction()).isTrue();
        assertThat(task.getActionParams()).containsExactly("message", "channel");
    }

    @Test
    @DisplayName("Each instantiation yields a fresh node")
    void instantiatesFreshNodes() {
        NodeTemplate foreach = toolbox.findTemplate(Loop.TYPE_NAME).orElseThrow();

        StepNode first = foreach.instantiate();
        StepNode second = foreach.instantiate();

        assertThat(first).isInstanceOf(Loop.class);
        assertThat(first.getId()).isNotEqualTo(second.getId());
        assertThat(((Loop) first).getValue()).isEmpty();
    }

    @Test
    @DisplayName("Condition templates start with empty operands")
    void conditionTemplate() {
        NodeTemplate threshold = toolbox.findTemplate(ConditionType.THRESHOLD.typeName()).orElseThrow();

        Condition condition = (Condition) threshold.instantiate();

        assertThat(condition.getName()).isEqualTo("Threshold");
        assertThat(condition.getValue()).isEmpty();
        assertThat(condition.getCompareTo()).isEmpty();
        assertThat(condition.getTrueBranch()).isEmpty();
    }

    @Test
    @DisplayName("Trigger templates provide defaults instead of step nodes")
    void triggerTemplate() {
        NodeTemplate alert = toolbox.findTemplate("alert").orElseThrow();

        assertThat(alert.getKind()).isEqualTo(NodeKind.TRIGGER);
        assertThat(alert.getName()).isEqualTo("Alert");
        assertThat(alert.triggerDefaults()).isEqualTo(TriggerDeclaration.alert(Map.of("source", "")));
        assertThatThrownBy(alert::instantiate).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> NodeTemplate.foreach().triggerDefaults())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("An empty catalog still offers triggers, loops and conditions")
    void emptyCatalog() {
        ToolboxConfiguration empty = ToolboxConfiguration.fromCatalog(ProviderCatalog.empty());

        assertThat(empty.getGroup(ToolboxConfiguration.STEPS_GROUP).orElseThrow().templates()).isEmpty();
        assertThat(empty.getGroup(ToolboxConfiguration.TRIGGERS_GROUP).orElseThrow().templates())
                .extracting(NodeTemplate::getTriggerType)
                .containsExactly(TriggerType.MANUAL, TriggerType.INTERVAL, TriggerType.ALERT, TriggerType.INCIDENT);
        assertThat(empty.findTemplate("condition-assert")).isPresent();
        assertThat(empty.getGroup("Misc").orElseThrow().templates()).hasSize(1);
        assertThat(empty.getGroups()).hasSize(5);
    }
}
