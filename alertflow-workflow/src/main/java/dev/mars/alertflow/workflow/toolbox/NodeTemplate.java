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

import dev.mars.alertflow.workflow.model.Condition;
import dev.mars.alertflow.workflow.model.ConditionType;
import dev.mars.alertflow.workflow.model.Loop;
import dev.mars.alertflow.workflow.model.NodeKind;
import dev.mars.alertflow.workflow.model.StepNode;
import dev.mars.alertflow.workflow.model.Task;
import dev.mars.alertflow.workflow.model.TaskRole;
import dev.mars.alertflow.workflow.model.TriggerDeclaration;
import dev.mars.alertflow.workflow.model.TriggerType;

import java.util.List;
import java.util.Objects;

/**
 * Specification of a node an editor can place into a workflow graph.
 * <p>
 * Each template kind uses a subset of the fields:
 * <ul>
 *   <li>{@link NodeKind#TRIGGER}: {@code triggerType}</li>
 *   <li>{@link NodeKind#TASK}: {@code role}, {@code providerType}, {@code configName},
 *       {@code stepParams}, {@code actionParams}</li>
 *   <li>{@link NodeKind#CONDITION}: {@code conditionType}</li>
 *   <li>{@link NodeKind#LOOP}: none</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-19
 */
public final class NodeTemplate {

    private final NodeKind kind;
    private final String name;
    private final String typeName;

    // TRIGGER template field
    private final TriggerType triggerType;

    // TASK template fields
    private final TaskRole role;
    private final String providerType;
    private final String configName;
    private final List<String> stepParams;
    private final List<String> actionParams;

    // CONDITION template field
    private final ConditionType conditionType;

    private NodeTemplate(NodeKind kind, String name, String typeName, TriggerType triggerType,
                         TaskRole role, String providerType, String configName,
                         List<String> stepParams, List<String> actionParams, ConditionType conditionType) {
        this.kind = Objects.requireNonNull(kind, "Template kind cannot be null");
        this.name = name;
        this.typeName = typeName;
        this.triggerType = triggerType;
        this.role = role;
        this.providerType = providerType;
        this.configName = configName;
        this.stepParams = stepParams != null ? List.copyOf(stepParams) : List.of();
        this.actionParams = actionParams != null ? List.copyOf(actionParams) : List.of();
        this.conditionType = conditionType;
    }

    /**
     * Creates a trigger template. Its name is the capitalised trigger value.
     */
    public static NodeTemplate trigger(TriggerType type) {
        Objects.requireNonNull(type, "Trigger type cannot be null");
        String value = type.getValue();
        String name = Character.toUpperCase(value.charAt(0)) + value.substring(1);
        return new NodeTemplate(NodeKind.TRIGGER, name, value, type,
                null, null, null, null, null, null);
    }

    /**
     * Creates a step or action template for a provider.
     *
     * @param configName installed configuration the task starts with, or null
     */
    public static NodeTemplate task(TaskRole role, String providerType, String name,
                                    List<String> stepParams, List<String> actionParams, String configName) {
        Objects.requireNonNull(role, "Task role cannot be null");
        Objects.requireNonNull(providerType, "Provider type cannot be null");
        return new NodeTemplate(NodeKind.TASK, name, role.typeName(providerType), null,
                role, providerType, configName, stepParams, actionParams, null);
    }

    /**
     * Creates a condition template named after its type.
     */
    public static NodeTemplate condition(ConditionType type) {
        Objects.requireNonNull(type, "Condition type cannot be null");
        String value = type.getValue();
        String name = Character.toUpperCase(value.charAt(0)) + value.substring(1);
        return new NodeTemplate(NodeKind.CONDITION, name, type.typeName(), null,
                null, null, null, null, null, type);
    }

    public static NodeTemplate foreach() {
        return new NodeTemplate(NodeKind.LOOP, Loop.DEFAULT_NAME, Loop.TYPE_NAME, null,
                null, null, null, null, null, null);
    }

    /**
     * Creates a fresh, empty step node from this template.
     *
     * @throws IllegalStateException for trigger templates, which live in the definition's trigger set
     */
    public StepNode instantiate() {
        switch (kind) {
            case TASK:
                Task task = new Task(StepNode.newId(), name, role, providerType);
                task.setConfigName(configName);
                task.setParams(stepParams, actionParams);
                return task;
            case CONDITION:
                Condition condition = new Condition(StepNode.newId(), conditionType, name);
                if (conditionType == ConditionType.THRESHOLD) {
                    condition.setValue("");
                    condition.setCompareTo("");
                } else {
                    condition.setAssertExpression("");
                }
                return condition;
            case LOOP:
                return new Loop(StepNode.newId(), "");
            default:
                throw new IllegalStateException("Template '" + typeName + "' does not create a step node");
        }
    }

    /**
     * The declaration placed in the trigger set when this trigger template is inserted.
     */
    public TriggerDeclaration triggerDefaults() {
        if (kind != NodeKind.TRIGGER) {
            throw new IllegalStateException("Template '" + typeName + "' is not a trigger");
        }
        return TriggerDeclaration.defaultFor(triggerType);
    }

    public boolean isTrigger() {
        return kind == NodeKind.TRIGGER;
    }

    public NodeKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public String getTypeName() {
        return typeName;
    }

    public TriggerType getTriggerType() {
        return triggerType;
    }

    public TaskRole getRole() {
        return role;
    }

    public String getProviderType() {
        return providerType;
    }

    public String getConfigName() {
        return configName;
    }

    public List<String> getStepParams() {
        return stepParams;
    }

    public List<String> getActionParams() {
        return actionParams;
    }

    public ConditionType getConditionType() {
        return conditionType;
    }

    @Override
    public String toString() {
        return "NodeTemplate{" +
                "kind=" + kind +
                ", name='" + name + '\'' +
                ", type='" + typeName + '\'' +
                '}';
    }
}
