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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single provider invocation.
 * <p>
 * {@code configName} is the bare name of the provider configuration, without the
 * {@code {{ providers.<name> }}} templating used in documents. {@code guard} holds a raw
 * {@code if} expression that was not resolved to a condition alias.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-19
 */
public final class Task implements StepNode {

    private final String id;
    private String name;
    private final TaskRole role;
    private final String providerType;
    private String configName;
    private final Map<String, Object> with;
    private final Map<String, Object> vars;
    private String guard;
    private String loopExpression;
    private List<String> stepParams;
    private List<String> actionParams;

    public Task(String id, String name, TaskRole role, String providerType) {
        this.id = Objects.requireNonNull(id, "Task id cannot be null");
        this.name = name != null ? name : "";
        this.role = Objects.requireNonNull(role, "Task role cannot be null");
        this.providerType = Objects.requireNonNull(providerType, "Provider type cannot be null");
        this.with = new LinkedHashMap<>();
        this.vars = new LinkedHashMap<>();
        this.stepParams = List.of();
        this.actionParams = List.of();
    }

    public static Task step(String name, String providerType) {
        return new Task(StepNode.newId(), name, TaskRole.STEP, providerType);
    }

    public static Task action(String name, String providerType) {
        return new Task(StepNode.newId(), name, TaskRole.ACTION, providerType);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void setName(String name) {
        this.name = name != null ? name : "";
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.TASK;
    }

    @Override
    public String getTypeName() {
        return role.typeName(providerType);
    }

    public TaskRole getRole() {
        return role;
    }

    public boolean isAction() {
        return role == TaskRole.ACTION;
    }

    public String getProviderType() {
        return providerType;
    }

    public String getConfigName() {
        return configName;
    }

    public void setConfigName(String configName) {
        this.configName = configName;
    }

    /**
     * Live, ordered {@code with} parameters.
     */
    public Map<String, Object> getWith() {
        return with;
    }

    /**
     * Live, ordered task variables.
     */
    public Map<String, Object> getVars() {
        return vars;
    }

    public String getGuard() {
        return guard;
    }

    public void setGuard(String guard) {
        this.guard = guard;
    }

    public String getLoopExpression() {
        return loopExpression;
    }

    public void setLoopExpression(String loopExpression) {
        this.loopExpression = loopExpression;
    }

    public List<String> getStepParams() {
        return stepParams;
    }

    public List<String> getActionParams() {
        return actionParams;
    }

    public void setParams(List<String> stepParams, List<String> actionParams) {
        this.stepParams = stepParams != null ? List.copyOf(stepParams) : List.of();
        this.actionParams = actionParams != null ? List.copyOf(actionParams) : List.of();
    }

    @Override
    public Task copy() {
        return copyAs(id);
    }

    @Override
    public Task duplicate() {
        return copyAs(StepNode.newId());
    }

    private Task copyAs(String newId) {
        Task copy = new Task(newId, name, role, providerType);
        copy.configName = configName;
        copy.with.putAll(ModelCopies.deepCopy(with));
        copy.vars.putAll(ModelCopies.deepCopy(vars));
        copy.guard = guard;
        copy.loopExpression = loopExpression;
        copy.stepParams = stepParams;
        copy.actionParams = actionParams;
        return copy;
    }

    @Override
    public String toString() {
        return "Task{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", type='" + getTypeName() + '\'' +
                (configName != null ? ", config='" + configName + '\'' : "") +
                (guard != null ? ", if='" + guard + '\'' : "") +
                (loopExpression != null ? ", foreach='" + loopExpression + '\'' : "") +
                '}';
    }
}
