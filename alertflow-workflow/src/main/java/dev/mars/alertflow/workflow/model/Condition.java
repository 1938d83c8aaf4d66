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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A branch node. Its true branch holds the actions that run when the condition holds; the
 * false branch exists for graph symmetry and stays empty in valid workflows.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-19
 */
public final class Condition implements StepNode {

    private final String id;
    private final ConditionType conditionType;
    private String name;
    private String alias;
    private String value;
    private String compareTo;
    private String assertExpression;
    private final List<StepNode> trueBranch;
    private final List<StepNode> falseBranch;

    public Condition(String id, ConditionType conditionType, String name) {
        this.id = Objects.requireNonNull(id, "Condition id cannot be null");
        this.conditionType = Objects.requireNonNull(conditionType, "Condition type cannot be null");
        this.name = name != null ? name : "";
        this.trueBranch = new ArrayList<>();
        this.falseBranch = new ArrayList<>();
    }

    public static Condition threshold(String name, String value, String compareTo) {
        Condition condition = new Condition(StepNode.newId(), ConditionType.THRESHOLD, name);
        condition.setValue(value);
        condition.setCompareTo(compareTo);
        return condition;
    }

    public static Condition assertion(String name, String assertExpression) {
        Condition condition = new Condition(StepNode.newId(), ConditionType.ASSERT, name);
        condition.setAssertExpression(assertExpression);
        return condition;
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
        return NodeKind.CONDITION;
    }

    @Override
    public String getTypeName() {
        return conditionType.typeName();
    }

    public ConditionType getConditionType() {
        return conditionType;
    }

    public String getAlias() {
        return alias;
    }

    public void setAlias(String alias) {
        this.alias = alias;
    }

    public boolean hasAlias() {
        return alias != null && !alias.isBlank();
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public String getCompareTo() {
        return compareTo;
    }

    public void setCompareTo(String compareTo) {
        this.compareTo = compareTo;
    }

    public String getAssertExpression() {
        return assertExpression;
    }

    public void setAssertExpression(String assertExpression) {
        this.assertExpression = assertExpression;
    }

    /**
     * Live true branch.
     */
    public List<StepNode> getTrueBranch() {
        return trueBranch;
    }

    /**
     * Live false branch.
     */
    public List<StepNode> getFalseBranch() {
        return falseBranch;
    }

    @Override
    public Condition copy() {
        Condition copy = copyFields(id);
        trueBranch.forEach(node -> copy.trueBranch.add(node.copy()));
        falseBranch.forEach(node -> copy.falseBranch.add(node.copy()));
        return copy;
    }

    /**
     * Copies this condition and its branches under fresh ids. The alias is not carried over,
     * since an alias must resolve to a single condition.
     */
    @Override
    public Condition duplicate() {
        Condition copy = copyFields(StepNode.newId());
        copy.alias = null;
        trueBranch.forEach(node -> copy.trueBranch.add(node.duplicate()));
        falseBranch.forEach(node -> copy.falseBranch.add(node.duplicate()));
        return copy;
    }

    private Condition copyFields(String newId) {
        Condition copy = new Condition(newId, conditionType, name);
        copy.alias = alias;
        copy.value = value;
        copy.compareTo = compareTo;
        copy.assertExpression = assertExpression;
        return copy;
    }

    @Override
    public String toString() {
        return "Condition{" +
                "id='" + id + '\'' +
                ", type=" + conditionType +
                ", name='" + name + '\'' +
                (hasAlias() ? ", alias='" + alias + '\'' : "") +
                ", trueBranch=" + trueBranch.size() +
                '}';
    }
}
