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
import dev.mars.alertflow.workflow.model.Condition;
import dev.mars.alertflow.workflow.model.ConditionType;
import dev.mars.alertflow.workflow.model.Definition;
import dev.mars.alertflow.workflow.model.Loop;
import dev.mars.alertflow.workflow.model.StepNode;
import dev.mars.alertflow.workflow.model.Task;
import dev.mars.alertflow.workflow.model.TaskRole;
import dev.mars.alertflow.workflow.model.TriggerDeclaration;
import dev.mars.alertflow.workflow.model.TriggerType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Two-level rule engine for workflow graphs.
 * <p>
 * Node rules are evaluated depth-first in document order and report the first failing rule
 * of each node. Whole-graph rules run after the node rules. All methods are pure.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class GraphValidator {

    // Sentinel keys for workflow-level rules
    public static final String WORKFLOW_NAME = "workflow_name";
    public static final String WORKFLOW_DESCRIPTION = "workflow_description";
    public static final String TRIGGER_START = "trigger_start";
    public static final String TRIGGER_END = "trigger_end";

    // Rule messages
    static final String LOOP_VALUE_EMPTY = "Foreach value cannot be empty.";
    static final String LOOP_EMPTY = "Foreach container must hold a condition or an action.";
    static final String LOOP_CONDITIONS_ONLY = "Foreach container may only hold conditions.";
    static final String CONDITION_NAME_EMPTY = "Condition name cannot be empty.";
    static final String CONDITION_VALUE_EMPTY = "Condition value cannot be empty.";
    static final String CONDITION_COMPARE_TO_EMPTY = "Condition compare to cannot be empty.";
    static final String CONDITION_ASSERT_EMPTY = "Condition assert cannot be empty.";
    static final String BRANCH_EMPTY = "Condition branch must contain at least one action.";
    static final String BRANCH_ACTIONS_ONLY = "Condition branch may only hold actions.";
    static final String FALSE_BRANCH_UNSUPPORTED = "Condition false branch is not supported.";
    static final String STEP_NAME_EMPTY = "Step name cannot be empty.";
    static final String STEP_AFTER_ACTION = "Steps cannot be placed after actions.";
    static final String DUPLICATE_ALIAS = "Condition alias '%s' is already used by another condition.";
    static final String DETACHED_NODE = "Workflow must have exactly one root sequence; this node is not connected to it.";
    static final String NAME_EMPTY = "Workflow name cannot be empty.";
    static final String NO_TRIGGER = "Workflow should have at least one trigger.";
    static final String INTERVAL_EMPTY = "Workflow interval cannot be empty.";
    static final String ALERT_EMPTY = "Workflow alert trigger cannot be empty.";
    static final String INCIDENT_EMPTY = "Workflow incident trigger cannot be empty.";
    static final String SEQUENCE_EMPTY = "At least one step or action is required.";

    private final ProviderCatalog catalog;
    private final int descriptionMaxLength;
    private final Set<String> nonBlockingCategories;

    public GraphValidator(ProviderCatalog catalog) {
        this(catalog, AlertflowConfiguration.defaults());
    }

    public GraphValidator(ProviderCatalog catalog, AlertflowConfiguration configuration) {
        this.catalog = Objects.requireNonNull(catalog, "Provider catalog cannot be null");
        this.descriptionMaxLength = configuration.getDescriptionMaxLength();
        this.nonBlockingCategories = configuration.getNonBlockingCategories();
    }

    /**
     * Validates one node against its own rules.
     *
     * @param node           the node to check
     * @param parentSequence the container holding the node; ordering rules apply when it is the
     *                       definition's root sequence
     * @param definition     the definition the node belongs to
     */
    public Verdict validateNode(StepNode node, List<StepNode> parentSequence, Definition definition) {
        Optional<Violation> violation = checkNode(node, definition);
        if (violation.isEmpty() && parentSequence == definition.getSequence()) {
            violation = checkPlacement(node, parentSequence);
        }
        return violation.<Verdict>map(Verdict.Invalid::new).orElse(Verdict.valid());
    }

    /**
     * Validates the whole graph, surfacing the first violation found.
     */
    public Verdict validateGraph(Definition definition) {
        Map<String, Violation> violations = collectViolations(definition);
        return violations.values().stream()
                .findFirst()
                .<Verdict>map(Verdict.Invalid::new)
                .orElse(Verdict.valid());
    }

    /**
     * First violation of every failing node, then the workflow-level violations.
     */
    public Map<String, Violation> collectViolations(Definition definition) {
        return collectViolations(definition, List.of());
    }

    /**
     * As {@link #collectViolations(Definition)}, also reporting nodes that exist in an editor
     * but are not part of the definition's root sequence.
     */
    public Map<String, Violation> collectViolations(Definition definition, Collection<StepNode> detached) {
        Map<String, Violation> violations = new LinkedHashMap<>();

        for (StepNode node : definition.allNodes()) {
            checkNode(node, definition).ifPresent(v -> violations.putIfAbsent(v.key(), v));
        }
        for (StepNode node : definition.getSequence()) {
            checkPlacement(node, definition.getSequence()).ifPresent(v -> violations.putIfAbsent(v.key(), v));
        }
        for (StepNode node : detached) {
            violations.putIfAbsent(node.getId(),
                    new Violation(node.getId(), DETACHED_NODE, ViolationCategory.STRUCTURE));
        }
        checkAliases(definition, detached, violations);

        checkWorkflow(definition, violations);
        return violations;
    }

    /**
     * True when every violation belongs to a non-blocking category.
     */
    public boolean canDeploy(Map<String, Violation> violations) {
        return violations.values().stream()
                .allMatch(v -> nonBlockingCategories.contains(v.category().name()));
    }

    private Optional<Violation> checkNode(StepNode node, Definition definition) {
        Optional<Violation> violation = Optional.empty();
        if (node instanceof Loop loop) {
            violation = checkLoop(loop);
        } else if (node instanceof Condition condition) {
            violation = checkCondition(condition);
        } else if (node instanceof Task task && isBlank(task.getName())) {
            violation = structure(task, STEP_NAME_EMPTY);
        }
        if (violation.isEmpty()) {
            violation = VariableReferenceChecker.check(node, definition)
                    .map(reason -> new Violation(node.getId(), reason, ViolationCategory.VARIABLE));
        }
        if (violation.isEmpty() && node instanceof Task task) {
            violation = checkProvider(task);
        }
        return violation;
    }

    private Optional<Violation> checkLoop(Loop loop) {
        if (isBlank(loop.getValue())) {
            return structure(loop, LOOP_VALUE_EMPTY);
        }
        List<StepNode> children = loop.getSequence();
        if (children.isEmpty()) {
            return structure(loop, LOOP_EMPTY);
        }
        // a foreach action without a condition parses into a loop around that single action
        if (children.size() == 1 && children.get(0) instanceof Task) {
            return Optional.empty();
        }
        if (children.stream().anyMatch(child -> !(child instanceof Condition))) {
            return structure(loop, LOOP_CONDITIONS_ONLY);
        }
        return Optional.empty();
    }

    private Optional<Violation> checkCondition(Condition condition) {
        if (isBlank(condition.getName())) {
            return structure(condition, CONDITION_NAME_EMPTY);
        }
        if (condition.getConditionType() == ConditionType.THRESHOLD) {
            if (isBlank(condition.getValue())) {
                return structure(condition, CONDITION_VALUE_EMPTY);
            }
            if (isBlank(condition.getCompareTo())) {
                return structure(condition, CONDITION_COMPARE_TO_EMPTY);
            }
        } else if (isBlank(condition.getAssertExpression())) {
            return structure(condition, CONDITION_ASSERT_EMPTY);
        }
        if (condition.getTrueBranch().isEmpty()) {
            return structure(condition, BRANCH_EMPTY);
        }
        boolean actionsOnly = condition.getTrueBranch().stream()
                .allMatch(child -> child instanceof Task task && task.isAction());
        if (!actionsOnly) {
            return structure(condition, BRANCH_ACTIONS_ONLY);
        }
        if (!condition.getFalseBranch().isEmpty()) {
            return structure(condition, FALSE_BRANCH_UNSUPPORTED);
        }
        return Optional.empty();
    }

    private Optional<Violation> checkProvider(Task task) {
        String configName = task.getConfigName() != null ? task.getConfigName().trim() : null;
        return catalog.checkInstallation(task.getProviderType(), configName)
                .map(reason -> new Violation(task.getId(), reason, ViolationCategory.PROVIDER_NOT_INSTALLED));
    }

    /**
     * Ordering rule for the root sequence: no step may follow the first action.
     */
    private Optional<Violation> checkPlacement(StepNode node, List<StepNode> rootSequence) {
        if (!(node instanceof Task task) || task.getRole() != TaskRole.STEP) {
            return Optional.empty();
        }
        int position = rootSequence.indexOf(node);
        for (int i = 0; i < position; i++) {
            if (rootSequence.get(i) instanceof Task earlier && earlier.isAction()) {
                return structure(node, STEP_AFTER_ACTION);
            }
        }
        return Optional.empty();
    }

    /**
     * Aliases resolve guards, so each must belong to exactly one condition. The first holder
     * in document order keeps it; every later holder is reported.
     */
    private void checkAliases(Definition definition, Collection<StepNode> detached,
                              Map<String, Violation> violations) {
        Set<String> seen = new HashSet<>();
        List<StepNode> nodes = new ArrayList<>(definition.allNodes());
        detached.forEach(node -> addSubtree(node, nodes));
        for (StepNode node : nodes) {
            if (node instanceof Condition condition && condition.hasAlias() && !seen.add(condition.getAlias())) {
                violations.putIfAbsent(condition.getId(), new Violation(condition.getId(),
                        String.format(DUPLICATE_ALIAS, condition.getAlias()), ViolationCategory.STRUCTURE));
            }
        }
    }

    private static void addSubtree(StepNode node, List<StepNode> nodes) {
        nodes.add(node);
        Definition.childrenOf(node).forEach(child -> addSubtree(child, nodes));
    }

    private void checkWorkflow(Definition definition, Map<String, Violation> violations) {
        if (isBlank(definition.getName())) {
            add(violations, WORKFLOW_NAME, NAME_EMPTY, ViolationCategory.METADATA);
        }
        if (definition.getDescription().length() > descriptionMaxLength) {
            add(violations, WORKFLOW_DESCRIPTION,
                    "Workflow description cannot exceed " + descriptionMaxLength + " characters.",
                    ViolationCategory.METADATA);
        }
        if (definition.getTriggers().isEmpty()) {
            add(violations, TRIGGER_START, NO_TRIGGER, ViolationCategory.TRIGGER);
        }
        definition.getTrigger(TriggerType.INTERVAL)
                .filter(t -> isBlank(t.getValue()))
                .ifPresent(t -> add(violations, TriggerType.INTERVAL.getValue(), INTERVAL_EMPTY, ViolationCategory.TRIGGER));
        definition.getTrigger(TriggerType.ALERT)
                .filter(t -> t.getFilters().values().stream().allMatch(GraphValidator::isBlank))
                .ifPresent(t -> add(violations, TriggerType.ALERT.getValue(), ALERT_EMPTY, ViolationCategory.TRIGGER));
        definition.getTrigger(TriggerType.INCIDENT)
                .flatMap(this::checkIncident)
                .ifPresent(reason -> add(violations, TriggerType.INCIDENT.getValue(), reason, ViolationCategory.TRIGGER));
        if (definition.getSequence().isEmpty()) {
            add(violations, TRIGGER_END, SEQUENCE_EMPTY, ViolationCategory.STRUCTURE);
        }
    }

    private Optional<String> checkIncident(TriggerDeclaration incident) {
        if (incident.getEvents().isEmpty()) {
            return Optional.of(INCIDENT_EMPTY);
        }
        return incident.getEvents().stream()
                .filter(event -> !TriggerDeclaration.INCIDENT_EVENTS.contains(event))
                .findFirst()
                .map(event -> "Incident event '" + event + "' is not supported; use one of "
                        + TriggerDeclaration.INCIDENT_EVENTS + ".");
    }

    private static Optional<Violation> structure(StepNode node, String reason) {
        return Optional.of(new Violation(node.getId(), reason, ViolationCategory.STRUCTURE));
    }

    private static void add(Map<String, Violation> violations, String key, String reason, ViolationCategory category) {
        violations.putIfAbsent(key, new Violation(key, reason, category));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
