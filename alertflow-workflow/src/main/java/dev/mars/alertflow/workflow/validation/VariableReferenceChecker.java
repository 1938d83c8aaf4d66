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

import dev.mars.alertflow.workflow.model.Condition;
import dev.mars.alertflow.workflow.model.ConditionType;
import dev.mars.alertflow.workflow.model.Definition;
import dev.mars.alertflow.workflow.model.Loop;
import dev.mars.alertflow.workflow.model.NodeLocation;
import dev.mars.alertflow.workflow.model.StepNode;
import dev.mars.alertflow.workflow.model.Task;
import dev.mars.alertflow.workflow.model.TaskRole;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks the {@code {{ ... }}} references held in a node's templated fields against the
 * definition the node belongs to.
 * <p>
 * {@code steps.<name>.results} must name an earlier task, {@code consts.<name>} a declared
 * constant, and {@code foreach}, {@code value} or {@code .} are only available inside a
 * foreach. {@code alert}, {@code incident}, {@code providers} and condition aliases are
 * accepted as they are.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
final class VariableReferenceChecker {

    private static final Pattern VARIABLE_PATTERN = Pattern.compile("\\{\\{([^}]*)\\}\\}");
    private static final Pattern ALLOWED_NAME = Pattern.compile("[A-Za-z0-9_.\\-]+");

    private VariableReferenceChecker() {
    }

    /**
     * First invalid reference among the node's templated fields, as a readable message.
     */
    static Optional<String> check(StepNode node, Definition definition) {
        for (String template : templatesOf(node)) {
            Matcher matcher = VARIABLE_PATTERN.matcher(template);
            while (matcher.find()) {
                Optional<String> error = checkVariable(matcher.group(1).trim(), node, definition);
                if (error.isPresent()) {
                    return error;
                }
            }
        }
        return Optional.empty();
    }

    static Optional<String> checkVariable(String name, StepNode node, Definition definition) {
        if (name.isEmpty()) {
            return Optional.of("Empty mustache variable.");
        }
        if (".".equals(name)) {
            return insideLoop(node, definition)
                    ? Optional.empty()
                    : error(name, "needs to be used in a foreach.");
        }
        if (!ALLOWED_NAME.matcher(name).matches()) {
            if (name.contains("[") || name.contains("]")) {
                return error(name, "bracket notation is not supported, use dot notation instead.");
            }
            return error(name, "contains invalid characters.");
        }
        String[] parts = name.split("\\.", -1);
        for (String part : parts) {
            if (part.isEmpty()) {
                return error(name, "parts cannot be empty.");
            }
        }
        String second = parts.length > 1 ? parts[1] : null;
        switch (parts[0]) {
            case "alert":
            case "incident":
            case "providers":
                return Optional.empty();
            case "foreach":
            case "value":
                return insideLoop(node, definition)
                        ? Optional.empty()
                        : error(name, "'" + parts[0] + "' can only be used inside a foreach.");
            case "secrets":
                return second == null
                        ? error(name, "to access a secret, you need to specify the secret name.")
                        : Optional.empty();
            case "vars":
                if (second == null) {
                    return error(name, "to access a variable, you need to specify the variable name.");
                }
                if (!(node instanceof Task task) || !task.getVars().containsKey(second)) {
                    return error(name, "variable '" + second + "' not found in step definition.");
                }
                return Optional.empty();
            case "consts":
                if (second == null) {
                    return error(name, "to access a constant, you need to specify the constant name.");
                }
                if (!definition.getConsts().containsKey(second)) {
                    return error(name, "constant '" + second + "' not found.");
                }
                return Optional.empty();
            case "steps":
                return checkStepReference(name, parts, node, definition);
            default:
                if (parts.length == 1 && isAlias(parts[0], definition)) {
                    return Optional.empty();
                }
                return error(name, "unknown variable.");
        }
    }

    private static Optional<String> checkStepReference(String name, String[] parts, StepNode node,
                                                       Definition definition) {
        if (parts.length < 2) {
            return error(name, "to access the results of a step, you need to specify the step name.");
        }
        String stepName = parts[1];
        List<StepNode> flat = definition.allNodes();
        int referenced = -1;
        for (int i = 0; i < flat.size(); i++) {
            StepNode candidate = flat.get(i);
            if (candidate instanceof Task && (stepName.equals(candidate.getName()) || stepName.equals(candidate.getId()))) {
                referenced = i;
                break;
            }
        }
        if (referenced < 0) {
            return error(name, "a '" + stepName + "' step doesn't exist.");
        }
        Task target = (Task) flat.get(referenced);
        if (target == node) {
            return error(name, "you can't access the results of the current step.");
        }
        int current = flat.indexOf(node);
        if (current >= 0 && referenced > current) {
            return error(name, "you can't access the results of a step that appears after the current step.");
        }
        if (node instanceof Task task && task.getRole() == TaskRole.STEP && target.isAction()) {
            return error(name, "you can't access the results of an action from a step.");
        }
        if (parts.length < 3 || !"results".equals(parts[2])) {
            return error(name, "to access the results of a step, use 'results' as suffix.");
        }
        return Optional.empty();
    }

    private static boolean insideLoop(StepNode node, Definition definition) {
        if (node instanceof Task task && !isBlank(task.getLoopExpression())) {
            return true;
        }
        Optional<NodeLocation> location = definition.locate(node.getId());
        while (location.isPresent() && location.get().parent() != null) {
            StepNode parent = location.get().parent();
            if (parent instanceof Loop) {
                return true;
            }
            location = definition.locate(parent.getId());
        }
        return false;
    }

    private static boolean isAlias(String name, Definition definition) {
        return definition.allNodes().stream()
                .anyMatch(n -> n instanceof Condition condition && name.equals(condition.getAlias()));
    }

    private static List<String> templatesOf(StepNode node) {
        List<String> templates = new ArrayList<>();
        if (node instanceof Task task) {
            addIfPresent(templates, task.getGuard());
            addIfPresent(templates, task.getLoopExpression());
            task.getWith().values().forEach(value -> collectStrings(value, templates));
        } else if (node instanceof Condition condition) {
            if (condition.getConditionType() == ConditionType.THRESHOLD) {
                addIfPresent(templates, condition.getValue());
                addIfPresent(templates, condition.getCompareTo());
            } else {
                addIfPresent(templates, condition.getAssertExpression());
            }
        } else if (node instanceof Loop loop) {
            addIfPresent(templates, loop.getValue());
        }
        return templates;
    }

    private static void collectStrings(Object value, List<String> templates) {
        if (value instanceof String text) {
            templates.add(text);
        } else if (value instanceof Map<?, ?> map) {
            map.values().forEach(v -> collectStrings(v, templates));
        } else if (value instanceof List<?> list) {
            list.forEach(v -> collectStrings(v, templates));
        }
    }

    private static void addIfPresent(List<String> templates, String value) {
        if (value != null) {
            templates.add(value);
        }
    }

    private static Optional<String> error(String name, String detail) {
        return Optional.of("Variable: '" + name + "' - " + detail);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
