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

package dev.mars.alertflow.builder;

import dev.mars.alertflow.workflow.model.Condition;
import dev.mars.alertflow.workflow.model.ConditionType;
import dev.mars.alertflow.workflow.model.Definition;
import dev.mars.alertflow.workflow.model.Loop;
import dev.mars.alertflow.workflow.model.StepNode;
import dev.mars.alertflow.workflow.model.Task;
import dev.mars.alertflow.workflow.model.TriggerDeclaration;
import dev.mars.alertflow.workflow.model.TriggerType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies single property edits to model objects. A {@code null} value removes the property:
 * optional fields are cleared, map entries and triggers are deleted, names become empty.
 * <p>
 * Task keys: {@code name}, {@code config}, {@code if}, {@code foreach}, {@code with.<param>},
 * {@code vars.<name>}. Condition keys: {@code name}, {@code alias}, {@code value} and
 * {@code compare_to} (threshold), {@code assert} (assert). Loop keys: {@code name},
 * {@code value}. Trigger keys: {@code value} (interval), {@code filters} or
 * {@code filters.<key>} (alert), {@code events} (incident).
 */
final class PropertyEditor {

    static final String WITH_PREFIX = "with.";
    static final String VARS_PREFIX = "vars.";
    static final String FILTERS_PREFIX = "filters.";

    private PropertyEditor() {
    }

    static void applyToStep(StepNode node, String key, Object value) throws MutationRejectedException {
        if (node instanceof Task task) {
            applyToTask(task, key, value);
        } else if (node instanceof Condition condition) {
            applyToCondition(condition, key, value);
        } else if (node instanceof Loop loop) {
            applyToLoop(loop, key, value);
        }
    }

    private static void applyToTask(Task task, String key, Object value) throws MutationRejectedException {
        if (key.startsWith(WITH_PREFIX) && key.length() > WITH_PREFIX.length()) {
            putOrRemove(task.getWith(), key.substring(WITH_PREFIX.length()), value);
            return;
        }
        if (key.startsWith(VARS_PREFIX) && key.length() > VARS_PREFIX.length()) {
            putOrRemove(task.getVars(), key.substring(VARS_PREFIX.length()), value);
            return;
        }
        switch (key) {
            case "name":
                task.setName(text(key, value));
                break;
            case "config":
                task.setConfigName(text(key, value));
                break;
            case "if":
                task.setGuard(text(key, value));
                break;
            case "foreach":
                task.setLoopExpression(text(key, value));
                break;
            default:
                throw unknown(key, task.getTypeName());
        }
    }

    private static void applyToCondition(Condition condition, String key, Object value)
            throws MutationRejectedException {
        boolean threshold = condition.getConditionType() == ConditionType.THRESHOLD;
        switch (key) {
            case "name":
                condition.setName(text(key, value));
                break;
            case "alias":
                condition.setAlias(text(key, value));
                break;
            case "value":
                if (!threshold) {
                    throw unknown(key, condition.getTypeName());
                }
                condition.setValue(text(key, value));
                break;
            case "compare_to":
                if (!threshold) {
                    throw unknown(key, condition.getTypeName());
                }
                condition.setCompareTo(text(key, value));
                break;
            case "assert":
                if (threshold) {
                    throw unknown(key, condition.getTypeName());
                }
                condition.setAssertExpression(text(key, value));
                break;
            default:
                throw unknown(key, condition.getTypeName());
        }
    }

    private static void applyToLoop(Loop loop, String key, Object value) throws MutationRejectedException {
        switch (key) {
            case "name":
                loop.setName(text(key, value));
                break;
            case "value":
                loop.setValue(text(key, value));
                break;
            default:
                throw unknown(key, loop.getTypeName());
        }
    }

    static void applyToTrigger(Definition definition, TriggerType type, String key, Object value)
            throws MutationRejectedException {
        TriggerDeclaration current = definition.getTrigger(type)
                .orElseThrow(() -> new MutationRejectedException(Rejection.UNKNOWN_NODE,
                        "Trigger '" + type.getValue() + "' is not declared"));
        switch (type) {
            case INTERVAL:
                if (!"value".equals(key)) {
                    throw unknown(key, type.getValue());
                }
                String interval = text(key, value);
                definition.putTrigger(TriggerDeclaration.interval(interval != null ? interval : ""));
                break;
            case ALERT:
                Map<String, String> filters;
                if ("filters".equals(key)) {
                    filters = value == null ? Map.of() : textMap(key, value);
                } else if (key.startsWith(FILTERS_PREFIX) && key.length() > FILTERS_PREFIX.length()) {
                    filters = new LinkedHashMap<>(current.getFilters());
                    String filterKey = key.substring(FILTERS_PREFIX.length());
                    if (value == null) {
                        filters.remove(filterKey);
                    } else {
                        filters.put(filterKey, text(key, value));
                    }
                } else {
                    throw unknown(key, type.getValue());
                }
                definition.putTrigger(TriggerDeclaration.alert(filters));
                break;
            case INCIDENT:
                if (!"events".equals(key)) {
                    throw unknown(key, type.getValue());
                }
                definition.putTrigger(TriggerDeclaration.incident(value == null ? List.of() : textList(key, value)));
                break;
            default:
                throw unknown(key, type.getValue());
        }
    }

    /**
     * Edits a global workflow property. Trigger keys declare, replace or (with {@code null})
     * remove the trigger.
     */
    static void applyToWorkflow(Definition definition, String key, Object value) throws MutationRejectedException {
        TriggerType triggerType = TriggerType.fromValue(key).orElse(null);
        if (triggerType != null) {
            applyTriggerProperty(definition, triggerType, value);
            return;
        }
        switch (key) {
            case "id":
                String id = text(key, value);
                if (id == null || id.isBlank()) {
                    throw new MutationRejectedException(Rejection.INVALID_VALUE, "Workflow id cannot be empty");
                }
                definition.setId(id);
                break;
            case "name":
                definition.setName(text(key, value));
                break;
            case "description":
                definition.setDescription(text(key, value));
                break;
            case "disabled":
                definition.setDisabled(value != null && Boolean.parseBoolean(text(key, value)));
                break;
            case "consts":
                Map<String, String> consts = value == null ? Map.of() : textMap(key, value);
                definition.getConsts().clear();
                definition.getConsts().putAll(consts);
                break;
            case "owners":
                List<String> owners = value == null ? List.of() : textList(key, value);
                definition.getOwners().clear();
                definition.getOwners().addAll(owners);
                break;
            case "services":
                List<String> services = value == null ? List.of() : textList(key, value);
                definition.getServices().clear();
                definition.getServices().addAll(services);
                break;
            default:
                throw unknown(key, "workflow");
        }
    }

    private static void applyTriggerProperty(Definition definition, TriggerType type, Object value)
            throws MutationRejectedException {
        if (value == null) {
            definition.removeTrigger(type);
            return;
        }
        switch (type) {
            case MANUAL:
                definition.putTrigger(TriggerDeclaration.manual());
                break;
            case INTERVAL:
                definition.putTrigger(TriggerDeclaration.interval(text(type.getValue(), value)));
                break;
            case ALERT:
                definition.putTrigger(TriggerDeclaration.alert(textMap(type.getValue(), value)));
                break;
            case INCIDENT:
                Object events = value instanceof Map<?, ?> map ? map.get("events") : value;
                definition.putTrigger(TriggerDeclaration.incident(
                        events == null ? List.of() : textList(type.getValue(), events)));
                break;
            default:
                throw unknown(type.getValue(), "workflow");
        }
    }

    private static void putOrRemove(Map<String, Object> target, String key, Object value) {
        if (value == null) {
            target.remove(key);
        } else {
            target.put(key, value);
        }
    }

    private static String text(String key, Object value) throws MutationRejectedException {
        if (value == null) {
            return null;
        }
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        throw new MutationRejectedException(Rejection.INVALID_VALUE,
                "Property '" + key + "' expects a scalar, got " + value.getClass().getSimpleName());
    }

    private static Map<String, String> textMap(String key, Object value) throws MutationRejectedException {
        if (!(value instanceof Map<?, ?> map)) {
            throw new MutationRejectedException(Rejection.INVALID_VALUE, "Property '" + key + "' expects a mapping");
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String text = text(key, entry.getValue());
            result.put(String.valueOf(entry.getKey()), text != null ? text : "");
        }
        return result;
    }

    /**
     * Accepts a list or a comma separated string.
     */
    private static List<String> textList(String key, Object value) throws MutationRejectedException {
        List<String> result = new ArrayList<>();
        if (value instanceof String text) {
            Arrays.stream(text.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(result::add);
            return result;
        }
        if (!(value instanceof List<?> list)) {
            throw new MutationRejectedException(Rejection.INVALID_VALUE, "Property '" + key + "' expects a list");
        }
        for (Object item : list) {
            String text = text(key, item);
            if (text != null) {
                result.add(text);
            }
        }
        return result;
    }

    private static MutationRejectedException unknown(String key, String owner) {
        return new MutationRejectedException(Rejection.UNKNOWN_PROPERTY,
                "Property '" + key + "' is not defined for " + owner);
    }
}
