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

package dev.mars.alertflow.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.alertflow.config.AlertflowConfiguration;
import dev.mars.alertflow.workflow.model.Condition;
import dev.mars.alertflow.workflow.model.ConditionType;
import dev.mars.alertflow.workflow.model.Definition;
import dev.mars.alertflow.workflow.model.Loop;
import dev.mars.alertflow.workflow.model.StepNode;
import dev.mars.alertflow.workflow.model.Task;
import dev.mars.alertflow.workflow.model.TaskRole;
import dev.mars.alertflow.workflow.model.TriggerDeclaration;
import dev.mars.alertflow.workflow.observability.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML-based implementation of WorkflowSerializer.
 * <p>
 * The root sequence is walked in document order. Step tasks become {@code steps} entries;
 * every other node becomes one or more {@code actions} entries:
 * <ul>
 *   <li>a condition emits one entry per true-branch action with an inline {@code condition}
 *       list; when the condition has an alias only the first entry carries the list and later
 *       entries reference it through {@code if: "{{ alias }}"}</li>
 *   <li>a loop emits its children the same way with {@code foreach} set to the loop value</li>
 * </ul>
 * Fields are written in a fixed order so repeated serialization of an unchanged definition is
 * byte-identical.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class YamlWorkflowSerializer implements WorkflowSerializer {

    private static final Logger logger = LoggerFactory.getLogger(YamlWorkflowSerializer.class);

    private static final ObjectMapper JSON = new ObjectMapper();

    private final Yaml yaml;
    private final WorkflowMetrics metrics;

    public YamlWorkflowSerializer() {
        this(AlertflowConfiguration.defaults());
    }

    public YamlWorkflowSerializer(AlertflowConfiguration configuration) {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(configuration.getSerializerIndent());
        options.setWidth(configuration.getSerializerLineWidth());
        options.setSplitLines(false);
        this.yaml = new Yaml(options);
        this.metrics = configuration.isMetricsEnabled() ? WorkflowMetrics.getInstance() : null;
    }

    @Override
    public String serialize(Definition definition) {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put(YamlWorkflowParser.WORKFLOW_KEY, buildWorkflow(definition));
        String text = yaml.dump(document);

        logger.debug("Serialized workflow '{}' ({} characters)", definition.getId(), text.length());
        if (metrics != null) {
            metrics.recordSerialized();
        }
        return text;
    }

    @Override
    public void serializeToFile(Definition definition, Path file) throws IOException {
        Files.writeString(file, serialize(definition));
    }

    private Map<String, Object> buildWorkflow(Definition definition) {
        List<Map<String, Object>> steps = new ArrayList<>();
        List<Map<String, Object>> actions = new ArrayList<>();

        for (StepNode node : definition.getSequence()) {
            if (node instanceof Task task) {
                Map<String, Object> entry = buildTaskEntry(task, task.getGuard(), task.getLoopExpression());
                (task.getRole() == TaskRole.STEP ? steps : actions).add(entry);
            } else if (node instanceof Condition condition) {
                actions.addAll(buildConditionEntries(condition, null));
            } else if (node instanceof Loop loop) {
                actions.addAll(buildLoopEntries(loop));
            }
        }

        Map<String, Object> workflow = new LinkedHashMap<>();
        workflow.put("id", definition.getId());
        workflow.put("name", definition.getName());
        workflow.put("description", definition.getDescription());
        workflow.put("disabled", definition.isDisabled());
        workflow.put("owners", new ArrayList<>(definition.getOwners()));
        workflow.put("services", new ArrayList<>(definition.getServices()));
        workflow.put("consts", new LinkedHashMap<>(definition.getConsts()));
        workflow.put("triggers", buildTriggers(definition));
        workflow.put("steps", steps);
        workflow.put("actions", actions);
        return workflow;
    }

    private List<Map<String, Object>> buildTriggers(Definition definition) {
        List<Map<String, Object>> triggers = new ArrayList<>();
        for (TriggerDeclaration trigger : definition.getTriggers()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("type", trigger.getType().getValue());
            switch (trigger.getType()) {
                case MANUAL:
                    break;
                case INTERVAL:
                    if (trigger.getValue() == null || trigger.getValue().isBlank()) {
                        continue;
                    }
                    entry.put("value", trigger.getValue());
                    break;
                case ALERT:
                    if (trigger.getFilters().isEmpty()) {
                        continue;
                    }
                    List<Map<String, Object>> filters = new ArrayList<>();
                    trigger.getFilters().forEach((key, value) -> {
                        Map<String, Object> filter = new LinkedHashMap<>();
                        filter.put("key", key);
                        filter.put("value", value);
                        filters.add(filter);
                    });
                    entry.put("filters", filters);
                    break;
                case INCIDENT:
                    entry.put("events", new ArrayList<>(trigger.getEvents()));
                    break;
                default:
                    break;
            }
            triggers.add(entry);
        }
        return triggers;
    }

    private List<Map<String, Object>> buildLoopEntries(Loop loop) {
        List<Map<String, Object>> entries = new ArrayList<>();
        for (StepNode child : loop.getSequence()) {
            if (child instanceof Condition condition) {
                entries.addAll(buildConditionEntries(condition, loop.getValue()));
            } else if (child instanceof Task task) {
                entries.add(buildTaskEntry(task, task.getGuard(), loop.getValue()));
            } else {
                logger.debug("Skipping nested loop '{}' inside loop '{}'", child.getId(), loop.getId());
            }
        }
        return entries;
    }

    private List<Map<String, Object>> buildConditionEntries(Condition condition, String loopValue) {
        List<Map<String, Object>> entries = new ArrayList<>();
        Map<String, Object> inline = buildInlineCondition(condition);
        boolean first = true;
        for (StepNode child : condition.getTrueBranch()) {
            if (!(child instanceof Task task)) {
                logger.debug("Skipping non-task node '{}' in condition '{}'", child.getId(), condition.getId());
                continue;
            }
            boolean carriesCondition = first || !condition.hasAlias();
            String guard = carriesCondition ? null : "{{ " + condition.getAlias() + " }}";
            // an entry holding both condition and foreach parses back as a loop around the condition
            String foreach = loopValue;
            if (foreach == null && !carriesCondition) {
                foreach = task.getLoopExpression();
            } else if (foreach == null && task.getLoopExpression() != null && !task.getLoopExpression().isBlank()) {
                logger.warn("Action '{}' carries condition '{}' and cannot keep its own foreach '{}'",
                        task.getName(), condition.getName(), task.getLoopExpression());
            }
            Map<String, Object> entry = buildTaskEntry(task, guard, foreach);
            if (carriesCondition) {
                List<Map<String, Object>> conditions = new ArrayList<>();
                conditions.add(new LinkedHashMap<>(inline));
                entry.put("condition", conditions);
            }
            entries.add(entry);
            first = false;
        }
        if (entries.isEmpty()) {
            logger.debug("Condition '{}' has no actions and produces no entries", condition.getId());
        }
        return entries;
    }

    private Map<String, Object> buildInlineCondition(Condition condition) {
        Map<String, Object> inline = new LinkedHashMap<>();
        inline.put("name", condition.getName());
        inline.put("type", condition.getConditionType().getValue());
        if (condition.hasAlias()) {
            inline.put("alias", condition.getAlias());
        }
        if (condition.getConditionType() == ConditionType.THRESHOLD) {
            inline.put("value", nullToEmpty(condition.getValue()));
            inline.put("compare_to", nullToEmpty(condition.getCompareTo()));
        } else {
            inline.put("assert", nullToEmpty(condition.getAssertExpression()));
        }
        return inline;
    }

    private Map<String, Object> buildTaskEntry(Task task, String guard, String foreach) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("name", task.getName());
        if (guard != null && !guard.isBlank()) {
            entry.put("if", guard);
        }
        if (foreach != null && !foreach.isBlank()) {
            entry.put("foreach", foreach);
        }

        String configName = task.getConfigName() != null && !task.getConfigName().isBlank()
                ? task.getConfigName().trim()
                : "default-" + task.getProviderType();
        Map<String, Object> provider = new LinkedHashMap<>();
        provider.put("type", task.getProviderType());
        provider.put("config", "{{ providers." + configName + " }}");
        provider.put("with", decodeWithParams(task.getWith()));
        entry.put("provider", provider);

        if (!task.getVars().isEmpty()) {
            entry.put("vars", new LinkedHashMap<>(task.getVars()));
        }
        return entry;
    }

    /**
     * String values holding a JSON object or array are written as structured YAML.
     */
    private Map<String, Object> decodeWithParams(Map<String, Object> with) {
        Map<String, Object> result = new LinkedHashMap<>();
        with.forEach((key, value) -> result.put(key, decodeJson(value)));
        return result;
    }

    private Object decodeJson(Object value) {
        if (!(value instanceof String text)) {
            return value;
        }
        String trimmed = text.trim();
        if (!(trimmed.startsWith("{") && trimmed.endsWith("}"))
                && !(trimmed.startsWith("[") && trimmed.endsWith("]"))) {
            return value;
        }
        try {
            return JSON.readValue(trimmed, Object.class);
        } catch (JsonProcessingException e) {
            // templated values such as "{{ alert.name }}" are not JSON
            return value;
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
