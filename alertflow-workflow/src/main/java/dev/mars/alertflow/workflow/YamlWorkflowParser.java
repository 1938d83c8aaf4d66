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

import dev.mars.alertflow.config.AlertflowConfiguration;
import dev.mars.alertflow.provider.ProviderCatalog;
import dev.mars.alertflow.provider.ProviderDescriptor;
import dev.mars.alertflow.workflow.model.Condition;
import dev.mars.alertflow.workflow.model.ConditionType;
import dev.mars.alertflow.workflow.model.Definition;
import dev.mars.alertflow.workflow.model.Loop;
import dev.mars.alertflow.workflow.model.StepNode;
import dev.mars.alertflow.workflow.model.Task;
import dev.mars.alertflow.workflow.model.TaskRole;
import dev.mars.alertflow.workflow.model.TriggerDeclaration;
import dev.mars.alertflow.workflow.model.TriggerType;
import dev.mars.alertflow.workflow.observability.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.MarkedYAMLException;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * YAML-based implementation of WorkflowParser.
 * Parses workflow documents using SnakeYAML in a single left-to-right pass.
 * <p>
 * Steps are appended to the root sequence as they are read. Actions are placed according
 * to their {@code if}, {@code foreach} and {@code condition} fields: an {@code if} naming a
 * previously declared condition alias joins that condition's true branch, a {@code foreach}
 * wraps the action (or each of its inline conditions) in a loop, and each inline condition
 * becomes its own condition node holding a copy of the action.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class YamlWorkflowParser implements WorkflowParser {

    private static final Logger logger = LoggerFactory.getLogger(YamlWorkflowParser.class);

    static final String WORKFLOW_KEY = "workflow";
    static final String LEGACY_WORKFLOW_KEY = "alert";

    // Graph anchor ids; document ids may not take them
    static final Set<String> RESERVED_IDS = Set.of("trigger_start", "trigger_end", "end");

    private final Yaml yaml;
    private final ProviderCatalog catalog;
    private final boolean strictAliases;
    private final WorkflowMetrics metrics;

    public YamlWorkflowParser() {
        this(ProviderCatalog.empty(), AlertflowConfiguration.defaults());
    }

    public YamlWorkflowParser(ProviderCatalog catalog, AlertflowConfiguration configuration) {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
        this.catalog = Objects.requireNonNull(catalog, "Provider catalog cannot be null");
        this.strictAliases = configuration.isStrictAliases();
        this.metrics = configuration.isMetricsEnabled() ? WorkflowMetrics.getInstance() : null;
    }

    @Override
    public Definition parse(String text) throws WorkflowParseException {
        return parseWithDiagnostics(text).definition();
    }

    @Override
    public Definition parse(Path file) throws WorkflowParseException {
        try {
            String content = Files.readString(file);
            return parse(content);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read workflow file: " + file, e);
        }
    }

    @Override
    public ParsedWorkflow parseWithDiagnostics(String text) throws WorkflowParseException {
        long start = System.nanoTime();
        try {
            Map<String, Object> document = decode(text);
            String wrapper = document.containsKey(LEGACY_WORKFLOW_KEY) ? LEGACY_WORKFLOW_KEY : WORKFLOW_KEY;
            ParseContext context = new ParseContext();
            Definition definition = parseWorkflow(document, wrapper, context);

            logger.debug("Parsed workflow '{}': {} top-level nodes, {} triggers, {} diagnostics",
                    definition.getId(), definition.getSequence().size(),
                    definition.getTriggers().size(), context.diagnostics.size());
            if (metrics != null) {
                metrics.recordParsed(wrapper, (System.nanoTime() - start) / 1_000_000_000.0);
            }
            return new ParsedWorkflow(definition, context.diagnostics);
        } catch (WorkflowParseException e) {
            logger.debug("Workflow document rejected: {}", e.getMessage());
            if (metrics != null) {
                metrics.recordParseFailed(e.getClass().getSimpleName());
            }
            throw e;
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> decode(String text) throws MalformedDocumentException {
        Object root;
        try {
            root = yaml.load(text);
        } catch (MarkedYAMLException e) {
            int line = e.getProblemMark() != null ? e.getProblemMark().getLine() + 1 : -1;
            throw new MalformedDocumentException(line, "YAML parsing failed: " + e.getProblem(), e);
        } catch (YAMLException e) {
            throw new MalformedDocumentException(-1, "YAML parsing failed: " + e.getMessage(), e);
        }
        if (root == null) {
            throw new MalformedDocumentException("Empty workflow document");
        }
        if (!(root instanceof Map)) {
            throw new MalformedDocumentException("Workflow document must be a mapping, found "
                    + root.getClass().getSimpleName());
        }
        return (Map<String, Object>) root;
    }

    private Definition parseWorkflow(Map<String, Object> document, String wrapper, ParseContext context)
            throws WorkflowParseException {
        Object payload = document.get(wrapper);
        if (payload == null) {
            throw new SemanticErrorException("Missing top-level '" + WORKFLOW_KEY + "' or '"
                    + LEGACY_WORKFLOW_KEY + "' key");
        }
        if (!(payload instanceof Map)) {
            throw new SemanticErrorException(null, wrapper, "Workflow payload must be a mapping");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> data = (Map<String, Object>) payload;

        String id = getStringValue(data, "id");
        if (id == null || id.isBlank()) {
            throw new SemanticErrorException(null, "id", "Workflow id is required");
        }
        context.workflowId = id;

        List<Map<String, Object>> steps = getListValue(data, "steps", context);
        List<Map<String, Object>> actions = getListValue(data, "actions", context);
        if (steps == null && actions == null) {
            throw new SemanticErrorException(id, null, "Workflow must declare steps or actions");
        }

        Definition definition = new Definition(id);
        String name = getStringValue(data, "name");
        definition.setName(name == null || name.isBlank() ? id : name);
        definition.setDescription(getStringValue(data, "description", ""));
        definition.setDisabled(getBooleanValue(data, "disabled", false));
        definition.getConsts().putAll(parseConsts(getMapValue(data, "consts", context)));
        definition.getOwners().addAll(parseStringList(data.get("owners")));
        definition.getServices().addAll(parseStringList(data.get("services")));

        parseTriggers(data, definition, context);

        if (steps != null) {
            for (int i = 0; i < steps.size(); i++) {
                String path = "steps[" + i + "]";
                definition.getSequence().add(parseStep(steps.get(i), path, context));
            }
        }
        if (actions != null) {
            for (int i = 0; i < actions.size(); i++) {
                String path = "actions[" + i + "]";
                parseAction(actions.get(i), path, definition.getSequence(), context);
            }
        }
        return definition;
    }

    private void parseTriggers(Map<String, Object> data, Definition definition, ParseContext context)
            throws WorkflowParseException {
        List<Map<String, Object>> triggers = getListValue(data, "triggers", context);
        if (triggers == null) {
            return;
        }
        for (int i = 0; i < triggers.size(); i++) {
            String path = "triggers[" + i + "]";
            Map<String, Object> entry = triggers.get(i);
            String typeValue = getStringValue(entry, "type");
            TriggerType type = TriggerType.fromValue(typeValue)
                    .orElseThrow(() -> new SemanticErrorException(context.workflowId, path + ".type",
                            "Unknown trigger type '" + typeValue + "'"));

            if (definition.hasTrigger(type)) {
                context.diagnose(ParseDiagnostic.Kind.DUPLICATE_TRIGGER, path,
                        "Trigger '" + type.getValue() + "' declared more than once, keeping the first");
                continue;
            }
            definition.putTrigger(parseTrigger(type, entry, path, context));
        }
    }

    private TriggerDeclaration parseTrigger(TriggerType type, Map<String, Object> entry, String path,
                                            ParseContext context) throws WorkflowParseException {
        switch (type) {
            case MANUAL:
                return TriggerDeclaration.manual();
            case INTERVAL:
                return TriggerDeclaration.interval(getStringValue(entry, "value", ""));
            case ALERT: {
                Map<String, String> filters = new LinkedHashMap<>();
                List<Map<String, Object>> filterList = getListValue(entry, "filters", context, path);
                if (filterList != null) {
                    for (Map<String, Object> filter : filterList) {
                        String key = getStringValue(filter, "key");
                        if (key != null) {
                            filters.put(key, getStringValue(filter, "value", ""));
                        }
                    }
                }
                return TriggerDeclaration.alert(filters);
            }
            case INCIDENT:
                return TriggerDeclaration.incident(parseStringList(entry.get("events")));
            default:
                throw new SemanticErrorException(context.workflowId, path, "Unsupported trigger type " + type);
        }
    }

    private Task parseStep(Map<String, Object> entry, String path, ParseContext context)
            throws WorkflowParseException {
        Task task = parseTask(entry, TaskRole.STEP, path, context);
        // steps keep their guard and loop verbatim; they never move into branches
        task.setGuard(getStringValue(entry, "if"));
        task.setLoopExpression(getStringValue(entry, "foreach"));
        return task;
    }

    private void parseAction(Map<String, Object> entry, String path, List<StepNode> sequence,
                             ParseContext context) throws WorkflowParseException {
        Task task = parseTask(entry, TaskRole.ACTION, path, context);
        String guard = getStringValue(entry, "if");
        String foreach = getStringValue(entry, "foreach");
        List<Map<String, Object>> conditions = getListValue(entry, "condition", context, path);
        boolean hasConditions = conditions != null && !conditions.isEmpty();

        if (guard != null && !guard.isBlank()) {
            if (hasConditions) {
                context.diagnose(ParseDiagnostic.Kind.IGNORED_CONDITION, path + ".condition",
                        "Action '" + task.getName() + "' has both 'if' and 'condition'; the condition list is ignored");
            }
            String alias = stripTemplating(guard);
            Condition target = context.aliases.get(alias);
            if (target != null) {
                task.setLoopExpression(foreach);
                target.getTrueBranch().add(task);
                return;
            }
            if (strictAliases) {
                throw new SemanticErrorException(context.workflowId, path + ".if",
                        "Condition alias '" + alias + "' is not declared");
            }
            logger.warn("Workflow '{}': action '{}' references undeclared condition alias '{}', keeping it unconditioned",
                    context.workflowId, task.getName(), alias);
            context.diagnose(ParseDiagnostic.Kind.UNRESOLVED_ALIAS, path + ".if",
                    "Condition alias '" + alias + "' is not declared; action '" + task.getName() + "' runs unconditionally");
            task.setGuard(guard);
            sequence.add(foreach != null ? Loop.around(foreach, task) : task);
            return;
        }

        if (!hasConditions) {
            sequence.add(foreach != null ? Loop.around(foreach, task) : task);
            return;
        }

        for (int i = 0; i < conditions.size(); i++) {
            String conditionPath = path + ".condition[" + i + "]";
            Condition condition = parseCondition(conditions.get(i), conditionPath, context);
            condition.getTrueBranch().add(i == 0 ? task : task.duplicate());
            if (condition.hasAlias()) {
                Condition existing = context.aliases.putIfAbsent(condition.getAlias(), condition);
                if (existing != null) {
                    context.diagnose(ParseDiagnostic.Kind.DUPLICATE_ALIAS, conditionPath + ".alias",
                            "Alias '" + condition.getAlias() + "' already declared, references resolve to the first");
                }
            }
            sequence.add(foreach != null ? Loop.around(foreach, condition) : condition);
        }
    }

    private Task parseTask(Map<String, Object> entry, TaskRole role, String path, ParseContext context)
            throws WorkflowParseException {
        Map<String, Object> provider = getMapValue(entry, "provider", context, path);
        if (provider == null) {
            throw new SemanticErrorException(context.workflowId, path + ".provider", "Provider is required");
        }
        String providerType = getStringValue(provider, "type");
        if (providerType == null || providerType.isBlank()) {
            throw new SemanticErrorException(context.workflowId, path + ".provider.type", "Provider type is required");
        }

        String id = context.nodeId(getStringValue(entry, "id"), path + ".id");
        Task task = new Task(id, getStringValue(entry, "name", ""), role, providerType);
        task.setConfigName(stripConfigReference(getStringValue(provider, "config")));

        Map<String, Object> with = getMapValue(provider, "with", context, path + ".provider");
        if (with != null) {
            with.forEach((key, value) -> task.getWith().put(String.valueOf(key), value));
        }
        Map<String, Object> vars = getMapValue(entry, "vars", context, path);
        if (vars != null) {
            vars.forEach((key, value) -> task.getVars().put(String.valueOf(key), value));
        }

        Optional<ProviderDescriptor> descriptor = catalog.find(providerType);
        descriptor.ifPresent(d -> task.setParams(d.getQueryParams(), d.getNotifyParams()));
        return task;
    }

    private Condition parseCondition(Map<String, Object> entry, String path, ParseContext context)
            throws WorkflowParseException {
        String typeValue = getStringValue(entry, "type");
        ConditionType type = ConditionType.fromValue(typeValue)
                .orElseThrow(() -> new SemanticErrorException(context.workflowId, path + ".type",
                        "Unknown condition type '" + typeValue + "'"));

        String id = context.nodeId(getStringValue(entry, "id"), path + ".id");
        Condition condition = new Condition(id, type, getStringValue(entry, "name", ""));
        condition.setAlias(getStringValue(entry, "alias"));
        condition.setValue(getStringValue(entry, "value"));
        condition.setCompareTo(getStringValue(entry, "compare_to"));
        condition.setAssertExpression(getStringValue(entry, "assert"));
        return condition;
    }

    /**
     * Removes {@code {{ }}} delimiters and surrounding whitespace from a reference.
     */
    static String stripTemplating(String reference) {
        return reference.replace("{{", "").replace("}}", "").trim();
    }

    /**
     * Reduces {@code {{ providers.<name> }}} to {@code <name>}.
     */
    static String stripConfigReference(String reference) {
        if (reference == null) {
            return null;
        }
        String name = stripTemplating(reference).replace("providers.", "").trim();
        return name.isEmpty() ? null : name;
    }

    // Utility methods for safe value extraction

    private String getStringValue(Map<String, Object> data, String key) {
        return getStringValue(data, key, null);
    }

    private String getStringValue(Map<String, Object> data, String key, String defaultValue) {
        Object value = data.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private boolean getBooleanValue(Map<String, Object> data, String key, boolean defaultValue) {
        Object value = data.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    private Map<String, Object> getMapValue(Map<String, Object> data, String key, ParseContext context)
            throws SemanticErrorException {
        return getMapValue(data, key, context, null);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getMapValue(Map<String, Object> data, String key, ParseContext context,
                                            String parentPath) throws SemanticErrorException {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw new SemanticErrorException(context.workflowId, fieldPath(parentPath, key),
                    "Expected a mapping");
        }
        return (Map<String, Object>) value;
    }

    private List<Map<String, Object>> getListValue(Map<String, Object> data, String key, ParseContext context)
            throws SemanticErrorException {
        return getListValue(data, key, context, null);
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> getListValue(Map<String, Object> data, String key, ParseContext context,
                                                   String parentPath) throws SemanticErrorException {
        Object value = data.get(key);
        if (value == null) {
            return null;
        }
        String path = fieldPath(parentPath, key);
        if (!(value instanceof List)) {
            throw new SemanticErrorException(context.workflowId, path, "Expected a list");
        }
        List<Object> items = (List<Object>) value;
        List<Map<String, Object>> result = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            if (!(items.get(i) instanceof Map)) {
                throw new SemanticErrorException(context.workflowId, path + "[" + i + "]", "Expected a mapping");
            }
            result.add((Map<String, Object>) items.get(i));
        }
        return result;
    }

    private Map<String, String> parseConsts(Map<String, Object> data) {
        Map<String, String> consts = new LinkedHashMap<>();
        if (data != null) {
            data.forEach((key, value) -> consts.put(String.valueOf(key), value != null ? value.toString() : ""));
        }
        return consts;
    }

    private List<String> parseStringList(Object data) {
        List<String> result = new ArrayList<>();
        if (data instanceof List) {
            for (Object item : (List<?>) data) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        }
        return result;
    }

    private static String fieldPath(String parentPath, String key) {
        return parentPath != null ? parentPath + "." + key : key;
    }

    /**
     * State of a single parse pass.
     */
    private static final class ParseContext {
        private final Map<String, Condition> aliases = new HashMap<>();
        private final List<ParseDiagnostic> diagnostics = new ArrayList<>();
        private final Set<String> nodeIds = new HashSet<>();
        private String workflowId;

        void diagnose(ParseDiagnostic.Kind kind, String fieldPath, String message) {
            diagnostics.add(new ParseDiagnostic(kind, fieldPath, message));
        }

        /**
         * The declared id when it is free to use, otherwise a generated one.
         */
        String nodeId(String declared, String fieldPath) {
            if (declared == null) {
                return StepNode.newId();
            }
            if (declared.isBlank() || RESERVED_IDS.contains(declared)
                    || TriggerType.fromValue(declared).isPresent() || !nodeIds.add(declared)) {
                String generated = StepNode.newId();
                diagnose(ParseDiagnostic.Kind.REPLACED_ID, fieldPath,
                        "Id '" + declared + "' is reserved or already taken, using '" + generated + "'");
                return generated;
            }
            return declared;
        }
    }
}
