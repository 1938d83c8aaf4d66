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

import dev.mars.alertflow.builder.graph.FlowEdge;
import dev.mars.alertflow.builder.graph.FlowGraph;
import dev.mars.alertflow.builder.graph.FlowNode;
import dev.mars.alertflow.builder.graph.FlowNodeType;
import dev.mars.alertflow.builder.graph.GraphProjection;
import dev.mars.alertflow.builder.graph.Slot;
import dev.mars.alertflow.builder.history.EditHistory;
import dev.mars.alertflow.builder.history.EditSnapshot;
import dev.mars.alertflow.builder.observability.BuilderMetrics;
import dev.mars.alertflow.config.AlertflowConfiguration;
import dev.mars.alertflow.provider.ProviderCatalog;
import dev.mars.alertflow.workflow.ParseDiagnostic;
import dev.mars.alertflow.workflow.ParsedWorkflow;
import dev.mars.alertflow.workflow.WorkflowParseException;
import dev.mars.alertflow.workflow.YamlWorkflowParser;
import dev.mars.alertflow.workflow.YamlWorkflowSerializer;
import dev.mars.alertflow.workflow.model.Condition;
import dev.mars.alertflow.workflow.model.Definition;
import dev.mars.alertflow.workflow.model.Loop;
import dev.mars.alertflow.workflow.model.NodeLocation;
import dev.mars.alertflow.workflow.model.StepNode;
import dev.mars.alertflow.workflow.model.TriggerDeclaration;
import dev.mars.alertflow.workflow.toolbox.NodeTemplate;
import dev.mars.alertflow.workflow.validation.GraphValidator;
import dev.mars.alertflow.workflow.validation.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Editing state of one workflow: the definition, the graph derived from it, nodes dropped onto
 * the canvas but not yet part of the workflow, manual edges, the selection and the validation
 * outcome.
 * <p>
 * Every mutation either applies completely or leaves the store untouched, then re-derives the
 * graph and re-runs validation before returning. Rejections are reported through
 * {@link MutationResult}; mutations never throw for user errors.
 * <p>
 * Not thread safe. One editor thread owns a store.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-19
 */
public class WorkflowBuilderStore {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowBuilderStore.class);

    private final YamlWorkflowParser parser;
    private final YamlWorkflowSerializer serializer;
    private final GraphValidator validator;
    private final EditHistory history;
    private final BuilderMetrics metrics;

    private Definition definition;
    private List<StepNode> detached = new ArrayList<>();
    private List<FlowEdge> manualEdges = new ArrayList<>();
    private FlowGraph graph;
    private String selectedNode;
    private Map<String, Violation> violations = Map.of();
    private boolean canDeploy;
    private int changes;
    private List<ParseDiagnostic> diagnostics = List.of();

    @FunctionalInterface
    private interface Mutation {
        void apply() throws MutationRejectedException;
    }

    public WorkflowBuilderStore(ProviderCatalog catalog) {
        this(catalog, AlertflowConfiguration.defaults());
    }

    public WorkflowBuilderStore(ProviderCatalog catalog, AlertflowConfiguration configuration) {
        Objects.requireNonNull(catalog, "Provider catalog cannot be null");
        Objects.requireNonNull(configuration, "Configuration cannot be null");
        this.parser = new YamlWorkflowParser(catalog, configuration);
        this.serializer = new YamlWorkflowSerializer(configuration);
        this.validator = new GraphValidator(catalog, configuration);
        this.history = new EditHistory(configuration.getHistorySize());
        this.metrics = configuration.isMetricsEnabled() ? BuilderMetrics.getInstance() : null;
        this.definition = Definition.empty(UUID.randomUUID().toString());
        refresh();
    }

    // Graph mutations

    /**
     * Inserts a node at the model position the edge stands for. Trigger templates are only
     * accepted on edges between {@code trigger_start} and {@code trigger_end}, every other
     * template only outside that region. The new node becomes the selection.
     */
    public MutationResult addNodeBetween(String edgeId, NodeTemplate template) {
        Objects.requireNonNull(template, "Template cannot be null");
        return mutate("addNodeBetween", () -> {
            FlowEdge edge = graph.findEdge(edgeId)
                    .orElseThrow(() -> new MutationRejectedException(Rejection.UNKNOWN_EDGE,
                            "Edge '" + edgeId + "' does not exist"));
            insertAt(edge, template);
        });
    }

    /**
     * Inserts a node in front of an existing one, on its first insertable incoming edge.
     */
    public MutationResult addNodeBefore(String nodeId, NodeTemplate template) {
        Objects.requireNonNull(template, "Template cannot be null");
        return mutate("addNodeBefore", () -> {
            requireGraphNode(nodeId);
            FlowEdge edge = graph.incoming(nodeId).stream()
                    .filter(FlowEdge::isInsertable)
                    .findFirst()
                    .orElseThrow(() -> new MutationRejectedException(Rejection.INVALID_PLACEMENT,
                            "Nothing can be inserted before '" + nodeId + "'"));
            insertAt(edge, template);
        });
    }

    /**
     * Removes a task, a whole condition or loop, a trigger or a dropped node. Clears the
     * selection.
     */
    public MutationResult deleteNodes(String nodeId) {
        return mutate("deleteNodes", () -> {
            FlowNode node = requireGraphNode(nodeId);
            if (!node.type().isDeletable()) {
                throw new MutationRejectedException(Rejection.NOT_DELETABLE,
                        "Node '" + nodeId + "' cannot be deleted");
            }
            if (node.type() == FlowNodeType.TRIGGER) {
                definition.removeTrigger(node.triggerType());
            } else {
                NodeLocation location = locateStep(nodeId)
                        .orElseThrow(() -> new MutationRejectedException(Rejection.UNKNOWN_NODE,
                                "Node '" + nodeId + "' is not part of the workflow"));
                location.container().remove(location.index());
            }
            selectedNode = null;
        });
    }

    /**
     * Adds a manual edge. Conditions and loops fan out freely; any other source may have a
     * single outgoing edge.
     */
    public MutationResult onConnect(String source, String target) {
        return mutate("onConnect", () -> {
            FlowNode from = requireGraphNode(source);
            requireGraphNode(target);
            if (source.equals(target)) {
                throw new MutationRejectedException(Rejection.CONNECTION_NOT_ALLOWED,
                        "A node cannot be connected to itself");
            }
            List<FlowEdge> outgoing = graph.outgoing(source);
            if (outgoing.stream().anyMatch(e -> e.target().equals(target))) {
                throw new MutationRejectedException(Rejection.CONNECTION_NOT_ALLOWED,
                        "'" + source + "' is already connected to '" + target + "'");
            }
            if (!from.type().isBranch() && !outgoing.isEmpty()) {
                throw new MutationRejectedException(Rejection.CONNECTION_NOT_ALLOWED,
                        "'" + source + "' already has an outgoing connection");
            }
            manualEdges.add(FlowEdge.manual(source, target));
        });
    }

    /**
     * Removes a manual edge. Derived edges follow the model and cannot be deleted.
     */
    public MutationResult deleteEdges(String edgeId) {
        return mutate("deleteEdges", () -> {
            FlowEdge edge = graph.findEdge(edgeId)
                    .orElseThrow(() -> new MutationRejectedException(Rejection.UNKNOWN_EDGE,
                            "Edge '" + edgeId + "' does not exist"));
            if (!edge.manual()) {
                throw new MutationRejectedException(Rejection.NOT_DELETABLE,
                        "Edge '" + edgeId + "' is derived from the workflow and cannot be deleted");
            }
            manualEdges.removeIf(e -> e.id().equals(edgeId));
        });
    }

    /**
     * Places a node on the canvas without linking it into the workflow. It shows up as a
     * detached node until the workflow is edited to include it.
     */
    public MutationResult dropNode(NodeTemplate template) {
        Objects.requireNonNull(template, "Template cannot be null");
        return mutate("dropNode", () -> {
            if (template.isTrigger()) {
                throw new MutationRejectedException(Rejection.INVALID_PLACEMENT,
                        "Triggers can only be added between the trigger anchors");
            }
            StepNode node = template.instantiate();
            detached.add(node);
            selectedNode = node.getId();
        });
    }

    /**
     * Drops a copy of a node, with fresh ids, onto the canvas.
     */
    public MutationResult duplicateNode(String nodeId) {
        return mutate("duplicateNode", () -> {
            requireGraphNode(nodeId);
            StepNode original = locateStep(nodeId)
                    .map(NodeLocation::node)
                    .orElseThrow(() -> new MutationRejectedException(Rejection.INVALID_PLACEMENT,
                            "Node '" + nodeId + "' cannot be duplicated"));
            StepNode copy = original.duplicate();
            detached.add(copy);
            selectedNode = copy.getId();
        });
    }

    // Properties

    /**
     * Sets a property on the selected node; {@code null} removes it.
     */
    public MutationResult updateSelectedNodeData(String key, Object value) {
        Objects.requireNonNull(key, "Property key cannot be null");
        return mutate("updateSelectedNodeData", () -> {
            if (selectedNode == null) {
                throw new MutationRejectedException(Rejection.NO_SELECTION, "No node is selected");
            }
            FlowNode node = requireGraphNode(selectedNode);
            if (node.type() == FlowNodeType.TRIGGER) {
                PropertyEditor.applyToTrigger(definition, node.triggerType(), key, value);
                return;
            }
            StepNode step = locateStep(selectedNode)
                    .map(NodeLocation::node)
                    .orElseThrow(() -> new MutationRejectedException(Rejection.UNKNOWN_PROPERTY,
                            "Node '" + selectedNode + "' has no editable properties"));
            PropertyEditor.applyToStep(step, key, value);
        });
    }

    /**
     * Applies global workflow properties in map order. Trigger keys declare or replace the
     * trigger; a {@code null} trigger value removes it. Either every entry applies or none.
     */
    public MutationResult updateWorkflowProperties(Map<String, ?> properties) {
        Objects.requireNonNull(properties, "Properties cannot be null");
        return mutate("updateWorkflowProperties", () -> {
            for (Map.Entry<String, ?> entry : properties.entrySet()) {
                PropertyEditor.applyToWorkflow(definition, entry.getKey(), entry.getValue());
            }
        });
    }

    // Selection

    /**
     * Selects a node; {@code null} clears the selection. Selection is not an edit and is not
     * recorded in the undo history.
     */
    public MutationResult selectNode(String nodeId) {
        if (nodeId != null && graph.findNode(nodeId).isEmpty()) {
            return reject("selectNode", Rejection.UNKNOWN_NODE, "Node '" + nodeId + "' does not exist");
        }
        selectedNode = nodeId;
        return MutationResult.applied(violations, canDeploy);
    }

    // Document lifecycle

    /**
     * Replaces the workflow with a parsed document. On failure the current workflow is kept.
     */
    public MutationResult loadFromText(String text) {
        ParsedWorkflow parsed;
        try {
            parsed = parser.parseWithDiagnostics(text);
        } catch (WorkflowParseException e) {
            return reject("loadFromText", Rejection.PARSE_FAILED, e.getMessage());
        }
        replace(parsed.definition());
        diagnostics = parsed.diagnostics();
        logger.debug("Loaded workflow '{}' with {} diagnostics", definition.getId(), diagnostics.size());
        return applied("loadFromText");
    }

    public MutationResult loadDefinition(Definition loaded) {
        Objects.requireNonNull(loaded, "Definition cannot be null");
        replace(loaded.copy());
        diagnostics = List.of();
        return applied("loadDefinition");
    }

    /**
     * Back to an empty workflow with a generated id. Clears the undo history.
     */
    public void reset() {
        replace(Definition.empty(UUID.randomUUID().toString()));
        diagnostics = List.of();
        logger.debug("Builder reset to empty workflow '{}'", definition.getId());
    }

    /**
     * YAML for the current workflow. Dropped nodes are not part of it.
     */
    public String serialize() {
        return serializer.serialize(definition);
    }

    /**
     * Restores the state before the last applied mutation.
     */
    public MutationResult undo() {
        Optional<EditSnapshot> snapshot = history.pop();
        if (snapshot.isEmpty()) {
            return reject("undo", Rejection.NOTHING_TO_UNDO, "Nothing to undo");
        }
        restore(snapshot.get());
        changes = Math.max(0, changes - 1);
        refresh();
        return applied("undo");
    }

    public boolean canUndo() {
        return !history.isEmpty();
    }

    // Queries

    /**
     * First outgoing edge of a node, if it has one.
     *
     * @throws IllegalArgumentException if the node does not exist
     */
    public Optional<FlowEdge> getNextEdge(String nodeId) {
        if (graph.findNode(nodeId).isEmpty()) {
            throw new IllegalArgumentException("Node '" + nodeId + "' does not exist");
        }
        return graph.outgoing(nodeId).stream().findFirst();
    }

    /**
     * Copy of the current workflow.
     */
    public Definition getDefinition() {
        return definition.copy();
    }

    public FlowGraph getGraph() {
        return graph;
    }

    public List<FlowNode> getNodes() {
        return graph.nodes();
    }

    public List<FlowEdge> getEdges() {
        return graph.edges();
    }

    public Optional<FlowNode> getNode(String nodeId) {
        return graph.findNode(nodeId);
    }

    public List<FlowNode> getDetachedNodes() {
        return graph.nodes().stream().filter(FlowNode::detached).toList();
    }

    public Optional<String> getSelectedNode() {
        return Optional.ofNullable(selectedNode);
    }

    public Map<String, Violation> getViolations() {
        return violations;
    }

    public boolean canDeploy() {
        return canDeploy;
    }

    /**
     * Applied edits since the workflow was loaded or reset.
     */
    public int getChanges() {
        return changes;
    }

    public List<ParseDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    // Internals

    private MutationResult mutate(String operation, Mutation mutation) {
        EditSnapshot before = snapshot();
        try {
            mutation.apply();
        } catch (MutationRejectedException e) {
            restore(before);
            refresh();
            return reject(operation, e.getRejection(), e.getMessage());
        }
        history.push(before);
        changes++;
        refresh();
        return applied(operation);
    }

    private void insertAt(FlowEdge edge, NodeTemplate template) throws MutationRejectedException {
        if (template.isTrigger()) {
            if (!edge.isTriggerRegion()) {
                throw new MutationRejectedException(Rejection.INVALID_PLACEMENT,
                        "Triggers can only be added between the trigger anchors");
            }
            if (definition.hasTrigger(template.getTriggerType())) {
                throw new MutationRejectedException(Rejection.DUPLICATE_TRIGGER,
                        "Trigger '" + template.getTriggerType().getValue() + "' is already declared");
            }
            TriggerDeclaration declaration = template.triggerDefaults();
            definition.putTrigger(declaration);
            selectedNode = declaration.getType().getValue();
            return;
        }
        if (!edge.isInsertable() || edge.isTriggerRegion()) {
            throw new MutationRejectedException(Rejection.INVALID_PLACEMENT,
                    "'" + template.getName() + "' cannot be placed on edge '" + edge.id() + "'");
        }
        List<StepNode> container = containerFor(edge.slot());
        StepNode node = template.instantiate();
        container.add(Math.min(edge.slot().index(), container.size()), node);
        selectedNode = node.getId();
    }

    private List<StepNode> containerFor(Slot slot) throws MutationRejectedException {
        if (slot.branch() == Slot.Branch.ROOT) {
            return definition.getSequence();
        }
        StepNode owner = locateStep(slot.ownerId())
                .map(NodeLocation::node)
                .orElseThrow(() -> new MutationRejectedException(Rejection.UNKNOWN_NODE,
                        "Node '" + slot.ownerId() + "' does not exist"));
        if (owner instanceof Condition condition) {
            if (slot.branch() == Slot.Branch.TRUE) {
                return condition.getTrueBranch();
            }
            if (slot.branch() == Slot.Branch.FALSE) {
                return condition.getFalseBranch();
            }
        } else if (owner instanceof Loop loop && slot.branch() == Slot.Branch.LOOP) {
            return loop.getSequence();
        }
        throw new MutationRejectedException(Rejection.INVALID_PLACEMENT,
                "Node '" + slot.ownerId() + "' has no " + slot.branch() + " branch");
    }

    private FlowNode requireGraphNode(String nodeId) throws MutationRejectedException {
        if (nodeId == null) {
            throw new MutationRejectedException(Rejection.UNKNOWN_NODE, "Node id is missing");
        }
        return graph.findNode(nodeId)
                .orElseThrow(() -> new MutationRejectedException(Rejection.UNKNOWN_NODE,
                        "Node '" + nodeId + "' does not exist"));
    }

    private Optional<NodeLocation> locateStep(String nodeId) {
        Optional<NodeLocation> location = definition.locate(nodeId);
        return location.isPresent() ? location : Definition.locateIn(detached, nodeId);
    }

    private EditSnapshot snapshot() {
        return EditSnapshot.capture(definition, detached, manualEdges, selectedNode);
    }

    private void restore(EditSnapshot snapshot) {
        definition = snapshot.definition();
        detached = new ArrayList<>(snapshot.detached());
        manualEdges = new ArrayList<>(snapshot.manualEdges());
        selectedNode = snapshot.selectedNode();
    }

    private void replace(Definition replacement) {
        definition = replacement;
        detached = new ArrayList<>();
        manualEdges = new ArrayList<>();
        selectedNode = null;
        history.clear();
        changes = 0;
        refresh();
    }

    /**
     * Re-derives the graph and re-runs validation. Manual edges whose endpoints are gone are
     * dropped.
     */
    private void refresh() {
        FlowGraph projected = GraphProjection.project(definition, detached);
        manualEdges.removeIf(e -> projected.findNode(e.source()).isEmpty()
                || projected.findNode(e.target()).isEmpty());
        graph = projected.withEdges(manualEdges);
        if (selectedNode != null && graph.findNode(selectedNode).isEmpty()) {
            selectedNode = null;
        }
        violations = Collections.unmodifiableMap(
                new LinkedHashMap<>(validator.collectViolations(definition, detached)));
        canDeploy = validator.canDeploy(violations);
    }

    private MutationResult applied(String operation) {
        logger.debug("{} applied: {} violations, canDeploy={}", operation, violations.size(), canDeploy);
        if (metrics != null) {
            metrics.recordMutation(operation, violations.size());
        }
        return MutationResult.applied(violations, canDeploy);
    }

    private MutationResult reject(String operation, Rejection rejection, String message) {
        logger.warn("{} rejected ({}): {}", operation, rejection, message);
        if (metrics != null) {
            metrics.recordRejected(operation, rejection.name());
        }
        return MutationResult.rejected(rejection, message, violations, canDeploy);
    }
}
