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
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Root of an edited workflow: global properties, trigger declarations and the top-level
 * step sequence.
 * <p>
 * The top-level sequence is the single root container of the workflow graph and cannot be
 * removed. At most one trigger is declared per {@link TriggerType}; declarations keep their
 * insertion order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public class Definition {

    private String id;
    private String name;
    private String description;
    private boolean disabled;
    private final Map<String, String> consts;
    private final List<String> owners;
    private final List<String> services;
    private final Map<TriggerType, TriggerDeclaration> triggers;
    private final List<StepNode> sequence;

    public Definition(String id) {
        this.id = Objects.requireNonNull(id, "Workflow id cannot be null");
        this.name = "";
        this.description = "";
        this.consts = new LinkedHashMap<>();
        this.owners = new ArrayList<>();
        this.services = new ArrayList<>();
        this.triggers = new LinkedHashMap<>();
        this.sequence = new ArrayList<>();
    }

    /**
     * Skeleton for a new workflow: no triggers, empty sequence.
     */
    public static Definition empty(String id) {
        return new Definition(id);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = Objects.requireNonNull(id, "Workflow id cannot be null");
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name != null ? name : "";
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description != null ? description : "";
    }

    public boolean isDisabled() {
        return disabled;
    }

    public void setDisabled(boolean disabled) {
        this.disabled = disabled;
    }

    /**
     * Live, ordered named constants.
     */
    public Map<String, String> getConsts() {
        return consts;
    }

    public List<String> getOwners() {
        return owners;
    }

    public List<String> getServices() {
        return services;
    }

    /**
     * Live top-level sequence.
     */
    public List<StepNode> getSequence() {
        return sequence;
    }

    public Collection<TriggerDeclaration> getTriggers() {
        return Collections.unmodifiableCollection(triggers.values());
    }

    public Optional<TriggerDeclaration> getTrigger(TriggerType type) {
        return Optional.ofNullable(triggers.get(type));
    }

    public boolean hasTrigger(TriggerType type) {
        return triggers.containsKey(type);
    }

    /**
     * Declares a trigger, replacing any declaration of the same type in place.
     */
    public void putTrigger(TriggerDeclaration declaration) {
        Objects.requireNonNull(declaration, "Trigger declaration cannot be null");
        triggers.put(declaration.getType(), declaration);
    }

    public boolean removeTrigger(TriggerType type) {
        return triggers.remove(type) != null;
    }

    /**
     * Global properties view: metadata plus one entry per declared trigger, keyed by the
     * trigger's type value. Undeclared triggers have no entry at all.
     */
    public Map<String, Object> getProperties() {
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("id", id);
        properties.put("name", name);
        properties.put("description", description);
        properties.put("disabled", disabled);
        properties.put("consts", Collections.unmodifiableMap(new LinkedHashMap<>(consts)));
        triggers.values().forEach(t -> properties.put(t.getType().getValue(), t.toPropertyValue()));
        return Collections.unmodifiableMap(properties);
    }

    /**
     * Every step node in depth-first document order.
     */
    public List<StepNode> allNodes() {
        List<StepNode> result = new ArrayList<>();
        collect(sequence, result);
        return result;
    }

    public Optional<NodeLocation> locate(String nodeId) {
        return locateIn(sequence, nodeId);
    }

    public Optional<StepNode> findNode(String nodeId) {
        return locate(nodeId).map(NodeLocation::node);
    }

    /**
     * Deep copy keeping every node id.
     */
    public Definition copy() {
        Definition copy = new Definition(id);
        copy.name = name;
        copy.description = description;
        copy.disabled = disabled;
        copy.consts.putAll(consts);
        copy.owners.addAll(owners);
        copy.services.addAll(services);
        copy.triggers.putAll(triggers);
        sequence.forEach(node -> copy.sequence.add(node.copy()));
        return copy;
    }

    /**
     * Direct children of a container node, in document order.
     */
    public static List<StepNode> childrenOf(StepNode node) {
        if (node instanceof Condition) {
            Condition condition = (Condition) node;
            List<StepNode> children = new ArrayList<>(condition.getTrueBranch());
            children.addAll(condition.getFalseBranch());
            return children;
        }
        if (node instanceof Loop) {
            return ((Loop) node).getSequence();
        }
        return List.of();
    }

    /**
     * Finds a node anywhere below {@code container}, which need not belong to a definition.
     */
    public static Optional<NodeLocation> locateIn(List<StepNode> container, String nodeId) {
        return locate(nodeId, container, null);
    }

    private static void collect(List<StepNode> nodes, List<StepNode> result) {
        for (StepNode node : nodes) {
            result.add(node);
            if (node instanceof Condition) {
                collect(((Condition) node).getTrueBranch(), result);
                collect(((Condition) node).getFalseBranch(), result);
            } else if (node instanceof Loop) {
                collect(((Loop) node).getSequence(), result);
            }
        }
    }

    private static Optional<NodeLocation> locate(String nodeId, List<StepNode> container, StepNode parent) {
        for (int i = 0; i < container.size(); i++) {
            StepNode node = container.get(i);
            if (node.getId().equals(nodeId)) {
                return Optional.of(new NodeLocation(node, container, i, parent));
            }
            Optional<NodeLocation> nested = Optional.empty();
            if (node instanceof Condition) {
                Condition condition = (Condition) node;
                nested = locate(nodeId, condition.getTrueBranch(), condition);
                if (nested.isEmpty()) {
                    nested = locate(nodeId, condition.getFalseBranch(), condition);
                }
            } else if (node instanceof Loop) {
                nested = locate(nodeId, ((Loop) node).getSequence(), node);
            }
            if (nested.isPresent()) {
                return nested;
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "Definition{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", triggers=" + triggers.keySet() +
                ", sequence=" + sequence.size() +
                '}';
    }
}
