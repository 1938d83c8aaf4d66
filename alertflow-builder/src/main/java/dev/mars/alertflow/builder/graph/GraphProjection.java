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

package dev.mars.alertflow.builder.graph;

import dev.mars.alertflow.workflow.model.Condition;
import dev.mars.alertflow.workflow.model.Definition;
import dev.mars.alertflow.workflow.model.Loop;
import dev.mars.alertflow.workflow.model.StepNode;
import dev.mars.alertflow.workflow.model.Task;
import dev.mars.alertflow.workflow.model.TriggerDeclaration;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Derives the editor graph from a definition.
 * <p>
 * Layout, in node order:
 * <pre>
 * trigger_start -&gt; &lt;trigger&gt;... -&gt; trigger_end -&gt; &lt;root sequence&gt; -&gt; end
 * </pre>
 * Triggers sit in parallel between the two anchors. A condition expands to its own node, the
 * {@code True} and {@code False} branches and a {@code <type>__end__<id>} node; a loop expands
 * to its own node, its body and a {@code foreach__end__<id>} node. Empty branches and bodies
 * are represented by placeholder nodes so that every container keeps an insertion edge.
 * <p>
 * Every edge that stands for a model position carries a {@link Slot}, so inserting on an edge
 * is a plain list insertion in the model.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-19
 */
public final class GraphProjection {

    public static final String TRIGGER_START = "trigger_start";
    public static final String TRIGGER_END = "trigger_end";
    public static final String END = "end";

    static final String TRUE_LABEL = "True";
    static final String FALSE_LABEL = "False";

    private final List<FlowNode> nodes = new ArrayList<>();
    private final List<FlowEdge> edges = new ArrayList<>();
    private boolean detached;

    private GraphProjection() {
    }

    /**
     * Projects a definition together with nodes dropped onto the canvas.
     */
    public static FlowGraph project(Definition definition, Collection<StepNode> detachedNodes) {
        GraphProjection projection = new GraphProjection();
        projection.projectTriggers(definition);
        String last = projection.projectSequence(definition.getSequence(), TRIGGER_END, null, null, Slot.Branch.ROOT);
        projection.nodes.add(new FlowNode(END, FlowNodeType.END, "End", END, null, null, false));
        projection.edges.add(FlowEdge.derived(last, END, null,
                new Slot(null, Slot.Branch.ROOT, definition.getSequence().size())));

        projection.detached = true;
        for (StepNode node : detachedNodes) {
            projection.projectNode(node);
        }
        return new FlowGraph(projection.nodes, projection.edges);
    }

    public static FlowGraph project(Definition definition) {
        return project(definition, List.of());
    }

    public static String conditionEndId(Condition condition) {
        return condition.getTypeName() + "__end__" + condition.getId();
    }

    public static String loopEndId(Loop loop) {
        return Loop.TYPE_NAME + "__end__" + loop.getId();
    }

    public static String placeholderId(StepNode owner, String suffix) {
        return owner.getTypeName() + "__" + owner.getId() + "__empty_" + suffix;
    }

    private void projectTriggers(Definition definition) {
        nodes.add(new FlowNode(TRIGGER_START, FlowNodeType.TRIGGER_START, "Triggers", TRIGGER_START,
                null, null, false));

        int index = 0;
        for (TriggerDeclaration trigger : definition.getTriggers()) {
            String id = trigger.getType().getValue();
            String name = Character.toUpperCase(id.charAt(0)) + id.substring(1);
            nodes.add(new FlowNode(id, FlowNodeType.TRIGGER, name, id, null, trigger.getType(), false));
            edges.add(FlowEdge.derived(TRIGGER_START, id, null, new Slot(null, Slot.Branch.TRIGGERS, index)));
            edges.add(FlowEdge.derived(id, TRIGGER_END, null, new Slot(null, Slot.Branch.TRIGGERS, index + 1)));
            index++;
        }
        if (index == 0) {
            edges.add(FlowEdge.derived(TRIGGER_START, TRIGGER_END, null, new Slot(null, Slot.Branch.TRIGGERS, 0)));
        }

        nodes.add(new FlowNode(TRIGGER_END, FlowNodeType.TRIGGER_END, "Steps", TRIGGER_END, null, null, false));
    }

    /**
     * Chains a container's nodes after {@code from}.
     *
     * @return id of the last node, to be linked to whatever follows the container
     */
    private String projectSequence(List<StepNode> sequence, String from, String firstLabel,
                                   String ownerId, Slot.Branch branch) {
        String previous = from;
        String label = firstLabel;
        for (int i = 0; i < sequence.size(); i++) {
            StepNode node = sequence.get(i);
            edges.add(FlowEdge.derived(previous, node.getId(), label, new Slot(ownerId, branch, i)));
            previous = projectNode(node);
            label = null;
        }
        return previous;
    }

    /**
     * @return the node's exit id: its own id for tasks, its end node for containers
     */
    private String projectNode(StepNode node) {
        if (node instanceof Condition condition) {
            return projectCondition(condition);
        }
        if (node instanceof Loop loop) {
            return projectLoop(loop);
        }
        Task task = (Task) node;
        nodes.add(new FlowNode(task.getId(), FlowNodeType.TASK, task.getName(), task.getTypeName(),
                task.copy(), null, detached));
        return task.getId();
    }

    private String projectCondition(Condition condition) {
        String endId = conditionEndId(condition);
        nodes.add(new FlowNode(condition.getId(), FlowNodeType.CONDITION, condition.getName(),
                condition.getTypeName(), condition.copy(), null, detached));
        projectBranch(condition, condition.getTrueBranch(), TRUE_LABEL, Slot.Branch.TRUE, "true", endId);
        projectBranch(condition, condition.getFalseBranch(), FALSE_LABEL, Slot.Branch.FALSE, "false", endId);
        nodes.add(new FlowNode(endId, FlowNodeType.CONDITION_END, condition.getName(),
                condition.getTypeName(), null, null, detached));
        return endId;
    }

    private String projectLoop(Loop loop) {
        String endId = loopEndId(loop);
        nodes.add(new FlowNode(loop.getId(), FlowNodeType.LOOP, loop.getName(), loop.getTypeName(),
                loop.copy(), null, detached));
        projectBranch(loop, loop.getSequence(), null, Slot.Branch.LOOP, "foreach", endId);
        nodes.add(new FlowNode(endId, FlowNodeType.LOOP_END, loop.getName(), loop.getTypeName(),
                null, null, detached));
        return endId;
    }

    private void projectBranch(StepNode owner, List<StepNode> branch, String label, Slot.Branch kind,
                               String placeholderSuffix, String endId) {
        if (branch.isEmpty()) {
            String placeholder = placeholderId(owner, placeholderSuffix);
            nodes.add(new FlowNode(placeholder, FlowNodeType.PLACEHOLDER, "", placeholder,
                    null, null, detached));
            edges.add(FlowEdge.derived(owner.getId(), placeholder, label, new Slot(owner.getId(), kind, 0)));
            edges.add(FlowEdge.derived(placeholder, endId, null, null));
            return;
        }
        String last = projectSequence(branch, owner.getId(), label, owner.getId(), kind);
        edges.add(FlowEdge.derived(last, endId, null, new Slot(owner.getId(), kind, branch.size())));
    }
}
