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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Immutable node and edge view of a definition.
 */
public record FlowGraph(List<FlowNode> nodes, List<FlowEdge> edges) {

    public FlowGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public Optional<FlowNode> findNode(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    public Optional<FlowEdge> findEdge(String id) {
        return edges.stream().filter(e -> e.id().equals(id)).findFirst();
    }

    public List<FlowEdge> outgoing(String nodeId) {
        return edges.stream().filter(e -> e.source().equals(nodeId)).toList();
    }

    public List<FlowEdge> incoming(String nodeId) {
        return edges.stream().filter(e -> e.target().equals(nodeId)).toList();
    }

    /**
     * Same nodes with extra edges appended.
     */
    public FlowGraph withEdges(List<FlowEdge> extra) {
        if (extra.isEmpty()) {
            return this;
        }
        List<FlowEdge> all = new ArrayList<>(edges);
        all.addAll(extra);
        return new FlowGraph(nodes, all);
    }
}
