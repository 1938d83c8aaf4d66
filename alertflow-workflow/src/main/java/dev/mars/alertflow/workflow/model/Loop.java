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
 * Foreach container. Repeats its nested sequence once per element of {@code value}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-02-19
 */
public final class Loop implements StepNode {

    public static final String TYPE_NAME = "foreach";
    public static final String DEFAULT_NAME = "Foreach";

    private final String id;
    private String name;
    private String value;
    private final List<StepNode> sequence;

    public Loop(String id, String value) {
        this.id = Objects.requireNonNull(id, "Loop id cannot be null");
        this.name = DEFAULT_NAME;
        this.value = value;
        this.sequence = new ArrayList<>();
    }

    /**
     * Wraps a single node in a new loop.
     */
    public static Loop around(String value, StepNode node) {
        Loop loop = new Loop(StepNode.newId(), value);
        loop.sequence.add(node);
        return loop;
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
        return NodeKind.LOOP;
    }

    @Override
    public String getTypeName() {
        return TYPE_NAME;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    /**
     * Live nested sequence.
     */
    public List<StepNode> getSequence() {
        return sequence;
    }

    @Override
    public Loop copy() {
        Loop copy = new Loop(id, value);
        copy.name = name;
        sequence.forEach(node -> copy.sequence.add(node.copy()));
        return copy;
    }

    @Override
    public Loop duplicate() {
        Loop copy = new Loop(StepNode.newId(), value);
        copy.name = name;
        sequence.forEach(node -> copy.sequence.add(node.duplicate()));
        return copy;
    }

    @Override
    public String toString() {
        return "Loop{id='" + id + "', value='" + value + "', children=" + sequence.size() + '}';
    }
}
