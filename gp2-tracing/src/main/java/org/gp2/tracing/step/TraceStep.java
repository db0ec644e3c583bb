/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements. See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership. The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied. See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.gp2.tracing.step;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.gp2.tracing.graph.EdgeItem;
import org.gp2.tracing.graph.GraphSnapshot;
import org.gp2.tracing.graph.NodeItem;

/**
 * One unit of trace replay, decoded from the tracefile. Each step has a
 * monotonically increasing sequence number in decode order.
 *
 * <p>Steps are immutable apart from three flags that replay discovers late:
 * the loop boundary mark, the virtual step mark and an attached graph
 * snapshot used to undo a rollback or a branch restore when stepping back.</p>
 */
public class TraceStep {

    private final long sequenceNumber;
    private final TraceStepType type;
    private final String contextName;
    private final boolean endOfContext;
    private final List<GraphChange> graphChanges;

    private boolean loopBoundary;
    private boolean virtualStep;
    private GraphSnapshot snapshot;

    public TraceStep(long sequenceNumber, TraceStepType type, String contextName,
                     boolean endOfContext, List<GraphChange> graphChanges) {
        this.sequenceNumber = sequenceNumber;
        this.type = Objects.requireNonNull(type, "type");
        this.contextName = contextName;
        this.endOfContext = endOfContext;
        this.graphChanges = List.copyOf(graphChanges);
    }

    public static TraceStep opening(long sequenceNumber, TraceStepType type, String contextName) {
        return new TraceStep(sequenceNumber, type, contextName, false, List.of());
    }

    public static TraceStep closing(long sequenceNumber, TraceStepType type, String contextName) {
        return new TraceStep(sequenceNumber, type, contextName, true, List.of());
    }

    public static TraceStep leaf(long sequenceNumber, TraceStepType type) {
        return new TraceStep(sequenceNumber, type, null, false, List.of());
    }

    public static TraceStep withChanges(long sequenceNumber, TraceStepType type, List<GraphChange> changes) {
        return new TraceStep(sequenceNumber, type, null, false, changes);
    }

    public long getSequenceNumber() {
        return sequenceNumber;
    }

    public TraceStepType getType() {
        return type;
    }

    /**
     * @return the rule or procedure name for {@link TraceStepType#RULE} and
     *         {@link TraceStepType#PROCEDURE} steps, {@code null} otherwise
     */
    public String getContextName() {
        return contextName;
    }

    public boolean isEndOfContext() {
        return endOfContext;
    }

    public boolean isContextEntry() {
        return type.isContext() && !endOfContext;
    }

    public boolean isContextExit() {
        return type.isContext() && endOfContext;
    }

    public List<GraphChange> getGraphChanges() {
        return graphChanges;
    }

    /**
     * Collects the matched node and edge ids of a {@link TraceStepType#RULE_MATCH} step.
     */
    public Morphism getMorphism() {
        List<String> nodeIds = new ArrayList<>();
        List<String> edgeIds = new ArrayList<>();
        for (GraphChange change : graphChanges) {
            if (change.getType() != GraphChangeType.MORPHISM_ENTRY) {
                continue;
            }
            if (change.getExistingItem() instanceof NodeItem) {
                nodeIds.add(change.getItemId());
            } else if (change.getExistingItem() instanceof EdgeItem) {
                edgeIds.add(change.getItemId());
            }
        }
        return new Morphism(nodeIds, edgeIds);
    }

    public boolean isLoopBoundary() {
        return loopBoundary;
    }

    public void markLoopBoundary() {
        this.loopBoundary = true;
    }

    public boolean isVirtualStep() {
        return virtualStep;
    }

    public void markVirtual() {
        this.virtualStep = true;
    }

    public boolean hasSnapshot() {
        return snapshot != null;
    }

    public GraphSnapshot getSnapshot() {
        return snapshot;
    }

    public void attachSnapshot(GraphSnapshot snapshot) {
        this.snapshot = snapshot;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(sequenceNumber).append("] ");
        if (endOfContext) {
            sb.append("END ");
        }
        sb.append(type);
        if (contextName != null) {
            sb.append(' ').append(contextName);
        }
        if (!graphChanges.isEmpty()) {
            sb.append(" changes=").append(graphChanges.size());
        }
        return sb.toString();
    }
}
