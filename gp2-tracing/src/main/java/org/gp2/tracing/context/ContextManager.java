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
package org.gp2.tracing.context;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.gp2.tracing.graph.Graph;
import org.gp2.tracing.graph.GraphSnapshot;
import org.gp2.tracing.step.TraceDirection;
import org.gp2.tracing.step.TraceStep;
import org.gp2.tracing.step.TraceStepType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the lexical contexts open at the replay cursor and owns the graph
 * snapshots used to roll back speculative execution.
 *
 * <p>Entering an if, try or loop iteration forwards pushes a snapshot of the
 * graph, which stays on the snapshot stack until that context exits. The
 * snapshot stack depth therefore always equals the number of open
 * rollback-eligible contexts. Branch entry and iteration rollback restore
 * from a snapshot without popping it.</p>
 *
 * <p>Everything a forward step pops is remembered against that step, so that
 * stepping backward over it pushes the same state back and the stacks match
 * the ones a forward replay to that point would have built.</p>
 */
public class ContextManager {

    private static final Logger LOG = LoggerFactory.getLogger(ContextManager.class);

    private final Graph graph;
    private final Deque<TraceStepType> contexts = new ArrayDeque<>();
    private final List<GraphSnapshot> snapshots = new ArrayList<>();
    private final Deque<Boolean> iterationOutcomes = new ArrayDeque<>();

    private final Map<TraceStep, GraphSnapshot> releasedSnapshots = new IdentityHashMap<>();
    private final Map<TraceStep, Boolean> releasedOutcomes = new IdentityHashMap<>();
    private final Set<TraceStep> rolledBackSteps = Collections.newSetFromMap(new IdentityHashMap<>());

    public ContextManager(Graph graph) {
        this.graph = graph;
    }

    /**
     * Opens the context of {@code step}. Forwards this is a context-entry step;
     * backwards it is an end-of-context step being re-entered from its end.
     */
    public void enterContext(TraceStep step, TraceDirection direction) {
        TraceStepType type = step.getType();
        if (direction == TraceDirection.FORWARDS) {
            if (type == TraceStepType.THEN_BRANCH || type == TraceStepType.ELSE_BRANCH) {
                enterBranch(step);
            }
            contexts.push(type);
            if (type.isRollbackEligible()) {
                snapshots.add(GraphSnapshot.capture(graph));
            }
            if (type == TraceStepType.LOOP_ITERATION) {
                iterationOutcomes.push(Boolean.TRUE);
            }
            return;
        }

        contexts.push(type);
        if (type.isRollbackEligible()) {
            GraphSnapshot released = releasedSnapshots.remove(step);
            if (released == null) {
                LOG.warn("No snapshot recorded for {}; using the current graph", step);
                released = GraphSnapshot.capture(graph);
            }
            snapshots.add(released);
        }
        if (type == TraceStepType.LOOP_ITERATION) {
            Boolean outcome = releasedOutcomes.remove(step);
            iterationOutcomes.push(outcome != null ? outcome : Boolean.TRUE);
        }
    }

    /**
     * Closes the context of {@code step}. Forwards this is an end-of-context
     * step; backwards it is a context-entry step being left from its start.
     */
    public void exitContext(TraceStep step, TraceDirection direction) {
        TraceStepType type = step.getType();
        if (direction == TraceDirection.FORWARDS) {
            popContext(step);
            if (type == TraceStepType.LOOP_ITERATION) {
                Boolean outcome = iterationOutcomes.pop();
                releasedOutcomes.put(step, outcome);
                if (!outcome) {
                    LOG.debug("Loop iteration closed after a rollback at {}", step);
                }
            }
            if (type.isRollbackEligible()) {
                releasedSnapshots.put(step, popSnapshot(step));
            }
            return;
        }

        if (type.isRollbackEligible()) {
            popSnapshot(step);
        }
        if (type == TraceStepType.LOOP_ITERATION) {
            iterationOutcomes.pop();
        }
        popContext(step);
        if ((type == TraceStepType.THEN_BRANCH || type == TraceStepType.ELSE_BRANCH) && step.hasSnapshot()) {
            LOG.debug("Undoing branch restore of {}", step);
            step.getSnapshot().restoreInto(graph);
        }
    }

    /**
     * Handles a failure point met while replaying forwards. If the nearest
     * enclosing loop iteration is reached before any branch condition or rule
     * set, the graph is rolled back to the snapshot taken when that iteration
     * was entered. The pre-rollback graph is attached to {@code step}.
     *
     * @return true if the graph was rolled back
     */
    public boolean rollBackIteration(TraceStep step) {
        int eligibleAbove = 0;
        for (Iterator<TraceStepType> it = contexts.iterator(); it.hasNext(); ) {
            TraceStepType type = it.next();
            if (type == TraceStepType.BRANCH_CONDITION || type == TraceStepType.RULE_SET) {
                return false;
            }
            if (type == TraceStepType.LOOP_ITERATION) {
                GraphSnapshot target = snapshots.get(snapshots.size() - 1 - eligibleAbove);
                step.attachSnapshot(GraphSnapshot.capture(graph));
                target.restoreInto(graph);
                iterationOutcomes.pop();
                iterationOutcomes.push(Boolean.FALSE);
                rolledBackSteps.add(step);
                LOG.debug("Rolled back loop iteration at {}", step);
                return true;
            }
            if (type.isRollbackEligible()) {
                eligibleAbove++;
            }
        }
        return false;
    }

    /**
     * Reverses {@link #rollBackIteration(TraceStep)} when stepping backward over
     * {@code step}. Does nothing if no rollback happened at that step.
     *
     * @return true if a rollback was undone
     */
    public boolean undoRollback(TraceStep step) {
        if (!rolledBackSteps.remove(step)) {
            return false;
        }
        step.getSnapshot().restoreInto(graph);
        iterationOutcomes.pop();
        iterationOutcomes.push(Boolean.TRUE);
        LOG.debug("Undid loop iteration rollback at {}", step);
        return true;
    }

    public boolean isEmpty() {
        return contexts.isEmpty();
    }

    public int getDepth() {
        return contexts.size();
    }

    /**
     * @return the innermost open context, or {@code null} if none is open
     */
    public TraceStepType peek() {
        return contexts.peek();
    }

    /**
     * @return the open contexts, innermost first
     */
    public List<TraceStepType> getOpenContexts() {
        return List.copyOf(contexts);
    }

    public int getSnapshotDepth() {
        return snapshots.size();
    }

    /**
     * Number of open if, try and loop iteration contexts.
     */
    public int getRollbackEligibleDepth() {
        return (int) contexts.stream().filter(TraceStepType::isRollbackEligible).count();
    }

    /**
     * @return whether the innermost open loop iteration is still expected to succeed,
     *         or {@code null} if no iteration is open
     */
    public Boolean getCurrentIterationOutcome() {
        return iterationOutcomes.peek();
    }

    private void enterBranch(TraceStep step) {
        TraceStepType enclosing = contexts.peek();
        if (enclosing != TraceStepType.IF_CONTEXT && enclosing != TraceStepType.TRY_CONTEXT) {
            LOG.warn("{} is not directly inside an if or try context (found {})", step, enclosing);
            return;
        }
        if (snapshots.isEmpty()) {
            LOG.warn("No snapshot to restore when entering {}", step);
            return;
        }
        // A successful try keeps the effects of its condition.
        if (step.getType() == TraceStepType.THEN_BRANCH && enclosing == TraceStepType.TRY_CONTEXT) {
            return;
        }
        step.attachSnapshot(GraphSnapshot.capture(graph));
        snapshots.get(snapshots.size() - 1).restoreInto(graph);
        LOG.debug("Restored pre-condition graph on entering {}", step);
    }

    private void popContext(TraceStep step) {
        if (contexts.isEmpty()) {
            LOG.warn("Context stack is empty when closing {}", step);
            return;
        }
        TraceStepType top = contexts.pop();
        if (top != step.getType()) {
            LOG.warn("Closed {} but the innermost open context was {}", step, top);
        }
    }

    private GraphSnapshot popSnapshot(TraceStep step) {
        if (snapshots.isEmpty()) {
            LOG.warn("Snapshot stack is empty when closing {}", step);
            return GraphSnapshot.capture(graph);
        }
        return snapshots.remove(snapshots.size() - 1);
    }
}
