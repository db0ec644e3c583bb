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
package org.gp2.tracing.runner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.gp2.tracing.context.ContextManager;
import org.gp2.tracing.graph.Graph;
import org.gp2.tracing.highlight.Token;
import org.gp2.tracing.highlight.TraceHighlighter;
import org.gp2.tracing.parser.TraceParseException;
import org.gp2.tracing.parser.TraceParser;
import org.gp2.tracing.step.Morphism;
import org.gp2.tracing.step.TraceDirection;
import org.gp2.tracing.step.TraceStep;
import org.gp2.tracing.step.TraceStepType;
import org.gp2.tracing.step.TraceSteps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays a tracefile forwards and backwards over a live graph.
 *
 * <p>The step at the cursor is the next one to replay. Steps are decoded
 * lazily, at most one ahead of the cursor, and kept for the whole session so
 * that stepping backward never needs the decoder.</p>
 *
 * <p>Usage:
 * <pre>{@code
 * try (TraceRunner runner = TraceSessionConfiguration.builder()
 *         .tracefile(Paths.get("gp2.trace"))
 *         .graph(hostGraph)
 *         .programTokens(tokens)
 *         .build()) {
 *
 *     // Show the match, then apply it
 *     if (runner.isFindMatchAvailable()) {
 *         Morphism match = runner.findMatch();
 *         runner.applyMatch();
 *     }
 *
 *     runner.goToEnd();
 *     runner.stepBackward();
 *     runner.goToStart();
 * }
 * }</pre>
 */
public class TraceRunner implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(TraceRunner.class);

    private final TraceParser parser;
    private final Graph graph;
    private final ContextManager contextManager;
    private final GraphChangeApplier changeApplier;
    private final TraceHighlighter highlighter;
    private final String compilerPrefix;
    private final List<ReplayListener> listeners;
    private final List<TraceStep> steps = new ArrayList<>();

    private int currentPosition;
    private boolean parseComplete;
    private boolean parseFailed;

    public TraceRunner(TraceParser parser, Graph graph, List<Token> programTokens,
                       String compilerPrefix, List<ReplayListener> listeners) {
        this.parser = parser;
        this.graph = graph;
        this.contextManager = new ContextManager(graph);
        this.changeApplier = new GraphChangeApplier(graph);
        this.compilerPrefix = compilerPrefix != null ? compilerPrefix : "";
        this.highlighter = new TraceHighlighter(programTokens, this.compilerPrefix);
        this.listeners = List.copyOf(listeners);

        decodeNextStep();
        highlighter.update(getCurrentStep(), TraceDirection.FORWARDS);
        LOG.info("Trace session started ({} step(s) decoded)", steps.size());
    }

    public boolean isForwardAvailable() {
        return currentPosition < steps.size() || !parseComplete;
    }

    public boolean isBackwardAvailable() {
        return currentPosition > 0;
    }

    public boolean isFindMatchAvailable() {
        TraceStep step = getCurrentStep();
        return step != null && (step.getType() == TraceStepType.RULE_MATCH
                || step.getType() == TraceStepType.RULE_MATCH_FAILED);
    }

    public boolean isMatchApplicationAvailable() {
        TraceStep step = getCurrentStep();
        return step != null && step.getType() == TraceStepType.RULE_APPLICATION;
    }

    /**
     * Replays the step at the cursor and advances the cursor past it.
     *
     * @return the step that was replayed
     * @throws NavigationException if forward navigation is unavailable
     * @throws TraceParseException if decoding the next step fails; the step
     *         itself has been replayed and the cursor has moved
     */
    public TraceStep stepForward() {
        if (!isForwardAvailable()) {
            throw new NavigationException("Cannot step forward: reached the end of the trace");
        }
        if (currentPosition == steps.size() && !decodeNextStep()) {
            highlighter.update(null, TraceDirection.FORWARDS);
            throw new NavigationException("Cannot step forward: reached the end of the trace");
        }

        TraceStep step = steps.get(currentPosition);
        replayForward(step, currentPosition);
        currentPosition++;

        if (currentPosition == steps.size() && !parseComplete) {
            try {
                decodeNextStep();
            } catch (TraceParseException e) {
                parseFailed = true;
                parseComplete = true;
                highlighter.update(null, TraceDirection.FORWARDS);
                notifyStep(step, TraceDirection.FORWARDS);
                throw e;
            }
        }

        propagateVirtualFlag();
        highlighter.update(getCurrentStep(), TraceDirection.FORWARDS);
        notifyStep(step, TraceDirection.FORWARDS);
        return step;
    }

    /**
     * Moves the cursor back by one and undoes the step it lands on.
     *
     * @return the step that was undone, now the step at the cursor
     * @throws NavigationException if the cursor is at the start
     */
    public TraceStep stepBackward() {
        if (!isBackwardAvailable()) {
            throw new NavigationException("Cannot step backward: already at the start of the trace");
        }
        currentPosition--;
        TraceStep step = steps.get(currentPosition);
        replayBackward(step);
        highlighter.update(step, TraceDirection.BACKWARDS);
        notifyStep(step, TraceDirection.BACKWARDS);
        return step;
    }

    /**
     * Steps forward until the end of the trace. A failing step stops the walk
     * and propagates; the steps replayed before it are kept.
     */
    public void goToEnd() {
        while (isForwardAvailable()) {
            stepForward();
        }
    }

    /**
     * Steps backward until the start of the trace.
     */
    public void goToStart() {
        while (isBackwardAvailable()) {
            stepBackward();
        }
    }

    /**
     * Steps over the match at the cursor.
     *
     * @return the matched node and edge ids, empty for a failed match
     * @throws NavigationException if the step at the cursor is not a match
     */
    public Morphism findMatch() {
        if (!isFindMatchAvailable()) {
            throw new NavigationException("No rule match at position " + currentPosition);
        }
        return stepForward().getMorphism();
    }

    /**
     * Steps over the rule application at the cursor.
     *
     * @throws NavigationException if the step at the cursor is not a rule application
     */
    public TraceStep applyMatch() {
        if (!isMatchApplicationAvailable()) {
            throw new NavigationException("No rule application at position " + currentPosition);
        }
        return stepForward();
    }

    public int getCurrentPosition() {
        return currentPosition;
    }

    /**
     * @return the number of steps decoded so far
     */
    public int getStepCount() {
        return steps.size();
    }

    public List<TraceStep> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    /**
     * @return the next step to replay, or {@code null} at the end of the decoded steps
     */
    public TraceStep getCurrentStep() {
        return currentPosition < steps.size() ? steps.get(currentPosition) : null;
    }

    public boolean isParseComplete() {
        return parseComplete;
    }

    /**
     * @return true if decoding stopped because the tracefile is malformed
     */
    public boolean isParseFailed() {
        return parseFailed;
    }

    public Graph getGraph() {
        return graph;
    }

    public ContextManager getContextManager() {
        return contextManager;
    }

    public TraceHighlighter getHighlighter() {
        return highlighter;
    }

    @Override
    public void close() {
        parser.close();
        LOG.info("Trace session closed at position {} of {}", currentPosition, steps.size());
    }

    private void replayForward(TraceStep step, int index) {
        LOG.debug("Forward {}", step);
        if (step.getType() == TraceStepType.RULE_APPLICATION) {
            changeApplier.apply(step.getGraphChanges());
        } else if (step.getType() == TraceStepType.RULE_MATCH_FAILED) {
            TraceStep rule = TraceSteps.findOpeningStep(steps, index, TraceStepType.RULE);
            String ruleName = rule != null ? stripPrefix(rule.getContextName()) : "?";
            notifyMessage("No match found for rule " + ruleName);
        } else if (step.isContextEntry()) {
            contextManager.enterContext(step, TraceDirection.FORWARDS);
        } else if (step.isContextExit()) {
            contextManager.exitContext(step, TraceDirection.FORWARDS);
        }

        if (isFailure(index) && contextManager.rollBackIteration(step)) {
            notifyMessage("Graph reverted to a previous snapshot");
        }
    }

    private void replayBackward(TraceStep step) {
        LOG.debug("Backward {}", step);
        contextManager.undoRollback(step);
        if (step.getType() == TraceStepType.RULE_APPLICATION) {
            changeApplier.revert(step.getGraphChanges());
        } else if (step.isContextExit()) {
            contextManager.enterContext(step, TraceDirection.BACKWARDS);
        } else if (step.isContextEntry()) {
            contextManager.exitContext(step, TraceDirection.BACKWARDS);
        }
    }

    /**
     * A step fails the enclosing speculative context if it is a fail statement,
     * the end of a rule whose match failed, or the end of a rule set whose last
     * rule failed.
     */
    private boolean isFailure(int index) {
        if (index < 0) {
            return false;
        }
        TraceStep step = steps.get(index);
        switch (step.getType()) {
            case FAIL:
                return true;
            case RULE:
                return step.isEndOfContext() && index > 0
                        && steps.get(index - 1).getType() == TraceStepType.RULE_MATCH_FAILED;
            case RULE_SET:
                return step.isEndOfContext() && index > 0
                        && steps.get(index - 1).getType() == TraceStepType.RULE
                        && isFailure(index - 1);
            default:
                return false;
        }
    }

    /**
     * An else-branch with no source text is only recognised once it is
     * highlighted, so the steps that belong to it inherit the flag as the
     * cursor reaches them.
     */
    private void propagateVirtualFlag() {
        TraceStep current = getCurrentStep();
        if (current == null || current.isVirtualStep()) {
            return;
        }
        TraceStepType type = current.getType();
        if (type == TraceStepType.SKIP && currentPosition > 0) {
            TraceStep previous = steps.get(currentPosition - 1);
            if (previous.getType() == TraceStepType.ELSE_BRANCH && previous.isContextEntry()
                    && previous.isVirtualStep()) {
                current.markVirtual();
            }
        } else if ((type == TraceStepType.ELSE_BRANCH || type == TraceStepType.THEN_BRANCH)
                && current.isEndOfContext()) {
            TraceStep opener = TraceSteps.findOpeningStep(steps, currentPosition, type);
            if (opener != null && opener.isVirtualStep()) {
                current.markVirtual();
            }
        }
    }

    /**
     * @return false if the decoder reached the end of the trace
     */
    private boolean decodeNextStep() {
        TraceStep step = parser.parseNextStep();
        if (step == null) {
            parseComplete = true;
            LOG.debug("Trace fully decoded: {} step(s)", steps.size());
            return false;
        }
        appendStep(step);
        return true;
    }

    private void appendStep(TraceStep step) {
        int index = steps.size();
        if (step.getType() == TraceStepType.LOOP_ITERATION && step.isContextEntry() && index > 0) {
            TraceStep previous = steps.get(index - 1);
            if (previous.getType() == TraceStepType.LOOP && previous.isContextEntry()) {
                step.markLoopBoundary();
            }
        } else if (step.getType() == TraceStepType.LOOP && step.isContextExit()) {
            int lastIteration = TraceSteps.findLastIterationEnd(steps, index);
            if (lastIteration >= 0) {
                steps.get(lastIteration).markLoopBoundary();
            }
        }
        steps.add(step);
    }

    private String stripPrefix(String name) {
        if (name != null && !compilerPrefix.isEmpty() && name.startsWith(compilerPrefix)) {
            return name.substring(compilerPrefix.length());
        }
        return name;
    }

    private void notifyStep(TraceStep step, TraceDirection direction) {
        for (ReplayListener listener : listeners) {
            listener.onStep(step, direction, currentPosition);
        }
    }

    private void notifyMessage(String message) {
        LOG.debug(message);
        for (ReplayListener listener : listeners) {
            listener.onMessage(message);
        }
    }
}
