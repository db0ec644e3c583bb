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

import java.util.List;

/**
 * Backward scans over a decoded step sequence. Every scan walks the list once
 * with a nesting counter instead of recursing.
 */
public final class TraceSteps {

    private TraceSteps() {
    }

    /**
     * Finds the still-open step of {@code type} that encloses position
     * {@code fromIndex}. Called with the index of an end-of-context step, this
     * is the step that opened it.
     *
     * @return the index of the opening step, or -1 if there is none
     */
    public static int findOpeningIndex(List<TraceStep> steps, int fromIndex, TraceStepType type) {
        int depth = 0;
        for (int i = fromIndex - 1; i >= 0; i--) {
            TraceStep step = steps.get(i);
            if (step.getType() != type) {
                continue;
            }
            if (step.isEndOfContext()) {
                depth++;
            } else if (depth == 0) {
                return i;
            } else {
                depth--;
            }
        }
        return -1;
    }

    public static TraceStep findOpeningStep(List<TraceStep> steps, int fromIndex, TraceStepType type) {
        int index = findOpeningIndex(steps, fromIndex, type);
        return index < 0 ? null : steps.get(index);
    }

    /**
     * Finds the last end-of-iteration step belonging to the loop closed at
     * {@code loopEndIndex}, skipping iterations of nested loops.
     *
     * @return the index of that step, or -1 if the loop ran no complete iteration
     */
    public static int findLastIterationEnd(List<TraceStep> steps, int loopEndIndex) {
        int depth = 0;
        for (int i = loopEndIndex - 1; i >= 0; i--) {
            TraceStep step = steps.get(i);
            if (step.getType() == TraceStepType.LOOP) {
                if (step.isEndOfContext()) {
                    depth++;
                } else if (depth == 0) {
                    return -1;
                } else {
                    depth--;
                }
            } else if (depth == 0 && step.getType() == TraceStepType.LOOP_ITERATION && step.isEndOfContext()) {
                return i;
            }
        }
        return -1;
    }
}
