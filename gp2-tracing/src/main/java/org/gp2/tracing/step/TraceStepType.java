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

import java.util.HashMap;
import java.util.Map;

/**
 * Kinds of trace step, with the tracefile element each one is read from.
 * Context types open a lexical scope that a later end-of-context step closes;
 * the remaining types are leaves.
 */
public enum TraceStepType {

    RULE("rule", Category.CONTEXT),
    RULE_MATCH("match", Category.PAYLOAD),
    RULE_MATCH_FAILED(null, Category.PAYLOAD),
    RULE_APPLICATION("apply", Category.PAYLOAD),
    RULE_SET("ruleset", Category.CONTEXT),
    LOOP("loop", Category.CONTEXT),
    LOOP_ITERATION("iteration", Category.CONTEXT),
    PROCEDURE("procedure", Category.CONTEXT),
    IF_CONTEXT("if", Category.CONTEXT),
    TRY_CONTEXT("try", Category.CONTEXT),
    BRANCH_CONDITION("condition", Category.CONTEXT),
    THEN_BRANCH("then", Category.CONTEXT),
    ELSE_BRANCH("else", Category.CONTEXT),
    OR_CONTEXT("or", Category.CONTEXT),
    OR_LEFT("leftBranch", Category.CONTEXT),
    OR_RIGHT("rightBranch", Category.CONTEXT),
    SKIP("skip", Category.LEAF),
    BREAK("break", Category.LEAF),
    FAIL("fail", Category.LEAF),
    UNKNOWN(null, Category.LEAF);

    private static final Map<String, TraceStepType> BY_ELEMENT_NAME = new HashMap<>();

    static {
        for (TraceStepType type : values()) {
            if (type.elementName != null) {
                BY_ELEMENT_NAME.put(type.elementName, type);
            }
        }
    }

    private final String elementName;
    private final Category category;

    TraceStepType(String elementName, Category category) {
        this.elementName = elementName;
        this.category = category;
    }

    /**
     * @return the tracefile element name, or {@code null} for types that have no element of their own
     */
    public String getElementName() {
        return elementName;
    }

    public boolean isContext() {
        return category == Category.CONTEXT;
    }

    /**
     * Contexts that snapshot the graph on entry because they may have to roll it back.
     */
    public boolean isRollbackEligible() {
        return this == IF_CONTEXT || this == TRY_CONTEXT || this == LOOP_ITERATION;
    }

    /**
     * Contexts that carry the name of a declared rule or procedure.
     */
    public boolean isNamed() {
        return this == RULE || this == PROCEDURE;
    }

    /**
     * Maps a tracefile element name to its step type.
     *
     * @return the matching type, or {@link #UNKNOWN}
     */
    public static TraceStepType fromElementName(String elementName) {
        return BY_ELEMENT_NAME.getOrDefault(elementName, UNKNOWN);
    }

    private enum Category {
        CONTEXT, PAYLOAD, LEAF
    }
}
