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
package org.gp2.tracing.graph;

/**
 * Visual mark of a node or edge label.
 */
public enum Mark {

    NONE("none"),
    RED("red"),
    GREEN("green"),
    BLUE("blue"),
    GREY("grey"),
    DASHED("dashed");

    private final String displayName;

    Mark(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Converts the numeric mark written by the GP2 tracer. Only 1 to 4 carry a
     * mark; anything else, including a missing attribute, is {@link #NONE}.
     */
    public static Mark fromTraceValue(String value) {
        if (value == null) {
            return NONE;
        }
        return switch (value.trim()) {
            case "1" -> RED;
            case "2" -> GREEN;
            case "3" -> BLUE;
            case "4" -> DASHED;
            default -> NONE;
        };
    }
}
