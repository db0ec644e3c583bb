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

public enum GraphChangeType {

    ADD_EDGE("createEdge"),
    ADD_NODE("createNode"),
    DELETE_EDGE("deleteEdge"),
    DELETE_NODE("deleteNode"),
    RELABEL_EDGE("relabelEdge"),
    RELABEL_NODE("relabelNode"),
    REMARK_EDGE("remarkEdge"),
    REMARK_NODE("remarkNode"),
    SET_ROOT("setRoot"),
    REMOVE_ROOT("removeRoot"),
    MORPHISM_ENTRY(null),
    INVALID(null);

    private static final Map<String, GraphChangeType> BY_ELEMENT_NAME = new HashMap<>();

    static {
        for (GraphChangeType type : values()) {
            if (type.elementName != null) {
                BY_ELEMENT_NAME.put(type.elementName, type);
            }
        }
    }

    private final String elementName;

    GraphChangeType(String elementName) {
        this.elementName = elementName;
    }

    public String getElementName() {
        return elementName;
    }

    /**
     * Changes that carry only the post-state.
     */
    public boolean isCreation() {
        return this == ADD_EDGE || this == ADD_NODE;
    }

    /**
     * Changes that carry only the pre-state.
     */
    public boolean isDeletion() {
        return this == DELETE_EDGE || this == DELETE_NODE;
    }

    public static GraphChangeType fromElementName(String elementName) {
        return BY_ELEMENT_NAME.getOrDefault(elementName, INVALID);
    }
}
