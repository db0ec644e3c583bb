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

import java.util.Objects;

/**
 * Value of a node: identity, label, root flag and display position. The
 * position is {@code null} for nodes that have not been laid out yet.
 */
public record NodeItem(String id, Label label, boolean root, Position position) implements GraphItem {

    public NodeItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(label, "label");
    }

    public static NodeItem ofId(String id) {
        return new NodeItem(id, Label.EMPTY, false, null);
    }

    public NodeItem withLabel(Label newLabel) {
        return new NodeItem(id, newLabel, root, position);
    }

    public NodeItem withRoot(boolean newRoot) {
        return new NodeItem(id, label, newRoot, position);
    }

    public NodeItem withPosition(Position newPosition) {
        return new NodeItem(id, label, root, newPosition);
    }
}
