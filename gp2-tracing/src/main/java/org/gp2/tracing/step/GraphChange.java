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

import java.util.Objects;

import org.gp2.tracing.graph.EdgeItem;
import org.gp2.tracing.graph.GraphItem;
import org.gp2.tracing.graph.Label;
import org.gp2.tracing.graph.NodeItem;
import org.gp2.tracing.graph.Position;

/**
 * A single node or edge mutation recorded in a rule application, or one entry
 * of a rule match morphism.
 *
 * <p>The existing item is the pre-state needed to undo the change and the new
 * item is the post-state needed to redo it. Creations only carry the new item,
 * deletions and morphism entries only the existing one, and relabel, remark and
 * root changes carry both with the same id.</p>
 */
public class GraphChange {

    private final GraphChangeType type;
    private final GraphItem existingItem;
    private final GraphItem newItem;
    private Position deletedPosition;

    public GraphChange(GraphChangeType type, GraphItem existingItem, GraphItem newItem) {
        this.type = Objects.requireNonNull(type, "type");
        this.existingItem = existingItem;
        this.newItem = newItem;
        validate();
    }

    public static GraphChange morphismEntry(GraphItem matched) {
        return new GraphChange(GraphChangeType.MORPHISM_ENTRY, matched, null);
    }

    public static GraphChange addNode(NodeItem node) {
        return new GraphChange(GraphChangeType.ADD_NODE, null, node);
    }

    public static GraphChange addEdge(EdgeItem edge) {
        return new GraphChange(GraphChangeType.ADD_EDGE, null, edge);
    }

    public static GraphChange deleteNode(NodeItem node) {
        return new GraphChange(GraphChangeType.DELETE_NODE, node, null);
    }

    public static GraphChange deleteEdge(EdgeItem edge) {
        return new GraphChange(GraphChangeType.DELETE_EDGE, edge, null);
    }

    public static GraphChange relabelNode(String id, Label oldLabel, Label newLabel) {
        return new GraphChange(GraphChangeType.RELABEL_NODE,
                new NodeItem(id, oldLabel, false, null), new NodeItem(id, newLabel, false, null));
    }

    public static GraphChange relabelEdge(String id, Label oldLabel, Label newLabel) {
        return new GraphChange(GraphChangeType.RELABEL_EDGE,
                new EdgeItem(id, null, null, oldLabel), new EdgeItem(id, null, null, newLabel));
    }

    public static GraphChange remarkNode(String id, Label oldLabel, Label newLabel) {
        return new GraphChange(GraphChangeType.REMARK_NODE,
                new NodeItem(id, oldLabel, false, null), new NodeItem(id, newLabel, false, null));
    }

    public static GraphChange remarkEdge(String id, Label oldLabel, Label newLabel) {
        return new GraphChange(GraphChangeType.REMARK_EDGE,
                new EdgeItem(id, null, null, oldLabel), new EdgeItem(id, null, null, newLabel));
    }

    public static GraphChange setRoot(String id) {
        NodeItem node = NodeItem.ofId(id);
        return new GraphChange(GraphChangeType.SET_ROOT, node.withRoot(false), node.withRoot(true));
    }

    public static GraphChange removeRoot(String id) {
        NodeItem node = NodeItem.ofId(id);
        return new GraphChange(GraphChangeType.REMOVE_ROOT, node.withRoot(true), node.withRoot(false));
    }

    public GraphChangeType getType() {
        return type;
    }

    public GraphItem getExistingItem() {
        return existingItem;
    }

    public GraphItem getNewItem() {
        return newItem;
    }

    /**
     * @return the id of the node or edge this change touches
     */
    public String getItemId() {
        return existingItem != null ? existingItem.id() : newItem.id();
    }

    public NodeItem getExistingNode() {
        return asNode(existingItem);
    }

    public NodeItem getNewNode() {
        return asNode(newItem);
    }

    public EdgeItem getExistingEdge() {
        return asEdge(existingItem);
    }

    public EdgeItem getNewEdge() {
        return asEdge(newItem);
    }

    /**
     * Position of the deleted node as it was displayed when the deletion was
     * replayed, or {@code null} if the deletion has not been replayed yet.
     */
    public Position getDeletedPosition() {
        return deletedPosition;
    }

    public void recordDeletedPosition(Position position) {
        this.deletedPosition = position;
    }

    @Override
    public String toString() {
        return String.format("%s(%s)", type, getItemId());
    }

    private void validate() {
        if (type == GraphChangeType.INVALID) {
            throw new IllegalArgumentException("Cannot build an INVALID graph change");
        }
        boolean needsExisting = !type.isCreation();
        boolean needsNew = !type.isDeletion() && type != GraphChangeType.MORPHISM_ENTRY;
        if (needsExisting != (existingItem != null) || needsNew != (newItem != null)) {
            throw new IllegalArgumentException("Graph change " + type + " has the wrong items: existing="
                    + existingItem + ", new=" + newItem);
        }
        if (existingItem != null && newItem != null && !existingItem.id().equals(newItem.id())) {
            throw new IllegalArgumentException("Graph change " + type + " cannot change id "
                    + existingItem.id() + " to " + newItem.id());
        }
    }

    private NodeItem asNode(GraphItem item) {
        if (item instanceof NodeItem node) {
            return node;
        }
        throw new IllegalStateException(type + " change does not carry a node: " + item);
    }

    private EdgeItem asEdge(GraphItem item) {
        if (item instanceof EdgeItem edge) {
            return edge;
        }
        throw new IllegalStateException(type + " change does not carry an edge: " + item);
    }
}
