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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Map-backed {@link Graph}. Keeps insertion order, so snapshots and dumps list
 * items in the order they were created. Not thread-safe; trace replay is
 * single-threaded.
 */
public class InMemoryGraph implements Graph {

    private final Map<String, NodeItem> nodes = new LinkedHashMap<>();
    private final Map<String, EdgeItem> edges = new LinkedHashMap<>();

    @Override
    public void addNode(NodeItem node) {
        if (nodes.putIfAbsent(node.id(), node) != null) {
            throw new IllegalArgumentException("Node already exists: " + node.id());
        }
    }

    @Override
    public void removeNode(String id) {
        requireNode(id);
        boolean incident = edges.values().stream()
                .anyMatch(e -> id.equals(e.source()) || id.equals(e.target()));
        if (incident) {
            throw new IllegalStateException("Node " + id + " still has incident edges");
        }
        nodes.remove(id);
    }

    @Override
    public void addEdge(EdgeItem edge) {
        if (!nodes.containsKey(edge.source()) || !nodes.containsKey(edge.target())) {
            throw new IllegalStateException("Edge " + edge.id() + " refers to a missing node ("
                    + edge.source() + " -> " + edge.target() + ")");
        }
        if (edges.putIfAbsent(edge.id(), edge) != null) {
            throw new IllegalArgumentException("Edge already exists: " + edge.id());
        }
    }

    @Override
    public void removeEdge(String id) {
        requireEdge(id);
        edges.remove(id);
    }

    @Override
    public Optional<NodeItem> findNode(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    @Override
    public Optional<EdgeItem> findEdge(String id) {
        return Optional.ofNullable(edges.get(id));
    }

    @Override
    public void setNodeLabel(String id, List<String> atoms) {
        NodeItem node = requireNode(id);
        nodes.put(id, node.withLabel(node.label().withAtoms(atoms)));
    }

    @Override
    public void setNodeMark(String id, Mark mark) {
        NodeItem node = requireNode(id);
        nodes.put(id, node.withLabel(node.label().withMark(mark)));
    }

    @Override
    public void setNodeRoot(String id, boolean root) {
        nodes.put(id, requireNode(id).withRoot(root));
    }

    @Override
    public void setEdgeLabel(String id, List<String> atoms) {
        EdgeItem edge = requireEdge(id);
        edges.put(id, edge.withLabel(edge.label().withAtoms(atoms)));
    }

    @Override
    public void setEdgeMark(String id, Mark mark) {
        EdgeItem edge = requireEdge(id);
        edges.put(id, edge.withLabel(edge.label().withMark(mark)));
    }

    @Override
    public Collection<NodeItem> getNodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    @Override
    public Collection<EdgeItem> getEdges() {
        return Collections.unmodifiableCollection(edges.values());
    }

    @Override
    public void clear() {
        edges.clear();
        nodes.clear();
    }

    @Override
    public String toString() {
        return String.format("InMemoryGraph{nodes=%d, edges=%d}", nodes.size(), edges.size());
    }

    private NodeItem requireNode(String id) {
        NodeItem node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Node not found: " + id);
        }
        return node;
    }

    private EdgeItem requireEdge(String id) {
        EdgeItem edge = edges.get(id);
        if (edge == null) {
            throw new IllegalArgumentException("Edge not found: " + id);
        }
        return edge;
    }
}
