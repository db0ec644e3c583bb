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
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * An immutable value copy of every node and edge in a graph at one point of the
 * replay. Snapshots are rollback targets: they are restored wholesale and never
 * diffed. Two snapshots are equal when they hold the same items by id,
 * regardless of insertion order.
 */
public final class GraphSnapshot {

    private final Map<String, NodeItem> nodes;
    private final Map<String, EdgeItem> edges;

    private GraphSnapshot(Map<String, NodeItem> nodes, Map<String, EdgeItem> edges) {
        this.nodes = nodes;
        this.edges = edges;
    }

    public static GraphSnapshot capture(Graph graph) {
        return new GraphSnapshot(index(graph.getNodes(), NodeItem::id), index(graph.getEdges(), EdgeItem::id));
    }

    /**
     * Replaces the whole content of {@code graph} with this snapshot.
     */
    public void restoreInto(Graph graph) {
        graph.clear();
        nodes.values().forEach(graph::addNode);
        edges.values().forEach(graph::addEdge);
    }

    public Collection<NodeItem> getNodes() {
        return nodes.values();
    }

    public Collection<EdgeItem> getEdges() {
        return edges.values();
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public int getEdgeCount() {
        return edges.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GraphSnapshot)) return false;
        GraphSnapshot that = (GraphSnapshot) o;
        return nodes.equals(that.nodes) && edges.equals(that.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, edges);
    }

    @Override
    public String toString() {
        return String.format("GraphSnapshot{nodes=%d, edges=%d}", nodes.size(), edges.size());
    }

    private static <T> Map<String, T> index(Collection<T> items, Function<T, String> id) {
        Map<String, T> indexed = new LinkedHashMap<>();
        for (T item : items) {
            indexed.put(id.apply(item), item);
        }
        return Collections.unmodifiableMap(indexed);
    }
}
