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

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GraphSnapshotTest {

    @Test
    void shouldRestoreCapturedGraph() {
        InMemoryGraph graph = new InMemoryGraph();
        graph.addNode(new NodeItem("n1", Label.parse("1", "2"), true, new Position(1, 2)));
        graph.addNode(NodeItem.ofId("n2"));
        graph.addEdge(new EdgeItem("e1", "n1", "n2", Label.EMPTY));
        GraphSnapshot snapshot = GraphSnapshot.capture(graph);

        graph.removeEdge("e1");
        graph.setNodeRoot("n1", false);
        graph.addNode(NodeItem.ofId("n3"));
        snapshot.restoreInto(graph);

        assertThat(GraphSnapshot.capture(graph)).isEqualTo(snapshot);
        assertThat(graph.findNode("n3")).isEmpty();
        assertThat(graph.findNode("n1").orElseThrow().root()).isTrue();
        assertThat(snapshot.getNodeCount()).isEqualTo(2);
        assertThat(snapshot.getEdgeCount()).isEqualTo(1);
    }

    @Test
    void shouldNotFollowLaterChangesToGraph() {
        InMemoryGraph graph = new InMemoryGraph();
        graph.addNode(NodeItem.ofId("n1"));
        GraphSnapshot snapshot = GraphSnapshot.capture(graph);

        graph.setNodeLabel("n1", List.of("changed"));

        assertThat(snapshot.getNodes()).extracting(node -> node.label().atoms()).containsExactly(List.of());
    }

    @Test
    void shouldCompareByContentRegardlessOfOrder() {
        InMemoryGraph first = new InMemoryGraph();
        first.addNode(NodeItem.ofId("a"));
        first.addNode(NodeItem.ofId("b"));
        InMemoryGraph second = new InMemoryGraph();
        second.addNode(NodeItem.ofId("b"));
        second.addNode(NodeItem.ofId("a"));

        assertThat(GraphSnapshot.capture(first)).isEqualTo(GraphSnapshot.capture(second));
        assertThat(GraphSnapshot.capture(first).hashCode()).isEqualTo(GraphSnapshot.capture(second).hashCode());
    }
}
