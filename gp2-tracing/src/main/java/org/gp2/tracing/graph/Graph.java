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
import java.util.List;
import java.util.Optional;

/**
 * The host graph mutated by trace replay. The editor owns the graph and renders
 * it; implementations may be backed by the editor's own model or held in memory.
 */
public interface Graph {

    void addNode(NodeItem node);

    void removeNode(String id);

    void addEdge(EdgeItem edge);

    void removeEdge(String id);

    Optional<NodeItem> findNode(String id);

    Optional<EdgeItem> findEdge(String id);

    void setNodeLabel(String id, List<String> atoms);

    void setNodeMark(String id, Mark mark);

    void setNodeRoot(String id, boolean root);

    void setEdgeLabel(String id, List<String> atoms);

    void setEdgeMark(String id, Mark mark);

    Collection<NodeItem> getNodes();

    Collection<EdgeItem> getEdges();

    /**
     * Removes every node and edge.
     */
    void clear();
}
