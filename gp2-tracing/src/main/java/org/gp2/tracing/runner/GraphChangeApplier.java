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
package org.gp2.tracing.runner;

import java.util.List;
import java.util.ListIterator;

import org.gp2.tracing.graph.Graph;
import org.gp2.tracing.graph.NodeItem;
import org.gp2.tracing.step.GraphChange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the changes of a rule application to the live graph and reverts them.
 * Reverting walks the changes in reverse order and writes back the pre-state
 * each change carries, so an apply followed by a revert leaves the graph
 * value-equal to what it was.
 */
public class GraphChangeApplier {

    private static final Logger LOG = LoggerFactory.getLogger(GraphChangeApplier.class);

    private final Graph graph;

    public GraphChangeApplier(Graph graph) {
        this.graph = graph;
    }

    public void apply(List<GraphChange> changes) {
        for (GraphChange change : changes) {
            LOG.trace("Applying {}", change);
            applyChange(change);
        }
    }

    public void revert(List<GraphChange> changes) {
        for (ListIterator<GraphChange> it = changes.listIterator(changes.size()); it.hasPrevious(); ) {
            GraphChange change = it.previous();
            LOG.trace("Reverting {}", change);
            revertChange(change);
        }
    }

    private void applyChange(GraphChange change) {
        switch (change.getType()) {
            case ADD_NODE:
                graph.addNode(change.getNewNode());
                break;
            case ADD_EDGE:
                graph.addEdge(change.getNewEdge());
                break;
            case DELETE_NODE: {
                String id = change.getItemId();
                // The editor may have moved the node since it was created.
                graph.findNode(id).ifPresent(live -> change.recordDeletedPosition(live.position()));
                graph.removeNode(id);
                break;
            }
            case DELETE_EDGE:
                graph.removeEdge(change.getItemId());
                break;
            case RELABEL_NODE:
                graph.setNodeLabel(change.getItemId(), change.getNewNode().label().atoms());
                break;
            case RELABEL_EDGE:
                graph.setEdgeLabel(change.getItemId(), change.getNewEdge().label().atoms());
                break;
            case REMARK_NODE:
                graph.setNodeMark(change.getItemId(), change.getNewNode().label().mark());
                break;
            case REMARK_EDGE:
                graph.setEdgeMark(change.getItemId(), change.getNewEdge().label().mark());
                break;
            case SET_ROOT:
            case REMOVE_ROOT:
                graph.setNodeRoot(change.getItemId(), change.getNewNode().root());
                break;
            default:
                LOG.debug("Ignoring {} in a rule application", change);
                break;
        }
    }

    private void revertChange(GraphChange change) {
        switch (change.getType()) {
            case ADD_NODE:
                graph.removeNode(change.getItemId());
                break;
            case ADD_EDGE:
                graph.removeEdge(change.getItemId());
                break;
            case DELETE_NODE: {
                NodeItem deleted = change.getExistingNode();
                if (change.getDeletedPosition() != null) {
                    deleted = deleted.withPosition(change.getDeletedPosition());
                }
                graph.addNode(deleted);
                break;
            }
            case DELETE_EDGE:
                graph.addEdge(change.getExistingEdge());
                break;
            case RELABEL_NODE:
                graph.setNodeLabel(change.getItemId(), change.getExistingNode().label().atoms());
                break;
            case RELABEL_EDGE:
                graph.setEdgeLabel(change.getItemId(), change.getExistingEdge().label().atoms());
                break;
            case REMARK_NODE:
                graph.setNodeMark(change.getItemId(), change.getExistingNode().label().mark());
                break;
            case REMARK_EDGE:
                graph.setEdgeMark(change.getItemId(), change.getExistingEdge().label().mark());
                break;
            case SET_ROOT:
            case REMOVE_ROOT:
                graph.setNodeRoot(change.getItemId(), change.getExistingNode().root());
                break;
            default:
                break;
        }
    }
}
