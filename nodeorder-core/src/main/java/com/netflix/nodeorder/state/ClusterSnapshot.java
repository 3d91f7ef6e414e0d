/*
 * Copyright 2015 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.nodeorder.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A consistent view of the state of all nodes of a scheduling session. Priority functions that need a bird's-eye
 * view of task placement throughout the cluster, such as inter-task affinity, read it instead of the live index.
 * Snapshots are immutable; the index publishes a new one after every change.
 */
public final class ClusterSnapshot {

    private final List<NodeState> nodes;
    private final Map<String, Integer> positions;
    private final long generation;

    ClusterSnapshot(List<NodeState> nodes, Map<String, Integer> positions, long generation) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.positions = positions;
        this.generation = generation;
    }

    /**
     * Get the states of all nodes, in the order the session listed the nodes when it opened.
     *
     * @return an unmodifiable list of node states
     */
    public List<NodeState> getNodes() {
        return nodes;
    }

    public Optional<NodeState> getNode(String nodeName) {
        Integer position = nodeName == null ? null : positions.get(nodeName);
        return position == null ? Optional.<NodeState>empty() : Optional.of(nodes.get(position));
    }

    public boolean contains(String nodeName) {
        return nodeName != null && positions.containsKey(nodeName);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Get the generation of the index this snapshot was taken at. Two snapshots of the same index with the same
     * generation hold the same state.
     *
     * @return the generation
     */
    public long getGeneration() {
        return generation;
    }

    ClusterSnapshot with(NodeState replacement, long newGeneration) {
        List<NodeState> copy = new ArrayList<>(nodes);
        copy.set(positions.get(replacement.getName()), replacement);
        return new ClusterSnapshot(copy, positions, newGeneration);
    }
}
