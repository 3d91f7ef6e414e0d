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

import com.netflix.nodeorder.ClusterNode;
import com.netflix.nodeorder.SchedulableTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps track of the tasks bound to each node during a scheduling session. The index is created when the session
 * opens, from the nodes and tasks the session knows about, and is kept up to date as the session tentatively
 * allocates and deallocates tasks.
 * <p>
 * Changes are serialized by a lock and published as a new {@link ClusterSnapshot}. Readers never take the lock and
 * never see a half applied change. The set of nodes is fixed at construction.
 */
public class NodeStateIndex {

    private static final Logger logger = LoggerFactory.getLogger(NodeStateIndex.class);

    private final ReentrantLock updateLock = new ReentrantLock();
    private volatile ClusterSnapshot current;

    public NodeStateIndex(Collection<? extends ClusterNode> nodes) {
        List<NodeState> states = new ArrayList<>(nodes.size());
        Map<String, Integer> positions = new HashMap<>();
        for (ClusterNode node : nodes) {
            if (positions.containsKey(node.getName())) {
                logger.warn("Ignoring duplicate node " + node.getName() + " while building node state index");
                continue;
            }
            positions.put(node.getName(), states.size());
            states.add(NodeState.of(node));
        }
        current = new ClusterSnapshot(states, Collections.unmodifiableMap(positions), 0L);
    }

    /**
     * Get the state of the named node.
     *
     * @param nodeName name of the node
     * @return the state of the node, or empty if the index does not know the node
     */
    public Optional<NodeState> lookup(String nodeName) {
        return current.getNode(nodeName);
    }

    public boolean contains(String nodeName) {
        return current.contains(nodeName);
    }

    /**
     * Get a consistent view of all nodes as of now.
     *
     * @return the current snapshot
     */
    public ClusterSnapshot snapshot() {
        return current;
    }

    /**
     * Get the number of changes applied to the index since it was created.
     *
     * @return the generation
     */
    public long getGeneration() {
        return current.getGeneration();
    }

    /**
     * Bind the task to the node, adding its request to the node's usage.
     *
     * @param task     the task
     * @param nodeName name of the node
     * @return {@code true} if the task was bound, {@code false} if the node is unknown or the task was already
     *         bound to it
     */
    public boolean bind(SchedulableTask task, String nodeName) {
        updateLock.lock();
        try {
            final ClusterSnapshot snapshot = current;
            final Optional<NodeState> state = snapshot.getNode(nodeName);
            if (!state.isPresent()) {
                logger.warn("Can't bind task " + task.getId() + " to unknown node " + nodeName);
                return false;
            }
            if (state.get().isBound(task.getId())) {
                logger.warn("Task " + task.getId() + " is already bound to node " + nodeName);
                return false;
            }
            current = snapshot.with(state.get().withTask(task), snapshot.getGeneration() + 1);
            return true;
        } finally {
            updateLock.unlock();
        }
    }

    /**
     * Unbind the task from the node, subtracting its request from the node's usage.
     *
     * @param task     the task
     * @param nodeName name of the node the task is being removed from
     * @return {@code true} if the task was unbound, {@code false} if the node is unknown or the task was not bound
     *         to it
     */
    public boolean unbind(SchedulableTask task, String nodeName) {
        updateLock.lock();
        try {
            final ClusterSnapshot snapshot = current;
            final Optional<NodeState> state = snapshot.getNode(nodeName);
            if (!state.isPresent()) {
                logger.warn("Can't unbind task " + task.getId() + " from unknown node " + nodeName);
                return false;
            }
            if (!state.get().isBound(task.getId())) {
                logger.warn("Unexpected to not find task " + task.getId() + " bound to node " + nodeName);
                return false;
            }
            current = snapshot.with(state.get().withoutTask(task.getId()), snapshot.getGeneration() + 1);
            return true;
        } finally {
            updateLock.unlock();
        }
    }
}
