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

package com.netflix.nodeorder;

import com.netflix.nodeorder.state.ClusterSnapshot;
import com.netflix.nodeorder.state.NodeState;

/**
 * Interface representing a node priority function, one of the heuristics combined into the score of a node. A task
 * may fit on many nodes; a priority function says how desirable a particular node is for the task given the current
 * state of task placement throughout the cluster.
 * <p>
 * Implementations must not modify shared state, as they are called concurrently for different nodes.
 */
public interface NodePriority {

    /**
     * Get the name of this priority function.
     *
     * @return the name
     */
    String getName();

    /**
     * Calculates the priority of the node for the task. This method does not have to check that the node has
     * sufficient resources for the task, or that it satisfies the task's required affinity. It can assume that
     * this has already been done.
     *
     * @param task       the task to place
     * @param targetNode the state of the candidate node
     * @param cluster    the state of all nodes of the session
     * @return the priority, higher values representing a more desirable node
     * @throws ScoringException if the priority cannot be calculated
     */
    int calculatePriority(SchedulableTask task, NodeState targetNode, ClusterSnapshot cluster) throws ScoringException;
}
