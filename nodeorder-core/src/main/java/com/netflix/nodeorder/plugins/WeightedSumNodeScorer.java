/*
 * Copyright 2017 Netflix, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.netflix.nodeorder.plugins;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.netflix.nodeorder.ClusterNode;
import com.netflix.nodeorder.NodeOrderFunction;
import com.netflix.nodeorder.NodePriority;
import com.netflix.nodeorder.SchedulableTask;
import com.netflix.nodeorder.ScoringException;
import com.netflix.nodeorder.state.ClusterSnapshot;
import com.netflix.nodeorder.state.NodeState;
import com.netflix.nodeorder.state.NodeStateIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A node order function that scores a node by the weighted sum of multiple node priorities. All priorities see
 * the same snapshot of the node state index. If any priority fails, the score of the node fails as a whole.
 */
public class WeightedSumNodeScorer implements NodeOrderFunction {

    private static final Logger logger = LoggerFactory.getLogger(WeightedSumNodeScorer.class);

    private final NodeStateIndex index;
    private final List<WeightedPriority> priorities;

    public WeightedSumNodeScorer(NodeStateIndex index, List<WeightedPriority> priorities) {
        if (index == null) {
            throw new IllegalArgumentException("Node state index cannot be null");
        }
        if (priorities == null || priorities.isEmpty()) {
            throw new IllegalArgumentException("There must be at least 1 priority");
        }
        this.index = index;
        this.priorities = Collections.unmodifiableList(new ArrayList<>(priorities));
    }

    public List<WeightedPriority> getPriorities() {
        return priorities;
    }

    /**
     * Score the node for the task. A node the index does not know is scored against a transient state built from
     * the tasks the node itself reports as bound.
     *
     * @param task the task awaiting placement
     * @param node the candidate node
     * @return the sum of each priority multiplied by its weight
     * @throws ScoringException from the first priority that fails; no partial score is returned
     */
    @Override
    public double score(SchedulableTask task, ClusterNode node) throws ScoringException {
        final ClusterSnapshot cluster = index.snapshot();
        NodeState state = cluster.getNode(node.getName()).orElse(null);
        if (state == null) {
            logger.warn("Generating transient node state for " + node.getName() + " while scoring task " +
                    task.getId() + " is unexpected");
            state = NodeState.of(node);
        }
        double score = 0.0;
        for (WeightedPriority priority : priorities) {
            final int value;
            try {
                value = priority.getPriority().calculatePriority(task, state, cluster);
            } catch (ScoringException e) {
                logger.warn(priority.getPriority().getName() + " failed for task " + task.getId() + " on node " +
                        node.getName() + ": " + e.getMessage());
                throw e;
            }
            score += (double) value * priority.getWeight();
        }
        if (logger.isDebugEnabled())
            logger.debug("Total score of node " + node.getName() + " for task " + task.getId() + " is " + score);
        return score;
    }

    @Override
    public String toString() {
        return "Weighted Sum Node Scorer: " + priorities;
    }

    public static class WeightedPriority {
        private final NodePriority priority;
        private final int weight;

        public WeightedPriority(NodePriority priority, int weight) {
            if (priority == null) {
                throw new IllegalArgumentException("Priority cannot be null");
            }
            this.priority = priority;
            this.weight = weight;
        }

        public NodePriority getPriority() {
            return priority;
        }

        public int getWeight() {
            return weight;
        }

        @Override
        public String toString() {
            return "{ priority: " + priority.getName() + ", weight: " + weight + " }";
        }
    }
}
