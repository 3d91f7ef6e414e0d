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

package com.netflix.nodeorder.plugins;

import com.netflix.nodeorder.NodePriority;
import com.netflix.nodeorder.SchedulableTask;
import com.netflix.nodeorder.ScoringException;
import com.netflix.nodeorder.affinity.Affinity;
import com.netflix.nodeorder.affinity.PreferredSchedulingTerm;
import com.netflix.nodeorder.affinity.Selectors;
import com.netflix.nodeorder.state.ClusterSnapshot;
import com.netflix.nodeorder.state.NodeState;

import java.util.Map;

/**
 * A priority that prefers nodes matching the task's preferred node affinity terms. The priority of a node is the
 * sum of the weights of the preferred terms whose requirements the node's labels all satisfy.
 */
public class NodeAffinityPriority implements NodePriority {

    public static final NodePriority INSTANCE = new NodeAffinityPriority();

    @Override
    public String getName() {
        return "NodeAffinityPriority";
    }

    /**
     * Tests the node labels against each preferred node affinity term of the task.
     *
     * @param task       the task to place
     * @param targetNode the state of the candidate node
     * @param cluster    not used
     * @return the total weight of the matching preferred terms
     * @throws ScoringException if the node is missing or a term has a malformed requirement
     */
    @Override
    public int calculatePriority(SchedulableTask task, NodeState targetNode, ClusterSnapshot cluster) throws ScoringException {
        if (targetNode == null || targetNode.getNode() == null)
            throw new ScoringException("node not found");
        Affinity affinity = task.getAffinity();
        if (affinity == null || affinity.getNodeAffinity() == null)
            return 0;
        Map<String, String> labels = targetNode.getLabels();
        int count = 0;
        for (PreferredSchedulingTerm term : affinity.getNodeAffinity().getPreferred()) {
            if (term.getWeight() == 0)
                continue;
            Selectors.LabelMatcher matcher =
                    Selectors.forNodeSelectorRequirements(term.getPreference().getMatchExpressions());
            if (matcher.matches(labels))
                count += term.getWeight();
        }
        return count;
    }
}
