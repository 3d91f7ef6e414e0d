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

import com.netflix.nodeorder.PluginArguments;
import com.netflix.nodeorder.SchedulingSession;
import com.netflix.nodeorder.SessionPlugin;
import com.netflix.nodeorder.listers.SessionNodeLister;
import com.netflix.nodeorder.listers.SessionTaskLister;
import com.netflix.nodeorder.listers.TaskLister;
import com.netflix.nodeorder.plugins.WeightedSumNodeScorer.WeightedPriority;
import com.netflix.nodeorder.state.NodeStateIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * The node order plugin. When a session opens, the plugin indexes the nodes of the session, subscribes to its
 * allocation events, and registers a node order function scoring each node as the weighted sum of the least
 * requested, balanced resource, node affinity and inter-task affinity priorities.
 * <p>
 * The weights come from the plugin arguments, see {@link PriorityWeights#fromArguments(PluginArguments)}. For example:
 * <pre>
 * nodeaffinity.weight: 2
 * podaffinity.weight: 2
 * leastrequested.weight: 2
 * balancedresource.weight: 2
 * </pre>
 */
public class NodeOrderPlugin implements SessionPlugin {

    public static final String NAME = "nodeorder";

    private static final Logger logger = LoggerFactory.getLogger(NodeOrderPlugin.class);

    private final PluginArguments arguments;
    private volatile NodeStateIndex index;

    public NodeOrderPlugin(PluginArguments arguments) {
        this.arguments = arguments == null ? PluginArguments.EMPTY : arguments;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void onSessionOpen(SchedulingSession session) {
        final PriorityWeights weights = PriorityWeights.fromArguments(arguments);
        final SessionNodeLister nodeLister = new SessionNodeLister(session);
        final TaskLister taskLister = new SessionTaskLister(session);
        final NodeStateIndex nodeStateIndex = new NodeStateIndex(nodeLister.list());

        session.addEventHandler(new NodeStateEventHandler(nodeStateIndex, taskLister));
        session.addNodeOrderFunction(getName(), new WeightedSumNodeScorer(nodeStateIndex, Arrays.asList(
                new WeightedPriority(ResourcePriorities.leastRequested, weights.getLeastRequested()),
                new WeightedPriority(ResourcePriorities.balancedResource, weights.getBalancedResource()),
                new WeightedPriority(NodeAffinityPriority.INSTANCE, weights.getNodeAffinity()),
                new WeightedPriority(new InterTaskAffinityPriority(taskLister, nodeLister), weights.getTaskAffinity())
        )));
        index = nodeStateIndex;
        logger.debug("node order plugin opened session with " + nodeStateIndex.snapshot().size() + " nodes, " + weights);
    }

    @Override
    public void onSessionClose(SchedulingSession session) {
        index = null;
    }

    /**
     * Get the node state index of the open session.
     *
     * @return the index, or null if no session is open
     */
    NodeStateIndex getNodeStateIndex() {
        return index;
    }
}
