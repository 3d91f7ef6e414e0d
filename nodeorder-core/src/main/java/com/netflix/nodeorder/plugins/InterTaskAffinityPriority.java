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

import com.netflix.nodeorder.ClusterNode;
import com.netflix.nodeorder.NodePriority;
import com.netflix.nodeorder.SchedulableTask;
import com.netflix.nodeorder.ScoringException;
import com.netflix.nodeorder.affinity.Affinity;
import com.netflix.nodeorder.affinity.Selectors;
import com.netflix.nodeorder.affinity.TaskAffinityTerm;
import com.netflix.nodeorder.affinity.WeightedTaskAffinityTerm;
import com.netflix.nodeorder.listers.NodeInfoLookup;
import com.netflix.nodeorder.listers.TaskLister;
import com.netflix.nodeorder.state.ClusterSnapshot;
import com.netflix.nodeorder.state.NodeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A priority that places a task near the tasks it has affinity to, and away from those it has anti-affinity to,
 * considering the tasks placed on all nodes of the cluster. Rules of the already placed tasks count as well: a node
 * is preferred when placed tasks there want the incoming task nearby.
 * <p>
 * For every placed task matched by a preferred term, the term's weight is added to (affinity) or subtracted from
 * (anti-affinity) the count of every node in the same topology domain as the placed task's node. Counts are then
 * normalized to the range [0, {@value ResourcePriorities#MAX_PRIORITY}] across all nodes.
 * <p>
 * Counts for all nodes are computed in one pass and kept for the last task and cluster snapshot seen, so scoring a
 * task against every candidate node walks the cluster once.
 */
public class InterTaskAffinityPriority implements NodePriority {

    /**
     * Weight given to a required affinity term of a placed task that matches the incoming task.
     */
    public static final int DEFAULT_HARD_AFFINITY_SYMMETRIC_WEIGHT = 1;

    private static final Logger logger = LoggerFactory.getLogger(InterTaskAffinityPriority.class);

    private static class CachedPriorities {
        private final String taskId;
        private final ClusterSnapshot snapshot;
        private final Map<String, Integer> priorities;

        private CachedPriorities(String taskId, ClusterSnapshot snapshot, Map<String, Integer> priorities) {
            this.taskId = taskId;
            this.snapshot = snapshot;
            this.priorities = priorities;
        }
    }

    private final TaskLister taskLister;
    private final NodeInfoLookup nodeInfoLookup;
    private final int hardAffinitySymmetricWeight;
    private final AtomicReference<CachedPriorities> lastComputed = new AtomicReference<>();

    public InterTaskAffinityPriority(TaskLister taskLister, NodeInfoLookup nodeInfoLookup) {
        this(taskLister, nodeInfoLookup, DEFAULT_HARD_AFFINITY_SYMMETRIC_WEIGHT);
    }

    /**
     * @param taskLister                  tracks the node each placed task is on
     * @param nodeInfoLookup              resolves the node of a placed task
     * @param hardAffinitySymmetricWeight weight of required affinity terms of placed tasks, disabled if not positive
     */
    public InterTaskAffinityPriority(TaskLister taskLister, NodeInfoLookup nodeInfoLookup, int hardAffinitySymmetricWeight) {
        if (taskLister == null || nodeInfoLookup == null) {
            throw new IllegalArgumentException("Task lister and node info lookup cannot be null");
        }
        this.taskLister = taskLister;
        this.nodeInfoLookup = nodeInfoLookup;
        this.hardAffinitySymmetricWeight = hardAffinitySymmetricWeight;
    }

    @Override
    public String getName() {
        return "InterTaskAffinityPriority";
    }

    /**
     * Get the priority of the target node from the priorities of all nodes. A target node unknown to the cluster
     * snapshot has priority 0.
     */
    @Override
    public int calculatePriority(SchedulableTask task, NodeState targetNode, ClusterSnapshot cluster) throws ScoringException {
        Integer priority = calculatePriorities(task, cluster).get(targetNode.getName());
        return priority == null ? 0 : priority;
    }

    /**
     * Calculate the priorities of all nodes of the cluster for the task.
     *
     * @param task    the task to place
     * @param cluster the state of all nodes
     * @return priorities by node name, in cluster order
     * @throws ScoringException if the node of a placed task can't be found, or a term has a malformed label selector
     */
    public Map<String, Integer> calculatePriorities(SchedulableTask task, ClusterSnapshot cluster) throws ScoringException {
        CachedPriorities cached = lastComputed.get();
        if (cached != null && cached.snapshot == cluster && cached.taskId.equals(task.getId()))
            return cached.priorities;
        Map<String, Integer> priorities = computePriorities(task, cluster);
        lastComputed.set(new CachedPriorities(task.getId(), cluster, priorities));
        return priorities;
    }

    private Map<String, Integer> computePriorities(SchedulableTask task, ClusterSnapshot cluster) throws ScoringException {
        final Affinity affinity = task.getAffinity();
        final boolean hasAffinity = affinity != null && affinity.hasTaskAffinity();
        final boolean hasAntiAffinity = affinity != null && affinity.hasTaskAntiAffinity();
        final Map<String, Long> counts = new HashMap<>();
        for (NodeState state : cluster.getNodes()) {
            // without rules of its own, the task is only affected by placed tasks that have rules
            Collection<SchedulableTask> placed = hasAffinity || hasAntiAffinity ?
                    state.getBoundTasks() : state.getBoundTasksWithAffinity();
            for (SchedulableTask existing : placed) {
                ClusterNode existingNode = nodeInfoLookup.getNodeInfo(getPlacement(existing, state));
                if (hasAffinity)
                    processTerms(affinity.getTaskAffinity().getPreferred(), task, existing, existingNode, cluster, counts, 1);
                if (hasAntiAffinity)
                    processTerms(affinity.getTaskAntiAffinity().getPreferred(), task, existing, existingNode, cluster, counts, -1);
                final Affinity existingAffinity = existing.getAffinity();
                if (existingAffinity != null && existingAffinity.hasTaskAffinity()) {
                    if (hardAffinitySymmetricWeight > 0) {
                        for (TaskAffinityTerm term : existingAffinity.getTaskAffinity().getRequired())
                            processTerm(term, existing, task, existingNode, cluster, counts, hardAffinitySymmetricWeight);
                    }
                    processTerms(existingAffinity.getTaskAffinity().getPreferred(), existing, task, existingNode, cluster, counts, 1);
                }
                if (existingAffinity != null && existingAffinity.hasTaskAntiAffinity())
                    processTerms(existingAffinity.getTaskAntiAffinity().getPreferred(), existing, task, existingNode, cluster, counts, -1);
            }
        }
        long maxCount = 0L;
        long minCount = 0L;
        for (NodeState state : cluster.getNodes()) {
            long count = getCount(counts, state.getName());
            maxCount = Math.max(maxCount, count);
            minCount = Math.min(minCount, count);
        }
        final long maxMinDiff = maxCount - minCount;
        Map<String, Integer> result = new LinkedHashMap<>();
        for (NodeState state : cluster.getNodes()) {
            double score = 0.0;
            if (maxMinDiff > 0L)
                score = ResourcePriorities.MAX_PRIORITY * ((double) (getCount(counts, state.getName()) - minCount) / (double) maxMinDiff);
            result.put(state.getName(), (int) score);
        }
        if (logger.isDebugEnabled())
            logger.debug("Inter-task affinity priorities for task " + task.getId() + ": " + result);
        return Collections.unmodifiableMap(result);
    }

    private String getPlacement(SchedulableTask existing, NodeState boundOn) {
        SchedulableTask tracked = taskLister.getTask(existing.getId());
        String placement = tracked == null ? existing.getAssignedNode() : tracked.getAssignedNode();
        return placement == null || placement.isEmpty() ? boundOn.getName() : placement;
    }

    private void processTerms(List<WeightedTaskAffinityTerm> terms, SchedulableTask definingTask, SchedulableTask taskToCheck,
                              ClusterNode fixedNode, ClusterSnapshot cluster, Map<String, Long> counts, int multiplier)
            throws ScoringException {
        for (WeightedTaskAffinityTerm term : terms)
            processTerm(term.getTerm(), definingTask, taskToCheck, fixedNode, cluster, counts, term.getWeight() * multiplier);
    }

    private void processTerm(TaskAffinityTerm term, SchedulableTask definingTask, SchedulableTask taskToCheck,
                             ClusterNode fixedNode, ClusterSnapshot cluster, Map<String, Long> counts, long weight)
            throws ScoringException {
        Selectors.LabelMatcher selector = Selectors.forLabelSelector(term.getLabelSelector());
        if (!getNamespaces(term, definingTask).contains(taskToCheck.getNamespace()) ||
                !selector.matches(taskToCheck.getLabels()))
            return;
        for (NodeState state : cluster.getNodes()) {
            if (haveSameTopology(state.getLabels(), fixedNode.getLabels(), term.getTopologyKey()))
                counts.merge(state.getName(), weight, Long::sum);
        }
    }

    private static Set<String> getNamespaces(TaskAffinityTerm term, SchedulableTask definingTask) {
        if (term.getNamespaces().isEmpty())
            return Collections.singleton(definingTask.getNamespace());
        return new HashSet<>(term.getNamespaces());
    }

    private static boolean haveSameTopology(Map<String, String> labels, Map<String, String> otherLabels, String topologyKey) {
        if (topologyKey == null || topologyKey.isEmpty())
            return false;
        String value = labels.get(topologyKey);
        return value != null && value.equals(otherLabels.get(topologyKey));
    }

    private static long getCount(Map<String, Long> counts, String nodeName) {
        Long count = counts.get(nodeName);
        return count == null ? 0L : count;
    }
}
