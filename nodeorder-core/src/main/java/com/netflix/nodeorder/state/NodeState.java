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
import com.netflix.nodeorder.ResourceVector;
import com.netflix.nodeorder.SchedulableTask;
import com.netflix.nodeorder.affinity.Affinity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The state of a node during a scheduling session: the tasks bound to it and the resources they request. A
 * priority function uses this state to judge how well a task fits on the node.
 * <p>
 * Instances are immutable. Binding or unbinding a task yields a new instance, so a state obtained for scoring never
 * changes underneath the caller. The requested totals always equal the sum of the requests of the bound tasks, each
 * taken as it was when the task was bound.
 */
public final class NodeState {

    private final ClusterNode node;
    private final Map<String, SchedulableTask> boundTasks;
    // requests as they were when each task was bound
    private final Map<String, ResourceVector> boundRequests;
    private final ResourceVector requested;
    private final ResourceVector nonZeroRequested;

    private NodeState(ClusterNode node, Map<String, SchedulableTask> boundTasks, Map<String, ResourceVector> boundRequests,
                      ResourceVector requested, ResourceVector nonZeroRequested) {
        this.node = node;
        this.boundTasks = Collections.unmodifiableMap(boundTasks);
        this.boundRequests = boundRequests;
        this.requested = requested;
        this.nonZeroRequested = nonZeroRequested;
    }

    /**
     * Creates the state of a node from the tasks bound to it when the session opened.
     *
     * @param node the node
     * @return the state of the node
     */
    public static NodeState of(ClusterNode node) {
        if (node == null)
            throw new IllegalArgumentException("Node cannot be null");
        Map<String, SchedulableTask> tasks = new LinkedHashMap<>();
        Map<String, ResourceVector> requests = new HashMap<>();
        ResourceVector requested = ResourceVector.EMPTY;
        ResourceVector nonZero = ResourceVector.EMPTY;
        for (SchedulableTask t : node.getBoundTasks()) {
            if (tasks.put(t.getId(), t) == null) {
                ResourceVector request = t.getResourceRequest();
                requests.put(t.getId(), request);
                requested = requested.add(request);
                nonZero = nonZero.add(request.nonZero());
            }
        }
        return new NodeState(node, tasks, requests, requested, nonZero);
    }

    public ClusterNode getNode() {
        return node;
    }

    public String getName() {
        return node.getName();
    }

    public Map<String, String> getLabels() {
        return node.getLabels();
    }

    /**
     * Get the tasks currently bound to the node, including those tentatively allocated in this session.
     *
     * @return an unmodifiable collection of tasks
     */
    public Collection<SchedulableTask> getBoundTasks() {
        return boundTasks.values();
    }

    /**
     * Get the bound tasks that carry task affinity or anti-affinity rules.
     *
     * @return a list of tasks with affinity rules
     */
    public List<SchedulableTask> getBoundTasksWithAffinity() {
        List<SchedulableTask> result = new ArrayList<>();
        for (SchedulableTask t : boundTasks.values()) {
            Affinity affinity = t.getAffinity();
            if (affinity != null && (affinity.hasTaskAffinity() || affinity.hasTaskAntiAffinity()))
                result.add(t);
        }
        return result;
    }

    public boolean isBound(String taskId) {
        return boundTasks.containsKey(taskId);
    }

    /**
     * Get the sum of the resource requests of the bound tasks.
     *
     * @return the requested resources
     */
    public ResourceVector getRequested() {
        return requested;
    }

    /**
     * Get the sum of the non-zero resource requests of the bound tasks.
     *
     * @return the requested resources, with defaults standing in for absent requests
     * @see ResourceVector#nonZero()
     */
    public ResourceVector getNonZeroRequested() {
        return nonZeroRequested;
    }

    NodeState withTask(SchedulableTask task) {
        Map<String, SchedulableTask> tasks = new LinkedHashMap<>(boundTasks);
        tasks.put(task.getId(), task);
        Map<String, ResourceVector> requests = new HashMap<>(boundRequests);
        ResourceVector request = task.getResourceRequest();
        requests.put(task.getId(), request);
        return new NodeState(node, tasks, requests,
                requested.add(request),
                nonZeroRequested.add(request.nonZero()));
    }

    NodeState withoutTask(String taskId) {
        Map<String, SchedulableTask> tasks = new LinkedHashMap<>(boundTasks);
        tasks.remove(taskId);
        Map<String, ResourceVector> requests = new HashMap<>(boundRequests);
        ResourceVector removed = requests.remove(taskId);
        return new NodeState(node, tasks, requests,
                requested.subtract(removed),
                nonZeroRequested.subtract(removed.nonZero()));
    }

    @Override
    public String toString() {
        return "NodeState{" +
                "node=" + node.getName() +
                ", boundTasks=" + boundTasks.keySet() +
                ", requested=" + requested +
                '}';
    }
}
