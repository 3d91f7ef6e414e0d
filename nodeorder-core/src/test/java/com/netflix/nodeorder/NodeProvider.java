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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class NodeProvider {

    public static final String HOSTNAME = "hostname";

    public static ClusterNode getNode(final String name, final long milliCpu, final long memoryMB,
                                      final SchedulableTask... boundTasks) {
        return getNode(name, milliCpu, memoryMB, Collections.<String, String>emptyMap(), boundTasks);
    }

    /**
     * Creates a node labeled with its own name under {@value #HOSTNAME} in addition to the given labels. The bound
     * tasks are marked as assigned to the node.
     */
    public static ClusterNode getNode(final String name, final long milliCpu, final long memoryMB,
                                      final Map<String, String> labels, final SchedulableTask... boundTasks) {
        final Map<String, String> nodeLabels = new HashMap<>();
        if (labels != null)
            nodeLabels.putAll(labels);
        nodeLabels.put(HOSTNAME, name);
        final ResourceVector allocatable = ResourceVector.of(milliCpu, TaskProvider.mb(memoryMB));
        final List<SchedulableTask> tasks = new ArrayList<>(Arrays.asList(boundTasks));
        for (SchedulableTask t : tasks)
            t.setAssignedNode(name);
        return getNode(name, allocatable, nodeLabels, tasks);
    }

    public static ClusterNode getNode(final String name, final ResourceVector allocatable,
                                      final Map<String, String> labels, final Collection<SchedulableTask> boundTasks) {
        final Map<String, String> nodeLabels = Collections.unmodifiableMap(labels);
        final Collection<SchedulableTask> tasks = Collections.unmodifiableCollection(boundTasks);
        return new ClusterNode() {
            @Override
            public String getName() {
                return name;
            }
            @Override
            public Map<String, String> getLabels() {
                return nodeLabels;
            }
            @Override
            public ResourceVector getAllocatable() {
                return allocatable;
            }
            @Override
            public Collection<SchedulableTask> getBoundTasks() {
                return tasks;
            }
            @Override
            public String toString() {
                return name;
            }
        };
    }

    public static List<ClusterNode> getNodes(int numNodes, long milliCpu, long memoryMB) {
        List<ClusterNode> nodes = new ArrayList<>(numNodes);
        for (int i = 0; i < numNodes; i++)
            nodes.add(getNode("host" + i, milliCpu, memoryMB));
        return nodes;
    }
}
