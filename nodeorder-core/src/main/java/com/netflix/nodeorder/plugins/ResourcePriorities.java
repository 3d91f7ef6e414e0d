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
import com.netflix.nodeorder.ResourceVector;
import com.netflix.nodeorder.SchedulableTask;
import com.netflix.nodeorder.ScoringException;
import com.netflix.nodeorder.state.ClusterSnapshot;
import com.netflix.nodeorder.state.NodeState;

import java.util.function.ToLongFunction;

/**
 * A collection of node priorities based on the resources requested on a node. Both look at the resources the node
 * would have requested if the task were placed on it, counting CPU and memory.
 */
public class ResourcePriorities {

    /**
     * The highest priority a resource based priority function yields.
     */
    public static final int MAX_PRIORITY = 10;

    /**
     * A least requested priority. This priority has the effect of placing a task on the node with the largest
     * fraction of its allocatable CPU and memory still unrequested, spreading tasks across nodes.
     */
    public final static NodePriority leastRequested = new NodePriority() {
        @Override
        public String getName() {
            return "LeastRequestedPriority";
        }
        @Override
        public int calculatePriority(SchedulableTask task, NodeState targetNode, ClusterSnapshot cluster) throws ScoringException {
            ResourceVector allocatable = getAllocatable(targetNode);
            ResourceVector requested = getRequestedWith(task, targetNode);
            long cpuScore = leastRequestedScore(requested, allocatable, ResourceVector::getMilliCpu);
            long memoryScore = leastRequestedScore(requested, allocatable, ResourceVector::getMemoryBytes);
            return (int) ((cpuScore + memoryScore) / 2);
        }
    };

    /**
     * A balanced resource priority. This priority has the effect of placing a task on the node whose CPU and memory
     * would be requested to a similar fraction of their capacity, avoiding nodes that run out of one resource while
     * the other is left unused.
     */
    public final static NodePriority balancedResource = new NodePriority() {
        @Override
        public String getName() {
            return "BalancedResourceAllocation";
        }
        @Override
        public int calculatePriority(SchedulableTask task, NodeState targetNode, ClusterSnapshot cluster) throws ScoringException {
            ResourceVector allocatable = getAllocatable(targetNode);
            ResourceVector requested = getRequestedWith(task, targetNode);
            double cpuFraction = fractionOfCapacity(requested, allocatable, ResourceVector::getMilliCpu);
            double memoryFraction = fractionOfCapacity(requested, allocatable, ResourceVector::getMemoryBytes);
            if (cpuFraction >= 1.0 || memoryFraction >= 1.0)
                return 0;
            double diff = Math.abs(cpuFraction - memoryFraction);
            return (int) ((1.0 - diff) * MAX_PRIORITY);
        }
    };

    private static ResourceVector getAllocatable(NodeState targetNode) throws ScoringException {
        if (targetNode == null || targetNode.getNode() == null)
            throw new ScoringException("node not found");
        ResourceVector allocatable = targetNode.getNode().getAllocatable();
        if (allocatable == null)
            throw new ScoringException("allocatable resources of node " + targetNode.getName() + " are unknown");
        return allocatable;
    }

    private static ResourceVector getRequestedWith(SchedulableTask task, NodeState targetNode) {
        return targetNode.getNonZeroRequested().add(task.getResourceRequest().nonZero());
    }

    private static long leastRequestedScore(ResourceVector requested, ResourceVector allocatable,
                                            ToLongFunction<ResourceVector> resourceGetter) {
        long capacity = resourceGetter.applyAsLong(allocatable);
        long used = resourceGetter.applyAsLong(requested);
        if (capacity == 0L || used > capacity)
            return 0L;
        return ((capacity - used) * MAX_PRIORITY) / capacity;
    }

    private static double fractionOfCapacity(ResourceVector requested, ResourceVector allocatable,
                                             ToLongFunction<ResourceVector> resourceGetter) {
        long capacity = resourceGetter.applyAsLong(allocatable);
        if (capacity == 0L)
            return 1.0;
        return (double) resourceGetter.applyAsLong(requested) / (double) capacity;
    }
}
