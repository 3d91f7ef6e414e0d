package com.netflix.nodeorder.plugins;

import com.netflix.nodeorder.ClusterNode;
import com.netflix.nodeorder.NodePriority;
import com.netflix.nodeorder.NodeProvider;
import com.netflix.nodeorder.SchedulableTask;
import com.netflix.nodeorder.ScoringException;
import com.netflix.nodeorder.TaskProvider;
import com.netflix.nodeorder.state.ClusterSnapshot;
import com.netflix.nodeorder.state.NodeState;
import com.netflix.nodeorder.state.NodeStateIndex;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

public class ResourcePrioritiesTest {

    private static int leastRequested(SchedulableTask task, ClusterNode node) throws ScoringException {
        NodeStateIndex index = new NodeStateIndex(Collections.singletonList(node));
        ClusterSnapshot snapshot = index.snapshot();
        return ResourcePriorities.leastRequested.calculatePriority(task, snapshot.getNode(node.getName()).get(), snapshot);
    }

    private static int balancedResource(SchedulableTask task, ClusterNode node) throws ScoringException {
        NodeStateIndex index = new NodeStateIndex(Collections.singletonList(node));
        ClusterSnapshot snapshot = index.snapshot();
        return ResourcePriorities.balancedResource.calculatePriority(task, snapshot.getNode(node.getName()).get(), snapshot);
    }

    @Test
    public void testMoreFreeCpuScoresHigher() throws Exception {
        SchedulableTask task = TaskProvider.getTask(1000, 1024);
        ClusterNode twoCpus = NodeProvider.getNode("hostA", 2000, 4096);
        ClusterNode oneCpu = NodeProvider.getNode("hostB", 1000, 4096);
        // cpu (2000-1000)*10/2000=5, memory (4096-1024)*10/4096=7
        Assert.assertEquals(6, leastRequested(task, twoCpus));
        // cpu 0, memory 7
        Assert.assertEquals(3, leastRequested(task, oneCpu));
        Assert.assertEquals(7, balancedResource(task, twoCpus));
        Assert.assertEquals(0, balancedResource(task, oneCpu));
    }

    @Test
    public void testCountsTasksAlreadyOnNode() throws Exception {
        SchedulableTask task = TaskProvider.getTask(1000, 1024);
        ClusterNode node = NodeProvider.getNode("hostA", 4000, 4096, TaskProvider.getTask(1000, 1024));
        Assert.assertEquals(5, leastRequested(task, node));
        Assert.assertEquals(10, balancedResource(task, node));
        Assert.assertEquals(7, leastRequested(task, NodeProvider.getNode("hostB", 4000, 4096)));
    }

    @Test
    public void testZeroRequestsUseDefaults() throws Exception {
        SchedulableTask task = TaskProvider.getTask(0, 0);
        // cpu (1000-100)*10/1000=9, memory (1000-200)*10/1000=8
        Assert.assertEquals(8, leastRequested(task, NodeProvider.getNode("hostA", 1000, 1000)));
    }

    @Test
    public void testOverCommittedNode() throws Exception {
        SchedulableTask task = TaskProvider.getTask(2000, 1024);
        ClusterNode node = NodeProvider.getNode("hostA", 1000, 4096);
        Assert.assertEquals(3, leastRequested(task, node));
        Assert.assertEquals(0, balancedResource(task, node));
    }

    @Test
    public void testZeroCapacity() throws Exception {
        SchedulableTask task = TaskProvider.getTask(100, 1024);
        ClusterNode node = NodeProvider.getNode("hostA", 0, 4096);
        Assert.assertEquals(3, leastRequested(task, node));
        Assert.assertEquals(0, balancedResource(task, node));
    }

    @Test
    public void testUnknownCapacityFails() throws Exception {
        SchedulableTask task = TaskProvider.getTask(100, 100);
        ClusterNode node = NodeProvider.getNode("hostA", null, Collections.<String, String>emptyMap(),
                Collections.<SchedulableTask>emptyList());
        NodeState state = NodeState.of(node);
        for (NodePriority priority : Arrays.asList(ResourcePriorities.leastRequested,
                ResourcePriorities.balancedResource)) {
            try {
                priority.calculatePriority(task, state, null);
                Assert.fail(priority.getName() + " should fail without node capacity");
            } catch (ScoringException e) {
                Assert.assertTrue(e.getMessage().contains("hostA"));
            }
        }
    }
}
