package com.netflix.nodeorder.listers;

import com.netflix.nodeorder.ClusterNode;
import com.netflix.nodeorder.NodeNotFoundException;
import com.netflix.nodeorder.NodeProvider;
import com.netflix.nodeorder.SchedulableTask;
import com.netflix.nodeorder.TaskProvider;
import com.netflix.nodeorder.TestSchedulingSession;
import com.netflix.nodeorder.affinity.InvalidSelectorException;
import com.netflix.nodeorder.affinity.LabelSelector;
import com.netflix.nodeorder.affinity.SelectorRequirement;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;

public class SessionListersTest {

    private SchedulableTask running;
    private SchedulableTask pending;
    private TestSchedulingSession session;

    @Before
    public void setUp() throws Exception {
        running = TaskProvider.getTask(500, 512);
        pending = TaskProvider.getTask(500, 512);
        List<ClusterNode> nodes = Arrays.asList(
                NodeProvider.getNode("hostA", 1000, 1024, running),
                NodeProvider.getNode("hostB", 1000, 1024),
                NodeProvider.getNode("hostA", 4000, 4096)
        );
        session = new TestSchedulingSession(nodes, Collections.singletonList(pending));
    }

    @Test
    public void testListsNodesOnceInSessionOrder() throws Exception {
        List<ClusterNode> nodes = new SessionNodeLister(session).list();
        Assert.assertEquals(2, nodes.size());
        Assert.assertEquals("hostA", nodes.get(0).getName());
        Assert.assertEquals("hostB", nodes.get(1).getName());
        Assert.assertEquals(1000L, nodes.get(0).getAllocatable().getMilliCpu());
    }

    @Test
    public void testNodeInfoLookup() throws Exception {
        SessionNodeLister lister = new SessionNodeLister(session);
        Assert.assertSame(session.getNode("hostB"), lister.getNodeInfo("hostB"));
        try {
            lister.getNodeInfo("hostZ");
            Assert.fail("unknown node should not be found");
        } catch (NodeNotFoundException e) {
            Assert.assertEquals("hostZ", e.getNodeName());
            Assert.assertEquals("failed to find node <hostZ>", e.getMessage());
        }
    }

    @Test
    public void testTaskListerTracksPlacement() throws Exception {
        SessionTaskLister lister = new SessionTaskLister(session);
        Assert.assertEquals("hostA", lister.getTask(running.getId()).getAssignedNode());
        Assert.assertNull(lister.getTask(pending.getId()).getAssignedNode());

        Assert.assertSame(pending, lister.updateTask(pending, "hostB"));
        Assert.assertEquals("hostB", lister.getTask(pending.getId()).getAssignedNode());
        lister.updateTask(pending, null);
        Assert.assertNull(pending.getAssignedNode());

        SchedulableTask unknown = TaskProvider.getTask(100, 100);
        Assert.assertNull(lister.getTask(unknown.getId()));
        lister.updateTask(unknown, "hostB");
        Assert.assertSame(unknown, lister.getTask(unknown.getId()));
    }

    @Test
    public void testListTasksBySelector() throws Exception {
        SchedulableTask web = TaskProvider.getTask(Collections.singletonMap("app", "web"), 100, 100);
        SchedulableTask batch = TaskProvider.getTask(Collections.singletonMap("app", "batch"), 100, 100);
        SessionTaskLister lister = new SessionTaskLister(new TestSchedulingSession(
                Collections.singletonList(NodeProvider.getNode("hostA", 1000, 1024, web)),
                Arrays.asList(batch, pending)));

        Assert.assertEquals(Collections.singletonList(web), lister.list(LabelSelector.matchingLabel("app", "web")));
        Assert.assertEquals(new HashSet<>(Arrays.asList(web, batch)), new HashSet<>(lister.list(new LabelSelector(null,
                Collections.singletonList(SelectorRequirement.exists("app"))))));
        Assert.assertEquals(3, lister.list(new LabelSelector(null, null)).size());
        Assert.assertTrue(lister.list(null).isEmpty());

        SchedulableTask added = TaskProvider.getTask(Collections.singletonMap("app", "web"), 100, 100);
        lister.updateTask(added, "hostA");
        Assert.assertEquals(new HashSet<>(Arrays.asList(web, added)),
                new HashSet<>(lister.list(LabelSelector.matchingLabel("app", "web"))));
    }

    @Test(expected = InvalidSelectorException.class)
    public void testListRejectsMalformedSelector() throws Exception {
        new SessionTaskLister(session).list(LabelSelector.matchingLabel("bad key!", "web"));
    }
}
