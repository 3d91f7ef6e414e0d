package com.netflix.nodeorder.plugins;

import com.netflix.nodeorder.PluginArguments;
import org.junit.Assert;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

public class PriorityWeightsTest {

    @Test
    public void testDefaultsToOne() throws Exception {
        PriorityWeights weights = PriorityWeights.fromArguments(PluginArguments.EMPTY);
        Assert.assertEquals(1, weights.getLeastRequested());
        Assert.assertEquals(1, weights.getBalancedResource());
        Assert.assertEquals(1, weights.getNodeAffinity());
        Assert.assertEquals(1, weights.getTaskAffinity());
        Assert.assertSame(PriorityWeights.DEFAULT, PriorityWeights.fromArguments(null));
    }

    @Test
    public void testRecognizedKeys() throws Exception {
        Map<String, Object> args = new HashMap<>();
        args.put("nodeaffinity.weight", 2);
        args.put("podaffinity.weight", 3);
        args.put("leastrequested.weight", 4);
        args.put("balancedresource.weight", 5);
        args.put("imagelocality.weight", 9);
        PriorityWeights weights = PriorityWeights.fromArguments(PluginArguments.fromMap(args));
        Assert.assertEquals(2, weights.getNodeAffinity());
        Assert.assertEquals(3, weights.getTaskAffinity());
        Assert.assertEquals(4, weights.getLeastRequested());
        Assert.assertEquals(5, weights.getBalancedResource());
    }

    @Test
    public void testUnparseableValueKeepsDefault() throws Exception {
        Map<String, Object> args = new HashMap<>();
        args.put("nodeaffinity.weight", "heavy");
        args.put("leastrequested.weight", 0);
        PriorityWeights weights = PriorityWeights.fromArguments(PluginArguments.fromMap(args));
        Assert.assertEquals(1, weights.getNodeAffinity());
        Assert.assertEquals(0, weights.getLeastRequested());
    }

    @Test
    public void testFromJsonConfiguration() throws Exception {
        PriorityWeights weights = PriorityWeights.fromArguments(PluginArguments.fromJson(
                "{\"nodeaffinity.weight\": 2, \"podaffinity.weight\": 2, \"leastrequested.weight\": 2, \"balancedresource.weight\": 2}"));
        Assert.assertEquals(2, weights.getNodeAffinity());
        Assert.assertEquals(2, weights.getTaskAffinity());
        Assert.assertEquals(2, weights.getLeastRequested());
        Assert.assertEquals(2, weights.getBalancedResource());
    }

    @Test
    public void testBuilder() throws Exception {
        PriorityWeights weights = PriorityWeights.newBuilder()
                .withLeastRequested(7)
                .withTaskAffinity(0)
                .build();
        Assert.assertEquals(7, weights.getLeastRequested());
        Assert.assertEquals(1, weights.getBalancedResource());
        Assert.assertEquals(1, weights.getNodeAffinity());
        Assert.assertEquals(0, weights.getTaskAffinity());
    }
}
