package com.netflix.nodeorder;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.Assert;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

public class PluginArgumentsTest {

    @Test
    public void testFromMapKeepsValuesAsText() throws Exception {
        Map<String, Object> values = new HashMap<>();
        values.put("a", 3);
        values.put("b", "text");
        values.put("c", null);
        PluginArguments arguments = PluginArguments.fromMap(values);
        Assert.assertEquals("3", arguments.get("a"));
        Assert.assertEquals("text", arguments.get("b"));
        Assert.assertFalse(arguments.contains("c"));
        Assert.assertNull(arguments.get("missing"));
    }

    @Test
    public void testGetInt() throws Exception {
        Map<String, Object> values = new HashMap<>();
        values.put("number", "42");
        values.put("padded", " 7 ");
        values.put("negative", -3);
        values.put("decimal", "2.5");
        values.put("word", "two");
        PluginArguments arguments = PluginArguments.fromMap(values);
        Assert.assertEquals(42, arguments.getInt("number", 1));
        Assert.assertEquals(7, arguments.getInt("padded", 1));
        Assert.assertEquals(-3, arguments.getInt("negative", 1));
        Assert.assertEquals(1, arguments.getInt("decimal", 1));
        Assert.assertEquals(1, arguments.getInt("word", 1));
        Assert.assertEquals(5, arguments.getInt("missing", 5));
    }

    @Test
    public void testFromJson() throws Exception {
        PluginArguments arguments = PluginArguments.fromJson(
                "{\"nodeaffinity.weight\": 2, \"podaffinity.weight\": \"3\", \"enabled\": true}");
        Assert.assertEquals(2, arguments.getInt("nodeaffinity.weight", 1));
        Assert.assertEquals(3, arguments.getInt("podaffinity.weight", 1));
        Assert.assertEquals("true", arguments.get("enabled"));
        Assert.assertEquals(3, arguments.asMap().size());
    }

    @Test
    public void testFromJsonNull() throws Exception {
        Assert.assertSame(PluginArguments.EMPTY, PluginArguments.fromJson("null"));
        Assert.assertSame(PluginArguments.EMPTY, PluginArguments.fromJson("{}"));
    }

    @Test(expected = JsonProcessingException.class)
    public void testFromJsonRejectsArray() throws Exception {
        PluginArguments.fromJson("[1, 2]");
    }
}
