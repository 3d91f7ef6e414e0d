package com.netflix.nodeorder;

import org.junit.Assert;
import org.junit.Test;

public class ResourceVectorTest {

    @Test
    public void testNonZeroDefaults() throws Exception {
        Assert.assertEquals(ResourceVector.of(ResourceVector.DEFAULT_MILLI_CPU_REQUEST, ResourceVector.DEFAULT_MEMORY_REQUEST),
                ResourceVector.EMPTY.nonZero());
        Assert.assertEquals(ResourceVector.of(500, ResourceVector.DEFAULT_MEMORY_REQUEST),
                ResourceVector.of(500, 0).nonZero());
        Assert.assertEquals(ResourceVector.of(ResourceVector.DEFAULT_MILLI_CPU_REQUEST, 1024),
                ResourceVector.of(0, 1024).nonZero());
        ResourceVector full = ResourceVector.of(250, 2048);
        Assert.assertSame(full, full.nonZero());
    }

    @Test
    public void testAddThenSubtractIsExact() throws Exception {
        ResourceVector base = ResourceVector.of(1300, 3 * 1024 * 1024);
        ResourceVector request = ResourceVector.of(333, 123457);
        ResourceVector value = base;
        for (int i = 0; i < 1000; i++)
            value = value.add(request);
        for (int i = 0; i < 1000; i++)
            value = value.subtract(request);
        Assert.assertEquals(base, value);
    }
}
