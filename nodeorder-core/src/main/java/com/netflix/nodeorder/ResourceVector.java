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

/**
 * An immutable amount of the resources considered by node ordering: CPU in milli-cores and memory in bytes.
 * Amounts are integral so that adding and then subtracting the same request always yields the original value.
 */
public final class ResourceVector {

    /**
     * CPU assumed for a task that does not request any, in milli-cores.
     */
    public static final long DEFAULT_MILLI_CPU_REQUEST = 100L;

    /**
     * Memory assumed for a task that does not request any, in bytes.
     */
    public static final long DEFAULT_MEMORY_REQUEST = 200L * 1024L * 1024L;

    public static final ResourceVector EMPTY = new ResourceVector(0L, 0L);

    private final long milliCpu;
    private final long memoryBytes;

    public ResourceVector(long milliCpu, long memoryBytes) {
        this.milliCpu = milliCpu;
        this.memoryBytes = memoryBytes;
    }

    public static ResourceVector of(long milliCpu, long memoryBytes) {
        return new ResourceVector(milliCpu, memoryBytes);
    }

    /**
     * Get the amount of CPU.
     *
     * @return CPU in milli-cores
     */
    public long getMilliCpu() {
        return milliCpu;
    }

    /**
     * Get the amount of memory.
     *
     * @return memory in bytes
     */
    public long getMemoryBytes() {
        return memoryBytes;
    }

    public ResourceVector add(ResourceVector other) {
        return new ResourceVector(milliCpu + other.milliCpu, memoryBytes + other.memoryBytes);
    }

    public ResourceVector subtract(ResourceVector other) {
        return new ResourceVector(milliCpu - other.milliCpu, memoryBytes - other.memoryBytes);
    }

    /**
     * Returns this request with zero amounts replaced by the defaults, so that tasks without explicit requests
     * still count towards the usage that resource based priorities look at.
     *
     * @return the non-zero form of this request
     */
    public ResourceVector nonZero() {
        if (milliCpu != 0L && memoryBytes != 0L)
            return this;
        return new ResourceVector(
                milliCpu == 0L ? DEFAULT_MILLI_CPU_REQUEST : milliCpu,
                memoryBytes == 0L ? DEFAULT_MEMORY_REQUEST : memoryBytes
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        ResourceVector that = (ResourceVector) o;
        return milliCpu == that.milliCpu && memoryBytes == that.memoryBytes;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(milliCpu) + Long.hashCode(memoryBytes);
    }

    @Override
    public String toString() {
        return "ResourceVector{" +
                "milliCpu=" + milliCpu +
                ", memoryBytes=" + memoryBytes +
                '}';
    }
}
