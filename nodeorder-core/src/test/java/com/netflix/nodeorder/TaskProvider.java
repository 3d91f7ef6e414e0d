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

import com.netflix.nodeorder.affinity.Affinity;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

public class TaskProvider {

    public static final String DEFAULT_NAMESPACE = "default";

    private static final AtomicInteger id = new AtomicInteger();

    public static long mb(long megabytes) {
        return megabytes * 1024L * 1024L;
    }

    public static SchedulableTask getTask(final long milliCpu, final long memoryMB) {
        return getTask(DEFAULT_NAMESPACE, null, milliCpu, memoryMB, null);
    }

    public static SchedulableTask getTask(final Map<String, String> labels, final long milliCpu, final long memoryMB) {
        return getTask(DEFAULT_NAMESPACE, labels, milliCpu, memoryMB, null);
    }

    public static SchedulableTask getTask(final long milliCpu, final long memoryMB, final Affinity affinity) {
        return getTask(DEFAULT_NAMESPACE, null, milliCpu, memoryMB, affinity);
    }

    public static SchedulableTask getTask(final Map<String, String> labels, final long milliCpu, final long memoryMB,
                                          final Affinity affinity) {
        return getTask(DEFAULT_NAMESPACE, labels, milliCpu, memoryMB, affinity);
    }

    public static SchedulableTask getTask(final String namespace, final Map<String, String> labels,
                                          final long milliCpu, final long memoryMB, final Affinity affinity) {
        final String taskId = "task-" + id.incrementAndGet();
        final Map<String, String> taskLabels = labels == null ? Collections.<String, String>emptyMap() : labels;
        final ResourceVector request = ResourceVector.of(milliCpu, mb(memoryMB));
        final AtomicReference<String> assignedNode = new AtomicReference<>();
        return new SchedulableTask() {
            @Override
            public String getId() {
                return taskId;
            }
            @Override
            public String getNamespace() {
                return namespace;
            }
            @Override
            public Map<String, String> getLabels() {
                return taskLabels;
            }
            @Override
            public ResourceVector getResourceRequest() {
                return request;
            }
            @Override
            public Affinity getAffinity() {
                return affinity;
            }
            @Override
            public String getAssignedNode() {
                return assignedNode.get();
            }
            @Override
            public void setAssignedNode(String nodeName) {
                assignedNode.set(nodeName);
            }
            @Override
            public String toString() {
                return taskId;
            }
        };
    }
}
