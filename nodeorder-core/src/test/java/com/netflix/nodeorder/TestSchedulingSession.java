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
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A scheduling session for tests. It dispatches allocation events to the registered handlers and scores nodes with
 * the registered node order functions.
 */
public class TestSchedulingSession implements SchedulingSession {

    private final List<ClusterNode> nodes;
    private final Set<SchedulableTask> tasks = new LinkedHashSet<>();
    private final List<SchedulingEventHandler> handlers = new ArrayList<>();
    private final Map<String, NodeOrderFunction> orderFunctions = new HashMap<>();

    public TestSchedulingSession(List<ClusterNode> nodes, Collection<SchedulableTask> pendingTasks) {
        this.nodes = new ArrayList<>(nodes);
        for (ClusterNode n : nodes)
            tasks.addAll(n.getBoundTasks());
        tasks.addAll(pendingTasks);
    }

    @Override
    public Collection<ClusterNode> getNodes() {
        return nodes;
    }

    @Override
    public Collection<SchedulableTask> getTasks() {
        return tasks;
    }

    @Override
    public void addEventHandler(SchedulingEventHandler handler) {
        handlers.add(handler);
    }

    @Override
    public void addNodeOrderFunction(String pluginName, NodeOrderFunction orderFunction) {
        orderFunctions.put(pluginName, orderFunction);
    }

    public List<SchedulingEventHandler> getHandlers() {
        return handlers;
    }

    public NodeOrderFunction getNodeOrderFunction(String pluginName) {
        return orderFunctions.get(pluginName);
    }

    public ClusterNode getNode(String name) {
        for (ClusterNode n : nodes) {
            if (n.getName().equals(name))
                return n;
        }
        return null;
    }

    public void allocate(SchedulableTask task, String nodeName) {
        dispatch(SchedulingEvent.allocate(task, nodeName));
    }

    public void deallocate(SchedulableTask task, String nodeName) {
        dispatch(SchedulingEvent.deallocate(task, nodeName));
    }

    private void dispatch(SchedulingEvent event) {
        for (SchedulingEventHandler h : handlers)
            h.onEvent(event);
    }
}
