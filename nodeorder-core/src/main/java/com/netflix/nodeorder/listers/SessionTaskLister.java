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

package com.netflix.nodeorder.listers;

import com.netflix.nodeorder.SchedulableTask;
import com.netflix.nodeorder.SchedulingSession;
import com.netflix.nodeorder.affinity.InvalidSelectorException;
import com.netflix.nodeorder.affinity.LabelSelector;
import com.netflix.nodeorder.affinity.Selectors;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * A {@link TaskLister} over the tasks a session knew about when it opened. Tasks first seen in an event are added.
 */
public class SessionTaskLister implements TaskLister {

    private final ConcurrentMap<String, SchedulableTask> tasks = new ConcurrentHashMap<>();

    public SessionTaskLister(SchedulingSession session) {
        for (SchedulableTask t : session.getTasks())
            tasks.put(t.getId(), t);
    }

    @Override
    public SchedulableTask updateTask(SchedulableTask task, String nodeName) {
        task.setAssignedNode(nodeName);
        tasks.put(task.getId(), task);
        return task;
    }

    @Override
    public SchedulableTask getTask(String taskId) {
        return tasks.get(taskId);
    }

    @Override
    public List<SchedulableTask> list(LabelSelector selector) throws InvalidSelectorException {
        Selectors.LabelMatcher matcher = Selectors.forLabelSelector(selector);
        List<SchedulableTask> result = new ArrayList<>();
        for (SchedulableTask t : tasks.values()) {
            if (matcher.matches(t.getLabels()))
                result.add(t);
        }
        return result;
    }
}
