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
import com.netflix.nodeorder.affinity.InvalidSelectorException;
import com.netflix.nodeorder.affinity.LabelSelector;

import java.util.List;

/**
 * Tracks where the tasks of a scheduling session are currently placed.
 */
public interface TaskLister {

    /**
     * Record the node a task is placed on.
     *
     * @param task     the task
     * @param nodeName name of the node, or null if the task is no longer placed
     * @return the tracked task
     */
    SchedulableTask updateTask(SchedulableTask task, String nodeName);

    /**
     * Get a task by its identifier.
     *
     * @param taskId the task identifier
     * @return the task, or null if the lister does not know it
     */
    SchedulableTask getTask(String taskId);

    /**
     * List the tasks whose labels the selector matches, placed or not.
     *
     * @param selector the label selector, null matches no task
     * @return the matching tasks, in no particular order
     * @throws InvalidSelectorException if the selector is malformed
     */
    List<SchedulableTask> list(LabelSelector selector) throws InvalidSelectorException;
}
