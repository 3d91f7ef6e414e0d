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

import java.util.Collection;

/**
 * One round of the scheduler, during which tasks are ordered across nodes and tentatively placed. The session owns
 * the nodes and tasks; plugins observe it through this interface while it is open.
 */
public interface SchedulingSession {

    /**
     * Get all nodes of the session, in a stable order.
     *
     * @return the nodes
     */
    Collection<? extends ClusterNode> getNodes();

    /**
     * Get all tasks the session knows about, whether bound to a node or pending.
     *
     * @return the tasks
     */
    Collection<? extends SchedulableTask> getTasks();

    /**
     * Register a handler to be notified of tentative allocations and deallocations during the session.
     *
     * @param handler the handler
     */
    void addEventHandler(SchedulingEventHandler handler);

    /**
     * Register the function that orders nodes for a task on behalf of a plugin.
     *
     * @param pluginName    name of the plugin registering the function
     * @param orderFunction the function
     */
    void addNodeOrderFunction(String pluginName, NodeOrderFunction orderFunction);
}
