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

package com.netflix.nodeorder.plugins;

import com.netflix.nodeorder.SchedulableTask;
import com.netflix.nodeorder.SchedulingEvent;
import com.netflix.nodeorder.SchedulingEventHandler;
import com.netflix.nodeorder.listers.TaskLister;
import com.netflix.nodeorder.state.NodeStateIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the node state index and the task lister in step with the tentative allocations and deallocations of the
 * scheduling session. Events for nodes the index does not know are logged and otherwise ignored; which nodes exist
 * is up to the session.
 */
public class NodeStateEventHandler implements SchedulingEventHandler {

    private static final Logger logger = LoggerFactory.getLogger(NodeStateEventHandler.class);

    private final NodeStateIndex index;
    private final TaskLister taskLister;

    public NodeStateEventHandler(NodeStateIndex index, TaskLister taskLister) {
        this.index = index;
        this.taskLister = taskLister;
    }

    @Override
    public void onAllocate(SchedulingEvent event) {
        final String nodeName = event.getNodeName();
        if (!index.contains(nodeName)) {
            logger.warn("node order, update task " + describe(event.getTask()) + " allocate to NOT EXIST node [" +
                    nodeName + "]");
            return;
        }
        final SchedulableTask task = taskLister.updateTask(event.getTask(), nodeName);
        index.bind(task, nodeName);
        if (logger.isDebugEnabled())
            logger.debug("node order, update task " + describe(task) + " allocate to node [" + nodeName + "]");
    }

    @Override
    public void onDeallocate(SchedulingEvent event) {
        final String nodeName = event.getNodeName();
        if (!index.contains(nodeName)) {
            logger.warn("node order, update task " + describe(event.getTask()) + " deallocate from NOT EXIST node [" +
                    nodeName + "]");
            return;
        }
        final SchedulableTask task = taskLister.updateTask(event.getTask(), null);
        index.unbind(task, nodeName);
        if (logger.isDebugEnabled())
            logger.debug("node order, update task " + describe(task) + " deallocate from node [" + nodeName + "]");
    }

    private static String describe(SchedulableTask task) {
        return task.getNamespace() + "/" + task.getId();
    }
}
