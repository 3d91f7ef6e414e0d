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
import java.util.Map;

/**
 * A placement target as seen by the scheduling session when it opens.
 */
public interface ClusterNode {

    /**
     * Get the name of the node. Names are unique within a scheduling session.
     *
     * @return the node name
     */
    String getName();

    /**
     * Get the labels of the node, used by node affinity and as topology domains by task affinity.
     *
     * @return a map of label names to values, never null
     */
    Map<String, String> getLabels();

    /**
     * Get the resources of the node that can be allocated to tasks.
     *
     * @return the allocatable resources, or null if the capacity of the node is unknown
     */
    ResourceVector getAllocatable();

    /**
     * Get the tasks bound to this node when the scheduling session opened.
     *
     * @return a collection of tasks, never null
     */
    Collection<SchedulableTask> getBoundTasks();
}
