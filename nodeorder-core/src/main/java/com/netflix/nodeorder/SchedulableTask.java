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

import java.util.Map;

/**
 * Describes a task awaiting placement and its requirements. Tasks are owned by the scheduling session; node
 * ordering only reads them, except for the assigned node which is updated as the session allocates and deallocates
 * the task.
 */
public interface SchedulableTask {

    /**
     * Get an identifier for this task. Identifiers are unique within a scheduling session.
     *
     * @return a task identifier
     */
    String getId();

    /**
     * Get the namespace of the task. Affinity terms without explicit namespaces apply to the namespace of the
     * task that defines them.
     *
     * @return the namespace
     */
    String getNamespace();

    /**
     * Get the labels of this task, which affinity terms of other tasks select on.
     *
     * @return a map of label names to values, never null
     */
    Map<String, String> getLabels();

    /**
     * Get the resources requested by the task. A node keeps the request it saw when the task was bound, and gives
     * back that same amount when the task is unbound.
     *
     * @return the requested resources
     */
    ResourceVector getResourceRequest();

    /**
     * Get the node and task affinity rules of the task.
     *
     * @return the affinity rules, or null if the task has none
     */
    Affinity getAffinity();

    /**
     * Get the name of the node the task is currently assigned to.
     *
     * @return the node name, or null if the task is not assigned to any node
     */
    String getAssignedNode();

    /**
     * Set the name of the node the task is assigned to.
     *
     * @param nodeName the node name, or null to mark the task as unassigned
     */
    void setAssignedNode(String nodeName);
}
