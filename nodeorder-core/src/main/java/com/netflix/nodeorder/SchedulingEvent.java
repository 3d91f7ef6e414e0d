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
 * A tentative placement decision made by the scheduling session.
 */
public class SchedulingEvent {

    public enum Type {
        /**
         * The task was allocated to the node.
         */
        ALLOCATE,
        /**
         * The task was deallocated from the node.
         */
        DEALLOCATE
    }

    private final Type type;
    private final SchedulableTask task;
    private final String nodeName;

    public SchedulingEvent(Type type, SchedulableTask task, String nodeName) {
        if (type == null || task == null) {
            throw new IllegalArgumentException("Event type and task cannot be null");
        }
        this.type = type;
        this.task = task;
        this.nodeName = nodeName;
    }

    public static SchedulingEvent allocate(SchedulableTask task, String nodeName) {
        return new SchedulingEvent(Type.ALLOCATE, task, nodeName);
    }

    public static SchedulingEvent deallocate(SchedulableTask task, String nodeName) {
        return new SchedulingEvent(Type.DEALLOCATE, task, nodeName);
    }

    public Type getType() {
        return type;
    }

    public SchedulableTask getTask() {
        return task;
    }

    /**
     * Get the name of the node the task was allocated to, or deallocated from.
     *
     * @return the node name
     */
    public String getNodeName() {
        return nodeName;
    }

    @Override
    public String toString() {
        return "SchedulingEvent{" +
                "type=" + type +
                ", task=" + task.getId() +
                ", nodeName='" + nodeName + '\'' +
                '}';
    }
}
