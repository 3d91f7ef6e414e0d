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

package com.netflix.nodeorder.affinity;

/**
 * The affinity rules of a task: preferences for nodes by their labels, and for co-location with, or separation
 * from, other tasks.
 */
public class Affinity {

    /**
     * Builder for {@link Affinity}. Rules not set remain absent.
     */
    public static class Builder {
        private NodeAffinity nodeAffinity;
        private TaskAffinityRules taskAffinity;
        private TaskAffinityRules taskAntiAffinity;

        public Builder withNodeAffinity(NodeAffinity nodeAffinity) {
            this.nodeAffinity = nodeAffinity;
            return this;
        }

        public Builder withTaskAffinity(TaskAffinityRules taskAffinity) {
            this.taskAffinity = taskAffinity;
            return this;
        }

        public Builder withTaskAntiAffinity(TaskAffinityRules taskAntiAffinity) {
            this.taskAntiAffinity = taskAntiAffinity;
            return this;
        }

        public Affinity build() {
            return new Affinity(nodeAffinity, taskAffinity, taskAntiAffinity);
        }
    }

    private final NodeAffinity nodeAffinity;
    private final TaskAffinityRules taskAffinity;
    private final TaskAffinityRules taskAntiAffinity;

    private Affinity(NodeAffinity nodeAffinity, TaskAffinityRules taskAffinity, TaskAffinityRules taskAntiAffinity) {
        this.nodeAffinity = nodeAffinity;
        this.taskAffinity = taskAffinity;
        this.taskAntiAffinity = taskAntiAffinity;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * @return the node affinity, or null if none
     */
    public NodeAffinity getNodeAffinity() {
        return nodeAffinity;
    }

    /**
     * @return the task affinity rules, or null if none
     */
    public TaskAffinityRules getTaskAffinity() {
        return taskAffinity;
    }

    /**
     * @return the task anti-affinity rules, or null if none
     */
    public TaskAffinityRules getTaskAntiAffinity() {
        return taskAntiAffinity;
    }

    public boolean hasTaskAffinity() {
        return taskAffinity != null;
    }

    public boolean hasTaskAntiAffinity() {
        return taskAntiAffinity != null;
    }
}
