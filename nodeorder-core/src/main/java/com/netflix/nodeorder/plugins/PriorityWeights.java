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

import com.netflix.nodeorder.PluginArguments;

/**
 * The weights by which the node ordering priorities are multiplied before they are summed into the score of a node.
 * Each weight defaults to 1.
 */
public final class PriorityWeights {

    /**
     * Argument key for the weight of the node affinity priority.
     */
    public static final String NODE_AFFINITY_WEIGHT = "nodeaffinity.weight";
    /**
     * Argument key for the weight of the inter-task affinity priority.
     */
    public static final String TASK_AFFINITY_WEIGHT = "podaffinity.weight";
    /**
     * Argument key for the weight of the least requested priority.
     */
    public static final String LEAST_REQUESTED_WEIGHT = "leastrequested.weight";
    /**
     * Argument key for the weight of the balanced resource priority.
     */
    public static final String BALANCED_RESOURCE_WEIGHT = "balancedresource.weight";

    public static final int DEFAULT_WEIGHT = 1;

    public static final PriorityWeights DEFAULT = new Builder().build();

    /**
     * Builder class for {@link PriorityWeights}.
     */
    public static class Builder {
        private int leastRequested = DEFAULT_WEIGHT;
        private int balancedResource = DEFAULT_WEIGHT;
        private int nodeAffinity = DEFAULT_WEIGHT;
        private int taskAffinity = DEFAULT_WEIGHT;

        public Builder withLeastRequested(int weight) {
            this.leastRequested = weight;
            return this;
        }

        public Builder withBalancedResource(int weight) {
            this.balancedResource = weight;
            return this;
        }

        public Builder withNodeAffinity(int weight) {
            this.nodeAffinity = weight;
            return this;
        }

        public Builder withTaskAffinity(int weight) {
            this.taskAffinity = weight;
            return this;
        }

        public PriorityWeights build() {
            return new PriorityWeights(leastRequested, balancedResource, nodeAffinity, taskAffinity);
        }
    }

    private final int leastRequested;
    private final int balancedResource;
    private final int nodeAffinity;
    private final int taskAffinity;

    private PriorityWeights(int leastRequested, int balancedResource, int nodeAffinity, int taskAffinity) {
        this.leastRequested = leastRequested;
        this.balancedResource = balancedResource;
        this.nodeAffinity = nodeAffinity;
        this.taskAffinity = taskAffinity;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Resolve the weights from plugin arguments, using the keys {@value #NODE_AFFINITY_WEIGHT},
     * {@value #TASK_AFFINITY_WEIGHT}, {@value #LEAST_REQUESTED_WEIGHT} and {@value #BALANCED_RESOURCE_WEIGHT}.
     * A weight that is absent, or not an integer, keeps its default of 1. Other arguments are ignored. This never
     * fails.
     *
     * @param arguments the plugin arguments, may be null
     * @return the weights
     */
    public static PriorityWeights fromArguments(PluginArguments arguments) {
        if (arguments == null)
            return DEFAULT;
        return new Builder()
                .withNodeAffinity(arguments.getInt(NODE_AFFINITY_WEIGHT, DEFAULT_WEIGHT))
                .withTaskAffinity(arguments.getInt(TASK_AFFINITY_WEIGHT, DEFAULT_WEIGHT))
                .withLeastRequested(arguments.getInt(LEAST_REQUESTED_WEIGHT, DEFAULT_WEIGHT))
                .withBalancedResource(arguments.getInt(BALANCED_RESOURCE_WEIGHT, DEFAULT_WEIGHT))
                .build();
    }

    public int getLeastRequested() {
        return leastRequested;
    }

    public int getBalancedResource() {
        return balancedResource;
    }

    public int getNodeAffinity() {
        return nodeAffinity;
    }

    public int getTaskAffinity() {
        return taskAffinity;
    }

    @Override
    public String toString() {
        return "PriorityWeights{" +
                "leastRequested=" + leastRequested +
                ", balancedResource=" + balancedResource +
                ", nodeAffinity=" + nodeAffinity +
                ", taskAffinity=" + taskAffinity +
                '}';
    }
}
