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

public class WeightedTaskAffinityTerm {
    private final int weight;
    private final TaskAffinityTerm term;

    public WeightedTaskAffinityTerm(int weight, TaskAffinityTerm term) {
        if (term == null) {
            throw new IllegalArgumentException("Affinity term cannot be null");
        }
        this.weight = weight;
        this.term = term;
    }

    public int getWeight() {
        return weight;
    }

    public TaskAffinityTerm getTerm() {
        return term;
    }

    @Override
    public String toString() {
        return "{ weight: " + weight + ", term: " + term + " }";
    }
}
