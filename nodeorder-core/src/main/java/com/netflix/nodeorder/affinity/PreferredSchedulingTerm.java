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
 * A node selector term with the weight it adds to the node affinity priority of the nodes it matches.
 */
public class PreferredSchedulingTerm {
    private final int weight;
    private final NodeSelectorTerm preference;

    public PreferredSchedulingTerm(int weight, NodeSelectorTerm preference) {
        if (preference == null) {
            throw new IllegalArgumentException("Preference cannot be null");
        }
        this.weight = weight;
        this.preference = preference;
    }

    public int getWeight() {
        return weight;
    }

    public NodeSelectorTerm getPreference() {
        return preference;
    }

    @Override
    public String toString() {
        return "{ weight: " + weight + ", preference: " + preference + " }";
    }
}
