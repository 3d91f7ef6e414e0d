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

import java.util.Collections;
import java.util.List;

/**
 * Selects a group of tasks and the topology domain in which the defining task wants to be near to, or away from,
 * that group. Two nodes are in the same domain when both carry the {@code topologyKey} label with the same value.
 */
public class TaskAffinityTerm {
    private final LabelSelector labelSelector;
    private final List<String> namespaces;
    private final String topologyKey;

    /**
     * @param labelSelector selector of the tasks this term refers to, null selects no task
     * @param namespaces    namespaces the selected tasks must be in, empty for the namespace of the defining task
     * @param topologyKey   name of the node label defining the topology domain
     */
    public TaskAffinityTerm(LabelSelector labelSelector, List<String> namespaces, String topologyKey) {
        this.labelSelector = labelSelector;
        this.namespaces = namespaces==null? Collections.<String>emptyList() : Collections.unmodifiableList(namespaces);
        this.topologyKey = topologyKey;
    }

    public LabelSelector getLabelSelector() {
        return labelSelector;
    }

    public List<String> getNamespaces() {
        return namespaces;
    }

    public String getTopologyKey() {
        return topologyKey;
    }

    @Override
    public String toString() {
        return "TaskAffinityTerm{" +
                "labelSelector=" + labelSelector +
                ", namespaces=" + namespaces +
                ", topologyKey='" + topologyKey + '\'' +
                '}';
    }
}
