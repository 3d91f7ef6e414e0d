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
 * Node affinity of a task. Required terms are enforced by feasibility filtering before nodes are ordered, so node
 * ordering only evaluates the preferred terms.
 */
public class NodeAffinity {
    private final List<NodeSelectorTerm> required;
    private final List<PreferredSchedulingTerm> preferred;

    public NodeAffinity(List<NodeSelectorTerm> required, List<PreferredSchedulingTerm> preferred) {
        this.required = required==null? Collections.<NodeSelectorTerm>emptyList() : Collections.unmodifiableList(required);
        this.preferred = preferred==null? Collections.<PreferredSchedulingTerm>emptyList() : Collections.unmodifiableList(preferred);
    }

    public List<NodeSelectorTerm> getRequired() {
        return required;
    }

    public List<PreferredSchedulingTerm> getPreferred() {
        return preferred;
    }
}
