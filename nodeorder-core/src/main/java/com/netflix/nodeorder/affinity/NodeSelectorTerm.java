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
 * A set of requirements on node labels, all of which must hold for the term to match a node. A term without
 * requirements matches no node.
 */
public class NodeSelectorTerm {
    private final List<SelectorRequirement> matchExpressions;

    public NodeSelectorTerm(List<SelectorRequirement> matchExpressions) {
        this.matchExpressions = matchExpressions==null? Collections.<SelectorRequirement>emptyList() :
                Collections.unmodifiableList(matchExpressions);
    }

    public List<SelectorRequirement> getMatchExpressions() {
        return matchExpressions;
    }

    @Override
    public String toString() {
        return "NodeSelectorTerm" + matchExpressions;
    }
}
