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

package com.netflix.nodeorder.listers;

import com.netflix.nodeorder.ClusterNode;
import com.netflix.nodeorder.NodeNotFoundException;
import com.netflix.nodeorder.SchedulingSession;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Node lister and lookup over the nodes of a session as of the time it opened. The set of nodes does not change
 * while a session is open.
 */
public class SessionNodeLister implements NodeLister, NodeInfoLookup {

    private final Map<String, ClusterNode> nodes;

    public SessionNodeLister(SchedulingSession session) {
        Map<String, ClusterNode> byName = new LinkedHashMap<>();
        for (ClusterNode n : session.getNodes())
            byName.putIfAbsent(n.getName(), n);
        nodes = Collections.unmodifiableMap(byName);
    }

    @Override
    public List<ClusterNode> list() {
        return new ArrayList<>(nodes.values());
    }

    @Override
    public ClusterNode getNodeInfo(String nodeName) throws NodeNotFoundException {
        ClusterNode node = nodeName == null ? null : nodes.get(nodeName);
        if (node == null)
            throw new NodeNotFoundException(nodeName);
        return node;
    }
}
