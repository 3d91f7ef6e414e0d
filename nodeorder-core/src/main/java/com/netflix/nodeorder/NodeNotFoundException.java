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
 * Thrown when a node that a scoring step needs cannot be found, or is known only by name without its capacity.
 */
public class NodeNotFoundException extends ScoringException {

    private final String nodeName;

    public NodeNotFoundException(String nodeName) {
        super("failed to find node <" + nodeName + ">");
        this.nodeName = nodeName;
    }

    public String getNodeName() {
        return nodeName;
    }
}
