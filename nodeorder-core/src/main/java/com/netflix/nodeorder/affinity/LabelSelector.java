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
import java.util.Map;

/**
 * Selects tasks by their labels. A task is selected when it carries every label of {@code matchLabels} with the
 * given value and satisfies every requirement of {@code matchExpressions}. An empty selector selects every task.
 */
public class LabelSelector {
    private final Map<String, String> matchLabels;
    private final List<SelectorRequirement> matchExpressions;

    public LabelSelector(Map<String, String> matchLabels, List<SelectorRequirement> matchExpressions) {
        this.matchLabels = matchLabels==null? Collections.<String, String>emptyMap() : Collections.unmodifiableMap(matchLabels);
        this.matchExpressions = matchExpressions==null? Collections.<SelectorRequirement>emptyList() :
                Collections.unmodifiableList(matchExpressions);
    }

    public static LabelSelector matchingLabel(String key, String value) {
        return new LabelSelector(Collections.singletonMap(key, value), null);
    }

    public Map<String, String> getMatchLabels() {
        return matchLabels;
    }

    public List<SelectorRequirement> getMatchExpressions() {
        return matchExpressions;
    }

    @Override
    public String toString() {
        return "LabelSelector{" +
                "matchLabels=" + matchLabels +
                ", matchExpressions=" + matchExpressions +
                '}';
    }
}
