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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Required and preferred task affinity terms. The same shape describes both affinity, where the task wants to share
 * a topology domain with the selected tasks, and anti-affinity, where it wants to stay out of their domains.
 */
public class TaskAffinityRules {
    private final List<TaskAffinityTerm> required;
    private final List<WeightedTaskAffinityTerm> preferred;

    public TaskAffinityRules(List<TaskAffinityTerm> required, List<WeightedTaskAffinityTerm> preferred) {
        this.required = required==null? Collections.<TaskAffinityTerm>emptyList() : Collections.unmodifiableList(required);
        this.preferred = preferred==null? Collections.<WeightedTaskAffinityTerm>emptyList() : Collections.unmodifiableList(preferred);
    }

    public static TaskAffinityRules preferred(WeightedTaskAffinityTerm... terms) {
        return new TaskAffinityRules(null, Arrays.asList(terms));
    }

    public static TaskAffinityRules required(TaskAffinityTerm... terms) {
        return new TaskAffinityRules(Arrays.asList(terms), null);
    }

    public List<TaskAffinityTerm> getRequired() {
        return required;
    }

    public List<WeightedTaskAffinityTerm> getPreferred() {
        return preferred;
    }
}
