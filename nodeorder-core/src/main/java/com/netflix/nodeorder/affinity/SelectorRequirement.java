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
 * A requirement on the value of a single label, as used by label selectors and node selector terms.
 */
public class SelectorRequirement {

    public enum Operator {
        In,
        NotIn,
        Exists,
        DoesNotExist,
        /**
         * The label value, parsed as an integer, is greater than the single requirement value. Node selectors only.
         */
        Gt,
        /**
         * The label value, parsed as an integer, is less than the single requirement value. Node selectors only.
         */
        Lt
    }

    private final String key;
    private final Operator operator;
    private final List<String> values;

    public SelectorRequirement(String key, Operator operator, List<String> values) {
        this.key = key;
        this.operator = operator;
        this.values = values==null? Collections.<String>emptyList() : Collections.unmodifiableList(values);
    }

    public static SelectorRequirement in(String key, String... values) {
        return new SelectorRequirement(key, Operator.In, Arrays.asList(values));
    }

    public static SelectorRequirement notIn(String key, String... values) {
        return new SelectorRequirement(key, Operator.NotIn, Arrays.asList(values));
    }

    public static SelectorRequirement exists(String key) {
        return new SelectorRequirement(key, Operator.Exists, null);
    }

    public static SelectorRequirement doesNotExist(String key) {
        return new SelectorRequirement(key, Operator.DoesNotExist, null);
    }

    public String getKey() {
        return key;
    }

    public Operator getOperator() {
        return operator;
    }

    public List<String> getValues() {
        return values;
    }

    @Override
    public String toString() {
        return key + " " + operator + " " + values;
    }
}
