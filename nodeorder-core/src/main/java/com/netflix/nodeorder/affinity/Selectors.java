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

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates label selectors and node selector requirements and turns them into {@link LabelMatcher}s.
 */
public class Selectors {

    /**
     * A validated selector, ready to be matched against label sets.
     */
    public interface LabelMatcher {
        boolean matches(Map<String, String> labels);
    }

    private static final int MAX_NAME_LENGTH = 63;
    private static final int MAX_PREFIX_LENGTH = 253;
    private static final Pattern NAME = Pattern.compile("([A-Za-z0-9][-A-Za-z0-9_.]*)?[A-Za-z0-9]");
    private static final Pattern DNS_SUBDOMAIN =
            Pattern.compile("[a-z0-9]([-a-z0-9]*[a-z0-9])?(\\.[a-z0-9]([-a-z0-9]*[a-z0-9])?)*");

    public static final LabelMatcher NOTHING = labels -> false;
    public static final LabelMatcher EVERYTHING = labels -> true;

    private Selectors() {
    }

    /**
     * Compiles a task label selector. A null selector matches no task and an empty selector matches every task.
     * Only {@code In}, {@code NotIn}, {@code Exists} and {@code DoesNotExist} are valid in a label selector.
     *
     * @param selector the selector to compile
     * @return a matcher for the selector
     * @throws InvalidSelectorException if the selector is malformed
     */
    public static LabelMatcher forLabelSelector(LabelSelector selector) throws InvalidSelectorException {
        if (selector == null)
            return NOTHING;
        if (selector.getMatchLabels().isEmpty() && selector.getMatchExpressions().isEmpty())
            return EVERYTHING;
        List<LabelMatcher> matchers = new ArrayList<>();
        for (Map.Entry<String, String> entry : selector.getMatchLabels().entrySet()) {
            validateKey(entry.getKey());
            final String key = entry.getKey();
            final String value = entry.getValue();
            if (value == null)
                throw new InvalidSelectorException("null value for label " + key);
            validateValue(value);
            matchers.add(labels -> value.equals(labels.get(key)));
        }
        for (SelectorRequirement requirement : selector.getMatchExpressions()) {
            if (requirement.getOperator() == SelectorRequirement.Operator.Gt ||
                    requirement.getOperator() == SelectorRequirement.Operator.Lt)
                throw new InvalidSelectorException("\"" + requirement.getOperator() + "\" is not a valid label selector operator");
            matchers.add(compile(requirement));
        }
        return allOf(matchers);
    }

    /**
     * Compiles the requirements of a node selector term. A term without requirements matches no node.
     *
     * @param requirements the requirements, all of which must hold
     * @return a matcher for the requirements
     * @throws InvalidSelectorException if a requirement is malformed
     */
    public static LabelMatcher forNodeSelectorRequirements(List<SelectorRequirement> requirements)
            throws InvalidSelectorException {
        if (requirements == null || requirements.isEmpty())
            return NOTHING;
        List<LabelMatcher> matchers = new ArrayList<>(requirements.size());
        for (SelectorRequirement requirement : requirements)
            matchers.add(compile(requirement));
        return allOf(matchers);
    }

    private static LabelMatcher allOf(final List<LabelMatcher> matchers) {
        return labels -> {
            for (LabelMatcher m : matchers) {
                if (!m.matches(labels))
                    return false;
            }
            return true;
        };
    }

    private static LabelMatcher compile(SelectorRequirement requirement) throws InvalidSelectorException {
        final String key = requirement.getKey();
        validateKey(key);
        if (requirement.getOperator() == null)
            throw new InvalidSelectorException("missing operator for key " + key);
        final List<String> values = requirement.getValues();
        switch (requirement.getOperator()) {
            case In:
            case NotIn:
                if (values.isEmpty())
                    throw new InvalidSelectorException("for 'In', 'NotIn' operators, values set can't be empty: " + requirement);
                for (String value : values)
                    validateValue(value);
                final Set<String> valueSet = new HashSet<>(values);
                if (requirement.getOperator() == SelectorRequirement.Operator.In)
                    return labels -> labels.containsKey(key) && valueSet.contains(labels.get(key));
                return labels -> !labels.containsKey(key) || !valueSet.contains(labels.get(key));
            case Exists:
                if (!values.isEmpty())
                    throw new InvalidSelectorException("values set must be empty for exists and does not exist: " + requirement);
                return labels -> labels.containsKey(key);
            case DoesNotExist:
                if (!values.isEmpty())
                    throw new InvalidSelectorException("values set must be empty for exists and does not exist: " + requirement);
                return labels -> !labels.containsKey(key);
            case Gt:
            case Lt:
                if (values.size() != 1)
                    throw new InvalidSelectorException("for 'Gt', 'Lt' operators, exactly one value is required: " + requirement);
                final long bound;
                try {
                    bound = Long.parseLong(values.get(0));
                } catch (NumberFormatException e) {
                    throw new InvalidSelectorException("for 'Gt', 'Lt' operators, the value must be an integer: " + requirement);
                }
                final boolean greater = requirement.getOperator() == SelectorRequirement.Operator.Gt;
                return labels -> {
                    String labelValue = labels.get(key);
                    if (labelValue == null)
                        return false;
                    long parsed;
                    try {
                        parsed = Long.parseLong(labelValue);
                    } catch (NumberFormatException e) {
                        return false;
                    }
                    return greater ? parsed > bound : parsed < bound;
                };
            default:
                throw new InvalidSelectorException("\"" + requirement.getOperator() + "\" is not a valid selector operator");
        }
    }

    /**
     * A key is a name of at most 63 characters, optionally preceded by a DNS subdomain prefix and a slash, as in
     * {@code example.com/zone}.
     */
    private static void validateKey(String key) throws InvalidSelectorException {
        if (key == null || key.isEmpty())
            throw new InvalidSelectorException("selector key cannot be empty");
        String name = key;
        int slash = key.indexOf('/');
        if (slash >= 0) {
            String prefix = key.substring(0, slash);
            name = key.substring(slash + 1);
            if (prefix.isEmpty() || prefix.length() > MAX_PREFIX_LENGTH || !DNS_SUBDOMAIN.matcher(prefix).matches())
                throw new InvalidSelectorException("invalid label key \"" + key + "\": prefix must be a DNS subdomain");
        }
        if (name.isEmpty() || name.length() > MAX_NAME_LENGTH || !NAME.matcher(name).matches())
            throw new InvalidSelectorException("invalid label key \"" + key +
                    "\": name must be at most 63 alphanumeric characters, '-', '_' or '.', starting and ending with an alphanumeric character");
    }

    /**
     * A value is empty or a name of at most 63 characters.
     */
    private static void validateValue(String value) throws InvalidSelectorException {
        if (value == null)
            throw new InvalidSelectorException("label value cannot be null");
        if (value.isEmpty())
            return;
        if (value.length() > MAX_NAME_LENGTH || !NAME.matcher(value).matches())
            throw new InvalidSelectorException("invalid label value \"" + value +
                    "\": must be at most 63 alphanumeric characters, '-', '_' or '.', starting and ending with an alphanumeric character");
    }
}
