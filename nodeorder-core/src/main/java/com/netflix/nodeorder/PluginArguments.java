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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The arguments configured for a plugin, as string keys and values. For example, the scheduler configuration entry
 * <pre>
 * { "nodeaffinity.weight": 2, "leastrequested.weight": 3 }
 * </pre>
 * configures the weights of two node ordering priorities. Values of any JSON scalar type are kept as their text.
 */
public final class PluginArguments {

    private static final Logger logger = LoggerFactory.getLogger(PluginArguments.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public static final PluginArguments EMPTY = new PluginArguments(Collections.<String, String>emptyMap());

    private final Map<String, String> arguments;

    private PluginArguments(Map<String, String> arguments) {
        this.arguments = Collections.unmodifiableMap(arguments);
    }

    /**
     * Create arguments from a map. Values are converted to strings; null values are dropped.
     *
     * @param arguments argument values by key
     * @return the arguments
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static PluginArguments fromMap(Map<String, ?> arguments) {
        if (arguments == null || arguments.isEmpty())
            return EMPTY;
        Map<String, String> values = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : arguments.entrySet()) {
            if (entry.getValue() != null)
                values.put(entry.getKey(), String.valueOf(entry.getValue()));
        }
        return new PluginArguments(values);
    }

    /**
     * Parse arguments from a JSON object.
     *
     * @param json the JSON text
     * @return the arguments
     * @throws JsonProcessingException if the text is not a JSON object
     */
    public static PluginArguments fromJson(String json) throws JsonProcessingException {
        PluginArguments parsed = objectMapper.readValue(json, PluginArguments.class);
        return parsed == null ? EMPTY : parsed;
    }

    @JsonValue
    public Map<String, String> asMap() {
        return arguments;
    }

    /**
     * Get the raw value of an argument.
     *
     * @param key the argument key
     * @return the value, or null if the argument is not set
     */
    public String get(String key) {
        return arguments.get(key);
    }

    public boolean contains(String key) {
        return arguments.containsKey(key);
    }

    /**
     * Get an argument as an integer. An absent argument silently yields the default. A value that is not an integer
     * also yields the default, but is logged so that a misconfiguration does not go unnoticed.
     *
     * @param key          the argument key
     * @param defaultValue the value to use if the argument is absent or not an integer
     * @return the argument value or the default
     */
    public int getInt(String key, int defaultValue) {
        String value = arguments.get(key);
        if (value == null)
            return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Ignoring argument " + key + "=" + value + ", not an integer; using default " + defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "PluginArguments" + arguments;
    }
}
