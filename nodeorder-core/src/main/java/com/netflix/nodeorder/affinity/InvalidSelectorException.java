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

import com.netflix.nodeorder.ScoringException;

/**
 * Thrown when a label selector or node selector requirement is malformed, for example an {@code In} requirement
 * without values or a {@code Gt} requirement whose value is not an integer.
 */
public class InvalidSelectorException extends ScoringException {

    public InvalidSelectorException(String message) {
        super(message);
    }
}
