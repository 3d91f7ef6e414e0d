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
 * A scheduler plugin. The session calls {@link #onSessionOpen(SchedulingSession)} when it opens, at which point the
 * plugin registers its functions and handlers, and {@link #onSessionClose(SchedulingSession)} when it closes.
 */
public interface SessionPlugin {

    /**
     * Get the name under which the plugin registers with the session.
     *
     * @return the plugin name
     */
    String getName();

    void onSessionOpen(SchedulingSession session);

    void onSessionClose(SchedulingSession session);
}
