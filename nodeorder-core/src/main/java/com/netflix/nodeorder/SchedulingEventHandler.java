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
 * A callback API providing notification about tentative task placement decisions during a scheduling session.
 */
public interface SchedulingEventHandler {

    /**
     * Called when the session allocates a task to a node.
     *
     * @param event an event of type {@link SchedulingEvent.Type#ALLOCATE}
     */
    void onAllocate(SchedulingEvent event);

    /**
     * Called when the session deallocates a task from a node.
     *
     * @param event an event of type {@link SchedulingEvent.Type#DEALLOCATE}
     */
    void onDeallocate(SchedulingEvent event);

    /**
     * Dispatch the event to {@link #onAllocate(SchedulingEvent)} or {@link #onDeallocate(SchedulingEvent)}
     * depending on its type.
     *
     * @param event the event
     */
    default void onEvent(SchedulingEvent event) {
        switch (event.getType()) {
            case ALLOCATE:
                onAllocate(event);
                break;
            case DEALLOCATE:
                onDeallocate(event);
                break;
            default:
                throw new IllegalArgumentException("Unknown event type " + event.getType());
        }
    }
}
