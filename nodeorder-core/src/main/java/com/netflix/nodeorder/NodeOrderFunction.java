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
 * Scores a candidate node for a task. The session calls the function once per candidate node per task, possibly
 * concurrently, and ranks the nodes by score. Only the relative order of scores for the same task within the same
 * session is meaningful; ties are broken by the session.
 */
@FunctionalInterface
public interface NodeOrderFunction {

    /**
     * Score the node for the task.
     *
     * @param task the task awaiting placement
     * @param node the candidate node, already found feasible for the task
     * @return the score, higher is better
     * @throws ScoringException if the node could not be scored, in which case it must be treated as unscored rather
     *                          than as a low score
     */
    double score(SchedulableTask task, ClusterNode node) throws ScoringException;
}
