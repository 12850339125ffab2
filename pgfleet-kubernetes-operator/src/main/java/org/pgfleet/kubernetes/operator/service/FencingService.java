/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.pgfleet.kubernetes.operator.service;

import org.pgfleet.kubernetes.operator.exception.ConflictingFenceStateException;

/** Suspends and restores the write access of single instances of a cluster. */
public interface FencingService {

    /**
     * Requests the given pod to be fenced, making it the only fenced instance of the cluster.
     * Doesn't wait for the instance to actually stop.
     *
     * @return true if the fencing annotation was changed, false if the pod already was the only
     *     fenced instance
     * @throws ConflictingFenceStateException if other instances of the cluster are fenced
     */
    boolean requestFence(String namespace, String clusterName, String podName);

    /**
     * Lifts the fencing of the given pod. Unfencing a pod that isn't fenced is a no-op.
     *
     * @return true if the fencing annotation was changed
     * @throws ConflictingFenceStateException if every instance of the cluster is fenced
     */
    boolean requestUnfence(String namespace, String clusterName, String podName);

    /** Whether the fencing of the pod took effect, i.e. the pod isn't ready anymore. */
    boolean isFencedInEffect(String namespace, String podName);
}
