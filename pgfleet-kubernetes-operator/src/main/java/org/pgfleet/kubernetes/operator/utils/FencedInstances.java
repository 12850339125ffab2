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

package org.pgfleet.kubernetes.operator.utils;

import org.pgfleet.kubernetes.operator.api.CrdConstants;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/** Immutable set of the instances named in the fencing annotation of a cluster. */
@EqualsAndHashCode
public final class FencedInstances {

    private static final FencedInstances NONE = new FencedInstances(new TreeSet<>());

    private final SortedSet<String> instances;

    private FencedInstances(SortedSet<String> instances) {
        this.instances = Collections.unmodifiableSortedSet(instances);
    }

    public static FencedInstances none() {
        return NONE;
    }

    public static FencedInstances of(Collection<String> instances) {
        return new FencedInstances(new TreeSet<>(instances));
    }

    public boolean isEmpty() {
        return instances.isEmpty();
    }

    /** Whether the wildcard is set, i.e. every instance of the cluster is fenced. */
    public boolean isFenceAll() {
        return instances.contains(CrdConstants.FENCE_ALL_INSTANCES);
    }

    public boolean contains(String podName) {
        return instances.contains(podName);
    }

    /** Whether the given pod is the one and only fenced instance. */
    public boolean isSoleInstance(String podName) {
        return instances.size() == 1 && instances.contains(podName);
    }

    public FencedInstances with(String podName) {
        var copy = new TreeSet<>(instances);
        copy.add(podName);
        return new FencedInstances(copy);
    }

    public FencedInstances without(String podName) {
        var copy = new TreeSet<>(instances);
        copy.remove(podName);
        return new FencedInstances(copy);
    }

    /** Sorted list of the fenced instances, the form stored in the annotation. */
    public List<String> toList() {
        return new ArrayList<>(instances);
    }

    @Override
    public String toString() {
        return instances.toString();
    }
}
