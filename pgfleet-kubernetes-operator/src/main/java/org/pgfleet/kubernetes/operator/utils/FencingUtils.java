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
import org.pgfleet.kubernetes.operator.exception.AlreadyFencedException;
import org.pgfleet.kubernetes.operator.exception.ConflictingFenceStateException;
import org.pgfleet.kubernetes.operator.exception.PreconditionFailedException;
import org.pgfleet.kubernetes.operator.exception.ReconciliationException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import org.apache.commons.lang3.StringUtils;

import java.util.HashMap;
import java.util.List;

/**
 * Pure functions reading and updating the fencing annotation of a cluster.
 *
 * <p>The annotation holds a JSON array of pod names. The {@link
 * CrdConstants#FENCE_ALL_INSTANCES} wildcard fences every instance of the cluster.
 */
public class FencingUtils {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    public static FencedInstances getFencedInstances(ObjectMeta meta) {
        var annotations = meta.getAnnotations();
        var value =
                annotations == null
                        ? null
                        : annotations.get(CrdConstants.FENCED_INSTANCES_ANNOTATION);
        if (StringUtils.isBlank(value)) {
            return FencedInstances.none();
        }
        try {
            return FencedInstances.of(MAPPER.readValue(value, STRING_LIST));
        } catch (JsonProcessingException e) {
            throw new PreconditionFailedException(
                    String.format(
                            "Could not parse annotation %s of %s: %s",
                            CrdConstants.FENCED_INSTANCES_ANNOTATION, meta.getName(), value),
                    e);
        }
    }

    /** Stores the fenced instances in the annotation, removing it when nothing is fenced. */
    public static void setFencedInstances(ObjectMeta meta, FencedInstances fencedInstances) {
        var annotations =
                meta.getAnnotations() == null
                        ? new HashMap<String, String>()
                        : new HashMap<>(meta.getAnnotations());
        if (fencedInstances.isEmpty()) {
            annotations.remove(CrdConstants.FENCED_INSTANCES_ANNOTATION);
        } else {
            try {
                annotations.put(
                        CrdConstants.FENCED_INSTANCES_ANNOTATION,
                        MAPPER.writeValueAsString(fencedInstances.toList()));
            } catch (JsonProcessingException e) {
                throw new ReconciliationException(e);
            }
        }
        meta.setAnnotations(annotations);
    }

    /**
     * Fences the given pod, which must become the only fenced instance of the cluster.
     *
     * @throws AlreadyFencedException if the pod already is the sole fenced instance
     * @throws ConflictingFenceStateException if any other instance, or the whole cluster, is
     *     fenced
     */
    public static FencedInstances addFencedInstance(
            String clusterName, FencedInstances current, String podName) {
        if (current.isSoleInstance(podName)) {
            throw new AlreadyFencedException(podName);
        }
        if (!current.isEmpty()) {
            throw ConflictingFenceStateException.fencedBySomebodyElse(
                    clusterName, podName, current.toList());
        }
        return current.with(podName);
    }

    /**
     * Removes the given pod from the fenced instances. Removing a pod that isn't fenced returns
     * the current set unchanged.
     *
     * @throws ConflictingFenceStateException if the whole cluster is fenced, a single instance
     *     can't be lifted out of it
     */
    public static FencedInstances removeFencedInstance(
            String clusterName, FencedInstances current, String podName) {
        if (current.isFenceAll() && !CrdConstants.FENCE_ALL_INSTANCES.equals(podName)) {
            throw new ConflictingFenceStateException(
                    String.format(
                            "Cannot unfence pod %s, every instance of cluster %s is fenced",
                            podName, clusterName));
        }
        if (!current.contains(podName)) {
            return current;
        }
        return current.without(podName);
    }
}
