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

import org.apache.flink.util.Preconditions;

import org.pgfleet.kubernetes.operator.api.PostgresCluster;
import org.pgfleet.kubernetes.operator.exception.AlreadyFencedException;
import org.pgfleet.kubernetes.operator.utils.FencedInstances;
import org.pgfleet.kubernetes.operator.utils.FencingUtils;
import org.pgfleet.kubernetes.operator.utils.PodUtils;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.HttpURLConnection;
import java.util.function.UnaryOperator;

/**
 * {@link FencingService} storing the fenced instances in the annotation of the {@link
 * PostgresCluster} resource. Every change is a compare-and-swap on the resource version of the
 * cluster, retried when somebody else modified the cluster in the meantime.
 */
public class KubernetesFencingService implements FencingService {

    private static final Logger LOG = LoggerFactory.getLogger(KubernetesFencingService.class);

    private final KubernetesClient client;
    private final int maxConflictRetries;

    public KubernetesFencingService(KubernetesClient client, int maxConflictRetries) {
        Preconditions.checkArgument(maxConflictRetries > 0, "maxConflictRetries must be positive");
        this.client = client;
        this.maxConflictRetries = maxConflictRetries;
    }

    @Override
    public boolean requestFence(String namespace, String clusterName, String podName) {
        try {
            return applyFenceFunction(
                    namespace,
                    clusterName,
                    current -> FencingUtils.addFencedInstance(clusterName, current, podName));
        } catch (AlreadyFencedException e) {
            LOG.debug("Pod {} of cluster {} is already fenced", podName, clusterName);
            return false;
        }
    }

    @Override
    public boolean requestUnfence(String namespace, String clusterName, String podName) {
        return applyFenceFunction(
                namespace,
                clusterName,
                current -> FencingUtils.removeFencedInstance(clusterName, current, podName));
    }

    @Override
    public boolean isFencedInEffect(String namespace, String podName) {
        var pod = client.pods().inNamespace(namespace).withName(podName).get();
        if (pod == null) {
            throw new IllegalStateException(
                    String.format("Pod %s not found in namespace %s", podName, namespace));
        }
        return !PodUtils.isPodReady(pod);
    }

    private boolean applyFenceFunction(
            String namespace, String clusterName, UnaryOperator<FencedInstances> fenceFunction) {
        KubernetesClientException lastConflict = null;
        for (int attempt = 1; attempt <= maxConflictRetries; attempt++) {
            var clusterResource =
                    client.resources(PostgresCluster.class)
                            .inNamespace(namespace)
                            .withName(clusterName);
            var cluster = clusterResource.get();
            if (cluster == null) {
                throw new IllegalStateException(
                        String.format(
                                "Cluster %s not found in namespace %s", clusterName, namespace));
            }

            var current = FencingUtils.getFencedInstances(cluster.getMetadata());
            var updated = fenceFunction.apply(current);
            if (updated.equals(current)) {
                return false;
            }

            FencingUtils.setFencedInstances(cluster.getMetadata(), updated);
            try {
                client.resources(PostgresCluster.class)
                        .inNamespace(namespace)
                        .resource(cluster)
                        .update();
                LOG.info(
                        "Fenced instances of cluster {} changed from {} to {}",
                        clusterName,
                        current,
                        updated);
                return true;
            } catch (KubernetesClientException e) {
                if (e.getCode() != HttpURLConnection.HTTP_CONFLICT) {
                    throw e;
                }
                LOG.debug(
                        "Cluster {} was modified concurrently, retrying ({}/{})",
                        clusterName,
                        attempt,
                        maxConflictRetries);
                lastConflict = e;
            }
        }
        LOG.warn(
                "Could not update the fenced instances of cluster {} after {} attempts",
                clusterName,
                maxConflictRetries);
        throw lastConflict;
    }
}
