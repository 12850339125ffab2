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

package org.pgfleet.kubernetes.operator.controller;

import org.pgfleet.kubernetes.operator.api.CrdConstants;
import org.pgfleet.kubernetes.operator.api.PostgresBackup;
import org.pgfleet.kubernetes.operator.api.PostgresCluster;
import org.pgfleet.kubernetes.operator.api.status.PostgresBackupStatus;

import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.Volume;
import io.fabric8.kubernetes.client.KubernetesClient;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Context for reconciling a {@link PostgresBackup}. */
@Getter
public class PostgresBackupContext {

    private final PostgresBackup resource;
    private final KubernetesClient kubernetesClient;
    private final PostgresBackupStatus originalStatus;

    private PostgresCluster cluster;

    public PostgresBackupContext(PostgresBackup resource, KubernetesClient kubernetesClient) {
        this.resource = resource;
        this.kubernetesClient = kubernetesClient;
        if (resource.getStatus() == null) {
            resource.setStatus(new PostgresBackupStatus());
        }
        this.originalStatus = resource.getStatus().toBuilder().build();
    }

    public String getNamespace() {
        return resource.getMetadata().getNamespace();
    }

    public String getClusterName() {
        var clusterRef = resource.getSpec().getCluster();
        return clusterRef == null ? null : clusterRef.getName();
    }

    /** The backed up cluster, null if it doesn't exist. */
    public PostgresCluster getCluster() {
        if (cluster == null && getClusterName() != null) {
            cluster =
                    kubernetesClient
                            .resources(PostgresCluster.class)
                            .inNamespace(getNamespace())
                            .withName(getClusterName())
                            .get();
        }
        return cluster;
    }

    public List<Pod> getInstancePods() {
        return kubernetesClient
                .pods()
                .inNamespace(getNamespace())
                .withLabel(CrdConstants.LABEL_CLUSTER, getClusterName())
                .list()
                .getItems();
    }

    public Pod getPod(String podName) {
        return kubernetesClient.pods().inNamespace(getNamespace()).withName(podName).get();
    }

    /** The PVCs mounted by the pod. */
    public List<PersistentVolumeClaim> getPersistentVolumeClaims(Pod pod) {
        var pvcs = new ArrayList<PersistentVolumeClaim>();
        if (pod.getSpec() == null || pod.getSpec().getVolumes() == null) {
            return pvcs;
        }
        for (Volume volume : pod.getSpec().getVolumes()) {
            if (volume.getPersistentVolumeClaim() == null) {
                continue;
            }
            var claimName = volume.getPersistentVolumeClaim().getClaimName();
            var pvc =
                    kubernetesClient
                            .persistentVolumeClaims()
                            .inNamespace(getNamespace())
                            .withName(claimName)
                            .get();
            pvcs.add(
                    Objects.requireNonNull(
                            pvc, "PersistentVolumeClaim " + claimName + " not found"));
        }
        return pvcs;
    }

    public boolean isStatusChanged() {
        return !originalStatus.equals(resource.getStatus());
    }
}
