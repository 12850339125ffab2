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

import org.apache.flink.annotation.VisibleForTesting;

import org.pgfleet.kubernetes.operator.api.CrdConstants;
import org.pgfleet.kubernetes.operator.api.PostgresBackup;
import org.pgfleet.kubernetes.operator.api.PostgresCluster;
import org.pgfleet.kubernetes.operator.api.spec.SnapshotOwnerReference;
import org.pgfleet.kubernetes.operator.api.spec.VolumeSnapshotConfiguration;
import org.pgfleet.kubernetes.operator.api.utils.PostgresClusterUtils;
import org.pgfleet.kubernetes.operator.exception.PreconditionFailedException;
import org.pgfleet.kubernetes.operator.exception.ReconciliationException;
import org.pgfleet.kubernetes.operator.utils.VolumeSnapshotUtils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.volumesnapshot.api.model.VolumeSnapshot;
import io.fabric8.volumesnapshot.api.model.VolumeSnapshotBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/** {@link VolumeSnapshotService} backed by the VolumeSnapshot API of Kubernetes. */
public class KubernetesVolumeSnapshotService implements VolumeSnapshotService {

    private static final Logger LOG =
            LoggerFactory.getLogger(KubernetesVolumeSnapshotService.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final KubernetesClient client;
    private final InstanceStatusClient instanceStatusClient;
    private final Clock clock;

    public KubernetesVolumeSnapshotService(
            KubernetesClient client, InstanceStatusClient instanceStatusClient) {
        this(client, instanceStatusClient, Clock.systemDefaultZone());
    }

    @VisibleForTesting
    KubernetesVolumeSnapshotService(
            KubernetesClient client, InstanceStatusClient instanceStatusClient, Clock clock) {
        this.client = client;
        this.instanceStatusClient = instanceStatusClient;
        this.clock = clock;
    }

    @Override
    public List<VolumeSnapshot> createSnapshotSet(
            PostgresCluster cluster,
            PostgresBackup backup,
            Pod targetPod,
            List<PersistentVolumeClaim> pvcs) {
        var config =
                PostgresClusterUtils.getVolumeSnapshotConfiguration(cluster)
                        .orElseThrow(
                                () ->
                                        new PreconditionFailedException(
                                                "Cluster "
                                                        + cluster.getMetadata().getName()
                                                        + " has no volume snapshot configuration"));
        var snapshotSuffix = String.valueOf(clock.instant().getEpochSecond());

        var created = new ArrayList<VolumeSnapshot>();
        for (var pvc : pvcs) {
            var snapshot = buildSnapshot(cluster, backup, targetPod, pvc, config, snapshotSuffix);
            LOG.info(
                    "Creating VolumeSnapshot {} for PVC {}",
                    snapshot.getMetadata().getName(),
                    pvc.getMetadata().getName());
            created.add(client.resource(snapshot).create());
        }
        return created;
    }

    @Override
    public List<VolumeSnapshot> listSnapshotsForBackup(String namespace, String backupName) {
        return client.resources(VolumeSnapshot.class)
                .inNamespace(namespace)
                .withLabel(CrdConstants.LABEL_BACKUP_NAME, backupName)
                .list()
                .getItems();
    }

    @VisibleForTesting
    VolumeSnapshot buildSnapshot(
            PostgresCluster cluster,
            PostgresBackup backup,
            Pod targetPod,
            PersistentVolumeClaim pvc,
            VolumeSnapshotConfiguration config,
            String snapshotSuffix) {
        var pvcName = pvc.getMetadata().getName();
        var labels = VolumeSnapshotUtils.merge(pvc.getMetadata().getLabels(), config.getLabels());
        var annotations =
                VolumeSnapshotUtils.merge(
                        pvc.getMetadata().getAnnotations(), config.getAnnotations());

        var snapshot =
                new VolumeSnapshotBuilder()
                        .withNewMetadata()
                        .withName(VolumeSnapshotUtils.getSnapshotName(pvcName, snapshotSuffix))
                        .withNamespace(pvc.getMetadata().getNamespace())
                        .withLabels(labels)
                        .withAnnotations(annotations)
                        .endMetadata()
                        .withNewSpec()
                        .withNewSource()
                        .withPersistentVolumeClaimName(pvcName)
                        .endSource()
                        .withVolumeSnapshotClassName(
                                VolumeSnapshotUtils.getSnapshotClassName(config, pvc).orElse(null))
                        .endSpec()
                        .build();

        enrichSnapshot(snapshot, cluster, backup, targetPod, config);
        return snapshot;
    }

    private void enrichSnapshot(
            VolumeSnapshot snapshot,
            PostgresCluster cluster,
            PostgresBackup backup,
            Pod targetPod,
            VolumeSnapshotConfiguration config) {
        var meta = snapshot.getMetadata();
        meta.getLabels().put(CrdConstants.LABEL_BACKUP_NAME, backup.getMetadata().getName());

        var ownerReference = config.getSnapshotOwnerReference();
        if (ownerReference == SnapshotOwnerReference.CLUSTER) {
            setInheritedData(meta, cluster);
            setOwner(meta, cluster);
        } else if (ownerReference == SnapshotOwnerReference.BACKUP) {
            setOwner(meta, backup);
        }

        // taken just before the snapshot is created
        try {
            meta.getAnnotations()
                    .put(
                            CrdConstants.ANNOTATION_PG_CONTROLDATA,
                            instanceStatusClient.getPgControlData(targetPod));
        } catch (IOException e) {
            LOG.warn(
                    "Could not get pg_controldata from pod {}, creating VolumeSnapshot {} without it",
                    targetPod.getMetadata().getName(),
                    meta.getName(),
                    e);
        }

        try {
            meta.getAnnotations()
                    .put(
                            CrdConstants.ANNOTATION_CLUSTER_MANIFEST,
                            MAPPER.writeValueAsString(cluster));
        } catch (JsonProcessingException e) {
            throw new ReconciliationException(e);
        }
    }

    private static void setInheritedData(ObjectMeta meta, PostgresCluster cluster) {
        var inherited = cluster.getSpec().getInheritedMetadata();
        if (inherited == null) {
            return;
        }
        if (inherited.getLabels() != null) {
            meta.getLabels().putAll(inherited.getLabels());
        }
        if (inherited.getAnnotations() != null) {
            meta.getAnnotations().putAll(inherited.getAnnotations());
        }
    }

    private static void setOwner(ObjectMeta meta, HasMetadata owner) {
        OwnerReference ownerReference =
                new OwnerReferenceBuilder()
                        .withApiVersion(owner.getApiVersion())
                        .withKind(owner.getKind())
                        .withName(owner.getMetadata().getName())
                        .withUid(owner.getMetadata().getUid())
                        .withController(true)
                        .build();
        var ownerReferences = new ArrayList<OwnerReference>();
        ownerReferences.add(ownerReference);
        meta.setOwnerReferences(ownerReferences);
    }
}
