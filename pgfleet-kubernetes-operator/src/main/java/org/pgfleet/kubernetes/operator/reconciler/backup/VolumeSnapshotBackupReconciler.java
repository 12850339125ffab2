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

package org.pgfleet.kubernetes.operator.reconciler.backup;

import org.pgfleet.kubernetes.operator.api.PostgresBackup;
import org.pgfleet.kubernetes.operator.api.PostgresCluster;
import org.pgfleet.kubernetes.operator.exception.ConflictingFenceStateException;
import org.pgfleet.kubernetes.operator.exception.VolumeSnapshotFailedException;
import org.pgfleet.kubernetes.operator.service.FencingService;
import org.pgfleet.kubernetes.operator.service.VolumeSnapshotService;
import org.pgfleet.kubernetes.operator.utils.EventRecorder;
import org.pgfleet.kubernetes.operator.utils.VolumeSnapshotInfo;
import org.pgfleet.kubernetes.operator.utils.VolumeSnapshotUtils;

import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.volumesnapshot.api.model.VolumeSnapshot;
import io.fabric8.volumesnapshot.api.model.VolumeSnapshotSource;
import io.fabric8.volumesnapshot.api.model.VolumeSnapshotSpec;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Takes a backup of an instance as a set of VolumeSnapshots, one for each of its volumes.
 *
 * <p>The backup goes through these steps:
 *
 * <ol>
 *   <li>the target instance is fenced, when configured to do so, and the execution is requeued
 *       until the instance stops being ready;
 *   <li>one VolumeSnapshot is created for every volume, unless the snapshots of the backup
 *       already exist;
 *   <li>the execution is requeued until every snapshot is ready to use, a volume left without
 *       a snapshot fails the backup;
 *   <li>the target instance is unfenced.
 * </ol>
 *
 * <p>Nothing is kept between executions: every call derives the current step from the fencing
 * annotation of the cluster, the readiness of the pod and the existing snapshots. Calling
 * {@link #execute} again after a requeue, a crash or a restart of the operator resumes the
 * backup where it stopped.
 */
@RequiredArgsConstructor
public class VolumeSnapshotBackupReconciler {

    private static final Logger LOG =
            LoggerFactory.getLogger(VolumeSnapshotBackupReconciler.class);

    private final FencingService fencingService;
    private final VolumeSnapshotService volumeSnapshotService;
    private final EventRecorder eventRecorder;
    private final KubernetesClient kubernetesClient;
    private final VolumeSnapshotBackupConfig config;

    /**
     * Runs the next step of the backup.
     *
     * @param cluster cluster being backed up
     * @param backup the backup
     * @param targetPod instance to snapshot
     * @param pvcs volumes of the target instance
     * @return done, or the delay after which the backup must be executed again
     * @throws ConflictingFenceStateException if another instance of the cluster is fenced
     * @throws VolumeSnapshotFailedException if the storage provider failed to take a snapshot
     */
    public ReconcileResult execute(
            PostgresCluster cluster,
            PostgresBackup backup,
            Pod targetPod,
            List<PersistentVolumeClaim> pvcs) {
        var namespace = cluster.getMetadata().getNamespace();
        var clusterName = cluster.getMetadata().getName();
        var podName = targetPod.getMetadata().getName();

        if (config.isFence()) {
            ensurePodIsFenced(backup, namespace, clusterName, podName);
            if (!fencingService.isFencedInEffect(namespace, podName)) {
                LOG.info("Waiting for pod {} to be fenced, retrying", podName);
                return ReconcileResult.requeueAfter(config.getRequeueDelay());
            }
        }

        var snapshots =
                volumeSnapshotService.listSnapshotsForBackup(
                        namespace, backup.getMetadata().getName());
        if (snapshots.isEmpty()) {
            // existing snapshots mean that they were created by a previous execution
            for (var pvc : pvcs) {
                recordEvent(
                        backup,
                        EventRecorder.Reason.CreateSnapshot,
                        EventRecorder.Component.Snapshot,
                        "Creating VolumeSnapshot for PVC " + pvc.getMetadata().getName());
            }
            snapshots = volumeSnapshotService.createSnapshotSet(cluster, backup, targetPod, pvcs);
            if (!snapshots.isEmpty()) {
                return ReconcileResult.requeueAfter(config.getRequeueDelay());
            }
            LOG.info("Pod {} has no volumes, nothing to snapshot", podName);
        }

        var failed = findFailedSnapshot(snapshots);
        if (failed.isPresent()) {
            if (config.isFence()) {
                unfenceAfterFailure(backup, namespace, clusterName, podName);
            }
            throw new VolumeSnapshotFailedException(
                    failed.get().getName(), failed.get().getFailureReason());
        }

        var missing = findVolumesWithoutSnapshot(pvcs, snapshots);
        if (!missing.isEmpty()) {
            LOG.warn(
                    "Backup {} has {} VolumeSnapshots for {} volumes, missing {}",
                    backup.getMetadata().getName(),
                    snapshots.size(),
                    pvcs.size(),
                    missing);
            if (config.isFence()) {
                unfenceAfterFailure(backup, namespace, clusterName, podName);
            }
            throw new VolumeSnapshotFailedException(
                    backup.getMetadata().getName(),
                    "no VolumeSnapshot was created for PVCs " + missing);
        }

        var pending = findPendingSnapshot(snapshots);
        if (pending.isPresent()) {
            LOG.info(
                    "Waiting for VolumeSnapshot {} to be ready to use, retrying",
                    pending.get().getName());
            return ReconcileResult.requeueAfter(config.getRequeueDelay());
        }

        if (config.isFence()) {
            ensurePodIsUnfenced(backup, namespace, clusterName, podName);
        }
        return ReconcileResult.done(snapshots);
    }

    private void ensurePodIsFenced(
            PostgresBackup backup, String namespace, String clusterName, String podName) {
        if (fencingService.requestFence(namespace, clusterName, podName)) {
            recordEvent(
                    backup,
                    EventRecorder.Reason.FencePod,
                    EventRecorder.Component.Fencing,
                    "Requested fencing for Pod " + podName);
        }
    }

    private void ensurePodIsUnfenced(
            PostgresBackup backup, String namespace, String clusterName, String podName) {
        LOG.info("Unfencing pod {}", podName);
        fencingService.requestUnfence(namespace, clusterName, podName);
        recordEvent(
                backup,
                EventRecorder.Reason.UnfencePod,
                EventRecorder.Component.Fencing,
                "Un-fencing Pod " + podName);
    }

    /** Events only inform users, a failure to record one never changes the backup outcome. */
    private void recordEvent(
            PostgresBackup backup,
            EventRecorder.Reason reason,
            EventRecorder.Component component,
            String message) {
        try {
            eventRecorder.triggerEvent(
                    backup,
                    EventRecorder.Type.Normal,
                    reason,
                    component,
                    message,
                    kubernetesClient);
        } catch (KubernetesClientException e) {
            LOG.warn(
                    "Could not record {} event for backup {}",
                    reason,
                    backup.getMetadata().getName(),
                    e);
        }
    }

    private void unfenceAfterFailure(
            PostgresBackup backup, String namespace, String clusterName, String podName) {
        try {
            ensurePodIsUnfenced(backup, namespace, clusterName, podName);
        } catch (RuntimeException e) {
            // the snapshot failure is what gets reported
            LOG.error(
                    "Could not unfence pod {} after a failed VolumeSnapshot, the pod is still fenced",
                    podName,
                    e);
        }
    }

    private static Optional<VolumeSnapshotInfo> findFailedSnapshot(
            List<VolumeSnapshot> snapshots) {
        return snapshots.stream()
                .map(VolumeSnapshotUtils::classify)
                .filter(VolumeSnapshotInfo::isFailed)
                .findFirst();
    }

    /** Snapshots are created one by one, an interrupted creation leaves some volumes out. */
    private static List<String> findVolumesWithoutSnapshot(
            List<PersistentVolumeClaim> pvcs, List<VolumeSnapshot> snapshots) {
        var snapshotted =
                snapshots.stream()
                        .map(VolumeSnapshot::getSpec)
                        .filter(Objects::nonNull)
                        .map(VolumeSnapshotSpec::getSource)
                        .filter(Objects::nonNull)
                        .map(VolumeSnapshotSource::getPersistentVolumeClaimName)
                        .collect(Collectors.toSet());
        return pvcs.stream()
                .map(pvc -> pvc.getMetadata().getName())
                .filter(name -> !snapshotted.contains(name))
                .sorted()
                .collect(Collectors.toList());
    }

    private static Optional<VolumeSnapshotInfo> findPendingSnapshot(
            List<VolumeSnapshot> snapshots) {
        return snapshots.stream()
                .map(VolumeSnapshotUtils::classify)
                .filter(VolumeSnapshotInfo::isPending)
                .findFirst();
    }
}
