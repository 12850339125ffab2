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

import org.apache.flink.annotation.VisibleForTesting;

import org.pgfleet.kubernetes.operator.api.PostgresBackup;
import org.pgfleet.kubernetes.operator.api.spec.BackupTarget;
import org.pgfleet.kubernetes.operator.api.spec.VolumeSnapshotConfiguration;
import org.pgfleet.kubernetes.operator.api.status.BackupPhase;
import org.pgfleet.kubernetes.operator.api.status.BackupSnapshotStatus;
import org.pgfleet.kubernetes.operator.api.status.InstanceId;
import org.pgfleet.kubernetes.operator.api.utils.PostgresClusterUtils;
import org.pgfleet.kubernetes.operator.config.PgFleetOperatorConfiguration;
import org.pgfleet.kubernetes.operator.exception.PreconditionFailedException;
import org.pgfleet.kubernetes.operator.exception.VolumeSnapshotFailedException;
import org.pgfleet.kubernetes.operator.listener.AuditUtils;
import org.pgfleet.kubernetes.operator.reconciler.backup.ReconcileResult;
import org.pgfleet.kubernetes.operator.reconciler.backup.VolumeSnapshotBackupConfig;
import org.pgfleet.kubernetes.operator.reconciler.backup.VolumeSnapshotBackupReconciler;
import org.pgfleet.kubernetes.operator.service.FencingService;
import org.pgfleet.kubernetes.operator.service.VolumeSnapshotService;
import org.pgfleet.kubernetes.operator.utils.EventRecorder;
import org.pgfleet.kubernetes.operator.utils.VolumeSnapshotUtils;

import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.ControllerConfiguration;
import io.javaoperatorsdk.operator.api.reconciler.ErrorStatusHandler;
import io.javaoperatorsdk.operator.api.reconciler.ErrorStatusUpdateControl;
import io.javaoperatorsdk.operator.api.reconciler.Reconciler;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Controller that runs the main reconcile loop for {@link PostgresBackup}. Every reconciliation
 * runs the next step of the volume snapshot backup until it completes or fails.
 */
@RequiredArgsConstructor
@ControllerConfiguration
public class PostgresBackupController
        implements Reconciler<PostgresBackup>, ErrorStatusHandler<PostgresBackup> {

    private static final Logger LOG = LoggerFactory.getLogger(PostgresBackupController.class);

    private final PgFleetOperatorConfiguration operatorConfiguration;
    private final FencingService fencingService;
    private final VolumeSnapshotService volumeSnapshotService;
    private final EventRecorder eventRecorder;

    @Override
    public UpdateControl<PostgresBackup> reconcile(
            PostgresBackup backup, Context<PostgresBackup> josdkContext) {
        return reconcile(new PostgresBackupContext(backup, josdkContext.getClient()));
    }

    @VisibleForTesting
    UpdateControl<PostgresBackup> reconcile(PostgresBackupContext ctx) {
        var backup = ctx.getResource();
        var status = backup.getStatus();
        if (status.getPhase() != null && status.getPhase().isTerminal()) {
            LOG.debug(
                    "Backup {} is {}, nothing to do",
                    backup.getMetadata().getName(),
                    status.getPhase());
            return UpdateControl.noUpdate();
        }

        var cluster = ctx.getCluster();
        if (cluster == null) {
            return markFailed(
                    ctx,
                    EventRecorder.Reason.FindingCluster,
                    "Unknown cluster " + ctx.getClusterName());
        }

        var volumeSnapshotConfig = PostgresClusterUtils.getVolumeSnapshotConfiguration(cluster);
        if (volumeSnapshotConfig.isEmpty()) {
            return markFailed(
                    ctx,
                    EventRecorder.Reason.MissingConfiguration,
                    "Cluster " + ctx.getClusterName() + " has no volume snapshot configuration");
        }

        if (status.getInstanceId() == null) {
            var target =
                    backup.getSpec().getTarget() == null
                            ? BackupTarget.PREFER_STANDBY
                            : backup.getSpec().getTarget();
            var targetPod =
                    BackupTargetSelector.selectTarget(cluster, target, ctx.getInstancePods())
                            .orElseThrow(
                                    () ->
                                            new IllegalStateException(
                                                    "No instance of cluster "
                                                            + ctx.getClusterName()
                                                            + " can be backed up"));
            var podName = targetPod.getMetadata().getName();
            status.setInstanceId(new InstanceId(podName));
            status.setStartedAt(Instant.now().toString());
            status.setPhase(BackupPhase.STARTED);
            eventRecorder.triggerEvent(
                    backup,
                    EventRecorder.Type.Normal,
                    EventRecorder.Reason.SelectedInstance,
                    EventRecorder.Component.Backup,
                    "Backing up instance " + podName,
                    ctx.getKubernetesClient());
        }

        var podName = status.getInstanceId().getPodName();
        var pod = ctx.getPod(podName);
        if (pod == null) {
            throw new IllegalStateException("Backup target pod " + podName + " not found");
        }

        ReconcileResult result;
        try {
            result =
                    createBackupReconciler(ctx, volumeSnapshotConfig.get())
                            .execute(cluster, backup, pod, ctx.getPersistentVolumeClaims(pod));
        } catch (PreconditionFailedException | VolumeSnapshotFailedException e) {
            LOG.error("Backup {} failed", backup.getMetadata().getName(), e);
            return markFailed(ctx, EventRecorder.Reason.Failed, e.getMessage());
        }

        if (!result.isDone()) {
            status.setError(null);
            return getUpdateControl(ctx, result.getRequeueAfter());
        }

        status.setBackupSnapshotStatus(
                new BackupSnapshotStatus(
                        VolumeSnapshotUtils.toStatusElements(result.getSnapshots())));
        status.setStoppedAt(Instant.now().toString());
        status.setPhase(BackupPhase.COMPLETED);
        status.setError(null);
        eventRecorder.triggerEvent(
                backup,
                EventRecorder.Type.Normal,
                EventRecorder.Reason.Completed,
                EventRecorder.Component.Backup,
                "Backup completed",
                ctx.getKubernetesClient());
        return getUpdateControl(ctx, null);
    }

    @Override
    public ErrorStatusUpdateControl<PostgresBackup> updateErrorStatus(
            PostgresBackup backup, Context<PostgresBackup> context, Exception e) {
        return updateErrorStatus(new PostgresBackupContext(backup, context.getClient()), e);
    }

    @VisibleForTesting
    ErrorStatusUpdateControl<PostgresBackup> updateErrorStatus(
            PostgresBackupContext ctx, Exception e) {
        var backup = ctx.getResource();
        LOG.warn(
                "Error while reconciling backup {}, retrying",
                backup.getMetadata().getName(),
                e);
        backup.getStatus().setError(e.getMessage());
        eventRecorder.triggerEvent(
                backup,
                EventRecorder.Type.Warning,
                EventRecorder.Reason.BackupError,
                EventRecorder.Component.Backup,
                String.valueOf(e.getMessage()),
                ctx.getKubernetesClient());
        AuditUtils.logContext(ctx.getOriginalStatus(), backup.getStatus());
        return ErrorStatusUpdateControl.patchStatus(backup);
    }

    private VolumeSnapshotBackupReconciler createBackupReconciler(
            PostgresBackupContext ctx, VolumeSnapshotConfiguration volumeSnapshotConfig) {
        var online = ctx.getResource().getSpec().getOnline();
        boolean fence = !(online != null ? online : volumeSnapshotConfig.isOnline());
        return new VolumeSnapshotBackupReconciler(
                fencingService,
                volumeSnapshotService,
                eventRecorder,
                ctx.getKubernetesClient(),
                VolumeSnapshotBackupConfig.fromOperatorConfiguration(operatorConfiguration, fence));
    }

    private UpdateControl<PostgresBackup> markFailed(
            PostgresBackupContext ctx, EventRecorder.Reason reason, String message) {
        var backup = ctx.getResource();
        var status = backup.getStatus();
        status.setPhase(BackupPhase.FAILED);
        status.setError(message);
        status.setStoppedAt(Instant.now().toString());
        eventRecorder.triggerEvent(
                backup,
                EventRecorder.Type.Warning,
                reason,
                EventRecorder.Component.Backup,
                message,
                ctx.getKubernetesClient());
        return getUpdateControl(ctx, null);
    }

    /**
     * Patches the status if it changed during the reconciliation, and reschedules the
     * reconciliation when a delay is given.
     */
    private UpdateControl<PostgresBackup> getUpdateControl(
            PostgresBackupContext ctx, Duration rescheduleAfter) {
        var backup = ctx.getResource();
        UpdateControl<PostgresBackup> updateControl;
        if (ctx.isStatusChanged()) {
            AuditUtils.logContext(ctx.getOriginalStatus(), backup.getStatus());
            updateControl = UpdateControl.patchStatus(backup);
        } else {
            updateControl = UpdateControl.noUpdate();
        }
        if (rescheduleAfter != null) {
            return updateControl.rescheduleAfter(rescheduleAfter.toMillis());
        }
        return updateControl;
    }
}
