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

import org.pgfleet.kubernetes.operator.TestUtils;
import org.pgfleet.kubernetes.operator.TestingFencingService;
import org.pgfleet.kubernetes.operator.TestingVolumeSnapshotService;
import org.pgfleet.kubernetes.operator.api.CrdConstants;
import org.pgfleet.kubernetes.operator.api.PostgresBackup;
import org.pgfleet.kubernetes.operator.api.PostgresCluster;
import org.pgfleet.kubernetes.operator.exception.ConflictingFenceStateException;
import org.pgfleet.kubernetes.operator.exception.VolumeSnapshotFailedException;
import org.pgfleet.kubernetes.operator.utils.BackupEventCollector;
import org.pgfleet.kubernetes.operator.utils.EventRecorder;
import org.pgfleet.kubernetes.operator.utils.FencedInstances;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.fabric8.kubernetes.client.server.mock.KubernetesMockServer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.pgfleet.kubernetes.operator.TestUtils.STANDBY_POD;
import static org.pgfleet.kubernetes.operator.TestUtils.TEST_BACKUP_NAME;
import static org.pgfleet.kubernetes.operator.TestUtils.TEST_CLUSTER_NAME;

/** Tests for {@link VolumeSnapshotBackupReconciler}. */
@EnableKubernetesMockClient(crud = true)
public class VolumeSnapshotBackupReconcilerTest {

    private static final Duration REQUEUE_DELAY = Duration.ofSeconds(7);

    private KubernetesMockServer mockServer;
    private KubernetesClient kubernetesClient;

    private TestingFencingService fencingService;
    private TestingVolumeSnapshotService snapshotService;
    private BackupEventCollector eventCollector;

    private PostgresCluster cluster;
    private PostgresBackup backup;
    private Pod pod;
    private List<PersistentVolumeClaim> pvcs;

    @BeforeEach
    public void setup() {
        fencingService = new TestingFencingService();
        snapshotService = new TestingVolumeSnapshotService();
        eventCollector = new BackupEventCollector();

        cluster = TestUtils.buildCluster();
        backup = TestUtils.buildBackup();
        pod = TestUtils.buildPod(STANDBY_POD, true);
        pvcs =
                List.of(
                        TestUtils.buildPvc(STANDBY_POD, CrdConstants.PVC_ROLE_PG_DATA),
                        TestUtils.buildPvc(STANDBY_POD + "-wal", CrdConstants.PVC_ROLE_PG_WAL));
        fencingService.setPodReady(STANDBY_POD, true);
    }

    @Test
    public void testColdBackup() {
        var reconciler = reconciler(true);

        var result = reconciler.execute(cluster, backup, pod, pvcs);
        assertThat(result.isDone()).isFalse();
        assertThat(result.getRequeueDelay()).contains(REQUEUE_DELAY);
        assertThat(fencingService.getFencedInstances(TEST_CLUSTER_NAME).toList())
                .containsExactly(STANDBY_POD);
        assertThat(snapshotService.getCreatedSnapshots()).isEqualTo(2);

        // snapshots still being taken
        result = reconciler.execute(cluster, backup, pod, pvcs);
        assertThat(result.isDone()).isFalse();
        assertThat(snapshotService.getCreatedSnapshots()).isEqualTo(2);
        assertThat(fencingService.getFencedInstances(TEST_CLUSTER_NAME).toList())
                .containsExactly(STANDBY_POD);

        snapshotService.markAllReady(TEST_BACKUP_NAME);
        result = reconciler.execute(cluster, backup, pod, pvcs);
        assertThat(result.isDone()).isTrue();
        assertThat(result.getSnapshots()).hasSize(2);
        assertThat(snapshotService.getCreatedSnapshots()).isEqualTo(2);
        assertThat(fencingService.getFencedInstances(TEST_CLUSTER_NAME).isEmpty()).isTrue();
        assertThat(fencingService.isFencedInEffect(TestUtils.TEST_NAMESPACE, STANDBY_POD))
                .isFalse();

        assertThat(eventCollector.getReasons())
                .containsExactly(
                        EventRecorder.Reason.FencePod.name(),
                        EventRecorder.Reason.CreateSnapshot.name(),
                        EventRecorder.Reason.CreateSnapshot.name(),
                        EventRecorder.Reason.UnfencePod.name());
    }

    @Test
    public void testWaitForFencingToTakeEffect() {
        fencingService.setStopPodsWhenFenced(false);
        var reconciler = reconciler(true);

        var result = reconciler.execute(cluster, backup, pod, pvcs);
        assertThat(result.getRequeueDelay()).contains(REQUEUE_DELAY);
        assertThat(snapshotService.getListRequests()).isZero();
        assertThat(snapshotService.getCreatedSnapshots()).isZero();

        fencingService.setPodReady(STANDBY_POD, false);
        result = reconciler.execute(cluster, backup, pod, pvcs);
        assertThat(result.isDone()).isFalse();
        assertThat(snapshotService.getCreatedSnapshots()).isEqualTo(2);
        assertThat(fencingService.getFenceRequests()).isEqualTo(2);
        assertThat(eventCollector.getReasons())
                .containsOnlyOnce(EventRecorder.Reason.FencePod.name());
    }

    @Test
    public void testResumesWithoutDuplicatingSnapshots() {
        reconciler(true).execute(cluster, backup, pod, pvcs);

        // a new reconciler, as after an operator restart
        var result = reconciler(true).execute(cluster, backup, pod, pvcs);
        assertThat(result.isDone()).isFalse();
        assertThat(snapshotService.getCreatedSnapshots()).isEqualTo(2);
        assertThat(snapshotService.getSnapshots(TEST_BACKUP_NAME)).hasSize(2);
    }

    @Test
    public void testOnlineBackup() {
        var reconciler = reconciler(false);

        var result = reconciler.execute(cluster, backup, pod, pvcs);
        assertThat(result.isDone()).isFalse();
        snapshotService.markAllReady(TEST_BACKUP_NAME);
        result = reconciler.execute(cluster, backup, pod, pvcs);
        assertThat(result.isDone()).isTrue();

        assertThat(fencingService.getFenceRequests()).isZero();
        assertThat(fencingService.getUnfenceRequests()).isZero();
        assertThat(eventCollector.getReasons())
                .doesNotContain(
                        EventRecorder.Reason.FencePod.name(),
                        EventRecorder.Reason.UnfencePod.name());
    }

    @Test
    public void testOnlineBackupOfFencedCluster() {
        fencingService.setFencedInstances(
                TEST_CLUSTER_NAME, FencedInstances.of(List.of(CrdConstants.FENCE_ALL_INSTANCES)));
        var reconciler = reconciler(false);

        reconciler.execute(cluster, backup, pod, pvcs);
        snapshotService.markAllReady(TEST_BACKUP_NAME);
        assertThat(reconciler.execute(cluster, backup, pod, pvcs).isDone()).isTrue();
        assertThat(fencingService.getFencedInstances(TEST_CLUSTER_NAME).isFenceAll()).isTrue();
    }

    @Test
    public void testNoVolumes() {
        var result = reconciler(true).execute(cluster, backup, pod, List.of());
        assertThat(result.isDone()).isTrue();
        assertThat(result.getSnapshots()).isEmpty();
        assertThat(fencingService.getFencedInstances(TEST_CLUSTER_NAME).isEmpty()).isTrue();
    }

    @Test
    public void testFailedSnapshotUnfencesOnce() {
        var reconciler = reconciler(true);
        reconciler.execute(cluster, backup, pod, pvcs);
        var snapshotName = getSnapshotName(1);
        snapshotService.markFailed(TEST_BACKUP_NAME, snapshotName, "disk quota exceeded");

        assertThatThrownBy(() -> reconciler.execute(cluster, backup, pod, pvcs))
                .isInstanceOfSatisfying(
                        VolumeSnapshotFailedException.class,
                        e -> {
                            assertThat(e.getSnapshotName()).isEqualTo(snapshotName);
                            assertThat(e.getMessage()).contains("disk quota exceeded");
                        });
        assertThat(fencingService.getUnfenceRequests()).isEqualTo(1);
        assertThat(fencingService.getFencedInstances(TEST_CLUSTER_NAME).isEmpty()).isTrue();
    }

    @Test
    public void testFailedUnfenceDoesNotHideSnapshotFailure() {
        var reconciler = reconciler(true);
        reconciler.execute(cluster, backup, pod, pvcs);
        var snapshotName = getSnapshotName(0);
        snapshotService.markFailed(TEST_BACKUP_NAME, snapshotName, "broken");
        fencingService.setUnfenceFailure(new IllegalStateException("api server down"));

        assertThatThrownBy(() -> reconciler.execute(cluster, backup, pod, pvcs))
                .isInstanceOf(VolumeSnapshotFailedException.class);
        assertThat(fencingService.getUnfenceRequests()).isEqualTo(1);
    }

    @Test
    public void testFailureWinsOverPending() {
        var reconciler = reconciler(false);
        reconciler.execute(cluster, backup, pod, pvcs);
        var snapshotName = getSnapshotName(1);
        snapshotService.markFailed(TEST_BACKUP_NAME, snapshotName, "broken");

        assertThatThrownBy(() -> reconciler.execute(cluster, backup, pod, pvcs))
                .isInstanceOf(VolumeSnapshotFailedException.class);
    }

    @Test
    public void testConflictingFence() {
        fencingService.setFencedInstances(
                TEST_CLUSTER_NAME, FencedInstances.of(List.of(TestUtils.PRIMARY_POD)));

        assertThatThrownBy(() -> reconciler(true).execute(cluster, backup, pod, pvcs))
                .isInstanceOf(ConflictingFenceStateException.class);
        assertThat(snapshotService.getCreatedSnapshots()).isZero();
        assertThat(fencingService.getFencedInstances(TEST_CLUSTER_NAME).toList())
                .containsExactly(TestUtils.PRIMARY_POD);
    }

    @Test
    public void testIncompleteSnapshotSetFailsBackup() {
        var reconciler = reconciler(true);
        // an earlier execution stopped after the first snapshot was created
        fencingService.requestFence(TestUtils.TEST_NAMESPACE, TEST_CLUSTER_NAME, STANDBY_POD);
        snapshotService.createSnapshotSet(cluster, backup, pod, pvcs.subList(0, 1));
        snapshotService.markAllReady(TEST_BACKUP_NAME);

        assertThatThrownBy(() -> reconciler.execute(cluster, backup, pod, pvcs))
                .isInstanceOf(VolumeSnapshotFailedException.class)
                .hasMessageContaining(STANDBY_POD + "-wal");
        assertThat(snapshotService.getCreatedSnapshots()).isEqualTo(1);
        assertThat(fencingService.getFencedInstances(TEST_CLUSTER_NAME).isEmpty()).isTrue();
    }

    @Test
    public void testEventFailureDoesNotFailBackup() {
        var failingRecorder =
                new EventRecorder(eventCollector) {
                    @Override
                    public boolean triggerEvent(
                            HasMetadata resource,
                            Type type,
                            Reason reason,
                            Component component,
                            String message,
                            KubernetesClient client) {
                        if (reason == Reason.UnfencePod) {
                            throw new KubernetesClientException("events unavailable", 500, null);
                        }
                        return super.triggerEvent(
                                resource, type, reason, component, message, client);
                    }
                };
        var reconciler =
                new VolumeSnapshotBackupReconciler(
                        fencingService,
                        snapshotService,
                        failingRecorder,
                        kubernetesClient,
                        VolumeSnapshotBackupConfig.DEFAULT
                                .withFence(true)
                                .withRequeueDelay(REQUEUE_DELAY));

        assertThat(reconciler.execute(cluster, backup, pod, pvcs).isDone()).isFalse();
        snapshotService.markAllReady(TEST_BACKUP_NAME);

        var result = reconciler.execute(cluster, backup, pod, pvcs);
        assertThat(result.isDone()).isTrue();
        assertThat(result.getSnapshots()).hasSize(2);
        assertThat(fencingService.getUnfenceRequests()).isEqualTo(1);
        assertThat(fencingService.getFencedInstances(TEST_CLUSTER_NAME).isEmpty()).isTrue();
        assertThat(eventCollector.getReasons())
                .containsOnlyOnce(EventRecorder.Reason.FencePod.name())
                .doesNotContain(EventRecorder.Reason.UnfencePod.name());
    }

    private VolumeSnapshotBackupReconciler reconciler(boolean fence) {
        return new VolumeSnapshotBackupReconciler(
                fencingService,
                snapshotService,
                new EventRecorder(eventCollector),
                kubernetesClient,
                VolumeSnapshotBackupConfig.DEFAULT
                        .withFence(fence)
                        .withRequeueDelay(REQUEUE_DELAY));
    }

    private String getSnapshotName(int index) {
        return snapshotService.getSnapshots(TEST_BACKUP_NAME).get(index).getMetadata().getName();
    }
}
