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

package org.pgfleet.kubernetes.operator;

import org.pgfleet.kubernetes.operator.api.CrdConstants;
import org.pgfleet.kubernetes.operator.api.PostgresBackup;
import org.pgfleet.kubernetes.operator.api.PostgresCluster;
import org.pgfleet.kubernetes.operator.service.VolumeSnapshotService;

import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.volumesnapshot.api.model.VolumeSnapshot;
import io.fabric8.volumesnapshot.api.model.VolumeSnapshotBuilder;
import io.fabric8.volumesnapshot.api.model.VolumeSnapshotStatusBuilder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** In-memory {@link VolumeSnapshotService}, snapshots stay pending until told otherwise. */
public class TestingVolumeSnapshotService implements VolumeSnapshotService {

    private final Map<String, List<VolumeSnapshot>> snapshotsByBackup = new HashMap<>();

    @Getter private int createdSnapshots;
    @Getter private int listRequests;

    private long suffix = 1700000000L;

    @Override
    public List<VolumeSnapshot> createSnapshotSet(
            PostgresCluster cluster,
            PostgresBackup backup,
            Pod targetPod,
            List<PersistentVolumeClaim> pvcs) {
        var backupName = backup.getMetadata().getName();
        var created = new ArrayList<VolumeSnapshot>();
        for (var pvc : pvcs) {
            var labels = new HashMap<>(pvc.getMetadata().getLabels());
            labels.put(CrdConstants.LABEL_BACKUP_NAME, backupName);
            created.add(
                    new VolumeSnapshotBuilder()
                            .withNewMetadata()
                            .withName(pvc.getMetadata().getName() + "-" + suffix)
                            .withNamespace(pvc.getMetadata().getNamespace())
                            .withLabels(labels)
                            .endMetadata()
                            .withNewSpec()
                            .withNewSource()
                            .withPersistentVolumeClaimName(pvc.getMetadata().getName())
                            .endSource()
                            .endSpec()
                            .build());
        }
        suffix++;
        createdSnapshots += created.size();
        snapshotsByBackup.computeIfAbsent(backupName, k -> new ArrayList<>()).addAll(created);
        return created;
    }

    @Override
    public List<VolumeSnapshot> listSnapshotsForBackup(String namespace, String backupName) {
        listRequests++;
        return new ArrayList<>(snapshotsByBackup.getOrDefault(backupName, List.of()));
    }

    public void markAllReady(String backupName) {
        snapshotsByBackup
                .getOrDefault(backupName, List.of())
                .forEach(
                        s ->
                                s.setStatus(
                                        new VolumeSnapshotStatusBuilder()
                                                .withReadyToUse(true)
                                                .withCreationTime("2024-01-01T00:00:00Z")
                                                .build()));
    }

    public void markFailed(String backupName, String snapshotName, String message) {
        snapshotsByBackup.getOrDefault(backupName, List.of()).stream()
                .filter(s -> s.getMetadata().getName().equals(snapshotName))
                .forEach(
                        s ->
                                s.setStatus(
                                        new VolumeSnapshotStatusBuilder()
                                                .withReadyToUse(false)
                                                .withNewError()
                                                .withMessage(message)
                                                .endError()
                                                .build()));
    }

    public List<VolumeSnapshot> getSnapshots(String backupName) {
        return snapshotsByBackup.getOrDefault(backupName, List.of());
    }
}
