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
import org.pgfleet.kubernetes.operator.api.spec.VolumeSnapshotConfiguration;
import org.pgfleet.kubernetes.operator.api.status.BackupSnapshotStatus;

import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.volumesnapshot.api.model.VolumeSnapshot;
import org.apache.commons.lang3.StringUtils;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/** Volume snapshot utilities. */
public class VolumeSnapshotUtils {

    public static String getSnapshotName(String pvcName, String snapshotSuffix) {
        return pvcName + "-" + snapshotSuffix;
    }

    /**
     * Interprets the status reported by the storage provider. A contradictory or incomplete
     * ready status is reported as failed, a snapshot stuck in such a state would be polled
     * forever otherwise.
     */
    public static VolumeSnapshotInfo classify(VolumeSnapshot snapshot) {
        var name = snapshot.getMetadata().getName();
        var status = snapshot.getStatus();
        if (status == null) {
            return VolumeSnapshotInfo.pending(name);
        }

        var error = status.getError();
        boolean hasError = error != null && StringUtils.isNotEmpty(error.getMessage());
        boolean readyToUse = Boolean.TRUE.equals(status.getReadyToUse());

        if (readyToUse && hasError) {
            return VolumeSnapshotInfo.failed(
                    name,
                    "malformed status: snapshot is ready to use but reports error "
                            + error.getMessage());
        }
        if (hasError) {
            return VolumeSnapshotInfo.failed(name, error.getMessage());
        }
        if (!readyToUse) {
            return VolumeSnapshotInfo.pending(name);
        }
        if (StringUtils.isEmpty(status.getCreationTime())) {
            return VolumeSnapshotInfo.failed(
                    name, "malformed status: snapshot is ready to use but has no creation time");
        }
        return VolumeSnapshotInfo.ready(name);
    }

    /**
     * VolumeSnapshotClass for the given volume: the WAL class for WAL volumes when one is set,
     * otherwise the default class, if any.
     */
    public static Optional<String> getSnapshotClassName(
            VolumeSnapshotConfiguration config, PersistentVolumeClaim pvc) {
        if (CrdConstants.PVC_ROLE_PG_WAL.equals(getPvcRole(pvc.getMetadata().getLabels()))
                && StringUtils.isNotEmpty(config.getWalClassName())) {
            return Optional.of(config.getWalClassName());
        }
        return Optional.ofNullable(StringUtils.trimToNull(config.getClassName()));
    }

    /** Copies {@code base} and puts every entry of {@code overrides} over it. */
    public static Map<String, String> merge(
            Map<String, String> base, Map<String, String> overrides) {
        var merged = base == null ? new HashMap<String, String>() : new HashMap<>(base);
        if (overrides != null) {
            merged.putAll(overrides);
        }
        return merged;
    }

    /** Status elements describing the given snapshots, sorted by name. */
    public static List<BackupSnapshotStatus.Element> toStatusElements(
            List<VolumeSnapshot> snapshots) {
        return snapshots.stream()
                .sorted(Comparator.comparing(s -> s.getMetadata().getName()))
                .map(
                        s ->
                                BackupSnapshotStatus.Element.builder()
                                        .name(s.getMetadata().getName())
                                        .type(getPvcRole(s.getMetadata().getLabels()))
                                        .build())
                .collect(Collectors.toList());
    }

    private static String getPvcRole(Map<String, String> labels) {
        if (labels == null) {
            return CrdConstants.PVC_ROLE_PG_DATA;
        }
        return labels.getOrDefault(CrdConstants.LABEL_PVC_ROLE, CrdConstants.PVC_ROLE_PG_DATA);
    }
}
