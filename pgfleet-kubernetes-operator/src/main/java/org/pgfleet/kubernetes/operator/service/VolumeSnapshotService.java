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

import org.pgfleet.kubernetes.operator.api.PostgresBackup;
import org.pgfleet.kubernetes.operator.api.PostgresCluster;

import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.volumesnapshot.api.model.VolumeSnapshot;

import java.util.List;

/** Creates and lists the VolumeSnapshot resources of a backup. */
public interface VolumeSnapshotService {

    /**
     * Creates one VolumeSnapshot for every given volume of the target pod. The snapshots share
     * the same name suffix and are labelled with the name of the backup.
     *
     * @return the created snapshots
     */
    List<VolumeSnapshot> createSnapshotSet(
            PostgresCluster cluster,
            PostgresBackup backup,
            Pod targetPod,
            List<PersistentVolumeClaim> pvcs);

    /** The snapshots already created for the backup, possibly none. */
    List<VolumeSnapshot> listSnapshotsForBackup(String namespace, String backupName);
}
