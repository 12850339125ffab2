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

import org.pgfleet.kubernetes.operator.config.PgFleetOperatorConfigOptions;
import org.pgfleet.kubernetes.operator.config.PgFleetOperatorConfiguration;

import lombok.Value;
import lombok.With;

import java.time.Duration;

/** Settings of a {@link VolumeSnapshotBackupReconciler}. */
@Value
@With
public class VolumeSnapshotBackupConfig {

    public static final Duration DEFAULT_REQUEUE_DELAY =
            PgFleetOperatorConfigOptions.BACKUP_SNAPSHOT_REQUEUE_DELAY.defaultValue();

    public static final VolumeSnapshotBackupConfig DEFAULT =
            new VolumeSnapshotBackupConfig(true, DEFAULT_REQUEUE_DELAY);

    /** Whether the target instance is fenced while its volumes are snapshotted. */
    boolean fence;

    /** Delay before checking again an instance being fenced or snapshots being taken. */
    Duration requeueDelay;

    public static VolumeSnapshotBackupConfig fromOperatorConfiguration(
            PgFleetOperatorConfiguration operatorConfiguration, boolean fence) {
        return new VolumeSnapshotBackupConfig(
                fence, operatorConfiguration.getSnapshotRequeueDelay());
    }
}
