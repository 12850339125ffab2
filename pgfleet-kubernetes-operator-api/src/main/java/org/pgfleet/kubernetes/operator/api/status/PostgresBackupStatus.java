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

package org.pgfleet.kubernetes.operator.api.status;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.fabric8.crd.generator.annotation.PrinterColumn;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Last observed status of a backup. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PostgresBackupStatus {

    /** Current phase of the backup. */
    @PrinterColumn(name = "Phase")
    @Builder.Default
    private BackupPhase phase = BackupPhase.PENDING;

    /** Instance the backup is taken from, fixed when the backup starts. */
    @JsonProperty("instanceID")
    private InstanceId instanceId;

    /** When the backup was started. */
    private String startedAt;

    /** When the backup was completed or failed. */
    private String stoppedAt;

    /** Error message of a failed backup, or of the last failed attempt. */
    @PrinterColumn(name = "Error")
    private String error;

    /** The snapshots produced by the backup. */
    private BackupSnapshotStatus backupSnapshotStatus;
}
