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

package org.pgfleet.kubernetes.operator.api.utils;

import org.pgfleet.kubernetes.operator.api.CrdConstants;
import org.pgfleet.kubernetes.operator.api.PostgresCluster;
import org.pgfleet.kubernetes.operator.api.spec.ExternalClusterSpec;
import org.pgfleet.kubernetes.operator.api.spec.ReplicationSlotsConfiguration;
import org.pgfleet.kubernetes.operator.api.spec.VolumeSnapshotConfiguration;

import java.util.Locale;
import java.util.Optional;

/** Utilities for the {@link PostgresCluster} resource. */
public class PostgresClusterUtils {

    /** Whether the cluster follows an external source instead of running its own primary. */
    public static boolean isReplica(PostgresCluster cluster) {
        var replica = cluster.getSpec().getReplica();
        return replica != null && replica.isEnabled();
    }

    public static Optional<ExternalClusterSpec> findExternalCluster(
            PostgresCluster cluster, String name) {
        if (name == null || cluster.getSpec().getExternalClusters() == null) {
            return Optional.empty();
        }
        return cluster.getSpec().getExternalClusters().stream()
                .filter(server -> name.equals(server.getName()))
                .findFirst();
    }

    /**
     * Name of the replication slot used by the given instance to follow the primary, empty when
     * the high availability slots are disabled.
     */
    public static Optional<String> getSlotNameFromInstanceName(
            PostgresCluster cluster, String instanceName) {
        var highAvailability =
                Optional.ofNullable(cluster.getSpec().getReplicationSlots())
                        .map(ReplicationSlotsConfiguration::getHighAvailability)
                        .orElseGet(ReplicationSlotsConfiguration.HighAvailability::new);
        if (!highAvailability.isEnabled()) {
            return Optional.empty();
        }
        var prefix =
                Optional.ofNullable(highAvailability.getSlotPrefix())
                        .orElse(ReplicationSlotsConfiguration.HighAvailability.DEFAULT_SLOT_PREFIX);
        var sanitized = instanceName.toLowerCase(Locale.ROOT).replace('-', '_').replace('.', '_');
        return Optional.of(prefix + sanitized);
    }

    /** Name of the service always pointing to the current primary. */
    public static String getReadWriteServiceName(PostgresCluster cluster) {
        return cluster.getMetadata().getName() + CrdConstants.READ_WRITE_SERVICE_SUFFIX;
    }

    public static Optional<VolumeSnapshotConfiguration> getVolumeSnapshotConfiguration(
            PostgresCluster cluster) {
        var backup = cluster.getSpec().getBackup();
        if (backup == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(backup.getVolumeSnapshot());
    }
}
