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

import org.pgfleet.kubernetes.operator.api.PostgresCluster;
import org.pgfleet.kubernetes.operator.api.spec.BackupConfiguration;
import org.pgfleet.kubernetes.operator.api.spec.ExternalClusterSpec;
import org.pgfleet.kubernetes.operator.api.spec.ReplicaClusterSpec;
import org.pgfleet.kubernetes.operator.api.spec.ReplicationSlotsConfiguration;
import org.pgfleet.kubernetes.operator.api.spec.VolumeSnapshotConfiguration;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link PostgresClusterUtils}. */
public class PostgresClusterUtilsTest {

    private PostgresCluster cluster;

    @BeforeEach
    public void setup() {
        cluster = new PostgresCluster();
        cluster.setMetadata(new ObjectMetaBuilder().withName("cluster-example").build());
    }

    @Test
    public void testIsReplica() {
        assertThat(PostgresClusterUtils.isReplica(cluster)).isFalse();
        cluster.getSpec().setReplica(new ReplicaClusterSpec(false, "origin"));
        assertThat(PostgresClusterUtils.isReplica(cluster)).isFalse();
        cluster.getSpec().setReplica(new ReplicaClusterSpec(true, "origin"));
        assertThat(PostgresClusterUtils.isReplica(cluster)).isTrue();
    }

    @Test
    public void testFindExternalCluster() {
        var origin = ExternalClusterSpec.builder().name("origin").build();
        cluster.getSpec().setExternalClusters(List.of(origin));

        assertThat(PostgresClusterUtils.findExternalCluster(cluster, "origin")).contains(origin);
        assertThat(PostgresClusterUtils.findExternalCluster(cluster, "other")).isEmpty();
        assertThat(PostgresClusterUtils.findExternalCluster(cluster, null)).isEmpty();
    }

    @Test
    public void testSlotName() {
        assertThat(PostgresClusterUtils.getSlotNameFromInstanceName(cluster, "cluster-example-2"))
                .contains("_pgfleet_cluster_example_2");

        cluster.getSpec()
                .setReplicationSlots(
                        new ReplicationSlotsConfiguration(
                                ReplicationSlotsConfiguration.HighAvailability.builder()
                                        .slotPrefix("ha_")
                                        .build()));
        assertThat(PostgresClusterUtils.getSlotNameFromInstanceName(cluster, "Pod-1.a"))
                .contains("ha_pod_1_a");

        cluster.getSpec()
                .getReplicationSlots()
                .getHighAvailability()
                .setEnabled(false);
        assertThat(PostgresClusterUtils.getSlotNameFromInstanceName(cluster, "pod-1")).isEmpty();
    }

    @Test
    public void testReadWriteServiceName() {
        assertThat(PostgresClusterUtils.getReadWriteServiceName(cluster))
                .isEqualTo("cluster-example-rw");
    }

    @Test
    public void testVolumeSnapshotConfiguration() {
        assertThat(PostgresClusterUtils.getVolumeSnapshotConfiguration(cluster)).isEmpty();
        cluster.getSpec().setBackup(new BackupConfiguration());
        assertThat(PostgresClusterUtils.getVolumeSnapshotConfiguration(cluster)).isEmpty();

        var config = VolumeSnapshotConfiguration.builder().className("csi").build();
        cluster.getSpec().setBackup(new BackupConfiguration(config));
        assertThat(PostgresClusterUtils.getVolumeSnapshotConfiguration(cluster)).contains(config);
    }
}
