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

import org.pgfleet.kubernetes.operator.TestUtils;
import org.pgfleet.kubernetes.operator.api.CrdConstants;
import org.pgfleet.kubernetes.operator.api.spec.VolumeSnapshotConfiguration;

import io.fabric8.volumesnapshot.api.model.VolumeSnapshot;
import io.fabric8.volumesnapshot.api.model.VolumeSnapshotBuilder;
import io.fabric8.volumesnapshot.api.model.VolumeSnapshotStatus;
import io.fabric8.volumesnapshot.api.model.VolumeSnapshotStatusBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/** Tests for {@link VolumeSnapshotUtils}. */
public class VolumeSnapshotUtilsTest {

    @Test
    public void testClassifyPending() {
        assertThat(VolumeSnapshotUtils.classify(snapshot("s1", null)).isPending()).isTrue();
        assertThat(
                        VolumeSnapshotUtils.classify(
                                        snapshot(
                                                "s1",
                                                new VolumeSnapshotStatusBuilder()
                                                        .withReadyToUse(false)
                                                        .build()))
                                .isPending())
                .isTrue();
    }

    @Test
    public void testClassifyReady() {
        var info =
                VolumeSnapshotUtils.classify(
                        snapshot(
                                "s1",
                                new VolumeSnapshotStatusBuilder()
                                        .withReadyToUse(true)
                                        .withCreationTime("2024-01-01T00:00:00Z")
                                        .build()));
        assertThat(info.isReady()).isTrue();
        assertThat(info.getName()).isEqualTo("s1");
        assertThat(info.getFailureReason()).isNull();
    }

    @Test
    public void testClassifyFailed() {
        var info =
                VolumeSnapshotUtils.classify(
                        snapshot(
                                "s1",
                                new VolumeSnapshotStatusBuilder()
                                        .withReadyToUse(false)
                                        .withNewError()
                                        .withMessage("quota exceeded")
                                        .endError()
                                        .build()));
        assertThat(info.isFailed()).isTrue();
        assertThat(info.getFailureReason()).isEqualTo("quota exceeded");
    }

    @Test
    public void testClassifyMalformed() {
        var readyWithError =
                VolumeSnapshotUtils.classify(
                        snapshot(
                                "s1",
                                new VolumeSnapshotStatusBuilder()
                                        .withReadyToUse(true)
                                        .withCreationTime("2024-01-01T00:00:00Z")
                                        .withNewError()
                                        .withMessage("boom")
                                        .endError()
                                        .build()));
        assertThat(readyWithError.isFailed()).isTrue();
        assertThat(readyWithError.getFailureReason())
                .startsWith("malformed status")
                .contains("boom");

        var readyWithoutTime =
                VolumeSnapshotUtils.classify(
                        snapshot(
                                "s1",
                                new VolumeSnapshotStatusBuilder().withReadyToUse(true).build()));
        assertThat(readyWithoutTime.isFailed()).isTrue();
        assertThat(readyWithoutTime.getFailureReason()).contains("no creation time");
    }

    @Test
    public void testSnapshotClassName() {
        var data = TestUtils.buildPvc("pvc-1", CrdConstants.PVC_ROLE_PG_DATA);
        var wal = TestUtils.buildPvc("pvc-1-wal", CrdConstants.PVC_ROLE_PG_WAL);

        var both =
                VolumeSnapshotConfiguration.builder()
                        .className("data")
                        .walClassName("wal")
                        .build();
        assertThat(VolumeSnapshotUtils.getSnapshotClassName(both, data)).contains("data");
        assertThat(VolumeSnapshotUtils.getSnapshotClassName(both, wal)).contains("wal");

        var dataOnly = VolumeSnapshotConfiguration.builder().className("data").build();
        assertThat(VolumeSnapshotUtils.getSnapshotClassName(dataOnly, wal)).contains("data");

        var none = VolumeSnapshotConfiguration.builder().build();
        assertThat(VolumeSnapshotUtils.getSnapshotClassName(none, data)).isEmpty();
    }

    @Test
    public void testMerge() {
        assertThat(VolumeSnapshotUtils.merge(null, null)).isEmpty();
        assertThat(VolumeSnapshotUtils.merge(Map.of("a", "1", "b", "1"), Map.of("b", "2")))
                .containsExactlyInAnyOrderEntriesOf(Map.of("a", "1", "b", "2"));
    }

    @Test
    public void testStatusElements() {
        var wal = snapshot("b-wal", null);
        wal.getMetadata()
                .setLabels(Map.of(CrdConstants.LABEL_PVC_ROLE, CrdConstants.PVC_ROLE_PG_WAL));
        var data = snapshot("a-data", null);

        var elements = VolumeSnapshotUtils.toStatusElements(List.of(wal, data));
        assertThat(elements).hasSize(2);
        assertThat(elements.get(0).getName()).isEqualTo("a-data");
        assertThat(elements.get(0).getType()).isEqualTo(CrdConstants.PVC_ROLE_PG_DATA);
        assertThat(elements.get(1).getName()).isEqualTo("b-wal");
        assertThat(elements.get(1).getType()).isEqualTo(CrdConstants.PVC_ROLE_PG_WAL);
    }

    private static VolumeSnapshot snapshot(String name, VolumeSnapshotStatus status) {
        return new VolumeSnapshotBuilder()
                .withNewMetadata()
                .withName(name)
                .endMetadata()
                .withStatus(status)
                .build();
    }
}
