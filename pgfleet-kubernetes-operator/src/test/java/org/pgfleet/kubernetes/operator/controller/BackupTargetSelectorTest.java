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

import org.pgfleet.kubernetes.operator.TestUtils;
import org.pgfleet.kubernetes.operator.api.spec.BackupTarget;

import io.fabric8.kubernetes.api.model.Pod;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pgfleet.kubernetes.operator.TestUtils.PRIMARY_POD;
import static org.pgfleet.kubernetes.operator.TestUtils.STANDBY_POD;

/** Tests for {@link BackupTargetSelector}. */
public class BackupTargetSelectorTest {

    private static final String OTHER_STANDBY_POD = TestUtils.TEST_CLUSTER_NAME + "-3";

    @Test
    public void testPreferStandby() {
        var pods =
                List.of(
                        TestUtils.buildPod(OTHER_STANDBY_POD, true),
                        TestUtils.buildPod(PRIMARY_POD, true),
                        TestUtils.buildPod(STANDBY_POD, true));
        assertThat(select(BackupTarget.PREFER_STANDBY, pods)).contains(STANDBY_POD);
    }

    @Test
    public void testSkipUnavailableStandbys() {
        var deleted = TestUtils.buildPod(STANDBY_POD, true);
        deleted.getMetadata().setDeletionTimestamp("2024-01-01T00:00:00Z");
        var pods =
                List.of(
                        TestUtils.buildPod(PRIMARY_POD, true),
                        deleted,
                        TestUtils.buildPod(OTHER_STANDBY_POD, false));
        assertThat(select(BackupTarget.PREFER_STANDBY, pods)).contains(PRIMARY_POD);
    }

    @Test
    public void testPrimary() {
        var pods =
                List.of(
                        TestUtils.buildPod(PRIMARY_POD, true),
                        TestUtils.buildPod(STANDBY_POD, true));
        assertThat(select(BackupTarget.PRIMARY, pods)).contains(PRIMARY_POD);
    }

    @Test
    public void testNoCandidate() {
        assertThat(select(BackupTarget.PRIMARY, List.of(TestUtils.buildPod(STANDBY_POD, true))))
                .isEmpty();
        assertThat(select(BackupTarget.PREFER_STANDBY, List.of())).isEmpty();
    }

    private static Optional<String> select(BackupTarget target, List<Pod> pods) {
        return BackupTargetSelector.selectTarget(TestUtils.buildCluster(), target, pods)
                .map(pod -> pod.getMetadata().getName());
    }
}
