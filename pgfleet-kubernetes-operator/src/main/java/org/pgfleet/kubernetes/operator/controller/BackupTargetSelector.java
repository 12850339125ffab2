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

import org.pgfleet.kubernetes.operator.api.PostgresCluster;
import org.pgfleet.kubernetes.operator.api.spec.BackupTarget;
import org.pgfleet.kubernetes.operator.utils.PodUtils;

import io.fabric8.kubernetes.api.model.Pod;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/** Chooses the instance a backup is taken from. */
public class BackupTargetSelector {

    /**
     * Selects the backup target among the instance pods of the cluster. With {@link
     * BackupTarget#PREFER_STANDBY} the first ready standby, by name, is chosen and the primary is
     * only used when no standby is ready.
     */
    public static Optional<Pod> selectTarget(
            PostgresCluster cluster, BackupTarget target, List<Pod> pods) {
        var primaryName =
                cluster.getStatus() == null ? null : cluster.getStatus().getCurrentPrimary();
        var primary =
                pods.stream()
                        .filter(pod -> pod.getMetadata().getName().equals(primaryName))
                        .findFirst();

        if (target == BackupTarget.PRIMARY) {
            return primary;
        }

        var standby =
                pods.stream()
                        .filter(pod -> !pod.getMetadata().getName().equals(primaryName))
                        .filter(pod -> !PodUtils.isPodDeleted(pod))
                        .filter(PodUtils::isPodReady)
                        .min(Comparator.comparing(pod -> pod.getMetadata().getName()));
        return standby.isPresent() ? standby : primary;
    }
}
