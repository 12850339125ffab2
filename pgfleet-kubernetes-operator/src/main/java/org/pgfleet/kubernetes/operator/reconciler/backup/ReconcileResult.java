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

import io.fabric8.volumesnapshot.api.model.VolumeSnapshot;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/** Outcome of a single execution of a volume snapshot backup. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReconcileResult {

    Duration requeueAfter;

    /** The snapshots of the backup, only set once the backup is done. */
    List<VolumeSnapshot> snapshots;

    public static ReconcileResult done(List<VolumeSnapshot> snapshots) {
        return new ReconcileResult(null, List.copyOf(snapshots));
    }

    public static ReconcileResult requeueAfter(Duration delay) {
        return new ReconcileResult(delay, List.of());
    }

    public boolean isDone() {
        return requeueAfter == null;
    }

    public Optional<Duration> getRequeueDelay() {
        return Optional.ofNullable(requeueAfter);
    }
}
