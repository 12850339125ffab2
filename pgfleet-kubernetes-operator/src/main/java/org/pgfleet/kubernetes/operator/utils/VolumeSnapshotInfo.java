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

import lombok.Value;

import javax.annotation.Nullable;

/** State of a VolumeSnapshot as reported by the storage provider. */
@Value
public class VolumeSnapshotInfo {

    /** Snapshot states. */
    public enum State {
        /** The provider is still taking the snapshot. */
        PENDING,
        /** The snapshot can be used to provision volumes. */
        READY,
        /** The provider reported an error, or a status that can't be interpreted. */
        FAILED
    }

    String name;
    State state;
    @Nullable String failureReason;

    public static VolumeSnapshotInfo pending(String name) {
        return new VolumeSnapshotInfo(name, State.PENDING, null);
    }

    public static VolumeSnapshotInfo ready(String name) {
        return new VolumeSnapshotInfo(name, State.READY, null);
    }

    public static VolumeSnapshotInfo failed(String name, String reason) {
        return new VolumeSnapshotInfo(name, State.FAILED, reason);
    }

    public boolean isPending() {
        return state == State.PENDING;
    }

    public boolean isReady() {
        return state == State.READY;
    }

    public boolean isFailed() {
        return state == State.FAILED;
    }
}
