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

package org.pgfleet.kubernetes.operator.exception;

/** Exception to signal that the storage provider failed to take a volume snapshot. */
public class VolumeSnapshotFailedException extends RuntimeException {

    private static final long serialVersionUID = -8455291709217392605L;

    private final String snapshotName;

    public VolumeSnapshotFailedException(String snapshotName, String reason) {
        super(String.format("VolumeSnapshot %s failed: %s", snapshotName, reason));
        this.snapshotName = snapshotName;
    }

    public String getSnapshotName() {
        return snapshotName;
    }
}
