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

package org.pgfleet.kubernetes.operator.api.spec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/** Configuration of the VolumeSnapshot resources created for a backup. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class VolumeSnapshotConfiguration {

    /** Labels added to every VolumeSnapshot, taking precedence over the PVC labels. */
    @Builder.Default private Map<String, String> labels = new HashMap<>();

    /** Annotations added to every VolumeSnapshot, taking precedence over the PVC ones. */
    @Builder.Default private Map<String, String> annotations = new HashMap<>();

    /** VolumeSnapshotClass used for every volume unless a more specific class applies. */
    private String className;

    /** VolumeSnapshotClass used for the WAL volume. */
    private String walClassName;

    /** Owner of the generated VolumeSnapshot resources. */
    @Builder.Default
    private SnapshotOwnerReference snapshotOwnerReference = SnapshotOwnerReference.NONE;

    /** Whether to take the snapshot without fencing the target instance. */
    @Builder.Default private boolean online = false;
}
