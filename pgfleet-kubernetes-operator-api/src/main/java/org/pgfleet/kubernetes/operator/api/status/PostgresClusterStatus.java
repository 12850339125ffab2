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
import io.fabric8.crd.generator.annotation.PrinterColumn;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Last observed status of a PostgreSQL cluster. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public class PostgresClusterStatus {

    /** Total number of instances. */
    @PrinterColumn(name = "Instances")
    private int instances;

    /** Number of ready instances. */
    @PrinterColumn(name = "Ready")
    private int readyInstances;

    /** Human readable phase of the cluster. */
    @PrinterColumn(name = "Status")
    private String phase;

    /** Pod currently acting as primary. */
    @PrinterColumn(name = "Primary")
    private String currentPrimary;

    /** Pod which is going to be (or already is) the primary. */
    private String targetPrimary;
}
