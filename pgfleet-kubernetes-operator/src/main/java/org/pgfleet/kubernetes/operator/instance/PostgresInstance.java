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

package org.pgfleet.kubernetes.operator.instance;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Files;
import java.nio.file.Path;

/** A PostgreSQL instance as seen from inside its pod. */
@Value
@Builder
public class PostgresInstance {

    /** Name of the pod running the instance, also used as application name. */
    String podName;

    String namespace;

    /** The data directory of the instance. */
    Path pgData;

    /** An instance is a primary unless it has been configured to start in standby mode. */
    public boolean isPrimary() {
        return !Files.exists(pgData.resolve(PostgresConfigFiles.STANDBY_SIGNAL));
    }
}
