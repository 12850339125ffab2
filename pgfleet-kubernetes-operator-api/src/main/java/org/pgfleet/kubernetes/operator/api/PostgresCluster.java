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

package org.pgfleet.kubernetes.operator.api;

import org.pgfleet.kubernetes.operator.api.spec.PostgresClusterSpec;
import org.pgfleet.kubernetes.operator.api.status.PostgresClusterStatus;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.ShortNames;
import io.fabric8.kubernetes.model.annotation.Version;

/** Custom resource describing a fleet of PostgreSQL instances. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonDeserialize()
@JsonIgnoreProperties(ignoreUnknown = true)
@Group(CrdConstants.API_GROUP)
@Version(CrdConstants.API_VERSION)
@ShortNames({"pgc"})
public class PostgresCluster extends CustomResource<PostgresClusterSpec, PostgresClusterStatus>
        implements Namespaced {

    @Override
    public PostgresClusterStatus initStatus() {
        return new PostgresClusterStatus();
    }

    @Override
    public PostgresClusterSpec initSpec() {
        return new PostgresClusterSpec();
    }
}
