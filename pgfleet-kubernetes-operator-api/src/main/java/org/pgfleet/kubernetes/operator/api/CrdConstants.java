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

/** Constants shared by the PgFleet custom resources. */
public class CrdConstants {
    public static final String API_GROUP = "postgresql.pgfleet.org";
    public static final String API_VERSION = "v1";
    public static final String KIND_CLUSTER = "PostgresCluster";
    public static final String KIND_BACKUP = "PostgresBackup";

    private static final String METADATA_PREFIX = "pgfleet.org/";

    public static final String FENCED_INSTANCES_ANNOTATION = METADATA_PREFIX + "fencedInstances";

    /** Value stored in the fencing annotation when every instance of the cluster is fenced. */
    public static final String FENCE_ALL_INSTANCES = "*";

    public static final String LABEL_CLUSTER = METADATA_PREFIX + "cluster";
    public static final String LABEL_INSTANCE_NAME = METADATA_PREFIX + "instanceName";
    public static final String LABEL_INSTANCE_ROLE = METADATA_PREFIX + "instanceRole";
    public static final String LABEL_PVC_ROLE = METADATA_PREFIX + "pvcRole";
    public static final String LABEL_BACKUP_NAME = METADATA_PREFIX + "backupName";

    public static final String ANNOTATION_CLUSTER_MANIFEST = METADATA_PREFIX + "clusterManifest";
    public static final String ANNOTATION_PG_CONTROLDATA = METADATA_PREFIX + "pgControldata";

    public static final String PVC_ROLE_PG_DATA = "PG_DATA";
    public static final String PVC_ROLE_PG_WAL = "PG_WAL";

    public static final String STREAMING_REPLICA_USER = "streaming_replica";
    public static final String READ_WRITE_SERVICE_SUFFIX = "-rw";
    public static final int POSTGRES_PORT = 5432;
}
