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

import org.pgfleet.kubernetes.operator.api.CrdConstants;
import org.pgfleet.kubernetes.operator.api.PostgresCluster;
import org.pgfleet.kubernetes.operator.api.utils.PostgresClusterUtils;
import org.pgfleet.kubernetes.operator.exception.MissingExternalSourceException;
import org.pgfleet.kubernetes.operator.exception.ReconciliationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writes the replication configuration of a standby instance, pointing it either to the primary
 * of its own cluster or, for the designated primary of a replica cluster, to the external source
 * cluster.
 */
public class ReplicaConfigurationWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ReplicaConfigurationWriter.class);

    static final String STREAMING_REPLICA_KEY = "streaming_replica.key";
    static final String STREAMING_REPLICA_CERT = "streaming_replica.crt";
    static final String SERVER_CA_CERT = "server-ca.crt";

    private final ExternalClusterConnector externalClusterConnector;
    private final Path certificatesDir;

    public ReplicaConfigurationWriter(
            ExternalClusterConnector externalClusterConnector, Path certificatesDir) {
        this.externalClusterConnector = externalClusterConnector;
        this.certificatesDir = certificatesDir;
    }

    /**
     * Refreshes the replication configuration of the instance.
     *
     * @return true if the configuration changed and PostgreSQL must reload it
     * @throws MissingExternalSourceException if the replica cluster source isn't defined among
     *     the external clusters
     */
    public boolean refreshReplicaConfiguration(PostgresInstance instance, PostgresCluster cluster) {
        try {
            PostgresConfigFiles.removeArchiveModeFromAutoConf(instance.getPgData());

            if (instance.isPrimary()) {
                return false;
            }

            if (PostgresClusterUtils.isReplica(cluster)
                    && instance.getPodName().equals(getTargetPrimary(cluster))) {
                return writeConfigurationForDesignatedPrimary(instance, cluster);
            }
            return writeConfigurationForReplica(instance, cluster);
        } catch (IOException e) {
            throw new ReconciliationException(
                    "Could not write the replication configuration of " + instance.getPodName(),
                    e);
        }
    }

    private boolean writeConfigurationForReplica(PostgresInstance instance, PostgresCluster cluster)
            throws IOException {
        var changed =
                PostgresConfigFiles.updateReplicaConfiguration(
                        instance.getPgData(),
                        getPrimaryConnInfo(instance, cluster),
                        PostgresClusterUtils.getSlotNameFromInstanceName(
                                cluster, instance.getPodName()));
        if (changed) {
            LOG.info("Instance {} now follows the primary of its cluster", instance.getPodName());
        }
        return changed;
    }

    private boolean writeConfigurationForDesignatedPrimary(
            PostgresInstance instance, PostgresCluster cluster) throws IOException {
        var sourceName = cluster.getSpec().getReplica().getSource();
        var server =
                PostgresClusterUtils.findExternalCluster(cluster, sourceName)
                        .orElseThrow(
                                () ->
                                        new MissingExternalSourceException(
                                                cluster.getMetadata().getName(), sourceName));

        var connection =
                externalClusterConnector.configureConnectionToServer(
                        instance.getNamespace(), server);
        var connectionString = connection.getConnectionString();
        if (connection.getPassFile().isPresent()) {
            connectionString =
                    connectionString
                            + " passfile="
                            + PostgresConfigFiles.quoteConnInfoValue(
                                    connection.getPassFile().get().toString());
        }

        var changed =
                PostgresConfigFiles.updateReplicaConfiguration(
                        instance.getPgData(),
                        connectionString,
                        PostgresClusterUtils.getSlotNameFromInstanceName(
                                cluster, instance.getPodName()));
        if (changed) {
            LOG.info(
                    "Designated primary {} now follows external cluster {}",
                    instance.getPodName(),
                    sourceName);
        }
        return changed;
    }

    /** Connection string to the read-write service of the cluster. */
    String getPrimaryConnInfo(PostgresInstance instance, PostgresCluster cluster) {
        return String.join(
                " ",
                "host=" + PostgresClusterUtils.getReadWriteServiceName(cluster),
                "user=" + CrdConstants.STREAMING_REPLICA_USER,
                "port=" + CrdConstants.POSTGRES_PORT,
                "sslkey=" + quotePath(STREAMING_REPLICA_KEY),
                "sslcert=" + quotePath(STREAMING_REPLICA_CERT),
                "sslrootcert=" + quotePath(SERVER_CA_CERT),
                "application_name=" + instance.getPodName(),
                "sslmode=verify-ca",
                "dbname=postgres");
    }

    private String quotePath(String certificateFile) {
        return PostgresConfigFiles.quoteConnInfoValue(
                certificatesDir.resolve(certificateFile).toString());
    }

    private static String getTargetPrimary(PostgresCluster cluster) {
        return cluster.getStatus() == null ? null : cluster.getStatus().getTargetPrimary();
    }
}
