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

import org.pgfleet.kubernetes.operator.api.PostgresCluster;
import org.pgfleet.kubernetes.operator.config.PgFleetConfigLoader;
import org.pgfleet.kubernetes.operator.config.PgFleetOperatorConfiguration;
import org.pgfleet.kubernetes.operator.utils.EnvUtils;
import org.pgfleet.kubernetes.operator.utils.KubernetesClientUtils;

import io.fabric8.kubernetes.client.KubernetesClient;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Refreshes the replication configuration of the instance running in the current pod. Runs
 * inside the instance pod when the instance starts or its cluster changes; the exit code tells
 * whether PostgreSQL has to reload its configuration.
 */
@RequiredArgsConstructor
public class ReplicaConfigurationRefresher {

    private static final Logger LOG = LoggerFactory.getLogger(ReplicaConfigurationRefresher.class);

    static final String DEFAULT_PGDATA = "/var/lib/postgresql/data/pgdata";

    /** Exit code telling that the configuration changed. */
    static final int EXIT_CHANGED = 2;

    private final KubernetesClient client;
    private final ReplicaConfigurationWriter writer;
    private final PostgresInstance instance;
    private final String clusterName;

    /** @return true if the configuration changed */
    public boolean refresh() {
        var cluster =
                client.resources(PostgresCluster.class)
                        .inNamespace(instance.getNamespace())
                        .withName(clusterName)
                        .get();
        if (cluster == null) {
            throw new IllegalStateException(
                    String.format(
                            "Cluster %s not found in namespace %s",
                            clusterName, instance.getNamespace()));
        }
        var changed = writer.refreshReplicaConfiguration(instance, cluster);
        LOG.info(
                "Replication configuration of {} {}",
                instance.getPodName(),
                changed ? "changed" : "unchanged");
        return changed;
    }

    public static void main(String... args) {
        EnvUtils.logEnvironmentInfo(LOG, "PgFleet replica configuration refresh", args);
        var operatorConfiguration =
                PgFleetOperatorConfiguration.fromConfiguration(
                        PgFleetConfigLoader.loadConfiguration());
        var instance =
                PostgresInstance.builder()
                        .podName(EnvUtils.getRequired(EnvUtils.ENV_POD_NAME))
                        .namespace(EnvUtils.getRequired(EnvUtils.ENV_NAMESPACE))
                        .pgData(Path.of(EnvUtils.getOrDefault(EnvUtils.ENV_PGDATA, DEFAULT_PGDATA)))
                        .build();

        boolean changed;
        try (var client = KubernetesClientUtils.getKubernetesClient()) {
            var writer =
                    new ReplicaConfigurationWriter(
                            new ExternalClusterConnector(
                                    client,
                                    Path.of(operatorConfiguration.getInstanceExternalSecretsDir())),
                            Path.of(operatorConfiguration.getInstanceCertificatesDir()));
            changed =
                    new ReplicaConfigurationRefresher(
                                    client,
                                    writer,
                                    instance,
                                    EnvUtils.getRequired(EnvUtils.ENV_CLUSTER_NAME))
                            .refresh();
        }
        System.exit(changed ? EXIT_CHANGED : 0);
    }
}
