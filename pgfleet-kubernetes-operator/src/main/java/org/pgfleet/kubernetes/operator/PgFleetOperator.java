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

package org.pgfleet.kubernetes.operator;

import org.apache.flink.annotation.VisibleForTesting;
import org.apache.flink.configuration.Configuration;

import org.pgfleet.kubernetes.operator.config.PgFleetConfigLoader;
import org.pgfleet.kubernetes.operator.config.PgFleetOperatorConfiguration;
import org.pgfleet.kubernetes.operator.controller.PostgresBackupController;
import org.pgfleet.kubernetes.operator.service.HttpInstanceStatusClient;
import org.pgfleet.kubernetes.operator.service.KubernetesFencingService;
import org.pgfleet.kubernetes.operator.service.KubernetesVolumeSnapshotService;
import org.pgfleet.kubernetes.operator.utils.EnvUtils;
import org.pgfleet.kubernetes.operator.utils.EventRecorder;
import org.pgfleet.kubernetes.operator.utils.KubernetesClientUtils;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.volumesnapshot.api.model.VolumeSnapshot;
import io.javaoperatorsdk.operator.Operator;
import io.javaoperatorsdk.operator.api.config.ConfigurationServiceOverrider;
import io.javaoperatorsdk.operator.api.config.ControllerConfigurationOverrider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;

/** Main Class for PgFleet Kubernetes Operator. */
public class PgFleetOperator {
    private static final Logger LOG = LoggerFactory.getLogger(PgFleetOperator.class);

    private final Operator operator;
    private final KubernetesClient client;
    private final PgFleetOperatorConfiguration operatorConfiguration;
    private final EventRecorder eventRecorder;

    public PgFleetOperator(Configuration conf) {
        this.operatorConfiguration = PgFleetOperatorConfiguration.fromConfiguration(conf);
        this.client = KubernetesClientUtils.getKubernetesClient();
        this.eventRecorder = EventRecorder.create();
        this.operator = new Operator(this::overrideOperatorConfigs);
    }

    private void overrideOperatorConfigs(ConfigurationServiceOverrider overrider) {
        overrider.withKubernetesClient(client);
        int parallelism = operatorConfiguration.getReconcilerMaxParallelism();
        if (parallelism == -1) {
            LOG.info("Configuring operator with unbounded reconciliation thread pool.");
            overrider.withExecutorService(Executors.newCachedThreadPool());
        } else {
            LOG.info("Configuring operator with {} reconciliation threads.", parallelism);
            overrider.withConcurrentReconciliationThreads(parallelism);
        }

        overrider.withTerminationTimeoutSeconds(
                (int) operatorConfiguration.getTerminationTimeout().toSeconds());

        var leaderElectionConf = operatorConfiguration.getLeaderElectionConfiguration();
        if (leaderElectionConf != null) {
            overrider.withLeaderElectionConfiguration(leaderElectionConf);
            LOG.info("Operator leader election is enabled.");
        } else {
            LOG.info("Operator leader election is disabled.");
        }
    }

    @VisibleForTesting
    void registerBackupController() {
        if (!KubernetesClientUtils.isCrdInstalled(client, VolumeSnapshot.class)) {
            LOG.warn(
                    "The VolumeSnapshot CRD is not installed, volume snapshot backups will fail"
                            + " until it is");
        }
        var fencingService =
                new KubernetesFencingService(
                        client, operatorConfiguration.getFencingMaxConflictRetries());
        var instanceStatusClient =
                new HttpInstanceStatusClient(
                        operatorConfiguration.getInstanceManagerPort(),
                        operatorConfiguration.getInstanceManagerTimeout());
        var volumeSnapshotService =
                new KubernetesVolumeSnapshotService(client, instanceStatusClient);
        var controller =
                new PostgresBackupController(
                        operatorConfiguration,
                        fencingService,
                        volumeSnapshotService,
                        eventRecorder);
        operator.register(controller, this::overrideControllerConfigs);
    }

    private void overrideControllerConfigs(ControllerConfigurationOverrider<?> overrider) {
        var watchNamespaces = operatorConfiguration.getWatchedNamespaces();
        LOG.info("Configuring operator to watch the following namespaces: {}.", watchNamespaces);
        overrider.settingNamespaces(watchNamespaces);
        overrider.withRetry(operatorConfiguration.getRetryConfiguration());
        overrider.withReconciliationMaxInterval(operatorConfiguration.getReconcileInterval());
    }

    public void run() {
        registerBackupController();
        operator.installShutdownHook(operatorConfiguration.getTerminationTimeout());
        operator.start();
    }

    public void stop() {
        operator.stop();
    }

    public static void main(String... args) {
        EnvUtils.logEnvironmentInfo(LOG, "PgFleet Kubernetes Operator", args);
        new PgFleetOperator(PgFleetConfigLoader.loadConfiguration()).run();
    }
}
