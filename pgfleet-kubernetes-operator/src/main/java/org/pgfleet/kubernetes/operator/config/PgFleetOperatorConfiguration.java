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

package org.pgfleet.kubernetes.operator.config;

import org.apache.flink.configuration.Configuration;
import org.apache.flink.configuration.IllegalConfigurationException;

import org.pgfleet.kubernetes.operator.utils.EnvUtils;

import io.javaoperatorsdk.operator.api.config.LeaderElectionConfiguration;
import io.javaoperatorsdk.operator.processing.retry.GenericRetry;
import lombok.Value;

import java.time.Duration;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.pgfleet.kubernetes.operator.utils.EnvUtils.ENV_WATCH_NAMESPACES;

/** Configuration class for operator. */
@Value
public class PgFleetOperatorConfiguration {

    private static final String NAMESPACES_SPLITTER_KEY = "\\s*,\\s*";

    Duration reconcileInterval;
    int reconcilerMaxParallelism;
    Set<String> watchedNamespaces;
    GenericRetry retryConfiguration;
    LeaderElectionConfiguration leaderElectionConfiguration;
    Duration terminationTimeout;
    Duration snapshotRequeueDelay;
    int fencingMaxConflictRetries;
    int instanceManagerPort;
    Duration instanceManagerTimeout;
    String instanceCertificatesDir;
    String instanceExternalSecretsDir;

    public static PgFleetOperatorConfiguration fromConfiguration(Configuration operatorConfig) {
        Duration reconcileInterval =
                operatorConfig.get(PgFleetOperatorConfigOptions.OPERATOR_RECONCILE_INTERVAL);

        int reconcilerMaxParallelism =
                operatorConfig.get(PgFleetOperatorConfigOptions.OPERATOR_RECONCILE_PARALLELISM);

        String namespaces =
                EnvUtils.get(ENV_WATCH_NAMESPACES)
                        .orElseGet(
                                () ->
                                        operatorConfig.get(
                                                PgFleetOperatorConfigOptions
                                                        .OPERATOR_WATCHED_NAMESPACES));
        Set<String> watchedNamespaces =
                new HashSet<>(Arrays.asList(namespaces.split(NAMESPACES_SPLITTER_KEY)));

        Duration terminationTimeout =
                operatorConfig.get(PgFleetOperatorConfigOptions.OPERATOR_TERMINATION_TIMEOUT);

        Duration snapshotRequeueDelay =
                operatorConfig.get(PgFleetOperatorConfigOptions.BACKUP_SNAPSHOT_REQUEUE_DELAY);

        int fencingMaxConflictRetries =
                operatorConfig.get(PgFleetOperatorConfigOptions.FENCING_MAX_CONFLICT_RETRIES);
        if (fencingMaxConflictRetries < 1) {
            throw new IllegalConfigurationException(
                    PgFleetOperatorConfigOptions.FENCING_MAX_CONFLICT_RETRIES.key()
                            + " must be at least 1.");
        }

        int instanceManagerPort =
                operatorConfig.get(PgFleetOperatorConfigOptions.INSTANCE_MANAGER_PORT);
        Duration instanceManagerTimeout =
                operatorConfig.get(PgFleetOperatorConfigOptions.INSTANCE_MANAGER_TIMEOUT);
        String instanceCertificatesDir =
                operatorConfig.get(PgFleetOperatorConfigOptions.INSTANCE_CERTIFICATES_DIR);
        String instanceExternalSecretsDir =
                operatorConfig.get(PgFleetOperatorConfigOptions.INSTANCE_EXTERNAL_SECRETS_DIR);

        return new PgFleetOperatorConfiguration(
                reconcileInterval,
                reconcilerMaxParallelism,
                watchedNamespaces,
                getRetryConfig(operatorConfig),
                getLeaderElectionConfig(operatorConfig),
                terminationTimeout,
                snapshotRequeueDelay,
                fencingMaxConflictRetries,
                instanceManagerPort,
                instanceManagerTimeout,
                instanceCertificatesDir,
                instanceExternalSecretsDir);
    }

    private static GenericRetry getRetryConfig(Configuration conf) {
        var genericRetry =
                new GenericRetry()
                        .setMaxAttempts(
                                conf.get(PgFleetOperatorConfigOptions.OPERATOR_RETRY_MAX_ATTEMPTS))
                        .setInitialInterval(
                                conf.get(
                                                PgFleetOperatorConfigOptions
                                                        .OPERATOR_RETRY_INITIAL_INTERVAL)
                                        .toMillis())
                        .setIntervalMultiplier(
                                conf.get(
                                        PgFleetOperatorConfigOptions
                                                .OPERATOR_RETRY_INTERVAL_MULTIPLIER));

        if (conf.contains(PgFleetOperatorConfigOptions.OPERATOR_RETRY_MAX_INTERVAL)) {
            genericRetry.setMaxInterval(
                    conf.get(PgFleetOperatorConfigOptions.OPERATOR_RETRY_MAX_INTERVAL).toMillis());
        } else {
            genericRetry.withoutMaxInterval();
        }
        return genericRetry;
    }

    private static LeaderElectionConfiguration getLeaderElectionConfig(Configuration conf) {
        if (!conf.get(PgFleetOperatorConfigOptions.OPERATOR_LEADER_ELECTION_ENABLED)) {
            return null;
        }

        return new LeaderElectionConfiguration(
                conf.getOptional(PgFleetOperatorConfigOptions.OPERATOR_LEADER_ELECTION_LEASE_NAME)
                        .orElseThrow(
                                () ->
                                        new IllegalConfigurationException(
                                                PgFleetOperatorConfigOptions
                                                                .OPERATOR_LEADER_ELECTION_LEASE_NAME
                                                                .key()
                                                        + " must be defined when operator leader election is enabled.")),
                null,
                conf.get(PgFleetOperatorConfigOptions.OPERATOR_LEADER_ELECTION_LEASE_DURATION),
                conf.get(PgFleetOperatorConfigOptions.OPERATOR_LEADER_ELECTION_RENEW_DEADLINE),
                conf.get(PgFleetOperatorConfigOptions.OPERATOR_LEADER_ELECTION_RETRY_PERIOD));
    }
}
