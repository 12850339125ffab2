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

import org.apache.flink.annotation.docs.Documentation;
import org.apache.flink.configuration.ConfigOption;
import org.apache.flink.configuration.ConfigOptions;

import io.javaoperatorsdk.operator.api.config.ConfigurationService;
import io.javaoperatorsdk.operator.api.config.LeaderElectionConfiguration;
import io.javaoperatorsdk.operator.api.reconciler.Constants;

import java.time.Duration;

/** This class holds configuration constants used by the PgFleet operator. */
public class PgFleetOperatorConfigOptions {

    public static final String OPERATOR_CONF_PREFIX = "pgfleet.operator.";
    public static final String SECTION_SYSTEM = "system";
    public static final String SECTION_ADVANCED = "system_advanced";
    public static final String SECTION_BACKUP = "backup";
    public static final String SECTION_INSTANCE = "instance";

    public static ConfigOptions.OptionBuilder operatorConfig(String key) {
        return ConfigOptions.key(OPERATOR_CONF_PREFIX + key);
    }

    public static String operatorConfigKey(String key) {
        return OPERATOR_CONF_PREFIX + key;
    }

    @Documentation.Section(SECTION_SYSTEM)
    public static final ConfigOption<Duration> OPERATOR_RECONCILE_INTERVAL =
            operatorConfig("reconcile.interval")
                    .durationType()
                    .defaultValue(Duration.ofSeconds(60))
                    .withDescription(
                            "Maximum time between two reconciliations of the same backup.");

    @Documentation.Section(SECTION_SYSTEM)
    public static final ConfigOption<Integer> OPERATOR_RECONCILE_PARALLELISM =
            operatorConfig("reconcile.parallelism")
                    .intType()
                    .defaultValue(ConfigurationService.DEFAULT_RECONCILIATION_THREADS_NUMBER)
                    .withDescription(
                            "Number of backups reconciled concurrently. Use -1 for no limit.");

    @Documentation.Section(SECTION_SYSTEM)
    public static final ConfigOption<String> OPERATOR_WATCHED_NAMESPACES =
            operatorConfig("watched.namespaces")
                    .stringType()
                    .defaultValue(Constants.WATCH_ALL_NAMESPACES)
                    .withDescription(
                            "Comma separated namespaces watched for PostgresBackup resources. The default watches all namespaces.");

    @Documentation.Section(SECTION_SYSTEM)
    public static final ConfigOption<Duration> OPERATOR_RETRY_INITIAL_INTERVAL =
            operatorConfig("retry.initial.interval")
                    .durationType()
                    .defaultValue(Duration.ofSeconds(5))
                    .withDescription(
                            "Delay before the first retry of a failed backup reconciliation.");

    @Documentation.Section(SECTION_SYSTEM)
    public static final ConfigOption<Duration> OPERATOR_RETRY_MAX_INTERVAL =
            operatorConfig("retry.max.interval")
                    .durationType()
                    .noDefaultValue()
                    .withDescription(
                            "Upper bound of the retry delay of a failed backup reconciliation.");

    @Documentation.Section(SECTION_SYSTEM)
    public static final ConfigOption<Double> OPERATOR_RETRY_INTERVAL_MULTIPLIER =
            operatorConfig("retry.interval.multiplier")
                    .doubleType()
                    .defaultValue(1.5)
                    .withDescription(
                            "Factor applied to the retry delay after each failed backup reconciliation.");

    @Documentation.Section(SECTION_SYSTEM)
    public static final ConfigOption<Integer> OPERATOR_RETRY_MAX_ATTEMPTS =
            operatorConfig("retry.max.attempts")
                    .intType()
                    .defaultValue(15)
                    .withDescription(
                            "Retries of a failed backup reconciliation before JOSDK gives up.");

    @Documentation.Section(SECTION_ADVANCED)
    public static final ConfigOption<Duration> OPERATOR_TERMINATION_TIMEOUT =
            operatorConfig("termination.timeout")
                    .durationType()
                    .defaultValue(Duration.ofSeconds(10))
                    .withDescription(
                            "Time given to running reconciliations when the operator stops.");

    @Documentation.Section(SECTION_ADVANCED)
    public static final ConfigOption<Boolean> OPERATOR_LEADER_ELECTION_ENABLED =
            operatorConfig("leader-election.enabled")
                    .booleanType()
                    .defaultValue(false)
                    .withDescription(
                            "Whether operator replicas elect a leader. Only the leader reconciles backups.");

    @Documentation.Section(SECTION_ADVANCED)
    public static final ConfigOption<String> OPERATOR_LEADER_ELECTION_LEASE_NAME =
            operatorConfig("leader-election.lease-name")
                    .stringType()
                    .noDefaultValue()
                    .withDescription(
                            "Name of the Lease object used for leader election. Required when leader election is enabled.");

    @Documentation.Section(SECTION_ADVANCED)
    public static final ConfigOption<Duration> OPERATOR_LEADER_ELECTION_LEASE_DURATION =
            operatorConfig("leader-election.lease-duration")
                    .durationType()
                    .defaultValue(LeaderElectionConfiguration.LEASE_DURATION_DEFAULT_VALUE)
                    .withDescription("How long a leader holds the Lease without renewing it.");

    @Documentation.Section(SECTION_ADVANCED)
    public static final ConfigOption<Duration> OPERATOR_LEADER_ELECTION_RENEW_DEADLINE =
            operatorConfig("leader-election.renew-deadline")
                    .durationType()
                    .defaultValue(LeaderElectionConfiguration.RENEW_DEADLINE_DEFAULT_VALUE)
                    .withDescription(
                            "Deadline for the leader to renew the Lease before giving up leadership.");

    @Documentation.Section(SECTION_ADVANCED)
    public static final ConfigOption<Duration> OPERATOR_LEADER_ELECTION_RETRY_PERIOD =
            operatorConfig("leader-election.retry-period")
                    .durationType()
                    .defaultValue(LeaderElectionConfiguration.RETRY_PERIOD_DEFAULT_VALUE)
                    .withDescription("Interval between attempts to acquire or renew the Lease.");

    @Documentation.Section(SECTION_BACKUP)
    public static final ConfigOption<Duration> BACKUP_SNAPSHOT_REQUEUE_DELAY =
            operatorConfig("backup.snapshot.requeue-delay")
                    .durationType()
                    .defaultValue(Duration.ofSeconds(10))
                    .withDescription(
                            "Delay before checking again a volume snapshot backup that is waiting for the target instance to be fenced or for its snapshots to be ready.");

    @Documentation.Section(SECTION_BACKUP)
    public static final ConfigOption<Integer> FENCING_MAX_CONFLICT_RETRIES =
            operatorConfig("fencing.max-conflict-retries")
                    .intType()
                    .defaultValue(10)
                    .withDescription(
                            "How many times a fencing request is retried when the cluster is concurrently modified.");

    @Documentation.Section(SECTION_INSTANCE)
    public static final ConfigOption<Integer> INSTANCE_MANAGER_PORT =
            operatorConfig("instance-manager.port")
                    .intType()
                    .defaultValue(8000)
                    .withDescription("Port of the status endpoint exposed by every instance.");

    @Documentation.Section(SECTION_INSTANCE)
    public static final ConfigOption<Duration> INSTANCE_MANAGER_TIMEOUT =
            operatorConfig("instance-manager.timeout")
                    .durationType()
                    .defaultValue(Duration.ofSeconds(10))
                    .withDescription(
                            "Timeout of the requests sent to the instance status endpoint.");

    @Documentation.Section(SECTION_INSTANCE)
    public static final ConfigOption<String> INSTANCE_CERTIFICATES_DIR =
            operatorConfig("instance.certificates.dir")
                    .stringType()
                    .defaultValue("/controller/certificates")
                    .withDescription(
                            "Directory holding the streaming replication client certificates of an instance.");

    @Documentation.Section(SECTION_INSTANCE)
    public static final ConfigOption<String> INSTANCE_EXTERNAL_SECRETS_DIR =
            operatorConfig("instance.external-secrets.dir")
                    .stringType()
                    .defaultValue("/controller/external")
                    .withDescription(
                            "Directory where the credentials of the external clusters are materialized.");
}
