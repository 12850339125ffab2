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

package org.pgfleet.kubernetes.operator.listener;

import org.apache.flink.annotation.VisibleForTesting;

import org.pgfleet.kubernetes.operator.api.status.PostgresBackupStatus;

import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.HasMetadata;
import lombok.NonNull;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Responsible for logging resource event/status updates. */
public class AuditUtils {
    private static final Logger LOG = LoggerFactory.getLogger(AuditUtils.class);

    public static void logContext(HasMetadata resource, Event event) {
        LOG.info(format(event, resource.getKind()));
    }

    public static void logContext(
            PostgresBackupStatus previousStatus, @NonNull PostgresBackupStatus newStatus) {
        if (previousStatus != null && previousStatus.getPhase() == newStatus.getPhase()) {
            // Unchanged phase, nothing to log
            return;
        }
        LOG.info(format(newStatus));
    }

    private static String format(@NonNull PostgresBackupStatus status) {
        String message =
                ObjectUtils.firstNonNull(
                        status.getError(),
                        status.getInstanceId() == null
                                ? null
                                : status.getInstanceId().getPodName(),
                        "");
        return String.format(
                ">>> %-16s | %-7s | %-9s | %s",
                "Status[Backup]",
                StringUtils.isEmpty(status.getError()) ? "Info" : "Error",
                status.getPhase(),
                message);
    }

    @VisibleForTesting
    public static String format(@NonNull Event event, String component) {
        var componentMessage = String.format("Event[%s]", component);
        return String.format(
                ">>> %-16s | %-7s | %-15s | %s",
                componentMessage,
                "Normal".equals(event.getType()) ? "Info" : event.getType(),
                event.getReason().toUpperCase(),
                event.getMessage());
    }
}
