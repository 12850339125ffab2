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

package org.pgfleet.kubernetes.operator.utils;

import org.pgfleet.kubernetes.operator.listener.AuditUtils;

import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;

import java.util.function.BiConsumer;

/** Helper class for creating Kubernetes events for the PgFleet resources. */
public class EventRecorder {

    private final BiConsumer<HasMetadata, Event> eventListener;

    public EventRecorder(BiConsumer<HasMetadata, Event> eventListener) {
        this.eventListener = eventListener;
    }

    /**
     * Records an event on the resource and notifies the listener.
     *
     * @return true if a new event was created
     */
    public boolean triggerEvent(
            HasMetadata resource,
            Type type,
            Reason reason,
            Component component,
            String message,
            KubernetesClient client) {
        return EventUtils.recordEvent(
                client,
                resource,
                type,
                reason.name(),
                message,
                component,
                e -> eventListener.accept(resource, e));
    }

    public static EventRecorder create() {
        return new EventRecorder((resource, event) -> AuditUtils.logContext(resource, event));
    }

    /** The type of the events. */
    public enum Type {
        Normal,
        Warning
    }

    /** The component of events. */
    public enum Component {
        Operator,
        Backup,
        Fencing,
        Snapshot
    }

    /** The reason codes of events. */
    public enum Reason {
        FindingCluster,
        MissingConfiguration,
        SelectedInstance,
        FencePod,
        UnfencePod,
        CreateSnapshot,
        Completed,
        Failed,
        BackupError
    }
}
