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

import org.apache.flink.annotation.VisibleForTesting;

import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.EventBuilder;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectReference;
import io.fabric8.kubernetes.api.model.ObjectReferenceBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.HttpURLConnection;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Writes Kubernetes events for PgFleet resources. Repeated events for the same resource, reason
 * and message share one {@link Event} whose count is increased.
 */
public class EventUtils {

    private static final Logger LOG = LoggerFactory.getLogger(EventUtils.class);

    /**
     * Name of the event recorded for the given resource. The name starts with the resource name
     * so that {@code kubectl get events} groups the events of one backup together.
     */
    public static String eventName(
            HasMetadata target,
            EventRecorder.Type type,
            String reason,
            String message,
            EventRecorder.Component component) {
        var meta = target.getMetadata();
        int hash =
                Objects.hash(
                                type,
                                reason,
                                message,
                                target.getKind(),
                                meta.getName(),
                                meta.getUid())
                        & Integer.MAX_VALUE;
        return meta.getName()
                + "."
                + component.name().toLowerCase(Locale.ROOT)
                + "."
                + Integer.toHexString(hash);
    }

    /**
     * Records the event on the target resource.
     *
     * @return true when a new event object was created, false when an existing one was bumped
     *     or the event could not be written
     */
    public static boolean recordEvent(
            KubernetesClient client,
            HasMetadata target,
            EventRecorder.Type type,
            String reason,
            String message,
            EventRecorder.Component component,
            Consumer<Event> listener) {
        var name = eventName(target, type, reason, message, component);
        var namespace = target.getMetadata().getNamespace();
        var now = Instant.now().toString();

        Event existing = client.v1().events().inNamespace(namespace).withName(name).get();
        Event event;
        if (existing == null) {
            event =
                    new EventBuilder()
                            .withNewMetadata()
                            .withName(name)
                            .withNamespace(namespace)
                            .endMetadata()
                            .withInvolvedObject(toObjectReference(target))
                            .withType(type.name())
                            .withReason(reason)
                            .withMessage(message)
                            .withNewSource()
                            .withComponent(component.name())
                            .endSource()
                            .withCount(1)
                            .withFirstTimestamp(now)
                            .withLastTimestamp(now)
                            .build();
        } else {
            event = existing;
            event.setCount(Optional.ofNullable(existing.getCount()).orElse(0) + 1);
            event.setLastTimestamp(now);
        }

        var written = write(client, event);
        written.ifPresent(listener);
        return existing == null && written.isPresent();
    }

    private static Optional<Event> write(KubernetesClient client, Event event) {
        try {
            return Optional.of(client.resource(event).createOrReplace());
        } catch (KubernetesClientException e) {
            if (e.getCode() != HttpURLConnection.HTTP_FORBIDDEN) {
                throw e;
            }
            // missing RBAC or a terminating namespace
            LOG.warn("Event {} was not recorded", event.getMetadata().getName(), e);
            return Optional.empty();
        }
    }

    @VisibleForTesting
    static ObjectReference toObjectReference(HasMetadata resource) {
        var meta = resource.getMetadata();
        return new ObjectReferenceBuilder()
                .withApiVersion(resource.getApiVersion())
                .withKind(resource.getKind())
                .withName(meta.getName())
                .withNamespace(meta.getNamespace())
                .withUid(meta.getUid())
                .withResourceVersion(meta.getResourceVersion())
                .build();
    }
}
