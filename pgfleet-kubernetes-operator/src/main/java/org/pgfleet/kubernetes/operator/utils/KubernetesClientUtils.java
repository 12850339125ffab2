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

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Kubernetes client utils. */
public class KubernetesClientUtils {

    private static final Logger LOG = LoggerFactory.getLogger(KubernetesClientUtils.class);

    public static KubernetesClient getKubernetesClient() {
        return new KubernetesClientBuilder().build();
    }

    /**
     * Checks if the class for a Custom Resource is installed in the current Kubernetes cluster.
     *
     * @param client Kubernetes client
     * @param clazz class of Custom Resource
     * @return true if the CRD present in the Kubernetes cluster
     */
    public static boolean isCrdInstalled(
            KubernetesClient client, Class<? extends HasMetadata> clazz) {
        try {
            client.resources(clazz).list().getItems();
            return true;
        } catch (Exception e) {
            LOG.debug("Could not find CRD {}", clazz.getSimpleName(), e);
            return false;
        }
    }
}
