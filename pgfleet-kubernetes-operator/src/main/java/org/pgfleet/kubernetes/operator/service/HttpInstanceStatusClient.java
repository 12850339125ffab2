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

package org.pgfleet.kubernetes.operator.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.Pod;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.time.Duration;

/** {@link InstanceStatusClient} calling the HTTP status endpoint of the instance manager. */
public class HttpInstanceStatusClient implements InstanceStatusClient {

    private static final Logger LOG = LoggerFactory.getLogger(HttpInstanceStatusClient.class);

    static final String PG_CONTROLDATA_PATH = "/pg/controldata";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final int port;
    private final Duration timeout;

    public HttpInstanceStatusClient(int port, Duration timeout) {
        this.port = port;
        this.timeout = timeout;
    }

    @Override
    public String getPgControlData(Pod pod) throws IOException {
        var podIp = pod.getStatus() == null ? null : pod.getStatus().getPodIP();
        if (StringUtils.isEmpty(podIp)) {
            throw new IOException("Pod " + pod.getMetadata().getName() + " has no IP address");
        }

        var url = new URL("http", podIp, port, PG_CONTROLDATA_PATH);
        LOG.debug("Fetching pg_controldata from {}", url);
        HttpURLConnection conn = (HttpURLConnection) url.openConnection();
        conn.setConnectTimeout((int) timeout.toMillis());
        conn.setReadTimeout((int) timeout.toMillis());
        conn.setRequestMethod("GET");
        try {
            int responseCode = conn.getResponseCode();
            if (responseCode != HttpURLConnection.HTTP_OK) {
                throw new IOException(
                        String.format(
                                "Unexpected response code %d from %s", responseCode, url));
            }
            try (InputStream in = conn.getInputStream()) {
                var response = MAPPER.readValue(in, ControlDataResponse.class);
                if (StringUtils.isNotEmpty(response.getError())) {
                    throw new IOException(
                            "pg_controldata failed on pod "
                                    + pod.getMetadata().getName()
                                    + ": "
                                    + response.getError());
                }
                return StringUtils.defaultString(response.getData());
            }
        } finally {
            conn.disconnect();
        }
    }

    /** Body returned by the status endpoint. */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ControlDataResponse {
        private String data;
        private String error;
    }
}
