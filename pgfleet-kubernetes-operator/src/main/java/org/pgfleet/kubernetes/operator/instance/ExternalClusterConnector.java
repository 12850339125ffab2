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

import org.pgfleet.kubernetes.operator.api.spec.ExternalClusterSpec;
import org.pgfleet.kubernetes.operator.exception.PreconditionFailedException;

import io.fabric8.kubernetes.api.model.SecretKeySelector;
import io.fabric8.kubernetes.client.KubernetesClient;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Prepares the connection to a server outside of the cluster. The credentials referenced by the
 * external cluster are read from their secrets and written to files only readable by the owner.
 */
public class ExternalClusterConnector {

    static final Set<PosixFilePermission> OWNER_READ_WRITE =
            PosixFilePermissions.fromString("rw-------");

    private static final String ANY = "*";

    private final KubernetesClient client;
    private final Path secretsDir;

    public ExternalClusterConnector(KubernetesClient client, Path secretsDir) {
        this.client = client;
        this.secretsDir = secretsDir;
    }

    /** Connection string and password file for an external server. */
    @Value
    public static class Connection {
        String connectionString;
        @Nullable Path passFile;

        public Optional<Path> getPassFile() {
            return Optional.ofNullable(passFile);
        }
    }

    public Connection configureConnectionToServer(String namespace, ExternalClusterSpec server)
            throws IOException {
        var parameters = new TreeMap<String, String>();
        if (server.getConnectionParameters() != null) {
            parameters.putAll(server.getConnectionParameters());
        }

        if (server.getSslCert() != null) {
            parameters.put(
                    "sslcert", dumpSecretKey(namespace, server, server.getSslCert()).toString());
        }
        if (server.getSslKey() != null) {
            parameters.put(
                    "sslkey", dumpSecretKey(namespace, server, server.getSslKey()).toString());
        }
        if (server.getSslRootCert() != null) {
            parameters.put(
                    "sslrootcert",
                    dumpSecretKey(namespace, server, server.getSslRootCert()).toString());
        }

        Path passFile = null;
        if (server.getPassword() != null) {
            var password = readSecretKey(namespace, server.getPassword());
            passFile = secretsDir.resolve(server.getName() + ".pgpass");
            PostgresConfigFiles.writeFileAtomic(
                    passFile, createPgPassLine(parameters, password), OWNER_READ_WRITE);
        }

        return new Connection(PostgresConfigFiles.toConnectionString(parameters), passFile);
    }

    /** A pgpass line matching the connection parameters of the server. */
    static String createPgPassLine(Map<String, String> parameters, String password) {
        return String.join(
                        ":",
                        escapePgPass(parameters.getOrDefault("host", ANY)),
                        escapePgPass(parameters.getOrDefault("port", ANY)),
                        escapePgPass(parameters.getOrDefault("dbname", ANY)),
                        escapePgPass(parameters.getOrDefault("user", ANY)),
                        escapePgPass(password))
                + "\n";
    }

    private Path dumpSecretKey(
            String namespace, ExternalClusterSpec server, SecretKeySelector selector)
            throws IOException {
        var file =
                secretsDir.resolve(
                        String.format(
                                "%s-%s-%s",
                                server.getName(), selector.getName(), selector.getKey()));
        PostgresConfigFiles.writeFileAtomic(
                file, readSecretKey(namespace, selector), OWNER_READ_WRITE);
        return file;
    }

    private String readSecretKey(String namespace, SecretKeySelector selector) {
        var secret = client.secrets().inNamespace(namespace).withName(selector.getName()).get();
        if (secret == null) {
            throw new PreconditionFailedException(
                    String.format(
                            "Secret %s not found in namespace %s", selector.getName(), namespace));
        }
        if (secret.getData() != null && secret.getData().containsKey(selector.getKey())) {
            return new String(
                    Base64.getDecoder().decode(secret.getData().get(selector.getKey())),
                    StandardCharsets.UTF_8);
        }
        if (secret.getStringData() != null
                && secret.getStringData().containsKey(selector.getKey())) {
            return secret.getStringData().get(selector.getKey());
        }
        throw new PreconditionFailedException(
                String.format(
                        "Key %s not found in secret %s", selector.getKey(), selector.getName()));
    }

    private static String escapePgPass(String value) {
        return StringUtils.replaceEach(
                value, new String[] {"\\", ":"}, new String[] {"\\\\", "\\:"});
    }
}
