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

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/** Reads the environment variables the operator and the instance commands are configured by. */
public class EnvUtils {

    public static final String ENV_CONF_DIR = "PGFLEET_CONF_DIR";
    public static final String ENV_CONF_OVERRIDE_DIR = "PGFLEET_CONF_OVERRIDE_DIR";
    public static final String ENV_POD_NAME = "POD_NAME";
    public static final String ENV_NAMESPACE = "NAMESPACE";
    public static final String ENV_CLUSTER_NAME = "CLUSTER_NAME";
    public static final String ENV_PGDATA = "PGDATA";
    public static final String ENV_WATCH_NAMESPACES = "WATCH_NAMESPACES";

    private static final List<String> LOGGED_VARIABLES =
            List.of(
                    ENV_CONF_DIR,
                    ENV_CONF_OVERRIDE_DIR,
                    ENV_WATCH_NAMESPACES,
                    ENV_NAMESPACE,
                    ENV_CLUSTER_NAME,
                    ENV_POD_NAME,
                    ENV_PGDATA);

    /** Value of the variable, empty when unset or blank. */
    public static Optional<String> get(String key) {
        var value = System.getenv(key);
        return StringUtils.isBlank(value) ? Optional.empty() : Optional.of(value.trim());
    }

    public static String getOrDefault(String key, String defaultValue) {
        return get(key).orElse(defaultValue);
    }

    /**
     * Value of a variable the component cannot start without.
     *
     * @throws NoSuchElementException when the variable is unset or blank
     */
    public static String getRequired(String key) {
        return get(key).orElseThrow(
                        () ->
                                new NoSuchElementException(
                                        "Environment variable " + key + " must be set"));
    }

    /** Logs the JVM and the PgFleet environment variables a component starts with. */
    public static void logEnvironmentInfo(Logger log, String componentName, String[] args) {
        if (!log.isInfoEnabled()) {
            return;
        }
        log.info(
                "Starting {} on {} {} ({}), max heap {} MiB, arguments {}",
                componentName,
                System.getProperty("java.vm.name"),
                System.getProperty("java.version"),
                System.getProperty("os.arch"),
                Runtime.getRuntime().maxMemory() >>> 20,
                args == null || args.length == 0 ? "(none)" : String.join(" ", args));
        for (String variable : LOGGED_VARIABLES) {
            log.info("  {}={}", variable, get(variable).orElse("(not set)"));
        }
    }
}
