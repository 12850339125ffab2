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

import org.apache.flink.annotation.VisibleForTesting;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.configuration.GlobalConfiguration;

import org.pgfleet.kubernetes.operator.utils.EnvUtils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Loads the operator configuration from the {@code flink-conf.yaml} file of the directory named
 * by {@code PGFLEET_CONF_DIR}. Keys found in the directory named by {@code
 * PGFLEET_CONF_OVERRIDE_DIR} take precedence.
 */
public class PgFleetConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(PgFleetConfigLoader.class);

    public static final String CONFIG_FILE_NAME = GlobalConfiguration.FLINK_CONF_FILENAME;

    public static Configuration loadConfiguration() {
        return loadConfiguration(
                EnvUtils.get(EnvUtils.ENV_CONF_DIR), EnvUtils.get(EnvUtils.ENV_CONF_OVERRIDE_DIR));
    }

    @VisibleForTesting
    static Configuration loadConfiguration(
            Optional<String> confDir, Optional<String> confOverrideDir) {
        Configuration overrides =
                confOverrideDir.map(GlobalConfiguration::loadConfiguration).orElse(null);
        if (confDir.isPresent()) {
            LOG.info(
                    "Loading configuration from {}{}",
                    confDir.get(),
                    confOverrideDir.map(dir -> " with overrides from " + dir).orElse(""));
            return GlobalConfiguration.loadConfiguration(confDir.get(), overrides);
        }
        LOG.info("{} is not set, using the default configuration", EnvUtils.ENV_CONF_DIR);
        return overrides == null ? new Configuration() : overrides;
    }
}
