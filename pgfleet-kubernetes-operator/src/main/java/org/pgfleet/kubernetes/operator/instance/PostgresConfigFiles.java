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

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** Reads and writes the configuration files in the data directory of an instance. */
public class PostgresConfigFiles {

    private static final Logger LOG = LoggerFactory.getLogger(PostgresConfigFiles.class);

    public static final String POSTGRESQL_AUTO_CONF = "postgresql.auto.conf";
    public static final String OVERRIDE_CONF = "override.conf";
    public static final String STANDBY_SIGNAL = "standby.signal";

    public static final String PRIMARY_CONNINFO = "primary_conninfo";
    public static final String PRIMARY_SLOT_NAME = "primary_slot_name";
    public static final String RECOVERY_TARGET_TIMELINE = "recovery_target_timeline";

    private static final String OVERRIDE_CONF_HEADER =
            "# Do not edit this file manually!\n"
                    + "# It will be overwritten by the PgFleet instance manager\n";

    private static final Pattern ARCHIVE_MODE_LINE = Pattern.compile("^\\s*archive_mode\\s*=.*$");

    /**
     * Removes the {@code archive_mode} setting written to {@code postgresql.auto.conf} by older
     * versions for designated primaries.
     *
     * @return true if the file changed
     */
    public static boolean removeArchiveModeFromAutoConf(Path pgData) throws IOException {
        var autoConf = pgData.resolve(POSTGRESQL_AUTO_CONF);
        if (!Files.exists(autoConf)) {
            return false;
        }
        List<String> lines = Files.readAllLines(autoConf, StandardCharsets.UTF_8);
        List<String> kept =
                lines.stream()
                        .filter(line -> !ARCHIVE_MODE_LINE.matcher(line).matches())
                        .collect(Collectors.toList());
        if (kept.size() == lines.size()) {
            return false;
        }
        LOG.info("Removing archive_mode from {}", autoConf);
        return writeFileAtomic(autoConf, joinLines(kept), null);
    }

    /**
     * Writes the standby settings to {@code override.conf} and makes sure the instance starts in
     * standby mode.
     *
     * @return true if {@code override.conf} changed
     */
    public static boolean updateReplicaConfiguration(
            Path pgData, String primaryConnInfo, Optional<String> slotName) throws IOException {
        var content = new StringBuilder(OVERRIDE_CONF_HEADER);
        appendSetting(content, PRIMARY_CONNINFO, primaryConnInfo);
        slotName.ifPresent(slot -> appendSetting(content, PRIMARY_SLOT_NAME, slot));
        appendSetting(content, RECOVERY_TARGET_TIMELINE, "latest");

        boolean changed = writeFileAtomic(pgData.resolve(OVERRIDE_CONF), content.toString(), null);
        ensureStandbySignal(pgData);
        return changed;
    }

    /** Creates the empty {@code standby.signal} file, if missing. */
    public static void ensureStandbySignal(Path pgData) throws IOException {
        var signal = pgData.resolve(STANDBY_SIGNAL);
        if (!Files.exists(signal)) {
            Files.createFile(signal);
        }
    }

    /**
     * Replaces the content of the file, going through a temporary file in the same directory so
     * that readers never see a partially written file.
     *
     * @param permissions permissions of the new file, null to keep the default ones
     * @return false if the file already had the expected content and was left untouched
     */
    public static boolean writeFileAtomic(
            Path file, String content, @Nullable Set<PosixFilePermission> permissions)
            throws IOException {
        if (Files.exists(file)
                && content.equals(
                        FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8))) {
            return false;
        }

        var dir = file.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        var tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
        try {
            if (permissions != null) {
                Files.setPosixFilePermissions(tmp, permissions);
            }
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            Files.move(
                    tmp,
                    file,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
        return true;
    }

    /** Quotes a value for a PostgreSQL configuration file. */
    public static String quoteConfigValue(String value) {
        return "'" + StringUtils.replace(value, "'", "''") + "'";
    }

    /** Builds a libpq connection string, the parameters are written in key order. */
    public static String toConnectionString(Map<String, String> parameters) {
        return parameters.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + "=" + quoteConnInfoValue(e.getValue()))
                .collect(Collectors.joining(" "));
    }

    /** Quotes a libpq connection parameter value. */
    public static String quoteConnInfoValue(String value) {
        var escaped =
                StringUtils.replaceEach(
                        value, new String[] {"\\", "'"}, new String[] {"\\\\", "\\'"});
        return "'" + escaped + "'";
    }

    private static void appendSetting(StringBuilder content, String key, String value) {
        content.append(key).append(" = ").append(quoteConfigValue(value)).append('\n');
    }

    private static String joinLines(List<String> lines) {
        return lines.isEmpty() ? "" : String.join("\n", lines) + "\n";
    }
}
