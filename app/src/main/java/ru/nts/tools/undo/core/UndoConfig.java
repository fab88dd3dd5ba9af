/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.undo.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Настройки undo-сессии.
 *
 * Источники:
 * - {@link #defaults()}
 * - {@link #fromEnvironment()}: UNDO_LOG_TABLE, UNDO_FREEZE_ENABLED, UNDO_DEBUG, UNDO_LOG_FILE
 * - {@link #load(Path)}: JSON-файл вида
 * <pre>
 * { "logTable": "undolog", "freezeEnabled": true, "debug": false, "logFile": "/tmp/undo.log" }
 * </pre>
 */
public final class UndoConfig {

    public static final String DEFAULT_LOG_TABLE = "undolog";

    public static final String ENV_LOG_TABLE = "UNDO_LOG_TABLE";
    public static final String ENV_FREEZE_ENABLED = "UNDO_FREEZE_ENABLED";
    public static final String ENV_DEBUG = "UNDO_DEBUG";
    public static final String ENV_LOG_FILE = "UNDO_LOG_FILE";

    private static final ObjectMapper mapper = new ObjectMapper();

    private final String logTable;
    private final boolean freezeEnabled;
    private final boolean debug;
    private final String logFile;

    private UndoConfig(Builder builder) {
        this.logTable = builder.logTable;
        this.freezeEnabled = builder.freezeEnabled;
        this.debug = builder.debug;
        this.logFile = builder.logFile;
    }

    public static UndoConfig defaults() {
        return builder().build();
    }

    public static UndoConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Собирает конфигурацию из переменных окружения; отсутствующие берутся по умолчанию.
     */
    public static UndoConfig fromEnvironment(Map<String, String> env) {
        Builder builder = builder();
        String table = env.get(ENV_LOG_TABLE);
        if (table != null && !table.isBlank()) {
            builder.logTable(table.trim());
        }
        String freeze = env.get(ENV_FREEZE_ENABLED);
        if (freeze != null && !freeze.isBlank()) {
            builder.freezeEnabled(!"false".equalsIgnoreCase(freeze.trim()));
        }
        builder.debug("true".equalsIgnoreCase(env.get(ENV_DEBUG)));
        builder.logFile(env.get(ENV_LOG_FILE));
        return builder.build();
    }

    /**
     * Читает конфигурацию из JSON-файла. Неизвестные поля игнорируются.
     *
     * @throws UndoException CONFIG_INVALID если файл не читается или поле имеет неверный тип
     */
    public static UndoConfig load(Path file) {
        JsonNode root;
        try {
            root = mapper.readTree(Files.readString(file));
        } catch (IOException e) {
            throw UndoException.configInvalid(file.toString(), e);
        }
        if (root == null || !root.isObject()) {
            throw UndoException.configInvalid(file.toString(), null);
        }

        Builder builder = builder();
        if (root.has("logTable")) {
            JsonNode node = root.get("logTable");
            if (!node.isTextual()) {
                throw UndoException.configInvalid("logTable", null);
            }
            builder.logTable(node.asText());
        }
        if (root.has("freezeEnabled")) {
            builder.freezeEnabled(requireBoolean(root, "freezeEnabled"));
        }
        if (root.has("debug")) {
            builder.debug(requireBoolean(root, "debug"));
        }
        if (root.hasNonNull("logFile")) {
            builder.logFile(root.get("logFile").asText());
        }
        return builder.build();
    }

    private static boolean requireBoolean(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (!node.isBoolean()) {
            throw UndoException.configInvalid(key, null);
        }
        return node.asBoolean();
    }

    public String getLogTable() {
        return logTable;
    }

    public boolean isFreezeEnabled() {
        return freezeEnabled;
    }

    public boolean isDebug() {
        return debug;
    }

    public String getLogFile() {
        return logFile;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "UndoConfig{logTable=" + logTable + ", freezeEnabled=" + freezeEnabled
                + ", debug=" + debug + ", logFile=" + logFile + "}";
    }

    /**
     * Builder для UndoConfig.
     */
    public static class Builder {
        private String logTable = DEFAULT_LOG_TABLE;
        private boolean freezeEnabled = true;
        private boolean debug;
        private String logFile;

        public Builder logTable(String logTable) {
            this.logTable = logTable;
            return this;
        }

        public Builder freezeEnabled(boolean freezeEnabled) {
            this.freezeEnabled = freezeEnabled;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder logFile(String logFile) {
            this.logFile = logFile;
            return this;
        }

        public UndoConfig build() {
            if (logTable == null || logTable.isBlank()) {
                throw UndoException.configInvalid("logTable", null);
            }
            return new UndoConfig(this);
        }
    }
}
