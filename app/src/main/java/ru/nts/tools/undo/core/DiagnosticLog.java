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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;

/**
 * Диагностический лог одной undo-сессии.
 *
 * По умолчанию молчит: приложение-хост может писать свой вывод в stderr.
 * Включается через {@link UndoConfig#isDebug()} (UNDO_DEBUG=true): вывод в stderr,
 * и/или через {@link UndoConfig#getLogFile()} (UNDO_LOG_FILE): дописывание в файл.
 * Файл открывается на каждую запись, поэтому несколько сессий могут писать
 * в один и тот же файл или в разные.
 */
public final class DiagnosticLog {

    private static final DiagnosticLog SILENT = new DiagnosticLog(false, null);

    private final boolean debug;
    private final Path logFile;
    private volatile boolean fileDisabled;

    public DiagnosticLog(UndoConfig config) {
        this(config.isDebug(),
                config.getLogFile() != null && !config.getLogFile().isBlank() ? Path.of(config.getLogFile()) : null);
    }

    private DiagnosticLog(boolean debug, Path logFile) {
        this.debug = debug;
        this.logFile = logFile;
    }

    public static DiagnosticLog silent() {
        return SILENT;
    }

    /**
     * Записывает сообщение в лог-файл (если настроен) и в stderr (если debug).
     */
    public void log(String message) {
        if (logFile != null && !fileDisabled) {
            String line = "[" + LocalDateTime.now() + "] " + message + System.lineSeparator();
            try {
                Files.writeString(logFile, line, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                fileDisabled = true;
                System.err.println("Undo log file disabled, cannot write " + logFile + ": " + e.getMessage());
            }
        }
        if (debug) {
            System.err.println("[undo] " + message);
        }
    }

    public void log(UndoException e) {
        log(e.toLogMessage());
    }

    public boolean isEnabled() {
        return debug || (logFile != null && !fileDisabled);
    }

    public Path getLogFile() {
        return logFile;
    }
}
