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
package ru.nts.tools.undo.journal;

import ru.nts.tools.undo.core.DiagnosticLog;
import ru.nts.tools.undo.core.UndoErrorCode;
import ru.nts.tools.undo.core.UndoException;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Устанавливает и снимает триггеры, записывающие изменения отслеживаемых таблиц
 * в журнал. Единственная точка, через которую движок касается данных строк.
 */
public class ChangeRecorder {

    private final SqlEngine engine;
    private final TriggerSqlGenerator generator;
    private final DiagnosticLog diagnostics;

    public ChangeRecorder(SqlEngine engine, String logTable, DiagnosticLog diagnostics) {
        this.engine = engine;
        this.generator = new TriggerSqlGenerator(logTable);
        this.diagnostics = diagnostics;
    }

    /**
     * Снимает список колонок для каждой таблицы.
     *
     * @throws UndoException TABLE_NOT_FOUND если у таблицы нет колонок (таблицы нет)
     */
    public List<TrackedTable> describe(String... tableNames) {
        List<TrackedTable> tables = new ArrayList<>();
        for (String name : tableNames) {
            List<String> columns;
            try {
                columns = engine.columnNames(name);
            } catch (SQLException e) {
                throw UndoException.forTable(UndoErrorCode.TABLE_NOT_FOUND, name, e);
            }
            if (columns.isEmpty()) {
                throw UndoException.forTable(UndoErrorCode.TABLE_NOT_FOUND, name, null);
            }
            tables.add(new TrackedTable(name, columns));
        }
        return tables;
    }

    /**
     * Пересоздает таблицу журнала и ставит по три триггера на каждую таблицу.
     *
     * @throws UndoException LOG_TABLE_UNAVAILABLE или TRIGGER_INSTALL_FAILED;
     *                       без журнала движок работать не может
     */
    public void install(List<TrackedTable> tables) {
        try {
            engine.execute(generator.dropLogTableSql());
            engine.execute(generator.createLogTableSql());
        } catch (SQLException e) {
            throw UndoException.forTable(UndoErrorCode.LOG_TABLE_UNAVAILABLE, generator.getLogTable(), e);
        }

        for (TrackedTable table : tables) {
            for (String ddl : generator.triggersFor(table)) {
                try {
                    engine.execute(ddl);
                } catch (SQLException e) {
                    throw UndoException.forTable(UndoErrorCode.TRIGGER_INSTALL_FAILED, table.name(), e);
                }
            }
            diagnostics.log("Recording changes of " + table.name() + " " + table.columns());
        }
    }

    /**
     * Удаляет все TEMP-триггеры с именами по шаблону {@code _*_(i|u|d)t} и таблицу журнала.
     * Идемпотентен: отсутствие таблицы или триггеров не ошибка.
     *
     * @return количество удаленных триггеров
     */
    public int uninstall() {
        int dropped = 0;
        try {
            List<Object[]> rows = engine.executeRows(
                    "SELECT name FROM sqlite_temp_master WHERE type='trigger'");
            for (Object[] row : rows) {
                String trigger = String.valueOf(row[0]);
                if (!TriggerSqlGenerator.isRecorderTrigger(trigger)) continue;
                engine.execute("DROP TRIGGER IF EXISTS temp." + TriggerSqlGenerator.quoteIdentifier(trigger));
                dropped++;
            }
            engine.execute(generator.dropLogTableSql());
        } catch (SQLException e) {
            throw UndoException.uninstallFailed(e);
        }
        return dropped;
    }

    /**
     * Имена установленных триггеров рекордера (для диагностики).
     */
    public List<String> installedTriggers() throws SQLException {
        List<String> names = new ArrayList<>();
        for (Object[] row : engine.executeRows(
                "SELECT name FROM sqlite_temp_master WHERE type='trigger' ORDER BY name")) {
            String name = String.valueOf(row[0]);
            if (TriggerSqlGenerator.isRecorderTrigger(name)) {
                names.add(name);
            }
        }
        return names;
    }
}
