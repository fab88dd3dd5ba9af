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

import java.util.List;
import java.util.regex.Pattern;

/**
 * Генератор DDL для триггеров, записывающих обратные SQL-выражения в журнал.
 *
 * Тело каждого триггера собирает текст обратного выражения в момент срабатывания:
 * значения старой строки подставляются через {@code quote()} самого SQLite, поэтому
 * результат в журнале уже готов к повторному выполнению как есть.
 *
 * Имена триггеров: {@code _<table>_it}, {@code _<table>_ut}, {@code _<table>_dt}.
 */
public final class TriggerSqlGenerator {

    /**
     * Все триггеры, созданные генератором, и только они, попадают под этот шаблон.
     */
    public static final Pattern TRIGGER_NAME_PATTERN = Pattern.compile("^_.*_(i|u|d)t$");

    private final String logTable;

    public TriggerSqlGenerator(String logTable) {
        this.logTable = logTable;
    }

    public String getLogTable() {
        return logTable;
    }

    /**
     * DDL таблицы журнала. Временная: живет только в текущем соединении.
     */
    public String createLogTableSql() {
        return "CREATE TEMP TABLE " + quoteIdentifier(logTable) + "(seq integer primary key, sql text)";
    }

    public String dropLogTableSql() {
        return "DROP TABLE IF EXISTS temp." + quoteIdentifier(logTable);
    }

    /**
     * AFTER INSERT: обратное выражение удаляет вставленную строку по rowid.
     */
    public String insertTrigger(TrackedTable table) {
        String tbl = quoteIdentifier(table.name());
        StringBuilder sql = new StringBuilder();
        sql.append("CREATE TEMP TRIGGER ").append(quoteIdentifier(insertTriggerName(table)))
                .append(" AFTER INSERT ON ").append(tbl).append(" BEGIN\n");
        sql.append("  INSERT INTO ").append(quoteIdentifier(logTable)).append(" VALUES(NULL,");
        sql.append("'DELETE FROM ").append(literalText(tbl)).append(" WHERE rowid='||new.rowid);\n");
        sql.append("END");
        return sql.toString();
    }

    /**
     * AFTER UPDATE: обратное выражение возвращает все колонки к старым значениям.
     * Строка ищется по new.rowid: если обновление сменило INTEGER PRIMARY KEY,
     * по old.rowid ее уже нет, а SET возвращает ключ на место.
     */
    public String updateTrigger(TrackedTable table) {
        String tbl = quoteIdentifier(table.name());
        StringBuilder sql = new StringBuilder();
        sql.append("CREATE TEMP TRIGGER ").append(quoteIdentifier(updateTriggerName(table)))
                .append(" AFTER UPDATE ON ").append(tbl).append(" BEGIN\n");
        sql.append("  INSERT INTO ").append(quoteIdentifier(logTable)).append(" VALUES(NULL,");
        sql.append("'UPDATE ").append(literalText(tbl)).append(' ');
        String sep = "SET ";
        for (String column : table.columns()) {
            String col = quoteIdentifier(column);
            sql.append(sep).append(literalText(col)).append("='||quote(old.").append(col).append(")||'");
            sep = ",";
        }
        sql.append(" WHERE rowid='||new.rowid);\n");
        sql.append("END");
        return sql.toString();
    }

    /**
     * BEFORE DELETE: обратное выражение вставляет строку обратно с тем же rowid.
     */
    public String deleteTrigger(TrackedTable table) {
        String tbl = quoteIdentifier(table.name());
        List<String> columns = table.columns();
        StringBuilder sql = new StringBuilder();
        sql.append("CREATE TEMP TRIGGER ").append(quoteIdentifier(deleteTriggerName(table)))
                .append(" BEFORE DELETE ON ").append(tbl).append(" BEGIN\n");
        sql.append("  INSERT INTO ").append(quoteIdentifier(logTable)).append(" VALUES(NULL,");
        sql.append("'INSERT INTO ").append(literalText(tbl)).append("(rowid");
        for (String column : columns) {
            sql.append(',').append(literalText(quoteIdentifier(column)));
        }
        sql.append(") VALUES('||old.rowid||'");
        for (String column : columns) {
            sql.append(",'||quote(old.").append(quoteIdentifier(column)).append(")||'");
        }
        sql.append(")');\n");
        sql.append("END");
        return sql.toString();
    }

    /**
     * Все три триггера таблицы в порядке установки.
     */
    public List<String> triggersFor(TrackedTable table) {
        return List.of(insertTrigger(table), updateTrigger(table), deleteTrigger(table));
    }

    public static String insertTriggerName(TrackedTable table) {
        return "_" + table.name() + "_it";
    }

    public static String updateTriggerName(TrackedTable table) {
        return "_" + table.name() + "_ut";
    }

    public static String deleteTriggerName(TrackedTable table) {
        return "_" + table.name() + "_dt";
    }

    public static boolean isRecorderTrigger(String name) {
        return name != null && TRIGGER_NAME_PATTERN.matcher(name).matches();
    }

    /**
     * Заключает идентификатор в двойные кавычки, удваивая внутренние кавычки.
     */
    public static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    // Текст, вставляемый внутрь строкового литерала '...'
    private static String literalText(String text) {
        return text.replace("'", "''");
    }
}
