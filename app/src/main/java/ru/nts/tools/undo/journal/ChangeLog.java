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

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Репозиторий для всех SQL-операций над таблицей журнала.
 *
 * Движок только читает, перебирает диапазоны и удаляет строки журнала;
 * вставляют их исключительно триггеры. Транзакционностью управляет вызывающий код:
 * <pre>
 *   engine.beginTransaction();
 *   List&lt;LogEntry&gt; entries = log.readRange(begin, end);
 *   log.deleteRange(begin, end);
 *   ...
 *   engine.commit();
 * </pre>
 */
public class ChangeLog {

    private final SqlEngine engine;
    private final String table;

    public ChangeLog(SqlEngine engine, String logTable) {
        this.engine = engine;
        this.table = TriggerSqlGenerator.quoteIdentifier(logTable);
    }

    /**
     * Максимальный номер записи журнала или 0, если журнал пуст.
     */
    public long maxSequence() throws SQLException {
        Long max = engine.executeScalar("SELECT coalesce(max(seq),0) FROM " + table, Long.class);
        return max != null ? max : 0;
    }

    /**
     * Читает записи с begin &lt;= seq &lt;= end, упорядоченные по seq DESC
     * (поздние изменения откатываются раньше ранних).
     */
    public List<LogEntry> readRange(long begin, long end) throws SQLException {
        List<LogEntry> result = new ArrayList<>();
        List<Object[]> rows = engine.executeRows(
                "SELECT seq, sql FROM " + table + " WHERE seq>=" + begin + " AND seq<=" + end
                        + " ORDER BY seq DESC");
        for (Object[] row : rows) {
            result.add(new LogEntry(((Number) row[0]).longValue(), (String) row[1]));
        }
        return result;
    }

    /**
     * Удаляет записи с begin &lt;= seq &lt;= end.
     */
    public void deleteRange(long begin, long end) throws SQLException {
        engine.execute("DELETE FROM " + table + " WHERE seq>=" + begin + " AND seq<=" + end);
    }

    /**
     * Удаляет все записи с seq &gt; watermark. Возвращает количество удаленных.
     */
    public long deleteAbove(long watermark) throws SQLException {
        long count = countAbove(watermark);
        engine.execute("DELETE FROM " + table + " WHERE seq>" + watermark);
        return count;
    }

    public long countAbove(long watermark) throws SQLException {
        Long count = engine.executeScalar("SELECT count(*) FROM " + table + " WHERE seq>" + watermark, Long.class);
        return count != null ? count : 0;
    }

    public long size() throws SQLException {
        return countAbove(0);
    }

    /**
     * Все записи журнала по возрастанию seq (для диагностики и тестов).
     */
    public List<LogEntry> readAll() throws SQLException {
        List<LogEntry> result = new ArrayList<>();
        for (Object[] row : engine.executeRows("SELECT seq, sql FROM " + table + " ORDER BY seq")) {
            result.add(new LogEntry(((Number) row[0]).longValue(), (String) row[1]));
        }
        return result;
    }
}
