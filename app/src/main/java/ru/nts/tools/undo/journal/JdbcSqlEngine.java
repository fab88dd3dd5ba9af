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

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link SqlEngine} поверх одного JDBC-соединения SQLite (plain JDBC, без ORM).
 *
 * Соединение должно быть тем же, через которое приложение меняет отслеживаемые
 * таблицы: TEMP-триггеры и TEMP-таблица журнала видны только в нем.
 * commit() и rollback() возвращают тот режим auto-commit, что был до beginTransaction().
 * Если хост держал auto-commit выключенным, его незакоммиченные изменения
 * фиксируются или откатываются вместе с шагом.
 */
public class JdbcSqlEngine implements SqlEngine {

    private final Connection conn;
    private boolean inTransaction;
    // режим auto-commit хоста до beginTransaction()
    private boolean restoreAutoCommit = true;

    public JdbcSqlEngine(Connection conn) {
        this.conn = conn;
    }

    public Connection getConnection() {
        return conn;
    }

    @Override
    public void execute(String sql) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.executeUpdate(sql);
        }
    }

    @Override
    public <T> T executeScalar(String sql, Class<T> type) throws SQLException {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            if (!rs.next()) {
                throw new SQLException("Scalar query returned no rows: " + sql);
            }
            Object value = rs.getObject(1);
            return convert(value, type);
        }
    }

    @Override
    public List<Object[]> executeRows(String sql) throws SQLException {
        List<Object[]> rows = new ArrayList<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            ResultSetMetaData meta = rs.getMetaData();
            int columns = meta.getColumnCount();
            while (rs.next()) {
                Object[] row = new Object[columns];
                for (int i = 0; i < columns; i++) {
                    row[i] = rs.getObject(i + 1);
                }
                rows.add(row);
            }
        }
        return rows;
    }

    @Override
    public void beginTransaction() throws SQLException {
        if (inTransaction) {
            throw new SQLException("Transaction already in progress");
        }
        // sqlite-jdbc открывает BEGIN лениво при первом statement
        restoreAutoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        inTransaction = true;
    }

    @Override
    public void commit() throws SQLException {
        if (!inTransaction) {
            throw new SQLException("No transaction in progress");
        }
        try {
            conn.commit();
        } finally {
            inTransaction = false;
            conn.setAutoCommit(restoreAutoCommit);
        }
    }

    @Override
    public void rollback() throws SQLException {
        if (!inTransaction) {
            return;
        }
        try {
            conn.rollback();
        } finally {
            inTransaction = false;
            conn.setAutoCommit(restoreAutoCommit);
        }
    }

    public boolean isInTransaction() {
        return inTransaction;
    }

    @Override
    public List<String> columnNames(String table) throws SQLException {
        List<String> names = new ArrayList<>();
        // pragma table_info: cid, name, type, notnull, dflt_value, pk
        for (Object[] row : executeRows("PRAGMA table_info(" + TriggerSqlGenerator.quoteIdentifier(table) + ")")) {
            names.add(String.valueOf(row[1]));
        }
        return names;
    }

    private static <T> T convert(Object value, Class<T> type) {
        if (value == null) {
            return null;
        }
        if (type == Long.class && value instanceof Number n) {
            return type.cast(n.longValue());
        }
        if (type == Integer.class && value instanceof Number n) {
            return type.cast(n.intValue());
        }
        if (type == String.class) {
            return type.cast(value.toString());
        }
        return type.cast(value);
    }
}
