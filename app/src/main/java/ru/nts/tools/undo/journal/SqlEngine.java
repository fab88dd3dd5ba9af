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
import java.util.List;

/**
 * Narrow contract to the relational engine.
 *
 * <p>Everything the undo engine needs from the database goes through here:
 * plain statements, scalar and row queries, transaction boundaries and the ordered
 * column list of a table. Value quoting happens inside trigger bodies (the engine's
 * {@code quote()} function), never through this interface.
 */
public interface SqlEngine {

    /**
     * Runs a non-query statement.
     */
    void execute(String sql) throws SQLException;

    /**
     * Runs a query returning exactly one value.
     *
     * @return the value converted to {@code type}, or null for SQL NULL
     */
    <T> T executeScalar(String sql, Class<T> type) throws SQLException;

    /**
     * Runs a query returning zero or more rows, each row as an array of column values.
     */
    List<Object[]> executeRows(String sql) throws SQLException;

    void beginTransaction() throws SQLException;

    void commit() throws SQLException;

    void rollback() throws SQLException;

    /**
     * Ordered column names of a table; empty if the table does not exist.
     */
    List<String> columnNames(String table) throws SQLException;
}
