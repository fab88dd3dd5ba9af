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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Управление жизненным циклом embedded SQLite базы, над которой работает undo/redo.
 *
 * В отличие от пула соединений здесь ровно одно долгоживущее соединение:
 * журнал и триггеры создаются как TEMP-объекты и существуют только внутри него.
 * Приложение обязано менять отслеживаемые таблицы через {@link #getConnection()}.
 *
 * Поддерживает:
 * - Файловый режим: {dir}/undo.db (директории создаются автоматически)
 * - In-memory режим для тестов и временных сессий
 * - Ленивое открытие при первом обращении
 */
public class UndoDatabase implements AutoCloseable {

    public static final String DB_FILE_NAME = "undo.db";

    private final Path dbPath;  // null for in-memory mode
    private final String jdbcUrl;
    private Connection connection;
    private JdbcSqlEngine engine;
    private volatile boolean closed;

    /**
     * Создает экземпляр для файловой базы в указанной директории.
     *
     * @param dir директория базы; файл {@value #DB_FILE_NAME} создается SQLite
     */
    public UndoDatabase(Path dir) {
        this.dbPath = dir.resolve(DB_FILE_NAME);
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath().toString().replace('\\', '/');
    }

    private UndoDatabase(String jdbcUrl) {
        this.dbPath = null;
        this.jdbcUrl = jdbcUrl;
    }

    /**
     * Создает in-memory базу. Данные исчезают при close().
     */
    public static UndoDatabase inMemory() {
        return new UndoDatabase("jdbc:sqlite::memory:");
    }

    /**
     * Открывает соединение, если оно еще не открыто. Безопасен для повторного вызова.
     */
    public synchronized void open() throws SQLException {
        if (closed) {
            throw new SQLException("UndoDatabase is closed");
        }
        if (connection != null) return;

        if (dbPath != null) {
            try {
                Files.createDirectories(dbPath.toAbsolutePath().getParent());
            } catch (IOException e) {
                throw new SQLException("Cannot create database directory: " + e.getMessage(), e);
            }
        }

        connection = DriverManager.getConnection(jdbcUrl);
        engine = new JdbcSqlEngine(connection);
    }

    /**
     * Возвращает единственное соединение базы, открывая его при необходимости.
     */
    public synchronized Connection getConnection() throws SQLException {
        open();
        return connection;
    }

    /**
     * Возвращает {@link SqlEngine} поверх соединения базы.
     */
    public synchronized JdbcSqlEngine engine() throws SQLException {
        open();
        return engine;
    }

    public boolean isOpen() {
        return connection != null && !closed;
    }

    /**
     * Проверяет, существует ли файл базы данных на диске.
     */
    public boolean existsOnDisk() {
        return dbPath != null && Files.exists(dbPath);
    }

    /**
     * Возвращает путь к файлу базы данных (null для in-memory).
     */
    public Path getDbPath() {
        return dbPath;
    }

    @Override
    public synchronized void close() throws SQLException {
        if (closed) return;
        closed = true;
        if (connection != null) {
            try {
                connection.close();
            } finally {
                connection = null;
                engine = null;
            }
        }
    }

    /**
     * Удаляет файл базы данных с диска. Вызывать только после close().
     */
    public void deleteFiles() throws IOException {
        if (dbPath == null) return;  // in-memory: nothing to delete
        Files.deleteIfExists(dbPath);
        Files.deleteIfExists(Path.of(dbPath + "-journal"));
    }
}
