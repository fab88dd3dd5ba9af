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

/**
 * Коды ошибок undo-движка.
 *
 * Каждый код несет короткое сообщение, подсказку для пользователя и категорию.
 * Подробности конкретного случая (таблица, интервал, стек, watermark) хранит
 * {@link UndoException}, а не текст кода.
 */
public enum UndoErrorCode {

    // ============ Precondition Errors ============

    ALREADY_FROZEN(Category.PRECONDITION, "Undo log is already frozen",
            "Call unfreeze() before freezing again."),

    NOT_FROZEN(Category.PRECONDITION, "Undo log is not frozen",
            "Call freeze() before unfreeze()."),

    STACK_EMPTY(Category.PRECONDITION, "Interval stack is empty",
            "Check canUndo()/canRedo() before stepping."),

    STEP_WHILE_FROZEN(Category.PRECONDITION, "Cannot undo or redo while frozen",
            "Call unfreeze() first. Replayed changes would be discarded by the freeze window."),

    // ============ Resource Errors ============

    LOG_TABLE_UNAVAILABLE(Category.RESOURCE, "Undo log table cannot be created",
            "Check that the connection is writable and the log table name is not used by the application."),

    TRIGGER_INSTALL_FAILED(Category.RESOURCE, "Change recording trigger cannot be installed",
            "Check that the table exists in this connection, is not a WITHOUT ROWID table "
                    + "and has no foreign trigger named like _<table>_it/_ut/_dt."),

    UNINSTALL_FAILED(Category.RESOURCE, "Change recording triggers cannot be removed",
            "Check that the connection is still open."),

    TABLE_NOT_FOUND(Category.RESOURCE, "Tracked table not found",
            "Create the table in this connection before activating undo."),

    DATABASE_ERROR(Category.RESOURCE, "Undo log cannot be read or changed",
            "Unexpected failure of the underlying connection. Check the cause."),

    // ============ Replay Errors ============

    STEP_FAILED(Category.REPLAY, "Undo/redo step failed and was rolled back",
            "The interval was restored on its stack. "
                    + "A constraint or schema change conflicts with the recorded history."),

    // ============ Configuration Errors ============

    CONFIG_INVALID(Category.CONFIGURATION, "Invalid undo configuration",
            "Fix the value or remove it to use the default.");

    /**
     * Как вызывающему коду реагировать на ошибку.
     */
    public enum Category {
        /** Неверный порядок вызовов; состояние сессии не изменилось */
        PRECONDITION,
        /** База данных не дала выполнить операцию */
        RESOURCE,
        /** Шаг откатан, история сохранена */
        REPLAY,
        /** Неверные настройки */
        CONFIGURATION
    }

    private final Category category;
    private final String message;
    private final String solution;

    UndoErrorCode(Category category, String message, String solution) {
        this.category = category;
        this.message = message;
        this.solution = solution;
    }

    public Category getCategory() {
        return category;
    }

    public String getMessage() {
        return message;
    }

    public String getSolution() {
        return solution;
    }

    /**
     * Ошибка порядка вызовов: сессия осталась в прежнем состоянии и может продолжать работу.
     */
    public boolean isPrecondition() {
        return category == Category.PRECONDITION;
    }
}
