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
 * Ошибка undo-движка.
 *
 * Создается фабричными методами по видам отказа; каждый заполняет только свои поля:
 * <ul>
 *   <li>{@link #getTable()}: TABLE_NOT_FOUND, LOG_TABLE_UNAVAILABLE, TRIGGER_INSTALL_FAILED</li>
 *   <li>{@link #getInterval()} и {@link #getStack()}: STEP_FAILED</li>
 *   <li>{@link #getStack()}: STACK_EMPTY</li>
 *   <li>{@link #getWatermark()}: ALREADY_FROZEN</li>
 *   <li>{@link #getKey()}: CONFIG_INVALID</li>
 *   <li>{@link #getOperation()}: DATABASE_ERROR</li>
 * </ul>
 */
public class UndoException extends RuntimeException {

    private final UndoErrorCode code;
    private final String table;
    private final Interval interval;
    private final String stack;
    private final long watermark;
    private final String key;
    private final String operation;

    private UndoException(UndoErrorCode code, String table, Interval interval, String stack,
                          long watermark, String key, String operation, Throwable cause) {
        super(code.getMessage(), cause);
        this.code = code;
        this.table = table;
        this.interval = interval;
        this.stack = stack;
        this.watermark = watermark;
        this.key = key;
        this.operation = operation;
    }

    /**
     * Ошибка порядка вызовов без подробностей (NOT_FROZEN, STEP_WHILE_FROZEN).
     */
    public static UndoException precondition(UndoErrorCode code) {
        return new UndoException(code, null, null, null, UndoState.NOT_FROZEN, null, null, null);
    }

    public static UndoException alreadyFrozen(long watermark) {
        return new UndoException(UndoErrorCode.ALREADY_FROZEN, null, null, null, watermark, null, null, null);
    }

    public static UndoException stackEmpty(String stack) {
        return new UndoException(UndoErrorCode.STACK_EMPTY, null, null, stack, UndoState.NOT_FROZEN, null, null, null);
    }

    /**
     * Отказ, относящийся к конкретной таблице (отслеживаемой или журналу).
     *
     * @param cause может быть null
     */
    public static UndoException forTable(UndoErrorCode code, String table, Throwable cause) {
        return new UndoException(code, table, null, null, UndoState.NOT_FROZEN, null, null, cause);
    }

    public static UndoException uninstallFailed(Throwable cause) {
        return new UndoException(UndoErrorCode.UNINSTALL_FAILED, null, null, null, UndoState.NOT_FROZEN,
                null, null, cause);
    }

    /**
     * Сбой чтения или изменения журнала вне шага undo/redo.
     *
     * @param operation что движок делал: "barrier", "freeze", "unfreeze above 12"
     */
    public static UndoException databaseError(String operation, Throwable cause) {
        return new UndoException(UndoErrorCode.DATABASE_ERROR, null, null, null, UndoState.NOT_FROZEN,
                null, operation, cause);
    }

    /**
     * Шаг откатан; интервал возвращен на стек {@code stack}.
     */
    public static UndoException stepFailed(Interval interval, String stack, Throwable cause) {
        return new UndoException(UndoErrorCode.STEP_FAILED, null, interval, stack, UndoState.NOT_FROZEN,
                null, null, cause);
    }

    /**
     * @param cause может быть null
     */
    public static UndoException configInvalid(String key, Throwable cause) {
        return new UndoException(UndoErrorCode.CONFIG_INVALID, null, null, null, UndoState.NOT_FROZEN,
                key, null, cause);
    }

    public UndoErrorCode getCode() {
        return code;
    }

    public String getTable() {
        return table;
    }

    /**
     * Интервал, который не удалось воспроизвести (только STEP_FAILED).
     */
    public Interval getInterval() {
        return interval;
    }

    public String getStack() {
        return stack;
    }

    /**
     * Watermark действующей заморозки или {@link UndoState#NOT_FROZEN}.
     */
    public long getWatermark() {
        return watermark;
    }

    public String getKey() {
        return key;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * Чего касается ошибка, например {@code interval (2,2) on undo stack}; null если не о чем сказать.
     */
    public String subject() {
        if (interval != null) {
            return "interval " + interval + " on " + stack + " stack";
        }
        if (stack != null) {
            return stack + " stack";
        }
        if (table != null) {
            return "table '" + table + "'";
        }
        if (watermark != UndoState.NOT_FROZEN) {
            return "frozen at sequence " + watermark;
        }
        if (key != null) {
            return "key '" + key + "'";
        }
        return operation;
    }

    @Override
    public String getMessage() {
        String subject = subject();
        return subject != null ? code.getMessage() + ": " + subject : code.getMessage();
    }

    /**
     * Многострочное сообщение для пользователя:
     * <pre>
     * [STEP_FAILED] Undo/redo step failed and was rolled back: interval (2,2) on undo stack
     * Solution: The interval was restored on its stack. ...
     * Cause: UNIQUE constraint failed: t.a
     * </pre>
     */
    public String toUserMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(code.name()).append("] ").append(getMessage());
        sb.append("\nSolution: ").append(code.getSolution());
        if (getCause() != null) {
            sb.append("\nCause: ").append(getCause().getMessage());
        }
        return sb.toString();
    }

    /**
     * Одна строка для диагностического лога.
     */
    public String toLogMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(code.name()).append("] ").append(getMessage());
        if (getCause() != null) {
            sb.append(" | cause: ").append(getCause().getMessage());
        }
        return sb.toString();
    }
}
