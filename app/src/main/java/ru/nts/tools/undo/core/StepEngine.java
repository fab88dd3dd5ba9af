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

import ru.nts.tools.undo.journal.ChangeLog;
import ru.nts.tools.undo.journal.LogEntry;
import ru.nts.tools.undo.journal.SqlEngine;

import java.sql.SQLException;
import java.util.List;

/**
 * Выполняет один шаг undo или redo.
 *
 * Алгоритм шага:
 * 1. Снимает интервал с исходного стека
 * 2. В одной транзакции читает записи интервала (seq DESC), удаляет их из журнала
 *    и выполняет обратные SQL. Триггеры при этом пишут в журнал обратные операции
 *    для противоположного направления
 * 3. После коммита кладет новый интервал на стек-приемник
 *
 * При ошибке транзакция откатывается, интервал возвращается на исходный стек.
 */
public class StepEngine {

    private final SqlEngine engine;
    private final ChangeLog log;
    private final IntervalTracker tracker;
    private final DiagnosticLog diagnostics;

    public StepEngine(SqlEngine engine, ChangeLog log, IntervalTracker tracker, DiagnosticLog diagnostics) {
        this.engine = engine;
        this.log = log;
        this.tracker = tracker;
        this.diagnostics = diagnostics;
    }

    /**
     * Выполняет шаг в указанном направлении.
     *
     * @return результат; NOTHING_TO_UNDO / NOTHING_TO_REDO если исходный стек пуст
     * @throws UndoException STEP_WHILE_FROZEN во время заморозки, STEP_FAILED при ошибке воспроизведения
     */
    public StepResult step(UndoState state, StepDirection direction) {
        IntervalStack source = state.source(direction);
        IntervalStack destination = state.destination(direction);

        if (!state.isActive() || source.isEmpty()) {
            return StepResult.nothingToDo(direction);
        }
        if (state.isFrozen()) {
            throw UndoException.precondition(UndoErrorCode.STEP_WHILE_FROZEN);
        }

        Interval interval = source.pop();
        long savedFirstLog = state.getFirstLog();
        int statements = 0;
        Interval produced = null;

        try {
            engine.beginTransaction();
            List<LogEntry> entries = log.readRange(interval.begin(), interval.end());
            log.deleteRange(interval.begin(), interval.end());
            state.setFirstLog(log.maxSequence() + 1);
            for (LogEntry entry : entries) {
                engine.execute(entry.inverseSql());
                statements++;
            }
            long end = log.maxSequence();
            engine.commit();

            if (end >= state.getFirstLog()) {
                produced = new Interval(state.getFirstLog(), end);
            }
        } catch (SQLException e) {
            UndoException failure = UndoException.stepFailed(interval, source.getName(), e);
            try {
                engine.rollback();
            } catch (SQLException rollbackError) {
                failure.addSuppressed(rollbackError);
            }
            source.push(interval);
            state.setFirstLog(savedFirstLog);
            diagnostics.log(failure);
            throw failure;
        }

        if (produced != null) {
            destination.push(produced);
        }
        tracker.startInterval(state);
        diagnostics.log(direction + " replayed " + interval + " (" + statements + " statements)"
                + (produced != null ? ", pushed " + produced + " to " + destination.getName() : ""));
        return StepResult.success(direction, interval, produced, statements);
    }
}
