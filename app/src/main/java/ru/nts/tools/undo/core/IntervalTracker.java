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

import java.sql.SQLException;
import java.util.Optional;

/**
 * Превращает непрерывный участок журнала в интервал undo-стека.
 */
public class IntervalTracker {

    private final ChangeLog log;
    private final DiagnosticLog diagnostics;

    public IntervalTracker(ChangeLog log, DiagnosticLog diagnostics) {
        this.log = log;
        this.diagnostics = diagnostics;
    }

    /**
     * Начинает новый интервал: firstLog = max(seq) + 1.
     */
    public void startInterval(UndoState state) {
        try {
            state.setFirstLog(log.maxSequence() + 1);
        } catch (SQLException e) {
            throw UndoException.databaseError("start interval", e);
        }
    }

    /**
     * Закрывает текущий участок журнала в один шаг undo.
     *
     * Если заморожено, конец интервала ограничивается watermark: записи, сделанные
     * во время заморозки, в интервал не попадают. Пустой участок ничего не добавляет.
     * Непустой интервал очищает redo-стек.
     *
     * @return записанный интервал или empty, если записывать нечего
     */
    public Optional<Interval> barrier(UndoState state) {
        state.setPendingEvent(false);
        if (!state.isActive()) {
            return Optional.empty();
        }

        long end;
        try {
            end = log.maxSequence();
        } catch (SQLException e) {
            throw UndoException.databaseError("barrier", e);
        }
        if (state.isFrozen() && end > state.getFreezeWatermark()) {
            end = state.getFreezeWatermark();
        }
        long begin = state.getFirstLog();
        startInterval(state);
        if (begin == state.getFirstLog() || begin > end) {
            return Optional.empty();
        }

        Interval interval = new Interval(begin, end);
        state.undoStack().push(interval);
        state.redoStack().clear();
        diagnostics.log("Barrier recorded " + interval);
        return Optional.of(interval);
    }
}
