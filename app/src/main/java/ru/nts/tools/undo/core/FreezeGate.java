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

/**
 * Окно заморозки: изменения между freeze() и unfreeze() не попадают в историю.
 *
 * Триггеры продолжают писать в журнал; unfreeze() просто удаляет все записи
 * выше watermark. Повторная заморозка без разморозки является ошибкой.
 */
public class FreezeGate {

    private final ChangeLog log;
    private final boolean enabled;
    private final DiagnosticLog diagnostics;

    public FreezeGate(ChangeLog log, boolean enabled, DiagnosticLog diagnostics) {
        this.log = log;
        this.enabled = enabled;
        this.diagnostics = diagnostics;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Запоминает текущий максимум журнала как watermark.
     *
     * @throws UndoException ALREADY_FROZEN при повторном вызове
     */
    public void freeze(UndoState state) {
        if (!enabled || !state.isActive()) {
            return;
        }
        if (state.isFrozen()) {
            throw UndoException.alreadyFrozen(state.getFreezeWatermark());
        }
        try {
            state.setFreezeWatermark(log.maxSequence());
        } catch (SQLException e) {
            throw UndoException.databaseError("freeze", e);
        }
        diagnostics.log("Frozen at sequence " + state.getFreezeWatermark());
    }

    /**
     * Удаляет записи, сделанные во время заморозки, и снимает watermark.
     *
     * @return количество отброшенных записей журнала
     * @throws UndoException NOT_FROZEN если заморозки не было
     */
    public long unfreeze(UndoState state) {
        if (!enabled || !state.isActive()) {
            return 0;
        }
        if (!state.isFrozen()) {
            throw UndoException.precondition(UndoErrorCode.NOT_FROZEN);
        }
        long watermark = state.getFreezeWatermark();
        long discarded;
        try {
            discarded = log.deleteAbove(watermark);
        } catch (SQLException e) {
            throw UndoException.databaseError("unfreeze above " + watermark, e);
        }
        // barrier() во время заморозки мог сдвинуть firstLog за удаленные записи
        if (state.getFirstLog() > watermark + 1) {
            state.setFirstLog(watermark + 1);
        }
        state.setFreezeWatermark(UndoState.NOT_FROZEN);
        diagnostics.log("Unfrozen, discarded " + discarded + " log rows above " + watermark);
        return discarded;
    }
}
