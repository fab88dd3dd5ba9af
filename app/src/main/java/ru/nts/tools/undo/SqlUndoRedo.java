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
package ru.nts.tools.undo;

import ru.nts.tools.undo.core.DiagnosticLog;
import ru.nts.tools.undo.core.FreezeGate;
import ru.nts.tools.undo.core.Interval;
import ru.nts.tools.undo.core.IntervalTracker;
import ru.nts.tools.undo.core.StepDirection;
import ru.nts.tools.undo.core.StepEngine;
import ru.nts.tools.undo.core.StepResult;
import ru.nts.tools.undo.core.UndoConfig;
import ru.nts.tools.undo.core.UndoException;
import ru.nts.tools.undo.core.UndoObserver;
import ru.nts.tools.undo.core.UndoState;
import ru.nts.tools.undo.core.UndoStatus;
import ru.nts.tools.undo.journal.ChangeLog;
import ru.nts.tools.undo.journal.ChangeRecorder;
import ru.nts.tools.undo.journal.SqlEngine;
import ru.nts.tools.undo.journal.TrackedTable;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Транзакционный undo/redo для набора таблиц SQLite.
 *
 * Типичное использование:
 * <pre>
 *   SqlUndoRedo undo = new SqlUndoRedo(db.engine(), UndoConfig.fromEnvironment());
 *   undo.activate("tbl1", "tbl2");
 *   ... изменения через то же соединение ...
 *   undo.barrier();          // одна пользовательская операция = один шаг
 *   undo.undo();
 *   undo.redo();
 *   undo.deactivate();
 * </pre>
 *
 * Все изменения отслеживаемых таблиц должны идти через то же соединение, что и
 * {@link SqlEngine}: триггеры и журнал временные и видны только ему.
 * Класс не потокобезопасен.
 */
public class SqlUndoRedo {

    private final SqlEngine engine;
    private final UndoConfig config;
    private final DiagnosticLog diagnostics;
    private final UndoState state = new UndoState();
    private final ChangeLog changeLog;
    private final ChangeRecorder recorder;
    private final IntervalTracker tracker;
    private final FreezeGate freezeGate;
    private final StepEngine stepEngine;
    private final List<UndoObserver> observers = new CopyOnWriteArrayList<>();

    private List<TrackedTable> trackedTables = List.of();

    public SqlUndoRedo(SqlEngine engine) {
        this(engine, UndoConfig.defaults());
    }

    public SqlUndoRedo(SqlEngine engine, UndoConfig config) {
        this.engine = engine;
        this.config = config;
        this.diagnostics = new DiagnosticLog(config);
        this.changeLog = new ChangeLog(engine, config.getLogTable());
        this.recorder = new ChangeRecorder(engine, config.getLogTable(), diagnostics);
        this.tracker = new IntervalTracker(changeLog, diagnostics);
        this.freezeGate = new FreezeGate(changeLog, config.isFreezeEnabled(), diagnostics);
        this.stepEngine = new StepEngine(engine, changeLog, tracker, diagnostics);
    }

    /**
     * Начинает запись изменений указанных таблиц. Повторный вызов на активной
     * сессии ничего не делает.
     *
     * @throws UndoException TABLE_NOT_FOUND, LOG_TABLE_UNAVAILABLE, TRIGGER_INSTALL_FAILED;
     *                       сессия при этом остается неактивной
     */
    public void activate(String... tableNames) {
        if (state.isActive()) {
            return;
        }
        List<TrackedTable> tables = recorder.describe(tableNames);
        try {
            recorder.install(tables);
            state.reset(true);
            tracker.startInterval(state);
            trackedTables = tables;
        } catch (UndoException e) {
            state.reset(false);
            try {
                recorder.uninstall();
            } catch (UndoException cleanup) {
                e.addSuppressed(cleanup);
            }
            diagnostics.log(e);
            throw e;
        }
        diagnostics.log("Activated on " + Arrays.toString(tableNames) + ", log table " + config.getLogTable());
        fireStatusChanged();
    }

    /**
     * Снимает триггеры, удаляет журнал и очищает историю. На неактивной сессии ничего не делает.
     *
     * @throws UndoException UNINSTALL_FAILED; состояние сессии все равно сбрасывается
     */
    public void deactivate() {
        if (!state.isActive()) {
            return;
        }
        try {
            int dropped = recorder.uninstall();
            diagnostics.log("Deactivated, dropped " + dropped + " triggers");
        } catch (UndoException e) {
            diagnostics.log(e);
            throw e;
        } finally {
            state.reset(false);
            trackedTables = List.of();
            fireStatusChanged();
        }
    }

    /**
     * Закрывает изменения с прошлого барьера в один шаг undo.
     *
     * @return записанный интервал, если изменения были
     */
    public Optional<Interval> barrier() {
        Optional<Interval> recorded = tracker.barrier(state);
        if (recorded.isPresent()) {
            fireStatusChanged();
        }
        return recorded;
    }

    /**
     * Отмечает, что произошло действие, требующее барьера. Сам барьер ставится
     * в {@link #flushPendingEvent()}, который хост вызывает из своего idle-обработчика.
     */
    public void event() {
        if (state.isActive()) {
            state.setPendingEvent(true);
        }
    }

    /**
     * Ставит отложенный барьер, если после {@link #event()} его еще не было.
     */
    public Optional<Interval> flushPendingEvent() {
        if (!state.hasPendingEvent()) {
            return Optional.empty();
        }
        return barrier();
    }

    public void freeze() {
        boolean wasFrozen = state.isFrozen();
        freezeGate.freeze(state);
        if (state.isFrozen() != wasFrozen) {
            fireStatusChanged();
        }
    }

    /**
     * @return количество отброшенных записей журнала
     */
    public long unfreeze() {
        boolean wasFrozen = state.isFrozen();
        long discarded = freezeGate.unfreeze(state);
        if (state.isFrozen() != wasFrozen) {
            fireStatusChanged();
        }
        return discarded;
    }

    public StepResult undo() {
        return step(StepDirection.UNDO);
    }

    public StepResult redo() {
        return step(StepDirection.REDO);
    }

    private StepResult step(StepDirection direction) {
        StepResult result = stepEngine.step(state, direction);
        if (result.isSuccess()) {
            fireStatusChanged();
            for (UndoObserver observer : observers) {
                observer.reloadAll();
            }
        }
        return result;
    }

    public boolean canUndo() {
        return state.canUndo();
    }

    public boolean canRedo() {
        return state.canRedo();
    }

    public boolean isActive() {
        return state.isActive();
    }

    public boolean isFrozen() {
        return state.isFrozen();
    }

    public UndoStatus status() {
        return UndoStatus.from(state);
    }

    public List<TrackedTable> getTrackedTables() {
        return trackedTables;
    }

    public UndoConfig getConfig() {
        return config;
    }

    public DiagnosticLog getDiagnosticLog() {
        return diagnostics;
    }

    public SqlEngine getEngine() {
        return engine;
    }

    /**
     * Репозиторий журнала (для диагностики).
     */
    public ChangeLog getChangeLog() {
        return changeLog;
    }

    public void addObserver(UndoObserver observer) {
        observers.add(observer);
    }

    public void removeObserver(UndoObserver observer) {
        observers.remove(observer);
    }

    private void fireStatusChanged() {
        if (observers.isEmpty()) return;
        UndoStatus status = status();
        for (UndoObserver observer : observers) {
            observer.statusChanged(status);
        }
    }
}
