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
 * Состояние одной undo-сессии.
 *
 * Не глобальное: каждый фасад владеет собственным экземпляром и явно передает его
 * в {@link IntervalTracker}, {@link FreezeGate} и {@link StepEngine}. Это позволяет
 * держать несколько независимых сессий над разными наборами таблиц.
 *
 * Инварианты:
 * - firstLog = 1 + максимальный номер журнала, уже учтенный интервалом или потребленный
 * - freezeWatermark &lt; 0 означает "не заморожено"
 */
public class UndoState {

    public static final long NOT_FROZEN = -1;

    private boolean active;
    private final IntervalStack undoStack = new IntervalStack("undo");
    private final IntervalStack redoStack = new IntervalStack("redo");
    private long firstLog = 1;
    private long freezeWatermark = NOT_FROZEN;
    private boolean pendingEvent;

    /**
     * Сбрасывает состояние при активации: пустые стеки, снятая заморозка.
     */
    public void reset(boolean active) {
        this.active = active;
        undoStack.clear();
        redoStack.clear();
        freezeWatermark = NOT_FROZEN;
        pendingEvent = false;
    }

    public boolean isActive() {
        return active;
    }

    public IntervalStack undoStack() {
        return undoStack;
    }

    public IntervalStack redoStack() {
        return redoStack;
    }

    /**
     * Стек-источник для шага в указанном направлении.
     */
    public IntervalStack source(StepDirection direction) {
        return direction == StepDirection.UNDO ? undoStack : redoStack;
    }

    /**
     * Стек-приемник для шага в указанном направлении.
     */
    public IntervalStack destination(StepDirection direction) {
        return direction == StepDirection.UNDO ? redoStack : undoStack;
    }

    public long getFirstLog() {
        return firstLog;
    }

    public void setFirstLog(long firstLog) {
        this.firstLog = firstLog;
    }

    public long getFreezeWatermark() {
        return freezeWatermark;
    }

    public void setFreezeWatermark(long freezeWatermark) {
        this.freezeWatermark = freezeWatermark;
    }

    public boolean isFrozen() {
        return freezeWatermark >= 0;
    }

    public boolean hasPendingEvent() {
        return pendingEvent;
    }

    public void setPendingEvent(boolean pendingEvent) {
        this.pendingEvent = pendingEvent;
    }

    public boolean canUndo() {
        return active && !undoStack.isEmpty();
    }

    public boolean canRedo() {
        return active && !redoStack.isEmpty();
    }

    @Override
    public String toString() {
        return "UndoState{active=" + active + ", " + undoStack + ", " + redoStack
                + ", firstLog=" + firstLog + ", freeze=" + freezeWatermark + "}";
    }
}
