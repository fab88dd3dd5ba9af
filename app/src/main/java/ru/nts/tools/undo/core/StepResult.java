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

import java.util.Locale;

/**
 * Результат одного шага undo или redo.
 */
public class StepResult {

    /**
     * Статус шага.
     */
    public enum Status {
        /** Интервал воспроизведен и закоммичен */
        SUCCESS("Step completed successfully"),

        /** Undo-стек пуст */
        NOTHING_TO_UNDO("No operations to undo"),

        /** Redo-стек пуст или очищен новыми изменениями */
        NOTHING_TO_REDO("No operations to redo");

        private final String description;

        Status(String description) {
            this.description = description;
        }

        public String getDescription() {
            return description;
        }
    }

    private final Status status;
    private final StepDirection direction;
    private final Interval replayed;
    private final Interval produced;
    private final int statementsReplayed;

    private StepResult(Status status, StepDirection direction, Interval replayed,
                       Interval produced, int statementsReplayed) {
        this.status = status;
        this.direction = direction;
        this.replayed = replayed;
        this.produced = produced;
        this.statementsReplayed = statementsReplayed;
    }

    public static StepResult success(StepDirection direction, Interval replayed,
                                     Interval produced, int statementsReplayed) {
        return new StepResult(Status.SUCCESS, direction, replayed, produced, statementsReplayed);
    }

    public static StepResult nothingToDo(StepDirection direction) {
        return new StepResult(direction == StepDirection.UNDO ? Status.NOTHING_TO_UNDO : Status.NOTHING_TO_REDO,
                direction, null, null, 0);
    }

    public Status getStatus() {
        return status;
    }

    public StepDirection getDirection() {
        return direction;
    }

    /**
     * Интервал, снятый с исходного стека (null если шагать было некуда).
     */
    public Interval getReplayed() {
        return replayed;
    }

    /**
     * Интервал, положенный на противоположный стек. Null, если воспроизведение
     * не затронуло ни одной строки.
     */
    public Interval getProduced() {
        return produced;
    }

    public int getStatementsReplayed() {
        return statementsReplayed;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /**
     * Форматирует результат для отображения пользователю.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(status.name()).append("] ").append(status.getDescription());
        if (replayed != null) {
            sb.append("\n").append(direction == StepDirection.UNDO ? "Undone: " : "Redone: ")
                    .append(replayed).append(", ").append(statementsReplayed).append(" statement(s)");
        }
        if (produced != null) {
            sb.append("\nRecorded on ").append(direction.opposite().name().toLowerCase(Locale.ROOT))
                    .append(" stack: ").append(produced);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return format();
    }
}
