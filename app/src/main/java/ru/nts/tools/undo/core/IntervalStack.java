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

import java.util.ArrayList;
import java.util.List;

/**
 * Стек интервалов (undo или redo). Push/pop только с хвоста.
 * Интервалы от дна к вершине строго возрастают и не пересекаются.
 */
public class IntervalStack {

    private final String name;
    private final List<Interval> intervals = new ArrayList<>();

    public IntervalStack(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void push(Interval interval) {
        if (!intervals.isEmpty()) {
            Interval top = intervals.get(intervals.size() - 1);
            if (interval.begin() <= top.end()) {
                throw new IllegalStateException("Interval " + interval + " overlaps top of "
                        + name + " stack " + top);
            }
        }
        intervals.add(interval);
    }

    /**
     * Снимает вершину стека. Вызывающий код обязан проверить {@link #isEmpty()}.
     *
     * @throws UndoException STACK_EMPTY если стек пуст
     */
    public Interval pop() {
        if (intervals.isEmpty()) {
            throw UndoException.stackEmpty(name);
        }
        return intervals.remove(intervals.size() - 1);
    }

    public Interval peek() {
        return intervals.isEmpty() ? null : intervals.get(intervals.size() - 1);
    }

    public boolean isEmpty() {
        return intervals.isEmpty();
    }

    public int size() {
        return intervals.size();
    }

    public void clear() {
        intervals.clear();
    }

    /**
     * Returns an immutable copy ordered bottom to top.
     */
    public List<Interval> snapshot() {
        return List.copyOf(intervals);
    }

    @Override
    public String toString() {
        return name + intervals;
    }
}
