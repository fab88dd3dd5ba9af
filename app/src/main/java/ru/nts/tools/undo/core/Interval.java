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
 * Замкнутый диапазон номеров записей журнала {@code [begin, end]}.
 * Один интервал = один шаг undo или redo.
 */
public record Interval(long begin, long end) {

    public Interval {
        if (begin < 1) {
            throw new IllegalArgumentException("Interval begin must be positive: " + begin);
        }
        if (begin > end) {
            throw new IllegalArgumentException("Empty interval: (" + begin + "," + end + ")");
        }
    }

    /**
     * Количество номеров журнала, покрываемых интервалом.
     */
    public long width() {
        return end - begin + 1;
    }

    public boolean contains(long sequence) {
        return sequence >= begin && sequence <= end;
    }

    @Override
    public String toString() {
        return "(" + begin + "," + end + ")";
    }
}
