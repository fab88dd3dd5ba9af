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
 * Слушатель undo-сессии, реализуемый приложением-хостом.
 */
public interface UndoObserver {

    /**
     * Состояние сессии изменилось (активация, барьер, заморозка, шаг).
     * Хост обычно обновляет доступность команд Undo/Redo.
     */
    default void statusChanged(UndoStatus status) {
    }

    /**
     * Шаг undo/redo изменил данные в обход приложения: хост должен перечитать
     * все, что показывает из отслеживаемых таблиц.
     */
    default void reloadAll() {
    }
}
