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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Неизменяемый снимок состояния undo-сессии.
 */
public record UndoStatus(
        boolean active,
        boolean frozen,
        boolean canUndo,
        boolean canRedo,
        List<Interval> undoStack,
        List<Interval> redoStack,
        long firstLog,
        long freezeWatermark
) {

    public UndoStatus {
        undoStack = List.copyOf(undoStack);
        redoStack = List.copyOf(redoStack);
    }

    public static UndoStatus from(UndoState state) {
        return new UndoStatus(
                state.isActive(),
                state.isFrozen(),
                state.canUndo(),
                state.canRedo(),
                state.undoStack().snapshot(),
                state.redoStack().snapshot(),
                state.getFirstLog(),
                state.getFreezeWatermark());
    }

    /**
     * JSON-представление, например:
     * <pre>
     * {"active":true,"frozen":false,"canUndo":true,"canRedo":false,
     *  "undoStack":[[1,4]],"redoStack":[],"firstLog":5,"freezeWatermark":-1}
     * </pre>
     */
    public ObjectNode toJson(ObjectMapper mapper) {
        ObjectNode node = mapper.createObjectNode();
        node.put("active", active);
        node.put("frozen", frozen);
        node.put("canUndo", canUndo);
        node.put("canRedo", canRedo);
        node.set("undoStack", intervals(mapper, undoStack));
        node.set("redoStack", intervals(mapper, redoStack));
        node.put("firstLog", firstLog);
        node.put("freezeWatermark", freezeWatermark);
        return node;
    }

    private static ArrayNode intervals(ObjectMapper mapper, List<Interval> stack) {
        ArrayNode array = mapper.createArrayNode();
        for (Interval interval : stack) {
            array.addArray().add(interval.begin()).add(interval.end());
        }
        return array;
    }
}
