package ru.nts.tools.undo.core;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class UndoExceptionTest {

    @Test
    @DisplayName("step failure carries the interval and the stack it went back to")
    void stepFailed() {
        UndoException e = UndoException.stepFailed(new Interval(2, 2), "undo",
                new SQLException("UNIQUE constraint failed"));

        assertEquals(UndoErrorCode.STEP_FAILED, e.getCode());
        assertEquals(UndoErrorCode.Category.REPLAY, e.getCode().getCategory());
        assertEquals(new Interval(2, 2), e.getInterval());
        assertEquals("undo", e.getStack());
        assertNull(e.getTable());
        assertEquals("Undo/redo step failed and was rolled back: interval (2,2) on undo stack", e.getMessage());
        assertEquals("[STEP_FAILED] Undo/redo step failed and was rolled back: interval (2,2) on undo stack"
                + " | cause: UNIQUE constraint failed", e.toLogMessage());
    }

    @Test
    @DisplayName("user message has the subject, the solution and the cause")
    void userMessage() {
        UndoException e = UndoException.forTable(UndoErrorCode.TABLE_NOT_FOUND, "orders", null);

        assertEquals("[TABLE_NOT_FOUND] Tracked table not found: table 'orders'\n"
                        + "Solution: " + UndoErrorCode.TABLE_NOT_FOUND.getSolution(),
                e.toUserMessage());

        UndoException withCause = UndoException.databaseError("barrier", new SQLException("disk I/O error"));
        assertTrue(withCause.toUserMessage().endsWith("\nCause: disk I/O error"), withCause.toUserMessage());
        assertEquals("Undo log cannot be read or changed: barrier", withCause.getMessage());
    }

    @Test
    @DisplayName("freeze and stack errors describe the session state")
    void preconditionSubjects() {
        UndoException frozen = UndoException.alreadyFrozen(12);
        assertEquals(12, frozen.getWatermark());
        assertEquals("Undo log is already frozen: frozen at sequence 12", frozen.getMessage());

        assertEquals("Interval stack is empty: redo stack", UndoException.stackEmpty("redo").getMessage());

        UndoException notFrozen = UndoException.precondition(UndoErrorCode.NOT_FROZEN);
        assertEquals(UndoState.NOT_FROZEN, notFrozen.getWatermark());
        assertEquals("Undo log is not frozen", notFrozen.getMessage());
        assertTrue(notFrozen.getCode().isPrecondition());
    }

    @Test
    @DisplayName("every code belongs to the category its handling needs")
    void categories() {
        assertTrue(UndoErrorCode.STEP_WHILE_FROZEN.isPrecondition());
        assertTrue(UndoErrorCode.STACK_EMPTY.isPrecondition());
        assertFalse(UndoErrorCode.STEP_FAILED.isPrecondition());
        assertEquals(UndoErrorCode.Category.RESOURCE, UndoErrorCode.TRIGGER_INSTALL_FAILED.getCategory());
        assertEquals(UndoErrorCode.Category.CONFIGURATION, UndoErrorCode.CONFIG_INVALID.getCategory());
        assertEquals("key 'debug'", UndoException.configInvalid("debug", null).subject());
    }

    @Nested
    @DisplayName("DiagnosticLog")
    class Logging {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("silent by default")
        void silentByDefault() {
            assertFalse(new DiagnosticLog(UndoConfig.defaults()).isEnabled());
            assertFalse(DiagnosticLog.silent().isEnabled());
        }

        @Test
        @DisplayName("writes timestamped lines to the log file")
        void writesToFile() throws Exception {
            Path file = tempDir.resolve("undo.log");
            DiagnosticLog log = new DiagnosticLog(UndoConfig.builder().logFile(file.toString()).build());
            assertTrue(log.isEnabled());

            log.log("hello");
            log.log(UndoException.precondition(UndoErrorCode.NOT_FROZEN));

            String content = Files.readString(file);
            assertTrue(content.matches("(?s)\\[.+\\] hello\\R.*"), content);
            assertTrue(content.contains("[NOT_FROZEN] Undo log is not frozen"), content);
        }

        @Test
        @DisplayName("unwritable file disables file output")
        void unwritableFile() {
            DiagnosticLog log = new DiagnosticLog(UndoConfig.builder().logFile(tempDir.toString()).build());

            log.log("cannot land in a directory");
            assertFalse(log.isEnabled());
        }
    }
}
