package ru.nts.tools.undo.core;

import org.junit.jupiter.api.*;
import ru.nts.tools.undo.journal.ChangeLog;
import ru.nts.tools.undo.journal.ChangeRecorder;
import ru.nts.tools.undo.journal.JdbcSqlEngine;
import ru.nts.tools.undo.journal.UndoDatabase;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class IntervalTrackerTest {

    private UndoDatabase db;
    private JdbcSqlEngine engine;
    private IntervalTracker tracker;
    private UndoState state;

    @BeforeEach
    void setUp() throws Exception {
        db = UndoDatabase.inMemory();
        engine = db.engine();
        engine.execute("CREATE TABLE tbl1(a)");
        ChangeRecorder recorder = new ChangeRecorder(engine, "undolog", DiagnosticLog.silent());
        recorder.install(recorder.describe("tbl1"));

        tracker = new IntervalTracker(new ChangeLog(engine, "undolog"), DiagnosticLog.silent());
        state = new UndoState();
        state.reset(true);
        tracker.startInterval(state);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (db != null) db.close();
    }

    private void insert(int value) throws Exception {
        engine.execute("INSERT INTO tbl1 VALUES(" + value + ")");
    }

    @Test
    @DisplayName("startInterval points one past the log maximum")
    void startInterval() throws Exception {
        assertEquals(1, state.getFirstLog());
        insert(1);
        insert(2);
        tracker.startInterval(state);
        assertEquals(3, state.getFirstLog());
    }

    @Test
    @DisplayName("barrier closes each span into one interval")
    void barrierPushesIntervals() throws Exception {
        insert(23);
        assertEquals(Optional.of(new Interval(1, 1)), tracker.barrier(state));
        insert(42);
        insert(43);
        assertEquals(Optional.of(new Interval(2, 3)), tracker.barrier(state));

        assertEquals(List.of(new Interval(1, 1), new Interval(2, 3)), state.undoStack().snapshot());
        assertEquals(4, state.getFirstLog());
    }

    @Test
    @DisplayName("barrier without changes is a no-op")
    void emptyBarrier() throws Exception {
        assertTrue(tracker.barrier(state).isEmpty());
        insert(1);
        tracker.barrier(state);
        assertTrue(tracker.barrier(state).isEmpty());

        assertEquals(1, state.undoStack().size());
    }

    @Test
    @DisplayName("non-empty barrier clears the redo stack")
    void barrierClearsRedo() throws Exception {
        state.redoStack().push(new Interval(10, 12));
        assertTrue(tracker.barrier(state).isEmpty());
        assertEquals(1, state.redoStack().size());

        insert(1);
        tracker.barrier(state);
        assertTrue(state.redoStack().isEmpty());
    }

    @Test
    @DisplayName("frozen barrier stops at the watermark")
    void frozenBarrierClamped() throws Exception {
        insert(1);
        state.setFreezeWatermark(1);
        insert(2);
        insert(3);

        assertEquals(Optional.of(new Interval(1, 1)), tracker.barrier(state));
        assertEquals(4, state.getFirstLog());
    }

    @Test
    @DisplayName("frozen barrier with only transient rows records nothing")
    void frozenBarrierOnlyTransientRows() throws Exception {
        insert(1);
        tracker.barrier(state);
        state.setFreezeWatermark(1);
        insert(2);

        assertTrue(tracker.barrier(state).isEmpty());
        assertEquals(1, state.undoStack().size());
    }

    @Test
    @DisplayName("barrier clears a pending event and ignores inactive state")
    void inactiveBarrier() throws Exception {
        insert(1);
        state.setPendingEvent(true);
        state.reset(false);
        state.setPendingEvent(true);

        assertTrue(tracker.barrier(state).isEmpty());
        assertFalse(state.hasPendingEvent());
        assertTrue(state.undoStack().isEmpty());
    }
}
