package ru.nts.tools.undo.core;

import org.junit.jupiter.api.*;
import ru.nts.tools.undo.journal.ChangeLog;
import ru.nts.tools.undo.journal.ChangeRecorder;
import ru.nts.tools.undo.journal.JdbcSqlEngine;
import ru.nts.tools.undo.journal.UndoDatabase;

import static org.junit.jupiter.api.Assertions.*;

class FreezeGateTest {

    private UndoDatabase db;
    private JdbcSqlEngine engine;
    private ChangeLog log;
    private IntervalTracker tracker;
    private FreezeGate gate;
    private UndoState state;

    @BeforeEach
    void setUp() throws Exception {
        db = UndoDatabase.inMemory();
        engine = db.engine();
        engine.execute("CREATE TABLE tbl1(a)");
        ChangeRecorder recorder = new ChangeRecorder(engine, "undolog", DiagnosticLog.silent());
        recorder.install(recorder.describe("tbl1"));

        log = new ChangeLog(engine, "undolog");
        tracker = new IntervalTracker(log, DiagnosticLog.silent());
        gate = new FreezeGate(log, true, DiagnosticLog.silent());
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
    @DisplayName("freeze records the current log maximum")
    void freezeSetsWatermark() throws Exception {
        insert(1);
        insert(2);
        gate.freeze(state);

        assertTrue(state.isFrozen());
        assertEquals(2, state.getFreezeWatermark());
    }

    @Test
    @DisplayName("freeze on empty log uses watermark 0")
    void freezeEmptyLog() {
        gate.freeze(state);
        assertTrue(state.isFrozen());
        assertEquals(0, state.getFreezeWatermark());
    }

    @Test
    @DisplayName("unfreeze discards rows logged while frozen")
    void unfreezeDiscards() throws Exception {
        insert(1);
        tracker.barrier(state);
        long firstLogBefore = state.getFirstLog();

        gate.freeze(state);
        insert(2);
        insert(3);
        engine.execute("UPDATE tbl1 SET a=a+10");

        assertEquals(5, gate.unfreeze(state));
        assertFalse(state.isFrozen());
        assertEquals(1, log.maxSequence());
        assertEquals(firstLogBefore, state.getFirstLog());
        // строки в таблице остаются, пропадает только история
        assertEquals(3L, engine.executeScalar("SELECT count(*) FROM tbl1", Long.class));
    }

    @Test
    @DisplayName("barrier inside the freeze window does not leave firstLog past the purged rows")
    void unfreezeClampsFirstLog() throws Exception {
        gate.freeze(state);
        insert(1);
        tracker.barrier(state);
        assertEquals(2, state.getFirstLog());

        gate.unfreeze(state);
        assertEquals(1, state.getFirstLog());

        insert(2);
        assertEquals(new Interval(1, 1), tracker.barrier(state).orElseThrow());
    }

    @Test
    @DisplayName("freeze twice fails with ALREADY_FROZEN")
    void freezeTwice() {
        gate.freeze(state);
        UndoException e = assertThrows(UndoException.class, () -> gate.freeze(state));
        assertEquals(UndoErrorCode.ALREADY_FROZEN, e.getCode());
        assertEquals(0, e.getWatermark());
    }

    @Test
    @DisplayName("unfreeze without freeze fails with NOT_FROZEN")
    void unfreezeWithoutFreeze() {
        UndoException e = assertThrows(UndoException.class, () -> gate.unfreeze(state));
        assertEquals(UndoErrorCode.NOT_FROZEN, e.getCode());
    }

    @Test
    @DisplayName("disabled gate ignores freeze and unfreeze")
    void disabledGate() throws Exception {
        FreezeGate disabled = new FreezeGate(log, false, DiagnosticLog.silent());
        assertFalse(disabled.isEnabled());

        disabled.freeze(state);
        insert(1);
        assertFalse(state.isFrozen());
        assertEquals(0, disabled.unfreeze(state));
        assertEquals(1, log.maxSequence());
    }

    @Test
    @DisplayName("inactive session ignores freeze and unfreeze")
    void inactiveSession() {
        state.reset(false);
        gate.freeze(state);
        assertFalse(state.isFrozen());
        assertEquals(0, gate.unfreeze(state));
    }
}
