package ru.nts.tools.undo.journal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TriggerSqlGeneratorTest {

    private final TriggerSqlGenerator generator = new TriggerSqlGenerator("undolog");
    private final TrackedTable tbl1 = new TrackedTable("tbl1", List.of("a"));

    @Test
    @DisplayName("log table is a temporary table keyed by seq")
    void logTableDdl() {
        assertEquals("CREATE TEMP TABLE \"undolog\"(seq integer primary key, sql text)",
                generator.createLogTableSql());
        assertEquals("DROP TABLE IF EXISTS temp.\"undolog\"", generator.dropLogTableSql());
    }

    @Test
    @DisplayName("insert trigger logs DELETE by rowid")
    void insertTrigger() {
        assertEquals("CREATE TEMP TRIGGER \"_tbl1_it\" AFTER INSERT ON \"tbl1\" BEGIN\n"
                        + "  INSERT INTO \"undolog\" VALUES(NULL,'DELETE FROM \"tbl1\" WHERE rowid='||new.rowid);\n"
                        + "END",
                generator.insertTrigger(tbl1));
    }

    @Test
    @DisplayName("update trigger restores old values of every column")
    void updateTrigger() {
        assertEquals("CREATE TEMP TRIGGER \"_tbl1_ut\" AFTER UPDATE ON \"tbl1\" BEGIN\n"
                        + "  INSERT INTO \"undolog\" VALUES(NULL,'UPDATE \"tbl1\" SET \"a\"='||quote(old.\"a\")"
                        + "||' WHERE rowid='||new.rowid);\n"
                        + "END",
                generator.updateTrigger(tbl1));

        String twoColumns = generator.updateTrigger(new TrackedTable("t", List.of("x", "y")));
        assertTrue(twoColumns.contains("SET \"x\"='||quote(old.\"x\")||',\"y\"='||quote(old.\"y\")||' WHERE rowid="),
                twoColumns);
    }

    @Test
    @DisplayName("delete trigger re-inserts the row with its rowid")
    void deleteTrigger() {
        assertEquals("CREATE TEMP TRIGGER \"_tbl1_dt\" BEFORE DELETE ON \"tbl1\" BEGIN\n"
                        + "  INSERT INTO \"undolog\" VALUES(NULL,'INSERT INTO \"tbl1\"(rowid,\"a\") VALUES('"
                        + "||old.rowid||','||quote(old.\"a\")||')');\n"
                        + "END",
                generator.deleteTrigger(tbl1));
    }

    @Test
    @DisplayName("triggersFor returns insert, update, delete in order")
    void triggersForOrder() {
        List<String> ddl = generator.triggersFor(tbl1);
        assertEquals(3, ddl.size());
        assertTrue(ddl.get(0).contains("\"_tbl1_it\""));
        assertTrue(ddl.get(1).contains("\"_tbl1_ut\""));
        assertTrue(ddl.get(2).contains("\"_tbl1_dt\""));
    }

    @Test
    @DisplayName("trigger names match the recorder pattern")
    void triggerNames() {
        assertEquals("_tbl1_it", TriggerSqlGenerator.insertTriggerName(tbl1));
        assertEquals("_tbl1_ut", TriggerSqlGenerator.updateTriggerName(tbl1));
        assertEquals("_tbl1_dt", TriggerSqlGenerator.deleteTriggerName(tbl1));

        assertTrue(TriggerSqlGenerator.isRecorderTrigger("_tbl1_it"));
        assertTrue(TriggerSqlGenerator.isRecorderTrigger("_my_table_dt"));
        assertFalse(TriggerSqlGenerator.isRecorderTrigger("tbl1_it"));
        assertFalse(TriggerSqlGenerator.isRecorderTrigger("_tbl1_xt"));
        assertFalse(TriggerSqlGenerator.isRecorderTrigger(null));
    }

    @Test
    @DisplayName("identifiers with quotes are escaped")
    void quoting() {
        assertEquals("\"a\"\"b\"", TriggerSqlGenerator.quoteIdentifier("a\"b"));

        String ddl = generator.insertTrigger(new TrackedTable("it's", List.of("a")));
        assertTrue(ddl.contains("'DELETE FROM \"it''s\" WHERE rowid='"), ddl);
    }
}
