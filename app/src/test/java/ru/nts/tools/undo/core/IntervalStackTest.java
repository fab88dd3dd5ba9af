package ru.nts.tools.undo.core;

import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IntervalStackTest {

    @Nested
    @DisplayName("Interval")
    class IntervalTests {

        @Test
        @DisplayName("closed range with width and membership")
        void closedRange() {
            Interval interval = new Interval(2, 5);
            assertEquals(4, interval.width());
            assertTrue(interval.contains(2));
            assertTrue(interval.contains(5));
            assertFalse(interval.contains(6));
            assertEquals("(2,5)", interval.toString());
        }

        @Test
        @DisplayName("single-row interval is allowed")
        void singleRow() {
            assertEquals(1, new Interval(3, 3).width());
        }

        @Test
        @DisplayName("begin after end or below 1 is rejected")
        void invalidBounds() {
            assertThrows(IllegalArgumentException.class, () -> new Interval(3, 2));
            assertThrows(IllegalArgumentException.class, () -> new Interval(0, 2));
        }
    }

    @Nested
    @DisplayName("IntervalStack")
    class StackTests {

        private final IntervalStack stack = new IntervalStack("undo");

        @Test
        @DisplayName("push and pop are LIFO")
        void lifo() {
            stack.push(new Interval(1, 1));
            stack.push(new Interval(2, 4));

            assertEquals(2, stack.size());
            assertEquals(new Interval(2, 4), stack.peek());
            assertEquals(new Interval(2, 4), stack.pop());
            assertEquals(new Interval(1, 1), stack.pop());
            assertTrue(stack.isEmpty());
            assertNull(stack.peek());
        }

        @Test
        @DisplayName("overlapping push is rejected")
        void overlapRejected() {
            stack.push(new Interval(1, 3));
            assertThrows(IllegalStateException.class, () -> stack.push(new Interval(3, 4)));
            assertThrows(IllegalStateException.class, () -> stack.push(new Interval(1, 1)));
        }

        @Test
        @DisplayName("pop of empty stack fails with STACK_EMPTY")
        void popEmpty() {
            UndoException e = assertThrows(UndoException.class, stack::pop);
            assertEquals(UndoErrorCode.STACK_EMPTY, e.getCode());
            assertEquals("undo", e.getStack());
        }

        @Test
        @DisplayName("snapshot is an immutable bottom-to-top copy")
        void snapshot() {
            stack.push(new Interval(1, 1));
            stack.push(new Interval(2, 2));

            List<Interval> snapshot = stack.snapshot();
            stack.clear();

            assertEquals(List.of(new Interval(1, 1), new Interval(2, 2)), snapshot);
            assertThrows(UnsupportedOperationException.class, () -> snapshot.add(new Interval(3, 3)));
            assertEquals("undo[]", stack.toString());
        }
    }
}
