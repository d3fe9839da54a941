package org.gdump.parser;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GoroutineTest {

    private static final StackFrame SERVE = new StackFrame("net/http.(*Server).Serve",
            "/usr/local/go/src/net/http/server.go", 3086, 0x5cbL);
    private static final StackFrame HANDLER = new StackFrame("main.handler",
            "/app/Handler.go", 12, null);
    private static final StackFrame MAIN = new StackFrame("main.main", "/app/main.go", 30, 0x1fL);

    @Test
    void rendersFrameForDisplay() {
        assertEquals("net/http.(*Server).Serve\n   file:///usr/local/go/src/net/http/server.go#3086 +0x5cb",
                SERVE.toString());
        assertEquals("main.handler\n   file:///app/Handler.go#12", HANDLER.toString());
    }

    @Test
    void stackContainsIgnoresCase() {
        List<StackFrame> frames = List.of(SERVE, HANDLER);

        assertTrue(Goroutine.stackContains(frames, "server.go"));
        assertTrue(Goroutine.stackContains(frames, "handler.go"));
        assertTrue(Goroutine.stackContains(frames, "HANDLER.GO"));
        assertFalse(Goroutine.stackContains(frames, "client.go"));
    }

    @Test
    void stackContainsIsFalseForEmptyStack() {
        assertFalse(Goroutine.stackContains(List.of(), "server.go"));
        assertThrows(NullPointerException.class, () -> Goroutine.stackContains(List.of(), null));
    }

    @Test
    void fullStackAppendsCreatedBy() {
        Goroutine goroutine = new Goroutine(21, "select", 0, false, List.of(SERVE, HANDLER), MAIN, null, false);

        assertEquals(List.of(SERVE, HANDLER, MAIN), goroutine.fullStack());
        assertEquals(List.of(SERVE, HANDLER), goroutine.getStackTrace());
        assertTrue(goroutine.stackContains("main.go"));
    }

    @Test
    void fullStackWithoutCreatedByIsTrace() {
        Goroutine goroutine = new Goroutine(1, "running", 0, false, List.of(HANDLER), null, null, false);

        assertEquals(List.of(HANDLER), goroutine.fullStack());
        assertFalse(goroutine.stackContains("main.go"));
    }

    @Test
    void copiesStackTrace() {
        List<StackFrame> frames = new ArrayList<>(List.of(SERVE));
        Goroutine goroutine = new Goroutine(2, "running", 0, false, frames, null, null, false);

        frames.add(HANDLER);

        assertEquals(1, goroutine.getStackTrace().size());
        assertThrows(UnsupportedOperationException.class, () -> goroutine.getStackTrace().add(MAIN));
    }

    @Test
    void describesHeader() {
        Goroutine goroutine = new Goroutine(7, "chan receive", 3, true, List.of(), null, null, false);

        assertEquals("goroutine 7 [chan receive, 3 minutes, locked to thread], frames: 0", goroutine.toString());
    }
}
