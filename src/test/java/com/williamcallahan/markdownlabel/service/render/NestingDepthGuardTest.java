package com.williamcallahan.markdownlabel.service.render;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NestingDepthGuardTest {

    @Test
    void exceedsOnlyPastTheMaximum() {
        NestingDepthGuard guard = new NestingDepthGuard();
        for (int level = 1; level <= NestingDepthGuard.MAX_NESTING_DEPTH; level++) {
            assertEquals(level, guard.enter());
            assertFalse(guard.isExceeded());
        }
        guard.enter();
        assertTrue(guard.isExceeded());
    }

    @Test
    void exitRestoresDepth() {
        NestingDepthGuard guard = new NestingDepthGuard(2);
        guard.enter();
        guard.enter();
        guard.enter();
        assertTrue(guard.isExceeded());
        guard.exit();
        assertFalse(guard.isExceeded());
        assertEquals(2, guard.depth());
    }

    @Test
    void unbalancedExitIsRejected() {
        NestingDepthGuard guard = new NestingDepthGuard();
        assertThrows(IllegalStateException.class, guard::exit);
    }
}
