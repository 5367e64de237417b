/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.state;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TrailerTest {

    @Test
    public void testSaveRestore() {
        Trailer sm = new Trailer();
        StateInt a = sm.makeStateInt(5);
        StateInt b = sm.makeStateInt(9);
        assertEquals(-1, sm.getLevel());

        a.setValue(7);
        b.setValue(13);
        b.setValue(13);

        sm.saveState();
        assertEquals(0, sm.getLevel());

        a.setValue(10);
        b.setValue(13);
        a.setValue(11);

        sm.saveState();
        a.setValue(4);
        b.setValue(1);

        sm.restoreState();
        assertEquals(11, a.value());
        assertEquals(13, b.value());

        sm.restoreState();
        assertEquals(7, a.value());
        assertEquals(13, b.value());
        assertEquals(-1, sm.getLevel());
    }

    @Test
    public void testOneEntryPerLevel() {
        Trailer sm = new Trailer();
        StateInt a = sm.makeStateInt(0);
        sm.saveState();
        int before = sm.trailSize();
        for (int i = 1; i <= 10; i++) {
            a.setValue(i);
        }
        assertEquals(before + 1, sm.trailSize());
        sm.restoreState();
        assertEquals(0, a.value());
        assertEquals(before, sm.trailSize());
    }

    @Test
    public void testRestoreUntil() {
        Trailer sm = new Trailer();
        StateInt a = sm.makeStateInt(0);
        for (int i = 1; i <= 5; i++) {
            sm.saveState();
            a.setValue(i);
        }
        assertEquals(4, sm.getLevel());
        sm.restoreStateUntil(1);
        assertEquals(1, sm.getLevel());
        assertEquals(2, a.value());
        sm.restoreStateUntil(-1);
        assertEquals(0, a.value());
    }

    @Test
    public void testPushedEntriesAreUndoneInReverseOrder() {
        Trailer sm = new Trailer();
        StringBuilder log = new StringBuilder();
        sm.saveState();
        sm.pushState(() -> log.append('a'));
        sm.pushState(() -> log.append('b'));
        sm.pushState(() -> log.append('c'));
        sm.restoreState();
        assertEquals("cba", log.toString());
    }

    @Test
    public void testWithNewState() {
        Trailer sm = new Trailer();
        StateInt a = sm.makeStateInt(3);
        sm.withNewState(() -> {
            a.setValue(42);
            assertEquals(0, sm.getLevel());
        });
        assertEquals(3, a.value());
        assertEquals(-1, sm.getLevel());
    }

    @Test
    public void testRestoreWithoutSave() {
        Trailer sm = new Trailer();
        assertThrows(IllegalStateException.class, sm::restoreState);
    }
}
