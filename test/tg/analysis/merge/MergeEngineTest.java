/*
 * Copyright (c) 2013, Khilan Gudka.
 * All rights reserved.
 *
 * Redistribution and use in source and binary forms, with or without 
 * modification, are permitted provided that the following conditions are met:
 *
 * 1. Redistributions of source code must retain the above copyright notice, 
 *    this list of conditions and the following disclaimer. 
 * 2. Redistributions in binary form must reproduce the above copyright notice, 
 *    this list of conditions and the following disclaimer in the documentation 
 *    and/or other materials provided with the distribution.
 * 
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" 
 * AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE 
 * IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE 
 * ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT HOLDER OR CONTRIBUTORS BE 
 * LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR 
 * CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF 
 * SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS 
 * INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN 
 * CONTRACT, STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE) 
 * ARISING IN ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF THE 
 * POSSIBILITY OF SUCH DAMAGE.
 */

package tg.analysis.merge;

import static org.junit.jupiter.api.Assertions.*;

import java.util.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import tg.analysis.store.LocalStore;
import tg.analysis.store.StoreTracker;
import tg.ir.FunctionContext;
import tg.ir.MemoryObject;
import tg.util.InvariantViolationException;

public class MergeEngineTest {

    StoreTracker tracker;
    MergeEngine merger;
    FunctionContext main;
    MemoryObject g;
    MemoryObject h;

    @BeforeEach
    public void setUp() {
        tracker = new StoreTracker();
        merger = new MergeEngine(tracker);
        main = new FunctionContext("main");
        g = MemoryObject.global("g", 16, false);
        h = MemoryObject.heap("h", 16);
    }

    LocalStore snapshot(boolean clobbered, MemoryObject o, long start, long stop) {
        LocalStore s = new LocalStore(tracker);
        s.pushStackFrame(main);
        s.setAllOthersClobbered(clobbered);
        if (o != null) {
            s.getOrCreateRangesFor(o).insert(start, stop);
        }
        return s;
    }

    static List<LocalStore> list(LocalStore... stores) {
        return new ArrayList<LocalStore>(Arrays.asList(stores));
    }

    @Test
    public void testNothingArrived() {
        assertNull(merger.merge(new ArrayList<LocalStore>()));
    }

    @Test
    public void testSingleInputPassesThrough() {
        LocalStore s = snapshot(true, g, 0, 4);
        assertSame(s, merger.merge(list(s)));
    }

    @Test
    public void testIntersectsListedRanges() {
        LocalStore a = snapshot(true, g, 0, 8);
        LocalStore b = snapshot(false, g, 4, 12);
        LocalStore m = merger.merge(list(a, b));
        assertTrue(m.isAllOthersClobbered());
        assertTrue(m.isTrusted(g, 4, 8));
        assertFalse(m.isTrusted(g, 0, 4));
        assertFalse(m.isTrusted(g, 8, 12));
        assertTrue(a.isFreed());
        assertTrue(b.isFreed());
        m.dropReference();
        assertEquals(0, tracker.getLiveCount());
    }

    @Test
    public void testUnlistedIsTrustedUnlessClobbered() {
        LocalStore a = snapshot(false, g, 0, 4);
        LocalStore b = snapshot(false, null, 0, 0);
        LocalStore m = merger.merge(list(a, b));
        assertFalse(m.isAllOthersClobbered());
        assertTrue(m.isTrusted(g, 0, 4));
        assertFalse(m.isTrusted(g, 4, 8));
        assertTrue(m.isTrusted(h, 0, 16));
        m.dropReference();

        a = snapshot(false, g, 0, 4);
        b = snapshot(true, null, 0, 0);
        m = merger.merge(list(a, b));
        assertTrue(m.isAllOthersClobbered());
        assertFalse(m.isTrusted(g, 0, 1));
        assertNull(m.getReadableRangesFor(g));
        m.dropReference();
    }

    @Test
    public void testMergeIsCommutativeAndAssociative() {
        LocalStore ab = merger.merge(list(snapshot(true, g, 0, 8), snapshot(true, g, 2, 12)));
        LocalStore ba = merger.merge(list(snapshot(true, g, 2, 12), snapshot(true, g, 0, 8)));
        assertTrue(ab.sameContents(ba));

        LocalStore left = merger.merge(list(merger.merge(list(snapshot(false, g, 0, 8), snapshot(true, h, 0, 4))), snapshot(false, g, 4, 16)));
        LocalStore right = merger.merge(list(snapshot(false, g, 0, 8), merger.merge(list(snapshot(true, h, 0, 4), snapshot(false, g, 4, 16)))));
        assertTrue(left.sameContents(right));
        assertTrue(left.isAllOthersClobbered());

        ab.dropReference();
        ba.dropReference();
        left.dropReference();
        right.dropReference();
        assertEquals(0, tracker.getLiveCount());
    }

    @Test
    public void testMergeWithItselfChangesNothing() {
        LocalStore[] stores = {snapshot(true, g, 2, 10), snapshot(false, h, 0, 4), snapshot(true, null, 0, 0)};
        for (LocalStore s : stores) {
            s.addReference();
            s.addReference();
            LocalStore m = merger.merge(list(s, s));
            assertTrue(m.sameContents(s));
            assertEquals(1, s.getRefCount());
            m.dropReference();
            s.dropReference();
        }
        assertEquals(0, tracker.getLiveCount());
    }

    // the three inputs used by the permutation and soundness cases
    LocalStore input(int k) {
        switch (k) {
        case 0:
            return snapshot(true, g, 0, 8);
        case 1:
            LocalStore s = snapshot(false, g, 2, 12);
            s.getOrCreateRangesFor(h).insert(4, 10);
            return s;
        default:
            return snapshot(false, h, 0, 6);
        }
    }

    @Test
    public void testMergeIgnoresInputOrder() {
        int[][] orders = {{0, 1, 2}, {0, 2, 1}, {1, 0, 2}, {1, 2, 0}, {2, 0, 1}, {2, 1, 0}};
        LocalStore expected = null;
        for (int[] order : orders) {
            LocalStore m = merger.merge(list(input(order[0]), input(order[1]), input(order[2])));
            if (expected == null) {
                expected = m;
                continue;
            }
            assertTrue(m.sameContents(expected), "order " + Arrays.toString(order) + " gave " + m);
            m.dropReference();
        }
        assertTrue(expected.isAllOthersClobbered());
        assertTrue(expected.isTrusted(g, 2, 8));
        assertFalse(expected.isTrusted(g, 0, 2));
        // clobbered and unlisted in the first input
        assertNull(expected.getReadableRangesFor(h));
        assertFalse(expected.isTrusted(h, 4, 5));
        expected.dropReference();
        assertEquals(0, tracker.getLiveCount());
    }

    // merges the inputs and returns the number of bytes trusted afterwards
    int assertMergeSound(List<LocalStore> inputs) {
        for (LocalStore s : inputs) {
            s.addReference();
        }
        LocalStore m = merger.merge(new ArrayList<LocalStore>(inputs));
        int trusted = 0;
        MemoryObject[] objects = {g, h, MemoryObject.heap("other", 16)};
        for (MemoryObject o : objects) {
            for (long b = 0; b < 16; b++) {
                if (!m.isTrusted(o, b, b + 1)) {
                    continue;
                }
                trusted++;
                for (LocalStore s : inputs) {
                    assertTrue(s.isTrusted(o, b, b + 1), o + " byte " + b + " trusted after merge but not in " + s);
                }
            }
        }
        for (LocalStore s : inputs) {
            s.dropReference();
        }
        m.dropReference();
        assertEquals(0, tracker.getLiveCount());
        return trusted;
    }

    @Test
    public void testMergedTrustHoldsOnEveryInput() {
        // g[2,8)
        assertEquals(6, assertMergeSound(list(input(0), input(1), input(2))));
        // g[2,12), h[4,6) and all of the unlisted object
        assertEquals(10 + 2 + 16, assertMergeSound(list(input(1), input(2))));
    }

    @Test
    public void testFrameMismatchThrows() {
        final LocalStore a = snapshot(true, g, 0, 8);
        final LocalStore b = new LocalStore(tracker);
        assertThrows(InvariantViolationException.class, new Executable() {
            public void execute() {
                merger.merge(list(a, b));
            }
        });
    }

    @Test
    public void testFilterSeesEveryInput() {
        final int[] seen = new int[1];
        LocalStore m = merger.merge(list(snapshot(true, null, 0, 0), snapshot(true, null, 0, 0)), new MergeEngine.IncomingFilter() {
            public LocalStore apply(LocalStore s) {
                seen[0]++;
                LocalStore w = s.getWritableFrameList();
                w.getOrCreateRangesFor(g).insert(0, 4);
                return w;
            }
        });
        assertEquals(2, seen[0]);
        assertTrue(m.isTrusted(g, 0, 4));
        m.dropReference();
    }

}
