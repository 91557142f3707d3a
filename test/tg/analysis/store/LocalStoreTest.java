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

package tg.analysis.store;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import tg.ir.FunctionContext;
import tg.ir.MemoryObject;
import tg.util.InvariantViolationException;

public class LocalStoreTest {

    StoreTracker tracker;
    FunctionContext main;
    MemoryObject g;

    @BeforeEach
    public void setUp() {
        tracker = new StoreTracker();
        main = new FunctionContext("main");
        g = MemoryObject.global("g", 8, false);
    }

    @Test
    public void testFreshSnapshotTrustsEverything() {
        LocalStore s = new LocalStore(tracker);
        assertTrue(s.isTrusted(g, 0, 8));
        s.setAllOthersClobbered(true);
        assertFalse(s.isTrusted(g, 0, 1));
        s.getOrCreateRangesFor(g).insert(0, 4);
        assertTrue(s.isTrusted(g, 0, 4));
        assertFalse(s.isTrusted(g, 0, 5));
    }

    @Test
    public void testReferenceCounting() {
        LocalStore s = new LocalStore(tracker);
        s.addReference();
        assertTrue(s.isShared());
        assertFalse(s.dropReference());
        assertTrue(s.dropReference());
        assertTrue(s.isFreed());
        assertEquals(0, tracker.getLiveCount());
    }

    @Test
    public void testDoubleReleaseThrows() {
        final LocalStore s = new LocalStore(tracker);
        s.dropReference();
        assertThrows(InvariantViolationException.class, new Executable() {
            public void execute() {
                s.dropReference();
            }
        });
    }

    @Test
    public void testSharedSnapshotCannotChange() {
        final LocalStore s = new LocalStore(tracker);
        s.addReference();
        assertThrows(InvariantViolationException.class, new Executable() {
            public void execute() {
                s.setAllOthersClobbered(true);
            }
        });
    }

    @Test
    public void testCopyOnWrite() {
        LocalStore s = new LocalStore(tracker);
        s.setAllOthersClobbered(true);
        s.getOrCreateRangesFor(g).insert(0, 4);
        s.addReference();

        LocalStore w = s.getWritableFrameList();
        assertNotSame(s, w);
        assertEquals(1, s.getRefCount());
        assertTrue(w.sameContents(s));

        w.getOrCreateRangesFor(g).insert(4, 8);
        assertTrue(w.isTrusted(g, 0, 8));
        assertFalse(s.isTrusted(g, 4, 8));

        assertSame(w, w.getWritableFrameList());
        w.dropReference();
        s.dropReference();
        assertEquals(0, tracker.getLiveCount());
        assertEquals(2, tracker.getAllocatedCount());
    }

    @Test
    public void testStackObjectsLiveInTheirFrame() {
        FunctionContext f = new FunctionContext("f");
        MemoryObject local = MemoryObject.stack("x", 4, f);
        LocalStore s = new LocalStore(tracker);
        s.pushStackFrame(main);
        s.pushStackFrame(f);
        s.setAllOthersClobbered(true);
        s.getOrCreateRangesFor(local).insert(0, 4);
        assertTrue(s.getFrames().get(1).getObjects().containsKey(local));
        assertFalse(s.getHeapObjects().containsKey(local));

        s.popStackFrame(f);
        assertEquals(1, s.getStackDepth());
        assertFalse(s.isTrusted(local, 0, 4));
        s.dropReference();
    }

    @Test
    public void testPopWrongFrameThrows() {
        final FunctionContext f = new FunctionContext("f");
        final LocalStore s = new LocalStore(tracker);
        s.pushStackFrame(main);
        assertThrows(InvariantViolationException.class, new Executable() {
            public void execute() {
                s.popStackFrame(f);
            }
        });
    }

    @Test
    public void testEmptyMapKeepsFrames() {
        LocalStore s = new LocalStore(tracker);
        s.pushStackFrame(main);
        s.getOrCreateRangesFor(g).insert(0, 8);
        LocalStore empty = s.getEmptyMap();
        assertTrue(s.isFreed());
        assertEquals(1, empty.getStackDepth());
        assertTrue(empty.getHeapObjects().isEmpty());
        empty.dropReference();
        assertEquals(0, tracker.getLiveCount());
    }

    @Test
    public void testUnknownSizeObjectIsNeverWhollyListed() {
        MemoryObject buf = MemoryObject.heap("buf", MemoryObject.UNKNOWN_SIZE);
        LocalStore listed = new LocalStore(tracker);
        listed.getOrCreateRangesFor(buf).insert(0, 64);
        LocalStore unlisted = new LocalStore(tracker);
        assertFalse(listed.sameContents(unlisted));
        assertFalse(unlisted.sameContents(listed));

        LocalStore whole = new LocalStore(tracker);
        whole.getOrCreateRangesFor(g).insert(0, 8);
        assertTrue(whole.sameContents(unlisted));

        listed.dropReference();
        unlisted.dropReference();
        whole.dropReference();
        assertEquals(0, tracker.getLiveCount());
    }

}
