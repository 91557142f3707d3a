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

package tg.analysis.dse;

import static org.junit.jupiter.api.Assertions.*;

import java.util.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import tg.analysis.AnalysisOptions;
import tg.analysis.AnalysisRun;
import tg.ir.*;

public class RedundantStoreProverTest {

    MemoryObject g;
    SpeculatedValue pg;
    RedundantStoreProver prover;

    @BeforeEach
    public void setUp() {
        g = MemoryObject.global("g", 8, false);
        pg = SpeculatedValue.pointer(g, 0);
        prover = new RedundantStoreProver(new AnalysisRun(AnalysisOptions.defaults()));
    }

    @Test
    public void testOverwrittenStoreIsDead() {
        FunctionContext main = new FunctionContext("main");
        BasicBlock entry = main.newBlock("entry");
        Instruction first = entry.add(Instruction.store("first", pg, 4));
        Instruction second = entry.add(Instruction.store("second", pg, 4));
        entry.add(Instruction.ret("ret"));

        prover.killAll(main);
        assertTrue(first.isUnusedWriter());
        // leaving a root that is not main: the caller may read it
        assertFalse(second.isUnusedWriter());
        assertEquals(1, prover.getKilledCount());
    }

    @Test
    public void testPartialOverwritesAddUp() {
        FunctionContext main = new FunctionContext("main");
        BasicBlock entry = main.newBlock("entry");
        Instruction wide = entry.add(Instruction.store("wide", pg, 8));
        entry.add(Instruction.store("low", pg, 4));
        entry.add(Instruction.store("high", pg.offsetBy(4), 4));
        entry.add(Instruction.ret("ret"));

        prover.killAll(main);
        assertTrue(wide.isUnusedWriter());
    }

    @Test
    public void testStoreReadLaterIsLive() {
        FunctionContext main = new FunctionContext("main").setRootMain(true);
        BasicBlock entry = main.newBlock("entry");
        Instruction st = entry.add(Instruction.store("st", pg, 4));
        entry.add(Instruction.load("ld", pg.offsetBy(2), 4, SpeculatedValue.scalar()));
        entry.add(Instruction.ret("ret"));

        prover.killAll(main);
        assertFalse(st.isUnusedWriter());
    }

    @Test
    public void testResolvedLoadDoesNotRead() {
        FunctionContext main = new FunctionContext("main").setRootMain(true);
        BasicBlock entry = main.newBlock("entry");
        Instruction st = entry.add(Instruction.store("st", pg, 4));
        entry.add(Instruction.load("ld", pg, 4, SpeculatedValue.scalar()).setResolved(true));
        entry.add(Instruction.ret("ret"));

        prover.killAll(main);
        assertTrue(st.isUnusedWriter());
    }

    @Test
    public void testReturningFromMainEndsEverything() {
        FunctionContext main = new FunctionContext("main").setRootMain(true);
        BasicBlock entry = main.newBlock("entry");
        Instruction st = entry.add(Instruction.store("st", pg, 4));
        entry.add(Instruction.ret("ret"));

        prover.killAll(main);
        assertTrue(st.isUnusedWriter());
    }

    @Test
    public void testStackStoreDiesWithItsFrame() {
        FunctionContext f = new FunctionContext("f");
        MemoryObject local = MemoryObject.stack("local", 4, f);
        BasicBlock fb = f.newBlock("entry");
        fb.add(Instruction.alloca("alloca", local));
        Instruction st = fb.add(Instruction.store("st", SpeculatedValue.pointer(local, 0), 4));
        fb.add(Instruction.ret("ret"));

        FunctionContext main = new FunctionContext("main");
        BasicBlock entry = main.newBlock("entry");
        entry.add(Instruction.call("call", f));
        Instruction global = entry.add(Instruction.store("global", pg, 4));
        entry.add(Instruction.ret("ret"));

        prover.killAll(main);
        assertTrue(st.isUnusedWriter());
        assertFalse(global.isUnusedWriter());
    }

    @Test
    public void testFreedHeapStoreIsDead() {
        FunctionContext main = new FunctionContext("main");
        MemoryObject block = MemoryObject.heap("block", 16);
        SpeculatedValue pb = SpeculatedValue.pointer(block, 0);
        BasicBlock entry = main.newBlock("entry");
        entry.add(Instruction.malloc("malloc", block));
        Instruction st = entry.add(Instruction.store("st", pb, 8));
        entry.add(Instruction.free("free", pb));
        entry.add(Instruction.ret("ret"));

        prover.killAll(main);
        assertTrue(st.isUnusedWriter());
    }

    @Test
    public void testCallThatMayReadKeepsStore() {
        FunctionContext main = new FunctionContext("main").setRootMain(true);
        BasicBlock entry = main.newBlock("entry");
        Instruction st = entry.add(Instruction.store("st", pg, 4));
        entry.add(Instruction.externalCall("ext", true));
        entry.add(Instruction.ret("ret"));

        prover.killAll(main);
        assertFalse(st.isUnusedWriter());
    }

    @Test
    public void testCallNotReferencingObjectIsSkipped() {
        MemoryObject other = MemoryObject.global("other", 8, false);
        FunctionContext main = new FunctionContext("main").setRootMain(true);
        BasicBlock entry = main.newBlock("entry");
        Instruction st = entry.add(Instruction.store("st", pg, 4));
        entry.add(Instruction.externalCall("ext", true).setReferencedObjects(Collections.singletonList(other)));
        entry.add(Instruction.ret("ret"));

        prover.killAll(main);
        assertTrue(st.isUnusedWriter());
    }

    @Test
    public void testReadInCalleeKeepsStore() {
        FunctionContext f = new FunctionContext("f");
        BasicBlock fb = f.newBlock("entry");
        fb.add(Instruction.load("ld", pg, 4, SpeculatedValue.scalar()));
        fb.add(Instruction.ret("ret"));

        FunctionContext main = new FunctionContext("main").setRootMain(true);
        BasicBlock entry = main.newBlock("entry");
        Instruction st = entry.add(Instruction.store("st", pg, 4));
        entry.add(Instruction.call("call", f));
        entry.add(Instruction.ret("ret"));

        prover.killAll(main);
        assertFalse(st.isUnusedWriter());
    }

    @Test
    public void testOverwriteOnOnePathOnlyIsLive() {
        FunctionContext main = new FunctionContext("main");
        BasicBlock entry = main.newBlock("entry");
        BasicBlock left = main.newBlock("left");
        BasicBlock right = main.newBlock("right");
        Instruction st = entry.add(Instruction.store("st", pg, 4));
        left.add(Instruction.store("overwrite", pg, 4));
        left.add(Instruction.ret("ret"));
        right.add(Instruction.ret("ret"));
        entry.addSuccessor(left);
        entry.addSuccessor(right);

        prover.killAll(main);
        assertFalse(st.isUnusedWriter());

        entry.killEdge(right);
        assertTrue(prover.tryKillStore(st));
    }

    @Test
    public void testDeadCopyNoLongerReadsItsSource() {
        MemoryObject dst = MemoryObject.heap("dst", 8);
        FunctionContext main = new FunctionContext("main").setRootMain(true);
        BasicBlock entry = main.newBlock("entry");
        Instruction st = entry.add(Instruction.store("st", pg, 4));
        Instruction cp = entry.add(Instruction.memcpy("cp", SpeculatedValue.pointer(dst, 0), pg, 4));
        entry.add(Instruction.ret("ret"));

        prover.killAll(main);
        assertTrue(cp.isUnusedWriter());
        assertTrue(st.isUnusedWriter());
    }

    @Test
    public void testLiveCopyReadsItsSource() {
        MemoryObject dst = MemoryObject.heap("dst", 8);
        SpeculatedValue pd = SpeculatedValue.pointer(dst, 0);
        FunctionContext main = new FunctionContext("main").setRootMain(true);
        BasicBlock entry = main.newBlock("entry");
        Instruction st = entry.add(Instruction.store("st", pg, 4));
        Instruction cp = entry.add(Instruction.memcpy("cp", pd, pg, 4));
        entry.add(Instruction.load("ld", pd, 4, SpeculatedValue.scalar()));
        entry.add(Instruction.ret("ret"));

        prover.killAll(main);
        assertFalse(cp.isUnusedWriter());
        assertFalse(st.isUnusedWriter());
    }

    @Test
    public void testStoreOverwrittenEveryLoopIterationIsDead() {
        FunctionContext main = new FunctionContext("main").setRootMain(true);
        LoopRegion l = main.newLoop("loop", null);
        BasicBlock entry = main.newBlock("entry");
        BasicBlock body = main.newBlock("body", l);
        BasicBlock exit = main.newBlock("exit");
        Instruction inLoop = body.add(Instruction.store("inLoop", pg, 4));
        entry.addSuccessor(body);
        body.addSuccessor(body);
        body.addSuccessor(exit);
        exit.add(Instruction.ret("ret"));
        l.setShape(entry, body, body);

        prover.killAll(main);
        // the next iteration overwrites it and main ends afterwards
        assertTrue(inLoop.isUnusedWriter());
    }

    @Test
    public void testDisabledContextsContributeNoCandidates() {
        FunctionContext f = new FunctionContext("f");
        BasicBlock fb = f.newBlock("entry");
        Instruction inDisabled = fb.add(Instruction.store("inDisabled", pg, 4));
        fb.add(Instruction.store("again", pg, 4));
        fb.add(Instruction.ret("ret"));
        f.setEnabled(false);

        FunctionContext main = new FunctionContext("main").setRootMain(true);
        BasicBlock entry = main.newBlock("entry");
        entry.add(Instruction.call("call", f));
        entry.add(Instruction.ret("ret"));

        prover.killAll(main);
        assertFalse(inDisabled.isUnusedWriter());
    }

    @Test
    public void testWrittenBytes() {
        WrittenBytes w = new WrittenBytes(8);
        w.set(-2, 3);
        w.set(6, 20);
        assertFalse(w.isComplete());
        WrittenBytes more = w.copy();
        more.set(3, 6);
        assertTrue(more.isComplete());
        assertTrue(w.isSubsetOf(more));
        assertFalse(more.isSubsetOf(w));
    }

}
