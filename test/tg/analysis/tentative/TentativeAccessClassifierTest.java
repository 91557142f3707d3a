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

package tg.analysis.tentative;

import static org.junit.jupiter.api.Assertions.*;

import java.util.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import tg.analysis.AnalysisOptions;
import tg.analysis.AnalysisRun;
import tg.analysis.oracle.CommitRegistry;
import tg.analysis.oracle.TargetAliasOracle;
import tg.ir.*;

public class TentativeAccessClassifierTest {

    MemoryObject g;
    MemoryObject h;
    SpeculatedValue pg;
    SpeculatedValue ph;
    CommitRegistry registry;

    @BeforeEach
    public void setUp() {
        g = MemoryObject.global("g", 8, false);
        h = MemoryObject.heap("h", 8);
        pg = SpeculatedValue.pointer(g, 0);
        ph = SpeculatedValue.pointer(h, 0);
        registry = new CommitRegistry();
    }

    // runs the analysis over a function made of a single block
    AnalysisRun analyse(String options, Instruction... insts) {
        FunctionContext main = new FunctionContext("main");
        BasicBlock entry = main.newBlock("entry");
        for (Instruction i : insts) {
            entry.add(i);
        }
        entry.add(Instruction.ret("ret"));
        AnalysisRun run = new AnalysisRun(AnalysisOptions.parse(options), new TargetAliasOracle(), registry);
        new TentativeLoadsAnalysis(run).findTentativeLoads(main);
        assertEquals(0, run.getTracker().getLiveCount());
        return run;
    }

    static Instruction load(String name, SpeculatedValue ptr, long size) {
        return Instruction.load(name, ptr, size, SpeculatedValue.scalar());
    }

    @Test
    public void testNothingClobberedNeedsNoCheck() {
        Instruction ld = load("ld", pg, 4);
        analyse("", ld);
        assertEquals(CheckRequirement.NO_CHECK, ld.getCheck());
    }

    @Test
    public void testLoadAfterFenceMustBeChecked() {
        Instruction ld = load("ld", pg, 4);
        analyse("", Instruction.fence("fence"), ld);
        assertEquals(CheckRequirement.MUST_CHECK, ld.getCheck());
        assertTrue(ld.getContext().readsTentativeData());
    }

    @Test
    public void testCheckedLoadRevalidatesItsBytes() {
        Instruction first = load("first", pg, 4);
        Instruction again = load("again", pg, 4);
        Instruction wider = load("wider", pg, 8);
        analyse("", Instruction.fence("fence"), first, again, wider);
        assertEquals(CheckRequirement.MUST_CHECK, first.getCheck());
        assertEquals(CheckRequirement.NO_CHECK, again.getCheck());
        assertEquals(CheckRequirement.MUST_CHECK, wider.getCheck());
    }

    @Test
    public void testOwnStoreIsTrusted() {
        Instruction ld = load("ld", pg, 4);
        Instruction partial = load("partial", pg.offsetBy(2), 4);
        analyse("", Instruction.fence("fence"), Instruction.store("st", pg, 4), ld, partial);
        assertEquals(CheckRequirement.NO_CHECK, ld.getCheck());
        assertEquals(CheckRequirement.MUST_CHECK, partial.getCheck());
    }

    @Test
    public void testConstantAndNullNeverChecked() {
        MemoryObject c = MemoryObject.global("c", 8, true);
        Instruction fromConstant = load("fromConstant", SpeculatedValue.pointer(c, 0), 4);
        Instruction fromNull = load("fromNull", SpeculatedValue.pointer(MemoryObject.NULL, 0), 4);
        Instruction unknownPtr = load("unknownPtr", SpeculatedValue.unknown(), 4);
        analyse("", Instruction.fence("fence"), fromConstant, fromNull, unknownPtr);
        assertEquals(CheckRequirement.NEVER_CHECK, fromConstant.getCheck());
        assertEquals(CheckRequirement.NEVER_CHECK, fromNull.getCheck());
        assertEquals(CheckRequirement.NEVER_CHECK, unknownPtr.getCheck());
    }

    @Test
    public void testNothingLearntNeverChecked() {
        Instruction ld = Instruction.load("ld", pg, 4, SpeculatedValue.unknown());
        analyse("", Instruction.fence("fence"), ld);
        assertEquals(CheckRequirement.NEVER_CHECK, ld.getCheck());
    }

    @Test
    public void testSingleThreadedNeverChecks() {
        Instruction ld = load("ld", pg, 4);
        Instruction xchg = Instruction.atomicRmw("xchg", ph, 4, SpeculatedValue.scalar());
        analyse("single-threaded:true", Instruction.fence("fence"), ld, xchg);
        assertEquals(CheckRequirement.NEVER_CHECK, ld.getCheck());
        assertEquals(CheckRequirement.NEVER_CHECK, xchg.getCheck());
    }

    @Test
    public void testVolatileLoadClobbers() {
        Instruction vol = load("vol", pg, 4).setVolatile(true);
        Instruction after = load("after", ph, 4);
        analyse("", vol, after);
        assertEquals(CheckRequirement.NO_CHECK, vol.getCheck());
        assertEquals(CheckRequirement.MUST_CHECK, after.getCheck());
    }

    @Test
    public void testOrderedLoadMustBeChecked() {
        Instruction ordered = load("ordered", pg, 4).setOrdered(true);
        analyse("", ordered);
        assertEquals(CheckRequirement.MUST_CHECK, ordered.getCheck());
    }

    @Test
    public void testAtomics() {
        Instruction xchg = Instruction.atomicRmw("xchg", ph, 4, SpeculatedValue.scalar());
        Instruction after = load("after", pg, 4);
        analyse("", xchg, after);
        assertEquals(CheckRequirement.MUST_CHECK, xchg.getCheck());
        assertEquals(CheckRequirement.MUST_CHECK, after.getCheck());
    }

    @Test
    public void testSimpleAtomicDoesNotClobber() {
        Instruction cas = Instruction.cmpxchg("cas", ph, 4, SpeculatedValue.scalar()).setSimpleAtomic(true);
        Instruction after = load("after", pg, 4);
        analyse("", cas, after);
        assertEquals(CheckRequirement.MUST_CHECK, cas.getCheck());
        assertEquals(CheckRequirement.NO_CHECK, after.getCheck());
    }

    @Test
    public void testSeveralTargetsTakeMostSevere() {
        SpeculatedValue either = SpeculatedValue.pointers(Arrays.asList(new PointerTarget(g, 0), new PointerTarget(h, 0)));
        Instruction ld = load("ld", either, 4);
        analyse("", Instruction.fence("fence"), Instruction.store("st", pg, 4), ld);
        assertEquals(CheckRequirement.MUST_CHECK, ld.getCheck());
    }

    @Test
    public void testOnlyKnownRangesAreChecked() {
        Instruction ld = Instruction.load("ld", pg, 8, SpeculatedValue.unknown())
            .addReadValue(0, 4, SpeculatedValue.scalar())
            .addReadValue(4, 8, SpeculatedValue.unknown());
        analyse("", Instruction.fence("fence"), Instruction.store("st", pg, 4), ld);
        assertEquals(CheckRequirement.NO_CHECK, ld.getCheck());
    }

    @Test
    public void testCopyChecksSourceAndTrustsBothEnds() {
        MemoryObject dst = MemoryObject.heap("dst", 8);
        Instruction cp = Instruction.memcpy("cp", SpeculatedValue.pointer(dst, 0), pg, 8)
            .addReadValue(0, 8, SpeculatedValue.scalar());
        Instruction fromDst = load("fromDst", SpeculatedValue.pointer(dst, 0), 8);
        Instruction fromSrc = load("fromSrc", pg, 8);
        analyse("", Instruction.fence("fence"), cp, fromDst, fromSrc);
        assertEquals(CheckRequirement.MUST_CHECK, cp.getCheck());
        assertEquals(CheckRequirement.NO_CHECK, fromDst.getCheck());
        assertEquals(CheckRequirement.NO_CHECK, fromSrc.getCheck());
    }

    @Test
    public void testCopyWithoutTransferredValuesNeverChecked() {
        Instruction cp = Instruction.memcpy("cp", ph, pg, 8);
        analyse("", Instruction.fence("fence"), cp);
        assertEquals(CheckRequirement.NEVER_CHECK, cp.getCheck());
    }

    @Test
    public void testReallocTrustsNewAllocation() {
        MemoryObject grown = MemoryObject.heap("grown", 16);
        Instruction re = Instruction.realloc("re", grown, ph, 16);
        Instruction tail = load("tail", SpeculatedValue.pointer(grown, 8), 8);
        analyse("", Instruction.fence("fence"), re, tail);
        assertEquals(CheckRequirement.NEVER_CHECK, re.getCheck());
        assertEquals(CheckRequirement.NO_CHECK, tail.getCheck());
    }

    @Test
    public void testUnknownCallClobbersAndEffectDomainClearsOnlyItsObjects() {
        Instruction afterUnknown = load("afterUnknown", pg, 4);
        analyse("", Instruction.externalCall("ext", false), afterUnknown);
        assertEquals(CheckRequirement.MUST_CHECK, afterUnknown.getCheck());

        Instruction fromG = load("fromG", pg, 4);
        Instruction fromH = load("fromH", ph, 4);
        Instruction yield = Instruction.externalCall("yield", true).setYieldPoint(true).setEffectDomain(Collections.singletonList(h));
        analyse("", yield, fromG, fromH);
        assertEquals(CheckRequirement.NO_CHECK, fromG.getCheck());
        assertEquals(CheckRequirement.MUST_CHECK, fromH.getCheck());
    }

    @Test
    public void testStoreRetrustsObjectClearedByEffectDomain() {
        Instruction yield = Instruction.externalCall("yield", true).setYieldPoint(true).setEffectDomain(Collections.singletonList(h));
        Instruction afterStore = load("afterStore", ph, 4);
        Instruction second = load("second", ph, 4);
        Instruction beyond = load("beyond", ph.offsetBy(4), 4);
        analyse("", yield, Instruction.store("st", ph, 4), afterStore, second, beyond);
        assertEquals(CheckRequirement.NO_CHECK, afterStore.getCheck());
        assertEquals(CheckRequirement.NO_CHECK, second.getCheck());
        assertEquals(CheckRequirement.MUST_CHECK, beyond.getCheck());
    }

    @Test
    public void testCheckedLoadRetrustsObjectClearedByEffectDomain() {
        Instruction yield = Instruction.externalCall("yield", true).setYieldPoint(true).setEffectDomain(Collections.singletonList(h));
        Instruction first = load("first", ph, 4);
        Instruction second = load("second", ph, 4);
        analyse("", yield, first, second);
        assertEquals(CheckRequirement.MUST_CHECK, first.getCheck());
        assertEquals(CheckRequirement.NO_CHECK, second.getCheck());
    }

    @Test
    public void testPessimisticLockDoesNotClobber() {
        Instruction ld = load("ld", pg, 4);
        analyse("", Instruction.externalCall("lock", true).setYieldPoint(true).setPessimisticLock(true), ld);
        assertEquals(CheckRequirement.NO_CHECK, ld.getCheck());
    }

    @Test
    public void testUnavailableResultIsSquashed() {
        MemoryObject fresh = MemoryObject.heap("fresh", 8);
        registry.markUnavailable(fresh);
        Instruction ld = Instruction.load("ld", pg, 8, SpeculatedValue.pointer(fresh, 0));
        analyse("", Instruction.fence("fence"), ld);
        assertEquals(CheckRequirement.NEVER_CHECK, ld.getCheck());
        assertTrue(ld.getResult().isWhollyUnknown());
        assertEquals(1, registry.getForgotten().size());
        assertSame(ld, registry.getForgotten().get(0).reader);
    }

    @Test
    public void testTrustedLoadStepsUpAsCanonicalReference() {
        MemoryObject fresh = MemoryObject.heap("fresh", 8);
        registry.markUnavailable(fresh);
        Instruction ld = Instruction.load("ld", pg, 8, SpeculatedValue.pointer(fresh, 0));
        analyse("", ld);
        assertEquals(CheckRequirement.NO_CHECK, ld.getCheck());
        assertFalse(registry.isUnavailable(fresh));
        assertSame(ld, registry.getCanonicalReference(fresh));
    }

}
