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

import java.util.*;

import tg.analysis.AnalysisRun;
import tg.analysis.oracle.AliasOracle;
import tg.ir.*;
import tg.util.AnalysisTimer;
import tg.util.Logger;

/**
 * Proves writes and allocations dead: a write is dead if, on every path
 * from it, each of its bytes is overwritten or dies before anything may
 * read it. Dead writers are flagged so the materialiser can drop them.
 */
public class RedundantStoreProver {

    // larger writes are only ever killed by the end of their object's lifetime
    static final long MAX_TRACKED_SIZE = 1 << 20;

    final AnalysisRun run;
    final AliasOracle oracle;
    int killed;

    public RedundantStoreProver(AnalysisRun r) {
        run = r;
        oracle = r.getAliasOracle();
    }

    public int getKilledCount() {
        return killed;
    }

    public void killAll(FunctionContext root) {
        long start = System.currentTimeMillis();
        // copies first: a copy found dead no longer reads its source
        tryKillAllMTIs(root);
        tryKillAllStores(root, new HashSet<Context>());
        tryKillAllAllocs(root, new HashSet<Context>());
        AnalysisTimer.addForDeadStores(System.currentTimeMillis() - start);
        Logger.debug("Dead writers: " + killed);
    }

    public boolean tryKillStore(Instruction store) {
        return tryKillWriterTo(store, store.getPointer(), store.getSize());
    }

    public boolean tryKillMemset(Instruction memset) {
        return tryKillWriterTo(memset, memset.getPointer(), memset.getSize());
    }

    public boolean tryKillRead(Instruction read) {
        return tryKillWriterTo(read, read.getPointer(), read.getSize());
    }

    public boolean tryKillMTI(Instruction copy) {
        return tryKillWriterTo(copy, copy.getCopyDest(), copy.getSize());
    }

    // an allocation dies only at the end of its lifetime, never by being overwritten
    public boolean tryKillAlloc(Instruction alloc) {
        return tryKillWriterTo(alloc, alloc.getPointer(), Instruction.UNKNOWN_SIZE);
    }

    public boolean tryKillWriterTo(Instruction writer, SpeculatedValue ptr, long size) {
        Logger.progress();
        PointerTarget base = ptr.getUniqueTarget();
        if (base == null) {
            return false;
        }
        WrittenBytes initial = null;
        if (size != Instruction.UNKNOWN_SIZE && size <= MAX_TRACKED_SIZE) {
            initial = new WrittenBytes((int)size);
        }
        long tracked = initial == null ? Instruction.UNKNOWN_SIZE : size;
        WriterUsedWalker walk = new WriterUsedWalker(writer, ptr, base, tracked, oracle);
        walk.walk(initial);
        if (!walk.isWriteUsed()) {
            Logger.debug("Killed " + writer);
            writer.setUnusedWriter(true);
            killed++;
        }
        return !walk.isWriteUsed();
    }

    // copies in reverse program order, so callees and later copies are settled first
    public void tryKillAllMTIs(Context c) {
        if (!c.isEnabled()) {
            return;
        }
        tryKillMTIsIn(c.getRegions());
    }

    void tryKillMTIsIn(List<Region> regions) {
        for (int k = regions.size() - 1; k >= 0; k--) {
            Region r = regions.get(k);
            if (r instanceof BlockRegion) {
                List<Instruction> insts = ((BlockRegion)r).getBlock().getInstructions();
                for (int j = insts.size() - 1; j >= 0; j--) {
                    Instruction i = insts.get(j);
                    if (i.getOpcode() == Opcode.MEMCPY) {
                        tryKillMTI(i);
                    }
                    else if (i.getCallee() != null) {
                        tryKillAllMTIs(i.getCallee());
                    }
                }
            }
            else if (r instanceof LoopRegion) {
                LoopRegion l = (LoopRegion)r;
                if (l.isPeeled()) {
                    List<IterationContext> its = l.getIterations();
                    for (int j = its.size() - 1; j >= 0; j--) {
                        tryKillAllMTIs(its.get(j));
                    }
                }
                else {
                    tryKillMTIsIn(l.getBody());
                }
            }
        }
    }

    public void tryKillAllStores(Context c, Set<Context> done) {
        if (!c.isEnabled() || !done.add(c)) {
            return;
        }
        for (BasicBlock b : c.getBlocks()) {
            for (Instruction i : b.getInstructions()) {
                switch (i.getOpcode()) {
                case STORE:
                    tryKillStore(i);
                    break;
                case MEMSET:
                    tryKillMemset(i);
                    break;
                case READ_FILE:
                    tryKillRead(i);
                    break;
                default:
                    break;
                }
            }
        }
        for (Context child : c.getChildren()) {
            tryKillAllStores(child, done);
        }
    }

    public void tryKillAllAllocs(Context c, Set<Context> done) {
        if (!c.isEnabled() || !done.add(c)) {
            return;
        }
        for (BasicBlock b : c.getBlocks()) {
            for (Instruction i : b.getInstructions()) {
                if (i.getOpcode() == Opcode.ALLOCA || i.getOpcode() == Opcode.MALLOC) {
                    tryKillAlloc(i);
                }
            }
        }
        for (Context child : c.getChildren()) {
            tryKillAllAllocs(child, done);
        }
    }

}
