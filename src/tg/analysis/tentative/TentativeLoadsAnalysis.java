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

import tg.analysis.AnalysisRun;
import tg.ir.*;
import tg.util.AnalysisTimer;
import tg.util.Logger;

/**
 * Finds the loads whose speculated values could have been changed by other
 * threads before they run, and so need a runtime check.
 */
public class TentativeLoadsAnalysis {

    final AnalysisRun run;
    final TentativeAccessClassifier classifier;

    public TentativeLoadsAnalysis(AnalysisRun r) {
        run = r;
        classifier = new TentativeAccessClassifier(r);
    }

    public TentativeAccessClassifier getClassifier() {
        return classifier;
    }

    public void findTentativeLoads(FunctionContext root) {
        long start = System.currentTimeMillis();
        new TraversalDriver(run, classifier).walkRoot(root);
        AnalysisTimer.addForTentativeLoads(System.currentTimeMillis() - start);

        start = System.currentTimeMillis();
        countTentativeInstructions(root);
        AnalysisTimer.addForCounting(System.currentTimeMillis() - start);

        Logger.debug("Tentative loads: " + root.getCheckedInstructionsChildren() + " checked instructions, " + run.getTracker());
    }

    // forget which contexts were walked so the analysis can run again
    public void resetTentativeLoads(Context c) {
        c.setTentativeLoadsRun(false);
        for (Context child : c.getChildren()) {
            resetTentativeLoads(child);
        }
    }

    /**
     * Whether the value produced by i must be checked at runtime. Special
     * checks are those requested upstream for reasons other than
     * interference.
     */
    public boolean requiresRuntimeCheck(Instruction i, boolean includeSpecialChecks) {
        if (run.getOptions().isOmitChecks()) {
            return false;
        }
        // the speculative engine never reached it
        if (!i.isAnalysed()) {
            return false;
        }
        if (i.getRuntimeCheck() == RuntimeCheckKind.AS_EXPECTED) {
            return true;
        }
        if (includeSpecialChecks && (i.getRuntimeCheck() == RuntimeCheckKind.READ_LLIOWD || i.getRuntimeCheck() == RuntimeCheckKind.READ_MEMCMP)) {
            return true;
        }
        if (i.readsMemoryDirectly()) {
            return i.getCheck() == CheckRequirement.MUST_CHECK;
        }
        FunctionContext callee = i.getCallee();
        if (callee != null && !callee.isEnabled() && callee.containsTentativeLoads()) {
            // the call is committed unspecialised, so its result is what must be checked
            return !i.getResult().isWhollyUnknown();
        }
        return false;
    }

    /**
     * Counts instructions checked because of interference in each context,
     * both directly and over its whole subtree.
     */
    public void countTentativeInstructions(Context c) {
        int here = 0;
        for (BasicBlock b : c.getBlocks()) {
            for (Instruction i : b.getInstructions()) {
                if (requiresRuntimeCheck(i, false) && i.getRuntimeCheck() == RuntimeCheckKind.NONE) {
                    here++;
                }
            }
        }
        int children = here;
        for (Context child : c.getChildren()) {
            countTentativeInstructions(child);
            children += child.getCheckedInstructionsChildren();
        }
        c.setCheckedInstructions(here, children);
    }

}
