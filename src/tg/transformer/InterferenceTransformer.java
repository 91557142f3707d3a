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

package tg.transformer;

import java.util.*;

import gnu.trove.map.hash.TObjectIntHashMap;
import soot.toolkits.scalar.Pair;
import tg.analysis.*;
import tg.analysis.dse.RedundantStoreProver;
import tg.analysis.oracle.*;
import tg.analysis.tentative.TentativeLoadsAnalysis;
import tg.dot.ContextTreeToDot;
import tg.ir.*;
import tg.util.*;

/**
 * Runs the interference analyses over a specialised context tree: finds the
 * tentative loads that need runtime checks, then proves dead writers.
 */
public class InterferenceTransformer {

    public static class Summary {
        final int contexts;
        final int mustCheck;
        final int noCheck;
        final int neverCheck;
        final int checkedInstructions;
        final int unusedWriters;

        Summary(int c, TObjectIntHashMap<CheckRequirement> byRequirement, int checked, int unused) {
            contexts = c;
            mustCheck = byRequirement.get(CheckRequirement.MUST_CHECK);
            noCheck = byRequirement.get(CheckRequirement.NO_CHECK);
            neverCheck = byRequirement.get(CheckRequirement.NEVER_CHECK);
            checkedInstructions = checked;
            unusedWriters = unused;
        }

        public int getContexts() {
            return contexts;
        }

        public int getMustCheck() {
            return mustCheck;
        }

        public int getNoCheck() {
            return noCheck;
        }

        public int getNeverCheck() {
            return neverCheck;
        }

        public int getCheckedInstructions() {
            return checkedInstructions;
        }

        public int getUnusedWriters() {
            return unusedWriters;
        }

        @Override
        public String toString() {
            return contexts + " contexts, " + mustCheck + " must-check, " + noCheck + " no-check, " + neverCheck
                + " never-check reads, " + checkedInstructions + " checked instructions, " + unusedWriters + " unused writers";
        }
    }

    AnalysisRun run;
    TentativeLoadsAnalysis tentativeLoads;

    public AnalysisRun getRun() {
        return run;
    }

    public TentativeLoadsAnalysis getTentativeLoads() {
        return tentativeLoads;
    }

    public Summary transform(FunctionContext root, Map<String,String> options) {
        return transform(root, AnalysisOptions.fromMap(options), new TargetAliasOracle(), new CommitRegistry());
    }

    public Summary transform(FunctionContext root, AnalysisOptions options, AliasOracle oracle, AvailabilityRegistry registry) {
        Logger.setDebug(options.isDebug());
        Logger.setLogFile(options.getLogFile());
        try {
            return internalTransform(root, new AnalysisRun(options, oracle, registry));
        }
        finally {
            Logger.setLogFile(null);
        }
    }

    protected Summary internalTransform(FunctionContext root, AnalysisRun r) {
        run = r;
        AnalysisOptions options = r.getOptions();

        Logger.println("");
        Logger.println("Running with options " + options);
        Logger.println("");

        if (!options.isEnabled()) {
            Logger.println("Interference analysis disabled");
            return null;
        }

        run.number(root);
        Logger.println("Found " + Info.countContexts(root) + " contexts, " + Info.countBlocks(root) + " blocks, "
            + Info.countInstructions(root) + " instructions");

        tentativeLoads = new TentativeLoadsAnalysis(run);
        if (options.isTentativeLoads()) {
            Logger.println("Finding tentative loads");
            tentativeLoads.findTentativeLoads(root);
            Logger.println("Tentative loads took " + AnalysisTimer.getTotalTentativeLoads() + "ms");
        }

        if (options.isDeadStores()) {
            Logger.println("Finding dead stores");
            RedundantStoreProver prover = new RedundantStoreProver(run);
            prover.killAll(root);
            Logger.println("Dead stores took " + AnalysisTimer.getTotalDeadStores() + "ms, killed " + prover.getKilledCount());
        }

        Summary summary = new Summary(Info.countContexts(root), Info.countByRequirement(root),
            root.getCheckedInstructionsChildren(), Info.countUnusedWriters(root));
        Logger.println("Summary: " + summary, ANSICode.FG_GREEN);

        if (options.isStats()) {
            Info.outputMemoryStatistics(null);
            Logger.println(run.getTracker().toString());
            Pair<Integer,Context> largest = Info.maxInstructionsPerContext(root);
            Logger.println("Largest context " + largest.getO2() + " has " + largest.getO1() + " instructions");
            Logger.println("Numbered " + run.getContextNumberer().size() + " contexts, " + run.getInstructionNumberer().size()
                + " instructions, " + run.getObjectNumberer().size() + " objects");
            Logger.println("Counting took " + AnalysisTimer.getTotalCounting() + "ms");
        }

        if (options.isOutputDot()) {
            String file = options.getDotFile() == null ? "contexts.dot" : options.getDotFile();
            Logger.println("Writing context tree to " + file);
            new ContextTreeToDot().plot(root, file);
        }

        return summary;
    }

}
