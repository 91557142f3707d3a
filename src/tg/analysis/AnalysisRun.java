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

package tg.analysis;

import java.util.*;

import soot.util.ArrayNumberer;
import tg.analysis.merge.MergeEngine;
import tg.analysis.oracle.*;
import tg.analysis.store.StoreTracker;
import tg.ir.*;
import tg.util.Info;

/**
 * Everything one analysis run shares: options, the snapshot tracker, the
 * collaborators answering alias and availability questions, and numberings
 * of the contexts, instructions and objects it has seen.
 */
public class AnalysisRun {

    final AnalysisOptions options;
    final StoreTracker tracker = new StoreTracker();
    final MergeEngine merger;
    final AliasOracle aliasOracle;
    final AvailabilityRegistry registry;
    final List<PathCondition> globalPathConditions = new ArrayList<PathCondition>();

    final ArrayNumberer<Context> contextNumberer = new ArrayNumberer<Context>();
    final ArrayNumberer<Instruction> instructionNumberer = new ArrayNumberer<Instruction>();
    final ArrayNumberer<MemoryObject> objectNumberer = new ArrayNumberer<MemoryObject>();

    public AnalysisRun(AnalysisOptions o, AliasOracle a, AvailabilityRegistry r) {
        options = o;
        aliasOracle = a;
        registry = r;
        merger = new MergeEngine(tracker);
    }

    public AnalysisRun(AnalysisOptions o) {
        this(o, new TargetAliasOracle(), new CommitRegistry());
    }

    public AnalysisOptions getOptions() {
        return options;
    }

    public StoreTracker getTracker() {
        return tracker;
    }

    public MergeEngine getMerger() {
        return merger;
    }

    public AliasOracle getAliasOracle() {
        return aliasOracle;
    }

    public AvailabilityRegistry getRegistry() {
        return registry;
    }

    // conditions checked wherever their block is entered at their stack depth
    public List<PathCondition> getGlobalPathConditions() {
        return globalPathConditions;
    }

    public void addGlobalPathCondition(PathCondition c) {
        globalPathConditions.add(c);
    }

    // gives every context, instruction and referenced object of the tree a number
    public void number(Context root) {
        for (Context c : Info.allContexts(root)) {
            contextNumberer.add(c);
            for (BasicBlock b : c.getBlocks()) {
                for (Instruction i : b.getInstructions()) {
                    instructionNumberer.add(i);
                    numberTargets(i.getPointer());
                    numberTargets(i.getSource());
                    numberTargets(i.getResult());
                }
            }
        }
    }

    void numberTargets(SpeculatedValue v) {
        for (PointerTarget t : v.getTargets()) {
            objectNumberer.add(t.getObject());
        }
    }

    public ArrayNumberer<Context> getContextNumberer() {
        return contextNumberer;
    }

    public ArrayNumberer<Instruction> getInstructionNumberer() {
        return instructionNumberer;
    }

    public ArrayNumberer<MemoryObject> getObjectNumberer() {
        return objectNumberer;
    }

}
