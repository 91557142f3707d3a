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

import java.util.*;

import tg.analysis.AnalysisRun;
import tg.analysis.merge.MergeEngine;
import tg.analysis.store.Frame;
import tg.analysis.store.LocalStore;
import tg.ir.*;
import tg.util.InvariantViolationException;
import tg.util.Logger;

/**
 * Walks the context tree once, threading a snapshot along every live
 * control-flow edge. Each live successor edge carries one reference; a block
 * drops its own reference when done, except at a return, which hands it to
 * the function's return list.
 */
public class TraversalDriver {

    final AnalysisRun run;
    final MergeEngine merger;
    final TentativeAccessClassifier classifier;

    final Map<BasicBlock,List<LocalStore>> incoming = new HashMap<BasicBlock,List<LocalStore>>();
    final Map<FunctionContext,List<LocalStore>> returns = new HashMap<FunctionContext,List<LocalStore>>();
    // snapshot after a walked callee returns, kept for callers of shared contexts
    final Map<FunctionContext,LocalStore> exitSnapshots = new HashMap<FunctionContext,LocalStore>();
    // loops currently in their first pass, innermost first
    final Deque<LoopRegion> firstPassLoops = new ArrayDeque<LoopRegion>();

    public TraversalDriver(AnalysisRun r, TentativeAccessClassifier c) {
        run = r;
        merger = r.getMerger();
        classifier = c;
    }

    public void walkRoot(FunctionContext root) {
        offer(root.getEntryBlock(), new LocalStore(run.getTracker()));
        walkFunction(root, !root.isEnabled(), false);
        LocalStore out = merger.merge(take(returns, root));
        if (out != null) {
            out.dropReference();
        }
        finish();
    }

    void walkFunction(FunctionContext f, boolean commitDisabled, boolean secondPass) {
        if (f.isTentativeLoadsRun()) {
            return;
        }
        f.setTentativeLoadsRun(true);
        Logger.progress();

        LocalStore entry = merger.merge(take(incoming, f.getEntryBlock()));
        if (entry == null) {
            return;
        }
        entry = entry.getWritableFrameList();
        entry.pushStackFrame(f);
        offer(f.getEntryBlock(), entry);
        walkRegions(f.getRegions(), commitDisabled, secondPass);
    }

    void walkIteration(IterationContext it, boolean commitDisabled, boolean secondPass) {
        if (it.isTentativeLoadsRun()) {
            return;
        }
        it.setTentativeLoadsRun(true);
        Logger.progress();
        walkRegions(it.getRegions(), commitDisabled, secondPass);
    }

    void walkRegions(List<Region> regions, boolean commitDisabled, boolean secondPass) {
        RegionWalker w = new RegionWalker(commitDisabled, secondPass);
        for (Region r : regions) {
            r.accept(w);
        }
    }

    class RegionWalker implements RegionVisitor {

        final boolean commitDisabled;
        final boolean secondPass;
        // snapshot of the block whose call is being visited
        BlockStore current;

        RegionWalker(boolean c, boolean s) {
            commitDisabled = c;
            secondPass = s;
        }

        public void visitBlock(BlockRegion r) {
            walkBlock(r.getBlock(), this);
        }

        public void visitLoop(LoopRegion l) {
            boolean disabled = commitDisabled || !l.isEnabled();
            if (l.isPeeled()) {
                // each iteration's latch feeds the next iteration's header
                for (IterationContext it : l.getIterations()) {
                    walkIteration(it, disabled, secondPass);
                }
            }
            else {
                walkUnboundedLoop(l, disabled, secondPass);
            }
        }

        public void visitCall(CallRegion c) {
            walkCall(c.getCall(), current, commitDisabled, secondPass);
        }

    }

    void walkBlock(BasicBlock bb, RegionWalker w) {
        List<LocalStore> in = take(incoming, bb);
        if (in.isEmpty()) {
            // not reached on this walk
            return;
        }
        FunctionContext fn = bb.getFunctionRoot();
        LocalStore s = merger.merge(in, pathConditionFilter(bb, fn, !w.commitDisabled));
        s = applyFunctionConditions(bb, fn, s, w.secondPass);
        if (s == null) {
            return;
        }

        BlockStore cur = new BlockStore(s);
        for (Instruction i : bb.getInstructions()) {
            classifier.analyse(i, cur, w.commitDisabled, w.secondPass);
            if (i.getCallee() != null) {
                w.current = cur;
                new CallRegion(i).accept(w);
                w.current = null;
                if (cur.get() == null) {
                    // the call never returns
                    break;
                }
            }
        }
        s = cur.get();
        if (s == null) {
            return;
        }

        List<BasicBlock> succs = bb.getSuccessors();
        for (int k = 0; k < succs.size(); k++) {
            BasicBlock succ = succs.get(k);
            if (!bb.isEdgeAlive(k) || skipEdge(bb, succ)) {
                continue;
            }
            s.addReference();
            offer(succ, s);
        }

        if (succs.isEmpty()) {
            s = s.getWritableFrameList();
            s.popStackFrame(fn);
        }

        Instruction term = bb.getTerminator();
        if (term != null && term.getOpcode() == Opcode.RETURN) {
            list(returns, fn).add(s);
        }
        else {
            s.dropReference();
        }
    }

    /**
     * Edges the current pass must not follow: exits of a loop in its first
     * pass, and the latch-to-header edge of a loop walked in place unless
     * that loop is the innermost one in its first pass.
     */
    boolean skipEdge(BasicBlock from, BasicBlock succ) {
        for (LoopRegion l : firstPassLoops) {
            if (!l.contains(succ)) {
                return true;
            }
        }
        LoopRegion l = succ.getLoop();
        if (l != null && succ == l.getHeader() && l.contains(from)) {
            if (from != l.getLatch()) {
                throw new InvariantViolationException("block " + from + " branches to the header of " + l + " but is not its latch");
            }
            return firstPassLoops.peek() != l;
        }
        return false;
    }

    /**
     * First pass: walk the body once from the loop's entry snapshot,
     * collecting what reaches the latch. Second pass: walk again from the
     * join of the entry and latch snapshots, now following the exits.
     * Trust at the latch is (entry minus clobbered bytes) plus bytes
     * re-validated in the body, so the join after one pass is already the
     * fixed point.
     */
    void walkUnboundedLoop(LoopRegion l, boolean commitDisabled, boolean secondPass) {
        BasicBlock header = l.getHeader();
        BasicBlock latch = l.getLatch();
        if (header == null || latch == null) {
            throw new InvariantViolationException(l + " has no header/latch shape");
        }
        if (!latch.isEdgeAlive(header)) {
            resetNested(l);
            walkRegions(l.getBody(), commitDisabled, secondPass);
            return;
        }

        LocalStore entry = merger.merge(take(incoming, header));
        if (entry == null) {
            return;
        }
        entry.addReference();
        offer(header, entry);

        resetNested(l);
        firstPassLoops.push(l);
        try {
            walkRegions(l.getBody(), commitDisabled, secondPass);
        }
        finally {
            firstPassLoops.pop();
        }

        List<LocalStore> fromLatch = take(incoming, header);
        fromLatch.add(entry);
        offer(header, merger.merge(fromLatch));

        resetNested(l);
        walkRegions(l.getBody(), commitDisabled, true);
    }

    // contexts opened inside the loop are walked again on every pass
    void resetNested(LoopRegion l) {
        for (Context c : l.getNestedContexts()) {
            c.setTentativeLoadsRun(false);
        }
    }

    void walkCall(Instruction call, BlockStore cur, boolean commitDisabled, boolean secondPass) {
        FunctionContext callee = call.getCallee();
        if (callee.isTentativeLoadsRun()) {
            useExitSnapshot(call, callee, cur);
        }
        else {
            offer(callee.getEntryBlock(), cur.get());
            cur.set(null);
            walkFunction(callee, commitDisabled || !callee.isEnabled(), secondPass);
            LocalStore out = merger.merge(take(returns, callee));
            LocalStore old = exitSnapshots.remove(callee);
            if (old != null) {
                old.dropReference();
            }
            if (out != null) {
                out.addReference();
                exitSnapshots.put(callee, out);
            }
            cur.set(out);
        }

        if (cur.get() != null && !callee.isEnabled() && callee.readsTentativeData()) {
            // its loads will not be checked, so nothing it read can be trusted
            Logger.println("Suppressed call " + call + " read tentative data");
            classifier.clobberAll(cur, call);
            classifier.squashReturnValue(call);
        }
    }

    // a shared context already walked from another call site
    void useExitSnapshot(Instruction call, FunctionContext callee, BlockStore cur) {
        LocalStore exit = exitSnapshots.get(callee);
        if (exit == null) {
            cur.get().dropReference();
            cur.set(null);
            return;
        }
        if (!sameFrames(exit, cur.get())) {
            Logger.debug("Shared context " + callee.getName() + " reached from a different stack at " + call);
            classifier.clobberAll(cur, call);
            return;
        }
        exit.addReference();
        List<LocalStore> both = new ArrayList<LocalStore>();
        both.add(cur.get());
        both.add(exit);
        cur.set(merger.merge(both));
    }

    static boolean sameFrames(LocalStore a, LocalStore b) {
        List<Frame> fa = a.getFrames();
        List<Frame> fb = b.getFrames();
        if (fa.size() != fb.size()) {
            return false;
        }
        for (int i = 0; i < fa.size(); i++) {
            if (fa.get(i).getOwner() != fb.get(i).getOwner()) {
                return false;
            }
        }
        return true;
    }

    MergeEngine.IncomingFilter pathConditionFilter(final BasicBlock bb, final FunctionContext fn, final boolean contextEnabled) {
        final List<PathCondition> conds = conditionsAt(bb, fn, false);
        if (conds.isEmpty()) {
            return null;
        }
        return new MergeEngine.IncomingFilter() {
            public LocalStore apply(LocalStore s) {
                BlockStore cur = new BlockStore(s);
                for (PathCondition c : conds) {
                    classifier.markGoodBytes(cur, c.getLocation(), c.getLength(), contextEnabled);
                }
                return cur.get();
            }
        };
    }

    /**
     * Function conditions run a checker function on the merged snapshot,
     * treated as committed code, and continue with its merged returns.
     */
    LocalStore applyFunctionConditions(BasicBlock bb, FunctionContext fn, LocalStore s, boolean secondPass) {
        for (PathCondition c : conditionsAt(bb, fn, true)) {
            if (s == null) {
                break;
            }
            FunctionContext checker = c.getFunction();
            checker.setTentativeLoadsRun(false);
            for (Context nested : checker.getChildren()) {
                nested.setTentativeLoadsRun(false);
            }
            offer(checker.getEntryBlock(), s);
            walkFunction(checker, false, secondPass);
            s = merger.merge(take(returns, checker));
        }
        return s;
    }

    List<PathCondition> conditionsAt(BasicBlock bb, FunctionContext fn, boolean functions) {
        List<PathCondition> found = new ArrayList<PathCondition>();
        addConditions(found, run.getGlobalPathConditions(), bb, fn, functions);
        addConditions(found, fn.getPathConditions(), bb, fn, functions);
        return found;
    }

    static void addConditions(List<PathCondition> found, List<PathCondition> from, BasicBlock bb, FunctionContext fn, boolean functions) {
        for (PathCondition c : from) {
            if ((c.getKind() == PathCondition.Kind.FUNC) == functions && c.appliesTo(bb, fn.getTargetStackDepth())) {
                found.add(c);
            }
        }
    }

    void offer(BasicBlock b, LocalStore s) {
        list(incoming, b).add(s);
    }

    static <K> List<LocalStore> list(Map<K,List<LocalStore>> m, K key) {
        List<LocalStore> l = m.get(key);
        if (l == null) {
            l = new ArrayList<LocalStore>();
            m.put(key, l);
        }
        return l;
    }

    static <K> List<LocalStore> take(Map<K,List<LocalStore>> m, K key) {
        List<LocalStore> l = m.remove(key);
        return l == null ? new ArrayList<LocalStore>() : l;
    }

    // releases everything still held once the walk is over
    void finish() {
        for (LocalStore s : exitSnapshots.values()) {
            s.dropReference();
        }
        exitSnapshots.clear();
        for (Map.Entry<BasicBlock,List<LocalStore>> e : incoming.entrySet()) {
            Logger.debug("Snapshot offered to " + e.getKey() + " was never consumed");
            for (LocalStore s : e.getValue()) {
                s.dropReference();
            }
        }
        incoming.clear();
        for (List<LocalStore> l : returns.values()) {
            for (LocalStore s : l) {
                s.dropReference();
            }
        }
        returns.clear();
    }

}
