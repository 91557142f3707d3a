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

package tg.ir;

import java.util.*;

import soot.util.Numberable;
import tg.cfg.RegionGraph;

/**
 * A specialised copy of a function body or of one peeled loop iteration.
 * Contexts form a tree: calls with inlined callees and peeled loops open
 * child contexts.
 */
public abstract class Context implements Numberable {

    final String name;
    Context parent;
    final List<BasicBlock> blocks = new ArrayList<BasicBlock>();
    final List<LoopRegion> loops = new ArrayList<LoopRegion>();
    boolean enabled = true;
    int number;

    List<Region> regions;

    // analysis results
    boolean tentativeLoadsRun;
    boolean readsTentativeData;
    int checkedInstructionsHere;
    int checkedInstructionsChildren;

    Context(String n, Context p) {
        name = n;
        parent = p;
    }

    public String getName() {
        return name;
    }

    public Context getParent() {
        return parent;
    }

    public abstract FunctionContext getFunctionRoot();

    // innermost loop region that encloses this whole context, within its function
    public abstract LoopRegion getEnclosingLoop();

    public BasicBlock newBlock(String blockName) {
        return newBlock(blockName, null);
    }

    public BasicBlock newBlock(String blockName, LoopRegion loop) {
        if (loop != null && loop.context != this) {
            throw new IllegalArgumentException("loop " + loop.getName() + " belongs to " + loop.context.getName());
        }
        if (loop != null && loop.isPeeled()) {
            throw new IllegalArgumentException("peeled loop " + loop.getName() + " has no blocks of its own");
        }
        BasicBlock b = new BasicBlock(this, blockName, loop);
        blocks.add(b);
        if (loop != null) {
            loop.addMember(b);
        }
        regions = null;
        return b;
    }

    // a loop walked in place until its store reaches a fixed point
    public LoopRegion newLoop(String loopName, LoopRegion parentLoop) {
        LoopRegion l = new LoopRegion(this, loopName, parentLoop, false);
        loops.add(l);
        regions = null;
        return l;
    }

    // a loop whose iterations were each specialised in their own context
    public LoopRegion newPeeledLoop(String loopName, LoopRegion parentLoop) {
        LoopRegion l = new LoopRegion(this, loopName, parentLoop, true);
        loops.add(l);
        regions = null;
        return l;
    }

    public List<BasicBlock> getBlocks() {
        return blocks;
    }

    public BasicBlock getEntryBlock() {
        if (blocks.isEmpty()) {
            throw new IllegalStateException("context " + name + " has no blocks");
        }
        return blocks.get(0);
    }

    public List<LoopRegion> getLoops() {
        return loops;
    }

    // regions of this context in walk order, loops collapsed
    public List<Region> getRegions() {
        if (regions == null) {
            regions = RegionGraph.orderTopLevel(this);
        }
        return regions;
    }

    /**
     * Direct child contexts: inlined callees of this context's own calls and
     * the iterations of loops peeled here.
     */
    public List<Context> getChildren() {
        List<Context> children = new ArrayList<Context>();
        for (BasicBlock b : blocks) {
            for (Instruction i : b.instructions) {
                if (i.callee != null && !children.contains(i.callee)) {
                    children.add(i.callee);
                }
            }
        }
        for (LoopRegion l : loops) {
            if (l.isPeeled()) {
                children.addAll(l.getIterations());
            }
        }
        return children;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean e) {
        enabled = e;
    }

    public boolean isTentativeLoadsRun() {
        return tentativeLoadsRun;
    }

    public void setTentativeLoadsRun(boolean r) {
        tentativeLoadsRun = r;
    }

    public boolean readsTentativeData() {
        return readsTentativeData;
    }

    public void setReadsTentativeData(boolean r) {
        readsTentativeData = r;
    }

    public boolean containsTentativeLoads() {
        return readsTentativeData;
    }

    public int getCheckedInstructionsHere() {
        return checkedInstructionsHere;
    }

    public int getCheckedInstructionsChildren() {
        return checkedInstructionsChildren;
    }

    public void setCheckedInstructions(int here, int children) {
        checkedInstructionsHere = here;
        checkedInstructionsChildren = children;
    }

    public int getNumber() {
        return number;
    }

    public void setNumber(int number) {
        this.number = number;
    }

    @Override
    public String toString() {
        return name;
    }

}
