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

public class BasicBlock {

    final Context context;
    final String name;
    final List<Instruction> instructions = new ArrayList<Instruction>();
    final List<BasicBlock> successors = new ArrayList<BasicBlock>();
    final BitSet deadEdges = new BitSet();
    final List<BasicBlock> predecessors = new ArrayList<BasicBlock>();

    // innermost loop walked in place (not peeled) that contains this block
    LoopRegion loop;
    boolean certain = true;

    BasicBlock(Context c, String n, LoopRegion l) {
        context = c;
        name = n;
        loop = l;
    }

    public Context getContext() {
        return context;
    }

    public String getName() {
        return name;
    }

    public List<Instruction> getInstructions() {
        return instructions;
    }

    public Instruction add(Instruction i) {
        if (i.parent != null) {
            throw new IllegalArgumentException(i + " already belongs to a block");
        }
        i.parent = this;
        i.index = instructions.size();
        instructions.add(i);
        if (i.callee != null && i.callee.parent == null) {
            i.callee.parent = context;
        }
        return i;
    }

    public Instruction getTerminator() {
        if (instructions.isEmpty()) {
            return null;
        }
        Instruction last = instructions.get(instructions.size() - 1);
        return last.isTerminator() ? last : null;
    }

    public BasicBlock addSuccessor(BasicBlock succ) {
        return addSuccessor(succ, true);
    }

    public BasicBlock addSuccessor(BasicBlock succ, boolean alive) {
        if (!alive) {
            deadEdges.set(successors.size());
        }
        successors.add(succ);
        succ.predecessors.add(this);
        return this;
    }

    public List<BasicBlock> getSuccessors() {
        return successors;
    }

    public List<BasicBlock> getPredecessors() {
        return predecessors;
    }

    public boolean isEdgeAlive(int succIndex) {
        return !deadEdges.get(succIndex);
    }

    public boolean isEdgeAlive(BasicBlock succ) {
        for (int i = 0; i < successors.size(); i++) {
            if (successors.get(i) == succ && isEdgeAlive(i)) {
                return true;
            }
        }
        return false;
    }

    public void killEdge(BasicBlock succ) {
        for (int i = 0; i < successors.size(); i++) {
            if (successors.get(i) == succ) {
                deadEdges.set(i);
            }
        }
    }

    public LoopRegion getLoop() {
        return loop;
    }

    /**
     * The innermost unpeeled loop containing this block, looking through
     * peeled iterations into the contexts that contain them.
     */
    public LoopRegion getEnclosingLoop() {
        if (loop != null) {
            return loop;
        }
        return context.getEnclosingLoop();
    }

    // whether execution is known to reach this block once its context is entered
    public boolean isCertain() {
        return certain;
    }

    public BasicBlock setCertain(boolean c) {
        certain = c;
        return this;
    }

    public FunctionContext getFunctionRoot() {
        return context.getFunctionRoot();
    }

    @Override
    public String toString() {
        return context.getName() + "/" + name;
    }

}
