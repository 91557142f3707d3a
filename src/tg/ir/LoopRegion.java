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

import tg.cfg.RegionGraph;

/**
 * A natural loop of one context. Either its iterations were peeled into
 * {@link IterationContext}s, or its member blocks stay in the owning
 * context and the loop is walked in place to a fixed point.
 */
public class LoopRegion implements Region {

    final Context context;
    final String name;
    final LoopRegion parentLoop;
    final boolean peeled;

    final Set<BasicBlock> members = new LinkedHashSet<BasicBlock>();
    final List<IterationContext> iterations = new ArrayList<IterationContext>();

    BasicBlock preheader;
    BasicBlock header;
    BasicBlock latch;
    boolean enabled = true;

    List<Region> body;

    LoopRegion(Context c, String n, LoopRegion parent, boolean p) {
        if (parent != null && parent.context != c) {
            throw new IllegalArgumentException("parent loop " + parent.getName() + " is in another context");
        }
        context = c;
        name = n;
        parentLoop = parent;
        peeled = p;
    }

    void addMember(BasicBlock b) {
        members.add(b);
        body = null;
    }

    public LoopRegion setShape(BasicBlock preheader, BasicBlock header, BasicBlock latch) {
        if (peeled) {
            throw new IllegalStateException("peeled loop " + name + " has no header of its own");
        }
        if (header.loop != this || latch.loop == null || !contains(latch)) {
            throw new IllegalArgumentException("header and latch of " + name + " must be loop members");
        }
        this.preheader = preheader;
        this.header = header;
        this.latch = latch;
        return this;
    }

    public LoopRegion setPreheader(BasicBlock preheader) {
        this.preheader = preheader;
        return this;
    }

    public IterationContext addIteration() {
        if (!peeled) {
            throw new IllegalStateException("loop " + name + " is not peeled");
        }
        IterationContext it = new IterationContext(this, iterations.size());
        iterations.add(it);
        return it;
    }

    public Context getContext() {
        return context;
    }

    public String getName() {
        return name;
    }

    public boolean isPeeled() {
        return peeled;
    }

    public List<IterationContext> getIterations() {
        return iterations;
    }

    public BasicBlock getPreheader() {
        return preheader;
    }

    public BasicBlock getHeader() {
        return header;
    }

    public BasicBlock getLatch() {
        return latch;
    }

    // blocks whose innermost loop is this one
    public Set<BasicBlock> getMembers() {
        return members;
    }

    public LoopRegion getParentLoop() {
        if (parentLoop != null) {
            return parentLoop;
        }
        return context.getEnclosingLoop();
    }

    public boolean contains(BasicBlock b) {
        for (LoopRegion l = b.getEnclosingLoop(); l != null; l = l.getParentLoop()) {
            if (l == this) {
                return true;
            }
        }
        return false;
    }

    public boolean isEnabled() {
        return enabled && context.isEnabled();
    }

    public void setEnabled(boolean e) {
        enabled = e;
    }

    public boolean containsTentativeLoads() {
        for (IterationContext it : iterations) {
            if (it.containsTentativeLoads()) {
                return true;
            }
        }
        return false;
    }

    // loops of the same context directly nested in this one
    public List<LoopRegion> getChildLoops() {
        List<LoopRegion> children = new ArrayList<LoopRegion>();
        for (LoopRegion l : context.loops) {
            if (l.parentLoop == this) {
                children.add(l);
            }
        }
        return children;
    }

    // body of a loop walked in place, latch-to-header edge removed
    public List<Region> getBody() {
        if (peeled) {
            throw new IllegalStateException("peeled loop " + name + " is walked through its iterations");
        }
        if (body == null) {
            body = RegionGraph.orderLoopBody(this);
        }
        return body;
    }

    /**
     * Every context opened inside this loop: inlined callees of member
     * blocks, iterations of nested peeled loops, and all of their
     * descendants.
     */
    public List<Context> getNestedContexts() {
        List<Context> found = new ArrayList<Context>();
        collectNestedContexts(found);
        return found;
    }

    void collectNestedContexts(List<Context> found) {
        if (peeled) {
            for (IterationContext it : iterations) {
                addWithDescendants(it, found);
            }
            return;
        }
        for (BasicBlock b : members) {
            for (Instruction i : b.instructions) {
                if (i.callee != null) {
                    addWithDescendants(i.callee, found);
                }
            }
        }
        for (LoopRegion child : getChildLoops()) {
            child.collectNestedContexts(found);
        }
    }

    static void addWithDescendants(Context c, List<Context> found) {
        if (found.contains(c)) {
            return;
        }
        found.add(c);
        for (Context child : c.getChildren()) {
            addWithDescendants(child, found);
        }
    }

    public void accept(RegionVisitor v) {
        v.visitLoop(this);
    }

    @Override
    public String toString() {
        return (peeled ? "peeled loop " : "loop ") + context.getName() + "/" + name;
    }

}
