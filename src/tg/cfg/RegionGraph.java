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

package tg.cfg;

import java.util.*;

import soot.toolkits.graph.DirectedGraph;
import soot.toolkits.graph.PseudoTopologicalOrderer;
import tg.ir.*;
import tg.util.InvariantViolationException;

/**
 * Graph of the regions at one nesting level of a context: the top level of
 * the context, or the body of one loop walked in place. Loops nested below
 * that level are collapsed into a single node and the latch-to-header edge
 * of the loop itself is left out, so the graph is acyclic for structured
 * control flow and a pseudo-topological order is a valid walk order.
 */
public class RegionGraph implements DirectedGraph<Region> {

    final Context context;
    final LoopRegion level;

    final Map<BasicBlock,BlockRegion> blockRegions = new HashMap<BasicBlock,BlockRegion>();
    final Map<Region,List<Region>> succs = new LinkedHashMap<Region,List<Region>>();
    final Map<Region,List<Region>> preds = new LinkedHashMap<Region,List<Region>>();

    public RegionGraph(Context c, LoopRegion l) {
        context = c;
        level = l;
        build();
    }

    public static List<Region> orderTopLevel(Context c) {
        return new RegionGraph(c, null).order();
    }

    public static List<Region> orderLoopBody(LoopRegion l) {
        return new RegionGraph(l.getContext(), l).order();
    }

    public List<Region> order() {
        return new PseudoTopologicalOrderer<Region>().newList(this, false);
    }

    void build() {
        List<BasicBlock> local = new ArrayList<BasicBlock>();
        collectLocalBlocks(context, local);

        Map<BasicBlock,Region> owner = new LinkedHashMap<BasicBlock,Region>();
        for (BasicBlock b : local) {
            Region r = regionOf(b);
            if (r != null) {
                owner.put(b, r);
                addNode(r);
            }
        }

        for (Map.Entry<BasicBlock,Region> e : owner.entrySet()) {
            BasicBlock b = e.getKey();
            Region from = e.getValue();
            for (BasicBlock s : b.getSuccessors()) {
                if (level != null && s == level.getHeader() && level.contains(b)) {
                    if (b != level.getLatch()) {
                        throw new InvariantViolationException("block " + b + " branches to the header of " + level + " but is not its latch");
                    }
                    continue;
                }
                Region to = regionOf(s);
                if (to == null || to == from) {
                    continue;
                }
                addEdge(from, to);
            }
        }
    }

    // blocks of c and of every peeled iteration opened (transitively) within c
    static void collectLocalBlocks(Context c, List<BasicBlock> out) {
        out.addAll(c.getBlocks());
        for (LoopRegion l : c.getLoops()) {
            if (l.isPeeled()) {
                for (IterationContext it : l.getIterations()) {
                    collectLocalBlocks(it, out);
                }
            }
        }
    }

    /**
     * The node at this graph's level containing b, or null when b lies
     * outside the level (another function, or outside the loop).
     */
    Region regionOf(BasicBlock b) {
        LoopRegion start;
        if (b.getContext() == context) {
            if (b.getLoop() == level) {
                return blockRegionFor(b);
            }
            start = b.getLoop();
        }
        else {
            start = peeledLoopAround(b.getContext());
        }
        for (LoopRegion l = start; l != null; l = parentWithinContext(l)) {
            if (parentWithinContext(l) == level) {
                return l;
            }
        }
        return null;
    }

    // the loop of this context whose peeled iterations (transitively) contain c
    LoopRegion peeledLoopAround(Context c) {
        while (c instanceof IterationContext) {
            LoopRegion l = ((IterationContext)c).getLoop();
            if (l.getContext() == context) {
                return l;
            }
            c = c.getParent();
        }
        return null;
    }

    LoopRegion parentWithinContext(LoopRegion l) {
        LoopRegion p = l.getParentLoop();
        if (p != null && p.getContext() != context) {
            return null;
        }
        return p;
    }

    BlockRegion blockRegionFor(BasicBlock b) {
        BlockRegion r = blockRegions.get(b);
        if (r == null) {
            r = new BlockRegion(b);
            blockRegions.put(b, r);
        }
        return r;
    }

    void addNode(Region r) {
        if (!succs.containsKey(r)) {
            succs.put(r, new ArrayList<Region>());
            preds.put(r, new ArrayList<Region>());
        }
    }

    void addEdge(Region from, Region to) {
        List<Region> out = succs.get(from);
        if (!out.contains(to)) {
            out.add(to);
            preds.get(to).add(from);
        }
    }

    public List<Region> getHeads() {
        List<Region> heads = new ArrayList<Region>();
        for (Map.Entry<Region,List<Region>> e : preds.entrySet()) {
            if (e.getValue().isEmpty()) {
                heads.add(e.getKey());
            }
        }
        return heads;
    }

    public List<Region> getTails() {
        List<Region> tails = new ArrayList<Region>();
        for (Map.Entry<Region,List<Region>> e : succs.entrySet()) {
            if (e.getValue().isEmpty()) {
                tails.add(e.getKey());
            }
        }
        return tails;
    }

    public List<Region> getPredsOf(Region r) {
        return preds.get(r);
    }

    public List<Region> getSuccsOf(Region r) {
        return succs.get(r);
    }

    public int size() {
        return succs.size();
    }

    public Iterator<Region> iterator() {
        return succs.keySet().iterator();
    }

}
