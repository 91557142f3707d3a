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

import soot.toolkits.scalar.Pair;
import tg.analysis.oracle.AliasOracle;
import tg.analysis.oracle.AliasResult;
import tg.ir.*;
import tg.util.Logger;

/**
 * Forward search from a write for any path on which the written bytes may
 * be read before they are overwritten or die. Paths fork at branches, enter
 * inlined callees that may touch the bytes, and walk out of a function to
 * its callers once its own call stack is exhausted.
 */
public class WriterUsedWalker {

    static class WalkItem {
        final BasicBlock block;
        final int index;
        final WrittenBytes ctx;
        // calls entered on this path, innermost last
        final List<Instruction> callStack;

        WalkItem(BasicBlock b, int i, WrittenBytes c, List<Instruction> s) {
            block = b;
            index = i;
            ctx = c;
            callStack = s;
        }
    }

    final Instruction writer;
    final SpeculatedValue storePtr;
    final PointerTarget storeBase;
    final long storeSize;
    final AliasOracle oracle;

    final Deque<WalkItem> worklist = new ArrayDeque<WalkItem>();
    final Map<Pair<BasicBlock,List<Instruction>>,List<WrittenBytes>> seen = new HashMap<Pair<BasicBlock,List<Instruction>>,List<WrittenBytes>>();

    boolean writeUsed;

    public WriterUsedWalker(Instruction w, SpeculatedValue ptr, PointerTarget base, long size, AliasOracle o) {
        writer = w;
        storePtr = ptr;
        storeBase = base;
        storeSize = size;
        oracle = o;
    }

    public boolean isWriteUsed() {
        return writeUsed;
    }

    public void walk(WrittenBytes initial) {
        worklist.push(new WalkItem(writer.getParent(), writer.getIndex() + 1, initial, Collections.<Instruction>emptyList()));
        while (!worklist.isEmpty() && !writeUsed) {
            walkFrom(worklist.pop());
        }
        worklist.clear();
    }

    void walkFrom(WalkItem item) {
        BasicBlock bb = item.block;
        List<Instruction> insts = bb.getInstructions();
        for (int k = item.index; k < insts.size(); k++) {
            Instruction i = insts.get(k);
            WalkInstructionResult r = noteBytesWrittenBy(i, item.ctx);
            if (r == WalkInstructionResult.STOP_WHOLE_WALK) {
                writeUsed = true;
                return;
            }
            if (r == WalkInstructionResult.STOP_THIS_PATH) {
                return;
            }
            if (i.isCall() && oracle.callMayReference(i, storePtr, storeSize)) {
                if (i.getCallee() == null) {
                    Logger.debug("Can't kill " + writer + " because of unexpanded call " + i);
                    writeUsed = true;
                    return;
                }
                List<Instruction> stack = new ArrayList<Instruction>(item.callStack);
                stack.add(i);
                enqueue(i.getCallee().getEntryBlock(), 0, item.ctx, Collections.unmodifiableList(stack));
                return;
            }
        }

        List<BasicBlock> succs = bb.getSuccessors();
        if (succs.isEmpty()) {
            Instruction term = bb.getTerminator();
            if (term != null && term.getOpcode() == Opcode.RETURN) {
                walkOut(bb, item);
            }
            return;
        }
        boolean first = true;
        for (int k = 0; k < succs.size(); k++) {
            if (!bb.isEdgeAlive(k)) {
                continue;
            }
            WrittenBytes ctx = first || item.ctx == null ? item.ctx : item.ctx.copy();
            first = false;
            enqueue(succs.get(k), 0, ctx, item.callStack);
        }
    }

    // leaves the function through a return
    void walkOut(BasicBlock bb, WalkItem item) {
        if (!item.callStack.isEmpty()) {
            Instruction call = item.callStack.get(item.callStack.size() - 1);
            List<Instruction> rest = item.callStack.subList(0, item.callStack.size() - 1);
            worklist.push(new WalkItem(call.getParent(), call.getIndex() + 1, item.ctx, rest));
            return;
        }
        FunctionContext fn = bb.getFunctionRoot();
        if (fn.getCallers().isEmpty()) {
            // leaving the root: only the end of the program makes the bytes dead
            if (!fn.isRootMain()) {
                writeUsed = true;
            }
            return;
        }
        boolean first = true;
        for (Instruction call : fn.getCallers()) {
            WrittenBytes ctx = first || item.ctx == null ? item.ctx : item.ctx.copy();
            first = false;
            worklist.push(new WalkItem(call.getParent(), call.getIndex() + 1, ctx, Collections.<Instruction>emptyList()));
        }
    }

    // skips block entries already reached with fewer bytes overwritten
    void enqueue(BasicBlock b, int index, WrittenBytes ctx, List<Instruction> callStack) {
        Pair<BasicBlock,List<Instruction>> key = new Pair<BasicBlock,List<Instruction>>(b, callStack);
        List<WrittenBytes> before = seen.get(key);
        if (before == null) {
            before = new ArrayList<WrittenBytes>();
            seen.put(key, before);
        }
        else if (ctx == null) {
            return;
        }
        else {
            for (WrittenBytes w : before) {
                if (w.isSubsetOf(ctx)) {
                    return;
                }
            }
        }
        if (ctx != null) {
            before.add(ctx.copy());
        }
        worklist.push(new WalkItem(b, index, ctx, callStack));
    }

    WalkInstructionResult noteBytesWrittenBy(Instruction i, WrittenBytes ctx) {
        if (isLifetimeEnd(i)) {
            return WalkInstructionResult.STOP_THIS_PATH;
        }
        switch (i.getOpcode()) {
        case MEMSET:
        case MEMCPY:
        case VACOPY:
            if (i.getOpcode() != Opcode.MEMSET && !i.isUnusedWriter()
                    && oracle.alias(i.getSource(), i.getSize(), storePtr, storeSize) != AliasResult.NO_ALIAS) {
                // a copy that is not itself dead is a big unresolved load
                Logger.debug("Can't kill " + writer + " because of copy " + i);
                return WalkInstructionResult.STOP_WHOLE_WALK;
            }
            // unknown length writes nothing for sure
            if (i.isSizeKnown()) {
                return handleWrite(i.getPointer(), i.getSize(), ctx) ? WalkInstructionResult.STOP_THIS_PATH : WalkInstructionResult.CONTINUE;
            }
            return WalkInstructionResult.CONTINUE;
        case READ_FILE:
        case STORE:
            return handleWrite(i.getPointer(), i.getSize(), ctx) ? WalkInstructionResult.STOP_THIS_PATH : WalkInstructionResult.CONTINUE;
        case LOAD:
            if (i.isResolved() && isAvailable(i.getResult())) {
                // replaced by its known value, so it never reads memory at runtime
                return WalkInstructionResult.CONTINUE;
            }
            return readOf(i, i.getPointer(), i.getSize());
        case ATOMIC_RMW:
        case CMPXCHG:
            return readOf(i, i.getPointer(), i.getSize());
        case REALLOC:
            return readOf(i, i.getSource(), i.getSize());
        default:
            return WalkInstructionResult.CONTINUE;
        }
    }

    WalkInstructionResult readOf(Instruction i, SpeculatedValue ptr, long size) {
        if (oracle.alias(ptr, size, storePtr, storeSize) != AliasResult.NO_ALIAS) {
            Logger.debug("Can't kill " + writer + " because of unresolved read " + i);
            return WalkInstructionResult.STOP_WHOLE_WALK;
        }
        return WalkInstructionResult.CONTINUE;
    }

    // a resolved pointer result can stand in for the load if its object is reachable from the writer
    boolean isAvailable(SpeculatedValue v) {
        if (!v.isPointer() && !v.isFd()) {
            return true;
        }
        MemoryObject o = v.getTargets().get(0).getObject();
        if (!o.isStack()) {
            return true;
        }
        for (Context c = writer.getContext(); c != null; c = c.getParent()) {
            if (c.getFunctionRoot() == o.getAllocatingFunction()) {
                return true;
            }
        }
        return false;
    }

    boolean isLifetimeEnd(Instruction i) {
        MemoryObject o = storeBase.getObject();
        if (o.isStack()) {
            // about to return from the function owning the stack slot
            return i.isTerminator() && i.getParent().getSuccessors().isEmpty()
                && i.getParent().getFunctionRoot() == o.getAllocatingFunction();
        }
        if (o.isHeap() && i.getOpcode() == Opcode.FREE) {
            PointerTarget freed = i.getPointer().getUniqueTarget();
            return freed != null && freed.getObject() == o;
        }
        return false;
    }

    /**
     * Records the bytes of the candidate that a later write overwrites.
     * Returns true once every byte has been overwritten on this path.
     */
    boolean handleWrite(SpeculatedValue writePtr, long writeSize, WrittenBytes ctx) {
        if (ctx == null) {
            return false;
        }
        PointerTarget w = writePtr.getUniqueTarget();
        if (w == null || writeSize == Instruction.UNKNOWN_SIZE) {
            return false;
        }
        AliasResult r = oracle.alias(writePtr, writeSize, storePtr, storeSize);
        long firstDef;
        long firstNotDef;
        if (r == AliasResult.MUST_ALIAS) {
            firstDef = 0;
            firstNotDef = Math.min(writeSize, storeSize);
        }
        else if ((r == AliasResult.MAY_ALIAS || r == AliasResult.PARTIAL_ALIAS) && w.getObject() == storeBase.getObject()) {
            firstDef = Math.max(0, w.getOffset() - storeBase.getOffset());
            firstNotDef = Math.min(storeSize, w.getOffset() + writeSize - storeBase.getOffset());
        }
        else {
            return false;
        }
        if (firstDef >= firstNotDef) {
            return false;
        }
        ctx.set(firstDef, firstNotDef);
        return ctx.isComplete();
    }

}
