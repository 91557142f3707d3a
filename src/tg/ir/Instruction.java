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

/**
 * One instruction of a specialised context, together with what the
 * speculative engine learnt about it. The interference analysis writes its
 * verdict ({@link CheckRequirement}) and the dead-store analysis its
 * unused-writer flag back onto the instruction.
 */
public class Instruction implements Numberable {

    public static final long UNKNOWN_SIZE = -1;

    final Opcode opcode;
    final String name;

    BasicBlock parent;
    int index;
    int number;

    SpeculatedValue pointer = SpeculatedValue.unknown();
    SpeculatedValue source = SpeculatedValue.unknown();
    long size = UNKNOWN_SIZE;
    SpeculatedValue result = SpeculatedValue.unknown();
    List<ValueRange> readValues = new ArrayList<ValueRange>();

    boolean analysed = true;
    boolean isVolatile;
    boolean ordered;
    boolean simpleAtomic;
    boolean resolved;

    // calls
    FunctionContext callee;
    boolean calleeKnown = true;
    boolean yieldPoint;
    boolean pessimisticLock;
    List<MemoryObject> effectDomain;
    List<MemoryObject> referencedObjects;

    MemoryObject allocation;

    CheckRequirement check = CheckRequirement.NO_CHECK;
    RuntimeCheckKind runtimeCheck = RuntimeCheckKind.NONE;
    boolean unusedWriter;

    Instruction(Opcode op, String n) {
        opcode = op;
        name = n;
    }

    public static Instruction load(String name, SpeculatedValue ptr, long size, SpeculatedValue result) {
        Instruction i = new Instruction(Opcode.LOAD, name);
        i.pointer = ptr;
        i.size = size;
        i.result = result;
        return i;
    }

    public static Instruction store(String name, SpeculatedValue ptr, long size) {
        Instruction i = new Instruction(Opcode.STORE, name);
        i.pointer = ptr;
        i.size = size;
        return i;
    }

    public static Instruction atomicRmw(String name, SpeculatedValue ptr, long size, SpeculatedValue result) {
        Instruction i = new Instruction(Opcode.ATOMIC_RMW, name);
        i.pointer = ptr;
        i.size = size;
        i.result = result;
        i.ordered = true;
        return i;
    }

    public static Instruction cmpxchg(String name, SpeculatedValue ptr, long size, SpeculatedValue result) {
        Instruction i = new Instruction(Opcode.CMPXCHG, name);
        i.pointer = ptr;
        i.size = size;
        i.result = result;
        i.ordered = true;
        return i;
    }

    public static Instruction fence(String name) {
        Instruction i = new Instruction(Opcode.FENCE, name);
        i.ordered = true;
        return i;
    }

    public static Instruction memset(String name, SpeculatedValue dest, long length) {
        Instruction i = new Instruction(Opcode.MEMSET, name);
        i.pointer = dest;
        i.size = length;
        return i;
    }

    public static Instruction memcpy(String name, SpeculatedValue dest, SpeculatedValue src, long length) {
        Instruction i = new Instruction(Opcode.MEMCPY, name);
        i.pointer = dest;
        i.source = src;
        i.size = length;
        return i;
    }

    public static Instruction vaCopy(String name, SpeculatedValue dest, SpeculatedValue src, long length) {
        Instruction i = new Instruction(Opcode.VACOPY, name);
        i.pointer = dest;
        i.source = src;
        i.size = length;
        return i;
    }

    // copies min(old size, newSize) bytes of oldPtr into the fresh allocation
    public static Instruction realloc(String name, MemoryObject allocation, SpeculatedValue oldPtr, long newSize) {
        Instruction i = new Instruction(Opcode.REALLOC, name);
        i.allocation = allocation;
        i.pointer = SpeculatedValue.pointer(allocation, 0);
        i.result = i.pointer;
        i.source = oldPtr;
        i.size = newSize;
        return i;
    }

    public static Instruction alloca(String name, MemoryObject allocation) {
        Instruction i = new Instruction(Opcode.ALLOCA, name);
        i.allocation = allocation;
        i.pointer = SpeculatedValue.pointer(allocation, 0);
        i.result = i.pointer;
        i.size = allocation.getStoreSize();
        return i;
    }

    public static Instruction malloc(String name, MemoryObject allocation) {
        Instruction i = new Instruction(Opcode.MALLOC, name);
        i.allocation = allocation;
        i.pointer = SpeculatedValue.pointer(allocation, 0);
        i.result = i.pointer;
        i.size = allocation.getStoreSize();
        return i;
    }

    public static Instruction free(String name, SpeculatedValue ptr) {
        Instruction i = new Instruction(Opcode.FREE, name);
        i.pointer = ptr;
        return i;
    }

    public static Instruction readFile(String name, SpeculatedValue buffer, long bytesRead) {
        Instruction i = new Instruction(Opcode.READ_FILE, name);
        i.pointer = buffer;
        i.size = bytesRead;
        i.result = SpeculatedValue.scalar();
        return i;
    }

    // call into an inlined (specialised) callee
    public static Instruction call(String name, FunctionContext callee) {
        Instruction i = new Instruction(Opcode.CALL, name);
        i.callee = callee;
        callee.addCaller(i);
        return i;
    }

    // call whose callee was not specialised
    public static Instruction externalCall(String name, boolean calleeKnown) {
        Instruction i = new Instruction(Opcode.CALL, name);
        i.calleeKnown = calleeKnown;
        return i;
    }

    public static Instruction ret(String name) {
        return new Instruction(Opcode.RETURN, name);
    }

    public static Instruction branch(String name) {
        return new Instruction(Opcode.BRANCH, name);
    }

    public static Instruction unreachable(String name) {
        return new Instruction(Opcode.UNREACHABLE, name);
    }

    public static Instruction other(String name, SpeculatedValue result) {
        Instruction i = new Instruction(Opcode.OTHER, name);
        i.result = result;
        return i;
    }

    public Opcode getOpcode() {
        return opcode;
    }

    public String getName() {
        return name;
    }

    public BasicBlock getParent() {
        return parent;
    }

    public int getIndex() {
        return index;
    }

    public Context getContext() {
        return parent.getContext();
    }

    public SpeculatedValue getPointer() {
        return pointer;
    }

    public SpeculatedValue getSource() {
        return source;
    }

    public long getSize() {
        return size;
    }

    public boolean isSizeKnown() {
        return size != UNKNOWN_SIZE;
    }

    public SpeculatedValue getResult() {
        return result;
    }

    public void setResult(SpeculatedValue r) {
        result = r;
    }

    public List<ValueRange> getReadValues() {
        return readValues;
    }

    public Instruction addReadValue(long start, long stop, SpeculatedValue v) {
        readValues.add(new ValueRange(start, stop, v));
        return this;
    }

    public boolean isAnalysed() {
        return analysed;
    }

    // the speculative engine never reached this instruction
    public Instruction unanalysed() {
        analysed = false;
        result = SpeculatedValue.unknown();
        return this;
    }

    public boolean isVolatile() {
        return isVolatile;
    }

    public Instruction setVolatile(boolean v) {
        isVolatile = v;
        return this;
    }

    public boolean isOrdered() {
        return ordered;
    }

    public Instruction setOrdered(boolean o) {
        ordered = o;
        return this;
    }

    public boolean isSimpleAtomic() {
        return simpleAtomic;
    }

    public Instruction setSimpleAtomic(boolean s) {
        simpleAtomic = s;
        return this;
    }

    public boolean isResolved() {
        return resolved;
    }

    public Instruction setResolved(boolean r) {
        resolved = r;
        return this;
    }

    public FunctionContext getCallee() {
        return callee;
    }

    public boolean isCalleeKnown() {
        return calleeKnown;
    }

    public boolean isYieldPoint() {
        return yieldPoint;
    }

    public Instruction setYieldPoint(boolean y) {
        yieldPoint = y;
        return this;
    }

    public boolean isPessimisticLock() {
        return pessimisticLock;
    }

    public Instruction setPessimisticLock(boolean p) {
        pessimisticLock = p;
        return this;
    }

    // null when the call does not declare which objects it may change
    public List<MemoryObject> getEffectDomain() {
        return effectDomain;
    }

    public Instruction setEffectDomain(List<MemoryObject> objects) {
        effectDomain = objects;
        return this;
    }

    // null when the call may reference anything
    public List<MemoryObject> getReferencedObjects() {
        return referencedObjects;
    }

    public Instruction setReferencedObjects(List<MemoryObject> objects) {
        referencedObjects = objects;
        return this;
    }

    public MemoryObject getAllocation() {
        return allocation;
    }

    public CheckRequirement getCheck() {
        return check;
    }

    public void setCheck(CheckRequirement c) {
        check = c;
    }

    public RuntimeCheckKind getRuntimeCheck() {
        return runtimeCheck;
    }

    public Instruction setRuntimeCheck(RuntimeCheckKind k) {
        runtimeCheck = k;
        return this;
    }

    public boolean isUnusedWriter() {
        return unusedWriter;
    }

    public void setUnusedWriter(boolean u) {
        unusedWriter = u;
    }

    public boolean isCall() {
        return opcode == Opcode.CALL;
    }

    public boolean isCopy() {
        return opcode == Opcode.MEMCPY || opcode == Opcode.VACOPY || opcode == Opcode.REALLOC;
    }

    public boolean isAtomic() {
        return opcode == Opcode.ATOMIC_RMW || opcode == Opcode.CMPXCHG;
    }

    public boolean readsMemoryDirectly() {
        switch (opcode) {
        case LOAD:
        case ATOMIC_RMW:
        case CMPXCHG:
        case MEMCPY:
        case VACOPY:
        case REALLOC:
            return true;
        default:
            return false;
        }
    }

    // where a copy instruction writes
    public SpeculatedValue getCopyDest() {
        return pointer;
    }

    public boolean isTerminator() {
        return opcode.isTerminator();
    }

    public int getNumber() {
        return number;
    }

    public void setNumber(int number) {
        this.number = number;
    }

    @Override
    public String toString() {
        String where = parent == null ? "<detached>" : parent.getContext().getName() + "/" + parent.getName();
        return where + ":" + name + " (" + opcode.name().toLowerCase() + ")";
    }

}
