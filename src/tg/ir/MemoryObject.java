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

import soot.util.Numberable;

/**
 * An allocation the speculative engine can point into: a stack slot, a heap
 * block, a global or a file descriptor. Two handles denote the same object
 * only if they are the same Java object.
 */
public class MemoryObject implements Numberable {

    public enum Kind { NULL, STACK, HEAP, GLOBAL, FD }

    public static final long UNKNOWN_SIZE = -1;

    public static final MemoryObject NULL = new MemoryObject(Kind.NULL, "null", 0, false, null);

    final Kind kind;
    final String name;
    final long storeSize;
    final boolean constant;
    final FunctionContext allocatingFunction;

    int number;

    MemoryObject(Kind k, String n, long size, boolean c, FunctionContext f) {
        kind = k;
        name = n;
        storeSize = size;
        constant = c;
        allocatingFunction = f;
    }

    // stack objects belong to the frame of the function that allocates them
    public static MemoryObject stack(String name, long size, FunctionContext allocatingFunction) {
        if (allocatingFunction == null) {
            throw new IllegalArgumentException("stack object " + name + " needs an allocating function");
        }
        return new MemoryObject(Kind.STACK, name, size, false, allocatingFunction);
    }

    public static MemoryObject heap(String name, long size) {
        return new MemoryObject(Kind.HEAP, name, size, false, null);
    }

    public static MemoryObject global(String name, long size, boolean constant) {
        return new MemoryObject(Kind.GLOBAL, name, size, constant, null);
    }

    public static MemoryObject fd(String name) {
        return new MemoryObject(Kind.FD, name, UNKNOWN_SIZE, false, null);
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    public long getStoreSize() {
        return storeSize;
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    public boolean isStack() {
        return kind == Kind.STACK;
    }

    public boolean isHeap() {
        return kind == Kind.HEAP;
    }

    public boolean isFd() {
        return kind == Kind.FD;
    }

    public boolean isConstantGlobal() {
        return kind == Kind.GLOBAL && constant;
    }

    // null and constant objects can never be changed by another thread
    public boolean isNullOrConstant() {
        return isNull() || isConstantGlobal();
    }

    public FunctionContext getAllocatingFunction() {
        return allocatingFunction;
    }

    public int getNumber() {
        return number;
    }

    public void setNumber(int number) {
        this.number = number;
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + ":" + name;
    }

}
