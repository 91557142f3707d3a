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

/**
 * A fact assumed on entry to a block and re-validated at runtime. Since the
 * runtime check guarantees the fact, the checked bytes can be trusted again
 * from that point on.
 */
public class PathCondition {

    public enum Kind {
        // memory at a location holds a given value
        INTMEM,
        // memory at a location holds a given string
        STRING,
        // a whole function is run as a check
        FUNC
    }

    final Kind kind;
    final BasicBlock block;
    final int stackDepth;
    final SpeculatedValue location;
    final long length;
    final FunctionContext function;

    PathCondition(Kind k, BasicBlock b, int depth, SpeculatedValue loc, long len, FunctionContext f) {
        kind = k;
        block = b;
        stackDepth = depth;
        location = loc;
        length = len;
        function = f;
    }

    public static PathCondition intmem(BasicBlock block, int stackDepth, SpeculatedValue location, long size) {
        return new PathCondition(Kind.INTMEM, block, stackDepth, location, size, null);
    }

    // length counts the terminator byte
    public static PathCondition string(BasicBlock block, int stackDepth, SpeculatedValue location, long length) {
        return new PathCondition(Kind.STRING, block, stackDepth, location, length, null);
    }

    public static PathCondition func(BasicBlock block, int stackDepth, FunctionContext checker) {
        return new PathCondition(Kind.FUNC, block, stackDepth, SpeculatedValue.unknown(), 0, checker);
    }

    public Kind getKind() {
        return kind;
    }

    public BasicBlock getBlock() {
        return block;
    }

    public int getStackDepth() {
        return stackDepth;
    }

    public SpeculatedValue getLocation() {
        return location;
    }

    public long getLength() {
        return length;
    }

    public FunctionContext getFunction() {
        return function;
    }

    // whether this condition is checked on entry to b within a function analysed at the given depth
    public boolean appliesTo(BasicBlock b, int targetStackDepth) {
        if (block != b) {
            return false;
        }
        return stackDepth == FunctionContext.ANY_STACK_DEPTH || stackDepth == targetStackDepth;
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + " condition at " + block;
    }

}
