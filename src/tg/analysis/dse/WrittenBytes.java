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

import java.util.BitSet;

/**
 * Per-path record of which bytes of the candidate write have been
 * overwritten since it happened. Copied at every path fork.
 */
public class WrittenBytes {

    final BitSet bits;
    final int size;

    public WrittenBytes(int size) {
        this.size = size;
        bits = new BitSet(size);
    }

    WrittenBytes(WrittenBytes other) {
        size = other.size;
        bits = (BitSet)other.bits.clone();
    }

    public WrittenBytes copy() {
        return new WrittenBytes(this);
    }

    // marks [from,to), clipped to the write
    public void set(long from, long to) {
        int lo = (int)Math.max(0, from);
        int hi = (int)Math.min(size, to);
        if (lo < hi) {
            bits.set(lo, hi);
        }
    }

    public boolean isComplete() {
        return bits.cardinality() == size;
    }

    // whether every byte written here is also written in other
    public boolean isSubsetOf(WrittenBytes other) {
        BitSet rest = (BitSet)bits.clone();
        rest.andNot(other.bits);
        return rest.isEmpty();
    }

    public int getSize() {
        return size;
    }

    @Override
    public String toString() {
        return bits + "/" + size;
    }

}
