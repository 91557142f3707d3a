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
 * A known pointer: base object plus a constant byte offset.
 */
public final class PointerTarget {

    final MemoryObject object;
    final long offset;

    public PointerTarget(MemoryObject object, long offset) {
        if (object == null) {
            throw new IllegalArgumentException("pointer target without an object");
        }
        this.object = object;
        this.offset = offset;
    }

    public MemoryObject getObject() {
        return object;
    }

    public long getOffset() {
        return offset;
    }

    public PointerTarget offsetBy(long delta) {
        return delta == 0 ? this : new PointerTarget(object, offset + delta);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof PointerTarget)) {
            return false;
        }
        PointerTarget other = (PointerTarget)o;
        return object == other.object && offset == other.offset;
    }

    @Override
    public int hashCode() {
        return System.identityHashCode(object) * 31 + (int)(offset ^ (offset >>> 32));
    }

    @Override
    public String toString() {
        return object + "+" + offset;
    }

}
