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

package tg.analysis.store;

import java.util.*;

import tg.ir.FunctionContext;
import tg.ir.MemoryObject;

/**
 * Trusted bytes of the stack objects allocated by one active function.
 */
public class Frame {

    final FunctionContext owner;
    final Map<MemoryObject,ByteRangeSet> objects;

    Frame(FunctionContext f) {
        owner = f;
        objects = new HashMap<MemoryObject,ByteRangeSet>();
    }

    Frame(Frame other) {
        owner = other.owner;
        objects = copyOf(other.objects);
    }

    static Map<MemoryObject,ByteRangeSet> copyOf(Map<MemoryObject,ByteRangeSet> m) {
        Map<MemoryObject,ByteRangeSet> copy = new HashMap<MemoryObject,ByteRangeSet>();
        for (Map.Entry<MemoryObject,ByteRangeSet> e : m.entrySet()) {
            copy.put(e.getKey(), e.getValue().readableCopy());
        }
        return copy;
    }

    public FunctionContext getOwner() {
        return owner;
    }

    public Map<MemoryObject,ByteRangeSet> getObjects() {
        return Collections.unmodifiableMap(objects);
    }

}
