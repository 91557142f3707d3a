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

package tg.analysis.oracle;

import java.util.*;

import tg.ir.Instruction;
import tg.ir.MemoryObject;
import tg.ir.PointerTarget;
import tg.util.Logger;

/**
 * In-memory {@link AvailabilityRegistry}: objects are unavailable until
 * some instruction is adopted as their name.
 */
public class CommitRegistry implements AvailabilityRegistry {

    final Set<MemoryObject> unavailable = new HashSet<MemoryObject>();
    final Map<MemoryObject,Instruction> canonical = new HashMap<MemoryObject,Instruction>();
    final List<Forgotten> forgotten = new ArrayList<Forgotten>();

    public static class Forgotten {
        public final Instruction reader;
        public final PointerTarget target;
        public final long size;

        Forgotten(Instruction r, PointerTarget t, long s) {
            reader = r;
            target = t;
            size = s;
        }

        @Override
        public String toString() {
            return target + " (" + size + " bytes) read by " + reader;
        }
    }

    public void markUnavailable(MemoryObject obj) {
        unavailable.add(obj);
    }

    public boolean isUnavailable(MemoryObject obj) {
        return unavailable.contains(obj);
    }

    public void adoptCanonicalReference(MemoryObject obj, Instruction reference) {
        Logger.debug("Adopting " + reference + " as the name of " + obj);
        canonical.put(obj, reference);
        unavailable.remove(obj);
    }

    public Instruction getCanonicalReference(MemoryObject obj) {
        return canonical.get(obj);
    }

    public void forgetValue(Instruction reader, PointerTarget target, long size) {
        forgotten.add(new Forgotten(reader, target, size));
    }

    public List<Forgotten> getForgotten() {
        return Collections.unmodifiableList(forgotten);
    }

}
