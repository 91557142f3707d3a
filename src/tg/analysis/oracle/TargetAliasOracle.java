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

import java.util.List;

import tg.ir.*;

/**
 * Answers alias queries from the speculated pointer targets alone: pointers
 * into different objects never alias, pointers the engine knows nothing
 * about may alias anything.
 */
public class TargetAliasOracle implements AliasOracle {

    public AliasResult alias(SpeculatedValue p1, long size1, SpeculatedValue p2, long size2) {
        if (!p1.isPointer() || !p2.isPointer()) {
            return AliasResult.MAY_ALIAS;
        }
        PointerTarget u1 = p1.getUniqueTarget();
        PointerTarget u2 = p2.getUniqueTarget();
        if (u1 != null && u2 != null && u1.equals(u2) && !u1.getObject().isNull()) {
            return AliasResult.MUST_ALIAS;
        }
        boolean overlap = false;
        for (PointerTarget t1 : p1.getTargets()) {
            for (PointerTarget t2 : p2.getTargets()) {
                if (overlaps(t1, size1, t2, size2)) {
                    overlap = true;
                }
            }
        }
        if (!overlap) {
            return AliasResult.NO_ALIAS;
        }
        return u1 != null && u2 != null ? AliasResult.PARTIAL_ALIAS : AliasResult.MAY_ALIAS;
    }

    static boolean overlaps(PointerTarget t1, long size1, PointerTarget t2, long size2) {
        if (t1.getObject() != t2.getObject() || t1.getObject().isNull()) {
            return false;
        }
        boolean firstBelow = size1 != Instruction.UNKNOWN_SIZE && t1.getOffset() + size1 <= t2.getOffset();
        boolean secondBelow = size2 != Instruction.UNKNOWN_SIZE && t2.getOffset() + size2 <= t1.getOffset();
        return !firstBelow && !secondBelow;
    }

    public boolean callMayReference(Instruction call, SpeculatedValue ptr, long size) {
        List<MemoryObject> refs = call.getReferencedObjects();
        if (refs == null || !ptr.isPointer()) {
            return true;
        }
        for (PointerTarget t : ptr.getTargets()) {
            if (refs.contains(t.getObject())) {
                return true;
            }
        }
        return false;
    }

}
