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

package tg.analysis.tentative;

import java.util.List;

import tg.analysis.AnalysisRun;
import tg.analysis.oracle.AvailabilityRegistry;
import tg.analysis.store.ByteRangeSet;
import tg.analysis.store.LocalStore;
import tg.ir.*;
import tg.util.ANSICode;
import tg.util.Logger;

/**
 * Decides, per memory-reading instruction, whether the value it read during
 * specialisation must be re-validated at runtime, and applies the
 * instruction's effect to the block's snapshot.
 */
public class TentativeAccessClassifier {

    final AnalysisRun run;
    final AvailabilityRegistry registry;

    public TentativeAccessClassifier(AnalysisRun r) {
        run = r;
        registry = r.getRegistry();
    }

    /**
     * Classifies i against the snapshot in cur, then updates the snapshot.
     * In a loop's second pass an instruction already known to need a check
     * keeps that verdict.
     */
    public void analyse(Instruction i, BlockStore cur, boolean commitDisabled, boolean secondPass) {
        if (i.readsMemoryDirectly()) {
            CheckRequirement req = i.getCheck();
            boolean sticky = secondPass && req == CheckRequirement.MUST_CHECK;
            if (!sticky && req != CheckRequirement.NEVER_CHECK) {
                req = shouldCheckLoad(i, cur.get());
                i.setCheck(req);
            }
            if (req == CheckRequirement.MUST_CHECK) {
                i.getContext().setReadsTentativeData(true);
                squashUnavailableObjects(i);
            }
            else {
                replaceUnavailableObjects(i);
            }
        }
        else if (i.isCall()) {
            replaceUnavailableObjects(i);
        }
        else if (i.getCheck() == CheckRequirement.NEVER_CHECK) {
            return;
        }
        updateStore(i, cur, !commitDisabled);
    }

    public CheckRequirement shouldCheckLoad(Instruction i, LocalStore store) {
        if (run.getOptions().isSingleThreaded()) {
            return CheckRequirement.NEVER_CHECK;
        }
        // nothing useful was read, so there is nothing to check
        if (!i.isCopy() && i.getReadValues().isEmpty() && i.getResult().isWhollyUnknown()) {
            return CheckRequirement.NEVER_CHECK;
        }

        switch (i.getOpcode()) {
        case LOAD:
            if (i.isOrdered()) {
                return CheckRequirement.MUST_CHECK;
            }
            SpeculatedValue ptr = i.getPointer();
            if (!ptr.isPointer()) {
                return CheckRequirement.NEVER_CHECK;
            }
            CheckRequirement result = CheckRequirement.NEVER_CHECK;
            for (PointerTarget t : ptr.getTargets()) {
                result = CheckRequirement.mostSevere(result, shouldCheckLoadFrom(i, t, store));
                if (result == CheckRequirement.MUST_CHECK) {
                    break;
                }
            }
            return result;
        case ATOMIC_RMW:
        case CMPXCHG:
            return CheckRequirement.MUST_CHECK;
        default:
            // memcpy, va_copy, realloc
            return shouldCheckCopy(i, i.getSource(), i.getSize(), store);
        }
    }

    CheckRequirement shouldCheckLoadFrom(Instruction i, PointerTarget ptr, LocalStore store) {
        if (ptr.getObject().isNullOrConstant()) {
            return CheckRequirement.NEVER_CHECK;
        }
        List<ValueRange> values = i.getReadValues();
        if (!values.isEmpty()) {
            for (ValueRange r : values) {
                if (r.getValue().isWhollyUnknown()) {
                    continue;
                }
                if (shouldCheckRead(store, ptr.offsetBy(r.getStart()), r.getLength())) {
                    return CheckRequirement.MUST_CHECK;
                }
            }
            return CheckRequirement.NO_CHECK;
        }
        return shouldCheckRead(store, ptr, i.getSize()) ? CheckRequirement.MUST_CHECK : CheckRequirement.NO_CHECK;
    }

    CheckRequirement shouldCheckCopy(Instruction i, SpeculatedValue src, long len, LocalStore store) {
        PointerTarget ptr = src.getUniqueTarget();
        if (len == Instruction.UNKNOWN_SIZE || ptr == null) {
            return CheckRequirement.NEVER_CHECK;
        }
        if (len == 0) {
            return CheckRequirement.NEVER_CHECK;
        }
        // no values were transferred during specialisation
        if (i.getReadValues().isEmpty()) {
            return CheckRequirement.NEVER_CHECK;
        }
        for (ValueRange r : i.getReadValues()) {
            if (r.getValue().isWhollyUnknown()) {
                continue;
            }
            if (shouldCheckRead(store, ptr.offsetBy(r.getStart()), r.getLength())) {
                return CheckRequirement.MUST_CHECK;
            }
        }
        return CheckRequirement.NO_CHECK;
    }

    public boolean shouldCheckRead(LocalStore store, PointerTarget ptr, long size) {
        MemoryObject obj = ptr.getObject();
        if (obj.isNullOrConstant()) {
            return false;
        }
        ByteRangeSet ranges = store.getReadableRangesFor(obj);
        if (ranges == null) {
            return store.isAllOthersClobbered();
        }
        if (size == Instruction.UNKNOWN_SIZE) {
            return true;
        }
        return !ranges.covers(ptr.getOffset(), ptr.getOffset() + size);
    }

    public void updateStore(Instruction i, BlockStore cur, boolean contextEnabled) {
        switch (i.getOpcode()) {
        case ALLOCA:
        case MALLOC:
            markGoodBytes(cur, i.getPointer(), i.getSize(), contextEnabled);
            break;
        case LOAD:
            if ((i.isVolatile() || i.isOrdered()) && !i.isSimpleAtomic()) {
                clobberAll(cur, i);
            }
            else {
                markGoodBytes(cur, i.getPointer(), i.getSize(), contextEnabled);
            }
            break;
        case STORE:
            // outgoing communication only, so never a yield point
            markGoodBytes(cur, i.getPointer(), i.getSize(), contextEnabled);
            break;
        case ATOMIC_RMW:
        case CMPXCHG:
            // may create a synchronisation edge
            if (i.getCheck() == CheckRequirement.MUST_CHECK && !i.isSimpleAtomic()) {
                clobberAll(cur, i);
            }
            else {
                markGoodBytes(cur, i.getPointer(), i.getSize(), contextEnabled);
            }
            break;
        case FENCE:
            clobberAll(cur, i);
            break;
        case MEMSET:
        case READ_FILE:
            if (i.isSizeKnown()) {
                markGoodBytes(cur, i.getPointer(), i.getSize(), contextEnabled);
            }
            break;
        case MEMCPY:
        case VACOPY:
            walkCopy(cur, i, contextEnabled);
            break;
        case REALLOC:
            walkCopy(cur, i, contextEnabled);
            markGoodBytes(cur, i.getPointer(), i.getAllocation().getStoreSize(), contextEnabled);
            break;
        case CALL:
            walkCall(cur, i);
            break;
        default:
            break;
        }
    }

    void walkCopy(BlockStore cur, Instruction i, boolean contextEnabled) {
        if (!i.isSizeKnown()) {
            return;
        }
        markGoodBytes(cur, i.getCopyDest(), i.getSize(), contextEnabled);
        markGoodBytes(cur, i.getSource(), i.getSize(), contextEnabled);
    }

    void walkCall(BlockStore cur, Instruction i) {
        if (i.getCallee() != null) {
            return;
        }
        boolean unknownCallee = !i.isCalleeKnown() && !run.getOptions().isSingleThreaded();
        if (!unknownCallee && !i.isYieldPoint()) {
            return;
        }
        // pessimistic locks clobber at specialisation time, no runtime check needed
        if (i.isPessimisticLock()) {
            return;
        }
        List<MemoryObject> domain = i.getEffectDomain();
        if (domain != null) {
            LocalStore s = cur.writable();
            for (MemoryObject o : domain) {
                s.clearRangesFor(o);
            }
        }
        else {
            clobberAll(cur, i);
        }
    }

    public void clobberAll(BlockStore cur, Instruction at) {
        LocalStore s = cur.get().getEmptyMap();
        s.setAllOthersClobbered(true);
        cur.set(s);
        if (at.getOpcode() == Opcode.LOAD || at.isAtomic()) {
            Logger.println("Clobber all at " + at, ANSICode.FG_YELLOW);
        }
        else {
            Logger.debug("Clobber all at " + at);
        }
    }

    /**
     * Marks bytes [ptr, ptr+len) trusted. Validations in check-suppressed
     * contexts are never emitted, so they establish nothing.
     */
    public void markGoodBytes(BlockStore cur, SpeculatedValue ptr, long len, boolean contextEnabled) {
        if (!contextEnabled || len == Instruction.UNKNOWN_SIZE) {
            return;
        }
        PointerTarget t = ptr.getUniqueTarget();
        if (t == null || t.getObject().isNullOrConstant()) {
            return;
        }
        long start = t.getOffset();
        long stop = start + len;
        ByteRangeSet existing = cur.get().getReadableRangesFor(t.getObject());
        // unlisted objects are wholly trusted until everything is clobbered
        if (existing == null && !cur.get().isAllOthersClobbered()) {
            return;
        }
        if (existing != null && existing.covers(start, stop)) {
            return;
        }
        cur.writable().getOrCreateRangesFor(t.getObject()).insert(start, stop);
    }

    /**
     * A checked read may have produced a pointer or descriptor naming an
     * object that has no committed name. The check could not be
     * synthesised, so the value is forgotten instead.
     */
    void squashUnavailableObjects(Instruction i) {
        switch (i.getOpcode()) {
        case LOAD:
        case CMPXCHG:
        case ATOMIC_RMW:
            if (!i.getReadValues().isEmpty()) {
                for (ValueRange r : i.getReadValues()) {
                    if (squashUnavailableObject(i, r.getValue(), i.getPointer(), r.getStart(), r.getLength())) {
                        r.squash();
                    }
                }
            }
            else if (squashUnavailableObject(i, i.getResult(), i.getPointer(), 0, i.getSize())) {
                i.setResult(SpeculatedValue.unknown());
            }
            break;
        default:
            for (ValueRange r : i.getReadValues()) {
                if (squashUnavailableObject(i, r.getValue(), i.getSource(), r.getStart(), r.getLength())) {
                    r.squash();
                    // undo storing the value at the destination
                    forgetAt(i, i.getCopyDest(), r.getStart(), r.getLength());
                }
            }
            break;
        }
    }

    boolean squashUnavailableObject(Instruction i, SpeculatedValue v, SpeculatedValue readPtr, long readOffset, long readSize) {
        if (!isUnavailable(v)) {
            return false;
        }
        Logger.println("Squash " + v + " read by " + i);
        i.setCheck(CheckRequirement.NEVER_CHECK);
        forgetAt(i, readPtr, readOffset, readSize);
        return true;
    }

    // whether v names an object that currently has no committed name; stack objects always have one
    boolean isUnavailable(SpeculatedValue v) {
        if (!v.isPointer() && !v.isFd()) {
            return false;
        }
        for (PointerTarget t : v.getTargets()) {
            MemoryObject o = t.getObject();
            if (o.isStack() || o.isNull()) {
                continue;
            }
            if (registry.isUnavailable(o)) {
                return true;
            }
        }
        return false;
    }

    void forgetAt(Instruction i, SpeculatedValue ptr, long offset, long size) {
        for (PointerTarget t : ptr.getTargets()) {
            registry.forgetValue(i, t.offsetBy(offset), size);
        }
    }

    /**
     * A load or call in a certain block that produced a pointer to an
     * unavailable object becomes that object's committed name.
     */
    void replaceUnavailableObjects(Instruction i) {
        if (i.getOpcode() != Opcode.LOAD && !i.isCall()) {
            return;
        }
        if (!i.getParent().isCertain()) {
            return;
        }
        SpeculatedValue v = i.getResult();
        if (v.getTargets().size() != 1) {
            return;
        }
        MemoryObject o = v.getTargets().get(0).getObject();
        if (o.isStack() || o.isNull()) {
            return;
        }
        if ((v.isPointer() || v.isFd()) && registry.isUnavailable(o)) {
            Logger.println(i + " stepping up as new canonical reference for " + o);
            registry.adoptCanonicalReference(o, i);
        }
    }

    // forgets a disabled callee's speculated return value when it names unavailable objects
    public void squashReturnValue(Instruction call) {
        if (isUnavailable(call.getResult())) {
            Logger.println("Squash return value " + call.getResult() + " of " + call);
            call.setResult(SpeculatedValue.unknown());
        }
    }

}
