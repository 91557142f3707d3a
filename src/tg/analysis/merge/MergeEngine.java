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

package tg.analysis.merge;

import java.util.*;

import tg.analysis.store.*;
import tg.ir.FunctionContext;
import tg.ir.MemoryObject;
import tg.util.InvariantViolationException;

/**
 * Joins the snapshots arriving at a control-flow merge point. A byte is
 * trusted after the merge only if every incoming snapshot trusts it.
 *
 * Each input reference is consumed; the caller owns the single reference
 * to the result.
 */
public class MergeEngine {

    /**
     * Applied to each incoming snapshot before it is joined. Consumes the
     * reference it is given and returns an owned reference.
     */
    public interface IncomingFilter {
        LocalStore apply(LocalStore incoming);
    }

    final StoreTracker tracker;

    public MergeEngine(StoreTracker t) {
        tracker = t;
    }

    public LocalStore merge(List<LocalStore> incoming) {
        return merge(incoming, null);
    }

    // null if nothing arrived
    public LocalStore merge(List<LocalStore> incoming, IncomingFilter filter) {
        if (incoming == null || incoming.isEmpty()) {
            return null;
        }
        List<LocalStore> inputs = new ArrayList<LocalStore>(incoming.size());
        for (LocalStore s : incoming) {
            inputs.add(filter == null ? s : filter.apply(s));
        }
        if (inputs.size() == 1) {
            return inputs.get(0);
        }

        LocalStore first = inputs.get(0);
        List<Frame> frames = first.getFrames();
        for (LocalStore s : inputs) {
            checkSameFrames(frames, s.getFrames());
        }

        LocalStore result = new LocalStore(tracker);
        boolean clobbered = false;
        for (LocalStore s : inputs) {
            clobbered |= s.isAllOthersClobbered();
        }
        result.setAllOthersClobbered(clobbered);
        for (Frame f : frames) {
            result.pushStackFrame(f.getOwner());
        }

        Set<MemoryObject> objects = new LinkedHashSet<MemoryObject>();
        for (LocalStore s : inputs) {
            objects.addAll(s.getHeapObjects().keySet());
            for (Frame f : s.getFrames()) {
                objects.addAll(f.getObjects().keySet());
            }
        }
        for (MemoryObject o : objects) {
            ByteRangeSet trusted = intersectTrusted(o, inputs);
            // null: wholly trusted everywhere, which unlisted already means
            if (trusted == null) {
                continue;
            }
            if (trusted.isEmpty() && clobbered) {
                continue;
            }
            result.getOrCreateRangesFor(o).addAll(trusted);
        }

        for (LocalStore s : inputs) {
            s.dropReference();
        }
        return result;
    }

    /**
     * Bytes of o trusted by every input, or null if every input trusts all
     * of o by leaving it unlisted.
     */
    ByteRangeSet intersectTrusted(MemoryObject o, List<LocalStore> inputs) {
        ByteRangeSet acc = null;
        for (LocalStore s : inputs) {
            ByteRangeSet r = s.getReadableRangesFor(o);
            if (r == null) {
                if (s.isAllOthersClobbered()) {
                    return new ByteRangeSet();
                }
                continue;
            }
            acc = acc == null ? r.readableCopy() : acc.intersect(r);
        }
        return acc;
    }

    void checkSameFrames(List<Frame> a, List<Frame> b) {
        if (a.size() != b.size()) {
            throw new InvariantViolationException("merging snapshots with stack depths " + a.size() + " and " + b.size());
        }
        for (int i = 0; i < a.size(); i++) {
            FunctionContext fa = a.get(i).getOwner();
            FunctionContext fb = b.get(i).getOwner();
            if (fa != fb) {
                throw new InvariantViolationException("merging snapshots whose frame " + i + " belongs to " + fa.getName() + " and " + fb.getName());
            }
        }
    }

}
