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

/**
 * What the speculative engine believes a value to be. Pointers and file
 * descriptors may name several candidate targets when the engine could not
 * decide between them.
 */
public final class SpeculatedValue {

    public enum Kind { UNKNOWN, POINTER, FD, SCALAR }

    private static final SpeculatedValue UNKNOWN = new SpeculatedValue(Kind.UNKNOWN, Collections.<PointerTarget>emptyList());
    private static final SpeculatedValue SCALAR = new SpeculatedValue(Kind.SCALAR, Collections.<PointerTarget>emptyList());

    final Kind kind;
    final List<PointerTarget> targets;

    private SpeculatedValue(Kind k, List<PointerTarget> ts) {
        kind = k;
        targets = ts;
    }

    public static SpeculatedValue unknown() {
        return UNKNOWN;
    }

    // a known non-pointer value (integer, float, ...)
    public static SpeculatedValue scalar() {
        return SCALAR;
    }

    public static SpeculatedValue pointer(MemoryObject object, long offset) {
        return new SpeculatedValue(Kind.POINTER, Collections.singletonList(new PointerTarget(object, offset)));
    }

    public static SpeculatedValue pointers(List<PointerTarget> candidates) {
        if (candidates.isEmpty()) {
            return UNKNOWN;
        }
        return new SpeculatedValue(Kind.POINTER, Collections.unmodifiableList(new ArrayList<PointerTarget>(candidates)));
    }

    public static SpeculatedValue fd(MemoryObject descriptor) {
        if (!descriptor.isFd()) {
            throw new IllegalArgumentException(descriptor + " is not a file descriptor");
        }
        return new SpeculatedValue(Kind.FD, Collections.singletonList(new PointerTarget(descriptor, 0)));
    }

    public Kind getKind() {
        return kind;
    }

    public List<PointerTarget> getTargets() {
        return targets;
    }

    public boolean isWhollyUnknown() {
        return kind == Kind.UNKNOWN;
    }

    public boolean isPointer() {
        return kind == Kind.POINTER;
    }

    public boolean isFd() {
        return kind == Kind.FD;
    }

    // the single pointer target, or null when the value is not exactly one known pointer
    public PointerTarget getUniqueTarget() {
        if (kind != Kind.POINTER || targets.size() != 1) {
            return null;
        }
        return targets.get(0);
    }

    public SpeculatedValue offsetBy(long delta) {
        if (kind != Kind.POINTER || delta == 0) {
            return this;
        }
        List<PointerTarget> moved = new ArrayList<PointerTarget>(targets.size());
        for (PointerTarget t : targets) {
            moved.add(t.offsetBy(delta));
        }
        return new SpeculatedValue(Kind.POINTER, Collections.unmodifiableList(moved));
    }

    @Override
    public String toString() {
        switch (kind) {
        case UNKNOWN:
            return "?";
        case SCALAR:
            return "scalar";
        default:
            return kind.name().toLowerCase() + targets;
        }
    }

}
