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
import tg.util.InvariantViolationException;

/**
 * Snapshot of which bytes are still trusted at one program point: bytes
 * this thread wrote or read itself since the last point where other
 * threads might have interfered.
 *
 * An object listed in the snapshot has exactly its listed ranges trusted.
 * An unlisted object is wholly untrusted if {@link #isAllOthersClobbered()}
 * holds, and wholly trusted otherwise.
 *
 * Snapshots are reference counted and copied on write: only the holder of
 * the single reference may change one.
 */
public class LocalStore {

    final StoreTracker tracker;
    final int id;

    int refCount = 1;
    boolean freed;
    boolean allOthersClobbered;

    final Map<MemoryObject,ByteRangeSet> heap;
    final List<Frame> frames;

    public LocalStore(StoreTracker t) {
        tracker = t;
        id = t.register();
        heap = new HashMap<MemoryObject,ByteRangeSet>();
        frames = new ArrayList<Frame>();
    }

    LocalStore(LocalStore other) {
        tracker = other.tracker;
        id = tracker.register();
        allOthersClobbered = other.allOthersClobbered;
        heap = Frame.copyOf(other.heap);
        frames = new ArrayList<Frame>();
        for (Frame f : other.frames) {
            frames.add(new Frame(f));
        }
    }

    public int getId() {
        return id;
    }

    public int getRefCount() {
        return refCount;
    }

    public boolean isShared() {
        return refCount > 1;
    }

    public boolean isFreed() {
        return freed;
    }

    public void addReference() {
        checkLive();
        refCount++;
    }

    /**
     * Gives up one reference. Returns true if that was the last one and the
     * snapshot is now released.
     */
    public boolean dropReference() {
        checkLive();
        refCount--;
        if (refCount == 0) {
            freed = true;
            tracker.release(id);
            return true;
        }
        return false;
    }

    void checkLive() {
        if (freed || refCount <= 0) {
            throw new InvariantViolationException("snapshot " + id + " used after release");
        }
    }

    void checkWritable() {
        checkLive();
        if (refCount != 1) {
            throw new InvariantViolationException("snapshot " + id + " changed while shared (" + refCount + " references)");
        }
    }

    /**
     * Returns a snapshot the caller may change. This one if the caller holds
     * the only reference; otherwise the caller's reference moves to a
     * private copy.
     */
    public LocalStore getWritableFrameList() {
        checkLive();
        if (refCount == 1) {
            return this;
        }
        refCount--;
        return new LocalStore(this);
    }

    /**
     * Returns a writable snapshot with the same frames but no listed objects,
     * consuming the caller's reference to this one.
     */
    public LocalStore getEmptyMap() {
        checkLive();
        LocalStore empty = new LocalStore(tracker);
        for (Frame f : frames) {
            empty.frames.add(new Frame(f.owner));
        }
        dropReference();
        return empty;
    }

    public boolean isAllOthersClobbered() {
        return allOthersClobbered;
    }

    public void setAllOthersClobbered(boolean c) {
        checkWritable();
        allOthersClobbered = c;
    }

    Map<MemoryObject,ByteRangeSet> mapFor(MemoryObject obj) {
        if (obj.isStack()) {
            for (int i = frames.size() - 1; i >= 0; i--) {
                Frame f = frames.get(i);
                if (f.owner == obj.getAllocatingFunction()) {
                    return f.objects;
                }
            }
        }
        // objects whose frame is not active fall back to the shared map
        return heap;
    }

    // listed ranges of obj, or null if obj is not listed
    public ByteRangeSet getReadableRangesFor(MemoryObject obj) {
        checkLive();
        return mapFor(obj).get(obj);
    }

    public ByteRangeSet getOrCreateRangesFor(MemoryObject obj) {
        checkWritable();
        Map<MemoryObject,ByteRangeSet> m = mapFor(obj);
        ByteRangeSet r = m.get(obj);
        if (r == null) {
            r = new ByteRangeSet();
            m.put(obj, r);
        }
        return r;
    }

    // lists obj with nothing trusted
    public void clearRangesFor(MemoryObject obj) {
        getOrCreateRangesFor(obj).clear();
    }

    // whether every byte of [start,stop) of obj is trusted
    public boolean isTrusted(MemoryObject obj, long start, long stop) {
        ByteRangeSet r = getReadableRangesFor(obj);
        if (r == null) {
            return !allOthersClobbered;
        }
        return r.covers(start, stop);
    }

    public void pushStackFrame(FunctionContext owner) {
        checkWritable();
        frames.add(new Frame(owner));
    }

    public void popStackFrame(FunctionContext expectedOwner) {
        checkWritable();
        if (frames.isEmpty()) {
            throw new InvariantViolationException("popping frame of " + expectedOwner.getName() + " from an empty stack");
        }
        Frame top = frames.get(frames.size() - 1);
        if (top.owner != expectedOwner) {
            throw new InvariantViolationException("popping frame of " + expectedOwner.getName() + " but top frame belongs to " + top.owner.getName());
        }
        frames.remove(frames.size() - 1);
    }

    public int getStackDepth() {
        return frames.size();
    }

    public List<Frame> getFrames() {
        return Collections.unmodifiableList(frames);
    }

    public Map<MemoryObject,ByteRangeSet> getHeapObjects() {
        return Collections.unmodifiableMap(heap);
    }

    /**
     * Whether both snapshots trust exactly the same bytes. Listed-but-empty
     * and unlisted objects are the same thing when all others are clobbered.
     */
    public boolean sameContents(LocalStore other) {
        if (allOthersClobbered != other.allOthersClobbered || frames.size() != other.frames.size()) {
            return false;
        }
        if (!sameMaps(heap, other.heap)) {
            return false;
        }
        for (int i = 0; i < frames.size(); i++) {
            Frame a = frames.get(i);
            Frame b = other.frames.get(i);
            if (a.owner != b.owner || !sameMaps(a.objects, b.objects)) {
                return false;
            }
        }
        return true;
    }

    boolean sameMaps(Map<MemoryObject,ByteRangeSet> a, Map<MemoryObject,ByteRangeSet> b) {
        Set<MemoryObject> keys = new HashSet<MemoryObject>(a.keySet());
        keys.addAll(b.keySet());
        for (MemoryObject o : keys) {
            ByteRangeSet ra = a.get(o);
            ByteRangeSet rb = b.get(o);
            if (ra == null || rb == null) {
                ByteRangeSet listed = ra == null ? rb : ra;
                // unlisted means all or nothing depending on the clobber flag
                if (allOthersClobbered ? !listed.isEmpty() : !coversObject(listed, o)) {
                    return false;
                }
            }
            else if (!ra.equals(rb)) {
                return false;
            }
        }
        return true;
    }

    // an object of unknown size is never known to be wholly covered
    static boolean coversObject(ByteRangeSet listed, MemoryObject o) {
        if (o.getStoreSize() == MemoryObject.UNKNOWN_SIZE) {
            return false;
        }
        return listed.covers(0, o.getStoreSize());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("snapshot " + id + (allOthersClobbered ? " (others clobbered)" : "") + " heap " + heap);
        for (Frame f : frames) {
            sb.append(" | ").append(f.owner.getName()).append(' ').append(f.objects);
        }
        return sb.toString();
    }

}
