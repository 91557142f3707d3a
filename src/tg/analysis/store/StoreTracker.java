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

import gnu.trove.set.hash.TIntHashSet;
import tg.util.InvariantViolationException;

/**
 * Counts snapshot allocations and releases for one analysis run, so leaks
 * and double releases are caught.
 */
public class StoreTracker {

    int nextId = 1;
    long allocated;
    long released;
    int peakLive;
    final TIntHashSet live = new TIntHashSet();

    int register() {
        int id = nextId++;
        live.add(id);
        allocated++;
        if (live.size() > peakLive) {
            peakLive = live.size();
        }
        return id;
    }

    void release(int id) {
        if (!live.remove(id)) {
            throw new InvariantViolationException("snapshot " + id + " released twice");
        }
        released++;
    }

    public int getLiveCount() {
        return live.size();
    }

    public long getAllocatedCount() {
        return allocated;
    }

    public long getReleasedCount() {
        return released;
    }

    public int getPeakLiveCount() {
        return peakLive;
    }

    @Override
    public String toString() {
        return "snapshots: " + allocated + " allocated, " + released + " released, " + live.size() + " live, peak " + peakLive;
    }

}
