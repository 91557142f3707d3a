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

import gnu.trove.list.array.TLongArrayList;

/**
 * Set of half-open byte intervals [start,stop), kept sorted, disjoint and
 * coalesced (no two intervals touch). Lookups are binary searches over the
 * parallel start and stop lists.
 */
public class ByteRangeSet {

    final TLongArrayList starts;
    final TLongArrayList stops;

    public ByteRangeSet() {
        starts = new TLongArrayList();
        stops = new TLongArrayList();
    }

    ByteRangeSet(ByteRangeSet other) {
        starts = new TLongArrayList(other.starts);
        stops = new TLongArrayList(other.stops);
    }

    public ByteRangeSet readableCopy() {
        return new ByteRangeSet(this);
    }

    public boolean isEmpty() {
        return starts.isEmpty();
    }

    // number of intervals
    public int size() {
        return starts.size();
    }

    public long getStart(int i) {
        return starts.get(i);
    }

    public long getStop(int i) {
        return stops.get(i);
    }

    public void clear() {
        starts.clear();
        stops.clear();
    }

    /**
     * Adds [start,stop), merging with every interval it overlaps or touches.
     */
    public void insert(long start, long stop) {
        if (start >= stop) {
            return;
        }
        // first interval whose stop reaches start
        int bs = stops.binarySearch(start);
        int first = bs >= 0 ? bs : -bs - 1;
        // first interval starting strictly after stop
        bs = starts.binarySearch(stop);
        int end = bs >= 0 ? bs + 1 : -bs - 1;

        long newStart = start;
        long newStop = stop;
        if (first < end) {
            newStart = Math.min(start, starts.get(first));
            newStop = Math.max(stop, stops.get(end - 1));
            starts.remove(first, end - first);
            stops.remove(first, end - first);
        }
        starts.insert(first, newStart);
        stops.insert(first, newStop);
    }

    public void addAll(ByteRangeSet other) {
        for (int i = 0; i < other.size(); i++) {
            insert(other.getStart(i), other.getStop(i));
        }
    }

    // whether every byte of [start,stop) is in the set
    public boolean covers(long start, long stop) {
        if (start >= stop) {
            return true;
        }
        int i = indexOfIntervalEndingAfter(start);
        return i < starts.size() && starts.get(i) <= start && stops.get(i) >= stop;
    }

    public boolean contains(long offset) {
        return covers(offset, offset + 1);
    }

    int indexOfIntervalEndingAfter(long offset) {
        int bs = stops.binarySearch(offset);
        return bs >= 0 ? bs + 1 : -bs - 1;
    }

    public ByteRangeSet intersect(ByteRangeSet other) {
        ByteRangeSet result = new ByteRangeSet();
        int i = 0;
        int j = 0;
        while (i < size() && j < other.size()) {
            long lo = Math.max(getStart(i), other.getStart(j));
            long hi = Math.min(getStop(i), other.getStop(j));
            if (lo < hi) {
                result.insert(lo, hi);
            }
            if (getStop(i) < other.getStop(j)) {
                i++;
            }
            else {
                j++;
            }
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof ByteRangeSet)) {
            return false;
        }
        ByteRangeSet other = (ByteRangeSet)o;
        return starts.equals(other.starts) && stops.equals(other.stops);
    }

    @Override
    public int hashCode() {
        return starts.hashCode() * 31 + stops.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < size(); i++) {
            if (i > 0) {
                sb.append(' ');
            }
            sb.append('[').append(getStart(i)).append(',').append(getStop(i)).append(')');
        }
        return sb.append('}').toString();
    }

}
