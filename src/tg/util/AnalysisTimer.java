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

package tg.util;

import java.util.concurrent.atomic.AtomicLong;

public class AnalysisTimer {

    static AtomicLong tentativeLoads = new AtomicLong(0);
    static AtomicLong deadStores = new AtomicLong(0);
    static AtomicLong counting = new AtomicLong(0);

    public static void addForTentativeLoads(long ms) {
        tentativeLoads.addAndGet(ms);
    }

    public static void addForDeadStores(long ms) {
        deadStores.addAndGet(ms);
    }

    public static void addForCounting(long ms) {
        counting.addAndGet(ms);
    }

    public static long getTotalTentativeLoads() {
        return tentativeLoads.get();
    }

    public static long getTotalDeadStores() {
        return deadStores.get();
    }

    public static long getTotalCounting() {
        return counting.get();
    }

    public static void reset() {
        tentativeLoads.set(0);
        deadStores.set(0);
        counting.set(0);
    }

}
