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

package tg.analysis;

import java.util.*;

import soot.PhaseOptions;

/**
 * Options of one analysis run, written as space-separated name:value pairs
 * on top of {@link #DEFAULT_OPTIONS}. String options use "null" for unset.
 */
public class AnalysisOptions {

    public static final String DECLARED_OPTIONS = "enabled debug single-threaded omit-checks tentative-loads dse output-dot dot-file log-file stats";
    public static final String DEFAULT_OPTIONS = "enabled:true debug:false single-threaded:false omit-checks:false tentative-loads:true dse:true output-dot:false dot-file:contexts.dot log-file:null stats:false";

    final Map<String,String> options;

    AnalysisOptions(Map<String,String> o) {
        options = o;
    }

    public static AnalysisOptions defaults() {
        return parse("");
    }

    public static AnalysisOptions parse(String optionString) {
        Map<String,String> o = new LinkedHashMap<String,String>();
        addPairs(o, DEFAULT_OPTIONS);
        addPairs(o, optionString);
        return new AnalysisOptions(o);
    }

    public static AnalysisOptions fromMap(Map<String,String> overrides) {
        Map<String,String> o = new LinkedHashMap<String,String>();
        addPairs(o, DEFAULT_OPTIONS);
        for (Map.Entry<String,String> e : overrides.entrySet()) {
            put(o, e.getKey(), e.getValue());
        }
        return new AnalysisOptions(o);
    }

    static void addPairs(Map<String,String> o, String optionString) {
        for (String pair : optionString.trim().split("\\s+")) {
            if (pair.isEmpty()) {
                continue;
            }
            int colon = pair.indexOf(':');
            if (colon <= 0) {
                throw new IllegalArgumentException("option " + pair + " is not of the form name:value");
            }
            put(o, pair.substring(0, colon), pair.substring(colon + 1));
        }
    }

    static void put(Map<String,String> o, String name, String value) {
        if (!Arrays.asList(DECLARED_OPTIONS.split(" ")).contains(name)) {
            throw new IllegalArgumentException("unknown option " + name);
        }
        o.put(name, value);
    }

    public boolean isEnabled() {
        return PhaseOptions.getBoolean(options, "enabled");
    }

    public boolean isDebug() {
        return PhaseOptions.getBoolean(options, "debug");
    }

    // the program never runs a second thread, so nothing can interfere
    public boolean isSingleThreaded() {
        return PhaseOptions.getBoolean(options, "single-threaded");
    }

    // runtime checks are not going to be emitted at all
    public boolean isOmitChecks() {
        return PhaseOptions.getBoolean(options, "omit-checks");
    }

    public boolean isTentativeLoads() {
        return PhaseOptions.getBoolean(options, "tentative-loads");
    }

    public boolean isDeadStores() {
        return PhaseOptions.getBoolean(options, "dse");
    }

    public boolean isOutputDot() {
        return PhaseOptions.getBoolean(options, "output-dot");
    }

    public boolean isStats() {
        return PhaseOptions.getBoolean(options, "stats");
    }

    public String getDotFile() {
        return getString("dot-file");
    }

    public String getLogFile() {
        return getString("log-file");
    }

    String getString(String name) {
        String v = PhaseOptions.getString(options, name);
        return v == null || v.isEmpty() || v.equals("null") ? null : v;
    }

    public Map<String,String> asMap() {
        return Collections.unmodifiableMap(options);
    }

    @Override
    public String toString() {
        return options.toString();
    }

}
