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

import static org.junit.jupiter.api.Assertions.*;

import java.util.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

public class AnalysisOptionsTest {

    @Test
    public void testDefaults() {
        AnalysisOptions o = AnalysisOptions.defaults();
        assertTrue(o.isEnabled());
        assertFalse(o.isDebug());
        assertFalse(o.isSingleThreaded());
        assertFalse(o.isOmitChecks());
        assertTrue(o.isTentativeLoads());
        assertTrue(o.isDeadStores());
        assertFalse(o.isOutputDot());
        assertFalse(o.isStats());
        assertEquals("contexts.dot", o.getDotFile());
        assertNull(o.getLogFile());
    }

    @Test
    public void testParseOverridesDefaults() {
        AnalysisOptions o = AnalysisOptions.parse("single-threaded:true  dse:false log-file:run.log");
        assertTrue(o.isSingleThreaded());
        assertFalse(o.isDeadStores());
        assertEquals("run.log", o.getLogFile());
        assertTrue(o.isTentativeLoads());
        assertEquals(10, o.asMap().size());
    }

    @Test
    public void testFromMap() {
        Map<String,String> m = new HashMap<String,String>();
        m.put("omit-checks", "true");
        assertTrue(AnalysisOptions.fromMap(m).isOmitChecks());
    }

    @Test
    public void testUnknownOptionRejected() {
        assertThrows(IllegalArgumentException.class, new Executable() {
            public void execute() {
                AnalysisOptions.parse("threads:4");
            }
        });
    }

    @Test
    public void testMalformedOptionRejected() {
        assertThrows(IllegalArgumentException.class, new Executable() {
            public void execute() {
                AnalysisOptions.parse("debug");
            }
        });
    }

}
