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

import java.io.*;

public class Logger {

    private static final int PROGRESS_LIMIT = 1000;

    private static PrintStream out;
    private static PrintStream outFile;
    private static PrintStream err;
    private static boolean debug;
    private static int progressCount;

    static {
        try {
            out = new PrintStream(System.out, true, "UTF-8");
            err = new PrintStream(System.err, true, "UTF-8");
        }
        catch (UnsupportedEncodingException uee) {
            out = System.out;
            err = System.err;
        }
    }

    private Logger() { }

    // mirrors everything printed through println to the given file (null to stop)
    public synchronized static void setLogFile(String filename) {
        if (outFile != null) {
            outFile.close();
            outFile = null;
        }
        if (filename != null) {
            try {
                outFile = new PrintStream(new FileOutputStream(new File(filename)), true, "UTF-8");
            }
            catch (IOException ioe) {
                throw new RuntimeException(ioe);
            }
        }
    }

    public static void setDebug(boolean d) {
        debug = d;
    }

    public static boolean isDebug() {
        return debug;
    }

    public static void debug(String s) {
        if (debug) {
            println(s, ANSICode.FG_CYAN);
        }
    }

	public static void println(String s) {
		println(s, ANSICode.FG_DEFAULT, ANSICode.BG_DEFAULT);
	}

	public static void println(String s, ANSICode fgcolour) {
	    println(s, fgcolour, ANSICode.BG_DEFAULT);
	}

	public synchronized static void println(String s, ANSICode fgcolour, ANSICode bgcolour) {
	    out.println(fgcolour.paint(s, bgcolour));
	    if (outFile != null) {
	        outFile.println(s);
	    }
	}

    public static void errprintln(String s) {
        errprintln(s, ANSICode.FG_RED, ANSICode.BG_DEFAULT);
    }

	public synchronized static void errprintln(String s, ANSICode fgcolour, ANSICode bgcolour) {
	    err.println(fgcolour.paint(s, bgcolour));
	    if (outFile != null) {
	        outFile.println(s);
	    }
	}

    // prints a dot every PROGRESS_LIMIT calls, used by the long-running walks
    public synchronized static void progress() {
        progressCount++;
        if (progressCount == PROGRESS_LIMIT) {
            err.print(".");
            err.flush();
            progressCount = 0;
        }
    }

}
