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

import java.io.PrintStream;
import java.util.*;

import gnu.trove.map.hash.TObjectIntHashMap;
import soot.toolkits.scalar.Pair;
import tg.ir.*;

public class Info {

	public static List<Context> allContexts(Context root) {
		List<Context> found = new ArrayList<Context>();
		collect(root, found, new HashSet<Context>());
		return found;
	}

	private static void collect(Context c, List<Context> found, Set<Context> seen) {
		if (!seen.add(c)) {
			return;
		}
		found.add(c);
		for (Context child : c.getChildren()) {
			collect(child, found, seen);
		}
	}

	public static int countContexts(Context root) {
		return allContexts(root).size();
	}

	public static int countBlocks(Context root) {
		int count=0;
		for (Context c : allContexts(root)) {
			count += c.getBlocks().size();
		}
		return count;
	}

	public static int countInstructions(Context root) {
		int count=0;
		for (Context c : allContexts(root)) {
			for (BasicBlock b : c.getBlocks()) {
				count += b.getInstructions().size();
			}
		}
		return count;
	}

	// how many memory-reading instructions ended up with each requirement
	public static TObjectIntHashMap<CheckRequirement> countByRequirement(Context root) {
		TObjectIntHashMap<CheckRequirement> counts = new TObjectIntHashMap<CheckRequirement>();
		for (Context c : allContexts(root)) {
			for (BasicBlock b : c.getBlocks()) {
				for (Instruction i : b.getInstructions()) {
					if (i.readsMemoryDirectly()) {
						counts.adjustOrPutValue(i.getCheck(), 1, 1);
					}
				}
			}
		}
		return counts;
	}

	public static int countUnusedWriters(Context root) {
		int count=0;
		for (Context c : allContexts(root)) {
			for (BasicBlock b : c.getBlocks()) {
				for (Instruction i : b.getInstructions()) {
					if (i.isUnusedWriter()) {
						count++;
					}
				}
			}
		}
		return count;
	}

	public static Pair<Integer,Context> maxInstructionsPerContext(Context root) {
		int max=0;
		Context maxContext = null;
		for (Context c : allContexts(root)) {
			int count=0;
			for (BasicBlock b : c.getBlocks()) {
				count += b.getInstructions().size();
			}
			if (count > max) {
				max = count;
				maxContext = c;
			}
		}
		return new Pair<Integer,Context>(max, maxContext);
	}

    public static void outputMemoryStatistics(PrintStream results) {
        Logger.println("Memory statistics:");
        Runtime r = Runtime.getRuntime();
        long totalMem = r.totalMemory();
        long freeMem = r.freeMemory();
        long usedMem = totalMem-freeMem;
        long maxMem = r.maxMemory();
        String totalMemStr = String.format("%1$.2fMB", bytesToMegabytes(totalMem));
        String freeMemStr = String.format("%1$.2fMB", bytesToMegabytes(freeMem));
        String usedMemStr = String.format("%1$.2fMB", bytesToMegabytes(usedMem));
        String maxMemStr = String.format("%1$.2fMB", bytesToMegabytes(maxMem));
        Logger.println("Total memory: " + totalMem + " (" + totalMemStr + ")");
        Logger.println("Used memory: " + usedMem + " (" + usedMemStr + ")");
        Logger.println("Max memory: " + maxMem + " (" + maxMemStr + ")");
        if (results != null) {
            results.println(totalMemStr + "," + freeMemStr + "," + usedMemStr + "," + maxMemStr);
        }
    }

    private static double bytesToMegabytes(long bytes) {
        return (bytes/1024.0)/1024.0;
    }

}
