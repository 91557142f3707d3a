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

package tg.dot;

import java.util.*;

import soot.util.dot.*;
import tg.ir.*;

/**
 * Draws the analysed context tree, one node per context labelled with the
 * number of instructions checked there and below it.
 */
public class ContextTreeToDot {

	public DotGraph drawTree(Context root) {
		DotGraph canvas = new DotGraph("contexts");
		Set<Context> drawn = new HashSet<Context>();
		drawContext(canvas, root, drawn);
		return canvas;
	}

	public void plot(Context root, String filename) {
		drawTree(root).plot(filename);
	}

	protected String nodeName(Context c) {
		return "c" + c.getNumber() + "_" + System.identityHashCode(c);
	}

	protected String formatNodeLabel(Context c) {
		return c.getName() + " (" + c.getCheckedInstructionsHere() + "/" + c.getCheckedInstructionsChildren() + ")";
	}

	private void drawContext(DotGraph canvas, Context c, Set<Context> drawn) {
		if (!drawn.add(c)) {
			return;
		}
		DotGraphNode n = canvas.drawNode(nodeName(c));
		n.setLabel(formatNodeLabel(c));
		if (!c.isEnabled()) {
			n.setStyle("dashed");
		}
		if (c.readsTentativeData()) {
			n.setAttribute("color", "red");
		}
		for (Context child : c.getChildren()) {
			drawContext(canvas, child, drawn);
			canvas.drawEdge(nodeName(c), nodeName(child));
		}
	}

}
