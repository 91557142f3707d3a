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

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;

import org.junit.jupiter.api.Test;

import soot.util.dot.DotGraph;
import tg.ir.*;

public class ContextTreeToDotTest {

    @Test
    public void testOneNodePerContext() throws Exception {
        FunctionContext f = new FunctionContext("callee");
        f.newBlock("entry").add(Instruction.ret("ret"));
        FunctionContext main = new FunctionContext("main");
        BasicBlock entry = main.newBlock("entry");
        entry.add(Instruction.call("first", f));
        entry.add(Instruction.call("second", f));
        entry.add(Instruction.ret("ret"));
        main.setCheckedInstructions(1, 3);
        f.setReadsTentativeData(true);

        DotGraph graph = new ContextTreeToDot().drawTree(main);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        graph.render(out, 0);
        String text = out.toString("UTF-8");
        assertTrue(text.contains("main (1/3)"));
        assertTrue(text.contains("callee (0/0)"));
        assertTrue(text.contains("red"));
    }

}
