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

package tg.ir;

import java.util.*;

public class FunctionContext extends Context {

    // path conditions that do not name a stack depth apply at any depth
    public static final int ANY_STACK_DEPTH = -1;

    final List<Instruction> callers = new ArrayList<Instruction>();
    final List<PathCondition> pathConditions = new ArrayList<PathCondition>();
    boolean rootMain;
    int targetStackDepth = ANY_STACK_DEPTH;

    public FunctionContext(String name) {
        super(name, null);
    }

    void addCaller(Instruction call) {
        callers.add(call);
    }

    public List<Instruction> getCallers() {
        return callers;
    }

    // the analysis root: the program entry point, or a function analysed without its callers
    public boolean isRoot() {
        return callers.isEmpty();
    }

    // the root is the program's main function, so returning from it ends the process
    public boolean isRootMain() {
        return rootMain;
    }

    public FunctionContext setRootMain(boolean m) {
        rootMain = m;
        return this;
    }

    public int getTargetStackDepth() {
        return targetStackDepth;
    }

    public FunctionContext setTargetStackDepth(int depth) {
        targetStackDepth = depth;
        return this;
    }

    public List<PathCondition> getPathConditions() {
        return pathConditions;
    }

    public FunctionContext addPathCondition(PathCondition c) {
        pathConditions.add(c);
        return this;
    }

    @Override
    public FunctionContext getFunctionRoot() {
        return this;
    }

    @Override
    public LoopRegion getEnclosingLoop() {
        return null;
    }

}
