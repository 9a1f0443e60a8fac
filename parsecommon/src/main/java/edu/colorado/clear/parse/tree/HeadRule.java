/**
* Copyright (c) 2010, Regents of the University of Colorado
* All rights reserved.
*
* Redistribution and use in source and binary forms, with or without
* modification, are permitted provided that the following conditions are met:
*
* Redistributions of source code must retain the above copyright notice, this list of conditions and the following disclaimer.
* Redistributions in binary form must reproduce the above copyright notice, this list of conditions and the following disclaimer in the documentation and/or other materials provided with the distribution.
* Neither the name of the University of Colorado at Boulder nor the names of its contributors may be used to endorse or promote products derived from this software without specific prior written permission.
*
* THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS"
* AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE
* IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE
* ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT OWNER OR CONTRIBUTORS BE
* LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR
* CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF
* SUBSTITUTE GOODS OR SERVICES; LOSS OF USE, DATA, OR PROFITS; OR BUSINESS
* INTERRUPTION) HOWEVER CAUSED AND ON ANY THEORY OF LIABILITY, WHETHER IN
* CONTRACT, STRICT LIABILITY, OR TORT (INCLUDING NEGLIGENCE OR OTHERWISE)
* ARISING IN ANY WAY OUT OF THE USE OF THIS SOFTWARE, EVEN IF ADVISED OF THE
* POSSIBILITY OF SUCH DAMAGE.
*/
package edu.colorado.clear.parse.tree;

import java.util.regex.Pattern;

/**
 * Head rule of one constituent label: a priority list of label patterns,
 * each searched over the children from the left or from the right.
 * <p>
 * Text form: <code>NP r NN|NNS;l NP;r CD</code>. A rule without a direction
 * takes the direction of the rule before it.
 */
public class HeadRule
{
    static public final String HEAD_DELIM  = ";";

    static public final HeadRule DEFAULT = new HeadRule("default r .*");

    public enum Direction
    {
        LEFT,
        RIGHT
    };

    String      ruleName;
    Direction[] dirs;
    Pattern[]   rules;

    public HeadRule(String textRule)
    {
        String[] ruleStrs = textRule.trim().split(HEAD_DELIM);
        dirs = new Direction[ruleStrs.length];
        rules = new Pattern[ruleStrs.length];

        String[] toks = ruleStrs[0].trim().split("\\s+");
        if (toks.length!=3)
            throw new IllegalArgumentException("malformed head rule: "+textRule);
        ruleName = toks[0];
        dirs[0] = toDirection(toks[1], textRule);
        rules[0] = Pattern.compile(toks[2]);

        for (int i=1; i<ruleStrs.length; ++i) {
            toks = ruleStrs[i].trim().split("\\s+");
            if (toks.length<2) {
                dirs[i] = dirs[i-1];
                rules[i] = Pattern.compile(toks[0]);
            } else {
                dirs[i] = toDirection(toks[0], textRule);
                rules[i] = Pattern.compile(toks[1]);
            }
        }
    }

    static Direction toDirection(String str, String textRule) {
        if (str.equals("l")) return Direction.LEFT;
        if (str.equals("r")) return Direction.RIGHT;
        throw new IllegalArgumentException("bad direction "+str+" in head rule: "+textRule);
    }

    /** Returns the label the rule applies to. */
    public String getName() {
        return ruleName;
    }

    public int size() {
        return rules.length;
    }

    public Direction getDirection(int i) {
        return dirs[i];
    }

    /** Whether a child label is matched by the i-th rule. */
    public boolean matches(int i, String category) {
        return rules[i].matcher(category).matches();
    }
}
