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

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Head rules of a treebank, one {@link HeadRule} per line, lines starting
 * with '#' are comments.
 */
public class HeadRules {

    /** classpath resource with the default English rules */
    public static final String ENGLISH_RESOURCE = "headrules.english.txt";

    private Map<String, HeadRule> headrules;

    public HeadRules(Reader reader) throws IOException {
        headrules = new HashMap<String, HeadRule>();
        BufferedReader in = new BufferedReader(reader);
        String line;
        while ((line=in.readLine())!=null) {
            line = line.trim();
            if (line.isEmpty() || line.charAt(0)=='#') continue;
            HeadRule rule = new HeadRule(line);
            headrules.put(rule.ruleName, rule);
        }
    }

    public HeadRules(String inputFile) throws IOException {
        this(readAll(new FileInputStream(inputFile)));
    }

    private HeadRules(Map<String, HeadRule> headrules) {
        this.headrules = headrules;
    }

    static Map<String, HeadRule> readAll(InputStream in) throws IOException {
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return new HeadRules(reader).headrules;
        }
    }

    /**
     * Loads the bundled English rules.
     */
    public static HeadRules english() {
        InputStream in = HeadRules.class.getResourceAsStream(ENGLISH_RESOURCE);
        if (in==null)
            throw new IllegalStateException("missing resource "+ENGLISH_RESOURCE);
        try {
            return new HeadRules(readAll(in));
        } catch (IOException e) {
            throw new IllegalStateException("cannot read "+ENGLISH_RESOURCE, e);
        }
    }

    /** Returns the rule for a label, or null if there is none. */
    public HeadRule getHeadRule(String category) {
        return headrules.get(category);
    }
}
