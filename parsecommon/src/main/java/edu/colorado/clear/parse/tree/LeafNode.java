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

/**
 * Terminal node: a pos-tag and the word it covers. Traces and other empty
 * elements may have no word at all.
 *
 * @author shumin
 */
public final class LeafNode extends Node {

    private static final long serialVersionUID = 8425037787203911628L;

    /** pos-tag of Penn Treebank empty categories */
    public static final String POS_EC = "-NONE-";

    String word;

    /**
     * @param category pos-tag
     * @param word the token, or null for an empty element
     */
    public LeafNode(String category, String word) {
        super(category);
        this.word = word;
    }

    /**
     * Returns the token, or null if the leaf has no word.
     * @see #hasWord()
     */
    public String word() {
        return word;
    }

    public boolean hasWord() {
        return word!=null;
    }

    /**
     * Returns true if this leaf is an empty element: either it has no word
     * or it is tagged as an empty category (<code>-NONE-</code>).
     */
    public boolean isEmpty() {
        return word==null || POS_EC.equals(category);
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public LeafNode clone() {
        return new LeafNode(category, word);
    }

    @Override
    void toParse(StringBuilder str) {
        str.append('(').append(category);
        if (word!=null)
            str.append(' ').append(word);
        str.append(')');
    }

    @Override
    void toPrettyParse(StringBuilder str, int indent) {
        for (int i=0; i<indent; ++i)
            str.append(' ');
        toParse(str);
    }

    @Override
    public boolean equals(Object obj) {
        if (this==obj)
            return true;
        if (!(obj instanceof LeafNode))
            return false;
        LeafNode rhs = (LeafNode)obj;
        return category.equals(rhs.category) && (word==null?rhs.word==null:word.equals(rhs.word));
    }

    @Override
    public int hashCode() {
        return 31*category.hashCode()+(word==null?0:word.hashCode());
    }
}
