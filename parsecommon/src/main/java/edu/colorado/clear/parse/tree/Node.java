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

import java.io.Serializable;

/**
 * Constituency tree node. There are exactly two kinds of nodes,
 * {@link LeafNode} and {@link InternalNode}; operations over trees are
 * written as {@link Visitor}s rather than by inspecting the node type.
 *
 * @author shumin
 */
public abstract class Node implements Serializable {
    /**
     *
     */
    private static final long serialVersionUID = -3270518716254883307L;

    String category;

    // can only be extended by the two node types in this package
    Node(String category) {
        if (category==null)
            throw new StructureException("node category cannot be null");
        this.category = category;
    }

    /** Returns the constituent label or pos-tag of this node. */
    public String category() {
        return category;
    }

    public abstract boolean isLeaf();

    /**
     * Whether the node was introduced by {@link Binarizer} and is to be
     * spliced out by {@link Debinarizer}.
     */
    public boolean isTemporary() {
        return false;
    }

    /**
     * Double dispatch to the visit method of the node's type.
     * @param visitor the visitor
     * @return whatever the visitor returns for this node
     */
    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Deep copy of the node. The copy shares no structure with this node.
     */
    @Override
    public abstract Node clone();

    /** Bracketed form, e.g. <code>(NP (DT the) (NN dog))</code>. */
    public String toParse() {
        StringBuilder str = new StringBuilder();
        toParse(str);
        return str.toString();
    }

    abstract void toParse(StringBuilder str);

    /**
     * Bracketed form with one node per line.
     * @param indent number of spaces in front of this node
     */
    public String toPrettyParse(int indent) {
        StringBuilder str = new StringBuilder();
        toPrettyParse(str, indent);
        return str.toString();
    }

    abstract void toPrettyParse(StringBuilder str, int indent);

    @Override
    public String toString() {
        return toParse();
    }
}
