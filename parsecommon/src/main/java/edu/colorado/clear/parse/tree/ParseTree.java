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
 * A parse tree: owns a single root node.
 *
 * @author shumin
 */
public class ParseTree implements Serializable {

    private static final long serialVersionUID = -6206836707497151736L;

    /** spaces per level in {@link #toPrettyString()} */
    public static final int INDENT = 2;

    Node rootNode;

    /**
     * Initializes the tree with a copy of <code>root</code>.
     */
    public ParseTree(Node root) {
        if (root==null)
            throw new StructureException("parse tree needs a root");
        rootNode = root.clone();
    }

    // takes the node as is, for trees built inside this package
    ParseTree(Node root, boolean copy) {
        rootNode = copy?root.clone():root;
    }

    public Node getRootNode() {
        return rootNode;
    }

    /**
     * Runs the visitor from the root.
     * @return the visitor's result for the root
     */
    public <R> R visit(Visitor<R> visitor) {
        return rootNode.accept(visitor);
    }

    /**
     * Replaces the root with the transformer's output.
     */
    public void transform(TreeTransformer transformer) {
        Node root = transformer.transform(rootNode);
        if (root==null)
            throw new StructureException(transformer.getClass().getSimpleName()+" produced an empty tree");
        rootNode = root;
    }

    /**
     * One node per line, children indented {@value #INDENT} spaces deeper
     * than their parent.
     */
    public String toPrettyString() {
        return rootNode.toPrettyParse(0);
    }

    /** Single line bracketed form. */
    @Override
    public String toString() {
        return rootNode.toParse();
    }

    @Override
    public boolean equals(Object obj) {
        if (this==obj)
            return true;
        if (!(obj instanceof ParseTree))
            return false;
        return rootNode.equals(((ParseTree)obj).rootNode);
    }

    @Override
    public int hashCode() {
        return rootNode.hashCode();
    }
}
