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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Non-terminal node. Owns an ordered, non-empty list of children which no
 * other node refers to; every node handed to an internal node from outside
 * is cloned first.
 * <p>
 * The head references set by {@link HeadFinder} point into the node's own
 * subtree and are not owned by it. Transforms build new nodes that carry no
 * head references, so heads have to be found again after a transform.
 *
 * @author shumin
 */
public final class InternalNode extends Node {

    private static final long serialVersionUID = 2071651830497102385L;

    List<Node> children;
    boolean    temporary;

    LeafNode   headLexicon;
    Node       headConstituent;

    /**
     * Initializes the node with copies of the given children.
     * @param category constituent label
     * @param children children, at least one
     * @throws StructureException if there are no children
     */
    public InternalNode(String category, List<? extends Node> children) {
        super(category);
        if (children==null || children.isEmpty())
            throw new StructureException("internal node "+category+" must have at least one child");
        List<Node> copies = new ArrayList<Node>(children.size());
        for (Node child:children) {
            if (child==null)
                throw new StructureException("null child of "+category);
            copies.add(child.clone());
        }
        this.children = copies;
    }

    /**
     * Copy constructor, see {@link #clone()}.
     */
    public InternalNode(InternalNode other) {
        super(other.category);
        temporary = other.temporary;
        children = new ArrayList<Node>(other.children.size());
        for (Node child:other.children)
            children.add(child.clone());

        // point the heads at the copied nodes
        if (other.headConstituent!=null)
            headConstituent = nodeAt(other.pathTo(other.headConstituent));
        if (other.headLexicon!=null)
            headLexicon = (LeafNode)nodeAt(other.pathTo(other.headLexicon));
    }

    // takes the list as is, only for nodes built inside this package
    InternalNode(String category, List<Node> children, boolean temporary) {
        super(category);
        if (children.isEmpty())
            throw new StructureException("internal node "+category+" must have at least one child");
        this.children = children;
        this.temporary = temporary;
    }

    @Override
    public boolean isLeaf() {
        return false;
    }

    @Override
    public boolean isTemporary() {
        return temporary;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visit(this);
    }

    /**
     * Appends a copy of the node as the last child.
     */
    public void addChild(Node child) {
        if (child==null)
            throw new StructureException("null child of "+category);
        children.add(child.clone());
    }

    public int numChildren() {
        return children.size();
    }

    /**
     * @throws IndexOutOfBoundsException if there is no such child
     */
    public Node child(int index) {
        return children.get(index);
    }

    /** Returns a read-only view of the children. */
    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    /** Callback for {@link InternalNode#eachChild(ChildFunction)}. */
    public interface ChildFunction {
        void apply(Node child);
    }

    /**
     * Calls the function on each direct child, left to right.
     */
    public void eachChild(ChildFunction fn) {
        for (Node child:children)
            fn.apply(child);
    }

    /** Returns the head word leaf, or null if heads have not been found. */
    public LeafNode headLexicon() {
        return headLexicon;
    }

    /**
     * Sets the head word leaf.
     * @param descendant a leaf of this node's subtree, or null to clear
     * @throws StructureException if the leaf is not in this subtree
     */
    public void headLexicon(LeafNode descendant) {
        if (descendant!=null && pathTo(descendant)==null)
            throw new StructureException(descendant+" is not a descendant of "+category);
        headLexicon = descendant;
    }

    /** Returns the head child, or null if heads have not been found. */
    public Node headConstituent() {
        return headConstituent;
    }

    /**
     * Sets the head constituent.
     * @param descendant a node of this node's subtree, or null to clear
     * @throws StructureException if the node is not in this subtree
     */
    public void headConstituent(Node descendant) {
        if (descendant!=null && pathTo(descendant)==null)
            throw new StructureException(descendant+" is not a descendant of "+category);
        headConstituent = descendant;
    }

    /**
     * Finds the child indices leading from this node to a descendant
     * (compared by identity).
     * @return the path, or null if the node is not a proper descendant
     */
    int[] pathTo(Node descendant) {
        List<Integer> path = new ArrayList<Integer>();
        if (!findPath(descendant, path))
            return null;
        int[] ret = new int[path.size()];
        for (int i=0; i<ret.length; ++i)
            ret[i] = path.get(ret.length-i-1);
        return ret;
    }

    // collects the path in reverse order
    private boolean findPath(Node descendant, List<Integer> path) {
        for (int i=0; i<children.size(); ++i) {
            Node child = children.get(i);
            if (child==descendant || !child.isLeaf() && ((InternalNode)child).findPath(descendant, path)) {
                path.add(i);
                return true;
            }
        }
        return false;
    }

    Node nodeAt(int[] path) {
        Node node = this;
        for (int idx:path)
            node = ((InternalNode)node).children.get(idx);
        return node;
    }

    @Override
    public InternalNode clone() {
        return new InternalNode(this);
    }

    @Override
    void toParse(StringBuilder str) {
        str.append('(').append(category);
        for (Node child:children) {
            str.append(' ');
            child.toParse(str);
        }
        str.append(')');
    }

    @Override
    void toPrettyParse(StringBuilder str, int indent) {
        for (int i=0; i<indent; ++i)
            str.append(' ');
        str.append('(').append(category);
        for (Node child:children) {
            str.append('\n');
            child.toPrettyParse(str, indent+ParseTree.INDENT);
        }
        str.append(')');
    }

    @Override
    public boolean equals(Object obj) {
        if (this==obj)
            return true;
        if (!(obj instanceof InternalNode))
            return false;
        InternalNode rhs = (InternalNode)obj;
        return category.equals(rhs.category) && children.equals(rhs.children);
    }

    @Override
    public int hashCode() {
        return 31*category.hashCode()+children.hashCode();
    }
}
