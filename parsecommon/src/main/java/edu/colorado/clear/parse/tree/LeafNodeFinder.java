package edu.colorado.clear.parse.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the leaves of a tree from left to right. The leaves are the
 * tree's own nodes, not copies.
 * <p>
 * Leaves of every tree visited are appended to the same list; call
 * {@link #reset()} to start over.
 */
public class LeafNodeFinder implements Visitor<Void> {

    List<LeafNode> leaves = new ArrayList<LeafNode>();

    @Override
    public Void visit(LeafNode node) {
        leaves.add(node);
        return null;
    }

    @Override
    public Void visit(InternalNode node) {
        for (Node child:node.children)
            child.accept(this);
        return null;
    }

    /** Returns a read-only view of the leaves found so far. */
    public List<LeafNode> leaves() {
        return Collections.unmodifiableList(leaves);
    }

    public void reset() {
        leaves.clear();
    }
}
