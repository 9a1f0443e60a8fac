package edu.colorado.clear.parse.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses chains of single-child constituents into the top node of the
 * chain: <code>(A (B (C word)))</code> becomes <code>(A (C word))</code> and
 * <code>(A (B (C x) (D y)))</code> becomes <code>(A (C x) (D y))</code>.
 * A chain stops at the first node with more than one child or at a leaf.
 *
 * @author shumin
 */
public class UnaryChainRemover extends TreeTransformer {

    @Override
    public Node visit(LeafNode node) {
        return node.clone();
    }

    @Override
    public Node visit(InternalNode node) {
        List<Node> children = node.children;
        while (children.size()==1 && !children.get(0).isLeaf())
            children = ((InternalNode)children.get(0)).children;

        List<Node> newChildren = new ArrayList<Node>(children.size());
        for (Node child:children)
            newChildren.add(child.accept(this));
        return new InternalNode(node.category, newChildren, node.temporary);
    }
}
