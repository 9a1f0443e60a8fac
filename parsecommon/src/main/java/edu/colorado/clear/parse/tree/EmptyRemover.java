package edu.colorado.clear.parse.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes empty elements (see {@link LeafNode#isEmpty()}) and any
 * constituent left with nothing under it.
 * <p>
 * A visit returns null for a node that is removed. If nothing of the tree
 * is left, {@link #transform(Node)} returns a word-less leaf with the root's
 * label so the result is still a valid tree.
 *
 * @author shumin
 */
public class EmptyRemover extends TreeTransformer {

    @Override
    public Node transform(Node root) {
        Node ret = root.accept(this);
        return ret==null?new LeafNode(root.category, null):ret;
    }

    @Override
    public Node visit(LeafNode node) {
        return node.isEmpty()?null:node.clone();
    }

    @Override
    public Node visit(InternalNode node) {
        List<Node> children = new ArrayList<Node>(node.children.size());
        for (Node child:node.children) {
            Node newChild = child.accept(this);
            if (newChild!=null)
                children.add(newChild);
        }
        return children.isEmpty()?null:new InternalNode(node.category, children, node.temporary);
    }
}
