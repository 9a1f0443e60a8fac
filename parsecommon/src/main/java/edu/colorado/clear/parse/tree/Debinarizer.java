package edu.colorado.clear.parse.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes the temporary nodes introduced by {@link Binarizer}, putting their
 * children in their place. The root is never removed.
 *
 * @author shumin
 */
public class Debinarizer extends TreeTransformer {

    @Override
    public Node visit(LeafNode node) {
        return node.clone();
    }

    @Override
    public Node visit(InternalNode node) {
        List<Node> children = new ArrayList<Node>(node.children.size());
        for (Node child:node.children) {
            Node newChild = child.accept(this);
            // already debinarized below, so its children are all permanent
            if (newChild.isTemporary())
                children.addAll(((InternalNode)newChild).children);
            else
                children.add(newChild);
        }
        return new InternalNode(node.category, children, node.temporary);
    }
}
