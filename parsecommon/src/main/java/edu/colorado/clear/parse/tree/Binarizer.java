package edu.colorado.clear.parse.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Right-branching binarization. A node with more than two children keeps its
 * first child and moves the rest under a temporary node labeled with the
 * parent category plus {@link #TEMPORARY_MARKER}, recursively:
 * <pre>
 * (X a b c d)  =&gt;  (X a (X* b (X* c d)))
 * </pre>
 * Nodes with at most two children are copied as is, so binarizing a binary
 * tree changes nothing. {@link Debinarizer} undoes the transform.
 *
 * @author shumin
 */
public class Binarizer extends TreeTransformer {

    public static final String TEMPORARY_MARKER = "*";

    /**
     * Whether the label is one this class gives to temporary nodes, e.g.
     * <code>NP*</code>.
     */
    public static boolean isTemporaryLabel(String category) {
        return category.length()>TEMPORARY_MARKER.length() && category.endsWith(TEMPORARY_MARKER);
    }

    @Override
    public Node visit(LeafNode node) {
        return node.clone();
    }

    @Override
    public Node visit(InternalNode node) {
        List<Node> children = new ArrayList<Node>(node.children.size());
        for (Node child:node.children)
            children.add(child.accept(this));

        if (children.size()<=2)
            return new InternalNode(node.category, children, node.temporary);

        String tempCategory = node.temporary?node.category:node.category+TEMPORARY_MARKER;

        // build the cascade from the right
        int last = children.size()-1;
        Node right = new InternalNode(tempCategory, pair(children.get(last-1), children.get(last)), true);
        for (int i=last-2; i>0; --i)
            right = new InternalNode(tempCategory, pair(children.get(i), right), true);

        return new InternalNode(node.category, pair(children.get(0), right), node.temporary);
    }

    static List<Node> pair(Node left, Node right) {
        List<Node> ret = new ArrayList<Node>(2);
        ret.add(left);
        ret.add(right);
        return ret;
    }
}
