package edu.colorado.clear.parse.tree;

/**
 * Visitor that rewrites a tree. Each visit returns the replacement for the
 * visited node, built from new nodes; the input is left untouched.
 */
public abstract class TreeTransformer implements Visitor<Node> {

    /**
     * Returns the replacement for a whole tree rooted at <code>root</code>.
     */
    public Node transform(Node root) {
        return root.accept(this);
    }
}
