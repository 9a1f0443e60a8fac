package edu.colorado.clear.parse.tree;

/**
 * Thrown when an operation would leave a tree in an invalid shape, such as
 * an internal node without children or a head reference pointing outside
 * of the node's own subtree.
 */
public class StructureException extends IllegalArgumentException {

    private static final long serialVersionUID = 5349136540937520951L;

    public StructureException(String message) {
        super(message);
    }
}
