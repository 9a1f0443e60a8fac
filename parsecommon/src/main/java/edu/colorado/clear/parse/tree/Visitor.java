package edu.colorado.clear.parse.tree;

/**
 * Operation over the two node types. {@link Node#accept(Visitor)} calls the
 * method matching the node's type.
 *
 * @param <R> result type, {@link Void} for visitors run for their side effects
 */
public interface Visitor<R> {

    R visit(LeafNode node);

    R visit(InternalNode node);
}
