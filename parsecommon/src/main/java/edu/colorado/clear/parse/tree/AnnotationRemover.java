package edu.colorado.clear.parse.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips function tags and co-indexing from labels, e.g.
 * <code>NP-SBJ-1</code> becomes <code>NP</code> and <code>PP=3</code>
 * becomes <code>PP</code>. Special labels such as <code>-NONE-</code> and
 * <code>-LRB-</code> are kept. Words are left alone.
 *
 * @author shumin
 */
public class AnnotationRemover extends TreeTransformer {

    public static final Pattern POS_PATTERN = Pattern
            .compile("\\A([^-\\=\\)]+|-NONE-|-LRB-|-RRB-|-LSB-|-RSB-|-LCB-|-RCB-)((-[a-zA-Z]+)*)((-\\d+)*(\\=\\d+)?(-\\d+)*)\\z");

    /**
     * Returns the label without function tags or indices.
     */
    public static String removeAnnotation(String category) {
        Matcher matcher = POS_PATTERN.matcher(category);
        if (matcher.matches())
            return matcher.group(1);

        // fall back on cutting at the first separator that isn't leading
        for (int i=1; i<category.length(); ++i)
            if (category.charAt(i)=='-' || category.charAt(i)=='=')
                return category.substring(0, i);
        return category;
    }

    @Override
    public Node visit(LeafNode node) {
        return new LeafNode(removeAnnotation(node.category), node.word);
    }

    @Override
    public Node visit(InternalNode node) {
        List<Node> children = new ArrayList<Node>(node.children.size());
        for (Node child:node.children)
            children.add(child.accept(this));
        return new InternalNode(removeAnnotation(node.category), children, node.temporary);
    }
}
