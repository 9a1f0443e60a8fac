package edu.colorado.clear.parse.tree;

import java.util.List;
import java.util.logging.Logger;

/**
 * Finds the head child and head word of every constituent, bottom up, and
 * stores them with {@link InternalNode#headConstituent(Node)} and
 * {@link InternalNode#headLexicon(LeafNode)}.
 * <p>
 * For each rule of the constituent's {@link HeadRule}, in order, the
 * children are scanned from the rule's end and the first child whose label
 * matches becomes the head. Children headed by an empty element and comma
 * or colon punctuation are never picked by a rule. If no rule matches, the
 * first non-empty child from the end of the first rule is taken.
 *
 * @author shumin
 */
public class HeadFinder implements Visitor<Void> {

    private static Logger logger = Logger.getLogger(HeadFinder.class.getPackage().getName());

    HeadRules headrules;

    /** Uses the bundled English rules. */
    public HeadFinder() {
        this(HeadRules.english());
    }

    public HeadFinder(HeadRules headrules) {
        this.headrules = headrules;
    }

    @Override
    public Void visit(LeafNode node) {
        return null;
    }

    @Override
    public Void visit(InternalNode node) {
        for (Node child:node.children)
            child.accept(this);

        HeadRule headrule = findRule(node.category);
        List<Node> children = node.children;

        Node head = null;
        for (int r=0; r<headrule.size() && head==null; ++r) {
            if (headrule.getDirection(r) == HeadRule.Direction.LEFT) {
                for (int i=0; i<children.size() && head==null; ++i)
                    if (isCandidate(children.get(i)) && headrule.matches(r, label(children.get(i))))
                        head = children.get(i);
            } else {
                for (int i=children.size()-1; i>=0 && head==null; --i)
                    if (isCandidate(children.get(i)) && headrule.matches(r, label(children.get(i))))
                        head = children.get(i);
            }
        }

        // no rule matched, all children are probably empty or punctuation
        if (head==null) {
            boolean left = headrule.getDirection(0) == HeadRule.Direction.LEFT;
            for (int i=0; i<children.size() && head==null; ++i) {
                Node child = children.get(left?i:children.size()-1-i);
                if (!headOf(child).isEmpty())
                    head = child;
            }
            if (head==null)
                head = children.get(left?0:children.size()-1);
        }

        node.headConstituent = head;
        node.headLexicon = headOf(head);
        return null;
    }

    HeadRule findRule(String category) {
        HeadRule headrule = headrules.getHeadRule(category);
        if (headrule!=null)
            return headrule;

        String base = AnnotationRemover.removeAnnotation(category);
        if (base.equals("NML"))
            base = "NP";
        else if (base.equals("SG"))
            base = "S";
        if ((headrule = headrules.getHeadRule(base))!=null)
            return headrule;

        logger.fine("no head rule for "+category+", using default");
        return HeadRule.DEFAULT;
    }

    static String label(Node node) {
        return AnnotationRemover.removeAnnotation(node.category);
    }

    static LeafNode headOf(Node node) {
        return node.isLeaf()?(LeafNode)node:((InternalNode)node).headLexicon;
    }

    static boolean isCandidate(Node child) {
        return !headOf(child).isEmpty() && !child.category.equals(":") && !child.category.equals(",");
    }
}
