package edu.colorado.clear.parse.tree;

import static org.junit.Assert.*;

import java.io.StringReader;
import java.util.List;

import org.junit.BeforeClass;
import org.junit.Test;

public class TestHeadFinder {

    static HeadRules english;

    @BeforeClass
    public static void setUpClass() throws Exception {
        english = HeadRules.english();
    }

    static ParseTree findHeads(String str, HeadRules rules) throws ParseException {
        ParseTree tree = TreeUtil.readTree(str);
        tree.visit(new HeadFinder(rules));
        return tree;
    }

    static String headword(Node node) {
        return ((InternalNode)node).headLexicon().word();
    }

    @Test
    public void testSimple() throws Exception {
        ParseTree tree = findHeads("(S (NP (DT the) (NN dog)) (VP (VBZ runs)))", english);
        InternalNode s = (InternalNode)tree.getRootNode();

        assertSame(s.child(1), s.headConstituent());
        assertEquals("runs", headword(s));
        assertSame(((InternalNode)s.child(1)).child(0), s.headLexicon());

        InternalNode np = (InternalNode)s.child(0);
        assertSame(np.child(1), np.headConstituent());
        assertEquals("dog", headword(np));
    }

    @Test
    public void testRules() throws Exception {
        ParseTree tree = findHeads("(S (NP (NNP John)) (VP (VBD gave) (NP (PRP her)) (NP (DT a) (NN book) (POS 's)) (PP (IN to) (NP (CD 3)))) (. .))", english);
        InternalNode s = (InternalNode)tree.getRootNode();
        assertEquals("gave", headword(s));

        InternalNode vp = (InternalNode)s.child(1);
        assertEquals("book", headword(vp.child(2)));
        assertEquals("to", headword(vp.child(3)));
        assertEquals("3", headword(((InternalNode)vp.child(3)).child(1)));
    }

    @Test
    public void testAnnotatedLabels() throws Exception {
        ParseTree tree = findHeads("(S-1 (NP-SBJ (NNP John)) (VP-2 (VBD left)))", english);
        assertEquals("left", headword(tree.getRootNode()));

        tree = findHeads("(NML (JJ big) (NN apple))", english);
        assertEquals("apple", headword(tree.getRootNode()));
    }

    @Test
    public void testSkipsEmptyAndPunctuation() throws Exception {
        ParseTree tree = findHeads("(S (NP-SBJ (-NONE- *PRO*)) (VP (VB go)))", english);
        assertEquals("go", headword(tree.getRootNode()));

        // nothing but an empty element: it is still the head
        InternalNode subject = (InternalNode)((InternalNode)tree.getRootNode()).child(0);
        assertEquals("*PRO*", subject.headLexicon().word());

        tree = findHeads("(FRAG (NN dog) (, ,))", english);
        assertEquals("dog", headword(tree.getRootNode()));
    }

    @Test
    public void testCustomRules() throws Exception {
        HeadRules rules = new HeadRules(new StringReader("# test rules\n\nX\tl B;A\nY r A;l B\n"));
        assertEquals("b", headword(findHeads("(X (A a) (B b) (A a2))", rules).getRootNode()));
        assertEquals("a2", headword(findHeads("(Y (A a) (B b) (A a2))", rules).getRootNode()));
        assertEquals("b", headword(findHeads("(Y (C c) (B b) (B b2))", rules).getRootNode()));

        // no rule, the rightmost child
        assertEquals("b", headword(findHeads("(ZZ (A a) (B b))", rules).getRootNode()));
    }

    @Test(expected=IllegalArgumentException.class)
    public void testBadRule() {
        new HeadRule("NP x NN");
    }

    @Test
    public void testHeadValidity() throws Exception {
        ParseTree tree = findHeads(TestTreeFileReader.treeString, english);
        assertEquals("remains", headword(tree.getRootNode()));

        for (InternalNode node:TestTransforms.internalNodes(tree)) {
            assertNotNull(node.headLexicon());
            assertTrue(node.headLexicon().isLeaf());
            assertTrue(node.children().contains(node.headConstituent()));

            Node headChild = node.headConstituent();
            LeafNode expected = headChild.isLeaf()?(LeafNode)headChild:((InternalNode)headChild).headLexicon();
            assertSame(expected, node.headLexicon());

            LeafNodeFinder finder = new LeafNodeFinder();
            node.accept(finder);
            boolean found = false;
            for (LeafNode leaf:finder.leaves())
                found |= leaf==node.headLexicon();
            assertTrue(node.category(), found);
        }
    }

    @Test
    public void testHeadsNotCarriedOver() throws Exception {
        ParseTree tree = findHeads("(S (NP (NN dog)) (VP (VB runs)))", english);
        tree.transform(new AnnotationRemover());
        for (InternalNode node:TestTransforms.internalNodes(tree)) {
            assertNull(node.headLexicon());
            assertNull(node.headConstituent());
        }
    }

    @Test
    public void testLeafNodeFinderAccumulates() throws Exception {
        LeafNodeFinder finder = new LeafNodeFinder();
        TreeUtil.readTree("(S (NP (NN dog)) (VP (VB runs)))").visit(finder);
        TreeUtil.readTree("(NP (DT a) (NN cat))").visit(finder);
        List<LeafNode> leaves = finder.leaves();
        assertEquals(4, leaves.size());
        assertEquals("cat", leaves.get(3).word());

        finder.reset();
        assertTrue(finder.leaves().isEmpty());
    }
}
