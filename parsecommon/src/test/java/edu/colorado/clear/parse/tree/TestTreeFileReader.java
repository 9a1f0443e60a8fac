package edu.colorado.clear.parse.tree;

import static org.junit.Assert.*;

import java.io.File;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestTreeFileReader {

    static String treeString =
        "(TOP (S (NP-SBJ (NNP Baker)) (ADVP (RB nonetheless)) (VP (VP (VBZ remains) "+
        "(ADJP-PRD (ADJP (JJ furious)) (DT both) (PP-3 (IN at) (NP-1 (NNP Shamir)))) "+
        "(, ,) (PP-PRP-4 (IN for) (S-NOM (NP-SBJ (-NONE- *PRO*-1)) (VP (VBG backing) "+
        "(PRT (RP down)) (PP (IN on) (NP (DT the) (NNS elections))))))) (, ,) "+
        "(CC and) (VP (PP=3 (IN at) (NP-2 (NP (NP (NNP Shamir) (POS 's)) (NN rival)) "+
        "(, ,) (NP (NNP Peres)) (, ,))) (PP-PRP=4 (IN for) (NP (NP (JJ political) "+
        "(NN ineptitude)) (PP (IN in) (S-NOM (NP-SBJ (-NONE- *PRO*-2)) "+
        "(VP (VBG forcing) (NP (NP (DT a) (JJ premature) (NN cabinet) (NN vote)) "+
        "(PP (IN on) (NP (NP (NNP Baker) (POS 's)) (NN plan))))))))))) (. .)))";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testTree() throws Exception {
        TreeFileReader reader = new TreeFileReader(new StringReader(treeString));
        ParseTree tree = reader.nextTree();
        assertNotNull(tree);
        assertNull(reader.nextTree());
        reader.close();

        assertEquals("TOP", tree.getRootNode().category());
        assertEquals(treeString, tree.toString());

        LeafNodeFinder finder = new LeafNodeFinder();
        tree.visit(finder);
        assertEquals(39, finder.leaves().size());
        assertEquals("Baker", finder.leaves().get(0).word());
        assertEquals("*PRO*-1", finder.leaves().get(9).word());
        assertEquals("-NONE-", finder.leaves().get(9).category());
        assertEquals(".", finder.leaves().get(38).word());
    }

    @Test
    public void testMultipleTrees() throws Exception {
        String input = "( (S (NP (NN dog)) (VP (VB runs))) )\n\n"+
                "(S (NP (PRP it))\n   (VP (VBD rained)))\n"+
                "((NP (NN one)) (NP (NN two)))\n"+
                "(X (-NONE-))";
        List<ParseTree> trees = TreeUtil.extractTrees(new StringReader(input));
        assertEquals(4, trees.size());

        // label-less wrapper around a single tree is dropped
        assertEquals("(S (NP (NN dog)) (VP (VB runs)))", trees.get(0).toString());
        assertEquals("(S (NP (PRP it)) (VP (VBD rained)))", trees.get(1).toString());
        assertEquals("(FRAG (NP (NN one)) (NP (NN two)))", trees.get(2).toString());

        InternalNode x = (InternalNode)trees.get(3).getRootNode();
        LeafNode empty = (LeafNode)x.child(0);
        assertFalse(empty.hasWord());
        assertTrue(empty.isEmpty());
    }

    @Test
    public void testEmptyInput() throws Exception {
        assertTrue(TreeUtil.extractTrees(new StringReader("")).isEmpty());
        assertTrue(TreeUtil.extractTrees(new StringReader("  \n\n ")).isEmpty());
    }

    static ParseException parseError(String input) {
        try {
            TreeUtil.extractTrees(new StringReader(input));
        } catch (ParseException e) {
            return e;
        } catch (Exception e) {
            fail("unexpected "+e);
        }
        fail("no error for "+input);
        return null;
    }

    @Test
    public void testErrors() {
        ParseException e = parseError("(S (NP (NN dog))");
        assertEquals(0, e.getTreeIndex());
        assertNull(e.getFileName());

        parseError("(S (NP (NN dog) (VP (VB runs))");
        parseError("dog (S (NN dog))");
        parseError("(NN New York)");
        parseError("(NP (NN dog) barks)");
        parseError("(NP dog (NN dog))");
        parseError("(S ((NN dog)))");
        parseError("()");

        e = parseError("(S (NN dog))\n(S (NN cat))\n(S (NN cow)");
        assertEquals(2, e.getTreeIndex());
        assertEquals(3, e.getLineNumber());

        e = parseError("(S (NN dog))\n\n(S\n  (NN cat) x)");
        assertEquals(1, e.getTreeIndex());
        assertEquals(4, e.getLineNumber());
    }

    @Test
    public void testBareToken() throws Exception {
        ParseException e = parseError("( dog )");
        assertTrue(e.getMessage().contains("dog"));
        parseError("( dog cat )");
        parseError("(S (NN dog))\n( cat\n)");

        // a label right after the bracket is a word-less leaf
        assertEquals("(dog)", TreeUtil.readTree("(dog)").toString());
        assertEquals("(NN dog)", TreeUtil.readTree("( (NN dog) )").toString());
        assertEquals("(S (NN dog))", TreeUtil.readTree("( S (NN dog))").toString());
    }

    @Test
    public void testTemporaryLabels() throws Exception {
        InternalNode root = (InternalNode)TreeUtil.readTree("(S (A a) (S* (B b) (C c)))").getRootNode();
        assertFalse(root.isTemporary());
        assertFalse(root.child(0).isTemporary());
        assertTrue(root.child(1).isTemporary());

        assertFalse(Binarizer.isTemporaryLabel("*"));
        assertFalse(Binarizer.isTemporaryLabel("NP"));
        assertTrue(Binarizer.isTemporaryLabel("NP*"));
    }

    @Test(expected=ParseException.class)
    public void testReadTreeNone() throws Exception {
        TreeUtil.readTree("   ");
    }

    @Test
    public void testReadFile() throws Exception {
        File file = folder.newFile("trees.mrg");
        try (Writer writer = new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8)) {
            writer.write(treeString+"\n(S (NP (NN dog)) (VP (VB runs)))\n");
        }
        List<ParseTree> trees = TreeUtil.extractTrees(file.getPath());
        assertEquals(2, trees.size());

        File gzFile = folder.newFile("trees.mrg.gz");
        try (Writer writer = new OutputStreamWriter(new GZIPOutputStream(new FileOutputStream(gzFile)), StandardCharsets.UTF_8)) {
            writer.write(treeString+"\n(S (NP (NN dog)) (VP (VB runs)))\n");
        }
        assertEquals(trees, TreeUtil.extractTrees(folder.getRoot().getPath(), "trees.mrg.gz"));

        assertEquals(2, TreeUtil.readTreeDir(folder.getRoot().getPath(), ".*\\.mrg(\\.gz)?").size());
    }

    @Test
    public void testReadFileError() throws Exception {
        File file = folder.newFile("bad.mrg");
        try (Writer writer = new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8)) {
            writer.write("(S (NN dog))\n(S (NN dog)\n");
        }
        try {
            TreeUtil.extractTrees(file.getPath());
            fail("no error for "+file);
        } catch (ParseException e) {
            assertEquals(file.getPath(), e.getFileName());
            assertEquals(1, e.getTreeIndex());
            assertTrue(e.getMessage().startsWith(file.getPath()));
        }
    }
}
