package edu.colorado.clear.parse.tools;

import static org.junit.Assert.*;

import java.io.File;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.kohsuke.args4j.CmdLineParser;

import edu.colorado.clear.parse.tree.HeadFinder;
import edu.colorado.clear.parse.tree.ParseTree;
import edu.colorado.clear.parse.tree.TreeUtil;

public class TestNormalizeTrees {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    static void write(File file, String text) throws Exception {
        try (Writer writer = new OutputStreamWriter(new FileOutputStream(file), StandardCharsets.UTF_8)) {
            writer.write(text);
        }
    }

    static NormalizeTrees parse(String... args) throws Exception {
        NormalizeTrees options = new NormalizeTrees();
        new CmdLineParser(options).parseArgument(args);
        return options;
    }

    @Test
    public void testRun() throws Exception {
        File dir = folder.newFolder("trees");
        write(new File(dir, "a.parse"), "( (S (NP-SBJ (-NONE- *PRO*) (NN dog)) (VP (VBZ runs))) )\n");
        write(new File(dir, "b.parse"), "(S (NP (NNS cats)) (VP (VBP sleep)))\n");
        write(new File(dir, "ignored.txt"), "(X (Y z))\n");
        File out = new File(folder.getRoot(), "out.parse");

        parse("-in", dir.getPath(), "-out", out.getPath(), "-transforms", "annotation,empty").run();

        List<String> lines = Files.readAllLines(out.toPath(), StandardCharsets.UTF_8);
        assertEquals(2, lines.size());
        assertEquals("(S (NP (NN dog)) (VP (VBZ runs)))", lines.get(0));
        assertEquals("(S (NP (NNS cats)) (VP (VBP sleep)))", lines.get(1));
    }

    @Test
    public void testBinarizeThenDebinarize() throws Exception {
        File dir = folder.newFolder("trees");
        write(new File(dir, "a.parse"), "(S (NP (DT the) (JJ big) (NN dog)) (VP (VBZ runs)) (. .))\n");
        File binarized = new File(folder.getRoot(), "binarized.parse");
        File out = new File(folder.getRoot(), "out.parse");

        parse("-in", dir.getPath(), "-out", binarized.getPath(), "-transforms", "binarize").run();
        assertEquals("(S (NP (DT the) (NP* (JJ big) (NN dog))) (S* (VP (VBZ runs)) (. .)))",
                Files.readAllLines(binarized.toPath(), StandardCharsets.UTF_8).get(0));

        parse("-in", binarized.getPath(), "-out", out.getPath(), "-transforms", "debinarize").run();
        assertEquals("(S (NP (DT the) (JJ big) (NN dog)) (VP (VBZ runs)) (. .))",
                Files.readAllLines(out.toPath(), StandardCharsets.UTF_8).get(0));
    }

    @Test
    public void testConfig() throws Exception {
        File dir = folder.newFolder("trees");
        write(new File(dir, "a.parse"), "(S-1 (NP-SBJ (NN dog)) (VP (VBZ runs)))\n");
        File config = new File(folder.getRoot(), "cleartree.properties");
        write(config, "transforms = empty\nnormalize.transforms = annotation\n");
        File out = new File(folder.getRoot(), "out.parse");

        parse("-in", dir.getPath(), "-out", out.getPath(), "-config", config.getPath()).run();
        assertEquals("(S (NP (NN dog)) (VP (VBZ runs)))", Files.readAllLines(out.toPath(), StandardCharsets.UTF_8).get(0));

        // command line wins over the config file
        parse("-in", dir.getPath(), "-out", out.getPath(), "-config", config.getPath(), "-transforms", "empty").run();
        assertEquals("(S-1 (NP-SBJ (NN dog)) (VP (VBZ runs)))", Files.readAllLines(out.toPath(), StandardCharsets.UTF_8).get(0));
    }

    @Test
    public void testFormat() throws Exception {
        ParseTree tree = TreeUtil.readTree("(S (NP (NN dog)) (VP (VBZ runs)))");

        assertEquals("(S (NP (NN dog)) (VP (VBZ runs)))", parse("-in", "x", "-out", "y").format(tree));
        assertEquals(tree.toPrettyString(), parse("-in", "x", "-out", "y", "-pretty").format(tree));

        tree.visit(new HeadFinder());
        assertEquals("(S[runs] (NP[dog] (NN dog)) (VP[runs] (VBZ runs)))", parse("-in", "x", "-out", "y", "-heads").format(tree));
    }
}
