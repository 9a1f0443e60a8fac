package edu.colorado.clear.parse.tools;

import java.io.File;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.logging.Logger;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

import edu.colorado.clear.parse.tree.HeadFinder;
import edu.colorado.clear.parse.tree.HeadRules;
import edu.colorado.clear.parse.tree.InternalNode;
import edu.colorado.clear.parse.tree.LeafNode;
import edu.colorado.clear.parse.tree.Node;
import edu.colorado.clear.parse.tree.ParseTree;
import edu.colorado.clear.parse.tree.TreeTransformer;
import edu.colorado.clear.parse.tree.TreeUtil;
import edu.colorado.clear.parse.tree.Visitor;
import edu.colorado.clear.parse.util.PropertyUtil;

/**
 * Applies a sequence of tree transforms to treebank files and writes the
 * result, one tree per line (or indented with -pretty).
 */
public class NormalizeTrees {

    private static Logger logger = Logger.getLogger(NormalizeTrees.class.getPackage().getName());

    @Option(name="-in",usage="input treebank file or directory",required=true)
    private File treeDir = null;

    @Option(name="-regex",usage="regular expression matching the files (default .*\\.(parse|mrg)(\\.gz)?)")
    private String regex = ".*\\.(parse|mrg)(\\.gz)?";

    @Option(name="-out",usage="output file",required=true)
    private File outFile = null;

    @Option(name="-transforms",usage="comma separated transforms: annotation,empty,unary,binarize,debinarize (overwrites config)")
    private String transforms = null;

    @Option(name="-config",usage="properties file")
    private File configFile = null;

    @Option(name="-pretty",usage="indented output")
    private boolean pretty = false;

    @Option(name="-heads",usage="print the head word of each constituent")
    private boolean heads = false;

    @Option(name="-h",usage="help message")
    private boolean help = false;

    // prints constituents as (NP[dog] ...)
    static class HeadPrinter implements Visitor<Void> {
        StringBuilder str = new StringBuilder();

        @Override
        public Void visit(LeafNode node) {
            str.append('(').append(node.category());
            if (node.hasWord())
                str.append(' ').append(node.word());
            str.append(')');
            return null;
        }

        @Override
        public Void visit(InternalNode node) {
            str.append('(').append(node.category());
            if (node.headLexicon()!=null && node.headLexicon().hasWord())
                str.append('[').append(node.headLexicon().word()).append(']');
            for (Node child:node.children()) {
                str.append(' ');
                child.accept(this);
            }
            str.append(')');
            return null;
        }
    }

    Properties loadConfig() throws Exception {
        Properties props = configFile==null?new Properties():PropertyUtil.load(configFile.getPath());
        props = PropertyUtil.filterProperties(props, "normalize.", true);
        if (transforms!=null)
            props.setProperty("transforms", transforms);
        return props;
    }

    String format(ParseTree tree) {
        if (heads) {
            HeadPrinter printer = new HeadPrinter();
            tree.visit(printer);
            return printer.str.toString();
        }
        return pretty?tree.toPrettyString():tree.toString();
    }

    void run() throws Exception {
        Properties props = loadConfig();
        logger.fine(PropertyUtil.toString(props));

        List<TreeTransformer> transformers = TreeUtil.getTransformers(props.getProperty("transforms"));
        HeadFinder headFinder = null;
        if (heads)
            headFinder = props.getProperty("headrules")==null?new HeadFinder():new HeadFinder(new HeadRules(props.getProperty("headrules")));

        Map<String, List<ParseTree>> treeMap = TreeUtil.readTreeDir(treeDir.getPath(), regex);

        int count = 0;
        try (PrintWriter writer = new PrintWriter(new OutputStreamWriter(new FileOutputStream(outFile), StandardCharsets.UTF_8))) {
            for (Map.Entry<String, List<ParseTree>> entry:treeMap.entrySet()) {
                logger.info("Normalizing "+entry.getKey());
                for (ParseTree tree:entry.getValue()) {
                    TreeUtil.transform(tree, transformers);
                    if (headFinder!=null)
                        tree.visit(headFinder);
                    writer.println(format(tree));
                    ++count;
                }
            }
        }
        logger.info("wrote "+count+" trees to "+outFile.getPath());
    }

    public static void main(String[] args) throws Exception {
        NormalizeTrees options = new NormalizeTrees();
        CmdLineParser cmdParser = new CmdLineParser(options);

        try {
            cmdParser.parseArgument(args);
        } catch (CmdLineException e) {
            System.err.println("invalid options:"+e);
            cmdParser.printUsage(System.err);
            System.exit(0);
        }
        if (options.help) {
            cmdParser.printUsage(System.err);
            System.exit(0);
        }

        options.run();
    }
}
