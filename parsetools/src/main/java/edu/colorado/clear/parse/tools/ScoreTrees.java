package edu.colorado.clear.parse.tools;

import java.io.File;
import java.io.PrintStream;
import java.util.List;
import java.util.Properties;
import java.util.logging.Logger;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

import edu.colorado.clear.parse.eval.EvalB;
import edu.colorado.clear.parse.tree.ParseTree;
import edu.colorado.clear.parse.tree.TreeTransformer;
import edu.colorado.clear.parse.tree.TreeUtil;
import edu.colorado.clear.parse.util.PropertyUtil;

/**
 * Labeled bracket scoring of system parses against gold parses. Trees are
 * paired by position in the two files.
 */
public class ScoreTrees {

    private static Logger logger = Logger.getLogger(ScoreTrees.class.getPackage().getName());

    /** applied to both sides unless configured otherwise */
    public static final String DEFAULT_TRANSFORMS = "annotation,empty";

    @Option(name="-gold",usage="gold treebank file",required=true)
    private File goldFile = null;

    @Option(name="-sys",usage="system output treebank file",required=true)
    private File sysFile = null;

    @Option(name="-transforms",usage="comma separated transforms applied before scoring (default "+DEFAULT_TRANSFORMS+", overwrites config)")
    private String transforms = null;

    @Option(name="-config",usage="properties file")
    private File configFile = null;

    @Option(name="-v",usage="print the score of each tree")
    private boolean verbose = false;

    @Option(name="-h",usage="help message")
    private boolean help = false;

    /**
     * Scores the system trees against the gold trees, pairwise.
     * @param out where per-tree scores go if verbose, may be null
     */
    static EvalB score(List<ParseTree> sysTrees, List<ParseTree> goldTrees, List<TreeTransformer> transformers, PrintStream out) {
        if (sysTrees.size()!=goldTrees.size())
            logger.warning("system has "+sysTrees.size()+" trees, gold has "+goldTrees.size()+", scoring the first "+Math.min(sysTrees.size(), goldTrees.size()));

        EvalB total = new EvalB();
        for (int i=0; i<Math.min(sysTrees.size(), goldTrees.size()); ++i) {
            ParseTree sys = sysTrees.get(i);
            ParseTree gold = goldTrees.get(i);
            TreeUtil.transform(sys, transformers);
            TreeUtil.transform(gold, transformers);

            total.addTree(sys, gold);
            if (out!=null) {
                EvalB single = new EvalB();
                single.addTree(sys, gold);
                out.printf("%5d  %6.2f %6.2f %5d %5d %5d %5d%n", i+1, single.labeledRecall()*100, single.labeledPrecision()*100,
                        single.matched(), single.goldTotal(), single.proposedTotal(), single.crossing());
            }
        }
        return total;
    }

    void run() throws Exception {
        Properties props = configFile==null?new Properties():PropertyUtil.load(configFile.getPath());
        props = PropertyUtil.filterProperties(props, "score.", true);
        if (transforms!=null)
            props.setProperty("transforms", transforms);

        List<TreeTransformer> transformers = TreeUtil.getTransformers(props.getProperty("transforms", DEFAULT_TRANSFORMS));

        logger.info("Reading "+goldFile.getPath());
        List<ParseTree> goldTrees = TreeUtil.extractTrees(goldFile.getPath());
        logger.info("Reading "+sysFile.getPath());
        List<ParseTree> sysTrees = TreeUtil.extractTrees(sysFile.getPath());

        EvalB score = score(sysTrees, goldTrees, transformers, verbose?System.out:null);
        System.out.print(score);
    }

    public static void main(String[] args) throws Exception {
        ScoreTrees options = new ScoreTrees();
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
