package edu.colorado.clear.parse.tree;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Logger;

import edu.colorado.clear.parse.util.FileUtil;

/**
 * Convenience methods for reading and normalizing trees.
 *
 * @author shumin
 */
public final class TreeUtil {

    private static Logger logger = Logger.getLogger(TreeUtil.class.getPackage().getName());

    private TreeUtil() {
    }

    /**
     * Reads all trees of a stream.
     * @throws ParseException at the first malformed tree
     */
    public static List<ParseTree> extractTrees(Reader reader) throws ParseException, IOException {
        return extractTrees(new TreeFileReader(reader));
    }

    /**
     * Reads all trees of a file.
     * @throws ParseException at the first malformed tree
     */
    public static List<ParseTree> extractTrees(String fileName) throws ParseException, IOException {
        return extractTrees(new TreeFileReader(fileName));
    }

    public static List<ParseTree> extractTrees(String dirName, String fileName) throws ParseException, IOException {
        return extractTrees(new TreeFileReader(dirName, fileName));
    }

    static List<ParseTree> extractTrees(TreeFileReader tbreader) throws ParseException, IOException {
        List<ParseTree> trees = new ArrayList<ParseTree>();
        try {
            ParseTree tree;
            while ((tree = tbreader.nextTree()) != null) {
                trees.add(tree);
                if (trees.size()%10000==0)
                    logger.info("reading tree "+trees.size());
            }
        } finally {
            tbreader.close();
        }
        return trees;
    }

    /**
     * Reads the first tree of a string.
     * @throws ParseException if the string is malformed or holds no tree
     */
    public static ParseTree readTree(String input) throws ParseException {
        try (TreeFileReader reader = new TreeFileReader(new StringReader(input))) {
            ParseTree tree = reader.nextTree();
            if (tree==null)
                throw new ParseException(null, 0, reader.lineNumber, "no tree found");
            return tree;
        } catch (IOException e) {
            // a string reader does not fail
            throw new IllegalStateException(e);
        }
    }

    /**
     * Reads every file under the directory whose name matches the regex.
     * @return trees keyed by file name relative to the directory
     */
    public static Map<String, List<ParseTree>> readTreeDir(String dirName, String regex) throws ParseException, IOException {
        File dir = new File(dirName);
        Map<String, List<ParseTree>> treeMap = new TreeMap<String, List<ParseTree>>();
        if (!dir.isDirectory()) {
            treeMap.put(dir.getName(), extractTrees(dirName));
            return treeMap;
        }
        for (String treeFile: FileUtil.getFiles(dir, regex)) {
            logger.info("Reading "+dirName+File.separatorChar+treeFile);
            treeMap.put(treeFile, extractTrees(dirName, treeFile));
        }
        return treeMap;
    }

    /**
     * Applies the transformers to the tree, in order.
     */
    public static void transform(ParseTree tree, List<? extends TreeTransformer> transformers) {
        for (TreeTransformer transformer:transformers)
            tree.transform(transformer);
    }

    /**
     * Creates a transformer from its short name: <code>annotation</code>,
     * <code>empty</code>, <code>unary</code>, <code>binarize</code> or
     * <code>debinarize</code>.
     */
    public static TreeTransformer getTransformer(String name) {
        switch (name.trim().toLowerCase()) {
        case "annotation": return new AnnotationRemover();
        case "empty":      return new EmptyRemover();
        case "unary":      return new UnaryChainRemover();
        case "binarize":   return new Binarizer();
        case "debinarize": return new Debinarizer();
        default:
            throw new IllegalArgumentException("unknown tree transform: "+name);
        }
    }

    /**
     * Parses a comma separated list of transformer names.
     * @see #getTransformer(String)
     */
    public static List<TreeTransformer> getTransformers(String names) {
        List<TreeTransformer> transformers = new ArrayList<TreeTransformer>();
        if (names==null)
            return transformers;
        for (String name:names.split(","))
            if (!name.trim().isEmpty())
                transformers.add(getTransformer(name));
        return transformers;
    }
}
