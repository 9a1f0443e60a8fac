package edu.colorado.clear.parse.tree;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.StringTokenizer;
import java.util.logging.Logger;
import java.util.zip.GZIPInputStream;

/**
 * Reads Penn Treebank style bracketed trees one at a time.
 * <ul>
 * <li><code>(NN dog)</code> is a leaf,</li>
 * <li><code>(-NONE-)</code> is a leaf without a word,</li>
 * <li><code>(NP (DT the) (NN dog))</code> is a constituent,</li>
 * <li>a label-less outer bracket around a single tree, <code>( (S ...) )</code>,
 * is dropped; around several it becomes {@value #DEFAULT_ROOT}.</li>
 * <li>a constituent labeled with a trailing {@value Binarizer#TEMPORARY_MARKER},
 * as written out by {@link Binarizer}, is read as a temporary node.</li>
 * </ul>
 * Malformed input is reported with a {@link ParseException}, nothing is
 * skipped.
 *
 * @author shumin
 */
public class TreeFileReader implements Closeable
{
    private static Logger logger = Logger.getLogger(TreeFileReader.class.getPackage().getName());

    public static final String DEFAULT_ROOT = "FRAG";

    static final String LRB = "(";
    static final String RRB = ")";

    BufferedReader reader;
    String         fileName;
    Deque<String>  tokenQueue;
    Deque<Boolean> spaceQueue;
    boolean        spaced;
    int            lineNumber;
    int            treeCount;
    boolean        closed;

    // a bracket being read
    static final class Frame {
        String     label;
        boolean    spacedLabel;
        String     word;
        List<Node> children = new ArrayList<Node>();
    }

    /**
     * Opens a treebank file, gzip compressed if the name ends with .gz.
     * @param fileName name of the treebank file
     * @throws IOException
     */
    public TreeFileReader(String fileName) throws IOException {
        this(new InputStreamReader(open(new File(fileName)), StandardCharsets.UTF_8), fileName);
    }

    public TreeFileReader(String dirName, String fileName) throws IOException {
        this(new InputStreamReader(open(new File(dirName, fileName)), StandardCharsets.UTF_8), fileName);
    }

    public TreeFileReader(Reader reader) {
        this(reader, null);
    }

    public TreeFileReader(Reader reader, String fileName) {
        this.reader   = new BufferedReader(reader);
        this.fileName = fileName;
        tokenQueue    = new ArrayDeque<String>();
        spaceQueue    = new ArrayDeque<Boolean>();
        lineNumber    = 0;
        treeCount     = 0;
        closed        = false;
    }

    static InputStream open(File file) throws IOException {
        InputStream in = new FileInputStream(file);
        return file.getName().endsWith(".gz")?new GZIPInputStream(in):in;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * Returns the next tree, or null if there is none.
     * @throws ParseException if the tree is malformed
     * @throws IOException
     */
    public ParseTree nextTree() throws ParseException, IOException
    {
        String str = nextToken();
        if (str == null) {
            logger.fine("Read "+treeCount+" trees, done.");
            return null;
        }
        if (!str.equals(LRB))
            throw error("expected '"+LRB+"' but found \""+str+"\"");
        logger.fine("Reading tree "+treeCount);

        Deque<Frame> stack = new ArrayDeque<Frame>();
        stack.push(new Frame());

        for (;;) {
            if ((str = nextToken()) == null)
                throw error("more tokens needed");

            Frame curr = stack.peek();
            if (str.equals(LRB)) {
                if (curr.word != null)
                    throw error("constituent following word \""+curr.word+"\" in ("+curr.label+")");
                if (curr.label == null && stack.size() > 1)
                    throw error("label is missing");
                stack.push(new Frame());
            } else if (str.equals(RRB)) {
                stack.pop();
                Node node = makeNode(curr, stack.isEmpty());
                if (stack.isEmpty()) {
                    ++treeCount;
                    return new ParseTree(node, false);
                }
                stack.peek().children.add(node);
            } else if (curr.label == null && curr.children.isEmpty()) {
                curr.label = str;
                curr.spacedLabel = spaced;
            } else if (!curr.children.isEmpty()) {
                throw error("word \""+str+"\" following constituents in ("+curr.label+")");
            } else if (curr.word != null) {
                throw error("more than one word in ("+curr.label+" "+curr.word+" "+str+")");
            } else {
                curr.word = str;
            }
        }
    }

    Node makeNode(Frame frame, boolean outermost) throws ParseException {
        if (frame.children.isEmpty()) {
            if (frame.label == null)
                throw error("empty brackets");
            // ( dog ): the first token isn't a label
            if (outermost && frame.spacedLabel)
                throw error("\""+frame.label+"\" outside of a constituent");
            return new LeafNode(frame.label, frame.word);
        }
        if (frame.label == null) {
            if (!outermost)
                throw error("label is missing");
            // omit the dummy root
            if (frame.children.size()==1)
                return frame.children.get(0);
            return new InternalNode(DEFAULT_ROOT, frame.children, false);
        }
        return new InternalNode(frame.label, frame.children, Binarizer.isTemporaryLabel(frame.label));
    }

    ParseException error(String message) {
        return new ParseException(fileName, treeCount, lineNumber, message);
    }

    @Override
    public void close() throws IOException
    {
        if (!closed)
        {
            reader.close();
            closed = true;
        }
    }

    public boolean isOpen()
    {
        return !closed;
    }

    private String nextToken() throws IOException
    {
        while (tokenQueue.isEmpty()) {
            if (closed)
                return null;

            String line = reader.readLine();
            if (line == null) {
                close();
                return null;
            }
            ++lineNumber;

            // a line break counts as white space
            boolean space = true;
            StringTokenizer tok = new StringTokenizer(line, "() \t\n\r\f", true);
            String str;
            while (tok.hasMoreTokens()) {
                str = tok.nextToken().trim();
                if (str.isEmpty()) {
                    space = true;
                } else {
                    tokenQueue.add(str);
                    spaceQueue.add(space);
                    space = false;
                }
            }
        }
        spaced = spaceQueue.pop();
        return tokenQueue.pop();
    }
}
