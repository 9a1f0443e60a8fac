package edu.colorado.clear.parse.tree;

/**
 * Malformed bracketed tree. Carries where the problem was found.
 */
public class ParseException extends Exception {

    private static final long serialVersionUID = -2587096383311738150L;

    String fileName;
    int    treeIndex;
    int    lineNumber;

    public ParseException(String fileName, int treeIndex, int lineNumber, String message) {
        super((fileName==null?"<input>":fileName)+", tree "+treeIndex+", line "+lineNumber+": "+message);
        this.fileName = fileName;
        this.treeIndex = treeIndex;
        this.lineNumber = lineNumber;
    }

    /** Returns the file being read, or null when reading from a stream. */
    public String getFileName() {
        return fileName;
    }

    /** Returns the 0-based index of the tree being read. */
    public int getTreeIndex() {
        return treeIndex;
    }

    /** Returns the 1-based line number. */
    public int getLineNumber() {
        return lineNumber;
    }
}
