package edu.colorado.clear.parse.eval;

import gnu.trove.map.TObjectIntMap;
import gnu.trove.map.hash.TObjectIntHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

import edu.colorado.clear.parse.tree.InternalNode;
import edu.colorado.clear.parse.tree.LeafNode;
import edu.colorado.clear.parse.tree.Node;
import edu.colorado.clear.parse.tree.ParseTree;
import edu.colorado.clear.parse.tree.Visitor;

/**
 * Labeled bracket scoring in the manner of evalb.
 * <p>
 * Every constituent (internal node) of a tree is a bracket, the root and
 * single-child constituents included; leaves are not. Brackets are matched
 * as multisets: a bracket occurring twice in both trees counts as two
 * matches. A pair where every bracket matches is a complete match, so two
 * trees without any brackets (a single leaf each) count as {@link #perfect()}
 * while adding nothing to precision or recall. Trees are scored as given, normalize them (e.g. with
 * {@link edu.colorado.clear.parse.tree.AnnotationRemover} and
 * {@link edu.colorado.clear.parse.tree.EmptyRemover}) beforehand.
 * <p>
 * Counts accumulate over all tree pairs added; use a new instance to start
 * over.
 *
 * @author shumin
 */
public class EvalB {

    private static Logger logger = Logger.getLogger(EvalB.class.getPackage().getName());

    long matched;
    long proposedTotal;
    long goldTotal;
    long perfect;
    long treeCount;
    long crossing;
    long zeroCrossing;

    static final class BracketFinder implements Visitor<Void> {
        int position = 0;
        List<Bracket> brackets = new ArrayList<Bracket>();

        @Override
        public Void visit(LeafNode node) {
            ++position;
            return null;
        }

        @Override
        public Void visit(InternalNode node) {
            int start = position;
            for (Node child:node.children())
                child.accept(this);
            brackets.add(new Bracket(node.category(), start, position));
            return null;
        }
    }

    /**
     * Returns the brackets of the tree, sorted by start position, longer
     * spans first.
     */
    public static List<Bracket> getBrackets(ParseTree tree) {
        return find(tree).brackets;
    }

    static BracketFinder find(ParseTree tree) {
        BracketFinder finder = new BracketFinder();
        tree.visit(finder);
        Collections.sort(finder.brackets);
        return finder;
    }

    /**
     * Scores a system tree against its gold tree and adds the counts.
     */
    public void addTree(ParseTree proposed, ParseTree gold) {
        BracketFinder propFinder = find(proposed);
        BracketFinder goldFinder = find(gold);
        List<Bracket> propBrackets = propFinder.brackets;
        List<Bracket> goldBrackets = goldFinder.brackets;

        if (propFinder.position!=goldFinder.position)
            logger.warning("length mismatch at tree "+treeCount+": "+propFinder.position+" vs "+goldFinder.position);

        TObjectIntMap<Bracket> goldCounts = new TObjectIntHashMap<Bracket>();
        for (Bracket bracket:goldBrackets)
            goldCounts.adjustOrPutValue(bracket, 1, 1);

        int treeMatched = 0;
        int treeCrossing = 0;
        for (Bracket bracket:propBrackets) {
            if (goldCounts.get(bracket)>0) {
                goldCounts.adjustValue(bracket, -1);
                ++treeMatched;
            }
            for (Bracket goldBracket:goldBrackets)
                if (bracket.crosses(goldBracket)) {
                    ++treeCrossing;
                    break;
                }
        }

        matched += treeMatched;
        proposedTotal += propBrackets.size();
        goldTotal += goldBrackets.size();
        if (treeMatched==propBrackets.size() && treeMatched==goldBrackets.size())
            ++perfect;
        crossing += treeCrossing;
        if (treeCrossing==0)
            ++zeroCrossing;
        ++treeCount;

        logger.fine(String.format("tree %d: matched %d, proposed %d, gold %d, crossing %d",
                treeCount, treeMatched, propBrackets.size(), goldBrackets.size(), treeCrossing));
    }

    public long matched() {
        return matched;
    }

    public long proposedTotal() {
        return proposedTotal;
    }

    public long goldTotal() {
        return goldTotal;
    }

    /** Number of tree pairs whose brackets all matched. */
    public long perfect() {
        return perfect;
    }

    public long treeCount() {
        return treeCount;
    }

    /** Total number of proposed brackets crossing a gold bracket. */
    public long crossing() {
        return crossing;
    }

    /** Number of tree pairs without crossing brackets. */
    public long zeroCrossing() {
        return zeroCrossing;
    }

    public double averageCrossing() {
        return treeCount==0?0:(double)crossing/treeCount;
    }

    /** matched / proposed, 0 if nothing was proposed */
    public double labeledPrecision() {
        return proposedTotal==0?0:(double)matched/proposedTotal;
    }

    /** matched / gold, 0 if there was nothing to find */
    public double labeledRecall() {
        return goldTotal==0?0:(double)matched/goldTotal;
    }

    public double labeledF1() {
        double p = labeledPrecision();
        double r = labeledRecall();
        return p+r==0?0:2*p*r/(p+r);
    }

    @Override
    public String toString() {
        StringBuilder str = new StringBuilder();
        str.append(String.format("Number of sentence        = %6d%n", treeCount));
        str.append(String.format("Bracketing Recall         = %6.2f%n", labeledRecall()*100));
        str.append(String.format("Bracketing Precision      = %6.2f%n", labeledPrecision()*100));
        str.append(String.format("Bracketing FMeasure       = %6.2f%n", labeledF1()*100));
        str.append(String.format("Complete match            = %6.2f%n", treeCount==0?0:perfect*100.0/treeCount));
        str.append(String.format("Average crossing          = %6.2f%n", averageCrossing()));
        str.append(String.format("No crossing               = %6.2f%n", treeCount==0?0:zeroCrossing*100.0/treeCount));
        return str.toString();
    }
}
