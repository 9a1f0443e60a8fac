package edu.colorado.clear.parse.eval;

import java.io.Serializable;

/**
 * Labeled span of a constituent over leaf positions [start, end).
 */
public final class Bracket implements Serializable, Comparable<Bracket> {

    private static final long serialVersionUID = 3917286432063364570L;

    final String label;
    final int    start;
    final int    end;

    public Bracket(String label, int start, int end) {
        this.label = label;
        this.start = start;
        this.end = end;
    }

    public String getLabel() {
        return label;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    /**
     * Returns true if the spans overlap without one containing the other.
     */
    public boolean crosses(Bracket rhs) {
        return start<rhs.start && rhs.start<end && end<rhs.end ||
               rhs.start<start && start<rhs.end && rhs.end<end;
    }

    @Override
    public int compareTo(Bracket rhs) {
        if (start!=rhs.start) return start-rhs.start;
        if (end!=rhs.end) return rhs.end-end;
        return label.compareTo(rhs.label);
    }

    @Override
    public boolean equals(Object obj) {
        if (this==obj)
            return true;
        if (!(obj instanceof Bracket))
            return false;
        Bracket rhs = (Bracket)obj;
        return start==rhs.start && end==rhs.end && label.equals(rhs.label);
    }

    @Override
    public int hashCode() {
        return (label.hashCode()*31+start)*31+end;
    }

    @Override
    public String toString() {
        return label+"["+start+","+end+")";
    }
}
