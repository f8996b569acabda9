package dumb.narsese;

/**
 * Algorithms written once against {@link Termlike}, usable with either model.
 */
public final class Termlikes {
    private Termlikes() {}

    /**
     * Same category and component count at every node, and atoms with the same text. Connector
     * and copula spellings are ignored, so a lexical term can be compared with a semantic one;
     * semantic images do not count their placeholder, so they never match their lexical form.
     */
    public static boolean structurallyEqual(Termlike<?> a, Termlike<?> b) {
        if (a.category() != b.category() || a.size() != b.size()) return false;
        if (a.isAtom()) return a.narsese().equals(b.narsese());
        for (var i = 0; i < a.size(); i++)
            if (!structurallyEqual(a.sub(i), b.sub(i))) return false;
        return true;
    }

    /** Whether both widen to the same lexical term, across models. */
    public static boolean equivalent(Termlike<?> a, Termlike<?> b) {
        return a.widen().equals(b.widen());
    }

    /** Nesting depth; atoms are 1. */
    public static int depth(Termlike<?> term) {
        var max = 0;
        for (var i = 0; i < term.size(); i++) max = Math.max(max, depth(term.sub(i)));
        return max + 1;
    }
}
