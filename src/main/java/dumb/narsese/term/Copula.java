package dumb.narsese.term;

import dumb.narsese.TermCapacity;

/**
 * Statement relations. Symmetric copulas do not distinguish subject from predicate.
 */
public enum Copula {
    INHERITANCE(false, false),
    SIMILARITY(true, false),
    IMPLICATION(false, false),
    EQUIVALENCE(true, false),
    IMPLICATION_PREDICTIVE(false, true),
    IMPLICATION_CONCURRENT(false, true),
    IMPLICATION_RETROSPECTIVE(false, true),
    EQUIVALENCE_PREDICTIVE(false, true),
    EQUIVALENCE_CONCURRENT(true, true);

    public final boolean symmetric;
    public final boolean temporal;

    Copula(boolean symmetric, boolean temporal) {
        this.symmetric = symmetric;
        this.temporal = temporal;
    }

    public TermCapacity capacity() {
        return symmetric ? TermCapacity.BINARY_SET : TermCapacity.BINARY_VEC;
    }
}
