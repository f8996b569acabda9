package dumb.narsese.term;

/**
 * Kinds of atomic term in the closed vocabulary.
 */
public enum AtomKind {
    WORD,
    /** Marks the relation slot of an image; has no name. */
    PLACEHOLDER,
    VARIABLE_INDEPENDENT,
    VARIABLE_DEPENDENT,
    VARIABLE_QUERY,
    /** Name is a non-negative decimal integer. */
    INTERVAL,
    OPERATOR;

    public boolean isVariable() {
        return this == VARIABLE_INDEPENDENT || this == VARIABLE_DEPENDENT || this == VARIABLE_QUERY;
    }
}
