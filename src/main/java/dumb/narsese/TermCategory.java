package dumb.narsese;

/**
 * Coarse classification shared by the lexical and the semantic term models.
 * Sets count as compounds.
 */
public enum TermCategory {
    ATOM, COMPOUND, STATEMENT
}
