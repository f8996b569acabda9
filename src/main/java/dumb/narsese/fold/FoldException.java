package dumb.narsese.fold;

import dumb.narsese.NarseseException;

/**
 * Well-formed lexical input that does not fit the closed vocabulary or its invariants.
 */
public class FoldException extends NarseseException {
    private final Constraint constraint;
    private final String token;
    private final String path;

    public FoldException(Constraint constraint, String token, String path, String detail) {
        super(detail);
        this.constraint = constraint;
        this.token = token;
        this.path = path;
    }

    public Constraint constraint() {
        return constraint;
    }

    /** The offending string exactly as it appeared in the lexical value. */
    public String token() {
        return token;
    }

    /**
     * Where in the value the failure happened, as slash separated steps from the root,
     * such as {@code term/0/1} or {@code truth/confidence}.
     */
    public String path() {
        return path;
    }

    @Override
    public String getMessage() {
        return constraint + " at " + path + " ('" + token + "'): " + super.getMessage();
    }

    public enum Constraint {
        UNKNOWN_PREFIX,
        UNKNOWN_CONNECTOR,
        UNKNOWN_COPULA,
        UNKNOWN_PUNCTUATION,
        UNKNOWN_STAMP,
        /** Atom name missing, superfluous, or not readable back as one atom. */
        CONTENT,
        ARITY,
        PLACEHOLDER,
        RANGE,
        NUMBER_FORMAT,
        TRUTH_NOT_ALLOWED
    }
}
