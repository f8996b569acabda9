package dumb.narsese.term;

/**
 * When a sentence holds. Only {@link Kind#FIXED} stamps carry a time.
 */
public record Stamp(Kind kind, long time) {
    public static final Stamp ETERNAL = new Stamp(Kind.ETERNAL, 0);
    public static final Stamp PAST = new Stamp(Kind.PAST, 0);
    public static final Stamp PRESENT = new Stamp(Kind.PRESENT, 0);
    public static final Stamp FUTURE = new Stamp(Kind.FUTURE, 0);

    public Stamp {
        if (kind == null) throw new IllegalArgumentException("stamp kind is required");
        if (kind != Kind.FIXED && time != 0)
            throw new IllegalArgumentException(kind + " stamp cannot carry a time");
    }

    public static Stamp fixed(long time) {
        return new Stamp(Kind.FIXED, time);
    }

    public boolean isEternal() {
        return kind == Kind.ETERNAL;
    }

    public enum Kind {
        ETERNAL, PAST, PRESENT, FUTURE, FIXED
    }
}
