package dumb.narsese.term;

public enum Punctuation {
    JUDGMENT(true),
    GOAL(true),
    QUESTION(false),
    QUEST(false);

    /** Whether sentences with this punctuation may carry a truth value. */
    public final boolean truthful;

    Punctuation(boolean truthful) {
        this.truthful = truthful;
    }
}
