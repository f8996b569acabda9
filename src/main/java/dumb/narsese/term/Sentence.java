package dumb.narsese.term;

import dumb.narsese.fold.Folder;
import dumb.narsese.lexical.LexicalSentence;

import static java.util.Objects.requireNonNull;

/**
 * A term with punctuation, stamp and truth. Questions and quests never carry truth components.
 */
public record Sentence(Term term, Punctuation punctuation, Stamp stamp, Truth truth) implements NarseseValue {

    public Sentence {
        requireNonNull(term);
        requireNonNull(punctuation);
        requireNonNull(stamp);
        requireNonNull(truth);
        if (!punctuation.truthful && !truth.isEmpty())
            throw new IllegalArgumentException(punctuation + " cannot carry a truth value");
    }

    public static Sentence judgment(Term term, Truth truth) {
        return new Sentence(term, Punctuation.JUDGMENT, Stamp.ETERNAL, truth);
    }

    public static Sentence goal(Term term, Truth truth) {
        return new Sentence(term, Punctuation.GOAL, Stamp.ETERNAL, truth);
    }

    public static Sentence question(Term term) {
        return new Sentence(term, Punctuation.QUESTION, Stamp.ETERNAL, Truth.EMPTY);
    }

    public static Sentence quest(Term term) {
        return new Sentence(term, Punctuation.QUEST, Stamp.ETERNAL, Truth.EMPTY);
    }

    public Sentence withStamp(Stamp stamp) {
        return new Sentence(term, punctuation, stamp, truth);
    }

    @Override
    public LexicalSentence widen() {
        return Folder.widenSentence(this);
    }

    @Override
    public String narsese() {
        return widen().narsese();
    }
}
