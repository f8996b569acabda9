package dumb.narsese;

import dumb.narsese.fold.FoldException;
import dumb.narsese.fold.Folder;
import dumb.narsese.fold.Vocabulary;
import dumb.narsese.lexical.LexicalNarsese;
import dumb.narsese.parse.NarseseParser;
import dumb.narsese.parse.ParseException;
import dumb.narsese.term.NarseseValue;
import dumb.narsese.term.Sentence;
import dumb.narsese.term.Task;
import dumb.narsese.term.Term;

/**
 * Entry points: text to lexical value, lexical to semantic value, and both at once.
 * <p>
 * {@link #term(String)}, {@link #sentence(String)} and {@link #task(String)} are for literals
 * written in code, where bad input is a programming error; they throw
 * {@link IllegalArgumentException} instead of checked exceptions.
 */
public final class Narsese {
    private Narsese() {}

    public static LexicalNarsese parse(CharSequence text) throws ParseException {
        return NarseseParser.parse(text);
    }

    public static NarseseValue fold(LexicalNarsese value) throws FoldException {
        return Folder.fold(value);
    }

    /** Folds a lexical value whose keywords are those of {@code vocabulary}. */
    public static NarseseValue fold(LexicalNarsese value, Vocabulary vocabulary) throws FoldException {
        return Folder.fold(value, vocabulary);
    }

    public static String render(NarseseValue value, Vocabulary vocabulary) {
        return value.narsese(vocabulary);
    }

    public static NarseseValue read(CharSequence text) throws NarseseException {
        return fold(parse(text));
    }

    public static Term term(String literal) {
        try {
            return Folder.foldTerm(NarseseParser.parseTerm(literal));
        } catch (NarseseException e) {
            throw malformed("term", literal, e);
        }
    }

    public static Sentence sentence(String literal) {
        try {
            return Folder.foldSentence(NarseseParser.parseSentence(literal));
        } catch (NarseseException e) {
            throw malformed("sentence", literal, e);
        }
    }

    public static Task task(String literal) {
        try {
            return Folder.foldTask(NarseseParser.parseTask(literal));
        } catch (NarseseException e) {
            throw malformed("task", literal, e);
        }
    }

    private static IllegalArgumentException malformed(String what, String literal, NarseseException e) {
        return new IllegalArgumentException("Malformed " + what + " literal '" + literal + "': " + e.getMessage(), e);
    }
}
