package dumb.narsese;

import dumb.narsese.fold.FoldException;
import dumb.narsese.lexical.LexicalTerm;
import dumb.narsese.term.Term;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Operations common to {@link LexicalTerm} and {@link Term}, so that printers, walkers and
 * comparisons can be written once for both models.
 *
 * @param <T> the model's own term type
 */
public interface Termlike<T extends Termlike<T>> {

    TermCategory category();

    TermCapacity capacity();

    /** Number of immediate components; zero for atoms. */
    int size();

    /**
     * @throws IndexOutOfBoundsException if {@code index} is not in {@code [0, size())}
     */
    T sub(int index);

    default List<T> subs() {
        var s = size();
        var list = new ArrayList<T>(s);
        for (var i = 0; i < s; i++) list.add(sub(i));
        return List.copyOf(list);
    }

    /** This term followed by all its descendants, depth first. */
    default Stream<T> walk() {
        @SuppressWarnings("unchecked") var self = (T) this;
        return Stream.concat(Stream.of(self), subs().stream().flatMap(Termlike::walk));
    }

    default boolean isAtom() {
        return category() == TermCategory.ATOM;
    }

    default boolean isCompound() {
        return category() == TermCategory.COMPOUND;
    }

    default boolean isStatement() {
        return category() == TermCategory.STATEMENT;
    }

    /** ASCII Narsese text; parsing it back yields an equal value. */
    String narsese();

    /** Folds into the closed vocabulary of the semantic model. */
    Term narrow() throws FoldException;

    /** The lexical form of this term. Never fails and loses nothing. */
    LexicalTerm widen();
}
