package dumb.narsese.lexical;

import dumb.narsese.TermCapacity;
import dumb.narsese.TermCategory;
import dumb.narsese.Termlike;
import dumb.narsese.fold.FoldException;
import dumb.narsese.fold.Folder;
import dumb.narsese.fold.Vocabulary;
import dumb.narsese.term.Term;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Untyped term tree. Prefixes, connectors, brackets and copulas are kept as the strings that
 * appeared in the text; nothing here checks them against a vocabulary.
 */
public sealed interface LexicalTerm extends Termlike<LexicalTerm>, LexicalNarsese
        permits LexicalTerm.Atom, LexicalTerm.Compound, LexicalTerm.Set, LexicalTerm.Statement {

    static Atom atom(String content) {
        return new Atom("", content);
    }

    static Atom atom(String prefix, String content) {
        return new Atom(prefix, content);
    }

    static Atom placeholder() {
        return new Atom("_", "");
    }

    static Compound compound(String connector, LexicalTerm... terms) {
        return new Compound(connector, List.of(terms));
    }

    static Set set(String opening, String closing, LexicalTerm... terms) {
        return new Set(opening, closing, List.of(terms));
    }

    static Statement statement(LexicalTerm subject, String copula, LexicalTerm predicate) {
        return new Statement(copula, subject, predicate);
    }

    @Override
    default LexicalTerm term() {
        return this;
    }

    @Override
    default Term narrow() throws FoldException {
        return Folder.foldTerm(this);
    }

    @Override
    default LexicalTerm widen() {
        return this;
    }

    @Override
    default String narsese() {
        return Vocabulary.ASCII.render(this);
    }

    /**
     * A leaf. Placeholders have an underscore-only prefix and empty content.
     */
    record Atom(String prefix, String content) implements LexicalTerm {
        public Atom {
            requireNonNull(prefix);
            requireNonNull(content);
        }

        /** Whether this is an ASCII placeholder, a run of underscores. */
        public boolean isPlaceholder() {
            return Vocabulary.ASCII.isPlaceholder(this);
        }

        @Override
        public TermCategory category() {
            return TermCategory.ATOM;
        }

        @Override
        public TermCapacity capacity() {
            return TermCapacity.ATOM;
        }

        @Override
        public int size() {
            return 0;
        }

        @Override
        public LexicalTerm sub(int index) {
            throw new IndexOutOfBoundsException("atom " + narsese() + " has no components");
        }

    }

    /**
     * {@code (connector, t1, ..., tn)}.
     */
    record Compound(String connector, List<LexicalTerm> terms) implements LexicalTerm {
        public Compound {
            requireNonNull(connector);
            terms = List.copyOf(terms);
        }

        @Override
        public TermCategory category() {
            return TermCategory.COMPOUND;
        }

        @Override
        public TermCapacity capacity() {
            return TermCapacity.VEC;
        }

        @Override
        public int size() {
            return terms.size();
        }

        @Override
        public LexicalTerm sub(int index) {
            return terms.get(index);
        }
    }

    /**
     * Bracketed collection such as {@code {a, b}} or {@code [a, b]}. Member order is the order
     * in the text; duplicates are kept.
     */
    record Set(String opening, String closing, List<LexicalTerm> terms) implements LexicalTerm {
        public Set {
            requireNonNull(opening);
            requireNonNull(closing);
            terms = List.copyOf(terms);
        }

        public String brackets() {
            return opening + closing;
        }

        @Override
        public TermCategory category() {
            return TermCategory.COMPOUND;
        }

        @Override
        public TermCapacity capacity() {
            return TermCapacity.VEC;
        }

        @Override
        public int size() {
            return terms.size();
        }

        @Override
        public LexicalTerm sub(int index) {
            return terms.get(index);
        }
    }

    /**
     * {@code <subject copula predicate>}.
     */
    record Statement(String copula, LexicalTerm subject, LexicalTerm predicate) implements LexicalTerm {
        public Statement {
            requireNonNull(copula);
            requireNonNull(subject);
            requireNonNull(predicate);
        }

        @Override
        public TermCategory category() {
            return TermCategory.STATEMENT;
        }

        @Override
        public TermCapacity capacity() {
            return TermCapacity.BINARY_VEC;
        }

        @Override
        public int size() {
            return 2;
        }

        @Override
        public LexicalTerm sub(int index) {
            return switch (index) {
                case 0 -> subject;
                case 1 -> predicate;
                default -> throw new IndexOutOfBoundsException("statement has 2 components, not " + (index + 1));
            };
        }
    }
}
