package dumb.narsese.term;

import dumb.narsese.TermCapacity;
import dumb.narsese.TermCategory;
import dumb.narsese.Termlike;
import dumb.narsese.fold.Folder;
import dumb.narsese.lexical.LexicalTerm;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Term in the closed Narsese vocabulary.
 * <p>
 * Instances can only be built in a valid state: names are checked, arities are enforced,
 * members of unordered compounds are deduplicated and sorted, and the operands of symmetric
 * statements are put in canonical order. Record equality is therefore term equality.
 * Ordering is by ASCII rendering.
 */
public sealed interface Term extends Termlike<Term>, NarseseValue, Comparable<Term>
        permits Term.Atom, Term.Compound, Term.Statement {

    Comparator<Term> CANONICAL = Comparator.comparing(Term::narsese);

    static Atom word(String name) {
        return new Atom(AtomKind.WORD, name);
    }

    static Atom placeholder() {
        return Atom.PLACEHOLDER;
    }

    static Atom independent(String name) {
        return new Atom(AtomKind.VARIABLE_INDEPENDENT, name);
    }

    static Atom dependent(String name) {
        return new Atom(AtomKind.VARIABLE_DEPENDENT, name);
    }

    static Atom query(String name) {
        return new Atom(AtomKind.VARIABLE_QUERY, name);
    }

    static Atom interval(long steps) {
        if (steps < 0) throw new IllegalArgumentException("interval must not be negative: " + steps);
        return new Atom(AtomKind.INTERVAL, Long.toString(steps));
    }

    static Atom operator(String name) {
        return new Atom(AtomKind.OPERATOR, name);
    }

    static Compound compound(Connector connector, List<Term> terms) {
        return new Compound(connector, terms, -1);
    }

    static Compound setExtension(Term... terms) {
        return compound(Connector.SET_EXTENSION, List.of(terms));
    }

    static Compound setIntension(Term... terms) {
        return compound(Connector.SET_INTENSION, List.of(terms));
    }

    static Compound intersectionExtension(Term... terms) {
        return compound(Connector.INTERSECTION_EXTENSION, List.of(terms));
    }

    static Compound intersectionIntension(Term... terms) {
        return compound(Connector.INTERSECTION_INTENSION, List.of(terms));
    }

    static Compound differenceExtension(Term left, Term right) {
        return compound(Connector.DIFFERENCE_EXTENSION, List.of(left, right));
    }

    static Compound differenceIntension(Term left, Term right) {
        return compound(Connector.DIFFERENCE_INTENSION, List.of(left, right));
    }

    static Compound product(Term... terms) {
        return compound(Connector.PRODUCT, List.of(terms));
    }

    /**
     * @param placeholder index of the relation slot among the full component list, so
     *                    {@code imageExtension(1, r, b)} is {@code (/, r, _, b)}
     */
    static Compound imageExtension(int placeholder, Term... terms) {
        return new Compound(Connector.IMAGE_EXTENSION, List.of(terms), placeholder);
    }

    static Compound imageIntension(int placeholder, Term... terms) {
        return new Compound(Connector.IMAGE_INTENSION, List.of(terms), placeholder);
    }

    static Compound conjunction(Term... terms) {
        return compound(Connector.CONJUNCTION, List.of(terms));
    }

    static Compound disjunction(Term... terms) {
        return compound(Connector.DISJUNCTION, List.of(terms));
    }

    static Compound negation(Term term) {
        return compound(Connector.NEGATION, List.of(term));
    }

    static Compound sequential(Term... terms) {
        return compound(Connector.CONJUNCTION_SEQUENTIAL, List.of(terms));
    }

    static Compound parallel(Term... terms) {
        return compound(Connector.CONJUNCTION_PARALLEL, List.of(terms));
    }

    static Statement statement(Term subject, Copula copula, Term predicate) {
        return new Statement(copula, subject, predicate);
    }

    static Statement inheritance(Term subject, Term predicate) {
        return statement(subject, Copula.INHERITANCE, predicate);
    }

    static Statement similarity(Term subject, Term predicate) {
        return statement(subject, Copula.SIMILARITY, predicate);
    }

    static Statement implication(Term subject, Term predicate) {
        return statement(subject, Copula.IMPLICATION, predicate);
    }

    static Statement equivalence(Term subject, Term predicate) {
        return statement(subject, Copula.EQUIVALENCE, predicate);
    }

    /** {@code <{S} --> P>} */
    static Statement instance(Term subject, Term predicate) {
        return inheritance(setExtension(subject), predicate);
    }

    /** {@code <S --> [P]>} */
    static Statement property(Term subject, Term predicate) {
        return inheritance(subject, setIntension(predicate));
    }

    /** {@code <{S} --> [P]>} */
    static Statement instanceProperty(Term subject, Term predicate) {
        return inheritance(setExtension(subject), setIntension(predicate));
    }

    /** Retrospective equivalence is predictive equivalence read backwards. */
    static Statement equivalenceRetrospective(Term subject, Term predicate) {
        return statement(predicate, Copula.EQUIVALENCE_PREDICTIVE, subject);
    }

    @Override
    default Term term() {
        return this;
    }

    @Override
    default Term narrow() {
        return this;
    }

    @Override
    default LexicalTerm widen() {
        return Folder.widenTerm(this);
    }

    @Override
    default String narsese() {
        return widen().narsese();
    }

    @Override
    default int compareTo(Term o) {
        return CANONICAL.compare(this, o);
    }

    /**
     * Named leaf. Interval names are the canonical decimal form of the interval.
     */
    record Atom(AtomKind kind, String name) implements Term {
        static final Atom PLACEHOLDER = new Atom(AtomKind.PLACEHOLDER, "");

        public Atom {
            requireNonNull(kind);
            requireNonNull(name);
            if (kind == AtomKind.PLACEHOLDER) {
                if (!name.isEmpty()) throw new IllegalArgumentException("placeholder has no name: " + name);
            } else if (kind == AtomKind.INTERVAL) {
                name = Long.toString(intervalValue(name));
            } else {
                checkName(name);
            }
        }

        public boolean isPlaceholder() {
            return kind == AtomKind.PLACEHOLDER;
        }

        public long interval() {
            if (kind != AtomKind.INTERVAL) throw new IllegalStateException(kind + " is not an interval");
            return Long.parseLong(name);
        }

        private static long intervalValue(String digits) {
            if (digits.isEmpty() || !digits.chars().allMatch(c -> c >= '0' && c <= '9'))
                throw new IllegalArgumentException("interval must be a non-negative integer: '" + digits + "'");
            try {
                return Long.parseLong(digits);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("interval out of range: " + digits, e);
            }
        }

        /**
         * Names must read back as a single atom: letters, digits, {@code _} and {@code -}, not
         * only underscores, never three hyphens in a row and never a trailing {@code --}: any
         * of those would read back as the start of a copula.
         */
        private static void checkName(String name) {
            if (name.isEmpty()) throw new IllegalArgumentException("atom name must not be empty");
            for (var i = 0; i < name.length(); i++) {
                var c = name.charAt(i);
                if (!Character.isLetterOrDigit(c) && c != '_' && c != '-')
                    throw new IllegalArgumentException("illegal character '" + c + "' in atom name: " + name);
            }
            if (name.chars().allMatch(c -> c == '_'))
                throw new IllegalArgumentException("atom name cannot consist of underscores only: " + name);
            if (name.contains("---"))
                throw new IllegalArgumentException("atom name cannot contain '---': " + name);
            if (name.endsWith("--"))
                throw new IllegalArgumentException("atom name cannot end with '--': " + name);
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
        public Term sub(int index) {
            throw new IndexOutOfBoundsException("atom " + narsese() + " has no components");
        }
    }

    /**
     * Connector with components.
     *
     * @param terms       components in order for ordered connectors, otherwise deduplicated and
     *                    sorted; never includes the image placeholder
     * @param placeholder for images, index of the placeholder among all components; -1 otherwise
     */
    record Compound(Connector connector, List<Term> terms, int placeholder) implements Term {
        public Compound {
            requireNonNull(connector);
            terms = List.copyOf(terms);
            if (connector.isImage()) {
                if (placeholder < 0 || placeholder > terms.size())
                    throw new IllegalArgumentException("placeholder index " + placeholder + " outside [0, " + terms.size() + "]");
                if (terms.stream().anyMatch(t -> t instanceof Atom a && a.isPlaceholder()))
                    throw new IllegalArgumentException(connector + " takes exactly one placeholder");
            } else if (placeholder != -1) {
                throw new IllegalArgumentException(connector + " has no placeholder");
            }
            if (!connector.ordered) terms = canonical(terms);
            var count = terms.size() + (connector.isImage() ? 1 : 0);
            if (!connector.arity.accepts(count))
                throw new IllegalArgumentException(connector + " takes " + connector.arity.describe() + " components, got " + count);
        }

        private static List<Term> canonical(List<Term> terms) {
            var members = new ArrayList<>(new LinkedHashSet<>(terms));
            members.sort(CANONICAL);
            return List.copyOf(members);
        }

        @Override
        public TermCategory category() {
            return TermCategory.COMPOUND;
        }

        @Override
        public TermCapacity capacity() {
            return connector.capacity();
        }

        @Override
        public int size() {
            return terms.size();
        }

        @Override
        public Term sub(int index) {
            return terms.get(index);
        }
    }

    /**
     * Subject, copula, predicate. For symmetric copulas the lesser operand is the subject.
     */
    record Statement(Copula copula, Term subject, Term predicate) implements Term {
        public Statement {
            requireNonNull(copula);
            requireNonNull(subject);
            requireNonNull(predicate);
            if (copula.symmetric && subject.compareTo(predicate) > 0) {
                var t = subject;
                subject = predicate;
                predicate = t;
            }
        }

        @Override
        public TermCategory category() {
            return TermCategory.STATEMENT;
        }

        @Override
        public TermCapacity capacity() {
            return copula.capacity();
        }

        @Override
        public int size() {
            return 2;
        }

        @Override
        public Term sub(int index) {
            return switch (index) {
                case 0 -> subject;
                case 1 -> predicate;
                default -> throw new IndexOutOfBoundsException("statement has 2 components, not " + (index + 1));
            };
        }
    }
}
