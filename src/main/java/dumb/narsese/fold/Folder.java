package dumb.narsese.fold;

import dumb.narsese.fold.FoldException.Constraint;
import dumb.narsese.lexical.LexicalNarsese;
import dumb.narsese.lexical.LexicalSentence;
import dumb.narsese.lexical.LexicalTask;
import dumb.narsese.lexical.LexicalTerm;
import dumb.narsese.term.AtomKind;
import dumb.narsese.term.Budget;
import dumb.narsese.term.Connector;
import dumb.narsese.term.Floats;
import dumb.narsese.term.NarseseValue;
import dumb.narsese.term.Sentence;
import dumb.narsese.term.Stamp;
import dumb.narsese.term.Task;
import dumb.narsese.term.Term;
import dumb.narsese.term.Truth;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Converts between the lexical and the semantic model.
 * <p>
 * Folding looks every prefix, connector, bracket pair, copula, punctuation and stamp up in a
 * {@link Vocabulary}, {@link Vocabulary#ASCII} unless another one is given, checks arities
 * before descending into components, and parses and
 * range-checks numeric tokens. The first violation ends the fold with a {@link FoldException}
 * naming the token and its path in the tree, such as {@code term/1/0} or
 * {@code truth/confidence}.
 * <p>
 * Widening is total: every semantic value has exactly one lexical form, and folding that form
 * gives back an equal value.
 */
public final class Folder {
    private static final Logger logger = LoggerFactory.getLogger(Folder.class);

    static final String TERM = "term";
    static final String PUNCTUATION = "punctuation";
    static final String STAMP = "stamp";
    static final String TRUTH = "truth";
    static final String BUDGET = "budget";

    private Folder() {}

    public static NarseseValue fold(LexicalNarsese value) throws FoldException {
        return fold(value, Vocabulary.ASCII);
    }

    public static NarseseValue fold(LexicalNarsese value, Vocabulary vocabulary) throws FoldException {
        if (value instanceof LexicalTerm t) return foldTerm(t, vocabulary);
        if (value instanceof LexicalSentence s) return foldSentence(s, vocabulary);
        return foldTask((LexicalTask) value, vocabulary);
    }

    public static Term foldTerm(LexicalTerm term) throws FoldException {
        return foldTerm(term, Vocabulary.ASCII);
    }

    public static Term foldTerm(LexicalTerm term, Vocabulary vocabulary) throws FoldException {
        return term(vocabulary, term, TERM);
    }

    public static Sentence foldSentence(LexicalSentence sentence) throws FoldException {
        return foldSentence(sentence, Vocabulary.ASCII);
    }

    public static Sentence foldSentence(LexicalSentence sentence, Vocabulary vocabulary) throws FoldException {
        var term = term(vocabulary, sentence.term(), TERM);

        var punctuation = vocabulary.punctuation(sentence.punctuation());
        if (punctuation == null)
            throw fail(Constraint.UNKNOWN_PUNCTUATION, sentence.punctuation(), PUNCTUATION, "no such punctuation");

        var stamp = stamp(vocabulary, sentence.stamp());

        var truth = Truth.EMPTY;
        if (sentence.truth() != null) {
            var values = numbers(sentence.truth(), Truth.FIELDS, TRUTH);
            if (!values.isEmpty() && !punctuation.truthful)
                throw fail(Constraint.TRUTH_NOT_ALLOWED, String.join(";", sentence.truth()), TRUTH,
                        punctuation + " cannot carry a truth value");
            truth = new Truth(values);
        }
        return new Sentence(term, punctuation, stamp, truth);
    }

    public static Task foldTask(LexicalTask task) throws FoldException {
        return foldTask(task, Vocabulary.ASCII);
    }

    public static Task foldTask(LexicalTask task, Vocabulary vocabulary) throws FoldException {
        var budget = new Budget(numbers(task.budget(), Budget.FIELDS, BUDGET));
        return new Task(budget, foldSentence(task.sentence(), vocabulary));
    }

    public static LexicalNarsese widen(NarseseValue value, Vocabulary vocabulary) {
        if (value instanceof Term t) return widenTerm(t, vocabulary);
        if (value instanceof Sentence s) return widenSentence(s, vocabulary);
        return widenTask((Task) value, vocabulary);
    }

    public static LexicalTerm widenTerm(Term term) {
        return widenTerm(term, Vocabulary.ASCII);
    }

    public static LexicalTerm widenTerm(Term term, Vocabulary vocabulary) {
        if (term instanceof Term.Atom a)
            return LexicalTerm.atom(vocabulary.symbol(a.kind()), a.name());
        if (term instanceof Term.Compound c) {
            var terms = new ArrayList<LexicalTerm>(c.size() + 1);
            for (var t : c.terms()) terms.add(widenTerm(t, vocabulary));
            var brackets = vocabulary.brackets(c.connector());
            if (brackets != null)
                return new LexicalTerm.Set(brackets.opening(), brackets.closing(), terms);
            if (c.connector().isImage())
                terms.add(c.placeholder(), LexicalTerm.atom(vocabulary.symbol(AtomKind.PLACEHOLDER), ""));
            return new LexicalTerm.Compound(vocabulary.symbol(c.connector()), terms);
        }
        var s = (Term.Statement) term;
        return new LexicalTerm.Statement(vocabulary.symbol(s.copula()),
                widenTerm(s.subject(), vocabulary), widenTerm(s.predicate(), vocabulary));
    }

    public static LexicalSentence widenSentence(Sentence sentence) {
        return widenSentence(sentence, Vocabulary.ASCII);
    }

    public static LexicalSentence widenSentence(Sentence sentence, Vocabulary vocabulary) {
        var stamp = switch (sentence.stamp().kind()) {
            case ETERNAL -> null;
            case FIXED -> vocabulary.stampFixed() + sentence.stamp().time();
            default -> vocabulary.symbol(sentence.stamp().kind());
        };
        var truth = sentence.truth().isEmpty() ? null : format(sentence.truth().values());
        return new LexicalSentence(widenTerm(sentence.term(), vocabulary), vocabulary.symbol(sentence.punctuation()), stamp, truth);
    }

    public static LexicalTask widenTask(Task task) {
        return widenTask(task, Vocabulary.ASCII);
    }

    public static LexicalTask widenTask(Task task, Vocabulary vocabulary) {
        return new LexicalTask(format(task.budget().values()), widenSentence(task.sentence(), vocabulary));
    }

    private static List<String> format(List<Double> values) {
        return values.stream().map(Floats::format).toList();
    }

    private static Term term(Vocabulary vocabulary, LexicalTerm term, String path) throws FoldException {
        if (term instanceof LexicalTerm.Atom a) return atom(vocabulary, a, path);
        if (term instanceof LexicalTerm.Set s) {
            var connector = vocabulary.set(s.brackets());
            if (connector == null)
                throw fail(Constraint.UNKNOWN_CONNECTOR, s.brackets(), path, "no such set brackets");
            return compound(vocabulary, connector, s.terms(), s.brackets(), path);
        }
        if (term instanceof LexicalTerm.Compound c) {
            var connector = vocabulary.connector(c.connector());
            if (connector == null)
                throw fail(Constraint.UNKNOWN_CONNECTOR, c.connector(), path, "no such connector");
            return compound(vocabulary, connector, c.terms(), c.connector(), path);
        }
        return statement(vocabulary, (LexicalTerm.Statement) term, path);
    }

    private static Term atom(Vocabulary vocabulary, LexicalTerm.Atom atom, String path) throws FoldException {
        if (vocabulary.isPlaceholder(atom)) return Term.placeholder();
        var token = atom.narsese();
        var kind = vocabulary.prefix(atom.prefix());
        if (kind == null)
            throw fail(Constraint.UNKNOWN_PREFIX, atom.prefix(), path, "no such atom prefix");
        if (kind == AtomKind.PLACEHOLDER)
            throw fail(Constraint.CONTENT, token, path, "placeholder takes no name");
        if (atom.content().isEmpty())
            throw fail(Constraint.CONTENT, token, path, kind + " needs a name");
        var constraint = kind == AtomKind.INTERVAL ? Constraint.NUMBER_FORMAT : Constraint.CONTENT;
        return build(() -> new Term.Atom(kind, atom.content()), constraint, token, path);
    }

    private static Term compound(Vocabulary vocabulary, Connector connector, List<LexicalTerm> members,
                                 String token, String path) throws FoldException {
        var arity = connector.arity;
        if (!arity.accepts(members.size()))
            throw fail(Constraint.ARITY, token, path,
                    connector + " takes " + arity.describe() + " components, got " + members.size());

        var placeholder = -1;
        if (connector.isImage()) {
            for (var i = 0; i < members.size(); i++) {
                if (!(members.get(i) instanceof LexicalTerm.Atom a) || !vocabulary.isPlaceholder(a)) continue;
                if (placeholder >= 0)
                    throw fail(Constraint.PLACEHOLDER, token, path + "/" + i, connector + " takes exactly one placeholder");
                placeholder = i;
            }
            if (placeholder < 0)
                throw fail(Constraint.PLACEHOLDER, token, path, connector + " needs a placeholder");
        }

        var terms = new ArrayList<Term>(members.size());
        for (var i = 0; i < members.size(); i++) {
            if (i == placeholder) continue;
            terms.add(term(vocabulary, members.get(i), path + "/" + i));
        }

        var index = placeholder;
        return build(() -> new Term.Compound(connector, terms, index), Constraint.ARITY, token, path);
    }

    private static Term statement(Vocabulary vocabulary, LexicalTerm.Statement statement, String path) throws FoldException {
        var symbol = statement.copula();
        var copula = vocabulary.copula(symbol);
        var derived = copula == null ? vocabulary.derivedCopula(symbol) : null;
        if (copula == null && derived == null)
            throw fail(Constraint.UNKNOWN_COPULA, symbol, path, "no such copula");

        var subject = term(vocabulary, statement.subject(), path + "/0");
        var predicate = term(vocabulary, statement.predicate(), path + "/1");
        return copula != null ? Term.statement(subject, copula, predicate) : derived.apply(subject, predicate);
    }

    private static Stamp stamp(Vocabulary vocabulary, @Nullable String stamp) throws FoldException {
        if (stamp == null) return Stamp.ETERNAL;
        var known = vocabulary.stamp(stamp);
        if (known != null) return known;
        var marker = vocabulary.stampFixed();
        if (stamp.startsWith(marker)) {
            var time = stamp.substring(marker.length());
            try {
                return Stamp.fixed(Long.parseLong(time));
            } catch (NumberFormatException e) {
                throw fail(Constraint.NUMBER_FORMAT, stamp, STAMP, "fixed stamp needs an integer time", e);
            }
        }
        throw fail(Constraint.UNKNOWN_STAMP, stamp, STAMP, "no such stamp");
    }

    /**
     * Parses numeric tokens into unit-interval values, one per field name.
     */
    private static List<Double> numbers(List<String> tokens, List<String> fields, String path) throws FoldException {
        if (tokens.size() > fields.size())
            throw fail(Constraint.ARITY, String.join(";", tokens), path,
                    path + " takes at most " + fields.size() + " values, got " + tokens.size());
        var values = new ArrayList<Double>(tokens.size());
        for (var i = 0; i < tokens.size(); i++) {
            var token = tokens.get(i);
            var field = fields.get(i);
            double value;
            try {
                value = Double.parseDouble(token);
            } catch (NumberFormatException e) {
                throw fail(Constraint.NUMBER_FORMAT, token, path + "/" + field, field + " is not a number", e);
            }
            if (Double.isNaN(value) || value < 0 || value > 1)
                throw fail(Constraint.RANGE, token, path + "/" + field, field + " must be within [0, 1]");
            values.add(value);
        }
        return values;
    }

    /** Runs a semantic constructor, reporting a rejected value as a fold failure. */
    private static Term build(Supplier<Term> constructor, Constraint constraint, String token, String path) throws FoldException {
        try {
            return constructor.get();
        } catch (IllegalArgumentException e) {
            throw fail(constraint, token, path, e.getMessage(), e);
        }
    }

    private static FoldException fail(Constraint constraint, String token, String path, String detail) {
        return fail(constraint, token, path, detail, null);
    }

    private static FoldException fail(Constraint constraint, String token, String path, String detail, @Nullable Throwable cause) {
        var e = new FoldException(constraint, token, path, detail);
        if (cause != null) e.initCause(cause);
        logger.debug("fold failure: {}", e.getMessage());
        return e;
    }
}
