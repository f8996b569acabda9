package dumb.narsese.fold;

import dumb.narsese.lexical.LexicalNarsese;
import dumb.narsese.lexical.LexicalSentence;
import dumb.narsese.lexical.LexicalTask;
import dumb.narsese.lexical.LexicalTerm;
import dumb.narsese.term.AtomKind;
import dumb.narsese.term.Connector;
import dumb.narsese.term.Copula;
import dumb.narsese.term.Punctuation;
import dumb.narsese.term.Stamp;
import dumb.narsese.term.Term;
import org.jetbrains.annotations.Nullable;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BinaryOperator;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * A Narsese format: exact strings for every prefix, connector, set bracket pair, copula,
 * punctuation and stamp marker, in both directions, plus the brackets and spacing used to
 * write a lexical value out. Built once and never modified.
 * <p>
 * {@link #ASCII} is the format the parser reads. {@link #LATEX} and {@link #HAN} share its
 * structure with other keywords, and are used for rendering and for folding lexical trees
 * that carry their keywords.
 */
public final class Vocabulary {

    public static final Vocabulary ASCII = ascii();

    /** LaTeX math notation. */
    public static final Vocabulary LATEX = latex();

    /** 漢文: Chinese keywords and full-width brackets. */
    public static final Vocabulary HAN = han();

    private static final List<Vocabulary> ALL = List.of(ASCII, LATEX, HAN);

    /** An opening and a closing string around some content; both may be empty. */
    public record Brackets(String opening, String closing) {
        public Brackets {
            requireNonNull(opening);
            requireNonNull(closing);
        }

        public String wrap(String content) {
            return opening + content + closing;
        }
    }

    /**
     * How the pieces of a value are put together in text.
     *
     * @param termSpace written after every separator and around copulas
     * @param itemSpace written between the term, stamp, truth and budget of a sentence or task
     */
    public record Layout(Brackets compound, String separator, Brackets statement, String termSpace,
                         String itemSpace, Brackets stamp, Brackets truth, String truthSeparator,
                         Brackets budget, String budgetSeparator) {
    }

    public final String name;
    public final Layout layout;

    private final Map<String, AtomKind> prefixes = new LinkedHashMap<>();
    private final Map<String, Connector> connectors = new LinkedHashMap<>();
    private final Map<String, Connector> sets = new LinkedHashMap<>();
    private final Map<String, Copula> copulas = new LinkedHashMap<>();
    private final Map<String, BinaryOperator<Term>> derivedCopulas = new LinkedHashMap<>();
    private final Map<String, Punctuation> punctuations = new LinkedHashMap<>();
    private final Map<String, Stamp> stamps = new LinkedHashMap<>();
    private String stampFixed;

    private final Map<AtomKind, String> prefixOf = new EnumMap<>(AtomKind.class);
    private final Map<Connector, String> connectorOf = new EnumMap<>(Connector.class);
    private final Map<Connector, Brackets> setOf = new EnumMap<>(Connector.class);
    private final Map<Copula, String> copulaOf = new EnumMap<>(Copula.class);
    private final Map<Punctuation, String> punctuationOf = new EnumMap<>(Punctuation.class);
    private final Map<Stamp.Kind, String> stampOf = new EnumMap<>(Stamp.Kind.class);

    private Vocabulary(String name, Layout layout) {
        this.name = name;
        this.layout = layout;
    }

    private static Vocabulary ascii() {
        var v = new Vocabulary("ascii", new Layout(
                new Brackets("(", ")"), ",", new Brackets("<", ">"), " ", " ",
                new Brackets(":", ":"), new Brackets("%", "%"), ";", new Brackets("$", "$"), ";"));

        v.add("", AtomKind.WORD);
        v.add("_", AtomKind.PLACEHOLDER);
        v.add("$", AtomKind.VARIABLE_INDEPENDENT);
        v.add("#", AtomKind.VARIABLE_DEPENDENT);
        v.add("?", AtomKind.VARIABLE_QUERY);
        v.add("+", AtomKind.INTERVAL);
        v.add("^", AtomKind.OPERATOR);

        v.set(Connector.SET_EXTENSION, "{", "}");
        v.set(Connector.SET_INTENSION, "[", "]");
        v.add("&", Connector.INTERSECTION_EXTENSION);
        v.add("|", Connector.INTERSECTION_INTENSION);
        v.add("-", Connector.DIFFERENCE_EXTENSION);
        v.add("~", Connector.DIFFERENCE_INTENSION);
        v.add("*", Connector.PRODUCT);
        v.add("/", Connector.IMAGE_EXTENSION);
        v.add("\\", Connector.IMAGE_INTENSION);
        v.add("&&", Connector.CONJUNCTION);
        v.add("||", Connector.DISJUNCTION);
        v.add("--", Connector.NEGATION);
        v.add("&/", Connector.CONJUNCTION_SEQUENTIAL);
        v.add("&|", Connector.CONJUNCTION_PARALLEL);

        v.add("-->", Copula.INHERITANCE);
        v.add("<->", Copula.SIMILARITY);
        v.add("==>", Copula.IMPLICATION);
        v.add("<=>", Copula.EQUIVALENCE);
        v.add("=/>", Copula.IMPLICATION_PREDICTIVE);
        v.add("=|>", Copula.IMPLICATION_CONCURRENT);
        v.add("=\\>", Copula.IMPLICATION_RETROSPECTIVE);
        v.add("</>", Copula.EQUIVALENCE_PREDICTIVE);
        v.add("<|>", Copula.EQUIVALENCE_CONCURRENT);
        v.derived("{--", "--]", "{-]", "<\\>");

        v.add(".", Punctuation.JUDGMENT);
        v.add("!", Punctuation.GOAL);
        v.add("?", Punctuation.QUESTION);
        v.add("@", Punctuation.QUEST);

        v.add("\\", Stamp.PAST);
        v.add("|", Stamp.PRESENT);
        v.add("/", Stamp.FUTURE);
        v.fixed("!");
        return v;
    }

    private static Vocabulary latex() {
        var v = new Vocabulary("latex", new Layout(
                new Brackets("\\left(", "\\right)"), "\\;", new Brackets("\\left<", "\\right>"), " ", " ",
                new Brackets("", ""), new Brackets("\\langle{}", "\\rangle{}"), ",", new Brackets("\\$", "\\$"), ";"));

        v.add("", AtomKind.WORD);
        v.add("\\diamond{}", AtomKind.PLACEHOLDER);
        v.add("\\$", AtomKind.VARIABLE_INDEPENDENT);
        v.add("\\#", AtomKind.VARIABLE_DEPENDENT);
        v.add("?", AtomKind.VARIABLE_QUERY);
        v.add("+", AtomKind.INTERVAL);
        v.add("\\Uparrow{}", AtomKind.OPERATOR);

        v.set(Connector.SET_EXTENSION, "\\left\\{", "\\right\\}");
        v.set(Connector.SET_INTENSION, "\\left[", "\\right]");
        v.add("\\cap{}", Connector.INTERSECTION_EXTENSION);
        v.add("\\cup{}", Connector.INTERSECTION_INTENSION);
        v.add("\\minus{}", Connector.DIFFERENCE_EXTENSION);
        v.add("\\sim{}", Connector.DIFFERENCE_INTENSION);
        v.add("\\times{}", Connector.PRODUCT);
        v.add("/", Connector.IMAGE_EXTENSION);
        v.add("\\backslash{}", Connector.IMAGE_INTENSION);
        v.add("\\wedge{}", Connector.CONJUNCTION);
        v.add("\\vee{}", Connector.DISJUNCTION);
        v.add("\\neg{}", Connector.NEGATION);
        v.add(",", Connector.CONJUNCTION_SEQUENTIAL);
        v.add(";", Connector.CONJUNCTION_PARALLEL);

        v.add("\\rightarrow{}", Copula.INHERITANCE);
        v.add("\\leftrightarrow{}", Copula.SIMILARITY);
        v.add("\\Rightarrow{}", Copula.IMPLICATION);
        v.add("\\Leftrightarrow{}", Copula.EQUIVALENCE);
        v.add("/\\!\\!\\!\\!\\!\\Rightarrow{}", Copula.IMPLICATION_PREDICTIVE);
        v.add("|\\!\\!\\!\\!\\!\\Rightarrow{}", Copula.IMPLICATION_CONCURRENT);
        v.add("\\backslash\\!\\!\\!\\!\\!\\Rightarrow{}", Copula.IMPLICATION_RETROSPECTIVE);
        v.add("/\\!\\!\\!\\Leftrightarrow{}", Copula.EQUIVALENCE_PREDICTIVE);
        v.add("|\\!\\!\\!\\Leftrightarrow{}", Copula.EQUIVALENCE_CONCURRENT);
        v.derived("\\circ\\!\\!\\!\\rightarrow{}", "\\rightarrow\\!\\!\\!\\circ{}",
                "\\circ\\!\\!\\!\\rightarrow\\!\\!\\!\\circ{}", "\\backslash\\!\\!\\!\\Leftrightarrow{}");

        v.add(".", Punctuation.JUDGMENT);
        v.add("!", Punctuation.GOAL);
        v.add("?", Punctuation.QUESTION);
        v.add("¿", Punctuation.QUEST);

        v.add("\\backslash\\!\\!\\!\\!\\!\\Rightarrow{}", Stamp.PAST);
        v.add("|\\!\\!\\!\\!\\!\\Rightarrow{}", Stamp.PRESENT);
        v.add("/\\!\\!\\!\\!\\!\\Rightarrow{}", Stamp.FUTURE);
        v.fixed("t=");
        return v;
    }

    private static Vocabulary han() {
        var v = new Vocabulary("han", new Layout(
                new Brackets("（", "）"), "，", new Brackets("「", "」"), "", " ",
                new Brackets("", ""), new Brackets("真", "值"), "、", new Brackets("预", "算"), "、"));

        v.add("", AtomKind.WORD);
        v.add("某", AtomKind.PLACEHOLDER);
        v.add("任一", AtomKind.VARIABLE_INDEPENDENT);
        v.add("其一", AtomKind.VARIABLE_DEPENDENT);
        v.add("所问", AtomKind.VARIABLE_QUERY);
        v.add("间隔", AtomKind.INTERVAL);
        v.add("操作", AtomKind.OPERATOR);

        v.set(Connector.SET_EXTENSION, "『", "』");
        v.set(Connector.SET_INTENSION, "【", "】");
        v.add("外交", Connector.INTERSECTION_EXTENSION);
        v.add("内交", Connector.INTERSECTION_INTENSION);
        v.add("外差", Connector.DIFFERENCE_EXTENSION);
        v.add("内差", Connector.DIFFERENCE_INTENSION);
        v.add("积", Connector.PRODUCT);
        v.add("外像", Connector.IMAGE_EXTENSION);
        v.add("内像", Connector.IMAGE_INTENSION);
        v.add("与", Connector.CONJUNCTION);
        v.add("或", Connector.DISJUNCTION);
        v.add("非", Connector.NEGATION);
        v.add("接连", Connector.CONJUNCTION_SEQUENTIAL);
        v.add("同时", Connector.CONJUNCTION_PARALLEL);

        v.add("是", Copula.INHERITANCE);
        v.add("似", Copula.SIMILARITY);
        v.add("得", Copula.IMPLICATION);
        v.add("同", Copula.EQUIVALENCE);
        v.add("将得", Copula.IMPLICATION_PREDICTIVE);
        v.add("现得", Copula.IMPLICATION_CONCURRENT);
        v.add("曾得", Copula.IMPLICATION_RETROSPECTIVE);
        v.add("将同", Copula.EQUIVALENCE_PREDICTIVE);
        v.add("现同", Copula.EQUIVALENCE_CONCURRENT);
        v.derived("为", "有", "具有", "曾同");

        v.add("。", Punctuation.JUDGMENT);
        v.add("！", Punctuation.GOAL);
        v.add("？", Punctuation.QUESTION);
        v.add("；", Punctuation.QUEST);

        v.add("过去", Stamp.PAST);
        v.add("现在", Stamp.PRESENT);
        v.add("将来", Stamp.FUTURE);
        v.fixed("发生在");
        return v;
    }

    /** The format called {@code name}, ignoring case, or null. */
    @Nullable
    public static Vocabulary named(String name) {
        for (var v : ALL)
            if (v.name.equalsIgnoreCase(name.trim())) return v;
        return null;
    }

    public static List<Vocabulary> all() {
        return ALL;
    }

    private void add(String symbol, AtomKind kind) {
        prefixes.put(symbol, kind);
        prefixOf.put(kind, symbol);
    }

    private void add(String symbol, Connector connector) {
        connectors.put(symbol, connector);
        connectorOf.put(connector, symbol);
    }

    private void set(Connector connector, String opening, String closing) {
        sets.put(opening + closing, connector);
        setOf.put(connector, new Brackets(opening, closing));
    }

    private void add(String symbol, Copula copula) {
        copulas.put(symbol, copula);
        copulaOf.put(copula, symbol);
    }

    /**
     * Read-only shorthands that fold into primitive statements and are never written back:
     * instance, property, instance-property and retrospective equivalence.
     */
    private void derived(String instance, String property, String instanceProperty, String equivalenceRetrospective) {
        derivedCopulas.put(instance, Term::instance);
        derivedCopulas.put(property, Term::property);
        derivedCopulas.put(instanceProperty, Term::instanceProperty);
        derivedCopulas.put(equivalenceRetrospective, Term::equivalenceRetrospective);
    }

    private void add(String symbol, Punctuation punctuation) {
        punctuations.put(symbol, punctuation);
        punctuationOf.put(punctuation, symbol);
    }

    private void add(String symbol, Stamp stamp) {
        stamps.put(symbol, stamp);
        stampOf.put(stamp.kind(), symbol);
    }

    private void fixed(String marker) {
        stampFixed = marker;
        stampOf.put(Stamp.Kind.FIXED, marker);
    }

    @Nullable
    public AtomKind prefix(String symbol) {
        return prefixes.get(symbol);
    }

    @Nullable
    public Connector connector(String symbol) {
        return connectors.get(symbol);
    }

    /** @param brackets opening and closing bracket concatenated, such as {@code "{}"} */
    @Nullable
    public Connector set(String brackets) {
        return sets.get(brackets);
    }

    @Nullable
    public Copula copula(String symbol) {
        return copulas.get(symbol);
    }

    /** Builder for a copula that is shorthand for a primitive statement. */
    @Nullable
    public BinaryOperator<Term> derivedCopula(String symbol) {
        return derivedCopulas.get(symbol);
    }

    @Nullable
    public Punctuation punctuation(String symbol) {
        return punctuations.get(symbol);
    }

    /** Stamp for a marker without a time; fixed stamps are handled by the caller. */
    @Nullable
    public Stamp stamp(String symbol) {
        return stamps.get(symbol);
    }

    /** Marker of fixed stamps; the time follows it, as in {@code :!42:}. */
    public String stampFixed() {
        return stampFixed;
    }

    /**
     * Whether {@code atom} is a placeholder here: no content, and a prefix made of one or more
     * copies of the placeholder marker, such as {@code _} or {@code ___} in ASCII.
     */
    public boolean isPlaceholder(LexicalTerm.Atom atom) {
        var prefix = atom.prefix();
        var marker = prefixOf.get(AtomKind.PLACEHOLDER);
        if (!atom.content().isEmpty() || prefix.isEmpty() || prefix.length() % marker.length() != 0) return false;
        for (var i = 0; i < prefix.length(); i += marker.length())
            if (!prefix.startsWith(marker, i)) return false;
        return true;
    }

    public String symbol(AtomKind kind) {
        return prefixOf.get(kind);
    }

    /** Connector text; sets use {@link #brackets(Connector)} instead. */
    public String symbol(Connector connector) {
        return connectorOf.get(connector);
    }

    /** Bracket pair of a set connector, or null for other connectors. */
    @Nullable
    public Brackets brackets(Connector connector) {
        return setOf.get(connector);
    }

    public String symbol(Copula copula) {
        return copulaOf.get(copula);
    }

    public String symbol(Punctuation punctuation) {
        return punctuationOf.get(punctuation);
    }

    public String symbol(Stamp.Kind kind) {
        return stampOf.get(kind);
    }

    public String render(LexicalNarsese value) {
        if (value instanceof LexicalTerm t) return render(t);
        if (value instanceof LexicalSentence s) return render(s);
        return render((LexicalTask) value);
    }

    public String render(LexicalTerm term) {
        if (term instanceof LexicalTerm.Atom a) return a.prefix() + a.content();
        var between = layout.separator() + layout.termSpace();
        if (term instanceof LexicalTerm.Compound c)
            return layout.compound().wrap(c.connector() + between + components(c.terms(), between));
        if (term instanceof LexicalTerm.Set s)
            return s.opening() + components(s.terms(), between) + s.closing();
        var s = (LexicalTerm.Statement) term;
        return layout.statement().wrap(render(s.subject()) + layout.termSpace() + s.copula()
                + layout.termSpace() + render(s.predicate()));
    }

    public String render(LexicalSentence sentence) {
        var sb = new StringBuilder(render(sentence.term())).append(sentence.punctuation());
        if (sentence.hasStamp())
            sb.append(layout.itemSpace()).append(layout.stamp().wrap(sentence.stamp()));
        if (sentence.hasTruth())
            sb.append(layout.itemSpace()).append(layout.truth().wrap(String.join(layout.truthSeparator(), sentence.truth())));
        return sb.toString();
    }

    public String render(LexicalTask task) {
        return layout.budget().wrap(String.join(layout.budgetSeparator(), task.budget()))
                + layout.itemSpace() + render(task.sentence());
    }

    private String components(List<LexicalTerm> terms, String between) {
        return terms.stream().map(this::render).collect(Collectors.joining(between));
    }

    @Override
    public String toString() {
        return name;
    }
}
