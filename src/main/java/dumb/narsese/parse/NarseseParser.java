package dumb.narsese.parse;

import dumb.narsese.lexical.LexicalNarsese;
import dumb.narsese.lexical.LexicalSentence;
import dumb.narsese.lexical.LexicalTask;
import dumb.narsese.lexical.LexicalTerm;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Text to {@link LexicalNarsese}.
 * <p>
 * Every rule is an ordered choice that restores the cursor when it fails, so the first
 * alternative that matches wins. At the top level a task is tried before a sentence and a
 * sentence before a bare term, each of which must consume the whole input. The parser
 * remembers the furthest offset any alternative reached and reports that one on failure.
 * <p>
 * Instances hold the cursor and are used for a single input; the static methods are the API.
 */
public final class NarseseParser {
    private static final Logger logger = LoggerFactory.getLogger(NarseseParser.class);

    static final int MAX_DEPTH = 256;
    private static final int CONTEXT_RADIUS = 12;
    private static final String STRUCTURAL = "()[]{}<>,";

    private final String input;
    private final int firstLine;
    private final int len;
    private int pos;
    private int depth;
    private int furthest = -1;
    private final Set<String> expected = new LinkedHashSet<>();

    private NarseseParser(CharSequence input, int firstLine) {
        this.input = input.toString();
        this.firstLine = firstLine;
        this.len = this.input.length();
    }

    /**
     * Parses a task, a sentence or a bare term, in that order of preference.
     */
    public static LexicalNarsese parse(CharSequence input) throws ParseException {
        return new NarseseParser(input, 1).narsese();
    }

    public static LexicalTerm parseTerm(CharSequence input) throws ParseException {
        var p = new NarseseParser(input, 1);
        return p.require(p.complete(p.term()));
    }

    public static LexicalSentence parseSentence(CharSequence input) throws ParseException {
        var p = new NarseseParser(input, 1);
        return p.require(p.complete(p.sentence()));
    }

    public static LexicalTask parseTask(CharSequence input) throws ParseException {
        var p = new NarseseParser(input, 1);
        return p.require(p.complete(p.task()));
    }

    /**
     * One value per non-blank line. Errors carry the line number within {@code text}.
     */
    public static List<LexicalNarsese> parseLines(CharSequence text) throws ParseException {
        var lines = text.toString().split("\\R", -1);
        var values = new ArrayList<LexicalNarsese>(lines.length);
        for (var i = 0; i < lines.length; i++) {
            if (lines[i].isBlank()) continue;
            values.add(new NarseseParser(lines[i], i + 1).narsese());
        }
        return values;
    }

    private LexicalNarsese narsese() throws ParseException {
        LexicalNarsese result = complete(task());
        if (result == null) {
            pos = 0;
            result = complete(sentence());
        }
        if (result == null) {
            pos = 0;
            result = complete(term());
        }
        var value = require(result);
        logger.trace("parsed '{}' as {}", input, value.getClass().getSimpleName());
        return value;
    }

    private <T> T require(@Nullable T value) throws ParseException {
        if (value == null) throw error();
        return value;
    }

    @Nullable
    private <T> T complete(@Nullable T value) {
        if (value == null) return null;
        skipWhitespace();
        if (pos < len) {
            expect("end of input");
            return null;
        }
        return value;
    }

    @Nullable
    private LexicalTask task() {
        var mark = pos;
        var budget = marker('$', "budget");
        if (budget != null) {
            var sentence = sentence();
            if (sentence != null) return new LexicalTask(budget, sentence);
        }
        pos = mark;
        return null;
    }

    @Nullable
    private LexicalSentence sentence() {
        var mark = pos;
        var term = term();
        if (term != null) {
            var punctuation = punctuation();
            if (punctuation != null) {
                var stamp = stamp();
                var truth = marker('%', "truth");
                return new LexicalSentence(term, punctuation, stamp, truth);
            }
        }
        pos = mark;
        return null;
    }

    @Nullable
    private String punctuation() {
        skipWhitespace();
        if (pos < len && isPunctuation(input.charAt(pos))) return input.substring(pos, ++pos);
        expect("punctuation");
        return null;
    }

    /** Content of an optional {@code :...:} stamp, or null if there is none. */
    @Nullable
    private String stamp() {
        skipWhitespace();
        if (!peekIs(':')) {
            expect("stamp");
            return null;
        }
        var mark = pos++;
        var start = pos;
        while (pos < len && input.charAt(pos) != ':' && !isWhitespace(input.charAt(pos))) pos++;
        if (pos == start) {
            expect("stamp content");
        } else if (!peekIs(':')) {
            expect("':' closing the stamp");
        } else {
            return input.substring(start, pos++);
        }
        pos = mark;
        return null;
    }

    /**
     * A delimited list of numeric tokens such as {@code $0.8;0.5$} or {@code %1.0;0.9;%}.
     * Returns null when no marker is present; an empty list for {@code $$}.
     */
    @Nullable
    private List<String> marker(char delimiter, String what) {
        skipWhitespace();
        if (!peekIs(delimiter)) {
            expect(what);
            return null;
        }
        var mark = pos++;
        var values = new ArrayList<String>(3);
        skipWhitespace();
        var first = number();
        if (first != null) {
            values.add(first);
            while (true) {
                skipWhitespace();
                if (!peekIs(';')) break;
                pos++;
                skipWhitespace();
                var next = number();
                if (next == null) break;
                values.add(next);
            }
        }
        skipWhitespace();
        if (peekIs(delimiter)) {
            pos++;
            return values;
        }
        expect("'" + delimiter + "' closing the " + what);
        pos = mark;
        return null;
    }

    @Nullable
    private String number() {
        var start = pos;
        if (peekIs('-')) pos++;
        var digits = pos;
        while (pos < len && isNumeric(input.charAt(pos))) pos++;
        if (pos > digits) return input.substring(start, pos);
        pos = start;
        expect("number");
        return null;
    }

    @Nullable
    private LexicalTerm term() {
        skipWhitespace();
        if (depth >= MAX_DEPTH) {
            expect("term nested less than " + MAX_DEPTH + " levels deep");
            return null;
        }
        depth++;
        try {
            LexicalTerm t = statement();
            if (t == null) t = compound();
            if (t == null) t = atom();
            return t;
        } finally {
            depth--;
        }
    }

    @Nullable
    private LexicalTerm.Statement statement() {
        var mark = pos;
        if (!peekIs('<')) {
            expect("statement");
            return null;
        }
        pos++;
        var subject = term();
        if (subject != null) {
            var copula = copula();
            if (copula != null) {
                var predicate = term();
                if (predicate != null) {
                    skipWhitespace();
                    if (peekIs('>')) {
                        pos++;
                        return new LexicalTerm.Statement(copula, subject, predicate);
                    }
                    expect("'>' closing the statement");
                }
            }
        }
        pos = mark;
        return null;
    }

    @Nullable
    private String copula() {
        skipWhitespace();
        if (copulaAt(pos)) {
            pos += 3;
            return input.substring(pos - 3, pos);
        }
        expect("copula");
        return null;
    }

    @Nullable
    private LexicalTerm compound() {
        var mark = pos;
        if (peekIs('(')) {
            pos++;
            skipWhitespace();
            var start = pos;
            while (pos < len && isConnector(input.charAt(pos))) pos++;
            if (pos == start) {
                expect("connector");
            } else {
                var connector = input.substring(start, pos);
                skipWhitespace();
                if (peekIs(',')) {
                    pos++;
                    var terms = members(')');
                    if (terms != null) return new LexicalTerm.Compound(connector, terms);
                } else {
                    expect("',' after the connector");
                }
            }
        } else if (peekIs('{') || peekIs('[')) {
            var opening = input.charAt(pos++);
            var closing = opening == '{' ? '}' : ']';
            var terms = members(closing);
            if (terms != null) return new LexicalTerm.Set(String.valueOf(opening), String.valueOf(closing), terms);
        } else {
            expect("compound");
        }
        pos = mark;
        return null;
    }

    /** One or more comma separated terms followed by {@code closing}. */
    @Nullable
    private List<LexicalTerm> members(char closing) {
        var terms = new ArrayList<LexicalTerm>();
        var t = term();
        while (t != null) {
            terms.add(t);
            skipWhitespace();
            if (peekIs(closing)) {
                pos++;
                return terms;
            }
            if (!peekIs(',')) {
                expect("',' or '" + closing + "'");
                return null;
            }
            pos++;
            t = term();
        }
        return null;
    }

    @Nullable
    private LexicalTerm.Atom atom() {
        var mark = pos;
        while (peekIs('_')) pos++;
        if (pos > mark && (pos >= len || !isContent(input.charAt(pos))))
            return new LexicalTerm.Atom(input.substring(mark, pos), "");
        pos = mark;

        while (pos < len && isPrefix(input.charAt(pos))) pos++;
        var contentStart = pos;
        while (pos < len && isContent(input.charAt(pos)) && !copulaAt(pos)) pos++;
        if (pos > contentStart)
            return new LexicalTerm.Atom(input.substring(mark, contentStart), input.substring(contentStart, pos));
        expect(contentStart > mark ? "atom content" : "atom");
        pos = mark;
        return null;
    }

    /**
     * Whether one of the four copula shapes starts at {@code i}: {@code P-P}, {@code P=P},
     * {@code =P>} or {@code <P>}, with {@code P} any punctuation or symbol character.
     */
    boolean copulaAt(int i) {
        if (i + 3 > len) return false;
        char c0 = input.charAt(i), c1 = input.charAt(i + 1), c2 = input.charAt(i + 2);
        return (isSymbolic(c0) && (c1 == '-' || c1 == '=') && isSymbolic(c2))
                || (c0 == '=' && isSymbolic(c1) && c2 == '>')
                || (c0 == '<' && isSymbolic(c1) && c2 == '>');
    }

    private boolean peekIs(char c) {
        return pos < len && input.charAt(pos) == c;
    }

    private void skipWhitespace() {
        while (pos < len && isWhitespace(input.charAt(pos))) pos++;
    }

    private void expect(String what) {
        if (pos > furthest) {
            furthest = pos;
            expected.clear();
        }
        if (pos == furthest) expected.add(what);
    }

    private ParseException error() {
        var at = Math.max(furthest, 0);
        var line = firstLine;
        var lineStart = 0;
        for (var i = 0; i < at; i++) {
            if (input.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        var found = at < len ? "'" + input.charAt(at) + "'" : "end of input";
        var message = "Expected " + String.join(" or ", expected) + ", found " + found;
        var context = input.substring(Math.max(0, at - CONTEXT_RADIUS), Math.min(len, at + CONTEXT_RADIUS));
        logger.debug("parse failure in '{}': {}", input, message);
        return new ParseException(message, at, line, at - lineStart + 1, new ArrayList<>(expected), context);
    }

    static boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    /** Atom content: letters, digits, underscore and hyphen. */
    static boolean isContent(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }

    /** Any visible character that is not a letter, digit or underscore. */
    static boolean isSymbolic(char c) {
        return !isWhitespace(c) && !Character.isLetterOrDigit(c) && c != '_';
    }

    static boolean isConnector(char c) {
        return isSymbolic(c) && STRUCTURAL.indexOf(c) < 0;
    }

    static boolean isPrefix(char c) {
        return isConnector(c) && c != '-' && c != ';';
    }

    static boolean isPunctuation(char c) {
        return isPrefix(c) && c != ':' && c != '%' && c != '$';
    }

    static boolean isNumeric(char c) {
        return (c >= '0' && c <= '9') || c == '.';
    }
}
