package dumb.narsese.parse;

import dumb.narsese.AbstractTest;
import dumb.narsese.lexical.LexicalSentence;
import dumb.narsese.lexical.LexicalTask;
import dumb.narsese.lexical.LexicalTerm;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static dumb.narsese.lexical.LexicalTerm.atom;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NarseseParserTest extends AbstractTest {

    private static final LexicalTerm ROBIN_BIRD = LexicalTerm.statement(atom("robin"), "-->", atom("bird"));

    @Test
    void judgmentIsSentence() {
        var s = assertInstanceOf(LexicalSentence.class, lexical("<robin --> bird>."));
        assertEquals(ROBIN_BIRD, s.term());
        assertEquals(".", s.punctuation());
        assertNull(s.stamp());
        assertNull(s.truth());
    }

    @Test
    void budgetMakesTask() {
        var t = assertInstanceOf(LexicalTask.class, lexical("$0.8;0.8;0.8$<robin --> bird>?"));
        assertEquals(List.of("0.8", "0.8", "0.8"), t.budget());
        assertEquals("?", t.sentence().punctuation());
        assertEquals(ROBIN_BIRD, t.term());
    }

    @Test
    void emptyBudgetIsStillTask() {
        var t = assertInstanceOf(LexicalTask.class, lexical("$$<robin --> bird>."));
        assertTrue(t.budget().isEmpty());
    }

    @Test
    void bareTerm() {
        assertEquals(ROBIN_BIRD, lexical("<robin --> bird>"));
    }

    @Test
    void stampAndTruth() {
        var s = assertInstanceOf(LexicalSentence.class, lexical("<robin --> bird>. :|: %1.0;0.9%"));
        assertEquals("|", s.stamp());
        assertEquals(List.of("1.0", "0.9"), s.truth());
    }

    @Test
    void stampContentStopsAtWhitespace() {
        var e = parseFailure("a. :x y:");
        assertEquals(5, e.offset());
        assertTrue(e.expected().contains("':' closing the stamp"), e.expected()::toString);
        assertEquals("x", ((LexicalSentence) lexical("a. :x:")).stamp());
    }

    @Test
    void fixedStamp() {
        var s = assertInstanceOf(LexicalSentence.class, lexical("<a --> b>! :!-5:"));
        assertEquals("!-5", s.stamp());
    }

    @Test
    void emptyTruthAndTrailingSeparator() {
        var empty = assertInstanceOf(LexicalSentence.class, lexical("<a --> b>. %%"));
        assertEquals(List.of(), empty.truth());
        var trailing = assertInstanceOf(LexicalSentence.class, lexical("<a --> b>. %1.0;0.9;%"));
        assertEquals(List.of("1.0", "0.9"), trailing.truth());
    }

    @Test
    void negativeNumbersParse() {
        var s = assertInstanceOf(LexicalSentence.class, lexical("a. %-0.1%"));
        assertEquals(List.of("-0.1"), s.truth());
    }

    @Test
    void compoundAndSets() {
        assertEquals(LexicalTerm.compound("&&", atom("a"), atom("b")), lexical("(&&, a, b)"));
        assertEquals(LexicalTerm.compound("&&", atom("a"), atom("b")), lexical("( && , a , b )"));
        assertEquals(LexicalTerm.set("{", "}", atom("b"), atom("a"), atom("b")), lexical("{b, a, b}"));
        assertEquals(LexicalTerm.set("[", "]", atom("bright")), lexical("[bright]"));
    }

    @Test
    void unknownVocabularyStillParses() {
        assertEquals(LexicalTerm.compound("@@", atom("a")), lexical("(@@, a)"));
        assertEquals(LexicalTerm.statement(atom("a"), "=#>", atom("b")), lexical("<a =#> b>"));
        assertEquals(atom("%%", "x"), lexical("%%x"));
    }

    @Test
    void prefixesAndPlaceholders() {
        assertEquals(LexicalTerm.compound("/", atom("r"), LexicalTerm.placeholder(), atom("b")), lexical("(/, r, _, b)"));
        assertEquals(atom("__", ""), lexical("__"));
        assertEquals(atom("_a"), lexical("_a"));
        assertEquals(atom("$", "x"), lexical("$x"));
        assertEquals(atom("?", "q"), lexical("?q"));
        assertEquals(atom("+", "12"), lexical("+12"));
        assertEquals(atom("^", "go"), lexical("^go"));
    }

    @Test
    void copulaWithoutSpaces() {
        assertEquals(LexicalTerm.statement(atom("a"), "-->", atom("b")), lexical("<a-->b>"));
        assertEquals(LexicalTerm.statement(atom("a"), "==>", atom("b")), lexical("<a==>b>"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"a-b", "a--b", "a-b-c", "under_score", "x-"})
    void hyphensStayInsideAtoms(String text) {
        assertEquals(atom(text), lexical(text));
    }

    @Test
    void threeHyphensEndAnAtom() {
        var e = parseFailure("a---b");
        assertEquals(1, e.offset());
    }

    @Test
    void hyphenatedSubject() {
        assertEquals(LexicalTerm.statement(atom("a-b"), "-->", atom("c")), lexical("<a-b --> c>"));
    }

    @Test
    void unicodeWhitespace() {
        assertEquals(ROBIN_BIRD, lexical("<robin\u3000-->\u00A0bird>"));
        assertEquals(ROBIN_BIRD, lexical("\t<robin -->\n bird>  "));
    }

    @Test
    void unclosedStatement() {
        var e = parseFailure("<robin --> bird");
        assertEquals(15, e.offset());
        assertEquals(1, e.line());
        assertEquals(16, e.col());
        assertTrue(e.expected().contains("'>' closing the statement"), e.expected()::toString);
        assertTrue(e.getMessage().contains("line 1, col 16"), e::getMessage);
    }

    @Test
    void unclosedCompound() {
        var e = parseFailure("(&&, a, b");
        assertEquals(9, e.offset());
        assertTrue(e.expected().contains("',' or ')'"), e.expected()::toString);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "a. b", "<a --> >", "(&&)", "{}", "<a b>", "a. :x", "$0.5 a."})
    void rejected(String text) {
        parseFailure(text);
    }

    @Test
    void typedEntryPoints() throws ParseException {
        assertEquals(atom("a"), NarseseParser.parseTerm("a"));
        assertEquals("!", NarseseParser.parseSentence("a!").punctuation());
        assertEquals(List.of("0.1"), NarseseParser.parseTask("$0.1$ a.").budget());
        assertThrows(ParseException.class, () -> NarseseParser.parseTerm("a."));
        assertThrows(ParseException.class, () -> NarseseParser.parseSentence("a"));
        assertThrows(ParseException.class, () -> NarseseParser.parseTask("a."));
    }

    @Test
    void linesSkipBlanksAndReportLineNumbers() throws ParseException {
        var values = NarseseParser.parseLines("a.\n\n<a --> b>?\r\n$$c@");
        assertEquals(3, values.size());
        assertInstanceOf(LexicalTask.class, values.get(2));

        var e = assertThrows(ParseException.class, () -> NarseseParser.parseLines("a.\nb.\n<a -->"));
        assertEquals(3, e.line());
    }

    @Test
    void nestingLimit() {
        var deep = "(&, ".repeat(NarseseParser.MAX_DEPTH + 10) + "a" + ")".repeat(NarseseParser.MAX_DEPTH + 10);
        parseFailure(deep);
        var fine = "(&, ".repeat(100) + "a" + ")".repeat(100);
        assertInstanceOf(LexicalTerm.Compound.class, lexical(fine));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "<robin --> bird>.",
            "$0.5;0.5$ <(&&, a, b) ==> {c}>! :/: %1;0.9%",
            "(/, r, _, b)",
            "<{tweety} {-- bird>",
            "(--, <#x --> [red]>)@ :!42:",
            "<(*, $a, ?b) <=> ^op>? %%"
    })
    void renderingParsesBack(String text) {
        var first = lexical(text);
        assertEquals(first, lexical(first.narsese()));
    }
}
