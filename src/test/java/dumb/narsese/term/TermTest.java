package dumb.narsese.term;

import dumb.narsese.AbstractTest;
import dumb.narsese.TermCapacity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static dumb.narsese.term.Term.word;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TermTest extends AbstractTest {

    private static final Term.Atom A = word("a"), B = word("b"), C = word("c");

    @Test
    void setsAreCanonical() {
        assertEquals(Term.setExtension(A, B), Term.setExtension(B, A));
        assertEquals(Term.setExtension(A), Term.setExtension(A, A));
        assertEquals(1, Term.setExtension(A, A).size());
        assertEquals("{B, a, b}", Term.setExtension(B, A, word("B")).narsese());
        assertEquals("[a, b]", Term.setIntension(B, A).narsese());
    }

    @Test
    void unorderedConnectorsIgnoreOrder() {
        assertEquals(Term.conjunction(A, B), Term.conjunction(B, A, B));
        assertEquals(Term.intersectionExtension(C, A), Term.intersectionExtension(A, C));
        assertNotEquals(Term.product(A, B), Term.product(B, A));
        assertNotEquals(Term.sequential(A, B), Term.sequential(B, A));
    }

    @Test
    void symmetricStatements() {
        var s = Term.similarity(B, A);
        assertEquals(Term.similarity(A, B), s);
        assertEquals(A, s.subject());
        assertEquals(Term.equivalence(A, B), Term.equivalence(B, A));
        assertNotEquals(Term.inheritance(A, B), Term.inheritance(B, A));
        assertEquals(TermCapacity.BINARY_SET, s.capacity());
        assertEquals(TermCapacity.BINARY_VEC, Term.implication(A, B).capacity());
    }

    @Test
    void capacities() {
        assertEquals(TermCapacity.ATOM, A.capacity());
        assertEquals(TermCapacity.UNARY, Term.negation(A).capacity());
        assertEquals(TermCapacity.BINARY_VEC, Term.differenceExtension(A, B).capacity());
        assertEquals(TermCapacity.VEC, Term.product(A, B).capacity());
        assertEquals(TermCapacity.SET, Term.conjunction(A, B).capacity());
        assertEquals(TermCapacity.SET, Term.setIntension(A).capacity());

        assertTrue(TermCapacity.UNARY.fixed());
        assertTrue(TermCapacity.VEC.ordered());
        assertFalse(TermCapacity.BINARY_SET.ordered());
        assertFalse(TermCapacity.ATOM.accepts(1));
        assertTrue(Term.negation(A).capacity().accepts(1));
    }

    @Test
    void copulaFlags() {
        assertTrue(Copula.EQUIVALENCE_CONCURRENT.symmetric);
        assertTrue(Copula.EQUIVALENCE_CONCURRENT.temporal);
        assertFalse(Copula.INHERITANCE.temporal);
        assertEquals(Connector.Arity.IMAGE, Connector.IMAGE_INTENSION.arity);
        assertEquals("at least 2", Connector.IMAGE_INTENSION.arity.describe());
        assertEquals("exactly 1", Connector.NEGATION.arity.describe());
    }

    @Test
    void arity() {
        assertThrows(IllegalArgumentException.class, () -> Term.compound(Connector.NEGATION, List.of(A, B)));
        assertThrows(IllegalArgumentException.class, () -> Term.compound(Connector.DIFFERENCE_INTENSION, List.of(A)));
        assertThrows(IllegalArgumentException.class, () -> Term.compound(Connector.PRODUCT, List.of()));
        assertThrows(IllegalArgumentException.class, () -> Term.setExtension());
    }

    @Test
    void images() {
        var image = Term.imageExtension(1, word("r"), B);
        assertEquals("(/, r, _, b)", image.narsese());
        assertEquals(2, image.size());
        assertEquals("(\\, _, r)", Term.imageIntension(0, word("r")).narsese());
        assertEquals("(/, r, b, _)", Term.imageExtension(2, word("r"), B).narsese());

        assertThrows(IllegalArgumentException.class, () -> Term.imageExtension(3, word("r"), B));
        assertThrows(IllegalArgumentException.class, () -> Term.imageExtension(0));
        assertThrows(IllegalArgumentException.class, () -> Term.imageExtension(0, word("r"), Term.placeholder()));
        assertThrows(IllegalArgumentException.class, () -> new Term.Compound(Connector.PRODUCT, List.of(A), 0));
    }

    @Test
    void derivedForms() {
        assertEquals("<{tweety} --> bird>", Term.instance(word("tweety"), word("bird")).narsese());
        assertEquals("<raven --> [black]>", Term.property(word("raven"), word("black")).narsese());
        assertEquals("<{tweety} --> [yellow]>", Term.instanceProperty(word("tweety"), word("yellow")).narsese());
        assertEquals(Term.statement(B, Copula.EQUIVALENCE_PREDICTIVE, A), Term.equivalenceRetrospective(A, B));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "a b", "__", "a---b", "a.b", "a,b", "<a>", "a--", "--"})
    void invalidNames(String name) {
        assertThrows(IllegalArgumentException.class, () -> word(name));
    }

    @ParameterizedTest
    @ValueSource(strings = {"a-", "-a", "a--b", "a-b-c", "-", "x_-"})
    void hyphenatedNamesReadBack(String name) {
        var w = word(name);
        for (var t : List.<Term>of(w, Term.setExtension(w), Term.product(w, A), Term.inheritance(A, w), Term.inheritance(w, A)))
            assertEquals(t, term(t.narsese()), t::narsese);
        var s = Sentence.judgment(w, Truth.EMPTY);
        assertEquals(s, sentence(s.narsese()));
    }

    @Test
    void atoms() {
        assertEquals("$x", Term.independent("x").narsese());
        assertEquals("#y", Term.dependent("y").narsese());
        assertEquals("?q", Term.query("q").narsese());
        assertEquals("^go", Term.operator("go").narsese());
        assertEquals("_", Term.placeholder().narsese());
        assertTrue(Term.independent("x").kind().isVariable());

        assertEquals("7", new Term.Atom(AtomKind.INTERVAL, "007").name());
        assertEquals(5, Term.interval(5).interval());
        assertEquals("+5", Term.interval(5).narsese());
        assertThrows(IllegalArgumentException.class, () -> Term.interval(-1));
        assertThrows(IllegalArgumentException.class, () -> new Term.Atom(AtomKind.INTERVAL, "1x"));
        assertThrows(IllegalArgumentException.class, () -> new Term.Atom(AtomKind.PLACEHOLDER, "x"));
        assertThrows(IllegalStateException.class, A::interval);
    }

    @Test
    void truthRange() {
        assertEquals(1.0, Truth.of(1.0, 0.0).frequency());
        var high = assertThrows(IllegalArgumentException.class, () -> Truth.of(1.5));
        assertTrue(high.getMessage().contains("frequency"), high::getMessage);
        var low = assertThrows(IllegalArgumentException.class, () -> Truth.of(0.5, -0.1));
        assertTrue(low.getMessage().contains("confidence"), low::getMessage);
        assertThrows(IllegalArgumentException.class, () -> Truth.of(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> new Truth(List.of(0.1, 0.2, 0.3)));
        assertThrows(IllegalStateException.class, () -> Truth.of(0.5).confidence());
        assertEquals(Truth.of(0.0), Truth.of(-0.0));
    }

    @Test
    void budgetRange() {
        assertEquals(0.3, Budget.of(0.1, 0.2, 0.3).quality());
        var e = assertThrows(IllegalArgumentException.class, () -> Budget.of(0.5, 2));
        assertTrue(e.getMessage().contains("durability"), e::getMessage);
        assertThrows(IllegalArgumentException.class, () -> new Budget(List.of(0.1, 0.2, 0.3, 0.4)));
        assertTrue(Budget.EMPTY.isEmpty());
    }

    @Test
    void questionsHaveNoTruth() {
        assertThrows(IllegalArgumentException.class,
                () -> new Sentence(A, Punctuation.QUESTION, Stamp.ETERNAL, Truth.of(1.0)));
        assertThrows(IllegalArgumentException.class,
                () -> new Sentence(A, Punctuation.QUEST, Stamp.ETERNAL, Truth.of(1.0, 0.9)));
        assertEquals(Truth.EMPTY, Sentence.question(A).truth());
    }

    @Test
    void stamps() {
        assertThrows(IllegalArgumentException.class, () -> new Stamp(Stamp.Kind.PAST, 3));
        assertEquals(-3, Stamp.fixed(-3).time());
        assertTrue(Stamp.ETERNAL.isEternal());
    }

    @Test
    void sentenceAndTaskRendering() {
        var judgment = Sentence.judgment(Term.inheritance(A, B), Truth.of(1.0, 0.9)).withStamp(Stamp.fixed(-3));
        assertEquals("<a --> b>. :!-3: %1.0;0.9%", judgment.narsese());
        assertEquals("<a --> b>! :|:", Sentence.goal(Term.inheritance(A, B), Truth.EMPTY).withStamp(Stamp.PRESENT).narsese());
        assertEquals("$$ a?", new Task(Budget.EMPTY, Sentence.question(A)).narsese());
        assertEquals("$0.5;0.25$ a@", new Task(Budget.of(0.5, 0.25), Sentence.quest(A)).narsese());
    }

    @Test
    void ordering() {
        assertTrue(A.compareTo(B) < 0);
        assertTrue(Term.setExtension(A).compareTo(A) > 0);
        assertEquals(0, Term.similarity(A, B).compareTo(Term.similarity(B, A)));
    }

    @Test
    void numbersFormatWithoutExponent() {
        assertEquals("1.0", Floats.format(1.0));
        assertEquals("0.00000000010", Floats.format(1e-10));
    }
}
