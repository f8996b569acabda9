package dumb.narsese.tool;

import dumb.narsese.util.Json;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StructureIllustratorTest {

    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

    private StructureIllustrator illustrator(Config config) {
        return new StructureIllustrator(config, new PrintStream(bytes, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return bytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    void replStopsAtEmptyLine() throws IOException {
        var in = new BufferedReader(new StringReader("a.\n(@@, a)\n<a\n\nb.\n"));
        var ok = illustrator(new Config()).run(in);
        assertEquals(1, ok);
        var out = output();
        assertTrue(out.contains("[Sentence] a."), out);
        assertTrue(out.contains("UNKNOWN_CONNECTOR at term ('@@')"), out);
        assertTrue(out.contains("Failed to read <a"), out);
        assertFalse(out.contains("b."), out);
    }

    @Test
    void replStopsAtEndOfInput() throws IOException {
        var in = new BufferedReader(new StringReader("<a --> b>?\n$$c!"));
        assertEquals(2, illustrator(new Config()).run(in));
        assertTrue(output().contains("[Task] $$ c!"), output());
    }

    @Test
    void lexicalOnly() {
        var illustrator = illustrator(new Config("", false, false, true, "ascii"));
        assertTrue(illustrator.illustrate("(@@, a)"));
        assertTrue(output().startsWith("[Term] (@@, a)\nCOMPOUND @@ [VEC]\n"), output());
    }

    @Test
    void showsConfiguredFormat() {
        var illustrator = illustrator(new Config("", true, false, true, "han"));
        assertTrue(illustrator.illustrate("<a --> b>. :!2:"));
        var out = output();
        assertTrue(out.startsWith("[Sentence] <a --> b>. :!2:\n[han] 「a是b」。 发生在2\n"), out);
    }

    @Test
    void unknownFormat() {
        var e = assertThrows(IllegalArgumentException.class, () -> illustrator(new Config("", true, false, true, "typst")));
        assertTrue(e.getMessage().contains("typst"), e::getMessage);
    }

    @Test
    void jsonOutput() {
        var illustrator = illustrator(new Config("", true, true, false, "ascii"));
        assertTrue(illustrator.illustrate("<b <-> a>"));
        var out = output();
        assertTrue(out.contains("[Term] <a <-> b>"), out);
        assertTrue(out.contains("\"category\":\"STATEMENT\""), out);
        assertTrue(out.contains("\"head\":\"SIMILARITY\""), out);
    }

    @Test
    void jsonSentenceIsOneDocumentPerLine() throws IOException {
        var illustrator = illustrator(new Config("", true, true, false, "ascii"));
        assertTrue(illustrator.illustrate("(&, b, a). :!7: %0.5%"));
        var lines = output().split("\\R");
        assertEquals(2, lines.length, output());
        var doc = Json.tree(lines[1]);
        assertEquals("JUDGMENT", doc.get("punctuation").asText());
        assertEquals("FIXED(7)", doc.get("stamp").asText());
        assertEquals(0.5, doc.get("truth").get(0).asDouble());
        assertEquals("(&, a, b)", doc.get("term").get("narsese").asText());
        assertEquals(2, doc.get("term").get("terms").size());
    }
}
