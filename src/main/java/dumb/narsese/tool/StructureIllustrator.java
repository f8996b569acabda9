package dumb.narsese.tool;

import dumb.narsese.NarseseException;
import dumb.narsese.fold.Folder;
import dumb.narsese.fold.Vocabulary;
import dumb.narsese.lexical.LexicalNarsese;
import dumb.narsese.lexical.LexicalSentence;
import dumb.narsese.lexical.LexicalTerm;
import dumb.narsese.parse.NarseseParser;
import dumb.narsese.term.NarseseValue;
import dumb.narsese.term.Sentence;
import dumb.narsese.term.Term;
import dumb.narsese.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Line-oriented REPL: reads one Narsese value per line and prints its structure. An empty line
 * or end of input quits.
 */
public class StructureIllustrator {
    private static final Logger logger = LoggerFactory.getLogger(StructureIllustrator.class);

    private final Config config;
    private final Vocabulary format;
    private final PrintStream out;

    /**
     * @throws IllegalArgumentException if the configured format is not a known vocabulary
     */
    public StructureIllustrator(Config config, PrintStream out) {
        this.config = config;
        var format = Vocabulary.named(config.format());
        if (format == null)
            throw new IllegalArgumentException("Unknown format '" + config.format() + "', expected one of " + Vocabulary.all());
        this.format = format;
        this.out = out;
    }

    public static void main(String[] args) throws IOException {
        var config = Config.load();
        logger.info("Starting with {}", config);
        var in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        var lines = new StructureIllustrator(config, System.out).run(in);
        logger.info("Illustrated {} lines", lines);
    }

    /**
     * @return the number of lines that parsed (and folded, when folding is on)
     */
    public int run(BufferedReader in) throws IOException {
        var ok = 0;
        while (true) {
            out.print(config.prompt());
            out.flush();
            var line = in.readLine();
            if (line == null || line.isBlank()) break;
            if (illustrate(line.strip())) ok++;
            out.println();
        }
        return ok;
    }

    /** Prints the structure of one value, or why it could not be read. */
    public boolean illustrate(String text) {
        try {
            var lexical = NarseseParser.parse(text);
            if (!config.fold()) {
                out.println("[" + kind(lexical) + "] " + lexical.narsese());
                out.print(config.json() ? Json.str(Illustration.document(lexical), config.pretty()) + "\n" : Illustration.text(lexical));
                return true;
            }
            var value = Folder.fold(lexical);
            out.println("[" + kind(value) + "] " + value.narsese());
            if (format != Vocabulary.ASCII) out.println("[" + format + "] " + value.narsese(format));
            out.print(config.json() ? Json.str(Illustration.document(value), config.pretty()) + "\n" : Illustration.text(value));
            return true;
        } catch (NarseseException e) {
            logger.warn("Could not read '{}': {}", text, e.getMessage());
            out.println("Failed to read " + text);
            out.println(e.getMessage());
            return false;
        }
    }

    private static String kind(LexicalNarsese value) {
        if (value instanceof LexicalTerm) return "Term";
        return value instanceof LexicalSentence ? "Sentence" : "Task";
    }

    private static String kind(NarseseValue value) {
        if (value instanceof Term) return "Term";
        return value instanceof Sentence ? "Sentence" : "Task";
    }
}
