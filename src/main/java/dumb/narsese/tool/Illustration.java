package dumb.narsese.tool;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dumb.narsese.Termlike;
import dumb.narsese.lexical.LexicalNarsese;
import dumb.narsese.lexical.LexicalSentence;
import dumb.narsese.lexical.LexicalTask;
import dumb.narsese.lexical.LexicalTerm;
import dumb.narsese.term.NarseseValue;
import dumb.narsese.term.Sentence;
import dumb.narsese.term.Stamp;
import dumb.narsese.term.Task;
import dumb.narsese.term.Term;
import dumb.narsese.util.Json;

import java.util.List;

/**
 * Structure dumps of either model, as an indented text tree or as JSON. Terms are walked only
 * through {@link Termlike}, so the same code prints lexical and semantic trees; {@code text}
 * and {@code document} add the sentence and task layers around them.
 */
public final class Illustration {
    private static final String INDENT = "  ";

    private Illustration() {}

    public static String tree(Termlike<?> term) {
        var sb = new StringBuilder();
        tree(term, 0, sb);
        return sb.toString();
    }

    public static String text(LexicalNarsese value) {
        var sb = new StringBuilder();
        var depth = 0;
        if (value instanceof LexicalTask t) {
            sb.append("TASK budget=").append(t.budget()).append('\n');
            depth++;
        }
        if (value instanceof LexicalTask || value instanceof LexicalSentence) {
            var s = value instanceof LexicalTask t ? t.sentence() : (LexicalSentence) value;
            sb.append(INDENT.repeat(depth)).append("SENTENCE punctuation=").append(s.punctuation());
            if (s.hasStamp()) sb.append(" stamp=").append(s.stamp());
            if (s.hasTruth()) sb.append(" truth=").append(s.truth());
            sb.append('\n');
            depth++;
        }
        tree(value.term(), depth, sb);
        return sb.toString();
    }

    public static String text(NarseseValue value) {
        var sb = new StringBuilder();
        var depth = 0;
        if (value instanceof Task t) {
            sb.append("TASK budget=").append(t.budget().values()).append('\n');
            depth++;
        }
        if (value instanceof Task || value instanceof Sentence) {
            var s = value instanceof Task t ? t.sentence() : (Sentence) value;
            sb.append(INDENT.repeat(depth)).append("SENTENCE ").append(s.punctuation())
                    .append(' ').append(stamp(s.stamp()));
            if (!s.truth().isEmpty()) sb.append(" truth=").append(s.truth().values());
            sb.append('\n');
            depth++;
        }
        tree(value.term(), depth, sb);
        return sb.toString();
    }

    private static void tree(Termlike<?> term, int depth, StringBuilder sb) {
        sb.append(INDENT.repeat(depth)).append(term.category()).append(' ').append(head(term));
        if (!term.isAtom()) sb.append(" [").append(term.capacity()).append(']');
        sb.append('\n');
        for (var sub : term.subs()) tree(sub, depth + 1, sb);
    }

    public static ObjectNode json(Termlike<?> term) {
        var node = Json.node()
                .put("category", term.category().name())
                .put("capacity", term.capacity().name())
                .put("head", head(term))
                .put("narsese", term.narsese());
        if (!term.isAtom()) {
            var subs = node.putArray("terms");
            for (var sub : term.subs()) subs.add(json(sub));
        }
        return node;
    }

    public static ObjectNode document(LexicalNarsese value) {
        if (value instanceof LexicalTerm t) return json(t);
        if (value instanceof LexicalSentence s) return sentence(s);
        var task = (LexicalTask) value;
        var node = Json.node();
        strings(node, "budget", task.budget());
        node.set("sentence", sentence(task.sentence()));
        return node;
    }

    public static ObjectNode document(NarseseValue value) {
        if (value instanceof Term t) return json(t);
        if (value instanceof Sentence s) return sentence(s);
        var task = (Task) value;
        var node = Json.node();
        numbers(node, "budget", task.budget().values());
        node.set("sentence", sentence(task.sentence()));
        return node;
    }

    private static ObjectNode sentence(LexicalSentence s) {
        var node = Json.node().put("punctuation", s.punctuation());
        if (s.hasStamp()) node.put("stamp", s.stamp());
        if (s.hasTruth()) strings(node, "truth", s.truth());
        node.set("term", json(s.term()));
        return node;
    }

    private static ObjectNode sentence(Sentence s) {
        var node = Json.node()
                .put("punctuation", s.punctuation().name())
                .put("stamp", stamp(s.stamp()));
        numbers(node, "truth", s.truth().values());
        node.set("term", json(s.term()));
        return node;
    }

    private static void strings(ObjectNode node, String field, List<String> values) {
        var array = node.putArray(field);
        for (var v : values) array.add(v);
    }

    private static void numbers(ObjectNode node, String field, List<Double> values) {
        var array = node.putArray(field);
        for (double v : values) array.add(v);
    }

    private static String stamp(Stamp stamp) {
        return stamp.kind() == Stamp.Kind.FIXED ? stamp.kind() + "(" + stamp.time() + ")" : stamp.kind().name();
    }

    /** What distinguishes a node from its siblings of the same category. */
    static String head(Termlike<?> term) {
        if (term instanceof LexicalTerm.Atom a) return a.narsese();
        if (term instanceof LexicalTerm.Compound c) return c.connector();
        if (term instanceof LexicalTerm.Set s) return s.brackets();
        if (term instanceof LexicalTerm.Statement s) return s.copula();
        if (term instanceof Term.Atom a) return a.isPlaceholder() ? a.kind().name() : a.kind() + " " + a.name();
        if (term instanceof Term.Compound c) return c.connector().isImage()
                ? c.connector() + " @" + c.placeholder() : c.connector().name();
        if (term instanceof Term.Statement s) return s.copula().name();
        return term.narsese();
    }
}
