package dumb.narsese.parse;

import dumb.narsese.NarseseException;

import java.util.List;

/**
 * Input that does not match the Narsese grammar. Reports the furthest position any
 * alternative reached and what was expected there.
 */
public class ParseException extends NarseseException {
    private final int offset;
    private final int line;
    private final int col;
    private final List<String> expected;
    private final String context;

    public ParseException(String message, int offset, int line, int col, List<String> expected, String context) {
        super(message);
        this.offset = offset;
        this.line = line;
        this.col = col;
        this.expected = List.copyOf(expected);
        this.context = context;
    }

    /** Zero-based character offset into the input. */
    public int offset() {
        return offset;
    }

    public int line() {
        return line;
    }

    public int col() {
        return col;
    }

    /** Constructs that could have continued the input at {@link #offset()}. */
    public List<String> expected() {
        return expected;
    }

    public String context() {
        return context;
    }

    @Override
    public String getMessage() {
        var location = " at line " + line + ", col " + col;
        var contextSnippet = context != null && !context.isEmpty() ? " near '" + context + "'" : "";
        return super.getMessage() + location + contextSnippet;
    }
}
