package dumb.narsese.term;

import java.util.List;

/**
 * Frequency and confidence, either of which may be left out from the right: a truth value has
 * zero, one or two components, each within {@code [0, 1]}.
 */
public record Truth(List<Double> values) {
    public static final List<String> FIELDS = List.of("frequency", "confidence");
    public static final Truth EMPTY = new Truth(List.of());

    public Truth {
        values = Floats.units(values, FIELDS, "truth");
    }

    public static Truth of(double frequency) {
        return new Truth(List.of(frequency));
    }

    public static Truth of(double frequency, double confidence) {
        return new Truth(List.of(frequency, confidence));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public double frequency() {
        return get(0);
    }

    public double confidence() {
        return get(1);
    }

    private double get(int i) {
        if (i >= values.size()) throw new IllegalStateException("truth value has no " + FIELDS.get(i));
        return values.get(i);
    }
}
