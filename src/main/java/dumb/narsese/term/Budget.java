package dumb.narsese.term;

import java.util.List;

/**
 * Priority, durability and quality; zero to three components, each within {@code [0, 1]}.
 * {@link #EMPTY} is the explicit {@code $$} budget.
 */
public record Budget(List<Double> values) {
    public static final List<String> FIELDS = List.of("priority", "durability", "quality");
    public static final Budget EMPTY = new Budget(List.of());

    public Budget {
        values = Floats.units(values, FIELDS, "budget");
    }

    public static Budget of(double priority) {
        return new Budget(List.of(priority));
    }

    public static Budget of(double priority, double durability) {
        return new Budget(List.of(priority, durability));
    }

    public static Budget of(double priority, double durability, double quality) {
        return new Budget(List.of(priority, durability, quality));
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public double priority() {
        return get(0);
    }

    public double durability() {
        return get(1);
    }

    public double quality() {
        return get(2);
    }

    private double get(int i) {
        if (i >= values.size()) throw new IllegalStateException("budget has no " + FIELDS.get(i));
        return values.get(i);
    }
}
