package dumb.narsese.term;

import java.math.BigDecimal;
import java.util.List;

/**
 * Validation and formatting of the unit-interval numbers in truth values and budgets.
 */
public final class Floats {
    private Floats() {}

    /**
     * @return {@code value}, with negative zero replaced by zero
     * @throws IllegalArgumentException if {@code value} is not within {@code [0, 1]}
     */
    public static double unit(double value, String field) {
        if (Double.isNaN(value) || value < 0 || value > 1)
            throw new IllegalArgumentException(field + " must be within [0, 1], got " + value);
        return value == 0 ? 0.0 : value;
    }

    /** Validates every element against the field name at the same index. */
    static List<Double> units(List<Double> values, List<String> fields, String what) {
        if (values.size() > fields.size())
            throw new IllegalArgumentException(what + " takes at most " + fields.size() + " values, got " + values.size());
        var out = new Double[values.size()];
        for (var i = 0; i < out.length; i++) out[i] = unit(values.get(i), fields.get(i));
        return List.of(out);
    }

    /** Plain decimal text without exponent, so the result is always a valid numeric token. */
    public static String format(double value) {
        return BigDecimal.valueOf(value).toPlainString();
    }
}
