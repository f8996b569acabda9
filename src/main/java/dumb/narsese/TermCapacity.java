package dumb.narsese;

/**
 * How a term stores its components.
 * <p>
 * {@code BINARY_SET} and {@code SET} hold unordered components: swapping or reordering them
 * does not change the term. Lexical terms only ever report {@code ATOM}, {@code VEC} or
 * {@code BINARY_VEC}, since the lexical model knows nothing about symmetry.
 */
public enum TermCapacity {
    ATOM(0, 0),
    UNARY(1, 1),
    BINARY_VEC(2, 2),
    BINARY_SET(2, 2),
    VEC(1, Integer.MAX_VALUE),
    SET(1, Integer.MAX_VALUE);

    public final int min;
    public final int max;

    TermCapacity(int min, int max) {
        this.min = min;
        this.max = max;
    }

    public boolean fixed() {
        return min == max;
    }

    public boolean ordered() {
        return this != BINARY_SET && this != SET;
    }

    public boolean accepts(int size) {
        return size >= min && size <= max;
    }
}
