package dumb.narsese.term;

import dumb.narsese.TermCapacity;

/**
 * Compound kinds. Each carries the arity rule checked at construction and whether member order
 * is part of the term's identity.
 */
public enum Connector {
    SET_EXTENSION(Arity.VARIADIC, false),
    SET_INTENSION(Arity.VARIADIC, false),
    INTERSECTION_EXTENSION(Arity.VARIADIC, false),
    INTERSECTION_INTENSION(Arity.VARIADIC, false),
    DIFFERENCE_EXTENSION(Arity.BINARY, true),
    DIFFERENCE_INTENSION(Arity.BINARY, true),
    PRODUCT(Arity.VARIADIC, true),
    IMAGE_EXTENSION(Arity.IMAGE, true),
    IMAGE_INTENSION(Arity.IMAGE, true),
    CONJUNCTION(Arity.VARIADIC, false),
    DISJUNCTION(Arity.VARIADIC, false),
    NEGATION(Arity.UNARY, true),
    CONJUNCTION_SEQUENTIAL(Arity.VARIADIC, true),
    CONJUNCTION_PARALLEL(Arity.VARIADIC, false);

    public final Arity arity;
    public final boolean ordered;

    Connector(Arity arity, boolean ordered) {
        this.arity = arity;
        this.ordered = ordered;
    }

    public boolean isSet() {
        return this == SET_EXTENSION || this == SET_INTENSION;
    }

    public boolean isImage() {
        return arity == Arity.IMAGE;
    }

    public TermCapacity capacity() {
        return switch (arity) {
            case UNARY -> TermCapacity.UNARY;
            case BINARY -> TermCapacity.BINARY_VEC;
            case VARIADIC, IMAGE -> ordered ? TermCapacity.VEC : TermCapacity.SET;
        };
    }

    /**
     * Component counts a connector accepts. For images the count includes the placeholder
     * slot, of which there must be exactly one.
     */
    public enum Arity {
        UNARY(1, 1),
        BINARY(2, 2),
        VARIADIC(1, Integer.MAX_VALUE),
        IMAGE(2, Integer.MAX_VALUE);

        public final int min;
        public final int max;

        Arity(int min, int max) {
            this.min = min;
            this.max = max;
        }

        public boolean accepts(int n) {
            return n >= min && n <= max;
        }

        public String describe() {
            if (min == max) return "exactly " + min;
            return "at least " + min;
        }
    }
}
