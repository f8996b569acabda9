package dumb.narsese;

/**
 * Base of the two failures a caller can get from this library: text that does not match the
 * grammar, and well-formed text that does not fit the vocabulary.
 */
public abstract class NarseseException extends Exception {
    protected NarseseException(String message) {
        super(message);
    }
}
