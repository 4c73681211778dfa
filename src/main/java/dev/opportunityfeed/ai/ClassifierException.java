package dev.opportunityfeed.ai;

/**
 * The classifier endpoint answered, but with nothing usable.
 */
public class ClassifierException extends RuntimeException {

    public ClassifierException(String message) {
        super(message);
    }
}
