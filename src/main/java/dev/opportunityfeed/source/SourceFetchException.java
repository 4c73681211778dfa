package dev.opportunityfeed.source;

/**
 * A source answered, but with something that cannot be used (error envelope, wrong shape).
 */
public class SourceFetchException extends RuntimeException {

    public SourceFetchException(String message) {
        super(message);
    }
}
