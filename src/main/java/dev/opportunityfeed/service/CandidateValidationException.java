package dev.opportunityfeed.service;

/**
 * A candidate is missing a field storage requires.
 */
public class CandidateValidationException extends RuntimeException {

    public CandidateValidationException(String message) {
        super(message);
    }
}
