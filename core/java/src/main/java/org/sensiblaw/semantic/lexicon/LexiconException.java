package org.sensiblaw.semantic.lexicon;

/**
 * Raised when the lexicon resource is missing or malformed. The lexicon is loaded
 * once per process, so this is a packaging defect rather than a data condition.
 */
public class LexiconException extends RuntimeException {

    public LexiconException(String message) {
        super(message);
    }

    public LexiconException(String message, Throwable cause) {
        super(message, cause);
    }
}
