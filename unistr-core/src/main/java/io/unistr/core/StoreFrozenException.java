package io.unistr.core;

/**
 * Thrown when a store that has already been frozen is asked to accept or look up
 * new content. The dedup index no longer exists at that point, so the call is a
 * programming error rather than a recoverable condition.
 */
public class StoreFrozenException extends UniqueStringsException {

    public StoreFrozenException(String message) {
        super(message);
    }
}
