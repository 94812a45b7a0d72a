package io.unistr.core;

public class UniqueStringsException extends RuntimeException {

    public UniqueStringsException(String message) {
        super(message);
    }

}
