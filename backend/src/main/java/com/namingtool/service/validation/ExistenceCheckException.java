package com.namingtool.service.validation;

/**
 * Transient failure to answer an existence query (timeout, transport or authorization error).
 */
public class ExistenceCheckException extends RuntimeException {

    public ExistenceCheckException(String message) {
        super(message);
    }

    public ExistenceCheckException(String message, Throwable cause) {
        super(message, cause);
    }
}
