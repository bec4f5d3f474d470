package org.pragmatica.querylang;

/**
 * Base of the failures a query can hit on its way from text to summary.
 */
public abstract class QueryCompilationException extends Exception {

    protected QueryCompilationException(String message) {
        super(message);
    }

    protected QueryCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
