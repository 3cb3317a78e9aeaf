package com.cred.freestyle.salesdata.exception;

/**
 * Exception thrown when existing order history could not be removed before a run.
 * The clear is all-or-nothing, so nothing was deleted and the run did not start.
 *
 * @author Sales Data Team
 */
public class HistoryClearException extends RuntimeException {

    public HistoryClearException(String message, Throwable cause) {
        super(message, cause);
    }
}
