package com.cred.freestyle.salesdata.exception;

/**
 * Exception thrown when a generation run is requested while another one is still going.
 *
 * @author Sales Data Team
 */
public class GenerationInProgressException extends RuntimeException {

    public GenerationInProgressException() {
        super("A sales data generation run is already in progress");
    }
}
