package com.myscrollr.delivery.routing;

/**
 * A change record's recipients could not be determined. Affects that record only.
 */
public class RecordResolutionException extends RuntimeException {

    public RecordResolutionException(String message) {
        super(message);
    }
}
