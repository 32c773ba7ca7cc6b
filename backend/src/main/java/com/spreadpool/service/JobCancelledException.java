package com.spreadpool.service;

/** Raised when a running job observes a cancellation request. */
public class JobCancelledException extends RuntimeException {
    public JobCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
