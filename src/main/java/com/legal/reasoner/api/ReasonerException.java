package com.legal.reasoner.api;

/** Base type for all failures raised by the reasoner. */
public class ReasonerException extends RuntimeException {

    public ReasonerException(String message) {
        super(message);
    }

    public ReasonerException(String message, Throwable cause) {
        super(message, cause);
    }
}
