package com.notice.evaluation.exception;

public class UnknownModelException extends RuntimeException {

    public UnknownModelException(String selector) {
        super("Unknown model: " + selector);
    }
}
