package com.ifip.fundamentals.exception;

public abstract class FundamentalsException extends RuntimeException {

    protected FundamentalsException(String message) {
        super(message);
    }

    protected FundamentalsException(String message, Throwable cause) {
        super(message, cause);
    }
}
