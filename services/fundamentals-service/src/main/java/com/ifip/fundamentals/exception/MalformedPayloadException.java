package com.ifip.fundamentals.exception;

public class MalformedPayloadException extends FundamentalsException {

    public MalformedPayloadException(String message) {
        super(message);
    }

    public MalformedPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
