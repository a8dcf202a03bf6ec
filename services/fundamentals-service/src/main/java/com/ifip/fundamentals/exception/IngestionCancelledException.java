package com.ifip.fundamentals.exception;

public class IngestionCancelledException extends FundamentalsException {

    public IngestionCancelledException(String ticker, Throwable cause) {
        super("Fetch cancelled for " + ticker, cause);
    }
}
