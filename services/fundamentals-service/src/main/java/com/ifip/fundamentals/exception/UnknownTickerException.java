package com.ifip.fundamentals.exception;

public class UnknownTickerException extends FundamentalsException {

    private final String ticker;

    public UnknownTickerException(String ticker) {
        super("Unknown ticker: " + ticker);
        this.ticker = ticker;
    }

    public String getTicker() {
        return ticker;
    }
}
