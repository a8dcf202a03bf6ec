package com.ifip.fundamentals.domain;

public record CompanyIdentity(String ticker, String cik, String companyName) {
}
