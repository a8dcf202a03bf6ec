package com.ifip.fundamentals.controller;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;

public record RefreshRequest(
    @NotEmpty(message = "tickers must not be empty")
    @Size(max = 200)
    List<String> tickers
) {
}
