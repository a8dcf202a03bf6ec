package com.ifip.fundamentals.batch;

public enum RunStatus {
    RUNNING,
    SUCCEEDED,
    PARTIAL_SUCCESS,
    CANCELLED
}
