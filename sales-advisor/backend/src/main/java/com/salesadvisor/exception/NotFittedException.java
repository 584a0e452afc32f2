package com.salesadvisor.exception;

public class NotFittedException extends SalesAdvisorException {
    public NotFittedException(String component) {
        super("NOT_FITTED", component + " is not fitted yet.");
    }
}
