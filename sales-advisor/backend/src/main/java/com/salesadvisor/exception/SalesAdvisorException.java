package com.salesadvisor.exception;

import lombok.Getter;

@Getter
public abstract class SalesAdvisorException extends RuntimeException {
    private final String errorCode;
    protected SalesAdvisorException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected SalesAdvisorException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
