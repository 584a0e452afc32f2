package com.salesadvisor.exception;

public class InferenceApiException extends SalesAdvisorException {
    public InferenceApiException(String message) {
        super("INFERENCE_API_ERROR", message);
    }
    public InferenceApiException(String message, Throwable cause) {
        super("INFERENCE_API_ERROR", message, cause);
    }
}
