package com.salesadvisor.exception;

public class InferenceApiUnavailableException extends SalesAdvisorException {
    public InferenceApiUnavailableException(Throwable cause) {
        super("INFERENCE_API_UNAVAILABLE",
              "The sales model inference service is currently unavailable. Please try again later.",
              cause);
    }
}
