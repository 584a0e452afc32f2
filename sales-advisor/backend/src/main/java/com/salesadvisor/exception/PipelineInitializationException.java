package com.salesadvisor.exception;

public class PipelineInitializationException extends SalesAdvisorException {
    public PipelineInitializationException(String message) {
        super("PIPELINE_INITIALIZATION_FAILED", message);
    }
}
