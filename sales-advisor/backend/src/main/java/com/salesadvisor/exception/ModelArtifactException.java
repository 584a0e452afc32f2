package com.salesadvisor.exception;

public class ModelArtifactException extends SalesAdvisorException {
    public ModelArtifactException(String message) {
        super("MODEL_ARTIFACT_INVALID", message);
    }
    public ModelArtifactException(String message, Throwable cause) {
        super("MODEL_ARTIFACT_INVALID", message, cause);
    }
}
