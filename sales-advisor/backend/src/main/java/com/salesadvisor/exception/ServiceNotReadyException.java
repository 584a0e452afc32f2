package com.salesadvisor.exception;

public class ServiceNotReadyException extends SalesAdvisorException {
    public ServiceNotReadyException() {
        super("SERVICE_NOT_READY",
              "Service not initialized. Please wait for startup to complete.");
    }
}
