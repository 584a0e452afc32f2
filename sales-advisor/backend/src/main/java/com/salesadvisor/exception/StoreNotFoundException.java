package com.salesadvisor.exception;

public class StoreNotFoundException extends SalesAdvisorException {
    public StoreNotFoundException(int storeId) {
        super("STORE_NOT_FOUND", "Store " + storeId + " not found.");
    }
}
