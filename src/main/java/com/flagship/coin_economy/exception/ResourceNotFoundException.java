package com.flagship.coin_economy.exception;

public class ResourceNotFoundException extends EconomyException {

    public ResourceNotFoundException(String resource, Object id) {
        super(resource + " not found: " + id);
    }

    @Override
    public String getErrorCode() {
        return "NOT_FOUND";
    }
}
