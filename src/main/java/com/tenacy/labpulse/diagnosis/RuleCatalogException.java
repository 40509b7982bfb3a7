package com.tenacy.labpulse.diagnosis;

public class RuleCatalogException extends RuntimeException {

    public RuleCatalogException(String message) {
        super(message);
    }

    public RuleCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
