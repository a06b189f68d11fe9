package com.telcobright.provisioner.core.exception;

/**
 * Base exception for input and configuration failures detected while
 * provisioning a benchmark schema. Database errors are not wrapped in this
 * type; they surface as {@link java.sql.SQLException}.
 */
public class SchemaProvisioningException extends RuntimeException {

    public SchemaProvisioningException(String message) {
        super(message);
    }

    public SchemaProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}
