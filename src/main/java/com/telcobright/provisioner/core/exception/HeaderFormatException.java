package com.telcobright.provisioner.core.exception;

/**
 * Thrown when the dataset header does not have the expected three-line shape.
 */
public class HeaderFormatException extends SchemaProvisioningException {

    public HeaderFormatException(String message) {
        super(message);
    }

    public HeaderFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
