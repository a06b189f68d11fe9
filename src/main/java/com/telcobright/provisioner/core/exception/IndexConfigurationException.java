package com.telcobright.provisioner.core.exception;

/**
 * Thrown for an index type token outside the supported set.
 */
public class IndexConfigurationException extends SchemaProvisioningException {

    private final String token;

    public IndexConfigurationException(String token) {
        super("Unknown index type '" + token + "'");
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
