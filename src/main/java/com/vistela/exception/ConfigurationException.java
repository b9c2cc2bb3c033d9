package com.vistela.exception;

import java.util.List;

/**
 * Required settings are absent. Raised before any connection or network call is attempted.
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> missingProperties;

    public ConfigurationException(List<String> missingProperties) {
        super("Missing required configuration: " + String.join(", ", missingProperties));
        this.missingProperties = List.copyOf(missingProperties);
    }

    public List<String> getMissingProperties() {
        return missingProperties;
    }
}
