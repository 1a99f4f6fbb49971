package com.ads.guardian.config;

/**
 * Missing or malformed guardian configuration. Fatal at startup.
 */
public class GuardianConfigurationException extends RuntimeException {

    public GuardianConfigurationException(String message) {
        super(message);
    }

    public GuardianConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
