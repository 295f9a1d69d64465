package com.example.teausage.services;

/** A constant or reference table is missing, zero, negative or malformed. Fatal for a run. */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) { super(message); }
    public ConfigurationException(String message, Throwable cause) { super(message, cause); }
}
