package org.javai.pdx.config;

/**
 * Thrown when a configuration file is missing required settings or has values of the
 * wrong type.
 */
public class ConfigurationException extends RuntimeException {

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
