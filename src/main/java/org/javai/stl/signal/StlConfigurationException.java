package org.javai.stl.signal;

/**
 * Exception thrown when a signal catalog cannot be read or is malformed.
 */
public class StlConfigurationException extends RuntimeException {

	public StlConfigurationException(String message) {
		super(message);
	}

	public StlConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
