package org.javai.pdx.script;

/**
 * Thrown when a parsed tree does not have the shape a fixed schema location requires.
 */
public class PdxSchemaException extends RuntimeException {

	public PdxSchemaException(String message) {
		super(message);
	}
}
