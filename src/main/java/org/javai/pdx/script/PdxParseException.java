package org.javai.pdx.script;

/**
 * Exception thrown when script text does not conform to the grammar.
 */
public class PdxParseException extends RuntimeException {

	private final String sourceName;
	private final int position;
	private final int line;
	private final int column;

	public PdxParseException(String message, String sourceName, int position, int line, int column) {
		super(message + " (" + sourceName + ", line " + line + ", column " + column + ", offset " + position + ")");
		this.sourceName = sourceName;
		this.position = position;
		this.line = line;
		this.column = column;
	}

	public String sourceName() {
		return sourceName;
	}

	public int position() {
		return position;
	}

	public int line() {
		return line;
	}

	public int column() {
		return column;
	}
}
