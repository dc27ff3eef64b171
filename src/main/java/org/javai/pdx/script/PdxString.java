package org.javai.pdx.script;

import java.util.Objects;

/**
 * A quoted string. The surrounding double quotes are part of {@link #value()}.
 */
public record PdxString(String value) implements PdxListElement {

	public PdxString {
		Objects.requireNonNull(value, "value must not be null");
		if (value.length() < 2 || value.charAt(0) != '"' || value.charAt(value.length() - 1) != '"') {
			throw new IllegalArgumentException("String value must keep its quotes: " + value);
		}
	}

	/**
	 * Creates a string node from unquoted text.
	 */
	public static PdxString quote(String text) {
		return new PdxString('"' + text + '"');
	}

	/**
	 * The text between the quotes.
	 */
	public String unquoted() {
		return value.substring(1, value.length() - 1);
	}

	@Override
	public Kind kind() {
		return Kind.STRING;
	}

	@Override
	public String toString() {
		return value;
	}
}
