package org.javai.pdx.script;

import java.util.Objects;

/**
 * A bare word: keys, flags, dates and most scalar values.
 */
public record PdxIdentifier(String value) implements PdxListElement {

	public PdxIdentifier {
		Objects.requireNonNull(value, "value must not be null");
	}

	@Override
	public Kind kind() {
		return Kind.IDENTIFIER;
	}

	@Override
	public String toString() {
		return value;
	}
}
