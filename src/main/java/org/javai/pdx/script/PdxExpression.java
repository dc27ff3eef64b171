package org.javai.pdx.script;

import java.util.Objects;

/**
 * A single <code>lhs = rhs</code> statement. A script file is a list of these.
 */
public record PdxExpression(PdxIdentifier lhs, PdxValue rhs) {

	public PdxExpression {
		Objects.requireNonNull(lhs, "lhs must not be null");
		Objects.requireNonNull(rhs, "rhs must not be null");
	}

	public static PdxExpression of(String key, PdxValue value) {
		return new PdxExpression(new PdxIdentifier(key), value);
	}

	public String key() {
		return lhs.value();
	}

	/**
	 * Returns the rhs as a block or fails with a schema error naming {@code origin}.
	 */
	public PdxBlock requireBlock(String origin) {
		if (rhs instanceof PdxBlock block) {
			return block;
		}
		throw new PdxSchemaException(
				"Expected a block for '" + key() + "' in " + origin + ", found " + rhs.kind());
	}
}
