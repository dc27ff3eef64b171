package org.javai.pdx.script;

/**
 * An RGB triple written as <code>{ r g b }</code>.
 */
public record PdxColor(int red, int green, int blue) implements PdxValue {

	public PdxColor {
		if (red < 0 || green < 0 || blue < 0) {
			throw new IllegalArgumentException("Color components must be non-negative");
		}
	}

	@Override
	public Kind kind() {
		return Kind.COLOR;
	}
}
