package org.javai.pdx.script;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A signed numeric literal.
 *
 * The node keeps the literal text it was parsed from so an untouched number prints
 * exactly as it was read. {@link #multiply(BigDecimal)} is the only mutation; it
 * replaces the literal with the plain decimal rendering of the new value.
 */
public final class PdxNumber implements PdxValue {

	private String literal;
	private BigDecimal value;

	private PdxNumber(String literal, BigDecimal value) {
		this.literal = literal;
		this.value = value;
	}

	/**
	 * Creates a number from literal text such as {@code -3}, {@code +2} or {@code 0.25}.
	 *
	 * @throws NumberFormatException if the text is not a decimal literal
	 */
	public static PdxNumber parse(String literal) {
		Objects.requireNonNull(literal, "literal must not be null");
		return new PdxNumber(literal, new BigDecimal(literal));
	}

	public static PdxNumber of(BigDecimal value) {
		Objects.requireNonNull(value, "value must not be null");
		return new PdxNumber(format(value), value);
	}

	public static PdxNumber of(long value) {
		return of(BigDecimal.valueOf(value));
	}

	public String literal() {
		return literal;
	}

	public BigDecimal value() {
		return value;
	}

	/**
	 * Whether the literal was written with a decimal point.
	 */
	public boolean isFloating() {
		return literal.indexOf('.') >= 0;
	}

	/**
	 * Multiplies the stored value in place.
	 */
	public void multiply(BigDecimal factor) {
		Objects.requireNonNull(factor, "factor must not be null");
		value = value.multiply(factor);
		literal = format(value);
	}

	static String format(BigDecimal value) {
		BigDecimal stripped = value.stripTrailingZeros();
		if (stripped.scale() < 0) {
			stripped = stripped.setScale(0);
		}
		return stripped.toPlainString();
	}

	@Override
	public Kind kind() {
		return Kind.NUMBER;
	}

	/**
	 * Numbers are equal when their values compare equal and they share the same
	 * integer/float kind; literal spelling is not significant.
	 */
	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof PdxNumber other)) {
			return false;
		}
		return value.compareTo(other.value) == 0 && isFloating() == other.isFloating();
	}

	@Override
	public int hashCode() {
		return Objects.hash(value.stripTrailingZeros(), isFloating());
	}

	@Override
	public String toString() {
		return literal;
	}
}
