package org.javai.pdx.script;

/**
 * A terminal matched in the script text.
 *
 * @param type the token type
 * @param value the matched text, verbatim (strings keep their quotes)
 * @param position the character offset of the first matched character
 */
public record PdxToken(TokenType type, String value, int position) {

	public enum TokenType {
		IDENTIFIER,    // keys, flags, dates
		STRING,        // "quoted", may span lines
		NUMBER,        // [sign]digits[.digits]
		DIGITS,        // unsigned run of digits, used by colors
		LBRACE,        // {
		RBRACE,        // }
		EQUALS         // =
	}

	/**
	 * Offset just past the last matched character.
	 */
	public int end() {
		return position + value.length();
	}

	@Override
	public String toString() {
		return switch (type) {
			case IDENTIFIER, NUMBER, DIGITS -> type + "(" + value + ")";
			case STRING -> "STRING(" + value + ")";
			default -> type.toString();
		};
	}
}
