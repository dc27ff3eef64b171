package org.javai.pdx.script;

/**
 * Terminal matchers for Paradox script.
 *
 * Unlike a stream tokenizer, every matcher is asked for a token at a given offset and
 * answers {@code null} when the terminal does not match there. The parser uses this to
 * try competing interpretations of the same characters. Every matcher skips leading
 * whitespace and comments first.
 */
public class PdxTokenizer {

	private final String input;
	private final PdxGrammar grammar;
	private int furthest = 0;

	public PdxTokenizer(String input, PdxGrammar grammar) {
		this.input = input != null ? input : "";
		this.grammar = grammar;
	}

	public int length() {
		return input.length();
	}

	/**
	 * Furthest offset at which any matcher was asked for a token. Used to locate
	 * parse failures.
	 */
	public int furthest() {
		return furthest;
	}

	/**
	 * Skips whitespace and comments.
	 *
	 * @return the offset of the next significant character, or {@link #length()}
	 */
	public int skipIgnorable(int pos) {
		while (pos < input.length()) {
			char c = input.charAt(pos);
			if (grammar.isWhitespace(c)) {
				pos++;
			} else if (c == grammar.commentStart()) {
				while (pos < input.length() && input.charAt(pos) != '\n') {
					pos++;
				}
			} else {
				break;
			}
		}
		return pos;
	}

	public PdxToken identifierAt(int pos) {
		int start = begin(pos);
		if (start >= input.length() || !grammar.isIdentifierStart(input.charAt(start))) {
			return null;
		}
		int end = start + 1;
		while (end < input.length() && grammar.isIdentifierPart(input.charAt(end))) {
			end++;
		}
		return token(PdxToken.TokenType.IDENTIFIER, start, end);
	}

	/**
	 * Matches {@code [+-]?digits(.digits?)?}.
	 */
	public PdxToken numberAt(int pos) {
		int start = begin(pos);
		int end = start;
		if (end < input.length() && (input.charAt(end) == '-' || input.charAt(end) == '+')) {
			end++;
		}
		int digitsStart = end;
		end = skipDigits(end);
		if (end == digitsStart) {
			return null;
		}
		if (end < input.length() && input.charAt(end) == '.') {
			end = skipDigits(end + 1);
		}
		return token(PdxToken.TokenType.NUMBER, start, end);
	}

	/**
	 * Matches an unsigned run of digits.
	 */
	public PdxToken digitsAt(int pos) {
		int start = begin(pos);
		int end = skipDigits(start);
		return end == start ? null : token(PdxToken.TokenType.DIGITS, start, end);
	}

	/**
	 * Matches a double-quoted string. There are no escapes and the string may span lines.
	 */
	public PdxToken stringAt(int pos) {
		int start = begin(pos);
		if (start >= input.length() || input.charAt(start) != '"') {
			return null;
		}
		int close = input.indexOf('"', start + 1);
		if (close < 0) {
			furthest = input.length();
			return null;
		}
		return token(PdxToken.TokenType.STRING, start, close + 1);
	}

	public PdxToken symbolAt(int pos, PdxToken.TokenType type) {
		char expected = switch (type) {
			case LBRACE -> '{';
			case RBRACE -> '}';
			case EQUALS -> '=';
			default -> throw new IllegalArgumentException("Not a symbol token: " + type);
		};
		int start = begin(pos);
		if (start >= input.length() || input.charAt(start) != expected) {
			return null;
		}
		return token(type, start, start + 1);
	}

	/**
	 * Converts an offset into a 1-based line and column.
	 */
	public int[] lineAndColumn(int pos) {
		int line = 1;
		int lineStart = 0;
		int limit = Math.min(pos, input.length());
		for (int i = 0; i < limit; i++) {
			if (input.charAt(i) == '\n') {
				line++;
				lineStart = i + 1;
			}
		}
		return new int[] { line, pos - lineStart + 1 };
	}

	/**
	 * A short single-line excerpt of the input starting at {@code pos}.
	 */
	public String excerpt(int pos) {
		if (pos >= input.length()) {
			return "<end of input>";
		}
		int end = Math.min(input.length(), pos + 30);
		int newline = input.indexOf('\n', pos);
		if (newline >= 0 && newline < end) {
			end = newline;
		}
		return input.substring(pos, end).strip();
	}

	private int begin(int pos) {
		int start = skipIgnorable(pos);
		if (start > furthest) {
			furthest = start;
		}
		return start;
	}

	private int skipDigits(int pos) {
		while (pos < input.length() && grammar.isDigit(input.charAt(pos))) {
			pos++;
		}
		return pos;
	}

	private PdxToken token(PdxToken.TokenType type, int start, int end) {
		return new PdxToken(type, input.substring(start, end), start);
	}
}
