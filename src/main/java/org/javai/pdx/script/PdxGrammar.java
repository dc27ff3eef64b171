package org.javai.pdx.script;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Lexical rules and alternative priorities for Paradox script.
 *
 * A grammar is an immutable value: build it once and hand it to every {@link PdxParser}
 * that needs it.
 *
 * @param valuePriority order in which value alternatives win when they consume the same
 *        number of characters
 * @param listingElementPriority the same for listing elements
 * @param commentStart character that starts a comment running to the end of the line
 */
public record PdxGrammar(List<PdxValue.Kind> valuePriority,
		List<PdxValue.Kind> listingElementPriority,
		char commentStart) {

	private static final Set<PdxValue.Kind> ELEMENT_KINDS = EnumSet.of(PdxValue.Kind.IDENTIFIER, PdxValue.Kind.STRING);

	private static final PdxGrammar STANDARD = new PdxGrammar(
			List.of(PdxValue.Kind.values()),
			List.of(PdxValue.Kind.IDENTIFIER, PdxValue.Kind.STRING),
			'#');

	public PdxGrammar {
		valuePriority = List.copyOf(valuePriority);
		listingElementPriority = List.copyOf(listingElementPriority);
		if (EnumSet.copyOf(valuePriority).size() != PdxValue.Kind.values().length
				|| valuePriority.size() != PdxValue.Kind.values().length) {
			throw new IllegalArgumentException("Value priority must list every kind exactly once: " + valuePriority);
		}
		if (listingElementPriority.isEmpty() || !ELEMENT_KINDS.containsAll(listingElementPriority)) {
			throw new IllegalArgumentException("Listing elements must be identifiers or strings: " + listingElementPriority);
		}
	}

	/**
	 * The grammar used by the game's content files:
	 * Number, Color, Listing, Block, Identifier, String; comments start with {@code #}.
	 */
	public static PdxGrammar standard() {
		return STANDARD;
	}

	public boolean isIdentifierStart(char c) {
		return Character.isLetter(c) || isDigit(c) || c == '_' || c == '-';
	}

	public boolean isIdentifierPart(char c) {
		return isIdentifierStart(c) || c == '.' || c == ':';
	}

	public boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	public boolean isWhitespace(char c) {
		return Character.isWhitespace(c) || c == '\uFEFF';
	}
}
