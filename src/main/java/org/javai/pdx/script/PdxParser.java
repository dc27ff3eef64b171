package org.javai.pdx.script;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Parser for Paradox script files.
 *
 * <pre>
 * File       ::= Expression*
 * Expression ::= Identifier '=' Value
 * Value      ::= Number | Color | Listing | Block | Identifier | String
 * Listing    ::= '{' (Identifier | String)+ '}'
 * Block      ::= '{' Expression* '}'
 * Color      ::= '{' digits digits digits '}'
 * </pre>
 *
 * Where several alternatives match at the same position, every one of them is tried
 * and the one that consumes the most characters wins; ties go to the alternative listed
 * first in the grammar's priority order. So {@code 10} is a number, {@code 1.5.2} is an
 * identifier and <code>{ 10 20 30 }</code> is a color rather than a listing.
 *
 * The whole input must be consumed. Comments are skipped and not represented.
 *
 * Example usage:
 *
 * <pre>
 * PdxParser parser = new PdxParser(PdxGrammar.standard());
 * List&lt;PdxExpression&gt; tree = parser.parse("base_tax = 1.5", "inline");
 * </pre>
 */
public class PdxParser {

	private final PdxGrammar grammar;

	public PdxParser(PdxGrammar grammar) {
		this.grammar = Objects.requireNonNull(grammar, "grammar must not be null");
	}

	public List<PdxExpression> parse(String source) {
		return parse(source, "<input>");
	}

	/**
	 * Parses a complete file.
	 *
	 * @param source the script text
	 * @param sourceName name used in error messages
	 * @return the top-level expressions, in order
	 * @throws PdxParseException if the text is malformed or not fully consumed
	 */
	public List<PdxExpression> parse(String source, String sourceName) {
		return new Run(new PdxTokenizer(source, grammar), sourceName).file();
	}

	/**
	 * Reads and parses a file with the given encoding.
	 */
	public List<PdxExpression> parseFile(Path path, Charset charset) throws IOException {
		return parse(Files.readString(path, charset), path.toString());
	}

	/**
	 * A successful match: the node and the offset just past it.
	 */
	private record Match<T>(T node, int end) {
	}

	/**
	 * State of a single parse.
	 */
	private final class Run {

		private final PdxTokenizer tokens;
		private final String sourceName;

		Run(PdxTokenizer tokens, String sourceName) {
			this.tokens = tokens;
			this.sourceName = sourceName;
		}

		List<PdxExpression> file() {
			List<PdxExpression> expressions = new ArrayList<>();
			int pos = 0;
			Match<PdxExpression> next;
			while ((next = expression(pos)) != null) {
				expressions.add(next.node());
				pos = next.end();
			}
			int rest = tokens.skipIgnorable(pos);
			if (rest < tokens.length()) {
				throw failure("Unexpected input", Math.max(rest, tokens.furthest()));
			}
			return expressions;
		}

		private Match<PdxExpression> expression(int pos) {
			PdxToken lhs = tokens.identifierAt(pos);
			if (lhs == null) {
				return null;
			}
			PdxToken equals = tokens.symbolAt(lhs.end(), PdxToken.TokenType.EQUALS);
			if (equals == null) {
				return null;
			}
			Match<PdxValue> rhs = value(equals.end());
			if (rhs == null) {
				return null;
			}
			return new Match<>(new PdxExpression(new PdxIdentifier(lhs.value()), rhs.node()), rhs.end());
		}

		private Match<PdxValue> value(int pos) {
			Match<PdxValue> best = null;
			for (PdxValue.Kind kind : grammar.valuePriority()) {
				Match<? extends PdxValue> candidate = switch (kind) {
					case NUMBER -> number(pos);
					case COLOR -> color(pos);
					case LISTING -> listing(pos);
					case BLOCK -> block(pos);
					case IDENTIFIER -> identifier(pos);
					case STRING -> string(pos);
				};
				// strictly longer only, so earlier kinds win ties
				if (candidate != null && (best == null || candidate.end() > best.end())) {
					best = new Match<>(candidate.node(), candidate.end());
				}
			}
			return best;
		}

		private Match<PdxListElement> listElement(int pos) {
			Match<PdxListElement> best = null;
			for (PdxValue.Kind kind : grammar.listingElementPriority()) {
				Match<? extends PdxListElement> candidate = kind == PdxValue.Kind.STRING ? string(pos) : identifier(pos);
				if (candidate != null && (best == null || candidate.end() > best.end())) {
					best = new Match<>(candidate.node(), candidate.end());
				}
			}
			return best;
		}

		private Match<PdxNumber> number(int pos) {
			PdxToken token = tokens.numberAt(pos);
			return token == null ? null : new Match<>(PdxNumber.parse(token.value()), token.end());
		}

		private Match<PdxIdentifier> identifier(int pos) {
			PdxToken token = tokens.identifierAt(pos);
			return token == null ? null : new Match<>(new PdxIdentifier(token.value()), token.end());
		}

		private Match<PdxString> string(int pos) {
			PdxToken token = tokens.stringAt(pos);
			return token == null ? null : new Match<>(new PdxString(token.value()), token.end());
		}

		private Match<PdxColor> color(int pos) {
			PdxToken open = tokens.symbolAt(pos, PdxToken.TokenType.LBRACE);
			if (open == null) {
				return null;
			}
			int[] rgb = new int[3];
			int cursor = open.end();
			for (int i = 0; i < rgb.length; i++) {
				PdxToken digits = tokens.digitsAt(cursor);
				if (digits == null) {
					return null;
				}
				try {
					rgb[i] = Integer.parseInt(digits.value());
				} catch (NumberFormatException e) {
					// too large for a color component; let another alternative claim it
					return null;
				}
				cursor = digits.end();
			}
			PdxToken close = tokens.symbolAt(cursor, PdxToken.TokenType.RBRACE);
			if (close == null) {
				return null;
			}
			return new Match<>(new PdxColor(rgb[0], rgb[1], rgb[2]), close.end());
		}

		private Match<PdxListing> listing(int pos) {
			PdxToken open = tokens.symbolAt(pos, PdxToken.TokenType.LBRACE);
			if (open == null) {
				return null;
			}
			List<PdxListElement> elements = new ArrayList<>();
			int cursor = open.end();
			Match<PdxListElement> element;
			while ((element = listElement(cursor)) != null) {
				elements.add(element.node());
				cursor = element.end();
			}
			if (elements.isEmpty()) {
				return null;
			}
			PdxToken close = tokens.symbolAt(cursor, PdxToken.TokenType.RBRACE);
			if (close == null) {
				return null;
			}
			return new Match<>(new PdxListing(elements), close.end());
		}

		private Match<PdxBlock> block(int pos) {
			PdxToken open = tokens.symbolAt(pos, PdxToken.TokenType.LBRACE);
			if (open == null) {
				return null;
			}
			List<PdxExpression> entries = new ArrayList<>();
			int cursor = open.end();
			Match<PdxExpression> entry;
			while ((entry = expression(cursor)) != null) {
				entries.add(entry.node());
				cursor = entry.end();
			}
			PdxToken close = tokens.symbolAt(cursor, PdxToken.TokenType.RBRACE);
			if (close == null) {
				return null;
			}
			return new Match<>(new PdxBlock(entries), close.end());
		}

		private PdxParseException failure(String message, int pos) {
			int[] lineAndColumn = tokens.lineAndColumn(pos);
			return new PdxParseException(
					message + " near '" + tokens.excerpt(pos) + "'",
					sourceName,
					pos,
					lineAndColumn[0],
					lineAndColumn[1]);
		}
	}
}
