package org.javai.pdx.script;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Prints a parsed tree back to script text that the {@link PdxParser} accepts.
 *
 * Output is canonical: one expression per line, tab indentation, comments are not
 * reproduced. A block with a single scalar entry and a listing with a single element stay
 * on one line; anything larger opens a new indentation level.
 */
public class PdxPrinter {

	private static final String INDENT = "\t";

	/**
	 * Static convenience method to print a whole file.
	 */
	public static String print(List<PdxExpression> expressions) {
		StringBuilder out = new StringBuilder();
		new PdxPrinter().write(expressions, out);
		return out.toString();
	}

	/**
	 * Static convenience method to print a single value at depth 0.
	 */
	public static String print(PdxValue value) {
		StringBuilder out = new StringBuilder();
		new PdxPrinter().writeValue(value, 0, out);
		return out.toString();
	}

	/**
	 * Writes each expression on its own line.
	 */
	public void write(List<PdxExpression> expressions, Appendable out) {
		for (PdxExpression expression : expressions) {
			writeExpression(expression, 0, out);
		}
	}

	public void writeExpression(PdxExpression expression, int depth, Appendable out) {
		indent(depth, out);
		append(out, expression.key());
		append(out, " = ");
		writeValue(expression.rhs(), depth, out);
		append(out, "\n");
	}

	public void writeValue(PdxValue value, int depth, Appendable out) {
		switch (value.kind()) {
			case IDENTIFIER, STRING -> append(out, ((PdxListElement) value).value());
			case NUMBER -> append(out, ((PdxNumber) value).literal());
			case COLOR -> {
				PdxColor color = (PdxColor) value;
				append(out, "{ " + color.red() + " " + color.green() + " " + color.blue() + " }");
			}
			case LISTING -> writeListing((PdxListing) value, depth, out);
			case BLOCK -> writeBlock((PdxBlock) value, depth, out);
		}
	}

	private void writeListing(PdxListing listing, int depth, Appendable out) {
		List<PdxListElement> elements = listing.elements();
		if (elements.isEmpty()) {
			append(out, "{ }");
		} else if (elements.size() == 1) {
			append(out, "{ " + elements.get(0).value() + " }");
		} else {
			append(out, "{\n");
			for (PdxListElement element : elements) {
				indent(depth + 1, out);
				append(out, element.value());
				append(out, "\n");
			}
			indent(depth, out);
			append(out, "}");
		}
	}

	private void writeBlock(PdxBlock block, int depth, Appendable out) {
		List<PdxExpression> entries = block.entries();
		if (entries.isEmpty()) {
			append(out, "{ }");
		} else if (entries.size() == 1 && !entries.get(0).rhs().isCompound()) {
			PdxExpression only = entries.get(0);
			append(out, "{ " + only.key() + " = ");
			writeValue(only.rhs(), depth, out);
			append(out, " }");
		} else {
			append(out, "{\n");
			for (PdxExpression entry : entries) {
				writeExpression(entry, depth + 1, out);
			}
			indent(depth, out);
			append(out, "}");
		}
	}

	private void indent(int depth, Appendable out) {
		append(out, INDENT.repeat(depth));
	}

	private void append(Appendable out, String text) {
		try {
			out.append(text);
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}
}
