package org.javai.pdx.script;

import java.util.List;

/**
 * An ordered run of identifiers and strings between braces, without assignments.
 */
public record PdxListing(List<PdxListElement> elements) implements PdxValue {

	public PdxListing {
		elements = elements != null ? List.copyOf(elements) : List.of();
	}

	public static PdxListing of(PdxListElement... elements) {
		return new PdxListing(List.of(elements));
	}

	@Override
	public Kind kind() {
		return Kind.LISTING;
	}
}
