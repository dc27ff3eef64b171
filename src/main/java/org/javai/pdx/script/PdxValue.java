package org.javai.pdx.script;

/**
 * Right-hand side of a {@link PdxExpression}.
 *
 * The set of value kinds is closed; consumers dispatch on {@link #kind()} rather than
 * on per-node behaviour.
 */
public sealed interface PdxValue permits PdxListElement, PdxNumber, PdxColor, PdxListing, PdxBlock {

	/**
	 * Value kinds, declared in the priority order used to break ties between
	 * alternatives that consume the same amount of input.
	 */
	enum Kind {
		NUMBER,
		COLOR,
		LISTING,
		BLOCK,
		IDENTIFIER,
		STRING
	}

	Kind kind();

	/**
	 * True for the kinds whose printed form may span several lines.
	 */
	default boolean isCompound() {
		return kind() == Kind.BLOCK || kind() == Kind.LISTING;
	}
}
