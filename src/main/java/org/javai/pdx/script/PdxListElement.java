package org.javai.pdx.script;

/**
 * Values allowed as elements of a {@link PdxListing}.
 */
public sealed interface PdxListElement extends PdxValue permits PdxIdentifier, PdxString {

	/**
	 * The stored text, printed verbatim.
	 */
	String value();
}
