package org.javai.pdx.modifier;

/**
 * Template tokens in modifier names that stand for every discovered entity of a category.
 * Declared in expansion order.
 */
public enum WildcardPlaceholder {
	ESTATE("<estate>"),
	FACTION("<faction>"),
	GOVERNMENT_POWER("<government_power_type_id>"),
	TECH("<tech>");

	private final String token;

	WildcardPlaceholder(String token) {
		this.token = token;
	}

	public boolean occursIn(String template) {
		return template.contains(token);
	}

	/**
	 * Replaces every occurrence of this placeholder with {@code name}.
	 */
	public String substitute(String template, String name) {
		return template.replace(token, name);
	}
}
