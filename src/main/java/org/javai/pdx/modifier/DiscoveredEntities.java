package org.javai.pdx.modifier;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Concrete entity names that wildcard placeholders expand to.
 * Each set is kept sorted so expansion order is stable.
 */
public record DiscoveredEntities(Set<String> estates,
		Set<String> factions,
		Set<String> governmentPowers,
		Set<String> techTypes) {

	public DiscoveredEntities {
		estates = sorted(estates);
		factions = sorted(factions);
		governmentPowers = sorted(governmentPowers);
		techTypes = sorted(techTypes);
	}

	public static DiscoveredEntities none() {
		return new DiscoveredEntities(Set.of(), Set.of(), Set.of(), Set.of());
	}

	public Set<String> namesFor(WildcardPlaceholder placeholder) {
		return switch (placeholder) {
			case ESTATE -> estates;
			case FACTION -> factions;
			case GOVERNMENT_POWER -> governmentPowers;
			case TECH -> techTypes;
		};
	}

	private static Set<String> sorted(Collection<String> names) {
		return names == null ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(names));
	}
}
