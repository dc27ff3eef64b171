package org.javai.pdx.modifier;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Flat mapping from concrete modifier name to multiplier, in insertion order.
 */
public final class ModifierTable {

	private final Map<String, BigDecimal> multipliers;

	public ModifierTable(Map<String, BigDecimal> multipliers) {
		Objects.requireNonNull(multipliers, "multipliers must not be null");
		LinkedHashMap<String, BigDecimal> copy = new LinkedHashMap<>();
		multipliers.forEach((name, multiplier) -> copy.put(
				Objects.requireNonNull(name, "modifier name must not be null"),
				Objects.requireNonNull(multiplier, "multiplier for '" + name + "' must not be null")));
		this.multipliers = Collections.unmodifiableMap(copy);
	}

	public static ModifierTable of(String name, BigDecimal multiplier) {
		return new ModifierTable(Map.of(name, multiplier));
	}

	public Optional<BigDecimal> multiplierFor(String name) {
		return Optional.ofNullable(multipliers.get(name));
	}

	public boolean contains(String name) {
		return multipliers.containsKey(name);
	}

	public int size() {
		return multipliers.size();
	}

	public Map<String, BigDecimal> asMap() {
		return multipliers;
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof ModifierTable other && multipliers.equals(other.multipliers);
	}

	@Override
	public int hashCode() {
		return multipliers.hashCode();
	}

	@Override
	public String toString() {
		return "ModifierTable" + multipliers;
	}
}
