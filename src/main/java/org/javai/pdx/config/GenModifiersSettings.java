package org.javai.pdx.config;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Settings of the {@code gen_modifiers} section.
 */
public record GenModifiersSettings(
	BigDecimal multiplier,
	List<String> ignores,
	Map<String, BigDecimal> alternatives,
	List<String> techTypes,
	List<Path> estates,
	List<Path> factions,
	List<String> ignoreFactions,
	List<Path> governmentMechanics
) {
}
