package org.javai.pdx.modifier;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link ModifierTable} from a list of modifier names.
 *
 * Names containing wildcard placeholders such as {@code <estate>} are expanded into one
 * entry per discovered entity. Each entry gets the override registered for its concrete
 * name, else the override registered for its template, else the default multiplier.
 *
 * <pre>
 * ModifierTable table = new ModifierTableBuilder(entities)
 *     .defaultMultiplier(BigDecimal.TEN)
 *     .ignore(List.of("local_unrest"))
 *     .override("global_tax_modifier", new BigDecimal("5"))
 *     .build(reader);
 * </pre>
 */
public class ModifierTableBuilder {

	private static final Logger logger = LoggerFactory.getLogger(ModifierTableBuilder.class);

	private final DiscoveredEntities entities;
	private final Set<String> ignores = new HashSet<>();
	private final Map<String, BigDecimal> overrides = new HashMap<>();
	private BigDecimal defaultMultiplier = BigDecimal.ONE;

	public ModifierTableBuilder(DiscoveredEntities entities) {
		this.entities = Objects.requireNonNull(entities, "entities must not be null");
	}

	public ModifierTableBuilder defaultMultiplier(BigDecimal multiplier) {
		this.defaultMultiplier = Objects.requireNonNull(multiplier, "multiplier must not be null");
		return this;
	}

	/**
	 * Names to drop from the input before expansion.
	 */
	public ModifierTableBuilder ignore(Collection<String> names) {
		ignores.addAll(names);
		return this;
	}

	public ModifierTableBuilder override(String name, BigDecimal multiplier) {
		overrides.put(name, Objects.requireNonNull(multiplier, "multiplier must not be null"));
		return this;
	}

	public ModifierTableBuilder overrides(Map<String, BigDecimal> multipliers) {
		multipliers.forEach(this::override);
		return this;
	}

	/**
	 * Reads one modifier name per line. Blank and ignored lines are skipped.
	 */
	public ModifierTable build(Reader modifierNames) throws IOException {
		List<String> names = new ArrayList<>();
		BufferedReader reader = modifierNames instanceof BufferedReader buffered
				? buffered
				: new BufferedReader(modifierNames);
		String line;
		while ((line = reader.readLine()) != null) {
			names.add(line);
		}
		return build(names);
	}

	public ModifierTable build(List<String> modifierNames) {
		Map<String, BigDecimal> table = new LinkedHashMap<>();
		for (String line : modifierNames) {
			String template = line.strip();
			if (template.isEmpty() || ignores.contains(template)) {
				continue;
			}
			List<String> keys = expand(template);
			if (keys.isEmpty()) {
				logger.warn("Modifier '{}' expanded to no entries; its placeholder matched no discovered entities",
						template);
			}
			for (String key : keys) {
				table.put(key, multiplierFor(key, template));
			}
		}
		logger.info("Built modifier table with {} entries from {} names", table.size(), modifierNames.size());
		return new ModifierTable(table);
	}

	/**
	 * Expands every placeholder kind found in {@code template}, in declaration order.
	 */
	List<String> expand(String template) {
		List<String> expanded = List.of(template);
		for (WildcardPlaceholder placeholder : WildcardPlaceholder.values()) {
			if (!placeholder.occursIn(template)) {
				continue;
			}
			List<String> next = new ArrayList<>();
			for (String partial : expanded) {
				for (String name : entities.namesFor(placeholder)) {
					next.add(placeholder.substitute(partial, name));
				}
			}
			expanded = next;
		}
		return expanded;
	}

	private BigDecimal multiplierFor(String key, String template) {
		BigDecimal multiplier = overrides.get(key);
		if (multiplier == null) {
			multiplier = overrides.get(template);
		}
		return multiplier != null ? multiplier : defaultMultiplier;
	}
}
