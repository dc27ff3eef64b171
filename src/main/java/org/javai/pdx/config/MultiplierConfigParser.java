package org.javai.pdx.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;

/**
 * Parser for multiplier configuration YAML files.
 *
 * Settings omitted from the {@code multiply} section are taken from the classpath
 * resource {@value #DEFAULTS_RESOURCE}.
 *
 * <pre>
 * gen_modifiers:
 *   multiplier: 10
 *   ignores: [ local_unrest ]
 *   alternatives: { global_tax_modifier: 5 }
 *   tech_types: [ adm, dip, mil ]
 *   estates: [ game/common/estates ]
 *   factions: [ game/common/factions ]
 *   ignore_factions: []
 *   government_mechanics: [ game/common/government_mechanics ]
 * multiply:
 *   destination: mod/common
 *   targets: [ game/common ]
 *   ignore_static: [ base_values ]
 * </pre>
 */
public class MultiplierConfigParser {

	static final String DEFAULTS_RESOURCE = "META-INF/pdx-multiplier-defaults.yml";

	private final Yaml yaml = new Yaml();
	private final Map<String, Object> defaults;

	public MultiplierConfigParser() {
		this.defaults = loadDefaults();
	}

	/**
	 * Parse a configuration file from a path.
	 */
	public MultiplierConfig parse(Path path) throws IOException {
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return parse(reader);
		}
	}

	/**
	 * Parse a configuration file from a reader.
	 */
	public MultiplierConfig parse(Reader reader) {
		return buildConfig(yaml.load(reader));
	}

	/**
	 * Parse a configuration file from a string.
	 */
	public MultiplierConfig parseString(String yamlContent) {
		return buildConfig(yaml.load(yamlContent));
	}

	private Map<String, Object> loadDefaults() {
		try (InputStream is = MultiplierConfigParser.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
			if (is == null) {
				throw new IllegalStateException("Resource not found: " + DEFAULTS_RESOURCE);
			}
			return section(yaml.load(is), "multiply", true);
		} catch (IOException e) {
			throw new IllegalStateException("Failed to read " + DEFAULTS_RESOURCE, e);
		}
	}

	private MultiplierConfig buildConfig(Object document) {
		if (document == null) {
			throw new ConfigurationException("Configuration is empty");
		}
		if (!(document instanceof Map)) {
			throw new ConfigurationException("Configuration must be a mapping of sections");
		}
		Map<String, Object> genModifiers = section(document, "gen_modifiers", false);
		Map<String, Object> multiply = section(document, "multiply", false);
		return new MultiplierConfig(
				genModifiers != null ? buildGenModifiers(genModifiers) : null,
				multiply != null ? buildMultiply(multiply) : null);
	}

	private GenModifiersSettings buildGenModifiers(Map<String, Object> data) {
		String where = "gen_modifiers";
		Object multiplier = data.get("multiplier");
		if (multiplier == null) {
			throw new ConfigurationException("Missing required '" + where + ".multiplier'");
		}
		Map<String, BigDecimal> alternatives = new LinkedHashMap<>();
		Object alternativesValue = data.get("alternatives");
		if (alternativesValue != null) {
			if (!(alternativesValue instanceof Map<?, ?> map)) {
				throw new ConfigurationException("'" + where + ".alternatives' must be a mapping");
			}
			map.forEach((key, value) -> alternatives.put(String.valueOf(key),
					toDecimal(value, where + ".alternatives." + key)));
		}
		return new GenModifiersSettings(
				toDecimal(multiplier, where + ".multiplier"),
				strings(data.get("ignores"), where + ".ignores"),
				alternatives,
				strings(data.get("tech_types"), where + ".tech_types"),
				paths(data.get("estates"), where + ".estates"),
				paths(data.get("factions"), where + ".factions"),
				strings(data.get("ignore_factions"), where + ".ignore_factions"),
				paths(data.get("government_mechanics"), where + ".government_mechanics"));
	}

	private MultiplySettings buildMultiply(Map<String, Object> data) {
		String where = "multiply";
		Map<String, Object> merged = new LinkedHashMap<>(defaults);
		data.forEach((key, value) -> {
			if (value != null) {
				merged.put(key, value);
			}
		});
		if (merged.get("destination") == null) {
			throw new ConfigurationException("Missing required '" + where + ".destination'");
		}
		List<Path> targets = paths(merged.get("targets"), where + ".targets");
		if (targets.isEmpty()) {
			throw new ConfigurationException("'" + where + ".targets' must name at least one directory");
		}
		return new MultiplySettings(
				Path.of(string(merged.get("destination"), where + ".destination")),
				targets,
				stringSet(merged.get("ignore_static"), where + ".ignore_static"),
				stringSet(merged.get("ignore_blocks"), where + ".ignore_blocks"),
				stringSet(merged.get("ignore_dirs"), where + ".ignore_dirs"),
				string(merged.get("root_directory"), where + ".root_directory"),
				string(merged.get("static_directory"), where + ".static_directory"),
				charset(merged.get("encoding"), where + ".encoding"),
				bool(merged.get("continue_on_error"), where + ".continue_on_error"));
	}

	@SuppressWarnings("unchecked")
	private Map<String, Object> section(Object document, String name, boolean required) {
		Object value = ((Map<String, Object>) document).get(name);
		if (value == null) {
			if (required) {
				throw new ConfigurationException("Missing required '" + name + "' section");
			}
			return null;
		}
		if (!(value instanceof Map)) {
			throw new ConfigurationException("'" + name + "' must be a mapping");
		}
		return (Map<String, Object>) value;
	}

	private BigDecimal toDecimal(Object value, String where) {
		if (value instanceof Number number) {
			return new BigDecimal(number.toString());
		}
		throw new ConfigurationException("'" + where + "' must be a number, found: " + value);
	}

	private String string(Object value, String where) {
		if (value instanceof String text) {
			return text;
		}
		throw new ConfigurationException("'" + where + "' must be a string, found: " + value);
	}

	private boolean bool(Object value, String where) {
		if (value instanceof Boolean flag) {
			return flag;
		}
		throw new ConfigurationException("'" + where + "' must be true or false, found: " + value);
	}

	private List<String> strings(Object value, String where) {
		if (value == null) {
			return List.of();
		}
		if (!(value instanceof List<?> list)) {
			throw new ConfigurationException("'" + where + "' must be a list");
		}
		return list.stream().map(String::valueOf).toList();
	}

	private Set<String> stringSet(Object value, String where) {
		return new LinkedHashSet<>(strings(value, where));
	}

	private List<Path> paths(Object value, String where) {
		return strings(value, where).stream().map(Path::of).toList();
	}

	private Charset charset(Object value, String where) {
		try {
			return Charset.forName(String.valueOf(value));
		} catch (IllegalArgumentException e) {
			throw new ConfigurationException("'" + where + "' is not a supported encoding: " + value, e);
		}
	}
}
