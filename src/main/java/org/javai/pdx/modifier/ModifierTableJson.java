package org.javai.pdx.modifier;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes a {@link ModifierTable} as a flat JSON object of numbers.
 *
 * <p>The file is the hand-off between table generation and multiplication, so numbers are
 * carried as {@link BigDecimal} in both directions and written in plain notation.</p>
 *
 * <pre>{@code
 * {
 *   "global_tax_modifier" : 10,
 *   "estate_church_influence_modifier" : 2.5
 * }
 * }</pre>
 */
public class ModifierTableJson {

	private final ObjectMapper mapper;

	public ModifierTableJson() {
		this.mapper = new ObjectMapper()
				.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
				.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
	}

	public void write(ModifierTable table, Path path) throws IOException {
		Path parent = path.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			write(table, writer);
		}
	}

	public void write(ModifierTable table, Writer writer) throws IOException {
		mapper.writerWithDefaultPrettyPrinter().writeValue(writer, toJson(table));
	}

	public String toString(ModifierTable table) throws IOException {
		return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(table));
	}

	public ModifierTable read(Path path) throws IOException {
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			return read(reader);
		}
	}

	/**
	 * @throws IllegalArgumentException if the document is not an object whose values are
	 *         all numbers
	 */
	public ModifierTable read(Reader reader) throws IOException {
		return fromJson(mapper.readTree(reader));
	}

	public ModifierTable read(String json) throws IOException {
		return fromJson(mapper.readTree(json));
	}

	private ObjectNode toJson(ModifierTable table) {
		ObjectNode json = mapper.createObjectNode();
		table.asMap().forEach(json::put);
		return json;
	}

	private ModifierTable fromJson(JsonNode json) {
		if (json == null || !json.isObject()) {
			throw new IllegalArgumentException("Modifier table must be a JSON object");
		}
		Map<String, BigDecimal> multipliers = new LinkedHashMap<>();
		Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			if (!field.getValue().isNumber()) {
				throw new IllegalArgumentException(
						"Modifier table entry '" + field.getKey() + "' is not a number: " + field.getValue());
			}
			multipliers.put(field.getKey(), field.getValue().decimalValue());
		}
		return new ModifierTable(multipliers);
	}
}
