package org.javai.pdx.script;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Converts a parsed tree into a JSON document for inspection.
 *
 * <ul>
 *   <li>a file or block becomes an array of {@code {"name": ..., "value": ...}} objects</li>
 *   <li>identifiers and strings become JSON strings (strings keep their quotes)</li>
 *   <li>numbers become JSON numbers</li>
 *   <li>colors become {@code {"red": r, "green": g, "blue": b}}</li>
 *   <li>listings become arrays of strings</li>
 * </ul>
 */
public class PdxJsonEncoder {

	private final ObjectMapper mapper;

	public PdxJsonEncoder() {
		this(new ObjectMapper());
	}

	public PdxJsonEncoder(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	public ArrayNode encode(List<PdxExpression> expressions) {
		ArrayNode array = mapper.createArrayNode();
		for (PdxExpression expression : expressions) {
			array.add(encode(expression));
		}
		return array;
	}

	public ObjectNode encode(PdxExpression expression) {
		ObjectNode json = mapper.createObjectNode();
		json.put("name", expression.key());
		json.set("value", encode(expression.rhs()));
		return json;
	}

	public JsonNode encode(PdxValue value) {
		return switch (value.kind()) {
			case IDENTIFIER, STRING -> mapper.getNodeFactory().textNode(((PdxListElement) value).value());
			case NUMBER -> mapper.getNodeFactory().numberNode(((PdxNumber) value).value());
			case COLOR -> {
				PdxColor color = (PdxColor) value;
				ObjectNode json = mapper.createObjectNode();
				json.put("red", color.red());
				json.put("green", color.green());
				json.put("blue", color.blue());
				yield json;
			}
			case LISTING -> {
				ArrayNode array = mapper.createArrayNode();
				((PdxListing) value).elements().forEach(element -> array.add(element.value()));
				yield array;
			}
			case BLOCK -> encode(((PdxBlock) value).entries());
		};
	}

	/**
	 * Pretty-printed JSON text for a whole file.
	 */
	public String toJson(List<PdxExpression> expressions) {
		try {
			return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(encode(expressions));
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to render script tree as JSON", e);
		}
	}
}
