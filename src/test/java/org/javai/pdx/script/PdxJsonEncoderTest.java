package org.javai.pdx.script;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Paradox script JSON encoder")
class PdxJsonEncoderTest {

	private final PdxParser parser = new PdxParser(PdxGrammar.standard());
	private final PdxJsonEncoder encoder = new PdxJsonEncoder();

	@Test
	@DisplayName("Should encode expressions as name/value objects")
	void shouldEncodeExpressions() {
		ArrayNode json = encoder.encode(parser.parse("tax = 0.5 tag = FRA name = \"Paris\""));

		assertThat(json).hasSize(3);
		assertThat(json.get(0).get("name").asText()).isEqualTo("tax");
		assertThat(json.get(0).get("value").decimalValue()).isEqualByComparingTo("0.5");
		assertThat(json.get(1).get("value").asText()).isEqualTo("FRA");
		assertThat(json.get(2).get("value").asText()).isEqualTo("\"Paris\"");
	}

	@Test
	@DisplayName("Should encode colors as objects and listings as arrays")
	void shouldEncodeColorsAndListings() {
		ArrayNode json = encoder.encode(parser.parse("color = { 1 2 3 } tags = { a \"b\" }"));

		JsonNode color = json.get(0).get("value");
		assertThat(color.get("red").asInt()).isEqualTo(1);
		assertThat(color.get("green").asInt()).isEqualTo(2);
		assertThat(color.get("blue").asInt()).isEqualTo(3);
		JsonNode tags = json.get(1).get("value");
		assertThat(tags.isArray()).isTrue();
		assertThat(tags.get(0).asText()).isEqualTo("a");
		assertThat(tags.get(1).asText()).isEqualTo("\"b\"");
	}

	@Test
	@DisplayName("Should encode blocks as nested arrays")
	void shouldEncodeBlocks() {
		JsonNode value = encoder.encode(PdxBlock.of(
				PdxExpression.of("trigger", PdxBlock.of(PdxExpression.of("always", new PdxIdentifier("yes"))))));

		assertThat(value.isArray()).isTrue();
		assertThat(value.get(0).get("name").asText()).isEqualTo("trigger");
		assertThat(value.get(0).get("value").get(0).get("value").asText()).isEqualTo("yes");
	}

	@Test
	@DisplayName("Should render a whole file as parseable JSON text")
	void shouldRenderJsonText() throws Exception {
		String text = encoder.toJson(List.of(PdxExpression.of("prestige", PdxNumber.of(new BigDecimal("2.5")))));

		JsonNode parsed = new ObjectMapper().readTree(text);
		assertThat(parsed.get(0).get("name").asText()).isEqualTo("prestige");
		assertThat(parsed.get(0).get("value").asDouble()).isEqualTo(2.5);
	}
}
