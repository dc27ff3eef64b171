package org.javai.pdx.modifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("Modifier table JSON")
class ModifierTableJsonTest {

	private final ModifierTableJson json = new ModifierTableJson();

	@Test
	@DisplayName("Should write numbers in plain notation")
	void shouldWritePlainNumbers() throws Exception {
		Map<String, BigDecimal> multipliers = new LinkedHashMap<>();
		multipliers.put("global_tax_modifier", BigDecimal.TEN);
		multipliers.put("prestige", new BigDecimal("1E+2"));
		multipliers.put("legitimacy", new BigDecimal("2.5"));

		String text = json.toString(new ModifierTable(multipliers));

		assertThat(text)
				.contains("\"global_tax_modifier\" : 10")
				.contains("\"prestige\" : 100")
				.contains("\"legitimacy\" : 2.5")
				.doesNotContain("E+");
	}

	@Test
	@DisplayName("Should read decimal values exactly")
	void shouldReadDecimalsExactly() throws Exception {
		ModifierTable table = json.read("{ \"a\": 0.1, \"b\": 10 }");

		assertThat(table.multiplierFor("a")).hasValueSatisfying(m -> assertThat(m).isEqualByComparingTo("0.1"));
		assertThat(table.multiplierFor("b")).hasValueSatisfying(m -> assertThat(m).isEqualByComparingTo("10"));
	}

	@Test
	@DisplayName("Should write a file that reads back to the same entries")
	void shouldWriteAndReadFile(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("out/modifiers.json");
		ModifierTable table = new ModifierTableBuilder(DiscoveredEntities.none())
				.defaultMultiplier(new BigDecimal("10"))
				.override("prestige", new BigDecimal("0.5"))
				.build(List.of("global_tax_modifier", "prestige"));

		json.write(table, file);

		assertThat(Files.exists(file)).isTrue();
		ModifierTable read = json.read(file);
		assertThat(read.asMap().keySet()).containsExactly("global_tax_modifier", "prestige");
		assertThat(read.multiplierFor("prestige")).hasValueSatisfying(m -> assertThat(m).isEqualByComparingTo("0.5"));
	}

	@Test
	@DisplayName("Should reject a document that is not an object")
	void shouldRejectNonObject() {
		assertThatThrownBy(() -> json.read("[1, 2]"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("JSON object");
	}

	@Test
	@DisplayName("Should reject a non-numeric multiplier")
	void shouldRejectNonNumericValue() {
		assertThatThrownBy(() -> json.read("{ \"prestige\": \"ten\" }"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("prestige");
	}
}
