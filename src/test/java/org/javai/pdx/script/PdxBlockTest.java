package org.javai.pdx.script;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Paradox script blocks")
class PdxBlockTest {

	@Test
	@DisplayName("Should reject the same expression instance twice")
	void shouldRejectSharedEntry() {
		PdxExpression tax = PdxExpression.of("base_tax", PdxNumber.of(1));

		assertThatThrownBy(() -> PdxBlock.of(tax, tax))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("base_tax");
		assertThatThrownBy(() -> new PdxBlock(List.of(tax, PdxExpression.of("other", PdxNumber.of(2)), tax)))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("Should accept equal but distinct expressions")
	void shouldAcceptEqualEntries() {
		PdxBlock block = PdxBlock.of(
				PdxExpression.of("base_tax", PdxNumber.of(1)),
				PdxExpression.of("base_tax", PdxNumber.of(1)));

		assertThat(block.entries()).hasSize(2);
		assertThat(block.find("base_tax")).containsSame(block.entries().get(0));
	}
}
