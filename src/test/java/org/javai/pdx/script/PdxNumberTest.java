package org.javai.pdx.script;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Paradox script numbers")
class PdxNumberTest {

	@Test
	@DisplayName("Should format multiplied values in plain notation without trailing zeros")
	void shouldFormatPlain() {
		assertThat(PdxNumber.format(new BigDecimal("15.0"))).isEqualTo("15");
		assertThat(PdxNumber.format(new BigDecimal("1E+3"))).isEqualTo("1000");
		assertThat(PdxNumber.format(new BigDecimal("0.250"))).isEqualTo("0.25");
		assertThat(PdxNumber.format(new BigDecimal("-0.00"))).isEqualTo("0");
	}

	@Test
	@DisplayName("Should multiply exactly")
	void shouldMultiplyExactly() {
		PdxNumber number = PdxNumber.parse("0.1");

		number.multiply(new BigDecimal("3"));

		assertThat(number.literal()).isEqualTo("0.3");
		assertThat(number.value()).isEqualByComparingTo("0.3");
	}

	@Test
	@DisplayName("Should compare by value and floating kind but not spelling")
	void shouldCompareByValueAndKind() {
		assertThat(PdxNumber.parse("1.50")).isEqualTo(PdxNumber.parse("1.5"));
		assertThat(PdxNumber.parse("1.50")).hasSameHashCodeAs(PdxNumber.parse("1.5"));
		assertThat(PdxNumber.parse("+2")).isEqualTo(PdxNumber.parse("2"));
		assertThat(PdxNumber.parse("2.0")).isNotEqualTo(PdxNumber.parse("2"));
	}

	@Test
	@DisplayName("Should reject text that is not a decimal literal")
	void shouldRejectNonNumbers() {
		assertThatThrownBy(() -> PdxNumber.parse("ten")).isInstanceOf(NumberFormatException.class);
	}
}
