package org.javai.pdx.config;

import java.util.Optional;

/**
 * A loaded configuration file. Either section may be absent when only the other
 * subcommand is used.
 */
public record MultiplierConfig(GenModifiersSettings genModifiers, MultiplySettings multiply) {

	public GenModifiersSettings requireGenModifiers() {
		return Optional.ofNullable(genModifiers)
				.orElseThrow(() -> new ConfigurationException("Missing required 'gen_modifiers' section"));
	}

	public MultiplySettings requireMultiply() {
		return Optional.ofNullable(multiply)
				.orElseThrow(() -> new ConfigurationException("Missing required 'multiply' section"));
	}
}
