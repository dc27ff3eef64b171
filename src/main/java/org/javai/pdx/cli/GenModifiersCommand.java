package org.javai.pdx.cli;

import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.javai.pdx.config.GenModifiersSettings;
import org.javai.pdx.config.MultiplierConfigParser;
import org.javai.pdx.discovery.EntityDiscovery;
import org.javai.pdx.modifier.DiscoveredEntities;
import org.javai.pdx.modifier.ModifierTable;
import org.javai.pdx.modifier.ModifierTableBuilder;
import org.javai.pdx.modifier.ModifierTableJson;
import org.javai.pdx.script.PdxGrammar;
import org.javai.pdx.script.PdxParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "gen_modifiers",
		mixinStandardHelpOptions = true,
		description = "Generates a JSON table of modifier multipliers for use by the 'multiply' "
				+ "subcommand. Generation behavior is managed by the configuration file.")
public class GenModifiersCommand implements Callable<Integer> {

	private static final Logger logger = LoggerFactory.getLogger(GenModifiersCommand.class);

	@Option(names = { "-i", "--input" }, defaultValue = "./modifiers.txt", paramLabel = "INPUT_FILE",
			description = "The file to read the raw modifiers from. Defaults to '${DEFAULT-VALUE}'.")
	Path input;

	@Option(names = { "-o", "--output" }, defaultValue = "./modifiers.json", paramLabel = "OUTPUT_FILE",
			description = "The file to write the modifier multipliers table to. Defaults to '${DEFAULT-VALUE}'.")
	Path output;

	@Option(names = { "-c", "--config" }, defaultValue = "./config.yml", paramLabel = "CONFIGURATION_FILE",
			description = "The file to read configuration data from. Defaults to '${DEFAULT-VALUE}'.")
	Path config;

	@Option(names = "--encoding", defaultValue = "ISO-8859-1",
			description = "Encoding of the game-data files scanned for entities. Defaults to '${DEFAULT-VALUE}'.")
	Charset encoding;

	@Override
	public Integer call() throws Exception {
		GenModifiersSettings settings = new MultiplierConfigParser().parse(config).requireGenModifiers();

		EntityDiscovery discovery = new EntityDiscovery(new PdxParser(PdxGrammar.standard()), encoding);
		DiscoveredEntities entities = discovery.discover(
				settings.estates(),
				settings.factions(),
				settings.ignoreFactions(),
				settings.governmentMechanics(),
				settings.techTypes());

		ModifierTable table;
		try (Reader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
			table = new ModifierTableBuilder(entities)
					.defaultMultiplier(settings.multiplier())
					.ignore(settings.ignores())
					.overrides(settings.alternatives())
					.build(reader);
		}

		new ModifierTableJson().write(table, output);
		logger.info("Modifiers written to '{}'.", output);
		return 0;
	}
}
