package org.javai.pdx.cli;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.javai.pdx.config.MultiplierConfigParser;
import org.javai.pdx.config.MultiplySettings;
import org.javai.pdx.modifier.ModifierTable;
import org.javai.pdx.modifier.ModifierTableJson;
import org.javai.pdx.script.PdxGrammar;
import org.javai.pdx.script.PdxParser;
import org.javai.pdx.target.TargetWalker;
import org.javai.pdx.target.WalkResult;
import org.javai.pdx.transform.TreeTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "multiply",
		mixinStandardHelpOptions = true,
		description = "Recursively parses over a set of target 'common' directories, multiplies the "
				+ "modifiers contained within, and writes the results to a destination directory. "
				+ "Parsing behavior is determined by the configuration file.")
public class MultiplyCommand implements Callable<Integer> {

	private static final Logger logger = LoggerFactory.getLogger(MultiplyCommand.class);

	@Option(names = { "-i", "--input" }, defaultValue = "./modifiers.json", paramLabel = "MODIFIERS_FILE",
			description = "JSON file containing a modifier multiplier table to be used during "
					+ "multiplication. Defaults to '${DEFAULT-VALUE}'.")
	Path input;

	@Option(names = { "-c", "--config" }, defaultValue = "./config.yml", paramLabel = "CONFIGURATION_FILE",
			description = "The file to read configuration data from. Defaults to '${DEFAULT-VALUE}'.")
	Path config;

	@Override
	public Integer call() throws Exception {
		MultiplySettings settings = new MultiplierConfigParser().parse(config).requireMultiply();
		ModifierTable table = new ModifierTableJson().read(input);
		logger.info("Loaded {} modifiers from '{}'.", table.size(), input);

		TreeTransformer transformer = new TreeTransformer(table, settings.ignoreBlocks());
		TargetWalker walker = new TargetWalker(new PdxParser(PdxGrammar.standard()), transformer, settings);

		WalkResult total = new WalkResult(0, List.of(), List.of());
		for (Path target : settings.targets()) {
			total = total.plus(walker.walk(target, settings.destination()));
		}

		logger.info("Processed {} files, wrote {}, {} failed.",
				total.filesProcessed(), total.written().size(), total.failed().size());
		return total.hasFailures() ? 1 : 0;
	}
}
