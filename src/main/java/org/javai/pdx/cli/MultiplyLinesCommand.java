package org.javai.pdx.cli;

import java.math.BigDecimal;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.javai.pdx.lines.LineMultiplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "multiply_lines",
		mixinStandardHelpOptions = true,
		description = "Multiplies the effects of ideas and policies line by line, without parsing. "
				+ "Only suitable for files that keep one statement per line.")
public class MultiplyLinesCommand implements Callable<Integer> {

	private static final Logger logger = LoggerFactory.getLogger(MultiplyLinesCommand.class);

	@Option(names = { "-m", "--multiplier" }, defaultValue = "10",
			description = "Multiplier applied to every eligible value. Defaults to ${DEFAULT-VALUE}.")
	BigDecimal multiplier;

	@Option(names = { "-i", "--root_in" }, required = true, paramLabel = "DIRECTORY",
			description = "Root input directory from which source directories are detected.")
	Path rootIn;

	@Option(names = { "-o", "--root_out" }, defaultValue = "./common", paramLabel = "DIRECTORY",
			description = "Root output directory to which modified directories are written. "
					+ "Defaults to '${DEFAULT-VALUE}'.")
	Path rootOut;

	@Option(names = { "-d", "--dirs" }, arity = "1..*", paramLabel = "DIRECTORY",
			defaultValue = "custom_ideas,ideas,policies", split = ",",
			description = "Directories to be modified. Defaults to ${DEFAULT-VALUE}.")
	List<String> dirs;

	@Option(names = "--encoding", defaultValue = "ISO-8859-1",
			description = "Encoding of the script files. Defaults to '${DEFAULT-VALUE}'.")
	Charset encoding;

	@Override
	public Integer call() throws Exception {
		int written = new LineMultiplier(multiplier, encoding).processDirectories(rootIn, rootOut, dirs);
		logger.info("Wrote {} files under '{}'.", written, rootOut);
		return 0;
	}
}
