package org.javai.pdx.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Command-line entry point. Generation and multiplication are separate subcommands so the
 * modifier table can be reviewed or edited between the two.
 */
@Command(name = "pdx-multiplier",
		mixinStandardHelpOptions = true,
		version = "pdx-multiplier 0.1.0",
		description = "Utility for creating multiplier mods from Paradox script files. "
				+ "See subcommand help for further information.",
		footer = "Script files are parsed in full rather than scanned line by line, so every file "
				+ "is loaded into memory before it is transformed.",
		subcommands = {
				GenModifiersCommand.class,
				MultiplyCommand.class,
				MultiplyLinesCommand.class,
				DumpCommand.class
		})
public class PdxMultiplierCommand implements Runnable {

	@Spec
	CommandSpec spec;

	@Override
	public void run() {
		throw new ParameterException(spec.commandLine(), "Missing required subcommand");
	}

	public static CommandLine commandLine() {
		return new CommandLine(new PdxMultiplierCommand());
	}

	public static void main(String[] args) {
		System.exit(commandLine().execute(args));
	}
}
