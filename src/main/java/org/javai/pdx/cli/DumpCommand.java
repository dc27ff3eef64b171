package org.javai.pdx.cli;

import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.javai.pdx.script.PdxExpression;
import org.javai.pdx.script.PdxGrammar;
import org.javai.pdx.script.PdxJsonEncoder;
import org.javai.pdx.script.PdxParser;
import org.javai.pdx.script.PdxPrinter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(name = "dump",
		mixinStandardHelpOptions = true,
		description = "Parses a single script file and prints it in canonical form, or as JSON.")
public class DumpCommand implements Callable<Integer> {

	@Spec
	CommandSpec spec;

	@Parameters(index = "0", paramLabel = "FILE", description = "The script file to parse.")
	Path file;

	@Option(names = "--json", description = "Print the parsed tree as JSON.")
	boolean json;

	@Option(names = "--encoding", defaultValue = "ISO-8859-1",
			description = "Encoding of the script file. Defaults to '${DEFAULT-VALUE}'.")
	Charset encoding;

	@Override
	public Integer call() throws Exception {
		List<PdxExpression> tree = new PdxParser(PdxGrammar.standard()).parseFile(file, encoding);
		String rendered = json ? new PdxJsonEncoder().toJson(tree) + "\n" : PdxPrinter.print(tree);
		spec.commandLine().getOut().print(rendered);
		spec.commandLine().getOut().flush();
		return 0;
	}
}
