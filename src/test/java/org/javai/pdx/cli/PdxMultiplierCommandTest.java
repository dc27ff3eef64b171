package org.javai.pdx.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.javai.pdx.modifier.ModifierTable;
import org.javai.pdx.modifier.ModifierTableJson;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

@DisplayName("pdx-multiplier command line")
class PdxMultiplierCommandTest {

	@TempDir
	Path root;

	private final StringWriter out = new StringWriter();
	private final StringWriter err = new StringWriter();
	private CommandLine commandLine;

	@BeforeEach
	void setUp() {
		commandLine = PdxMultiplierCommand.commandLine();
		commandLine.setOut(new PrintWriter(out));
		commandLine.setErr(new PrintWriter(err));
	}

	private Path write(String relative, String content) throws IOException {
		Path file = root.resolve(relative);
		Files.createDirectories(file.getParent());
		Files.writeString(file, content, StandardCharsets.ISO_8859_1);
		return file;
	}

	@Nested
	@DisplayName("Usage")
	class UsageTests {

		@Test
		@DisplayName("Should fail without a subcommand")
		void shouldRequireSubcommand() {
			int exitCode = commandLine.execute();

			assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
			assertThat(err.toString()).contains("Missing required subcommand");
		}

		@Test
		@DisplayName("Should print the version")
		void shouldPrintVersion() {
			int exitCode = commandLine.execute("--version");

			assertThat(exitCode).isEqualTo(CommandLine.ExitCode.OK);
			assertThat(out.toString()).contains("pdx-multiplier 0.1.0");
		}

		@Test
		@DisplayName("Should list the subcommands in the help")
		void shouldListSubcommands() {
			commandLine.execute("--help");

			assertThat(out.toString())
					.contains("gen_modifiers")
					.contains("multiply")
					.contains("multiply_lines")
					.contains("dump");
		}
	}

	@Nested
	@DisplayName("Pipeline")
	class PipelineTests {

		@Test
		@DisplayName("Should generate a table and multiply a target with it")
		void shouldGenerateAndMultiply() throws Exception {
			write("game/common/estates/00_estates.txt", "estate_church = { }\nestate_nobles = { }\n");
			write("game/common/factions/00_factions.txt", "mr_traders = { }\n");
			write("game/common/government_mechanics/00_mech.txt", "mech = { powers = { devotion = { } } }\n");
			write("game/common/ideas/00_ideas.txt", """
					my_ideas = {
						start = { global_tax_modifier = 0.1 estate_church_influence_modifier = 0.05 }
						bonus = { local_unrest = 1 }
						ai_will_do = { factor = 1 }
					}
					""");
			write("game/common/static_modifiers/00_static.txt", "war = { global_tax_modifier = 0.5 }\n");
			Path modifiers = write("modifiers.txt", """
					global_tax_modifier
					estate_<estate>_influence_modifier
					local_unrest
					""");
			Path config = write("config.yml", """
					gen_modifiers:
					  multiplier: 10
					  ignores: [ local_unrest ]
					  alternatives: { estate_church_influence_modifier: 2 }
					  tech_types: [ adm ]
					  estates: [ %1$s/game/common/estates ]
					  factions: [ %1$s/game/common/factions ]
					  government_mechanics: [ %1$s/game/common/government_mechanics ]
					multiply:
					  destination: %1$s/mod/common
					  targets: [ %1$s/game/common ]
					""".formatted(root.toAbsolutePath()));
			Path table = root.resolve("modifiers.json");

			int generated = commandLine.execute("gen_modifiers",
					"-i", modifiers.toString(), "-o", table.toString(), "-c", config.toString());

			assertThat(generated).isEqualTo(0);
			ModifierTable read = new ModifierTableJson().read(table);
			assertThat(read.asMap().keySet()).containsExactlyInAnyOrder(
					"global_tax_modifier",
					"estate_church_influence_modifier",
					"estate_nobles_influence_modifier");

			int multiplied = PdxMultiplierCommand.commandLine().execute("multiply",
					"-i", table.toString(), "-c", config.toString());

			assertThat(multiplied).isEqualTo(0);
			String ideas = Files.readString(root.resolve("mod/common/ideas/00_ideas.txt"), StandardCharsets.ISO_8859_1);
			assertThat(ideas)
					.contains("global_tax_modifier = 1\n")
					.contains("estate_church_influence_modifier = 0.1\n")
					.contains("local_unrest = 1")
					.contains("ai_will_do = { factor = 1 }");
			String statics = Files.readString(root.resolve("mod/common/static_modifiers/00_static.txt"),
					StandardCharsets.ISO_8859_1);
			assertThat(statics).isEqualTo("war = { global_tax_modifier = 5 }\n");
		}

		@Test
		@DisplayName("Should multiply ideas line by line")
		void shouldMultiplyLines() throws Exception {
			write("game/ideas/a.txt", "\tprestige = 1\n");

			int exitCode = commandLine.execute("multiply_lines", "-m", "3",
					"-i", root.resolve("game").toString(), "-o", root.resolve("mod").toString(), "-d", "ideas");

			assertThat(exitCode).isEqualTo(0);
			assertThat(Files.readString(root.resolve("mod/ideas/a.txt"))).isEqualTo("\tprestige = 3\n");
		}
	}

	@Nested
	@DisplayName("dump")
	class DumpTests {

		@Test
		@DisplayName("Should print a file in canonical form")
		void shouldPrintCanonicalForm() throws Exception {
			Path file = write("x.txt", "a={b=1}");

			int exitCode = commandLine.execute("dump", file.toString());

			assertThat(exitCode).isEqualTo(0);
			assertThat(out.toString()).isEqualTo("a = { b = 1 }\n");
		}

		@Test
		@DisplayName("Should print a file as JSON")
		void shouldPrintJson() throws Exception {
			Path file = write("x.txt", "a = 1");

			commandLine.execute("dump", "--json", file.toString());

			assertThat(out.toString()).contains("\"name\" : \"a\"").contains("\"value\" : 1");
		}

		@Test
		@DisplayName("Should report a parse failure with a non-zero exit code")
		void shouldReportParseFailure() throws Exception {
			Path file = write("x.txt", "a = {");

			int exitCode = commandLine.execute("dump", file.toString());

			assertThat(exitCode).isEqualTo(CommandLine.ExitCode.SOFTWARE);
			assertThat(err.toString()).contains("x.txt");
		}
	}
}
