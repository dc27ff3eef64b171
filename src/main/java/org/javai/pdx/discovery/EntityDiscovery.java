package org.javai.pdx.discovery;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;
import org.javai.pdx.modifier.DiscoveredEntities;
import org.javai.pdx.script.PdxBlock;
import org.javai.pdx.script.PdxExpression;
import org.javai.pdx.script.PdxParser;
import org.javai.pdx.script.PdxSchemaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the entity names that wildcard placeholders expand to, by parsing the
 * game-data directories that define them.
 *
 * Every file in a configured directory must be a list of top-level blocks; anything else
 * is a {@link PdxSchemaException}, since a partial entity set would silently produce an
 * incomplete modifier table.
 */
public class EntityDiscovery {

	private static final Logger logger = LoggerFactory.getLogger(EntityDiscovery.class);

	static final String ESTATE_PREFIX = "estate_";
	static final String POWERS_KEY = "powers";

	private final PdxParser parser;
	private final Charset charset;

	public EntityDiscovery(PdxParser parser, Charset charset) {
		this.parser = Objects.requireNonNull(parser, "parser must not be null");
		this.charset = Objects.requireNonNull(charset, "charset must not be null");
	}

	/**
	 * Runs all loaders and bundles the results with the configured tech types.
	 */
	public DiscoveredEntities discover(List<Path> estateDirs,
			List<Path> factionDirs,
			Collection<String> ignoredFactions,
			List<Path> governmentMechanicDirs,
			Collection<String> techTypes) throws IOException {
		return new DiscoveredEntities(
				loadEstates(estateDirs),
				loadFactions(factionDirs, ignoredFactions),
				loadGovernmentPowers(governmentMechanicDirs),
				Set.copyOf(techTypes));
	}

	/**
	 * Top-level keys of estate files with the {@code estate_} prefix removed.
	 */
	public Set<String> loadEstates(List<Path> dirs) throws IOException {
		logger.info("Retrieving estates:");
		Set<String> estates = new TreeSet<>();
		for (Path file : filesIn(dirs)) {
			for (PdxExpression expression : parse(file)) {
				expression.requireBlock(file.toString());
				estates.add(removePrefix(expression.key(), ESTATE_PREFIX));
			}
		}
		return estates;
	}

	/**
	 * Top-level keys of faction files, minus the ignored ones.
	 */
	public Set<String> loadFactions(List<Path> dirs, Collection<String> ignores) throws IOException {
		logger.info("Retrieving factions:");
		Set<String> factions = new TreeSet<>();
		for (Path file : filesIn(dirs)) {
			for (PdxExpression expression : parse(file)) {
				if (ignores.contains(expression.key())) {
					continue;
				}
				expression.requireBlock(file.toString());
				factions.add(expression.key());
			}
		}
		return factions;
	}

	/**
	 * Keys of the first {@code powers} block inside each top-level government mechanic.
	 */
	public Set<String> loadGovernmentPowers(List<Path> dirs) throws IOException {
		logger.info("Retrieving government power IDs:");
		Set<String> powers = new TreeSet<>();
		for (Path file : filesIn(dirs)) {
			for (PdxExpression mechanic : parse(file)) {
				PdxBlock body = mechanic.requireBlock(file.toString());
				for (PdxExpression entry : body.entries()) {
					if (!POWERS_KEY.equals(entry.key())) {
						continue;
					}
					for (PdxExpression power : entry.requireBlock(file + " > " + mechanic.key()).entries()) {
						powers.add(power.key());
					}
					break;
				}
			}
		}
		return powers;
	}

	private List<PdxExpression> parse(Path file) throws IOException {
		logger.info("  Parsing '{}'.", file);
		return parser.parseFile(file, charset);
	}

	private List<Path> filesIn(List<Path> dirs) throws IOException {
		List<Path> files = new ArrayList<>();
		for (Path dir : dirs) {
			try (Stream<Path> entries = Files.list(dir)) {
				entries.filter(Files::isRegularFile).sorted().forEach(files::add);
			}
		}
		return files;
	}

	private static String removePrefix(String value, String prefix) {
		return value.startsWith(prefix) ? value.substring(prefix.length()) : value;
	}
}
