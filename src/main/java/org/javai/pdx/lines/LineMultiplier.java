package org.javai.pdx.lines;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import org.javai.pdx.script.PdxNumber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Multiplies numbers in script files line by line, without building a tree.
 *
 * Every {@code key = number} on a line is multiplied unless the key is excluded. A line
 * that opens a protected block (<code>ai_will_do = {</code>, <code>chance = {</code>) locks
 * rewriting until its braces balance again. This only works on files that keep each
 * statement on its own line; {@link org.javai.pdx.target.TargetWalker} is the general
 * tool.
 */
public class LineMultiplier {

	private static final Logger logger = LoggerFactory.getLogger(LineMultiplier.class);

	public static final Set<String> DEFAULT_PROTECTED_BLOCKS = Set.of("ai_will_do", "chance");
	public static final Set<String> DEFAULT_EXCLUDED_KEYS = Set.of("factor", "max_level", "default", "female_advisor_chance");

	private static final Pattern ASSIGNMENT = Pattern.compile("(\\S+)\\s+=\\s+(-?\\d+\\.?\\d*)");
	private static final Pattern LEVEL_COST = Pattern.compile("level_cost_\\d+");

	private final BigDecimal multiplier;
	private final Pattern protectedBlock;
	private final Set<String> excludedKeys;
	private final Charset charset;

	public LineMultiplier(BigDecimal multiplier, Charset charset) {
		this(multiplier, DEFAULT_PROTECTED_BLOCKS, DEFAULT_EXCLUDED_KEYS, charset);
	}

	public LineMultiplier(BigDecimal multiplier, Set<String> protectedBlocks, Set<String> excludedKeys, Charset charset) {
		this.multiplier = Objects.requireNonNull(multiplier, "multiplier must not be null");
		this.protectedBlock = Pattern.compile(
				"\\s+(?:" + String.join("|", protectedBlocks.stream().map(Pattern::quote).sorted().toList()) + ")\\s+=\\s+\\{.*");
		this.excludedKeys = Set.copyOf(excludedKeys);
		this.charset = Objects.requireNonNull(charset, "charset must not be null");
	}

	/**
	 * Processes the {@code *.txt} files of each named sub-directory of {@code inputRoot}.
	 *
	 * @return the number of files written
	 */
	public int processDirectories(Path inputRoot, Path outputRoot, List<String> directories) throws IOException {
		int count = 0;
		for (String directory : directories) {
			Path source = inputRoot.resolve(directory);
			Path target = outputRoot.resolve(directory);
			Files.createDirectories(target);
			List<Path> files;
			try (Stream<Path> entries = Files.list(source)) {
				files = entries
						.filter(Files::isRegularFile)
						.filter(p -> p.getFileName().toString().endsWith(".txt"))
						.sorted()
						.toList();
			}
			for (Path file : files) {
				processFile(file, target.resolve(file.getFileName().toString()));
				count++;
			}
		}
		return count;
	}

	public void processFile(Path source, Path destination) throws IOException {
		logger.info("Processing '{}' -> '{}'", source, destination);
		try (BufferedReader reader = Files.newBufferedReader(source, charset);
				BufferedWriter writer = Files.newBufferedWriter(destination, charset)) {
			int lock = 0;
			String line;
			while ((line = reader.readLine()) != null) {
				if (lock > 0 || protectedBlock.matcher(line).lookingAt()) {
					lock += count(line, '{') - count(line, '}');
					writer.write(line);
				} else {
					writer.write(processLine(line));
				}
				writer.write("\n");
			}
		}
	}

	/**
	 * Rewrites every eligible {@code key = number} occurrence of a single line.
	 */
	public String processLine(String line) {
		Matcher matcher = ASSIGNMENT.matcher(line);
		StringBuilder out = new StringBuilder();
		while (matcher.find()) {
			String key = matcher.group(1);
			String replacement = isExcluded(key)
					? matcher.group(0)
					: key + " = " + PdxNumber.of(new BigDecimal(matcher.group(2)).multiply(multiplier)).literal();
			matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
		}
		matcher.appendTail(out);
		return out.toString();
	}

	private boolean isExcluded(String key) {
		return excludedKeys.contains(key) || LEVEL_COST.matcher(key).matches();
	}

	private static int count(String line, char c) {
		int n = 0;
		for (int i = 0; i < line.length(); i++) {
			if (line.charAt(i) == c) {
				n++;
			}
		}
		return n;
	}
}
